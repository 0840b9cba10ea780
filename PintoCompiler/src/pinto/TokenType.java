package pinto;

import java.util.Optional;

import com.google.common.collect.ImmutableList;

public enum TokenType {
  // Arrows, longest first.
  ARROW_BOTH("<->"),
  ARROW_DOTTED("-->"),
  ARROW_THICK("==>"),
  ARROW_LEFT("<-"),
  ARROW_RIGHT("->"),
  ARROW_LINE("--"),

  STRING_LITERAL(null, "string literal"),
  COLOR_LITERAL(null, "color literal"),
  NUMBER_LITERAL(null, "number literal"),

  LAYOUT("@layout"),
  GROUP("group"),
  ARROW("arrow"),
  SHAPE_RECTANGLE("rectangle"),
  SHAPE_RECT("rect"),
  SHAPE_BOX("box"),
  SHAPE_ELLIPSE("ellipse"),
  SHAPE_CIRCLE("circle"),
  SHAPE_OVAL("oval"),
  SHAPE_DIAMOND("diamond"),
  SHAPE_DATABASE("database"),
  SHAPE_CYLINDER("cylinder"),
  SHAPE_DB("db"),

  IDENTIFIER(null, "identifier"),

  LCURLY("{"),
  RCURLY("}"),
  LPAREN("("),
  RPAREN(")"),
  COLON(":"),
  COMMA(","),
  DOT(".");

  private final Optional<String> image;
  private final String displayName;

  TokenType(String image) {
    this(image, "'" + image + "'");
  }

  TokenType(String image, String displayName) {
    this.image = Optional.ofNullable(image);
    this.displayName = displayName;
  }

  /** The fixed text of this token, if it has one. */
  public Optional<String> image() {
    return image;
  }

  public String displayName() {
    return displayName;
  }

  public boolean isArrow() {
    return ARROWS.contains(this);
  }

  public boolean isShapeKeyword() {
    return SHAPE_KEYWORDS.contains(this);
  }

  public static final ImmutableList<TokenType> ARROWS =
      ImmutableList.of(ARROW_BOTH, ARROW_DOTTED, ARROW_THICK, ARROW_LEFT, ARROW_RIGHT, ARROW_LINE);

  public static final ImmutableList<TokenType> SHAPE_KEYWORDS =
      ImmutableList.of(
          SHAPE_RECTANGLE,
          SHAPE_RECT,
          SHAPE_BOX,
          SHAPE_ELLIPSE,
          SHAPE_CIRCLE,
          SHAPE_OVAL,
          SHAPE_DIAMOND,
          SHAPE_DATABASE,
          SHAPE_CYLINDER,
          SHAPE_DB);

  public static final ImmutableList<TokenType> KEYWORDS =
      ImmutableList.<TokenType>builder()
          .add(LAYOUT, GROUP, ARROW)
          .addAll(SHAPE_KEYWORDS)
          .build();

  public static final ImmutableList<TokenType> PUNCTUATION =
      ImmutableList.of(LCURLY, RCURLY, LPAREN, RPAREN, COLON, COMMA, DOT);
}
