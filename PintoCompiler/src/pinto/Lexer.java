package pinto;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;

/**
 * Produces a token stream from DSL source. Lexing never fails: unrecognized characters are
 * recorded as errors and skipped one at a time.
 */
public class Lexer {

  @AutoValue
  public abstract static class Result {
    public abstract ImmutableList<Token> tokens();

    public abstract ImmutableList<ParseError> errors();

    public boolean hasErrors() {
      return !errors().isEmpty();
    }

    static Result create(List<Token> tokens, List<ParseError> errors) {
      return new AutoValue_Lexer_Result(ImmutableList.copyOf(tokens), ImmutableList.copyOf(errors));
    }
  }

  private static final ImmutableMap<String, TokenType> KEYWORDS_BY_IMAGE;

  static {
    ImmutableMap.Builder<String, TokenType> builder = ImmutableMap.builder();
    for (TokenType type : TokenType.KEYWORDS) {
      builder.put(type.image().get(), type);
    }
    KEYWORDS_BY_IMAGE = builder.build();
  }

  private static final ImmutableMap<Character, TokenType> PUNCTUATION;

  static {
    ImmutableMap.Builder<Character, TokenType> builder = ImmutableMap.builder();
    for (TokenType type : TokenType.PUNCTUATION) {
      builder.put(type.image().get().charAt(0), type);
    }
    PUNCTUATION = builder.build();
  }

  private static final char QUOTE = '"';
  private static final char HASH = '#';
  private static final int MIN_COLOR_DIGITS = 3;
  private static final int MAX_COLOR_DIGITS = 6;

  private final String content;
  private int offset = 0;
  private int line = 1;
  private int col = 1;

  private final List<Token> tokens = new ArrayList<>();
  private final List<ParseError> errors = new ArrayList<>();

  public Lexer(String content) {
    this.content = content;
  }

  public Result tokenize() {
    while (canPeek(0)) {
      char ch = peek(0);
      if (Character.isWhitespace(ch)) {
        advance(1);
      } else if (ch == HASH) {
        int digits = colorDigits();
        if (digits > 0) {
          emit(TokenType.COLOR_LITERAL, 1 + digits);
        } else {
          skipComment();
        }
      } else if (!readArrow() && !readLiteral() && !readWord() && !readPunctuation()) {
        errors.add(
            ParseError.create(
                String.format("unexpected character '%c'", ch), Location.at(line, col)));
        advance(1);
      }
    }
    return Result.create(tokens, errors);
  }

  // A '#' is a color only in value position, i.e. directly after ':'.
  private int colorDigits() {
    if (tokens.isEmpty() || !Iterables.getLast(tokens).is(TokenType.COLON)) return 0;

    int digits = 0;
    while (digits < MAX_COLOR_DIGITS
        && canPeek(digits + 1)
        && isHexDigit(peek(digits + 1))) {
      digits++;
    }
    if (digits < MIN_COLOR_DIGITS) return 0;
    if (canPeek(digits + 1) && isIdentifierPart(peek(digits + 1))) return 0;
    return digits;
  }

  private void skipComment() {
    while (canPeek(0) && peek(0) != '\n') {
      advance(1);
    }
  }

  private boolean readArrow() {
    for (TokenType type : TokenType.ARROWS) {
      if (content.startsWith(type.image().get(), offset)) {
        emit(type, type.image().get().length());
        return true;
      }
    }
    return false;
  }

  private boolean readLiteral() {
    char ch = peek(0);
    if (ch == QUOTE) {
      int close = content.indexOf(QUOTE, offset + 1);
      if (close < 0) {
        errors.add(ParseError.create("unterminated string literal", Location.at(line, col)));
        advance(1);
      } else {
        emit(TokenType.STRING_LITERAL, close - offset + 1);
      }
      return true;
    }

    int start = ch == '-' ? 1 : 0;
    if (!canPeek(start) || !isAsciiDigit(peek(start))) return false;

    int len = start;
    while (canPeek(len) && isAsciiDigit(peek(len))) len++;

    emit(TokenType.NUMBER_LITERAL, len);
    return true;
  }

  private boolean readWord() {
    char ch = peek(0);
    if (ch == '@') {
      String image = TokenType.LAYOUT.image().get();
      if (content.startsWith(image, offset)
          && !(canPeek(image.length()) && isIdentifierPart(peek(image.length())))) {
        emit(TokenType.LAYOUT, image.length());
        return true;
      }
      return false;
    } else if (!isIdentifierStart(ch)) {
      return false;
    }

    int len = 1;
    while (canPeek(len) && isIdentifierPart(peek(len))) len++;

    // A keyword only matches a whole word; 'rectangle1' is an identifier.
    String word = content.substring(offset, offset + len);
    emit(KEYWORDS_BY_IMAGE.getOrDefault(word, TokenType.IDENTIFIER), len);
    return true;
  }

  private boolean readPunctuation() {
    Optional<TokenType> type = Optional.ofNullable(PUNCTUATION.get(peek(0)));
    type.ifPresent(t -> emit(t, 1));
    return type.isPresent();
  }

  private void emit(TokenType type, int length) {
    int startLine = line;
    int startCol = col;
    String text = content.substring(offset, offset + length);
    advance(length - 1);
    tokens.add(Token.create(type, text, Location.create(startLine, startCol, line, col)));
    advance(1);
  }

  private boolean canPeek(int ahead) {
    return offset + ahead < content.length();
  }

  private char peek(int ahead) {
    return content.charAt(offset + ahead);
  }

  private void advance(int count) {
    for (int i = 0; i < count && offset < content.length(); i++) {
      if (content.charAt(offset++) == '\n') {
        line++;
        col = 1;
      } else {
        col++;
      }
    }
  }

  private static boolean isIdentifierStart(char ch) {
    return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || ch == '_';
  }

  private static boolean isIdentifierPart(char ch) {
    return isIdentifierStart(ch) || isAsciiDigit(ch);
  }

  private static boolean isAsciiDigit(char ch) {
    return ch >= '0' && ch <= '9';
  }

  private static boolean isHexDigit(char ch) {
    return isAsciiDigit(ch) || (ch >= 'a' && ch <= 'f') || (ch >= 'A' && ch <= 'F');
  }
}
