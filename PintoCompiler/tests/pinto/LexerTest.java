package pinto;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class LexerTest {

  private static Lexer.Result lex(String content) {
    return new Lexer(content).tokenize();
  }

  private static ImmutableList<TokenType> types(String content) {
    Lexer.Result result = lex(content);
    assertThat(result.errors()).isEmpty();
    return result.tokens().stream().map(Token::type).collect(ImmutableList.toImmutableList());
  }

  @Test
  public void emptyInput() {
    Lexer.Result result = lex("");

    assertThat(result.tokens()).isEmpty();
    assertThat(result.hasErrors()).isFalse();
  }

  @Test
  public void keywordsNeedAWordBoundary() {
    assertThat(types("rectangle rectangle1 db dbx group groups"))
        .containsExactly(
            TokenType.SHAPE_RECTANGLE,
            TokenType.IDENTIFIER,
            TokenType.SHAPE_DB,
            TokenType.IDENTIFIER,
            TokenType.GROUP,
            TokenType.IDENTIFIER)
        .inOrder();
  }

  @Test
  public void arrowsMatchLongestFirst() {
    assertThat(types("a <-> b --> c ==> d <- e -> f -- g"))
        .containsExactly(
            TokenType.IDENTIFIER,
            TokenType.ARROW_BOTH,
            TokenType.IDENTIFIER,
            TokenType.ARROW_DOTTED,
            TokenType.IDENTIFIER,
            TokenType.ARROW_THICK,
            TokenType.IDENTIFIER,
            TokenType.ARROW_LEFT,
            TokenType.IDENTIFIER,
            TokenType.ARROW_RIGHT,
            TokenType.IDENTIFIER,
            TokenType.ARROW_LINE,
            TokenType.IDENTIFIER)
        .inOrder();
  }

  @Test
  public void colorAfterColon() {
    Lexer.Result result = lex("a(rect, fill: #ff0000)");

    assertThat(result.errors()).isEmpty();
    Token color = result.tokens().get(6);
    assertThat(color.type()).isEqualTo(TokenType.COLOR_LITERAL);
    assertThat(color.text()).isEqualTo("#ff0000");
  }

  @Test
  public void hashElsewhereIsAComment() {
    assertThat(types("a -> b # #fff is not a color here\nc"))
        .containsExactly(
            TokenType.IDENTIFIER, TokenType.ARROW_RIGHT, TokenType.IDENTIFIER, TokenType.IDENTIFIER)
        .inOrder();
  }

  @Test
  public void hashWithTrailingLettersIsAComment() {
    assertThat(types("fill: #ff00zz")).containsExactly(TokenType.IDENTIFIER, TokenType.COLON);
  }

  @Test
  public void stringLiteralKeepsQuotesAndContents() {
    Lexer.Result result = lex("a: \"hello # world\"");

    assertThat(result.errors()).isEmpty();
    assertThat(result.tokens()).hasSize(3);
    assertThat(result.tokens().get(2).type()).isEqualTo(TokenType.STRING_LITERAL);
    assertThat(result.tokens().get(2).text()).isEqualTo("\"hello # world\"");
  }

  @Test
  public void numbers() {
    Lexer.Result result = lex("x: -12, y: 40");

    assertThat(result.errors()).isEmpty();
    assertThat(result.tokens().get(2).type()).isEqualTo(TokenType.NUMBER_LITERAL);
    assertThat(result.tokens().get(2).text()).isEqualTo("-12");
    assertThat(result.tokens().get(6).text()).isEqualTo("40");
  }

  @Test
  public void layoutDirective() {
    assertThat(types("@layout: force"))
        .containsExactly(TokenType.LAYOUT, TokenType.COLON, TokenType.IDENTIFIER)
        .inOrder();
  }

  @Test
  public void locations() {
    Lexer.Result result = lex("a\n  bb -> c");

    assertThat(result.tokens().get(0).location()).isEqualTo(Location.create(1, 1, 1, 1));
    assertThat(result.tokens().get(1).location()).isEqualTo(Location.create(2, 3, 2, 4));
    assertThat(result.tokens().get(2).location()).isEqualTo(Location.create(2, 6, 2, 7));
  }

  @Test
  public void unexpectedCharacterIsReportedAndSkipped() {
    Lexer.Result result = lex("a $ b");

    assertThat(result.errors())
        .containsExactly(ParseError.create("unexpected character '$'", Location.at(1, 3)));
    assertThat(result.tokens()).hasSize(2);
  }

  @Test
  public void unterminatedString() {
    Lexer.Result result = lex("a: \"abc");

    assertThat(result.errors())
        .containsExactly(ParseError.create("unterminated string literal", Location.at(1, 4)));
  }
}
