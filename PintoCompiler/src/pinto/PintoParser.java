package pinto;

/** Entry point for turning DSL source into a {@link DocumentAst}. */
public final class PintoParser {

  /**
   * Parses {@code content}. Never throws: lexical and syntax errors are reported in {@link
   * DocumentAst#errors()}, in which case no statements are returned.
   */
  public static DocumentAst parse(String content) {
    Lexer.Result lexed = new Lexer(content).tokenize();
    if (lexed.hasErrors()) {
      return DocumentAst.failed(lexed.errors());
    }

    Parser.Result parsed = new Parser(lexed.tokens()).parse();
    if (parsed.hasErrors()) {
      return DocumentAst.failed(parsed.errors());
    }

    return DocumentAst.of(new AstBuilder().build(parsed.document()));
  }

  private PintoParser() {}
}
