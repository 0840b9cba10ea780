package pinto;

import java.util.ArrayList;
import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import pinto.Cst.Element;
import pinto.Cst.Rule;

/**
 * Recursive-descent parser producing a {@link Cst}. Syntax errors do not abort the parse: the
 * offending statement is abandoned, tokens are skipped up to the next statement start on a later
 * line (or the closing brace of the enclosing group), and parsing resumes.
 *
 * <p>A parser instance holds per-parse state and must be used for a single {@link #parse()}.
 */
public class Parser {

  @AutoValue
  public abstract static class Result {
    public abstract Cst.Node document();

    public abstract ImmutableList<ParseError> errors();

    public boolean hasErrors() {
      return !errors().isEmpty();
    }
  }

  private static final ImmutableSet<TokenType> STATEMENT_START =
      ImmutableSet.of(TokenType.IDENTIFIER, TokenType.GROUP, TokenType.LAYOUT, TokenType.ARROW);

  private static final ImmutableSet<TokenType> STYLE_VALUES =
      ImmutableSet.of(TokenType.COLOR_LITERAL, TokenType.NUMBER_LITERAL, TokenType.IDENTIFIER);

  private final ImmutableList<Token> tokens;
  private final List<ParseError> errors = new ArrayList<>();
  private int pos = 0;
  private int groupDepth = 0;
  private boolean parsed = false;

  public Parser(List<Token> tokens) {
    this.tokens = ImmutableList.copyOf(tokens);
  }

  public Result parse() {
    if (parsed) throw new IllegalStateException("Parser instances are single-use");
    parsed = true;

    Cst.Node document = new Cst.Node(Rule.DOCUMENT, statements());
    return new AutoValue_Parser_Result(document, ImmutableList.copyOf(errors));
  }

  // Statement*, up to end of input or the '}' closing the current group.
  private List<Element> statements() {
    List<Element> children = new ArrayList<>();
    while (!atEnd() && !(groupDepth > 0 && peekIs(0, TokenType.RCURLY))) {
      int start = pos;
      try {
        children.add(Element.of(statement()));
      } catch (CompilerException ex) {
        errors.add(toParseError(ex));
        recover(start);
      }
    }
    return children;
  }

  private Cst.Node statement() throws CompilerException {
    switch (peek(0).type()) {
      case GROUP:
        return groupDef();
      case LAYOUT:
        return layoutDef();
      case ARROW:
        return freeArrowDef();
      case IDENTIFIER:
        return edgeOrNode();
      default:
        throw unexpected("a statement");
    }
  }

  private Cst.Node groupDef() throws CompilerException {
    List<Element> children = new ArrayList<>();
    children.add(consume(TokenType.GROUP));
    children.add(consume(TokenType.IDENTIFIER));
    if (peekIs(0, TokenType.LPAREN)) {
      children.add(Element.of(styleSpec()));
    }
    children.add(consume(TokenType.LCURLY));

    groupDepth++;
    try {
      children.addAll(statements());
    } finally {
      groupDepth--;
    }

    children.add(consume(TokenType.RCURLY));
    return new Cst.Node(Rule.GROUP_DEF, children);
  }

  private Cst.Node layoutDef() throws CompilerException {
    return new Cst.Node(
        Rule.LAYOUT_DEF,
        ImmutableList.of(
            consume(TokenType.LAYOUT), consume(TokenType.COLON), consume(TokenType.IDENTIFIER)));
  }

  private Cst.Node freeArrowDef() throws CompilerException {
    return new Cst.Node(
        Rule.FREE_ARROW_DEF,
        ImmutableList.of(
            consume(TokenType.ARROW),
            consume(TokenType.LPAREN),
            Element.of(styleProps()),
            consume(TokenType.RPAREN)));
  }

  private Cst.Node edgeOrNode() throws CompilerException {
    List<Element> children = new ArrayList<>();
    children.add(Element.of(nodeRef()));
    while (!atEnd() && peek(0).type().isArrow()) {
      children.add(Element.of(arrow()));
      children.add(Element.of(nodeRef()));
      if (peekIs(0, TokenType.LPAREN) && peekIs(1, TokenType.IDENTIFIER)) {
        children.add(Element.of(parenthesizedStyle(Rule.ANCHOR_SPEC)));
      }
      if (peekIs(0, TokenType.COLON)) {
        children.add(Element.of(labelSpec()));
      }
    }
    return new Cst.Node(Rule.EDGE_OR_NODE, children);
  }

  private Cst.Node nodeRef() throws CompilerException {
    List<Element> children = new ArrayList<>();
    children.add(consume(TokenType.IDENTIFIER));
    if (peekIs(0, TokenType.DOT)) {
      children.add(consume(TokenType.DOT));
      children.add(consume(TokenType.IDENTIFIER));
    }
    if (peekIs(0, TokenType.LPAREN) && canPeek(1) && peek(1).type().isShapeKeyword()) {
      children.add(Element.of(shapeSpec()));
    }
    if (peekIs(0, TokenType.COLON)) {
      children.add(Element.of(labelSpec()));
    }
    return new Cst.Node(Rule.NODE_REF, children);
  }

  private Cst.Node shapeSpec() throws CompilerException {
    List<Element> children = new ArrayList<>();
    children.add(consume(TokenType.LPAREN));
    if (atEnd() || !peek(0).type().isShapeKeyword()) {
      throw unexpected("a shape type");
    }
    children.add(
        Element.of(new Cst.Node(Rule.SHAPE_TYPE, ImmutableList.of(Element.of(next())))));
    if (peekIs(0, TokenType.COMMA)) {
      children.add(consume(TokenType.COMMA));
      children.add(Element.of(styleProps()));
    }
    children.add(consume(TokenType.RPAREN));
    return new Cst.Node(Rule.SHAPE_SPEC, children);
  }

  private Cst.Node styleSpec() throws CompilerException {
    return parenthesizedStyle(Rule.STYLE_SPEC);
  }

  private Cst.Node parenthesizedStyle(Rule rule) throws CompilerException {
    return new Cst.Node(
        rule,
        ImmutableList.of(
            consume(TokenType.LPAREN), Element.of(styleProps()), consume(TokenType.RPAREN)));
  }

  private Cst.Node styleProps() throws CompilerException {
    List<Element> children = new ArrayList<>();
    children.add(Element.of(styleProp()));
    while (peekIs(0, TokenType.COMMA)) {
      children.add(consume(TokenType.COMMA));
      children.add(Element.of(styleProp()));
    }
    return new Cst.Node(Rule.STYLE_PROPS, children);
  }

  private Cst.Node styleProp() throws CompilerException {
    Element key = consume(TokenType.IDENTIFIER);
    Element colon = consume(TokenType.COLON);
    if (atEnd() || !STYLE_VALUES.contains(peek(0).type())) {
      throw unexpected("a color, number or identifier");
    }
    return new Cst.Node(Rule.STYLE_PROP, ImmutableList.of(key, colon, Element.of(next())));
  }

  private Cst.Node labelSpec() throws CompilerException {
    return new Cst.Node(
        Rule.LABEL_SPEC,
        ImmutableList.of(consume(TokenType.COLON), consume(TokenType.STRING_LITERAL)));
  }

  private Cst.Node arrow() throws CompilerException {
    if (atEnd() || !peek(0).type().isArrow()) {
      throw unexpected("an arrow");
    }
    return new Cst.Node(Rule.ARROW, ImmutableList.of(Element.of(next())));
  }

  // Skips to a plausible statement start after a syntax error.
  private void recover(int statementStart) {
    if (pos == statementStart) {
      pos++;
    }
    int lastLine = tokens.get(pos - 1).location().endLine();
    while (!atEnd()) {
      Token token = peek(0);
      if (groupDepth > 0 && token.is(TokenType.RCURLY)) return;
      if (STATEMENT_START.contains(token.type()) && token.location().startLine() > lastLine) return;
      pos++;
    }
  }

  private Element consume(TokenType type) throws CompilerException {
    if (!peekIs(0, type)) {
      throw unexpected(type.displayName());
    }
    return Element.of(next());
  }

  private CompilerException unexpected(String expected) {
    if (atEnd()) {
      return new CompilerException(
          String.format("expected %s but found end of input", expected));
    }
    Token found = peek(0);
    return new CompilerException(
        found.location(), String.format("expected %s but found '%s'", expected, found.text()));
  }

  private static ParseError toParseError(CompilerException ex) {
    return ex.location().isPresent()
        ? ParseError.create(ex.getMessage(), ex.location().get())
        : ParseError.create(ex.getMessage());
  }

  private Token next() {
    return tokens.get(pos++);
  }

  private boolean atEnd() {
    return pos >= tokens.size();
  }

  private boolean canPeek(int ahead) {
    return pos + ahead < tokens.size();
  }

  private Token peek(int ahead) {
    return tokens.get(pos + ahead);
  }

  private boolean peekIs(int ahead, TokenType type) {
    return canPeek(ahead) && peek(ahead).is(type);
  }
}
