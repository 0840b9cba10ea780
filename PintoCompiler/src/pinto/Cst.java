package pinto;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/** Concrete syntax tree: grammar rules with their tokens and sub-rules in source order. */
public final class Cst {
  public enum Rule {
    DOCUMENT,
    GROUP_DEF,
    LAYOUT_DEF,
    FREE_ARROW_DEF,
    EDGE_OR_NODE,
    NODE_REF,
    SHAPE_SPEC,
    SHAPE_TYPE,
    ANCHOR_SPEC,
    STYLE_SPEC,
    STYLE_PROPS,
    STYLE_PROP,
    LABEL_SPEC,
    ARROW;
  }

  public static final class Element {
    private final Optional<Node> node;
    private final Optional<Token> token;

    private Element(Optional<Node> node, Optional<Token> token) {
      this.node = node;
      this.token = token;
    }

    public static Element of(Node node) {
      return new Element(Optional.of(node), Optional.empty());
    }

    public static Element of(Token token) {
      return new Element(Optional.empty(), Optional.of(token));
    }

    public boolean isNode() {
      return node.isPresent();
    }

    public boolean isNode(Rule rule) {
      return node.isPresent() && node.get().rule() == rule;
    }

    public Node node() {
      return node.get();
    }

    public Token token() {
      return token.get();
    }

    @Override
    public String toString() {
      return isNode() ? node().toString() : token().toString();
    }
  }

  public static final class Node {
    private final Rule rule;
    private final ImmutableList<Element> children;

    public Node(Rule rule, List<Element> children) {
      this.rule = rule;
      this.children = ImmutableList.copyOf(children);
    }

    public Rule rule() {
      return rule;
    }

    public ImmutableList<Element> children() {
      return children;
    }

    public Stream<Token> tokens() {
      return children.stream().filter(e -> !e.isNode()).map(Element::token);
    }

    public Stream<Node> nodes(Rule rule) {
      return children.stream().filter(e -> e.isNode(rule)).map(Element::node);
    }

    public Optional<Node> firstNode(Rule rule) {
      return nodes(rule).findFirst();
    }

    public Node requiredNode(Rule rule) {
      Optional<Node> node = firstNode(rule);
      Preconditions.checkState(node.isPresent(), "%s has no %s", this.rule, rule);
      return node.get();
    }

    public Token token(int index) {
      return tokens().skip(index).findFirst().get();
    }

    public Optional<Token> firstToken(TokenType type) {
      return tokens().filter(t -> t.is(type)).findFirst();
    }

    @Override
    public String toString() {
      return rule + children.toString();
    }
  }

  private Cst() {}
}
