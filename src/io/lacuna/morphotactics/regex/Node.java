package io.lacuna.morphotactics.regex;

import io.lacuna.bifurcan.*;

/**
 * A node of a parsed pattern. Only {@link Kind#LITERAL} carries a symbol, and only {@link Kind#CONCAT} and
 * {@link Kind#UNION} carry more than one child.
 */
public final class Node {

  public enum Kind {
    LITERAL,
    CONCAT,
    UNION,
    STAR,
    PLUS,
    OPTIONAL,
    WILDCARD
  }

  public final Kind kind;
  public final String symbol;
  public final IList<Node> children;

  private Node(Kind kind, String symbol, IList<Node> children) {
    this.kind = kind;
    this.symbol = symbol;
    this.children = children.forked();
  }

  public static Node literal(String symbol) {
    return new Node(Kind.LITERAL, symbol, new LinearList<>());
  }

  public static Node wildcard() {
    return new Node(Kind.WILDCARD, null, new LinearList<>());
  }

  public static Node concat(IList<Node> children) {
    return new Node(Kind.CONCAT, null, children);
  }

  public static Node union(IList<Node> children) {
    return new Node(Kind.UNION, null, children);
  }

  public static Node quantify(char quantifier, Node child) {
    switch (quantifier) {
      case '*':
        return new Node(Kind.STAR, null, LinearList.of(child));
      case '+':
        return new Node(Kind.PLUS, null, LinearList.of(child));
      case '?':
        return new Node(Kind.OPTIONAL, null, LinearList.of(child));
      default:
        throw new IllegalArgumentException("not a quantifier: " + quantifier);
    }
  }

  public Node child() {
    return children.nth(0);
  }

  @Override
  public String toString() {
    switch (kind) {
      case LITERAL:
        return symbol;
      case WILDCARD:
        return ".";
      case STAR:
        return child() + "*";
      case PLUS:
        return child() + "+";
      case OPTIONAL:
        return child() + "?";
      default:
        StringBuilder sb = new StringBuilder(kind == Kind.UNION ? "[" : "(");
        for (Node n : children) {
          sb.append(n).append(kind == Kind.UNION ? " " : "");
        }
        if (kind == Kind.UNION && children.size() > 0) {
          sb.deleteCharAt(sb.length() - 1);
        }
        return sb.append(kind == Kind.UNION ? "]" : ")").toString();
    }
  }
}
