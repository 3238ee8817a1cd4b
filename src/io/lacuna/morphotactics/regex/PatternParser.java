package io.lacuna.morphotactics.regex;

import io.lacuna.bifurcan.*;

/**
 * A recursive descent parser for stem patterns:
 *
 * <pre>
 *   pattern    := sequence
 *   sequence   := quantified*
 *   quantified := atom ('?' | '*' | '+')*
 *   atom       := '(' sequence ')' | '[' quantified+ ']' | '.' | class | symbol
 * </pre>
 *
 * Whitespace is ignored. Class names and symbols are matched longest first, a class winning a tie. With an
 * empty alphabet, every other character is a symbol of its own.
 */
public final class PatternParser {

  private final String pattern;
  private final Alphabet alphabet;
  private int pos = 0;

  private PatternParser(String pattern, Alphabet alphabet) {
    this.pattern = pattern;
    this.alphabet = alphabet;
  }

  /**
   * @throws PatternException if {@code pattern} is malformed
   */
  public static Node parse(String pattern, Alphabet alphabet) {
    PatternParser p = new PatternParser(pattern, alphabet);
    Node node = p.sequence();

    if (!p.atEnd()) {
      throw p.error(p.pos, "unmatched '" + p.peek() + "'");
    }

    return node;
  }

  private Node sequence() {
    LinearList<Node> nodes = new LinearList<>();
    while (!atEnd() && peek() != ')' && peek() != ']') {
      nodes.addLast(quantified());
    }
    return nodes.size() == 1 ? nodes.nth(0) : Node.concat(nodes);
  }

  private Node quantified() {
    Node node = atom();
    while (!atEnd() && isQuantifier(peek())) {
      node = Node.quantify(next(), node);
    }
    return node;
  }

  private Node atom() {
    char c = peek();
    int start = pos;

    if (isQuantifier(c)) {
      throw error(start, "quantifier '" + c + "' has nothing to apply to");
    }

    switch (c) {
      case '(': {
        next();
        Node node = sequence();
        if (atEnd() || peek() != ')') {
          throw error(start, "unmatched '('");
        }
        next();
        return node;
      }

      case '[': {
        next();
        LinearList<Node> branches = new LinearList<>();
        while (!atEnd() && peek() != ']') {
          if (peek() == ')') {
            throw error(pos, "unmatched ')'");
          }
          branches.addLast(quantified());
        }
        if (atEnd()) {
          throw error(start, "unmatched '['");
        }
        next();
        if (branches.size() == 0) {
          throw error(start, "empty union");
        }
        return Node.union(branches);
      }

      case '.':
        next();
        if (alphabet.isEmpty()) {
          throw error(start, "the wildcard '.' needs an alphabet");
        }
        return Node.wildcard();

      default:
        return reference();
    }
  }

  private Node reference() {
    int start = pos;

    if (alphabet.isEmpty()) {
      return Node.literal(String.valueOf(next()));
    }

    String cls = alphabet.longestClass(pattern, pos);
    String symbol = alphabet.longestSymbol(pattern, pos);

    if (cls == null && symbol == null) {
      throw error(start, "unknown class or symbol '" + peek() + "'");
    }

    if (cls != null && (symbol == null || cls.length() >= symbol.length())) {
      advance(cls.length());
      IList<String> members = alphabet.members(cls);
      if (members.size() == 1) {
        return Node.literal(members.nth(0));
      }
      LinearList<Node> branches = new LinearList<>();
      members.forEach(s -> branches.addLast(Node.literal(s)));
      return Node.union(branches);
    }

    advance(symbol.length());
    return Node.literal(symbol);
  }

  ///

  private static boolean isQuantifier(char c) {
    return c == '?' || c == '*' || c == '+';
  }

  private void skipWhitespace() {
    while (pos < pattern.length() && Character.isWhitespace(pattern.charAt(pos))) {
      pos++;
    }
  }

  private boolean atEnd() {
    skipWhitespace();
    return pos >= pattern.length();
  }

  private char peek() {
    skipWhitespace();
    return pattern.charAt(pos);
  }

  private char next() {
    char c = peek();
    pos++;
    return c;
  }

  private void advance(int n) {
    pos += n;
  }

  private PatternException error(int position, String message) {
    return new PatternException(pattern, position, message);
  }
}
