package io.lacuna.morphotactics.regex;

/**
 * Thrown when a pattern is malformed: unbalanced grouping, a quantifier with nothing to apply to, an empty
 * union, or a reference to a class or symbol the alphabet doesn't define.
 */
public class PatternException extends RuntimeException {

  private final String pattern;
  private final int position;

  public PatternException(String pattern, int position, String message) {
    super(message + " at position " + position + " of pattern '" + pattern + "'");
    this.pattern = pattern;
    this.position = position;
  }

  public String pattern() {
    return pattern;
  }

  public int position() {
    return position;
  }
}
