package io.lacuna.morphotactics.query;

/**
 * Thrown when an automaton has no path for an input. This is an ordinary negative answer rather than a fault.
 */
public class NoPathException extends RuntimeException {

  private final String input;

  public NoPathException(String input) {
    super("no path for input '" + input + "'");
    this.input = input;
  }

  public String input() {
    return input;
  }
}
