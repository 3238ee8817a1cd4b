package io.lacuna.morphotactics;

import java.util.Objects;

/**
 * What may follow a rule: either another slot, or the end of the word. Either way, taking the continuation
 * costs {@code weight}.
 */
public final class Continuation {

  private final String target;
  private final double weight;

  private Continuation(String target, double weight) {
    this.target = target;
    this.weight = weight;
  }

  /**
   * @return a continuation into the slot named {@code slot}
   */
  public static Continuation to(String slot, double weight) {
    return new Continuation(Objects.requireNonNull(slot, "use Continuation.terminal() to end a word"), weight);
  }

  public static Continuation to(String slot) {
    return to(slot, 0.0);
  }

  /**
   * @return a continuation which ends the word, accepting with {@code weight}
   */
  public static Continuation terminal(double weight) {
    return new Continuation(null, weight);
  }

  public static Continuation terminal() {
    return terminal(0.0);
  }

  public boolean isTerminal() {
    return target == null;
  }

  /**
   * @return the name of the slot this continues to, or null if it's terminal
   */
  public String target() {
    return target;
  }

  public double weight() {
    return weight;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Continuation)) {
      return false;
    }
    Continuation c = (Continuation) o;
    return Objects.equals(target, c.target) && Double.compare(weight, c.weight) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(target, weight);
  }

  @Override
  public String toString() {
    return "(" + (target == null ? "#" : target) + ", " + weight + ")";
  }
}
