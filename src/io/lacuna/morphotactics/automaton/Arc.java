package io.lacuna.morphotactics.automaton;

import java.util.Comparator;
import java.util.Objects;

/**
 * A weighted transition which reads {@code input}, writes {@code output}, and moves to {@code dest}.
 * An empty label is epsilon.
 */
public final class Arc {

  static final Comparator<Arc> ORDER = Comparator
          .comparing((Arc a) -> a.input)
          .thenComparing(a -> a.output)
          .thenComparingDouble(a -> a.weight)
          .thenComparingInt(a -> a.dest);

  private final String input;
  private final String output;
  private final double weight;
  private final int dest;

  Arc(String input, String output, double weight, int dest) {
    this.input = Objects.requireNonNull(input);
    this.output = Objects.requireNonNull(output);
    this.weight = weight;
    this.dest = dest;
  }

  public String input() {
    return input;
  }

  public String output() {
    return output;
  }

  public double weight() {
    return weight;
  }

  public int dest() {
    return dest;
  }

  public boolean isEpsilon() {
    return input.isEmpty() && output.isEmpty();
  }

  /**
   * @return the (input, output) pair, used for determinism checks
   */
  public Label label() {
    return new Label(input, output);
  }

  Arc withDest(int dest) {
    return new Arc(input, output, weight, dest);
  }

  Arc withWeight(double weight) {
    return new Arc(input, output, weight, dest);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Arc)) {
      return false;
    }
    Arc a = (Arc) o;
    return dest == a.dest
            && Double.compare(weight, a.weight) == 0
            && input.equals(a.input)
            && output.equals(a.output);
  }

  @Override
  public int hashCode() {
    return Objects.hash(input, output, weight, dest);
  }

  @Override
  public String toString() {
    return (input.isEmpty() ? "<eps>" : input) + ":" + (output.isEmpty() ? "<eps>" : output) + "/" + weight + " -> " + dest;
  }

  public static final class Label {
    public final String input;
    public final String output;

    Label(String input, String output) {
      this.input = input;
      this.output = output;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Label)) {
        return false;
      }
      Label l = (Label) o;
      return input.equals(l.input) && output.equals(l.output);
    }

    @Override
    public int hashCode() {
      return 31 * input.hashCode() + output.hashCode();
    }
  }
}
