package io.lacuna.morphotactics.query;

import java.util.Comparator;
import java.util.Objects;

/**
 * One output of an automaton for some input, and the weight of the path which produced it.
 */
public final class Analysis {

  static final Comparator<Analysis> ORDER = Comparator
          .comparingDouble(Analysis::weight)
          .thenComparing(Analysis::output);

  private final String output;
  private final double weight;

  public Analysis(String output, double weight) {
    this.output = Objects.requireNonNull(output);
    this.weight = weight;
  }

  public String output() {
    return output;
  }

  public double weight() {
    return weight;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Analysis)) {
      return false;
    }
    Analysis a = (Analysis) o;
    return output.equals(a.output) && Double.compare(weight, a.weight) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(output, weight);
  }

  @Override
  public String toString() {
    return output + "/" + weight;
  }
}
