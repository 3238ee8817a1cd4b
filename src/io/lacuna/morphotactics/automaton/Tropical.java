package io.lacuna.morphotactics.automaton;

/**
 * The tropical semiring over non-negative weights: {@code plus} is {@code min}, {@code times} is {@code +}.
 */
public class Tropical {

  public static final double ZERO = Double.POSITIVE_INFINITY;
  public static final double ONE = 0.0;

  private Tropical() {
  }

  /**
   * @return the weight of choosing the better of two alternatives
   */
  public static double plus(double a, double b) {
    return Math.min(a, b);
  }

  /**
   * @return the weight of following {@code a} and then {@code b}
   */
  public static double times(double a, double b) {
    return a + b;
  }

  public static boolean isValid(double w) {
    return !Double.isNaN(w) && !Double.isInfinite(w) && w >= 0;
  }

  static double check(double w) {
    if (!isValid(w)) {
      throw new IllegalArgumentException("weights must be finite and non-negative, got " + w);
    }
    return w;
  }
}
