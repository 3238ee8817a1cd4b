package io.lacuna.morphotactics;

import io.lacuna.bifurcan.*;
import io.lacuna.morphotactics.automaton.Automaton;
import io.lacuna.morphotactics.automaton.Tropical;

import java.util.Arrays;
import java.util.Objects;

/**
 * One way of filling a slot. A literal rule reads its {@code lower} symbol and writes its {@code upper} symbol, so
 * that the compiled automaton maps surface forms onto their analyses. A pattern rule reads and writes whatever its
 * acceptor accepts.
 */
public final class Rule {

  public enum Kind {
    LITERAL,
    PATTERN
  }

  private final Kind kind;
  private final String upper;
  private final String lower;
  private final Automaton acceptor;
  private final IList<Continuation> continuations;
  private final double weight;

  private Rule(Kind kind, String upper, String lower, Automaton acceptor, Iterable<Continuation> continuations, double weight) {
    if (!Tropical.isValid(weight)) {
      throw new ConfigException("rule weights must be finite and non-negative, got " + weight);
    }

    LinearList<Continuation> l = new LinearList<>();
    for (Continuation c : continuations) {
      if (!Tropical.isValid(c.weight())) {
        throw new ConfigException("continuation weights must be finite and non-negative, got " + c);
      }
      l.addLast(c);
    }

    this.kind = kind;
    this.upper = upper;
    this.lower = lower;
    this.acceptor = acceptor;
    this.continuations = l.forked();
    this.weight = weight;

    if (l.size() == 0) {
      throw new ConfigException("rule " + this + " needs at least one continuation, use Continuation.terminal() to end a word");
    }
  }

  /**
   * @return a rule which reads {@code lower}, writes {@code upper}, and may be followed by any of {@code continuations}
   */
  public static Rule of(String upper, String lower, Iterable<Continuation> continuations, double weight) {
    return new Rule(Kind.LITERAL, Objects.requireNonNull(upper), Objects.requireNonNull(lower), null, continuations, weight);
  }

  public static Rule of(String upper, String lower, double weight, Continuation... continuations) {
    return of(upper, lower, Arrays.asList(continuations), weight);
  }

  /**
   * @return a rule which reads and writes any string {@code acceptor} accepts
   */
  public static Rule pattern(Automaton acceptor, Iterable<Continuation> continuations, double weight) {
    acceptor.exit();
    return new Rule(Kind.PATTERN, Automaton.EPSILON, Automaton.EPSILON, acceptor, continuations, weight);
  }

  public Kind kind() {
    return kind;
  }

  public String upper() {
    return upper;
  }

  public String lower() {
    return lower;
  }

  /**
   * @return the acceptor of a pattern rule, or null for a literal rule
   */
  public Automaton acceptor() {
    return acceptor;
  }

  public IList<Continuation> continuations() {
    return continuations;
  }

  public double weight() {
    return weight;
  }

  /**
   * @return true if the word may end after this rule
   */
  public boolean isTerminal() {
    for (Continuation c : continuations) {
      if (c.isTerminal()) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return (kind == Kind.PATTERN ? "<pattern>" : "'" + upper + "':'" + lower + "'") + "/" + weight;
  }
}
