package io.lacuna.morphotactics;

import io.lacuna.morphotactics.automaton.Automaton;
import io.lacuna.morphotactics.regex.Alphabet;
import io.lacuna.morphotactics.regex.PatternCompiler;
import io.lacuna.morphotactics.regex.PatternException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Builds slots which guess out-of-vocabulary stems from their shape. The single rule of such a slot passes through
 * any string matching a pattern, such as the bimoraic constraint {@code .*V.*V} over an alphabet where {@code V}
 * names the vowels.
 */
public final class StemGuesser {

  private static final Logger LOG = LoggerFactory.getLogger(StemGuesser.class);

  private StemGuesser() {
  }

  /**
   * @throws PatternException if {@code pattern} is malformed
   */
  public static Slot of(String pattern, String name, Iterable<Continuation> continuations, Alphabet alphabet, boolean start) {
    Automaton acceptor = PatternCompiler.compile(pattern, alphabet);
    LOG.debug("compiled pattern '{}' for slot '{}' into {} states", pattern, name, acceptor.numStates());

    return new Slot(name, Arrays.asList(Rule.pattern(acceptor, continuations, 0.0)), start);
  }

  public static Slot of(String pattern, String name, Iterable<Continuation> continuations, Alphabet alphabet) {
    return of(pattern, name, continuations, alphabet, false);
  }

  public static Slot of(String pattern, String name, Iterable<Continuation> continuations) {
    return of(pattern, name, continuations, Alphabet.empty(), false);
  }
}
