package io.lacuna.morphotactics.query;

import io.lacuna.bifurcan.*;
import io.lacuna.morphotactics.automaton.Arc;
import io.lacuna.morphotactics.automaton.Automaton;
import io.lacuna.morphotactics.automaton.Tropical;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs strings through a compiled automaton. The automaton is never modified.
 * <p>
 * An arc matches wherever its input symbol is a prefix of the rest of the input, so symbols of more than one
 * character are read whole. A single path never passes through the same state at the same input position twice,
 * which bounds the search even when epsilon arcs form a cycle.
 */
public class Analyzer {

  private final Automaton automaton;

  public Analyzer(Automaton automaton) {
    automaton.verify();
    this.automaton = automaton;
  }

  public boolean accepts(String input) {
    return !paths(input).isEmpty();
  }

  /**
   * @return every output of every accepting path for {@code input}, cheapest first
   */
  public List<Analysis> paths(String input) {
    LinearList<Analysis> acc = new LinearList<>();
    search(input, automaton.start(), 0, new StringBuilder(), Tropical.ONE, new LinearSet<>(), acc);

    Analysis[] sorted = acc.toArray(Analysis[]::new);
    Arrays.sort(sorted, Analysis.ORDER);
    return Collections.unmodifiableList(Arrays.asList(sorted));
  }

  /**
   * @return each distinct output for {@code input}, mapped onto the weight of its cheapest path, cheapest first
   */
  public Map<String, Double> weights(String input) {
    Map<String, Double> m = new LinkedHashMap<>();
    for (Analysis a : paths(input)) {
      m.putIfAbsent(a.output(), a.weight());
    }
    return m;
  }

  /**
   * @return the output of the cheapest path for {@code input}
   * @throws NoPathException if the automaton doesn't accept {@code input}
   */
  public String analyze(String input) {
    List<Analysis> paths = paths(input);
    if (paths.isEmpty()) {
      throw new NoPathException(input);
    }
    return paths.get(0).output();
  }

  private void search(String input, int state, int pos, StringBuilder output, double weight,
                      LinearSet<Long> onPath, LinearList<Analysis> acc) {

    long config = (long) state * (input.length() + 1) + pos;
    if (onPath.contains(config)) {
      return;
    }
    onPath.add(config);

    if (pos == input.length() && automaton.isFinal(state)) {
      acc.addLast(new Analysis(output.toString(), Tropical.times(weight, automaton.finalWeight(state))));
    }

    for (Arc arc : automaton.arcs(state)) {
      if (input.startsWith(arc.input(), pos)) {
        int length = output.length();
        output.append(arc.output());
        search(input, arc.dest(), pos + arc.input().length(), output, Tropical.times(weight, arc.weight()), onPath, acc);
        output.setLength(length);
      }
    }

    onPath.remove(config);
  }
}
