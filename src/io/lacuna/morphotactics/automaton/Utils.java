package io.lacuna.morphotactics.automaton;

import io.lacuna.bifurcan.*;

import java.util.Arrays;
import java.util.function.IntFunction;

class Utils {

  private Utils() {
  }

  /**
   * @return every state reachable from {@code init}, including {@code init}, where {@code next} gives the
   * immediate neighbors of a state
   */
  static LinearSet<Integer> reachable(Iterable<Integer> init, IntFunction<Iterable<Integer>> next) {
    LinearSet<Integer> visited = new LinearSet<>();
    LinearList<Integer> queue = new LinearList<>();
    init.forEach(queue::addLast);

    while (queue.size() > 0) {
      int s = queue.popFirst();
      if (!visited.contains(s)) {
        visited.add(s);
        next.apply(s).forEach(queue::addLast);
      }
    }

    return visited;
  }

  static int[] sorted(ISet<Integer> set) {
    int[] a = new int[(int) set.size()];
    int i = 0;
    for (int s : set) {
      a[i++] = s;
    }
    Arrays.sort(a);
    return a;
  }
}
