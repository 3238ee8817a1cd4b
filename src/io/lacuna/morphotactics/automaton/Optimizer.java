package io.lacuna.morphotactics.automaton;

import io.lacuna.bifurcan.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.PriorityQueue;
import java.util.function.IntFunction;

/**
 * Reduces an automaton to an equivalent, smaller one.
 * <p>
 * Only input-deterministic automata are touched. Collapsing the parallel paths of an ambiguous transducer
 * would throw away alternative analyses and their weights, so anything else is returned as-is.
 */
public class Optimizer {

  private static final Logger LOG = LoggerFactory.getLogger(Optimizer.class);

  private static final Object NOT_FINAL = new Object();

  private Optimizer() {
  }

  /**
   * @return {@code a} if it isn't deterministic, otherwise an equivalent automaton with no epsilon arcs,
   * no dead states, and equivalent states merged, numbered in breadth-first order from the start state
   */
  public static Automaton optimize(Automaton a) {
    if (!a.isDeterministic()) {
      LOG.debug("skipping optimization, automaton with {} states is nondeterministic", a.numStates());
      return a;
    }

    Automaton result = renumber(minimize(mergeParallelArcs(trim(removeEpsilons(a)))));
    LOG.debug("optimized automaton from {} states and {} arcs to {} states and {} arcs",
            a.numStates(), a.numArcs(), result.numStates(), result.numArcs());

    return result;
  }

  /// epsilon removal

  private static final class Candidate {
    final int state;
    final double distance;

    Candidate(int state, double distance) {
      this.state = state;
      this.distance = distance;
    }
  }

  /**
   * @return the shortest epsilon distance from {@code state} to every state reachable from it through epsilon arcs,
   * including itself
   */
  static LinearMap<Integer, Double> epsilonClosure(Automaton a, int state) {
    LinearMap<Integer, Double> distance = new LinearMap<>();
    LinearSet<Integer> settled = new LinearSet<>();
    PriorityQueue<Candidate> queue = new PriorityQueue<>((x, y) -> Double.compare(x.distance, y.distance));

    distance.put(state, Tropical.ONE);
    queue.add(new Candidate(state, Tropical.ONE));

    while (!queue.isEmpty()) {
      Candidate c = queue.poll();
      if (settled.contains(c.state)) {
        continue;
      }
      settled.add(c.state);

      for (Arc arc : a.arcs(c.state)) {
        if (arc.isEpsilon()) {
          double d = Tropical.times(c.distance, arc.weight());
          if (d < distance.get(arc.dest(), Tropical.ZERO)) {
            distance.put(arc.dest(), d);
            queue.add(new Candidate(arc.dest(), d));
          }
        }
      }
    }

    return distance;
  }

  static Automaton removeEpsilons(Automaton a) {
    Automaton result = withStates(a.numStates());
    result.setStart(a.start());

    for (int s = 0; s < a.numStates(); s++) {
      LinearMap<Integer, Double> closure = epsilonClosure(a, s);
      for (int q : Utils.sorted(closure.keys())) {
        double d = closure.get(q, Tropical.ZERO);
        if (a.isFinal(q)) {
          result.addFinal(s, Tropical.times(d, a.finalWeight(q)));
        }
        for (Arc arc : a.arcs(q)) {
          if (!arc.isEpsilon()) {
            result.addArc(s, arc.input(), arc.output(), Tropical.times(d, arc.weight()), arc.dest());
          }
        }
      }
    }

    return result;
  }

  /// dead states

  /**
   * @return {@code a}, less any state which isn't both reachable from the start state and able to reach a final state
   */
  static Automaton trim(Automaton a) {
    int n = a.numStates();

    LinearList<LinearList<Integer>> successors = new LinearList<>();
    LinearList<LinearList<Integer>> predecessors = new LinearList<>();
    for (int s = 0; s < n; s++) {
      successors.addLast(new LinearList<>());
      predecessors.addLast(new LinearList<>());
    }
    for (int s = 0; s < n; s++) {
      for (Arc arc : a.arcs(s)) {
        successors.nth(s).addLast(arc.dest());
        predecessors.nth(arc.dest()).addLast(s);
      }
    }

    LinearSet<Integer> accessible = Utils.reachable(LinearList.of(a.start()), successors::nth);
    LinearSet<Integer> coaccessible = Utils.reachable(a.finalStates(), predecessors::nth);

    if (!coaccessible.contains(a.start())) {
      Automaton empty = new Automaton();
      return empty.setStart(empty.addState());
    }

    int[] index = new int[n];
    int live = 0;
    for (int s = 0; s < n; s++) {
      index[s] = accessible.contains(s) && coaccessible.contains(s) ? live++ : -1;
    }

    Automaton result = withStates(live);
    result.setStart(index[a.start()]);
    for (int s = 0; s < n; s++) {
      if (index[s] < 0) {
        continue;
      }
      for (Arc arc : a.arcs(s)) {
        if (index[arc.dest()] >= 0) {
          result.addArc(index[s], arc.input(), arc.output(), arc.weight(), index[arc.dest()]);
        }
      }
      if (a.isFinal(s)) {
        result.setFinal(index[s], a.finalWeight(s));
      }
    }

    return result;
  }

  /**
   * @return {@code a}, with arcs that share a source, labels, and destination collapsed into the cheapest of them
   */
  static Automaton mergeParallelArcs(Automaton a) {
    Automaton result = withStates(a.numStates());
    result.setStart(a.start());

    for (int s = 0; s < a.numStates(); s++) {
      LinearList<Arc> order = new LinearList<>();
      LinearMap<Arc, Double> cheapest = new LinearMap<>();
      for (Arc arc : a.arcs(s)) {
        Arc key = arc.withWeight(Tropical.ONE);
        if (!cheapest.contains(key)) {
          order.addLast(key);
        }
        cheapest.put(key, Tropical.plus(cheapest.get(key, Tropical.ZERO), arc.weight()));
      }
      for (Arc key : order) {
        result.addArc(s, key.input(), key.output(), cheapest.get(key, Tropical.ZERO), key.dest());
      }
      if (a.isFinal(s)) {
        result.setFinal(s, a.finalWeight(s));
      }
    }

    return result;
  }

  /// equivalent states

  private static final class Signature {
    final int block;
    final LinearSet<Arc> arcs;

    Signature(int block, LinearSet<Arc> arcs) {
      this.block = block;
      this.arcs = arcs;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Signature)) {
        return false;
      }
      Signature s = (Signature) o;
      return block == s.block && arcs.equals(s.arcs);
    }

    @Override
    public int hashCode() {
      return 31 * block + arcs.hashCode();
    }
  }

  // numbers each distinct key in order of the lowest state which has it
  private static int[] partition(int n, IntFunction<Object> key) {
    LinearMap<Object, Integer> ids = new LinearMap<>();
    int[] block = new int[n];
    for (int s = 0; s < n; s++) {
      Object k = key.apply(s);
      Integer id = ids.get(k, null);
      if (id == null) {
        id = (int) ids.size();
        ids.put(k, id);
      }
      block[s] = id;
    }
    return block;
  }

  private static int count(int[] block) {
    return Arrays.stream(block).max().orElse(-1) + 1;
  }

  /**
   * Merges states which have the same final weight and, for every labeled and weighted arc, an arc into the
   * same set of merged states. The partition is refined until it stops splitting.
   */
  static Automaton minimize(Automaton a) {
    int n = a.numStates();

    int[] block = partition(n, s -> a.isFinal(s) ? (Object) a.finalWeight(s) : NOT_FINAL);
    for (; ; ) {
      int[] prev = block;
      block = partition(n, s -> {
        LinearSet<Arc> arcs = new LinearSet<>();
        a.arcs(s).forEach(arc -> arcs.add(arc.withDest(prev[arc.dest()])));
        return new Signature(prev[s], arcs);
      });

      if (count(block) == count(prev)) {
        break;
      }
    }

    Automaton result = withStates(count(block));
    result.setStart(block[a.start()]);

    boolean[] visited = new boolean[count(block)];
    for (int s = 0; s < n; s++) {
      int b = block[s];
      if (visited[b]) {
        continue;
      }
      visited[b] = true;

      LinearSet<Arc> seen = new LinearSet<>();
      for (Arc arc : a.arcs(s)) {
        Arc q = arc.withDest(block[arc.dest()]);
        if (!seen.contains(q)) {
          seen.add(q);
          result.addArc(b, q.input(), q.output(), q.weight(), q.dest());
        }
      }
      if (a.isFinal(s)) {
        result.setFinal(b, a.finalWeight(s));
      }
    }

    return result;
  }

  /// numbering

  /**
   * @return {@code a}, with states numbered in the order a breadth-first traversal from the start state visits them,
   * and each state's arcs sorted by labels, weight, and destination
   */
  static Automaton renumber(Automaton a) {
    int[] rank = new int[a.numStates()];
    Arrays.fill(rank, -1);

    LinearList<Integer> order = new LinearList<>();
    LinearList<Integer> queue = LinearList.of(a.start());
    rank[a.start()] = 0;
    int next = 1;

    while (queue.size() > 0) {
      int s = queue.popFirst();
      order.addLast(s);
      for (Arc arc : Lists.sort(a.arcs(s), Arc.ORDER)) {
        if (rank[arc.dest()] < 0) {
          rank[arc.dest()] = next++;
          queue.addLast(arc.dest());
        }
      }
    }

    Automaton result = withStates(next);
    result.setStart(0);
    for (int s : order) {
      LinearList<Arc> arcs = new LinearList<>();
      a.arcs(s).forEach(arc -> arcs.addLast(arc.withDest(rank[arc.dest()])));
      for (Arc arc : Lists.sort(arcs, Arc.ORDER)) {
        result.addArc(rank[s], arc.input(), arc.output(), arc.weight(), arc.dest());
      }
      if (a.isFinal(s)) {
        result.setFinal(rank[s], a.finalWeight(s));
      }
    }

    return result;
  }

  ///

  private static Automaton withStates(int n) {
    Automaton a = new Automaton();
    for (int i = 0; i < n; i++) {
      a.addState();
    }
    return a;
  }
}
