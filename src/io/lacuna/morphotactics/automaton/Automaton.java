package io.lacuna.morphotactics.automaton;

import io.lacuna.bifurcan.*;

/**
 * A weighted finite-state transducer over string symbols, in the tropical semiring. States are dense
 * integers {@code 0..n-1}, each with an ordered list of outgoing {@link Arc}s, and a state is accepting
 * iff it has a final weight.
 * <p>
 * An automaton with a start state and exactly one final state of weight {@link Tropical#ONE} is a
 * <i>fragment</i>; its final state is its exit. The static combinators take fragments and return new
 * fragments, copying their arguments rather than sharing any states with them.
 */
public class Automaton {

  public static final String EPSILON = "";

  private final LinearList<LinearList<Arc>> states;
  private final LinearMap<Integer, Double> finals;
  private int start = -1;

  public Automaton() {
    this.states = new LinearList<>();
    this.finals = new LinearMap<>();
  }

  /// primitives

  /**
   * @return the index of a new state, with no arcs
   */
  public int addState() {
    states.addLast(new LinearList<>());
    return numStates() - 1;
  }

  /**
   * @return the current automaton, with an arc from {@code src} to {@code dest}
   */
  public Automaton addArc(int src, String input, String output, double weight, int dest) {
    checkState(src);
    checkState(dest);
    states.nth(src).addLast(new Arc(input, output, Tropical.check(weight), dest));

    return this;
  }

  /**
   * @return the current automaton, with an epsilon arc from {@code src} to {@code dest}
   */
  public Automaton addEpsilon(int src, double weight, int dest) {
    return addArc(src, EPSILON, EPSILON, weight, dest);
  }

  public Automaton setStart(int state) {
    checkState(state);
    start = state;

    return this;
  }

  /**
   * @return the current automaton, with {@code state} accepting with exactly {@code weight}
   */
  public Automaton setFinal(int state, double weight) {
    checkState(state);
    finals.put(state, Tropical.check(weight));

    return this;
  }

  /**
   * @return the current automaton, with {@code weight} combined into any final weight {@code state} already has
   */
  public Automaton addFinal(int state, double weight) {
    checkState(state);
    finals.put(state, Tropical.plus(finalWeight(state), Tropical.check(weight)));

    return this;
  }

  public int start() {
    return start;
  }

  public int numStates() {
    return (int) states.size();
  }

  public int numArcs() {
    int n = 0;
    for (LinearList<Arc> arcs : states) {
      n += (int) arcs.size();
    }
    return n;
  }

  public IList<Arc> arcs(int state) {
    checkState(state);
    return states.nth(state).forked();
  }

  public boolean isFinal(int state) {
    return finals.contains(state);
  }

  /**
   * @return the final weight of {@code state}, or {@link Tropical#ZERO} if it isn't accepting
   */
  public double finalWeight(int state) {
    return finals.get(state, Tropical.ZERO);
  }

  public ISet<Integer> finalStates() {
    return finals.keys();
  }

  /// fragments

  /**
   * Copies the states and arcs of {@code fragment} into the current automaton, offset past its existing
   * states. The copy is disconnected until arcs are added to or from its entry and exit.
   *
   * @return the entry and exit of the copy
   */
  public Fragment importFragment(Automaton fragment) {
    int exit = fragment.exit();
    int offset = numStates();
    int n = fragment.numStates();

    for (int i = 0; i < n; i++) {
      addState();
    }

    for (int s = 0; s < n; s++) {
      LinearList<Arc> arcs = states.nth(offset + s);
      for (Arc a : fragment.arcs(s)) {
        arcs.addLast(a.withDest(a.dest() + offset));
      }
    }

    return new Fragment(fragment.start() + offset, exit + offset);
  }

  /**
   * @return the single final state of a fragment
   */
  public int exit() {
    if (start < 0 || finals.size() != 1) {
      throw new IllegalStateException("not a fragment: needs a start state and exactly one final state");
    }
    return finals.keys().iterator().next();
  }

  private Automaton asFragment(int entry, int exit) {
    return setStart(entry).setFinal(exit, Tropical.ONE);
  }

  /// combinators

  /**
   * @return a fragment which accepts only the empty string
   */
  public static Automaton epsilon() {
    Automaton a = new Automaton();
    int s = a.addState();

    return a.asFragment(s, s);
  }

  /**
   * @return a fragment which reads {@code input} and writes {@code output}
   */
  public static Automaton literal(String input, String output, double weight) {
    Automaton a = new Automaton();
    int entry = a.addState();
    int exit = a.addState();
    a.addArc(entry, input, output, weight, exit);

    return a.asFragment(entry, exit);
  }

  /**
   * @return a fragment which matches {@code a} followed by {@code b}
   */
  public static Automaton concat(Automaton a, Automaton b) {
    Automaton result = new Automaton();
    Fragment x = result.importFragment(a);
    Fragment y = result.importFragment(b);
    result.addEpsilon(x.exit, Tropical.ONE, y.entry);

    return result.asFragment(x.entry, y.exit);
  }

  /**
   * @return a fragment which matches any of {@code fragments}
   */
  public static Automaton union(Automaton... fragments) {
    return union(LinearList.of(fragments));
  }

  /**
   * @return a fragment which matches any of {@code fragments}
   */
  public static Automaton union(IList<Automaton> fragments) {
    if (fragments.size() == 0) {
      throw new IllegalArgumentException("cannot take the union of zero fragments");
    }

    Automaton result = new Automaton();
    int entry = result.addState();
    int exit = result.addState();

    for (Automaton a : fragments) {
      Fragment f = result.importFragment(a);
      result.addEpsilon(entry, Tropical.ONE, f.entry);
      result.addEpsilon(f.exit, Tropical.ONE, exit);
    }

    return result.asFragment(entry, exit);
  }

  /**
   * @return a fragment which matches {@code a} one or more times
   */
  public static Automaton plus(Automaton a) {
    Automaton result = new Automaton();
    Fragment f = result.importFragment(a);
    result.addEpsilon(f.exit, Tropical.ONE, f.entry);

    return result.asFragment(f.entry, f.exit);
  }

  /**
   * @return a fragment which matches {@code a} zero or one times
   */
  public static Automaton optional(Automaton a) {
    return union(a, epsilon());
  }

  /**
   * @return a fragment which matches {@code a} zero or more times
   */
  public static Automaton star(Automaton a) {
    return optional(plus(a));
  }

  /// properties

  /**
   * @return true if no state has two outgoing arcs with the same input and output labels, counting
   * epsilon as a label
   */
  public boolean isDeterministic() {
    for (LinearList<Arc> arcs : states) {
      LinearSet<Arc.Label> labels = new LinearSet<>();
      for (Arc a : arcs) {
        Arc.Label l = a.label();
        if (labels.contains(l)) {
          return false;
        }
        labels.add(l);
      }
    }
    return true;
  }

  /**
   * Checks the structural invariants: a start state is set, every arc and final weight refers to an
   * existing state, and every weight is finite and non-negative.
   *
   * @throws IllegalStateException if any invariant is broken
   */
  public void verify() {
    if (start < 0 || start >= numStates()) {
      throw new IllegalStateException("malformed automaton: no start state");
    }

    for (int s = 0; s < numStates(); s++) {
      for (Arc a : states.nth(s)) {
        if (a.dest() < 0 || a.dest() >= numStates()) {
          throw new IllegalStateException("malformed automaton: arc " + a + " from " + s + " has no destination");
        }
        if (!Tropical.isValid(a.weight())) {
          throw new IllegalStateException("malformed automaton: arc " + a + " from " + s + " has an invalid weight");
        }
      }
    }

    for (Integer s : finals.keys()) {
      if (s < 0 || s >= numStates() || !Tropical.isValid(finalWeight(s))) {
        throw new IllegalStateException("malformed automaton: bad final state " + s);
      }
    }
  }

  private void checkState(int state) {
    if (state < 0 || state >= numStates()) {
      throw new IndexOutOfBoundsException("no such state: " + state);
    }
  }

  ///

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Automaton)) {
      return false;
    }

    Automaton a = (Automaton) o;
    if (start != a.start || numStates() != a.numStates()) {
      return false;
    }

    for (int s = 0; s < numStates(); s++) {
      IList<Arc> x = arcs(s);
      IList<Arc> y = a.arcs(s);
      if (x.size() != y.size()) {
        return false;
      }
      for (long i = 0; i < x.size(); i++) {
        if (!x.nth(i).equals(y.nth(i))) {
          return false;
        }
      }
      if (isFinal(s) != a.isFinal(s) || Double.compare(finalWeight(s), a.finalWeight(s)) != 0) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    int h = start;
    for (int s = 0; s < numStates(); s++) {
      for (Arc a : arcs(s)) {
        h = 31 * h + a.hashCode();
      }
      h = 31 * h + Double.hashCode(finalWeight(s));
    }
    return h;
  }

  /**
   * @return the automaton in an AT&T-style text format: one {@code src dest input output weight} line per
   * arc, then one {@code state weight} line per final state
   */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (int s = 0; s < numStates(); s++) {
      for (Arc a : arcs(s)) {
        sb.append(s).append('\t')
                .append(a.dest()).append('\t')
                .append(a.input().isEmpty() ? "<eps>" : a.input()).append('\t')
                .append(a.output().isEmpty() ? "<eps>" : a.output()).append('\t')
                .append(a.weight()).append('\n');
      }
    }
    for (int s = 0; s < numStates(); s++) {
      if (isFinal(s)) {
        sb.append(s).append('\t').append(finalWeight(s)).append('\n');
      }
    }
    return sb.toString();
  }
}
