package io.lacuna.morphotactics.automaton;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.morphotactics.query.Analysis;
import io.lacuna.morphotactics.query.Analyzer;
import org.junit.Test;

import java.util.Arrays;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;

/**
 * Tests for {@link Automaton}.
 */
public class AutomatonTests {

  private static Automaton x() {
    return Automaton.literal("x", "X", 1.0);
  }

  private static Automaton y() {
    return Automaton.literal("y", "Y", 2.0);
  }

  @Test
  public void literalHasOneArcBetweenEntryAndExit() {
    Automaton a = x();

    assertThat(a.numStates(), is(2));
    assertThat(a.numArcs(), is(1));
    assertThat(a.exit(), is(1));
    assertThat(a.arcs(a.start()).nth(0).input(), is("x"));
    assertThat(a.arcs(a.start()).nth(0).output(), is("X"));
    assertThat(a.arcs(a.start()).nth(0).weight(), is(1.0));
  }

  @Test
  public void importFragmentOffsetsStates() {
    Automaton host = new Automaton();
    host.setStart(host.addState());
    host.addState();
    host.addState();

    Fragment f = host.importFragment(x());

    assertThat(f.entry, is(3));
    assertThat(f.exit, is(4));
    assertThat(host.numStates(), is(5));
    assertThat(host.arcs(3).nth(0).dest(), is(4));
    assertThat(host.isFinal(4), is(false));
  }

  @Test
  public void concatMatchesBothInOrder() {
    Analyzer analyzer = new Analyzer(Automaton.concat(x(), y()));

    assertThat(analyzer.paths("xy"), contains(new Analysis("XY", 3.0)));
    assertThat(analyzer.accepts("yx"), is(false));
    assertThat(analyzer.accepts("x"), is(false));
  }

  @Test
  public void combinatorsDontModifyTheirArguments() {
    Automaton a = x();
    Automaton b = y();
    Automaton before = x();

    Automaton.concat(a, b);
    Automaton.union(a, b);
    Automaton.star(a);
    Automaton.plus(a);

    assertThat(a, is(before));
    assertThat(b.numStates(), is(2));
  }

  @Test
  public void reusedFragmentsAreIndependentCopies() {
    Automaton a = x();
    Analyzer analyzer = new Analyzer(Automaton.concat(a, Automaton.concat(a, a)));

    assertThat(analyzer.paths("xxx"), contains(new Analysis("XXX", 3.0)));
    assertThat(analyzer.accepts("xx"), is(false));
  }

  @Test
  public void unionMatchesEitherBranch() {
    Analyzer analyzer = new Analyzer(Automaton.union(x(), y()));

    assertThat(analyzer.analyze("x"), is("X"));
    assertThat(analyzer.analyze("y"), is("Y"));
    assertThat(analyzer.accepts("xy"), is(false));
  }

  @Test(expected = IllegalArgumentException.class)
  public void unionOfNothingIsRejected() {
    Automaton.union(new LinearList<Automaton>());
  }

  @Test
  public void unionOfList() {
    Analyzer analyzer = new Analyzer(Automaton.union(LinearList.of(x(), y(), x())));

    assertThat(analyzer.paths("x"), contains(new Analysis("X", 1.0), new Analysis("X", 1.0)));
    assertThat(analyzer.analyze("y"), is("Y"));
  }

  @Test
  public void fragmentCanBeImportedIntoItself() {
    Automaton a = x();
    Fragment f = a.importFragment(a);

    assertThat(a.numStates(), is(4));
    assertThat(f.entry, is(2));
    assertThat(f.exit, is(3));
    assertThat(a.arcs(2).nth(0).dest(), is(3));
    assertThat(a.exit(), is(1));
  }

  @Test
  public void arcsCannotBeModifiedFromOutside() {
    Automaton a = x();

    IList<Arc> arcs = a.arcs(a.start());
    arcs.addLast(arcs.nth(0));
    arcs.removeLast();

    assertThat(a.numArcs(), is(1));
    assertThat(a.arcs(a.start()).size(), is(1L));
    assertThat(a.isDeterministic(), is(true));
  }

  @Test
  public void quantifiers() {
    Analyzer star = new Analyzer(Automaton.star(x()));
    Analyzer plus = new Analyzer(Automaton.plus(x()));
    Analyzer optional = new Analyzer(Automaton.optional(x()));

    for (String s : Arrays.asList("", "x", "xxxx")) {
      assertThat(s, star.accepts(s), is(true));
    }
    assertThat(star.paths("xx"), contains(new Analysis("XX", 2.0)));

    assertThat(plus.accepts(""), is(false));
    assertThat(plus.accepts("xxx"), is(true));

    assertThat(optional.accepts(""), is(true));
    assertThat(optional.accepts("x"), is(true));
    assertThat(optional.accepts("xx"), is(false));
  }

  @Test
  public void epsilonAcceptsOnlyTheEmptyString() {
    Analyzer analyzer = new Analyzer(Automaton.epsilon());

    assertThat(analyzer.paths(""), contains(new Analysis("", 0.0)));
    assertThat(analyzer.paths("x"), is(empty()));
  }

  @Test
  public void addFinalKeepsTheCheapestWeight() {
    Automaton a = new Automaton();
    int s = a.addState();
    a.setStart(s);

    a.addFinal(s, 3.0);
    assertThat(a.finalWeight(s), is(3.0));

    a.addFinal(s, 1.0);
    a.addFinal(s, 2.0);
    assertThat(a.finalWeight(s), is(1.0));

    a.setFinal(s, 5.0);
    assertThat(a.finalWeight(s), is(5.0));
  }

  @Test
  public void finalWeightOfNonFinalStateIsZero() {
    Automaton a = x();

    assertThat(a.isFinal(0), is(false));
    assertThat(a.finalWeight(0), is(Tropical.ZERO));
    assertThat(a.isFinal(1), is(true));
    assertThat(a.finalWeight(1), is(Tropical.ONE));
  }

  @Test
  public void determinismCountsEpsilonAsALabel() {
    Automaton a = new Automaton();
    int s0 = a.addState();
    int s1 = a.addState();
    int s2 = a.addState();
    a.setStart(s0);

    a.addArc(s0, "b", "c", 1.0, s1);
    a.addArc(s0, "b", "a", 2.0, s1);
    a.addEpsilon(s1, 0.0, s2);
    assertThat(a.isDeterministic(), is(true));

    a.addEpsilon(s1, 0.0, s0);
    assertThat(a.isDeterministic(), is(false));
  }

  @Test
  public void sameLabelsMakeAStateNondeterministic() {
    Automaton a = new Automaton();
    int s0 = a.addState();
    int s1 = a.addState();
    a.setStart(s0);

    a.addArc(s0, "b", "a", 1.0, s1);
    a.addArc(s0, "b", "a", 2.0, s1);

    assertThat(a.isDeterministic(), is(false));
  }

  @Test(expected = IllegalStateException.class)
  public void verifyRequiresAStartState() {
    Automaton a = new Automaton();
    a.addState();
    a.verify();
  }

  @Test(expected = IndexOutOfBoundsException.class)
  public void arcsMustPointAtExistingStates() {
    Automaton a = new Automaton();
    int s = a.addState();
    a.addArc(s, "a", "a", 0.0, s + 1);
  }

  @Test(expected = IllegalArgumentException.class)
  public void negativeWeightsAreRejected() {
    Automaton.literal("a", "a", -1.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void infiniteWeightsAreRejected() {
    Automaton a = Automaton.epsilon();
    a.setFinal(a.start(), Double.POSITIVE_INFINITY);
  }

  @Test(expected = IllegalStateException.class)
  public void fragmentsHaveExactlyOneExit() {
    Automaton a = Automaton.literal("a", "a", 0.0);
    a.setFinal(a.start(), 0.0);
    a.exit();
  }

  @Test
  public void toStringListsArcsThenFinalStates() {
    assertThat(x().toString(), is("0\t1\tx\tX\t1.0\n1\t0.0\n"));
  }
}
