package io.lacuna.morphotactics.automaton;

/**
 * The entry and exit states of a fragment imported into an {@link Automaton}.
 */
public final class Fragment {

  public final int entry;
  public final int exit;

  Fragment(int entry, int exit) {
    this.entry = entry;
    this.exit = exit;
  }

  @Override
  public String toString() {
    return "fragment[" + entry + " -> " + exit + "]";
  }
}
