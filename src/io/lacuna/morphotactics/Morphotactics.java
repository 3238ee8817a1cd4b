package io.lacuna.morphotactics;

import io.lacuna.bifurcan.*;
import io.lacuna.morphotactics.automaton.Automaton;
import io.lacuna.morphotactics.automaton.Fragment;
import io.lacuna.morphotactics.automaton.Optimizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;

/**
 * Compiles a lexicon of slots into a single weighted transducer.
 * <p>
 * Continuations may form cycles, so a slot can't be compiled by first compiling everything it continues into.
 * Instead every slot reachable from the start slot is materialized into one automaton, giving each slot an entry
 * state and each rule an exit state, and only then are the exits wired to the entries they continue into.
 */
public final class Morphotactics {

  private static final Logger LOG = LoggerFactory.getLogger(Morphotactics.class);

  private Morphotactics() {
  }

  private static final class Exit {
    final Rule rule;
    final int state;

    Exit(Rule rule, int state) {
      this.rule = rule;
      this.state = state;
    }
  }

  public static Automaton compile(Collection<Slot> slots) {
    return compile(slots, CompileOptions.DEFAULT);
  }

  /**
   * @return an automaton which reads the lower side of every word the slots allow and writes its upper side,
   * weighted by the sum of the weights of every rule and continuation along the way
   * @throws ConfigException if there isn't exactly one start slot, two slots share a name, or a rule continues to
   * a slot which isn't in {@code slots}
   */
  public static Automaton compile(Collection<Slot> slots, CompileOptions options) {
    LinearMap<String, Slot> byName = validate(slots);
    Slot start = startSlot(slots);

    Automaton result = new Automaton();
    LinearMap<String, Integer> entries = new LinearMap<>();
    LinearList<Exit> exits = new LinearList<>();

    // materialize, depth-first from the start slot
    LinearList<Slot> stack = LinearList.of(start);
    while (stack.size() > 0) {
      Slot slot = stack.popLast();
      if (entries.contains(slot.name())) {
        continue;
      }

      int entry = result.addState();
      entries.put(slot.name(), entry);

      for (Rule rule : slot.rules()) {
        exits.addLast(new Exit(rule, materialize(result, entry, rule)));
        for (Continuation c : rule.continuations()) {
          if (!c.isTerminal() && !entries.contains(c.target())) {
            stack.addLast(byName.get(c.target(), null));
          }
        }
      }
    }

    if (entries.size() < slots.size()) {
      for (Slot slot : slots) {
        if (!entries.contains(slot.name())) {
          LOG.debug("{} is unreachable from {}, skipping it", slot, start);
        }
      }
    }

    // wire
    for (Exit exit : exits) {
      for (Continuation c : exit.rule.continuations()) {
        if (c.isTerminal()) {
          result.addFinal(exit.state, c.weight());
        } else {
          result.addEpsilon(exit.state, c.weight(), entries.get(c.target(), -1));
        }
      }
    }

    result.setStart(entries.get(start.name(), -1));
    result.verify();

    LOG.debug("compiled {} slots into {} states and {} arcs", entries.size(), result.numStates(), result.numArcs());

    return options.optimize() ? Optimizer.optimize(result) : result;
  }

  /**
   * Adds {@code rule} to {@code automaton}, starting from {@code entry}.
   *
   * @return the state reached once the rule has been read
   */
  private static int materialize(Automaton automaton, int entry, Rule rule) {
    switch (rule.kind()) {
      case LITERAL: {
        int exit = automaton.addState();
        automaton.addArc(entry, rule.lower(), rule.upper(), rule.weight(), exit);
        return exit;
      }

      case PATTERN: {
        Fragment f = automaton.importFragment(rule.acceptor());
        automaton.addEpsilon(entry, rule.weight(), f.entry);
        return f.exit;
      }

      default:
        throw new IllegalStateException("unexpected rule " + rule.kind());
    }
  }

  private static LinearMap<String, Slot> validate(Collection<Slot> slots) {
    if (slots.isEmpty()) {
      throw new ConfigException("no slots to compile");
    }

    LinearMap<String, Slot> byName = new LinearMap<>();
    for (Slot slot : slots) {
      if (byName.contains(slot.name())) {
        throw new ConfigException("more than one slot is named '" + slot.name() + "'");
      }
      byName.put(slot.name(), slot);
    }

    for (Slot slot : slots) {
      for (Rule rule : slot.rules()) {
        for (Continuation c : rule.continuations()) {
          if (!c.isTerminal() && !byName.contains(c.target())) {
            throw new ConfigException("rule " + rule + " of " + slot + " continues to unknown slot '" + c.target() + "'");
          }
        }
      }
    }

    return byName;
  }

  private static Slot startSlot(Collection<Slot> slots) {
    LinearList<String> names = new LinearList<>();
    Slot start = null;
    for (Slot slot : slots) {
      if (slot.isStart()) {
        names.addLast(slot.name());
        start = slot;
      }
    }

    if (names.size() != 1) {
      throw new ConfigException("need exactly one start slot, found " + names.size() + " " + names);
    }

    return start;
  }
}
