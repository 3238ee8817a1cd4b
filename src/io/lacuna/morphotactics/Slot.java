package io.lacuna.morphotactics;

import io.lacuna.bifurcan.*;

import java.util.Arrays;
import java.util.Objects;

/**
 * A named group of interchangeable rules, equivalent to a continuation class in LEXC. The rules of a slot are
 * alternatives, and a rule may continue into any slot, including the one it belongs to.
 */
public final class Slot {

  private final String name;
  private final IList<Rule> rules;
  private final boolean start;

  public Slot(String name, Iterable<Rule> rules, boolean start) {
    this.name = Objects.requireNonNull(name);
    this.start = start;

    LinearList<Rule> l = new LinearList<>();
    rules.forEach(l::addLast);
    this.rules = l.forked();
  }

  public static Slot of(String name, Rule... rules) {
    return new Slot(name, Arrays.asList(rules), false);
  }

  /**
   * @return a slot which every word begins with
   */
  public static Slot start(String name, Rule... rules) {
    return new Slot(name, Arrays.asList(rules), true);
  }

  public String name() {
    return name;
  }

  public IList<Rule> rules() {
    return rules;
  }

  public boolean isStart() {
    return start;
  }

  @Override
  public String toString() {
    return "slot[" + name + (start ? ", start" : "") + "]";
  }
}
