package io.lacuna.morphotactics;

/**
 * Thrown when a set of slots, or a single rule, can't be compiled: there isn't exactly one start slot, two
 * slots share a name, a rule continues to a slot that doesn't exist, or a rule has no continuations.
 */
public class ConfigException extends RuntimeException {

  public ConfigException(String message) {
    super(message);
  }
}
