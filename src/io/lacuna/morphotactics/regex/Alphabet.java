package io.lacuna.morphotactics.regex;

import io.lacuna.bifurcan.*;

import java.util.Map;

/**
 * Named classes of symbols, such as consonants and vowels, which a pattern can refer to by name. Symbols may be
 * longer than one character ({@code "kw"}, {@code "o:"}), and classes may overlap.
 */
public final class Alphabet {

  private static final Alphabet EMPTY = new Alphabet(new LinearMap<>(), new LinearList<>());

  private final LinearMap<String, IList<String>> classes;
  private final IList<String> symbols;
  private final LinearSet<String> symbolSet;

  private Alphabet(LinearMap<String, IList<String>> classes, LinearList<String> symbols) {
    this.classes = classes;
    this.symbols = symbols.forked();
    this.symbolSet = new LinearSet<>();
    symbols.forEach(symbolSet::add);
  }

  public static Alphabet empty() {
    return EMPTY;
  }

  /**
   * @return an alphabet with a class for each entry of {@code classes}, in iteration order
   */
  public static Alphabet of(Map<String, ? extends Iterable<String>> classes) {
    Builder b = builder();
    classes.forEach(b::add);
    return b.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private final LinearMap<String, IList<String>> classes = new LinearMap<>();
    private final LinearList<String> symbols = new LinearList<>();
    private final LinearSet<String> seen = new LinearSet<>();

    private Builder() {
    }

    public Builder add(String name, String... symbols) {
      return add(name, LinearList.of(symbols));
    }

    public Builder add(String name, Iterable<String> symbols) {
      if (name == null || name.isEmpty()) {
        throw new IllegalArgumentException("class names must be non-empty");
      }
      if (classes.contains(name)) {
        throw new IllegalArgumentException("duplicate class '" + name + "'");
      }

      LinearList<String> members = new LinearList<>();
      for (String s : symbols) {
        if (s == null || s.isEmpty()) {
          throw new IllegalArgumentException("class '" + name + "' contains the empty symbol");
        }
        members.addLast(s);
        if (!seen.contains(s)) {
          seen.add(s);
          this.symbols.addLast(s);
        }
      }
      if (members.size() == 0) {
        throw new IllegalArgumentException("class '" + name + "' has no symbols");
      }
      classes.put(name, members.forked());

      return this;
    }

    public Alphabet build() {
      return new Alphabet(classes.clone(), symbols.clone());
    }
  }

  public boolean isEmpty() {
    return symbols.size() == 0;
  }

  public boolean isClass(String name) {
    return classes.contains(name);
  }

  public boolean isSymbol(String symbol) {
    return symbolSet.contains(symbol);
  }

  /**
   * @return the symbols of the class {@code name}, in declaration order
   */
  public IList<String> members(String name) {
    return classes.get(name).orElseThrow(() -> new IllegalArgumentException("no such class '" + name + "'"));
  }

  /**
   * @return every symbol of every class, each once, in declaration order
   */
  public IList<String> symbols() {
    return symbols;
  }

  /**
   * @return the longest class name starting at {@code offset} in {@code s}, or null if there isn't one
   */
  String longestClass(String s, int offset) {
    return longest(classes.keys(), s, offset);
  }

  /**
   * @return the longest symbol starting at {@code offset} in {@code s}, or null if there isn't one
   */
  String longestSymbol(String s, int offset) {
    return longest(symbolSet, s, offset);
  }

  private static String longest(ISet<String> candidates, String s, int offset) {
    String result = null;
    for (String c : candidates) {
      if (s.startsWith(c, offset) && (result == null || c.length() > result.length())) {
        result = c;
      }
    }
    return result;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("alphabet[");
    for (String name : classes.keys()) {
      sb.append(name).append('=').append(classes.get(name, null)).append(", ");
    }
    if (classes.size() > 0) {
      sb.delete(sb.length() - 2, sb.length());
    }
    return sb.append(']').toString();
  }
}
