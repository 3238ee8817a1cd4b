package io.lacuna.morphotactics;

/**
 * Settings for {@link Morphotactics#compile(java.util.Collection, CompileOptions)}.
 */
public final class CompileOptions {

  public static final CompileOptions DEFAULT = builder().build();

  private final boolean optimize;

  private CompileOptions(Builder builder) {
    this.optimize = builder.optimize;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * @return whether the compiled automaton is handed to the optimizer, which leaves nondeterministic automata alone
   */
  public boolean optimize() {
    return optimize;
  }

  public static final class Builder {
    private boolean optimize = true;

    private Builder() {
    }

    public Builder optimize(boolean optimize) {
      this.optimize = optimize;
      return this;
    }

    public CompileOptions build() {
      return new CompileOptions(this);
    }
  }

  @Override
  public String toString() {
    return "options[optimize=" + optimize + "]";
  }
}
