package com.github.automaton;

/**
 * This class encapsulates all the configuration parameters for the Automaton. Use the
 * {@code AutomatonConfigurationBuilder} to build it.
 * 
 * Notes:<br>
 * 1. duplicateTransitionPolicy decides how conflicting transitions out of a single state are
 * handled. There is no default at this level, {@link #defaults()} provides OVERWRITE.<br>
 */
public final class AutomatonConfiguration {
  private DuplicateTransitionPolicy duplicateTransitionPolicy;

  public DuplicateTransitionPolicy getDuplicateTransitionPolicy() {
    return duplicateTransitionPolicy;
  }

  /**
   * Last-write-wins configuration used when the builder is not handed one.
   */
  public static AutomatonConfiguration defaults() {
    return new AutomatonConfiguration(DuplicateTransitionPolicy.OVERWRITE);
  }

  public final static class AutomatonConfigurationBuilder {
    private DuplicateTransitionPolicy duplicateTransitionPolicy;

    public static AutomatonConfigurationBuilder newBuilder() {
      return new AutomatonConfigurationBuilder();
    }

    public AutomatonConfigurationBuilder duplicateTransitionPolicy(
        final DuplicateTransitionPolicy duplicateTransitionPolicy) {
      this.duplicateTransitionPolicy = duplicateTransitionPolicy;
      return this;
    }

    public AutomatonConfiguration build() throws AutomatonException {
      final AutomatonConfiguration config = new AutomatonConfiguration(duplicateTransitionPolicy);
      config.validate();
      return config;
    }

    private AutomatonConfigurationBuilder() {}
  }

  private void validate() throws AutomatonException {
    StringBuilder messages = new StringBuilder();
    if (duplicateTransitionPolicy == null) {
      messages.append("DuplicateTransitionPolicy cannot be null. ");
    }
    if (messages.length() > 0) {
      throw new AutomatonException(AutomatonException.Code.INVALID_AUTOMATON_CONFIG,
          messages.toString());
    }
  }

  @Override
  public String toString() {
    return "AutomatonConfiguration [duplicateTransitionPolicy=" + duplicateTransitionPolicy + "]";
  }

  private AutomatonConfiguration(final DuplicateTransitionPolicy duplicateTransitionPolicy) {
    this.duplicateTransitionPolicy = duplicateTransitionPolicy;
  }

}
