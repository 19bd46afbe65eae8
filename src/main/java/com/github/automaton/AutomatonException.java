package com.github.automaton;

/**
 * Unified single exception that's thrown by the automaton while its graph is being built. The code
 * enum encapsulates the various error conditions. Simulation never throws.
 */
public final class AutomatonException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public AutomatonException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public AutomatonException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    INVALID_STATE("State is null or was not allocated by this automaton"),
    // 2.
    INVALID_STATE_NAME(
        "State name cannot be greater than " + State.maxStateNameLength + " characters"),
    // 3.
    DUPLICATE_TRANSITION("Source state already has a transition on this symbol"),
    // 4.
    INVALID_AUTOMATON_CONFIG("Automaton configuration is invalid");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
