package com.github.automaton;

/**
 * Point-in-time statistics for an automaton. {@link Automaton#getStatistics()} hands out a fresh
 * snapshot on every call, later changes to the automaton do not show up in an earlier one. Per-run
 * counters live in {@link RunStatistics}.
 */
public final class AutomatonStatistics {
  private final String automatonId;

  private final long startTstampMillis;

  AutomatonStatistics(final String automatonId) {
    this(automatonId, System.currentTimeMillis());
  }

  private AutomatonStatistics(final String automatonId, final long startTstampMillis) {
    this.automatonId = automatonId;
    this.startTstampMillis = startTstampMillis;
  }

  int totalStates;
  int totalTransitions;
  int totalAcceptingStates;
  int totalOverwrittenTransitions;
  // includes the automaton's own primary run
  int totalRunsStarted;

  /**
   * Copy the running counters together with the current graph sizes.
   */
  AutomatonStatistics snapshot(final int totalStates, final int totalTransitions,
      final int totalAcceptingStates) {
    final AutomatonStatistics snapshot = new AutomatonStatistics(automatonId, startTstampMillis);
    snapshot.totalStates = totalStates;
    snapshot.totalTransitions = totalTransitions;
    snapshot.totalAcceptingStates = totalAcceptingStates;
    snapshot.totalOverwrittenTransitions = totalOverwrittenTransitions;
    snapshot.totalRunsStarted = totalRunsStarted;
    return snapshot;
  }

  public long getStartTimeMillis() {
    return startTstampMillis;
  }

  public String getAutomatonId() {
    return automatonId;
  }

  public int getTotalStates() {
    return totalStates;
  }

  public int getTotalTransitions() {
    return totalTransitions;
  }

  public int getTotalAcceptingStates() {
    return totalAcceptingStates;
  }

  public int getTotalOverwrittenTransitions() {
    return totalOverwrittenTransitions;
  }

  public int getTotalRunsStarted() {
    return totalRunsStarted;
  }

  @Override
  public String toString() {
    return "AutomatonStatistics [automatonId=" + automatonId + ", startTstampMillis="
        + startTstampMillis + ", totalStates=" + totalStates + ", totalTransitions="
        + totalTransitions + ", totalAcceptingStates=" + totalAcceptingStates
        + ", totalOverwrittenTransitions=" + totalOverwrittenTransitions + ", totalRunsStarted="
        + totalRunsStarted + "]";
  }

}
