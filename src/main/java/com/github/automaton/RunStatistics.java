package com.github.automaton;

/**
 * Simple statistics holder for a run.
 */
public final class RunStatistics {
  private final long startMillis = System.currentTimeMillis();
  private final String runId;
  int symbolsConsumed;
  int transitionsTaken;
  // consumed while there was no matching transition or no current state
  int unmatchedSymbols;
  int restarts;

  RunStatistics(final String runId) {
    this.runId = runId;
  }

  public String getRunId() {
    return runId;
  }

  public int getSymbolsConsumed() {
    return symbolsConsumed;
  }

  public int getTransitionsTaken() {
    return transitionsTaken;
  }

  public int getUnmatchedSymbols() {
    return unmatchedSymbols;
  }

  public int getRestarts() {
    return restarts;
  }

  public long getAliveTimeMillis() {
    return System.currentTimeMillis() - startMillis;
  }

  @Override
  public String toString() {
    return "RunStatistics [runId=" + runId + ", symbolsConsumed=" + symbolsConsumed
        + ", transitionsTaken=" + transitionsTaken + ", unmatchedSymbols=" + unmatchedSymbols
        + ", restarts=" + restarts + ", aliveTimeMillis=" + getAliveTimeMillis() + "]";
  }

}
