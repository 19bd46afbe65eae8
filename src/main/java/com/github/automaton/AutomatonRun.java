package com.github.automaton;

import java.util.Optional;
import java.util.UUID;

/**
 * An independent cursor over an automaton's graph. Every run owns its position and statistics,
 * the graph itself is only ever read, so any number of runs can walk the same automaton as long as
 * nobody is adding states or transitions at the same time.
 *
 * A run is positioned at the automaton's start state when it is created. {@link #restart()} goes
 * back to whatever the start state is at that moment. Transitions added after the run was opened
 * are visible to it.
 *
 * Runs are confined to a single thread.
 */
public final class AutomatonRun<T> {
  private final String runId = UUID.randomUUID().toString();
  private final AutomatonImpl<T> automaton;

  // null until the automaton has a start state
  private State currentState;

  private final RunStatistics runStats;

  AutomatonRun(final AutomatonImpl<T> automaton) {
    this.automaton = automaton;
    this.currentState = automaton.startState();
    this.runStats = new RunStatistics(runId);
  }

  /**
   * Follow the transition labeled symbol out of the current state. Without such a transition, or
   * without a current state, the cursor stays put. The symbol's toString() is only called when
   * debug logging is on.
   */
  public void consume(final T symbol) {
    runStats.symbolsConsumed++;
    if (currentState == null) {
      runStats.unmatchedSymbols++;
      if (AutomatonImpl.debugEnabled()) {
        AutomatonImpl.logDebug(automaton.getId(), runId,
            String.format("Ignored %s, run has no current state", symbol));
      }
      return;
    }
    final State nextState = automaton.lookupTarget(currentState, symbol);
    if (nextState == null) {
      runStats.unmatchedSymbols++;
      if (AutomatonImpl.debugEnabled()) {
        AutomatonImpl.logDebug(automaton.getId(), runId,
            String.format("No transition out of %s on %s", currentState.getName(), symbol));
      }
      return;
    }
    if (AutomatonImpl.debugEnabled()) {
      AutomatonImpl.logDebug(automaton.getId(), runId, String.format("%s --%s--> %s",
          currentState.getName(), symbol, nextState.getName()));
    }
    currentState = nextState;
    runStats.transitionsTaken++;
  }

  public void consumeAll(final Iterable<? extends T> symbols) {
    for (final T symbol : symbols) {
      consume(symbol);
    }
  }

  public void restart() {
    currentState = automaton.startState();
    runStats.restarts++;
  }

  public boolean accepted() {
    return currentState != null && automaton.isAccepting(currentState);
  }

  public Optional<State> current() {
    return Optional.ofNullable(currentState);
  }

  public String getId() {
    return runId;
  }

  public RunStatistics getStatistics() {
    return runStats;
  }

  void relocate(final State state) {
    currentState = state;
  }

  @Override
  public String toString() {
    return "AutomatonRun [runId=" + runId + ", automatonId=" + automaton.getId()
        + ", currentState=" + currentState + "]";
  }
}
