package com.github.automaton;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automaton.AutomatonException.Code;

/**
 * A simple Deterministic Finite Automaton backed by a state arena.
 *
 * Notes for users:<br>
 * 1. every state is an entry in an arena indexed by {@link State#getIndex()}. The entry owns a
 * keyed transition table symbol->target, so a lookup is a single hash probe and last-write-wins
 * is a single put()<br>
 *
 * 2. the accepting set is a flag on the arena entry, so membership is O(1) and adding a state
 * twice is harmless<br>
 *
 * 3. the automaton's own cursor is just its primary {@link AutomatonRun}. Additional runs share the
 * arena read-only<br>
 *
 * 4. not thread-safe, see {@link Automaton}<br>
 */
final class AutomatonImpl<T> implements Automaton<T> {
  private static final Logger logger = LogManager.getLogger(AutomatonImpl.class.getSimpleName());

  private final String automatonId = UUID.randomUUID().toString();

  private final AutomatonConfiguration config;

  // K=State.index, append-only
  private final List<StateEntry<T>> stateArena = new ArrayList<>();

  private State startState;
  private int transitionCount;

  private final AutomatonStatistics automatonStats;

  private final AutomatonRun<T> primaryRun;

  AutomatonImpl(final AutomatonConfiguration config) {
    this.config = config;
    this.automatonStats = new AutomatonStatistics(automatonId);
    this.primaryRun = new AutomatonRun<>(this);
    automatonStats.totalRunsStarted++;
    logInfo(automatonId, null, "Created automaton with " + config);
  }

  @Override
  public State addState() {
    return allocateState(null);
  }

  @Override
  public State addState(final Optional<String> name) throws AutomatonException {
    String stateName = null;
    if (name != null && name.isPresent()) {
      stateName = name.get().trim();
      if (stateName.length() > State.maxStateNameLength) {
        logError(automatonId, null, String.format("Rejected state name '%s'", stateName));
        throw new AutomatonException(Code.INVALID_STATE_NAME);
      }
    }
    return allocateState(stateName);
  }

  @Override
  public void addTransition(final State source, final State target, final T symbol)
      throws AutomatonException {
    // both ends are checked before anything is touched
    final StateEntry<T> sourceEntry = lookupEntry(source, "addTransition");
    lookupEntry(target, "addTransition");

    final State existing = sourceEntry.transitionTable.get(symbol);
    if (existing == null) {
      sourceEntry.transitionTable.put(symbol, target);
      transitionCount++;
      if (debugEnabled()) {
        logDebug(automatonId, null, String.format("Added transition %s --%s--> %s",
            source.getName(), symbol, target.getName()));
      }
      return;
    }
    if (existing.equals(target)) {
      return;
    }
    switch (config.getDuplicateTransitionPolicy()) {
      case OVERWRITE:
        sourceEntry.transitionTable.put(symbol, target);
        automatonStats.totalOverwrittenTransitions++;
        if (debugEnabled()) {
          logDebug(automatonId, null, String.format("Replaced transition %s --%s--> %s with %s",
              source.getName(), symbol, existing.getName(), target.getName()));
        }
        break;
      case REJECT:
        logError(automatonId, null,
            String.format("Rejected transition %s --%s--> %s, already leads to %s",
                source.getName(), symbol, target.getName(), existing.getName()));
        throw new AutomatonException(Code.DUPLICATE_TRANSITION, String.format(
            "State %s already has a transition on %s", source.getName(), symbol));
      default:
        throw new AutomatonException(Code.INVALID_AUTOMATON_CONFIG);
    }
  }

  @Override
  public void setStart(final State state) throws AutomatonException {
    lookupEntry(state, "setStart");
    startState = state;
    primaryRun.relocate(state);
    logInfo(automatonId, null, "Designated start state " + state);
  }

  @Override
  public void addEnd(final State state) throws AutomatonException {
    final StateEntry<T> entry = lookupEntry(state, "addEnd");
    if (!entry.accepting) {
      entry.accepting = true;
      if (debugEnabled()) {
        logDebug(automatonId, null, "Marked accepting state " + state);
      }
    }
  }

  @Override
  public void consume(final T symbol) {
    primaryRun.consume(symbol);
  }

  @Override
  public void consumeAll(final Iterable<? extends T> symbols) {
    primaryRun.consumeAll(symbols);
  }

  @Override
  public void restart() {
    primaryRun.restart();
  }

  @Override
  public boolean accepted() {
    return primaryRun.accepted();
  }

  @Override
  public Optional<State> current() {
    return primaryRun.current();
  }

  @Override
  public boolean matches(final Iterable<? extends T> input) {
    final AutomatonRun<T> run = newRun();
    run.consumeAll(input);
    return run.accepted();
  }

  @Override
  public AutomatonRun<T> newRun() {
    final AutomatonRun<T> run = new AutomatonRun<>(this);
    automatonStats.totalRunsStarted++;
    if (debugEnabled()) {
      logDebug(automatonId, run.getId(), "Started run at " + startState);
    }
    return run;
  }

  @Override
  public Optional<State> start() {
    return Optional.ofNullable(startState);
  }

  @Override
  public int stateCount() {
    return stateArena.size();
  }

  @Override
  public int transitionCount() {
    return transitionCount;
  }

  @Override
  public List<State> states() {
    final List<State> states = new ArrayList<>(stateArena.size());
    for (final StateEntry<T> entry : stateArena) {
      states.add(entry.state);
    }
    return Collections.unmodifiableList(states);
  }

  @Override
  public boolean isAccepting(final State state) {
    final StateEntry<T> entry = findEntry(state);
    return entry != null && entry.accepting;
  }

  @Override
  public Set<State> acceptingStates() {
    final Set<State> accepting = new LinkedHashSet<>();
    for (final StateEntry<T> entry : stateArena) {
      if (entry.accepting) {
        accepting.add(entry.state);
      }
    }
    return Collections.unmodifiableSet(accepting);
  }

  @Override
  public Optional<State> next(final State state, final T symbol) {
    return Optional.ofNullable(lookupTarget(state, symbol));
  }

  @Override
  public List<Transition<T>> transitions(final State source) throws AutomatonException {
    final StateEntry<T> entry = lookupEntry(source, "transitions");
    final List<Transition<T>> transitions = new ArrayList<>(entry.transitionTable.size());
    for (final Map.Entry<T, State> transition : entry.transitionTable.entrySet()) {
      transitions.add(new Transition<>(source, transition.getValue(), transition.getKey()));
    }
    return Collections.unmodifiableList(transitions);
  }

  @Override
  public String getId() {
    return automatonId;
  }

  @Override
  public AutomatonConfiguration getConfiguration() {
    return config;
  }

  @Override
  public AutomatonStatistics getStatistics() {
    return automatonStats.snapshot(stateArena.size(), transitionCount, acceptingStates().size());
  }

  /**
   * Transition function used by every run. Returns null when state is unknown or has no transition
   * on symbol.
   */
  State lookupTarget(final State state, final T symbol) {
    final StateEntry<T> entry = findEntry(state);
    if (entry == null) {
      return null;
    }
    return entry.transitionTable.get(symbol);
  }

  State startState() {
    return startState;
  }

  private State allocateState(final String name) {
    final int index = stateArena.size();
    final State state = new State(automatonId, index, name != null ? name : "S" + index);
    stateArena.add(new StateEntry<>(state));
    if (debugEnabled()) {
      logDebug(automatonId, null, "Allocated " + state);
    }
    return state;
  }

  private StateEntry<T> findEntry(final State state) {
    if (state == null || !automatonId.equals(state.getAutomatonId()) || state.getIndex() < 0
        || state.getIndex() >= stateArena.size()) {
      return null;
    }
    return stateArena.get(state.getIndex());
  }

  private StateEntry<T> lookupEntry(final State state, final String operation)
      throws AutomatonException {
    final StateEntry<T> entry = findEntry(state);
    if (entry == null) {
      logError(automatonId, null,
          String.format("%s referenced a state this automaton never allocated: %s", operation,
              state));
      throw new AutomatonException(Code.INVALID_STATE,
          "Automaton id:" + automatonId + " has no state " + state);
    }
    return entry;
  }

  /**
   * Callers check this before building a debug message, so symbols are not rendered per step.
   */
  static boolean debugEnabled() {
    return logger.isDebugEnabled();
  }

  static void logError(final String automatonId, final String runId, final String message) {
    logger.error(new StringBuilder().append("[a:").append(automatonId).append("][r:").append(runId)
        .append("] ").append(message).toString());
  }

  static void logInfo(final String automatonId, final String runId, final String message) {
    logger.info(new StringBuilder().append("[a:").append(automatonId).append("][r:").append(runId)
        .append("] ").append(message).toString());
  }

  static void logDebug(final String automatonId, final String runId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[a:").append(automatonId).append("][r:")
          .append(runId).append("] ").append(message).toString());
    }
  }

  /**
   * One slot of the state arena. The transition table preserves the order in which symbols were
   * first registered, an overwrite keeps the symbol's original position.
   */
  private final static class StateEntry<T> {
    private final State state;
    private final Map<T, State> transitionTable = new LinkedHashMap<>();
    private boolean accepting;

    private StateEntry(final State state) {
      this.state = state;
    }
  }

}
