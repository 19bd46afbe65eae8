package com.github.automaton;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A simple Deterministic Finite Automaton over a caller-supplied alphabet type T. T only needs
 * equals() and a hashCode() consistent with it.
 *
 * Notes for users:<br>
 * 0a. correctness is the most important virtue of this dfa<br>
 * 0b. less boilerplate code is the next most important virtue<br>
 *
 * 1. this instance is NOT thread-safe. Both construction and simulation mutate it, so callers
 * sharing it across threads must provide their own mutual exclusion<br>
 *
 * 2. states and transitions are append-only. There is no removal; build a fresh automaton if the
 * topology has to change<br>
 *
 * 3. there is no implicit start state. Until {@link #setStart(State)} is called, {@link #current()}
 * is empty, {@link #accepted()} is false and {@link #consume(Object)} does nothing<br>
 *
 * 4. only construction calls throw, and only for state references this automaton never allocated.
 * Simulation calls are total: a symbol without a matching transition leaves the cursor where it
 * is<br>
 *
 * 5. the automaton carries its own cursor. For several independent simulations over the same graph
 * use {@link #newRun()}, every run owns its own cursor and none of them modifies the graph<br>
 */
public interface Automaton<T> {

  ///// Construction API /////
  /**
   * Allocate a new state with no outgoing transitions. Indices are handed out 0, 1, 2, ... in order
   * of allocation.
   */
  State addState();

  /**
   * Allocate a new state with a display name of at most 20 characters.
   */
  State addState(final Optional<String> name) throws AutomatonException;

  /**
   * Register source --symbol--> target. Conflicts with an existing transition on an equal symbol
   * out of source are resolved by the configured {@link DuplicateTransitionPolicy}.
   */
  void addTransition(final State source, final State target, final T symbol)
      throws AutomatonException;

  /**
   * Designate the start state and move this automaton's cursor to it.
   */
  void setStart(final State state) throws AutomatonException;

  /**
   * Mark a state as accepting. Marking it again has no further effect.
   */
  void addEnd(final State state) throws AutomatonException;


  ///// Simulation API /////
  /**
   * Follow the transition labeled symbol out of the current state, if there is one.
   */
  void consume(final T symbol);

  /**
   * Consume every symbol in order.
   */
  void consumeAll(final Iterable<? extends T> symbols);

  /**
   * Move the cursor back to the start state, or to no state at all if none was designated.
   */
  void restart();

  /**
   * Returns true iff the current state is accepting.
   */
  boolean accepted();

  /**
   * Read the current state.
   */
  Optional<State> current();

  /**
   * Run the input from the start state on a throwaway cursor and report whether it ends up in an
   * accepting state. This automaton's own cursor is not touched.
   */
  boolean matches(final Iterable<? extends T> input);

  /**
   * Open an independent cursor over this automaton's graph, positioned at the start state.
   */
  AutomatonRun<T> newRun();


  ///// Graph queries /////
  Optional<State> start();

  int stateCount();

  int transitionCount();

  /**
   * All states in order of allocation.
   */
  List<State> states();

  /**
   * Returns false for states not allocated by this automaton.
   */
  boolean isAccepting(final State state);

  Set<State> acceptingStates();

  /**
   * Evaluate the transition function without moving any cursor.
   */
  Optional<State> next(final State state, final T symbol);

  /**
   * Outgoing transitions of source in the order their symbols were first registered.
   */
  List<Transition<T>> transitions(final State source) throws AutomatonException;


  ///// Non-graph functions /////
  /**
   * Reports the id of this Automaton instance. States carry it to tie them to their automaton.
   */
  String getId();

  AutomatonConfiguration getConfiguration();

  AutomatonStatistics getStatistics();

  /**
   * A simple builder to let users use fluent APIs to build automata.
   */
  public final static class AutomatonBuilder<T> {
    private AutomatonConfiguration config;

    public static <T> AutomatonBuilder<T> newBuilder() {
      return new AutomatonBuilder<>();
    }

    public AutomatonBuilder<T> config(final AutomatonConfiguration config) {
      this.config = config;
      return this;
    }

    public Automaton<T> build() {
      return new AutomatonImpl<>(config != null ? config : AutomatonConfiguration.defaults());
    }

    private AutomatonBuilder() {}
  }

}
