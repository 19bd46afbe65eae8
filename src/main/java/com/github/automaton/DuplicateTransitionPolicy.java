package com.github.automaton;

/**
 * This represents what the automaton does when a source state receives a second transition on a
 * symbol it already has a transition for.
 */
public enum DuplicateTransitionPolicy {
  // replace the existing transition, the most recent one wins every later lookup
  OVERWRITE,
  // fail with DUPLICATE_TRANSITION and keep the existing transition
  REJECT;
}
