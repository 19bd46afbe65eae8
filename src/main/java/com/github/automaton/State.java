package com.github.automaton;

/**
 * This object represents an immutable handle to a state allocated by an {@link Automaton}. The
 * index is the state's position in the automaton's arena and never changes once allocated. Names are
 * for display only, they play no part in equality.
 */
public final class State implements Comparable<State> {
  final static int maxStateNameLength = 20;

  private final String automatonId;
  private final int index;
  private final String name;

  State(final String automatonId, final int index, final String name) {
    this.automatonId = automatonId;
    this.index = index;
    this.name = name;
  }

  public int getIndex() {
    return index;
  }

  public String getName() {
    return name;
  }

  public String getAutomatonId() {
    return automatonId;
  }

  /**
   * Orders by automaton id, then by index, consistent with equals. States of one automaton
   * therefore order by allocation.
   */
  @Override
  public int compareTo(final State other) {
    final int byAutomaton = automatonId.compareTo(other.automatonId);
    if (byAutomaton != 0) {
      return byAutomaton;
    }
    return Integer.compare(index, other.index);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + ((automatonId == null) ? 0 : automatonId.hashCode());
    result = prime * result + index;
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null) {
      return false;
    }
    if (getClass() != obj.getClass()) {
      return false;
    }
    State other = (State) obj;
    if (automatonId == null) {
      if (other.automatonId != null) {
        return false;
      }
    } else if (!automatonId.equals(other.automatonId)) {
      return false;
    }
    return index == other.index;
  }

  @Override
  public String toString() {
    return "State [index=" + index + ", name=" + name + "]";
  }
}
