package com.github.automaton;

import java.util.Objects;

/**
 * Read-only view of a single labeled arc source --symbol--> target. Handed out by
 * {@link Automaton#transitions(State)}; mutating the graph goes through
 * {@link Automaton#addTransition(State, State, Object)} only.
 */
public final class Transition<T> {
  private final State source;
  private final State target;
  private final T symbol;

  Transition(final State source, final State target, final T symbol) {
    this.source = source;
    this.target = target;
    this.symbol = symbol;
  }

  public State getSource() {
    return source;
  }

  public State getTarget() {
    return target;
  }

  public T getSymbol() {
    return symbol;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Transition)) {
      return false;
    }
    Transition<?> other = (Transition<?>) o;
    return Objects.equals(source, other.source) && Objects.equals(target, other.target)
        && Objects.equals(symbol, other.symbol);
  }

  @Override
  public int hashCode() {
    return Objects.hash(source, target, symbol);
  }

  @Override
  public String toString() {
    return "Transition [source=" + source.getName() + ", target=" + target.getName() + ", symbol="
        + symbol + "]";
  }
}
