package com.github.automaton;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Optional;

import org.junit.Test;

import com.github.automaton.Automaton.AutomatonBuilder;

/**
 * Tests for independent runs over a shared automaton graph.
 */
public class AutomatonRunTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j2.properties");
  }

  @Test
  public void testRunsAreIndependent() throws AutomatonException {
    // 1. prep a ring s0 -1-> s1 -1-> s2 -1-> s0, s2 accepting
    final Automaton<Integer> automaton = AutomatonBuilder.<Integer>newBuilder().build();
    final State s0 = automaton.addState();
    final State s1 = automaton.addState();
    final State s2 = automaton.addState();
    automaton.setStart(s0);
    automaton.addEnd(s2);
    automaton.addTransition(s0, s1, 1);
    automaton.addTransition(s1, s2, 1);
    automaton.addTransition(s2, s0, 1);

    // 2. open two runs
    final AutomatonRun<Integer> first = automaton.newRun();
    final AutomatonRun<Integer> second = automaton.newRun();
    assertNotEquals(first.getId(), second.getId());
    assertEquals(Optional.of(s0), first.current());
    assertEquals(Optional.of(s0), second.current());

    // 3. walk them apart
    first.consumeAll(Arrays.asList(1, 1));
    second.consume(1);
    assertEquals(Optional.of(s2), first.current());
    assertTrue(first.accepted());
    assertEquals(Optional.of(s1), second.current());
    assertFalse(second.accepted());

    // 4. the automaton's own cursor never moved
    assertEquals(Optional.of(s0), automaton.current());

    // 5. restart one run only
    first.restart();
    assertEquals(Optional.of(s0), first.current());
    assertEquals(Optional.of(s1), second.current());
  }

  @Test
  public void testRunSeesLaterTransitions() throws AutomatonException {
    final Automaton<String> automaton = AutomatonBuilder.<String>newBuilder().build();
    final State s0 = automaton.addState();
    final State s1 = automaton.addState();
    automaton.setStart(s0);
    final AutomatonRun<String> run = automaton.newRun();

    run.consume("next");
    assertEquals(Optional.of(s0), run.current());

    automaton.addTransition(s0, s1, "next");
    run.consume("next");
    assertEquals(Optional.of(s1), run.current());
  }

  @Test
  public void testRunOpenedBeforeStart() throws AutomatonException {
    final Automaton<String> automaton = AutomatonBuilder.<String>newBuilder().build();
    final AutomatonRun<String> run = automaton.newRun();
    final State s0 = automaton.addState();
    assertFalse(run.current().isPresent());

    // setStart only moves the automaton's own cursor, runs pick it up on restart
    automaton.setStart(s0);
    assertFalse(run.current().isPresent());
    run.restart();
    assertEquals(Optional.of(s0), run.current());
  }

  @Test
  public void testConsumeDoesNotRenderSymbols() throws AutomatonException {
    // the test logging config keeps debug off
    assertFalse(AutomatonImpl.debugEnabled());

    final Automaton<CountingSymbol> automaton =
        AutomatonBuilder.<CountingSymbol>newBuilder().build();
    final State s0 = automaton.addState();
    final State s1 = automaton.addState();
    final CountingSymbol matching = new CountingSymbol(1, false);
    automaton.addTransition(s0, s1, matching);

    // 1. no current state yet
    final CountingSymbol unmatched = new CountingSymbol(2, false);
    automaton.consume(unmatched);

    // 2. unmatched and matched symbols
    automaton.setStart(s0);
    for (int iter = 0; iter < 1000; iter++) {
      automaton.consume(unmatched);
    }
    automaton.consume(matching);
    assertEquals(Optional.of(s1), automaton.current());
    assertEquals(0, unmatched.renderings);
    assertEquals(0, matching.renderings);

    // 3. a symbol that cannot be rendered at all is still consumed
    automaton.consume(new CountingSymbol(99, true));
    assertEquals(Optional.of(s1), automaton.current());
  }

  @Test
  public void testRunStatistics() throws AutomatonException {
    final Automaton<Character> automaton = AutomatonBuilder.<Character>newBuilder().build();
    final State s0 = automaton.addState();
    final State s1 = automaton.addState();
    automaton.setStart(s0);
    automaton.addTransition(s0, s1, 'a');

    final AutomatonRun<Character> run = automaton.newRun();
    run.consumeAll(Arrays.asList('z', 'a', 'a'));
    run.restart();

    final RunStatistics stats = run.getStatistics();
    assertEquals(run.getId(), stats.getRunId());
    assertEquals(3, stats.getSymbolsConsumed());
    assertEquals(1, stats.getTransitionsTaken());
    assertEquals(2, stats.getUnmatchedSymbols());
    assertEquals(1, stats.getRestarts());
    assertTrue(stats.getAliveTimeMillis() >= 0L);
  }

  /**
   * Symbol that counts how often it is rendered.
   */
  static final class CountingSymbol {
    private final int value;
    private final boolean failOnRender;
    int renderings;

    CountingSymbol(final int value, final boolean failOnRender) {
      this.value = value;
      this.failOnRender = failOnRender;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof CountingSymbol && ((CountingSymbol) obj).value == value;
    }

    @Override
    public int hashCode() {
      return value;
    }

    @Override
    public String toString() {
      renderings++;
      if (failOnRender) {
        throw new IllegalStateException("symbol " + value + " cannot be rendered");
      }
      return "CountingSymbol [value=" + value + "]";
    }
  }

}
