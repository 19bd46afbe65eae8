package com.github.automaton;

import java.util.ArrayList;
import java.util.List;

import org.openjdk.jmh.annotations.Benchmark;

import com.github.automaton.Automaton.AutomatonBuilder;

/**
 * Builds a binary divisible-by-3 automaton and feeds it a fixed input. The JMH harness for it is
 * generated at test-compile time; main() runs a single iteration by hand. Not part of the unit
 * test run.
 */
public class AutomatonBenchmark {

  @Benchmark
  public boolean testAutomatonSimulation() throws AutomatonException {
    // 1. prep states, index == remainder
    final Automaton<Integer> automaton = AutomatonBuilder.<Integer>newBuilder().build();
    final State[] remainders = {automaton.addState(), automaton.addState(), automaton.addState()};
    automaton.setStart(remainders[0]);
    automaton.addEnd(remainders[0]);

    // 2. remainder r on bit b goes to (2r + b) mod 3
    for (int remainder = 0; remainder < 3; remainder++) {
      for (int bit = 0; bit < 2; bit++) {
        automaton.addTransition(remainders[remainder], remainders[(2 * remainder + bit) % 3], bit);
      }
    }

    // 3. consume
    final List<Integer> bits = new ArrayList<>();
    for (int iter = 0; iter < 1024; iter++) {
      bits.add(iter & 1);
    }
    automaton.consumeAll(bits);
    return automaton.accepted();
  }

  public static void main(String args[]) throws AutomatonException {
    AutomatonBenchmark benchmark = new AutomatonBenchmark();
    benchmark.testAutomatonSimulation();
  }

}
