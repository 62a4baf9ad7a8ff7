package io.calcshell.shell.cli;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/** Bounded record of successful evaluations in the current REPL session. */
public final class CalculationHistory {

  public record Entry(String expression, double result) {}

  private final int capacity;
  private final Deque<Entry> entries = new ArrayDeque<>();

  public CalculationHistory(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive: " + capacity);
    }
    this.capacity = capacity;
  }

  public void add(String expression, double result) {
    if (entries.size() == capacity) {
      entries.removeFirst();
    }
    entries.addLast(new Entry(expression, result));
  }

  /** Up to {@code n} most recent entries, oldest first. */
  public List<Entry> recent(int n) {
    List<Entry> all = new ArrayList<>(entries);
    return all.subList(Math.max(0, all.size() - n), all.size());
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }
}
