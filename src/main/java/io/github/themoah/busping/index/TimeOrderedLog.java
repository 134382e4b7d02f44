package io.github.themoah.busping.index;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.ToLongFunction;

/**
 * Append-only sequence of timestamped elements, expired from the front.
 *
 * <p>Elements can only be added at the tail and removed from the head, so the log keeps
 * insertion order. {@link #pruneBefore(long)} stops at the first element that is not
 * expired; it is not a filter. Not thread-safe: guarded by the owning index.
 *
 * @param <T> element type
 */
final class TimeOrderedLog<T> {

  private final ArrayDeque<T> elements = new ArrayDeque<>();
  private final ToLongFunction<T> timestampOf;

  TimeOrderedLog(ToLongFunction<T> timestampOf) {
    this.timestampOf = timestampOf;
  }

  void append(T element) {
    elements.addLast(element);
  }

  /**
   * Removes head elements while their timestamp is below {@code cutoff}.
   *
   * @return number of removed elements
   */
  int pruneBefore(long cutoff) {
    int removed = 0;
    while (!elements.isEmpty() && timestampOf.applyAsLong(elements.peekFirst()) < cutoff) {
      elements.removeFirst();
      removed++;
    }
    return removed;
  }

  void forEach(Consumer<? super T> action) {
    elements.forEach(action);
  }

  List<T> snapshot() {
    return new ArrayList<>(elements);
  }

  boolean isEmpty() {
    return elements.isEmpty();
  }

  int size() {
    return elements.size();
  }
}
