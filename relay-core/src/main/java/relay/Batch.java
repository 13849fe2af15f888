package relay;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, ordered, non-empty sequence of {@link EventRecord}s submitted together.
 *
 * <p>Order is never changed: {@link #split(int)} yields sub-batches whose concatenation
 * reconstructs this batch exactly.
 */
public final class Batch implements Iterable<EventRecord> {
  private final List<EventRecord> records;

  private Batch(List<EventRecord> records) {
    this.records = records;
  }

  /**
   * Creates a batch from the given records, in order.
   *
   * @param records the records; must not be empty or contain nulls
   * @return a new batch
   */
  public static Batch of(List<EventRecord> records) {
    Objects.requireNonNull(records, "records");
    if (records.isEmpty()) {
      throw new IllegalArgumentException("batch cannot be empty");
    }
    List<EventRecord> copy = new ArrayList<>(records.size());
    for (EventRecord record : records) {
      copy.add(Objects.requireNonNull(record, "records cannot contain null"));
    }
    return new Batch(Collections.unmodifiableList(copy));
  }

  public static Batch of(EventRecord... records) {
    return of(List.of(records));
  }

  /**
   * Wraps a single record as a batch of one.
   *
   * @param record the record
   * @return a batch of size 1
   */
  public static Batch single(EventRecord record) {
    return new Batch(List.of(Objects.requireNonNull(record, "record")));
  }

  public List<EventRecord> records() {
    return records;
  }

  public int size() {
    return records.size();
  }

  public EventRecord get(int index) {
    return records.get(index);
  }

  /**
   * Returns the first record's id, used to identify the batch in logs.
   *
   * @return the id of the first record
   */
  public String firstEventId() {
    return records.get(0).eventId();
  }

  /**
   * Splits this batch into consecutive sub-batches of at most {@code maxSize} records.
   *
   * @param maxSize maximum records per sub-batch; must be &gt; 0
   * @return this batch alone when it already fits, otherwise the ordered sub-batches
   */
  public List<Batch> split(int maxSize) {
    if (maxSize <= 0) {
      throw new IllegalArgumentException("maxSize must be > 0, got: " + maxSize);
    }
    if (records.size() <= maxSize) {
      return List.of(this);
    }
    List<Batch> parts = new ArrayList<>((records.size() + maxSize - 1) / maxSize);
    for (int from = 0; from < records.size(); from += maxSize) {
      int to = Math.min(records.size(), from + maxSize);
      parts.add(new Batch(records.subList(from, to)));
    }
    return Collections.unmodifiableList(parts);
  }

  @Override
  public Iterator<EventRecord> iterator() {
    return records.iterator();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    return o instanceof Batch other && records.equals(other.records);
  }

  @Override
  public int hashCode() {
    return records.hashCode();
  }

  @Override
  public String toString() {
    return "Batch{size=" + records.size() + ", first=" + firstEventId() + '}';
  }
}
