package relay.dead;

import relay.Batch;
import relay.SubmissionOutcome.DeferReason;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded, in-memory FIFO of deferred sub-batches awaiting replay.
 *
 * <p>When full, {@link #enqueue} evicts the oldest entry and reports it to the
 * {@link DeadLetterListener} as an overflow: evictions are data loss and are always logged.
 * {@link #replay(int)} hands out entries lazily; an entry leaves the buffer for good only when
 * its replay is confirmed or it is dropped. Entries returned after a failed replay go back to
 * their original position at the front.
 *
 * <p>This class is thread-safe. Each operation holds the instance lock only for its own
 * bookkeeping, never across a sink call. Size changes are reported to
 * {@link DeadLetterListener#onSizeChanged(int)} while the lock is held.
 *
 * @see ReplaySession
 */
public final class DeadLetterBuffer {
  private static final Logger logger = Logger.getLogger(DeadLetterBuffer.class.getName());

  private final int capacity;
  private final int maxReplayAttempts;
  private final Clock clock;
  private final DeadLetterListener listener;

  // Keyed by arrival sequence: iteration order is FIFO, and a returned entry regains its slot.
  private final TreeMap<Long, DeadLetterEntry> entries = new TreeMap<>();
  private long nextSequence;
  private int inReplay;

  public DeadLetterBuffer(int capacity, int maxReplayAttempts) {
    this(capacity, maxReplayAttempts, Clock.systemUTC(), null);
  }

  /**
   * @param capacity          maximum stored entries
   * @param maxReplayAttempts failed replays an entry survives before it is dropped
   * @param clock             time source for enqueue timestamps
   * @param listener          data-loss and size notifications, or {@code null}
   */
  public DeadLetterBuffer(int capacity, int maxReplayAttempts, Clock clock,
      DeadLetterListener listener) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
    }
    if (maxReplayAttempts < 0) {
      throw new IllegalArgumentException("maxReplayAttempts must be >= 0, got: " + maxReplayAttempts);
    }
    this.capacity = capacity;
    this.maxReplayAttempts = maxReplayAttempts;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.listener = listener != null ? listener : DeadLetterListener.NOOP;
  }

  /**
   * Creates an entry for a deferred batch, timestamped now, and appends it.
   *
   * @param batch     the undelivered records
   * @param reason    why delivery was deferred
   * @param lastError last sink error detail, or {@code null}
   * @return the stored entry
   */
  public DeadLetterEntry enqueue(Batch batch, DeferReason reason, String lastError) {
    DeadLetterEntry entry = new DeadLetterEntry(batch, reason, lastError, clock.instant(), 0);
    enqueue(entry);
    return entry;
  }

  /**
   * Appends an entry, evicting the oldest stored entry first if the buffer is full.
   *
   * @param entry the entry to store
   */
  public void enqueue(DeadLetterEntry entry) {
    Objects.requireNonNull(entry, "entry");
    List<DeadLetterEntry> evicted;
    synchronized (this) {
      entries.put(nextSequence++, entry);
      evicted = trimToCapacity();
      publishSize();
    }
    reportEvictions(evicted);
  }

  /**
   * Opens a replay session over at most {@code limit} entries, taken from the front as the
   * session is iterated. An empty buffer yields an empty session.
   *
   * @param limit maximum entries to hand out
   * @return a new session; close it to return unresolved entries
   */
  public ReplaySession replay(int limit) {
    if (limit < 0) {
      throw new IllegalArgumentException("limit must be >= 0, got: " + limit);
    }
    return new ReplaySession(this, limit);
  }

  /**
   * Returns the number of stored entries, excluding those currently out on replay.
   *
   * @return current entry count
   */
  public synchronized int size() {
    return entries.size();
  }

  /**
   * Returns the number of entries handed to replay sessions and not yet resolved.
   *
   * @return entries out on replay
   */
  public synchronized int inReplay() {
    return inReplay;
  }

  public int capacity() {
    return capacity;
  }

  public int maxReplayAttempts() {
    return maxReplayAttempts;
  }

  /**
   * Returns the stored entries, oldest first.
   *
   * @return snapshot of stored entries
   */
  public synchronized List<DeadLetterEntry> snapshot() {
    return List.copyOf(entries.values());
  }

  // ── Replay session callbacks ────────────────────────────────────

  synchronized Map.Entry<Long, DeadLetterEntry> claimNext() {
    Map.Entry<Long, DeadLetterEntry> head = entries.pollFirstEntry();
    if (head != null) {
      inReplay++;
      publishSize();
    }
    return head;
  }

  synchronized void confirm(long sequence) {
    inReplay--;
  }

  void release(long sequence, DeadLetterEntry entry) {
    putBack(sequence, entry);
  }

  boolean retryLater(long sequence, DeadLetterEntry entry, String error) {
    DeadLetterEntry charged = entry.withFailedReplay(error);
    if (charged.retryCount() > maxReplayAttempts) {
      drop(sequence, charged, "replay attempts exhausted (" + maxReplayAttempts + ")");
      return false;
    }
    putBack(sequence, charged);
    return true;
  }

  void drop(long sequence, DeadLetterEntry entry, String reason) {
    synchronized (this) {
      inReplay--;
    }
    logger.log(Level.SEVERE, "Dropped dead letter entry of " + entry.batch().size()
        + " record(s) starting at " + entry.batch().firstEventId() + ": " + reason
        + " (last error: " + entry.lastError() + ")");
    listener.onDropped(entry, reason);
  }

  private void putBack(long sequence, DeadLetterEntry entry) {
    List<DeadLetterEntry> evicted;
    synchronized (this) {
      inReplay--;
      entries.put(sequence, entry);
      evicted = trimToCapacity();
      publishSize();
    }
    reportEvictions(evicted);
  }

  // Called under the lock so listeners observe sizes in mutation order.
  private void publishSize() {
    try {
      listener.onSizeChanged(entries.size());
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Dead letter size listener failed", e);
    }
  }

  private List<DeadLetterEntry> trimToCapacity() {
    List<DeadLetterEntry> evicted = List.of();
    while (entries.size() > capacity) {
      if (evicted.isEmpty()) {
        evicted = new ArrayList<>(1);
      }
      evicted.add(entries.pollFirstEntry().getValue());
    }
    return evicted;
  }

  private void reportEvictions(List<DeadLetterEntry> evicted) {
    for (DeadLetterEntry entry : evicted) {
      Instant enqueuedAt = entry.enqueuedAt();
      logger.log(Level.SEVERE, "Dead letter buffer overflow (capacity " + capacity
          + "): evicted " + entry.batch().size() + " record(s) starting at "
          + entry.batch().firstEventId() + ", enqueued at " + enqueuedAt);
      listener.onOverflow(entry);
    }
  }
}
