package relay.dead;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * A lazy, finite pass over the front of a {@link DeadLetterBuffer}.
 *
 * <p>Entries are claimed from the buffer one at a time as the session is iterated, up to the
 * session's limit. Each {@link Item} is resolved with {@link Item#confirm()},
 * {@link Item#retryLater(String)}, {@link Item#release()} or {@link Item#discard(String)}.
 * Closing the session puts every unresolved item back in its original position without
 * charging a replay attempt, so an interrupted replay can simply be started again.
 *
 * <p>A session is meant to be driven by one thread.
 */
public final class ReplaySession implements Iterable<ReplaySession.Item>, AutoCloseable {

  private final DeadLetterBuffer buffer;
  private final int limit;
  private final Map<Long, Item> unresolved = new LinkedHashMap<>();
  private int claimed;
  private boolean closed;

  ReplaySession(DeadLetterBuffer buffer, int limit) {
    this.buffer = buffer;
    this.limit = limit;
  }

  /**
   * Returns an iterator that claims entries lazily. A new iterator continues where the
   * previous one stopped; the limit applies to the session as a whole.
   *
   * @return iterator over claimed items
   */
  @Override
  public Iterator<Item> iterator() {
    return new Iterator<>() {
      private Item next;

      @Override
      public boolean hasNext() {
        if (next == null) {
          next = claim();
        }
        return next != null;
      }

      @Override
      public Item next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        Item item = next;
        next = null;
        return item;
      }
    };
  }

  /**
   * Returns the number of entries this session has claimed so far.
   *
   * @return claimed entries
   */
  public int claimed() {
    return claimed;
  }

  /**
   * Returns every unresolved item to the buffer. Idempotent.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    List<Item> pending = new ArrayList<>(unresolved.values());
    unresolved.clear();
    for (Item item : pending) {
      item.resolved = true;
      buffer.release(item.sequence, item.entry);
    }
  }

  private Item claim() {
    if (closed || claimed >= limit) {
      return null;
    }
    Map.Entry<Long, DeadLetterEntry> head = buffer.claimNext();
    if (head == null) {
      return null;
    }
    claimed++;
    Item item = new Item(head.getKey(), head.getValue());
    unresolved.put(item.sequence, item);
    return item;
  }

  private void resolve(Item item) {
    if (item.resolved) {
      throw new IllegalStateException("replay item already resolved");
    }
    item.resolved = true;
    unresolved.remove(item.sequence);
  }

  /**
   * One claimed entry.
   */
  public final class Item {
    private final long sequence;
    private final DeadLetterEntry entry;
    private boolean resolved;

    private Item(long sequence, DeadLetterEntry entry) {
      this.sequence = sequence;
      this.entry = Objects.requireNonNull(entry, "entry");
    }

    public DeadLetterEntry entry() {
      return entry;
    }

    /**
     * The entry was re-delivered; remove it from the buffer for good.
     */
    public void confirm() {
      resolve(this);
      buffer.confirm(sequence);
    }

    /**
     * Re-delivery failed again; put the entry back at its place with one more failed replay,
     * or drop it if its replay cap is exceeded.
     *
     * @param error the failure detail, or {@code null}
     * @return {@code true} if the entry went back to the buffer, {@code false} if it was dropped
     */
    public boolean retryLater(String error) {
      resolve(this);
      return buffer.retryLater(sequence, entry, error);
    }

    /**
     * Re-delivery was not attempted; put the entry back unchanged.
     */
    public void release() {
      resolve(this);
      buffer.release(sequence, entry);
    }

    /**
     * The entry can never be delivered; drop it and report the loss.
     *
     * @param reason why it is dropped
     */
    public void discard(String reason) {
      resolve(this);
      buffer.drop(sequence, entry, reason);
    }
  }
}
