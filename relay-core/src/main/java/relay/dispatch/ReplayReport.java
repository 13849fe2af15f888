package relay.dispatch;

/**
 * Result of {@link DeliveryCoordinator#replay(int)}.
 *
 * @param delivered entries re-delivered and removed from the dead letter buffer
 * @param returned  entries put back into the buffer for a later replay
 * @param dropped   entries removed without delivery (rejected, or replay cap reached)
 */
public record ReplayReport(int delivered, int returned, int dropped) {

  public static final ReplayReport EMPTY = new ReplayReport(0, 0, 0);

  public ReplayReport {
    if (delivered < 0 || returned < 0 || dropped < 0) {
      throw new IllegalArgumentException("counts must be >= 0");
    }
  }

  /**
   * Returns the number of entries the replay claimed.
   *
   * @return {@code delivered + returned + dropped}
   */
  public int total() {
    return delivered + returned + dropped;
  }
}
