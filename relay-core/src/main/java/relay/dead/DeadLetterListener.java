package relay.dead;

/**
 * Receives data-loss notifications from a {@link DeadLetterBuffer}.
 */
public interface DeadLetterListener {

    DeadLetterListener NOOP = new DeadLetterListener() {
        @Override
        public void onOverflow(DeadLetterEntry evicted) {
        }

        @Override
        public void onDropped(DeadLetterEntry dropped, String reason) {
        }
    };

    /**
     * The buffer was full and evicted its oldest entry.
     *
     * @param evicted the entry that was lost
     */
    void onOverflow(DeadLetterEntry evicted);

    /**
     * An entry left the buffer without being delivered: its replay cap was reached or the
     * sink rejected it permanently.
     *
     * @param dropped the entry that was lost
     * @param reason  why it was dropped
     */
    void onDropped(DeadLetterEntry dropped, String reason);

    /**
     * The buffer's entry count changed. Called while the buffer's lock is held, so
     * successive calls arrive in the order the changes happened; keep it cheap.
     *
     * @param size entries currently stored
     */
    default void onSizeChanged(int size) {
    }
}
