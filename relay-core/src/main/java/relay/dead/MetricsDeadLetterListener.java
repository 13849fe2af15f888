package relay.dead;

import relay.spi.MetricsExporter;

import java.util.Objects;

/**
 * Forwards dead letter buffer events to a {@link MetricsExporter}.
 */
public final class MetricsDeadLetterListener implements DeadLetterListener {
  private final MetricsExporter metrics;

  public MetricsDeadLetterListener(MetricsExporter metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void onOverflow(DeadLetterEntry evicted) {
    metrics.incrementDeadLetterOverflow();
  }

  @Override
  public void onDropped(DeadLetterEntry dropped, String reason) {
    metrics.incrementDeadLetterDropped();
  }

  @Override
  public void onSizeChanged(int size) {
    metrics.recordDeadLetterSize(size);
  }
}
