/**
 * Service Provider Interfaces (SPI) for extending relay.
 *
 * @see relay.spi.MetricsExporter
 * @see relay.sink.DeliverySink
 */
package relay.spi;
