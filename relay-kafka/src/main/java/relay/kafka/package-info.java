/**
 * Apache Kafka {@link relay.sink.DeliverySink} adapter.
 *
 * <pre>{@code
 * KafkaSinkConfig config = KafkaSinkConfig.builder()
 *     .bootstrapServers("broker:9092")
 *     .topic("game-events")
 *     .build();
 * DeliveryCoordinator coordinator = DeliveryCoordinator.builder()
 *     .sink(new KafkaDeliverySink(config))
 *     .build();
 * }</pre>
 */
package relay.kafka;
