/**
 * Spring Boot auto-configuration for event delivery.
 *
 * <p>Add {@code relay-spring-boot-starter} to the classpath and configure under the
 * {@code relay.*} prefix:
 *
 * <pre>{@code
 * relay:
 *   sink:
 *     type: kafka
 *   kafka:
 *     bootstrap-servers: broker:9092
 *     topic: game-events
 *   retry:
 *     max-attempts: 3
 *   circuit-breaker:
 *     failure-threshold: 5
 *     cool-down: 30s
 * }</pre>
 *
 * @see relay.spring.boot.RelayProperties
 */
package relay.spring.boot;
