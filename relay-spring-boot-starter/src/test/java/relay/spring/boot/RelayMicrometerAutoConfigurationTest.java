package relay.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import relay.Batch;
import relay.EventRecord;
import relay.EventType;
import relay.dispatch.DeliveryCoordinator;
import relay.micrometer.MicrometerMetricsExporter;
import relay.spi.MetricsExporter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RelayMicrometerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    RelayMicrometerAutoConfiguration.class, RelayAutoConfiguration.class))
            .withUserConfiguration(MeterRegistryConfig.class);

    @Test
    void createsMicrometerExporterByDefault() {
        runner.run(ctx -> {
            assertTrue(ctx.containsBean("micrometerMetricsExporter"));
            assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
        });
    }

    @Test
    void respectsCustomNamePrefix() {
        runner.withPropertyValues("relay.metrics.name-prefix=analytics.relay").run(ctx -> {
            var registry = ctx.getBean(MeterRegistry.class);
            assertNotNull(registry.find("analytics.relay.submission.delivered").counter());
        });
    }

    @Test
    void coordinatorRecordsIntoRegistry() {
        runner.run(ctx -> {
            var coordinator = ctx.getBean(DeliveryCoordinator.class);
            coordinator.handle(Batch.single(EventRecord.builder(EventType.INSTALL).build()));

            var registry = ctx.getBean(MeterRegistry.class);
            assertEquals(1.0, registry.get("relay.submission.delivered").counter().count());
            assertEquals(1.0, registry.get("relay.sink.attempt").counter().count());
        });
    }

    @Test
    void disabledWhenPropertyFalse() {
        runner.withPropertyValues("relay.metrics.enabled=false").run(ctx -> {
            assertFalse(ctx.containsBean("micrometerMetricsExporter"));
            assertTrue(ctx.containsBean("deliveryCoordinator"));
        });
    }

    @Test
    void backsOffWhenCustomMetricsExporterPresent() {
        runner.withUserConfiguration(CustomExporterConfig.class).run(ctx -> {
            var exporter = ctx.getBean(MetricsExporter.class);
            assertFalse(exporter instanceof MicrometerMetricsExporter);
        });
    }

    @Configuration
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration
    static class CustomExporterConfig {
        @Bean
        MetricsExporter customExporter() {
            return MetricsExporter.NOOP;
        }
    }
}
