package io.retrygate.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.retrygate.RetryGate;
import io.retrygate.micrometer.MicrometerMetricsExporter;
import io.retrygate.spi.BrokerPublisher;
import io.retrygate.spi.MetricsExporter;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration;
import org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration;
import org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryGateMicrometerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(RetryGateMicrometerAutoConfiguration.class))
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
        runner.withPropertyValues("retry-gate.metrics.name-prefix=edge.gate").run(ctx -> {
            var registry = ctx.getBean(MeterRegistry.class);
            assertNotNull(registry.find("edge.gate.normal.deferred").counter());
        });
    }

    @Test
    void disabledWhenPropertyFalse() {
        runner.withPropertyValues("retry-gate.metrics.enabled=false").run(ctx ->
                assertFalse(ctx.containsBean("micrometerMetricsExporter")));
    }

    @Test
    void backsOffWhenCustomMetricsExporterPresent() {
        runner.withUserConfiguration(CustomExporterConfig.class).run(ctx ->
                assertFalse(ctx.getBean(MetricsExporter.class) instanceof MicrometerMetricsExporter));
    }

    @Test
    void gateReportsThroughMicrometer() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(
                        RetryGateMicrometerAutoConfiguration.class, RetryGateAutoConfiguration.class))
                .withUserConfiguration(MeterRegistryConfig.class, PublisherConfig.class)
                .run(ctx -> {
                    ctx.getBean(RetryGate.class).onInbound("orders/retry");
                    var registry = ctx.getBean(MeterRegistry.class);
                    assertEquals(1.0, registry.find("retry.gate.retry.accepted").counter().count());
                    assertEquals(1.0, registry.find("retry.gate.retry.pending").gauge().value());
                });
    }

    @Test
    void createsExporterWhenRegistryComesFromActuator() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(
                        MetricsAutoConfiguration.class,
                        SimpleMetricsExportAutoConfiguration.class,
                        CompositeMeterRegistryAutoConfiguration.class,
                        RetryGateMicrometerAutoConfiguration.class,
                        RetryGateAutoConfiguration.class))
                .withUserConfiguration(PublisherConfig.class)
                .run(ctx -> {
                    assertTrue(ctx.containsBean("micrometerMetricsExporter"));
                    ctx.getBean(RetryGate.class).onInbound("orders/retry");
                    var registry = ctx.getBean(MeterRegistry.class);
                    assertEquals(1.0, registry.find("retry.gate.retry.accepted").counter().count());
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
        MetricsExporter customMetricsExporter() {
            return MetricsExporter.NOOP;
        }
    }

    @Configuration
    static class PublisherConfig {
        @Bean
        BrokerPublisher brokerPublisher() {
            return message -> CompletableFuture.completedFuture(null);
        }
    }
}
