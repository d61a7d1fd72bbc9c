package io.retrygate.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryGatePropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(RetryGateProperties.class);
            assertTrue(props.isEnabled());
            assertEquals(Duration.ofSeconds(2), props.getRedeliveryDelay());
            assertEquals("retry", props.getClassifier().getRetryToken());
            assertEquals("/", props.getClassifier().getSeparator());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("retry.gate", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "retry-gate.enabled=false",
                "retry-gate.redelivery-delay=500ms",
                "retry-gate.classifier.retry-token=dlq",
                "retry-gate.classifier.separator=.",
                "retry-gate.metrics.enabled=false",
                "retry-gate.metrics.name-prefix=edge.gate"
        ).run(ctx -> {
            var props = ctx.getBean(RetryGateProperties.class);
            assertFalse(props.isEnabled());
            assertEquals(Duration.ofMillis(500), props.getRedeliveryDelay());
            assertEquals("dlq", props.getClassifier().getRetryToken());
            assertEquals(".", props.getClassifier().getSeparator());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("edge.gate", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(RetryGateProperties.class)
    static class PropsConfig {
    }
}
