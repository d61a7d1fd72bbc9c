package io.retrygate.spring.boot;

import io.retrygate.RetryGate;
import io.retrygate.classify.TopicClassifier;
import io.retrygate.micrometer.MicrometerMetricsExporter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the retry gate.
 *
 * @see RetryGateAutoConfiguration
 */
@ConfigurationProperties(prefix = "retry-gate")
public class RetryGateProperties {

    /**
     * Whether to create the {@link RetryGate} bean.
     */
    private boolean enabled = true;

    /**
     * Wait between attempts to redeliver a deferred normal message.
     */
    private Duration redeliveryDelay = RetryGate.DEFAULT_REDELIVERY_DELAY;

    private final Classifier classifier = new Classifier();
    private final Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getRedeliveryDelay() {
        return redeliveryDelay;
    }

    public void setRedeliveryDelay(Duration redeliveryDelay) {
        this.redeliveryDelay = redeliveryDelay;
    }

    public Classifier getClassifier() {
        return classifier;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Classifier {
        private String retryToken = TopicClassifier.DEFAULT_RETRY_TOKEN;
        private String separator = TopicClassifier.DEFAULT_SEPARATOR;

        public String getRetryToken() {
            return retryToken;
        }

        public void setRetryToken(String retryToken) {
            this.retryToken = retryToken;
        }

        public String getSeparator() {
            return separator;
        }

        public void setSeparator(String separator) {
            this.separator = separator;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = MicrometerMetricsExporter.DEFAULT_PREFIX;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
