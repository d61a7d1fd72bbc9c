package io.retrygate.spring.boot;

import io.retrygate.RetryGate;
import io.retrygate.classify.TopicClassifier;
import io.retrygate.spi.BrokerPublisher;
import io.retrygate.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the retry gate.
 *
 * <p>Builds a {@link RetryGate} around the application's {@link BrokerPublisher} using
 * {@link RetryGateProperties}. The gate is closed with the context, which cancels every
 * deferred delivery still on the timer.
 *
 * @see RetryGateProperties
 * @see RetryGateMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(RetryGate.class)
@ConditionalOnBean(BrokerPublisher.class)
@ConditionalOnProperty(prefix = "retry-gate", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(RetryGateProperties.class)
public class RetryGateAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public TopicClassifier topicClassifier(RetryGateProperties props) {
    return new TopicClassifier(
        props.getClassifier().getSeparator(), props.getClassifier().getRetryToken());
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public RetryGate retryGate(RetryGateProperties props,
      BrokerPublisher publisher,
      TopicClassifier classifier,
      ObjectProvider<MetricsExporter> metricsProvider) {

    var builder = RetryGate.builder()
        .publisher(publisher)
        .classifier(classifier)
        .redeliveryDelay(props.getRedeliveryDelay());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }
}
