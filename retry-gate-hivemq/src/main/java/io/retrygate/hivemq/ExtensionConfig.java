package io.retrygate.hivemq;

import io.retrygate.RetryGate;
import io.retrygate.classify.TopicClassifier;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings read from {@code retry-gate.properties} in the extension folder.
 *
 * <table>
 *   <tr><th>Key</th><th>Default</th></tr>
 *   <tr><td>{@code redelivery-delay-ms}</td><td>{@code 2000}</td></tr>
 *   <tr><td>{@code retry-token}</td><td>{@code retry}</td></tr>
 *   <tr><td>{@code separator}</td><td>{@code /}</td></tr>
 * </table>
 */
public final class ExtensionConfig {

  public static final String FILE_NAME = "retry-gate.properties";

  static final String REDELIVERY_DELAY_MS = "redelivery-delay-ms";
  static final String RETRY_TOKEN = "retry-token";
  static final String SEPARATOR = "separator";

  private final Duration redeliveryDelay;
  private final TopicClassifier classifier;

  ExtensionConfig(Duration redeliveryDelay, TopicClassifier classifier) {
    this.redeliveryDelay = redeliveryDelay;
    this.classifier = classifier;
  }

  public static ExtensionConfig defaults() {
    return new ExtensionConfig(RetryGate.DEFAULT_REDELIVERY_DELAY, TopicClassifier.defaults());
  }

  /**
   * Loads the config file from the given folder. A missing file yields {@link #defaults()}.
   *
   * @throws IllegalArgumentException if a value is malformed
   * @throws UncheckedIOException     if the file exists but cannot be read
   */
  public static ExtensionConfig load(Path extensionHome) {
    Objects.requireNonNull(extensionHome, "extensionHome");
    Path file = extensionHome.resolve(FILE_NAME);
    if (!Files.isRegularFile(file)) {
      return defaults();
    }
    Properties props = new Properties();
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      props.load(reader);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read " + file, e);
    }
    return fromProperties(props);
  }

  static ExtensionConfig fromProperties(Properties props) {
    Duration delay = RetryGate.DEFAULT_REDELIVERY_DELAY;
    String rawDelay = props.getProperty(REDELIVERY_DELAY_MS);
    if (rawDelay != null) {
      long millis;
      try {
        millis = Long.parseLong(rawDelay.trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(REDELIVERY_DELAY_MS + " is not a number: " + rawDelay, e);
      }
      if (millis <= 0) {
        throw new IllegalArgumentException(REDELIVERY_DELAY_MS + " must be > 0, got " + millis);
      }
      delay = Duration.ofMillis(millis);
    }
    TopicClassifier classifier = new TopicClassifier(
        props.getProperty(SEPARATOR, TopicClassifier.DEFAULT_SEPARATOR),
        props.getProperty(RETRY_TOKEN, TopicClassifier.DEFAULT_RETRY_TOKEN).trim());
    return new ExtensionConfig(delay, classifier);
  }

  public Duration redeliveryDelay() {
    return redeliveryDelay;
  }

  public TopicClassifier classifier() {
    return classifier;
  }
}
