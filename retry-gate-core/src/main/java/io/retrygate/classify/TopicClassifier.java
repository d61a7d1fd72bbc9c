package io.retrygate.classify;

import io.retrygate.MessageClass;

import java.util.Objects;

/**
 * Maps a routing key to a {@link MessageClass} purely from its structure.
 *
 * <p>The key is split on the hierarchy separator; if any segment equals the retry
 * token exactly (case-sensitive, no wildcard expansion) the message is
 * {@link MessageClass#RETRY}, otherwise {@link MessageClass#NORMAL}. Empty keys,
 * separator-only keys and {@code null} are all {@code NORMAL}.
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class TopicClassifier {

  public static final String DEFAULT_SEPARATOR = "/";
  public static final String DEFAULT_RETRY_TOKEN = "retry";

  private static final TopicClassifier DEFAULT =
      new TopicClassifier(DEFAULT_SEPARATOR, DEFAULT_RETRY_TOKEN);

  private final String separator;
  private final String retryToken;

  /**
   * @param separator  hierarchy separator, e.g. {@code "/"}
   * @param retryToken the segment that marks retry traffic, e.g. {@code "retry"}
   */
  public TopicClassifier(String separator, String retryToken) {
    this.separator = Objects.requireNonNull(separator, "separator");
    this.retryToken = Objects.requireNonNull(retryToken, "retryToken");
    if (separator.isEmpty()) {
      throw new IllegalArgumentException("separator must not be empty");
    }
    if (retryToken.isEmpty()) {
      throw new IllegalArgumentException("retryToken must not be empty");
    }
    if (retryToken.contains(separator)) {
      throw new IllegalArgumentException("retryToken must not contain the separator");
    }
  }

  /**
   * Returns the classifier for {@code /}-separated keys with the {@code retry} token.
   */
  public static TopicClassifier defaults() {
    return DEFAULT;
  }

  public MessageClass classify(String routingKey) {
    return isRetry(routingKey) ? MessageClass.RETRY : MessageClass.NORMAL;
  }

  public boolean isRetry(String routingKey) {
    if (routingKey == null || routingKey.length() < retryToken.length()) {
      return false;
    }
    int start = 0;
    int length = routingKey.length();
    while (start <= length) {
      int end = routingKey.indexOf(separator, start);
      if (end < 0) {
        end = length;
      }
      if (end - start == retryToken.length()
          && routingKey.regionMatches(start, retryToken, 0, retryToken.length())) {
        return true;
      }
      start = end + separator.length();
    }
    return false;
  }

  public String separator() {
    return separator;
  }

  public String retryToken() {
    return retryToken;
  }

  @Override
  public String toString() {
    return "TopicClassifier{separator='" + separator + "', retryToken='" + retryToken + "'}";
  }
}
