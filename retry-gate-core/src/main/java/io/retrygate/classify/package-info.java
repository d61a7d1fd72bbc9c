/**
 * Structural classification of routing keys into retry and normal traffic.
 *
 * @see io.retrygate.classify.TopicClassifier
 */
package io.retrygate.classify;
