/**
 * The shared count of in-flight retry messages.
 */
package io.retrygate.counter;
