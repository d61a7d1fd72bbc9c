package io.retrygate.hivemq;

import io.retrygate.RetryGate;
import com.hivemq.extension.sdk.api.ExtensionMain;
import com.hivemq.extension.sdk.api.annotations.NotNull;
import com.hivemq.extension.sdk.api.parameter.ExtensionStartInput;
import com.hivemq.extension.sdk.api.parameter.ExtensionStartOutput;
import com.hivemq.extension.sdk.api.parameter.ExtensionStopInput;
import com.hivemq.extension.sdk.api.parameter.ExtensionStopOutput;
import com.hivemq.extension.sdk.api.services.Services;
import com.hivemq.extension.sdk.api.services.builder.Builders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extension entry point. Starts one {@link RetryGate} per broker and stops it with the extension,
 * discarding any deferred messages still waiting on the timer.
 */
public class RetryGateExtensionMain implements ExtensionMain {

  private static final Logger log = LoggerFactory.getLogger(RetryGateExtensionMain.class);

  private volatile RetryGate gate;

  @Override
  public void extensionStart(@NotNull ExtensionStartInput input, @NotNull ExtensionStartOutput output) {
    ExtensionConfig config;
    try {
      config = ExtensionConfig.load(input.getExtensionInformation().getExtensionHomeFolder().toPath());
    } catch (RuntimeException e) {
      log.error("Invalid {}: {}", ExtensionConfig.FILE_NAME, e.getMessage());
      output.preventExtensionStartup("Invalid " + ExtensionConfig.FILE_NAME + ": " + e.getMessage());
      return;
    }

    RetryGate started = RetryGate.builder()
        .publisher(new HivemqBrokerPublisher(Services.publishService(), Builders::publish))
        .classifier(config.classifier())
        .redeliveryDelay(config.redeliveryDelay())
        .timer(Services.extensionExecutorService())
        .build();
    Services.initializerRegistry().setClientInitializer(new RetryGateInitializer(started));
    gate = started;
    log.info("Retry gate extension started (retryToken={}, separator={}, redeliveryDelay={})",
        config.classifier().retryToken(), config.classifier().separator(), config.redeliveryDelay());
  }

  @Override
  public void extensionStop(@NotNull ExtensionStopInput input, @NotNull ExtensionStopOutput output) {
    RetryGate current = gate;
    gate = null;
    if (current != null) {
      current.close();
    }
    log.info("Retry gate extension stopped");
  }

  RetryGate gate() {
    return gate;
  }
}
