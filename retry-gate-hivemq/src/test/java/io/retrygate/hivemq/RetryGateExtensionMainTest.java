package io.retrygate.hivemq;

import com.hivemq.extension.sdk.api.parameter.ExtensionInformation;
import com.hivemq.extension.sdk.api.parameter.ExtensionStartInput;
import com.hivemq.extension.sdk.api.parameter.ExtensionStartOutput;
import com.hivemq.extension.sdk.api.parameter.ExtensionStopInput;
import com.hivemq.extension.sdk.api.parameter.ExtensionStopOutput;
import com.hivemq.extension.sdk.api.services.ManagedExtensionExecutorService;
import com.hivemq.extension.sdk.api.services.Services;
import com.hivemq.extension.sdk.api.services.intializer.InitializerRegistry;
import com.hivemq.extension.sdk.api.services.publish.PublishService;
import io.retrygate.RetryGate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.MockedStatic;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.mockStatic;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RetryGateExtensionMainTest {

    @TempDir
    Path home;

    @Mock
    private ExtensionStartInput startInput;

    @Mock
    private ExtensionStartOutput startOutput;

    @Mock
    private ExtensionInformation information;

    @Test
    void startRegistersInitializerAndStopClosesGate() throws Exception {
        Files.writeString(home.resolve(ExtensionConfig.FILE_NAME), "redelivery-delay-ms=300\n");
        when(startInput.getExtensionInformation()).thenReturn(information);
        when(information.getExtensionHomeFolder()).thenReturn(home.toFile());
        InitializerRegistry initializers = mock(InitializerRegistry.class);
        ManagedExtensionExecutorService executor = mock(ManagedExtensionExecutorService.class);

        RetryGateExtensionMain main = new RetryGateExtensionMain();
        try (MockedStatic<Services> services = mockStatic(Services.class)) {
            services.when(Services::publishService).thenReturn(mock(PublishService.class));
            services.when(Services::extensionExecutorService).thenReturn(executor);
            services.when(Services::initializerRegistry).thenReturn(initializers);

            main.extensionStart(startInput, startOutput);
        }

        verify(startOutput, never()).preventExtensionStartup(anyString());
        verify(initializers).setClientInitializer(any(RetryGateInitializer.class));
        RetryGate gate = main.gate();
        assertTrue(gate.isRunning());
        assertEquals(Duration.ofMillis(300), gate.outboundGate().redeliveryDelay());

        main.extensionStop(mock(ExtensionStopInput.class), mock(ExtensionStopOutput.class));

        assertFalse(gate.isRunning());
        assertNull(main.gate());
        verify(executor, never()).shutdown();
        verify(executor, never()).shutdownNow();
    }

    @Test
    void malformedConfigPreventsStartup() throws Exception {
        Files.writeString(home.resolve(ExtensionConfig.FILE_NAME), "redelivery-delay-ms=-5\n");
        when(startInput.getExtensionInformation()).thenReturn(information);
        when(information.getExtensionHomeFolder()).thenReturn(home.toFile());

        RetryGateExtensionMain main = new RetryGateExtensionMain();
        main.extensionStart(startInput, startOutput);

        verify(startOutput).preventExtensionStartup(anyString());
        assertNull(main.gate());
    }

    @Test
    void stopWithoutStartIsHarmless() {
        new RetryGateExtensionMain().extensionStop(mock(ExtensionStopInput.class), mock(ExtensionStopOutput.class));
    }
}
