package com.intteq.reliable.subscriber.rabbitmq;

import com.rabbitmq.client.BlockedCallback;
import com.rabbitmq.client.BlockedListener;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.UnblockedCallback;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConnectionDiagnosticsTest {

    @Mock
    private Connection connection;

    @Test
    void attachRegistersAndCloseRemovesListeners() {
        BlockedListener blockedListener = mock(BlockedListener.class);
        when(connection.addBlockedListener(any(BlockedCallback.class), any(UnblockedCallback.class)))
                .thenReturn(blockedListener);

        ConnectionDiagnostics diagnostics = ConnectionDiagnostics.attach(connection);

        ArgumentCaptor<ShutdownListener> shutdownListener = ArgumentCaptor.forClass(ShutdownListener.class);
        verify(connection).addShutdownListener(shutdownListener.capture());
        assertThat(diagnostics.isAttached()).isTrue();

        diagnostics.close();
        diagnostics.close();

        verify(connection, times(1)).removeShutdownListener(shutdownListener.getValue());
        verify(connection, times(1)).removeBlockedListener(blockedListener);
        assertThat(diagnostics.isAttached()).isFalse();
    }
}
