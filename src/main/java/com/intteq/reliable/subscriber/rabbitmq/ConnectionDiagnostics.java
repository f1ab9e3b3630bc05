package com.intteq.reliable.subscriber.rabbitmq;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.BlockedListener;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Logs shutdown and blocked/unblocked notifications of a connection for as long as it is attached.
 *
 * <p>{@link #attach(Connection)} registers the listeners; {@link #close()} removes them again and
 * is safe to call more than once.
 */
@Slf4j
public final class ConnectionDiagnostics implements AutoCloseable {

    private final Connection connection;
    private final ShutdownListener shutdownListener = ConnectionDiagnostics::onShutdown;
    private final AtomicBoolean attached = new AtomicBoolean(true);
    private BlockedListener blockedListener;

    private ConnectionDiagnostics(Connection connection) {
        this.connection = connection;
    }

    public static ConnectionDiagnostics attach(Connection connection) {
        ConnectionDiagnostics diagnostics = new ConnectionDiagnostics(connection);
        connection.addShutdownListener(diagnostics.shutdownListener);
        diagnostics.blockedListener = connection.addBlockedListener(
                reason -> log.error("RabbitMQ connection has been blocked. {}", reason),
                () -> log.info("RabbitMQ connection has been unblocked."));
        log.debug("Attached connection diagnostics");
        return diagnostics;
    }

    public boolean isAttached() {
        return attached.get();
    }

    @Override
    public void close() {
        if (!attached.compareAndSet(true, false)) {
            return;
        }
        connection.removeShutdownListener(shutdownListener);
        if (blockedListener != null) {
            connection.removeBlockedListener(blockedListener);
        }
        log.debug("Detached connection diagnostics");
    }

    static void onShutdown(ShutdownSignalException cause) {
        String initiator = cause.isInitiatedByApplication() ? "application" : "peer";
        int replyCode = 0;
        String replyText = cause.getMessage();
        if (cause.getReason() instanceof AMQP.Connection.Close close) {
            replyCode = close.getReplyCode();
            replyText = close.getReplyText();
        }
        log.error("RabbitMQ connection shutdown occurred. Initiator: '{}', reply code: '{}', text: '{}'.",
                initiator, replyCode, replyText);
    }
}
