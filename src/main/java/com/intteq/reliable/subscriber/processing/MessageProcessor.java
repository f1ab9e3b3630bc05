package com.intteq.reliable.subscriber.processing;

import com.intteq.reliable.subscriber.CorrelationContext;
import com.intteq.reliable.subscriber.DeliveryAcknowledgement;
import com.intteq.reliable.subscriber.DeliveryInfo;
import com.intteq.reliable.subscriber.MessageEnvelope;
import com.intteq.reliable.subscriber.MessageHandler;
import com.intteq.reliable.subscriber.MessagingProperties;
import com.intteq.reliable.subscriber.conventions.MessageNames;
import com.intteq.reliable.subscriber.exception.MessageProcessingTimeoutException;
import com.intteq.reliable.subscriber.publisher.BusPublisher;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Drives one delivery of type {@code T} to its final disposition.
 *
 * <p>Per message:
 * <ol>
 *     <li>The handler is invoked, raced against the processing timeout when one is configured.
 *     A timeout nacks the delivery (requeue per configuration) and is never retried.</li>
 *     <li>Success acks the delivery.</li>
 *     <li>A failure is offered to the {@link ExceptionToMessageMapper}. A mapped event is
 *     published and the delivery acked. Otherwise the handler is retried after the fixed
 *     interval until the retry budget is spent, then the delivery is nacked.</li>
 * </ol>
 *
 * <p>Only the handler is re-invoked on retry; the plugin chain in front of the processor runs once.
 * Waiting for the timeout and for the retry interval is scheduled, no thread is parked.
 *
 * @param <T> message type
 */
@Slf4j
public class MessageProcessor<T> {

    private final Class<T> messageType;
    private final MessageHandler<T> handler;
    private final ExceptionToMessageMapper exceptionMapper;
    private final BusPublisher publisher;
    private final ScheduledExecutorService scheduler;

    private final int retries;
    private final Duration retryInterval;
    private final Duration timeout;
    private final boolean requeueFailedMessages;
    private final boolean loggerEnabled;

    public MessageProcessor(Class<T> messageType,
                            MessageHandler<T> handler,
                            ExceptionToMessageMapper exceptionMapper,
                            BusPublisher publisher,
                            ScheduledExecutorService scheduler,
                            MessagingProperties properties) {
        this.messageType = messageType;
        this.handler = handler;
        this.exceptionMapper = exceptionMapper;
        this.publisher = publisher;
        this.scheduler = scheduler;
        this.retries = properties.getRetriesOrDefault();
        this.retryInterval = properties.getRetryIntervalOrDefault();
        this.timeout = properties.getMessageProcessingTimeout();
        this.requeueFailedMessages = properties.isRequeueFailedMessages();
        this.loggerEnabled = properties.getLogger().isEnabled();
    }

    /**
     * Processes one message. The returned future completes once the delivery has been settled,
     * and completes exceptionally only if settling itself failed.
     */
    public CompletableFuture<Void> process(Object message, CorrelationContext context, DeliveryInfo delivery) {
        Attempt attempt = new Attempt(messageType.cast(message), context, delivery,
                new RetryState(retries, retryInterval));
        attempt.run();
        return attempt.done;
    }

    // =====================================================================
    // ONE MESSAGE
    // =====================================================================

    private final class Attempt {

        private final T message;
        private final CorrelationContext context;
        private final DeliveryAcknowledgement acknowledgement;
        private final MessageEnvelope envelope;
        private final RetryState state;
        private final String messageName;
        private final CompletableFuture<Void> done = new CompletableFuture<>();

        private Attempt(T message, CorrelationContext context, DeliveryInfo delivery, RetryState state) {
            this.message = message;
            this.context = context;
            this.acknowledgement = delivery.acknowledgement();
            this.envelope = delivery.envelope();
            this.state = state;
            this.messageName = MessageNames.of(message);
        }

        private void run() {
            String retryMessage = state.getAttempt() == 0 ? "" : "Retry: " + state.getAttempt() + ".";
            if (loggerEnabled) {
                log.info("Handling a message: '{}' [id: '{}'] with correlation id: '{}'. {}",
                        messageName, envelope.messageId(), envelope.correlationId(), retryMessage);
            }

            try {
                invokeHandler().whenComplete((ignored, error) -> {
                    try {
                        onAttemptCompleted(error, retryMessage);
                    } catch (Throwable e) {
                        done.completeExceptionally(e);
                    }
                });
            } catch (Throwable e) {
                done.completeExceptionally(e);
            }
        }

        private CompletableFuture<Void> invokeHandler() {
            CompletableFuture<Void> outcome = new CompletableFuture<>();

            if (timeout != null) {
                ScheduledFuture<?> timer = scheduler.schedule(
                        () -> outcome.completeExceptionally(new MessageProcessingTimeoutException(
                                envelope.messageId(), envelope.correlationId(), timeout)),
                        timeout.toMillis(), TimeUnit.MILLISECONDS);
                outcome.whenComplete((r, e) -> timer.cancel(false));
            }

            try {
                CompletionStage<?> stage = handler.handle(message, context);
                if (stage == null) {
                    outcome.complete(null);
                } else {
                    stage.whenComplete((r, e) -> {
                        if (e != null) {
                            outcome.completeExceptionally(e);
                        } else {
                            outcome.complete(null);
                        }
                    });
                }
            } catch (Throwable e) {
                outcome.completeExceptionally(e);
            }

            return outcome;
        }

        private void onAttemptCompleted(Throwable error, String retryMessage) {
            Throwable failure = unwrap(error);

            if (failure != null) {
                log.error("Handler attempt failed: {}", failure.toString(), failure);

                if (failure instanceof MessageProcessingTimeoutException) {
                    acknowledgement.nack(requeueFailedMessages);
                    done.complete(null);
                    return;
                }

                state.recordFailure();
                Optional<Object> rejectedEvent = exceptionMapper.map(failure, message);
                if (rejectedEvent.isPresent()) {
                    publishRejectedEvent(rejectedEvent.get(), failure);
                    return;
                }

                int retry = state.getAttempt() - 1;
                if (retry > 0) {
                    log.error("Unable to handle a message: '{}' [id: '{}'] with correlation id: '{}', retry {}/{}...",
                            messageName, envelope.messageId(), envelope.correlationId(), retry, state.getMaxAttempts());
                }
            }

            switch (state.decide(failure)) {
                case SUCCEED -> {
                    acknowledgement.ack();
                    if (loggerEnabled) {
                        log.info("Handled a message: '{}' [id: '{}'] with correlation id: '{}'. {}",
                                messageName, envelope.messageId(), envelope.correlationId(), retryMessage);
                    }
                    done.complete(null);
                }
                case RETRY -> scheduler.schedule(this::run, state.getInterval().toMillis(), TimeUnit.MILLISECONDS);
                case GIVE_UP -> {
                    log.error("Handling a message: '{}' [id: '{}'] with correlation id: '{}' failed.",
                            messageName, envelope.messageId(), envelope.correlationId());
                    acknowledgement.nack(requeueFailedMessages);
                    done.complete(null);
                }
            }
        }

        private void publishRejectedEvent(Object rejectedEvent, Throwable failure) {
            String rejectedEventName = MessageNames.of(rejectedEvent);

            CompletableFuture<Void> published;
            try {
                published = publisher.publish(rejectedEvent, envelope.correlationId(), context);
            } catch (Throwable e) {
                published = CompletableFuture.failedFuture(e);
            }

            published.whenComplete((ignored, error) -> {
                try {
                    if (error != null) {
                        log.error("Publishing a rejected event: '{}' for the message: '{}' [id: '{}'] "
                                        + "with correlation id: '{}' failed.",
                                rejectedEventName, messageName, envelope.messageId(), envelope.correlationId(),
                                unwrap(error));
                        acknowledgement.nack(requeueFailedMessages);
                        done.complete(null);
                        return;
                    }

                    if (loggerEnabled) {
                        log.warn("Published a rejected event: '{}' for the message: '{}' [id: '{}'] "
                                        + "with correlation id: '{}'.",
                                rejectedEventName, messageName, envelope.messageId(), envelope.correlationId());
                    }
                    log.error("Handling a message: '{}' [id: '{}'] with correlation id: '{}' failed and "
                                    + "rejected event: '{}' was published.",
                            messageName, envelope.messageId(), envelope.correlationId(), rejectedEventName, failure);

                    acknowledgement.ack();
                    done.complete(null);
                } catch (Throwable e) {
                    done.completeExceptionally(e);
                }
            });
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
