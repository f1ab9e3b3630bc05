package com.intteq.reliable.subscriber.internal;

import com.intteq.reliable.subscriber.BusSubscriber;
import com.intteq.reliable.subscriber.CorrelationContext;
import com.intteq.reliable.subscriber.MessageHandler;
import com.intteq.reliable.subscriber.annotation.EventHandler;
import com.intteq.reliable.subscriber.annotation.MessagingListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ListenerRegistrarTest {

    @Mock
    private ApplicationContext applicationContext;

    @Mock
    private BusSubscriber subscriber;

    @Captor
    private ArgumentCaptor<MessageHandler<OrderCreated>> handlerCaptor;

    private ListenerRegistrar registrar;

    @BeforeEach
    void setUp() {
        registrar = new ListenerRegistrar(applicationContext, subscriber, Runnable::run);
    }

    @Test
    void subscribesEveryAnnotatedListener() throws Exception {
        OrderListener listener = new OrderListener();
        when(applicationContext.getBeansWithAnnotation(MessagingListener.class))
                .thenReturn(Map.<String, Object>of("orderListener", listener));

        registrar.afterSingletonsInstantiated();

        verify(subscriber).subscribe(eq(OrderCreated.class), handlerCaptor.capture());

        OrderCreated message = new OrderCreated();
        CorrelationContext context = CorrelationContext.of(Map.of("traceId", "t-1"));
        CompletionStage<?> result = handlerCaptor.getValue().handle(message, context);
        result.toCompletableFuture().join();

        assertThat(listener.received).containsExactly(message);
        assertThat(listener.contexts).containsExactly(context);
    }

    @Test
    void asyncHandlerStageIsReturnedAsIs() throws Exception {
        AsyncListener listener = new AsyncListener();

        registrar.registerListenerBean(listener);

        verify(subscriber).subscribe(eq(OrderCreated.class), handlerCaptor.capture());
        assertThat(handlerCaptor.getValue().handle(new OrderCreated(), CorrelationContext.empty()))
                .isSameAs(listener.stage);
    }

    @Test
    void synchronousHandlerFailureCompletesExceptionally() throws Exception {
        registrar.registerListenerBean(new FailingListener());

        verify(subscriber).subscribe(eq(OrderCreated.class), handlerCaptor.capture());
        CompletionStage<?> result = handlerCaptor.getValue().handle(new OrderCreated(), CorrelationContext.empty());

        assertThatThrownBy(() -> result.toCompletableFuture().join())
                .hasCauseInstanceOf(IllegalStateException.class)
                .hasRootCauseMessage("cannot handle");
    }

    @Test
    void invalidSignatureAbortsRegistration() {
        assertThatThrownBy(() -> registrar.registerListenerBean(new InvalidListener()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Invalid @EventHandler signature");
        verify(subscriber, never()).subscribe(any(), any());
    }

    static class OrderCreated {
    }

    @MessagingListener
    static class OrderListener {
        final List<OrderCreated> received = new ArrayList<>();
        final List<CorrelationContext> contexts = new ArrayList<>();

        @EventHandler
        public void on(OrderCreated message, CorrelationContext context) {
            received.add(message);
            contexts.add(context);
        }
    }

    @MessagingListener
    static class AsyncListener {
        final CompletableFuture<Void> stage = new CompletableFuture<>();

        @EventHandler
        public CompletionStage<Void> on(OrderCreated message) {
            return stage;
        }
    }

    @MessagingListener
    static class FailingListener {

        @EventHandler
        public void on(OrderCreated message) {
            throw new IllegalStateException("cannot handle");
        }
    }

    @MessagingListener
    static class InvalidListener {

        @EventHandler
        public String on(OrderCreated message) {
            return "not allowed";
        }
    }
}
