package com.intteq.reliable.subscriber.internal;

import com.intteq.reliable.subscriber.BusSubscriber;
import com.intteq.reliable.subscriber.CorrelationContext;
import com.intteq.reliable.subscriber.MessageHandler;
import com.intteq.reliable.subscriber.annotation.EventHandler;
import com.intteq.reliable.subscriber.annotation.MessagingListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.util.ReflectionUtils;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/**
 * Subscribes the {@link EventHandler} methods of {@link MessagingListener} beans.
 *
 * <p>Runs once all singletons are instantiated, so the subscriber and its infrastructure are
 * ready. An invalid handler signature or a topology failure aborts startup.
 */
@Slf4j
@RequiredArgsConstructor
public class ListenerRegistrar implements SmartInitializingSingleton {

    private final ApplicationContext context;
    private final BusSubscriber subscriber;
    private final Executor handlerExecutor;

    // =====================================================================
    // BEAN DISCOVERY
    // =====================================================================

    @Override
    public void afterSingletonsInstantiated() {
        log.info("Initializing @MessagingListener handlers...");

        context.getBeansWithAnnotation(MessagingListener.class)
                .values()
                .forEach(this::registerListenerBean);
    }

    void registerListenerBean(Object bean) {
        Class<?> clazz = AopUtils.getTargetClass(bean);

        if (AnnotationUtils.findAnnotation(clazz, MessagingListener.class) == null) {
            return;
        }

        for (Method method : clazz.getDeclaredMethods()) {
            if (!method.isAnnotationPresent(EventHandler.class)) {
                continue;
            }

            validateHandlerSignature(clazz, method);
            subscribe(method.getParameterTypes()[0], bean, method);

            log.info("Registered @EventHandler {}#{} for {}",
                    clazz.getSimpleName(), method.getName(), method.getParameterTypes()[0].getSimpleName());
        }
    }

    private <T> void subscribe(Class<T> messageType, Object bean, Method method) {
        ReflectionUtils.makeAccessible(method);
        subscriber.subscribe(messageType, adapt(bean, method));
    }

    // =====================================================================
    // INVOCATION
    // =====================================================================

    private <T> MessageHandler<T> adapt(Object bean, Method method) {
        boolean async = CompletionStage.class.isAssignableFrom(method.getReturnType());
        boolean withContext = method.getParameterCount() == 2;

        return (message, ctx) -> {
            Object[] args = withContext ? new Object[]{message, ctx} : new Object[]{message};
            if (async) {
                return (CompletionStage<?>) invoke(bean, method, args);
            }
            return CompletableFuture.runAsync(() -> {
                try {
                    invoke(bean, method, args);
                } catch (RuntimeException e) {
                    throw e;
                } catch (Exception e) {
                    throw new CompletionException(e);
                }
            }, handlerExecutor);
        };
    }

    private static Object invoke(Object bean, Method method, Object[] args) throws Exception {
        try {
            return method.invoke(bean, args);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    // =====================================================================
    // VALIDATION
    // =====================================================================

    private void validateHandlerSignature(Class<?> clazz, Method method) {
        Class<?>[] parameters = method.getParameterTypes();
        boolean validParameters = parameters.length == 1
                || (parameters.length == 2 && parameters[1] == CorrelationContext.class);
        boolean validReturn = method.getReturnType() == void.class
                || CompletionStage.class.isAssignableFrom(method.getReturnType());

        if (!validParameters || !validReturn) {
            throw new IllegalStateException(
                    "Invalid @EventHandler signature: "
                            + clazz.getName() + "#" + method.getName()
                            + ": expected (Payload[, CorrelationContext]) returning void or CompletionStage"
            );
        }
    }
}
