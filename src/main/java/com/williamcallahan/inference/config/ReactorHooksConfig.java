package com.williamcallahan.inference.config;

import java.io.InterruptedIOException;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.ContextRefreshedEvent;
import org.springframework.context.event.EventListener;
import reactor.core.publisher.Hooks;

/**
 * Downgrades errors dropped by cancelled upstream calls.
 *
 * <p>When a provider call on {@code boundedElastic} is abandoned by the per-attempt timeout, the
 * interrupted worker may fail after its {@code Mono} has already completed. Those late errors are
 * expected and are logged at DEBUG; anything else stays at WARN.</p>
 */
@Configuration
public class ReactorHooksConfig {

    private static final Logger log = LoggerFactory.getLogger(ReactorHooksConfig.class);

    @EventListener(ContextRefreshedEvent.class)
    public void configureDroppedErrorHandler() {
        Hooks.onErrorDropped(error -> {
            if (isAbandonedAttemptError(error)) {
                log.debug("Dropped error from abandoned provider attempt (exceptionType={})",
                        error.getClass().getSimpleName());
            } else {
                log.warn("Dropped unexpected error", error);
            }
        });
        log.info("Reactor dropped-error hook configured");
    }

    static boolean isAbandonedAttemptError(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof InterruptedException || current instanceof InterruptedIOException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        String message = error.getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains("interrupt");
    }
}
