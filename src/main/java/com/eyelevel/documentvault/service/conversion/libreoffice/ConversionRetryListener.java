package com.eyelevel.documentvault.service.conversion.libreoffice;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

/**
 * Logs each failed conversion attempt, and a recovery once a retried conversion succeeds.
 */
@Slf4j
@Component("conversionRetryListener")
public class ConversionRetryListener implements RetryListener {

    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                 Throwable throwable) {
        log.warn("Upload conversion attempt {} failed: {}", context.getRetryCount(), describe(throwable));
    }

    @Override
    public <T, E extends Throwable> void close(RetryContext context, RetryCallback<T, E> callback,
                                               Throwable throwable) {
        if (throwable == null && context.getRetryCount() > 0) {
            log.info("Upload conversion succeeded after {} failed attempt(s).", context.getRetryCount());
        }
    }

    static String describe(Throwable throwable) {
        Throwable cause = throwable.getCause() != null ? throwable.getCause() : throwable;
        return throwable.getMessage() + (cause != throwable ? " (" + cause.getClass().getSimpleName() + ")" : "");
    }
}
