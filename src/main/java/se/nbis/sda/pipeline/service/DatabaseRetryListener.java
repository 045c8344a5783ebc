package se.nbis.sda.pipeline.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

/**
 * Logs the retries of {@link FileRecordService} calls.
 * <p>
 * Each failed attempt is a warning naming the operation. A call that recovers is noted once, and a call that
 * gives up is logged as an error, since its {@code DataAccessException} is about to requeue the delivery.
 */
@Component("databaseRetryListener")
@Slf4j
public class DatabaseRetryListener implements RetryListener {

    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                 Throwable throwable) {
        log.warn("Database operation {} failed on attempt {}: {}", operation(context), context.getRetryCount(),
                 throwable.toString());
        log.debug("Database failure detail.", throwable);
    }

    @Override
    public <T, E extends Throwable> void onSuccess(RetryContext context, RetryCallback<T, E> callback, T result) {
        if (context.getRetryCount() > 0) {
            log.info("Database operation {} succeeded after {} failed attempt(s).", operation(context),
                     context.getRetryCount());
        }
    }

    @Override
    public <T, E extends Throwable> void close(RetryContext context, RetryCallback<T, E> callback,
                                               Throwable throwable) {
        if (throwable != null) {
            log.error("Giving up on database operation {} after {} attempt(s); the message will be requeued.",
                      operation(context), context.getRetryCount());
        }
    }

    static String operation(RetryContext context) {
        Object name = context.getAttribute(RetryContext.NAME);
        return name == null ? "(unnamed)" : name.toString();
    }
}
