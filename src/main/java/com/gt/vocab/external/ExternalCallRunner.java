package com.gt.vocab.external;

import com.gt.vocab.conf.AsyncConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.*;
import java.util.function.Supplier;

/**
 * Runs calls to external collaborators on the external call executor and waits at most the given
 * timeout for them. A call that times out is interrupted; a call the executor has no room for fails
 * immediately. Failures are reported through the returned {@link CallOutcome}, never thrown.
 */
@Component
public class ExternalCallRunner {

    private static final Logger log = LoggerFactory.getLogger(ExternalCallRunner.class);

    private final Executor executor;

    @Autowired
    public ExternalCallRunner(@Qualifier(AsyncConfig.EXTERNAL_CALL_EXECUTOR) Executor executor) {
        this.executor = executor;
    }

    public <T> CallOutcome<T> call(String callName, Supplier<T> supplier, Duration timeout) {
        FutureTask<T> future = new FutureTask<>(supplier::get);

        try {
            executor.execute(future);
        } catch (RejectedExecutionException ex) {
            log.warn("External call {} rejected, no executor capacity left", callName);
            return CallOutcome.error(ex);
        }

        try {
            return CallOutcome.success(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("External call {} timed out after {} ms", callName, timeout.toMillis());
            return CallOutcome.timeout();
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            log.warn("External call {} failed: {}", callName, cause.getMessage());
            return CallOutcome.error(cause);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for external call {}", callName);
            return CallOutcome.error(ex);
        }
    }
}
