package com.sitesmith.core.upstream;

import com.sitesmith.core.error.UpstreamUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs blocking calls to external collaborators with a hard deadline.
 *
 * <p>Used for clients that expose no timeout of their own (the chat model
 * calls). A call that exceeds its deadline is cancelled and reported as
 * {@link UpstreamUnavailableException}; so is any exception it throws.
 */
@Component
public class UpstreamCalls implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(UpstreamCalls.class);

    private final ExecutorService executor;

    public UpstreamCalls() {
        var counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            var t = new Thread(r, "upstream-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public <T> T call(String collaborator, Duration timeout, Callable<T> work) {
        Future<T> future = executor.submit(work);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} did not answer within {}s", collaborator, timeout.toSeconds());
            throw new UpstreamUnavailableException(collaborator,
                    collaborator + " timed out after " + timeout.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new UpstreamUnavailableException(collaborator, collaborator + " call interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof UpstreamUnavailableException upstream) {
                throw upstream;
            }
            throw new UpstreamUnavailableException(collaborator,
                    collaborator + " failed: " + cause.getMessage(), cause);
        }
    }

    @Override
    public void destroy() {
        executor.shutdownNow();
    }
}
