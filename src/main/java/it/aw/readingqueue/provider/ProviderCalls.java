package it.aw.readingqueue.provider;

import dev.langchain4j.exception.HttpException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import it.aw.readingqueue.config.MdcAwareExecutor;
import it.aw.readingqueue.config.ProviderConfig;
import it.aw.readingqueue.error.ProviderException;
import it.aw.readingqueue.error.ProviderTimeoutException;
import it.aw.readingqueue.error.ReadingQueueException;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Esegue le chiamate ai provider esterni con un timeout limitato.
 * <p>
 * La chiamata gira su un pool dedicato e il {@link TimeLimiter} di resilience4j
 * limita l'attesa del chiamante: allo scadere il task viene cancellato con
 * interrupt e il client HTTP sottostante abbandona la richiesta. Lo stesso accade
 * se il chiamante viene interrotto (richiesta abbandonata).
 * <p>
 * Traduce gli errori nella tassonomia del motore:
 * HTTP 429 e 5xx → {@link ProviderException} transitoria, timeout di rete →
 * {@link ProviderTimeoutException}, tutto il resto → {@link ProviderException}.
 */
public class ProviderCalls {

    private final ExecutorService executor;
    private final TimeLimiter timeLimiter;

    public ProviderCalls(ExecutorService executor, Duration timeout) {
        this(executor, TimeLimiter.of(ProviderConfig.providerTimeLimiterConfig(timeout)));
    }

    public ProviderCalls(ExecutorService executor, TimeLimiter timeLimiter) {
        this.executor = executor;
        this.timeLimiter = timeLimiter;
    }

    public <T> T call(String operation, Callable<T> call) {
        Callable<T> task = MdcAwareExecutor.withMdc(call);
        AtomicReference<Future<T>> submitted = new AtomicReference<>();
        try {
            return timeLimiter.executeFutureSupplier(() -> {
                Future<T> future = executor.submit(task);
                submitted.set(future);
                return future;
            });
        } catch (TimeoutException e) {
            throw new ProviderTimeoutException(operation, timeout(), e);
        } catch (InterruptedException e) {
            Future<T> future = submitted.get();
            if (future != null) {
                future.cancel(true);
            }
            Thread.currentThread().interrupt();
            throw new ProviderException(operation + ": chiamata abbandonata", e);
        } catch (Exception e) {
            throw translate(operation, e);
        }
    }

    public Duration timeout() {
        return timeLimiter.getTimeLimiterConfig().getTimeoutDuration();
    }

    ReadingQueueException translate(String operation, Throwable failure) {
        if (failure instanceof ReadingQueueException) {
            return (ReadingQueueException) failure;
        }
        Throwable cur = failure;
        int hops = 0;
        while (cur != null && hops++ < 20) {
            if (cur instanceof HttpTimeoutException || cur instanceof SocketTimeoutException) {
                return new ProviderTimeoutException(operation, timeout(), failure);
            }
            if (cur instanceof HttpException) {
                int status = ((HttpException) cur).statusCode();
                boolean transientFailure = status == 429 || (status >= 500 && status <= 599);
                return new ProviderException(operation + ": HTTP " + status, failure, transientFailure);
            }
            if (cur.getCause() == cur) {
                break;
            }
            cur = cur.getCause();
        }
        return new ProviderException(operation + ": " + failure.getMessage(), failure);
    }
}
