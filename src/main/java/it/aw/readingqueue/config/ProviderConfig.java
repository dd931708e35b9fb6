package it.aw.readingqueue.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import it.aw.readingqueue.error.ProviderException;
import it.aw.readingqueue.error.ProviderTimeoutException;
import it.aw.readingqueue.provider.ProviderCalls;
import it.aw.readingqueue.provider.StructuredOutputDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Pool di thread, chiamate ai provider e politica di retry della pipeline.
 * <p>
 * Tre pool separati: le chiamate ai provider (limitate da {@code app.provider.concurrency}),
 * l'ingestione asincrona e l'etichettatura dei cluster. I pool sono chiusi da Spring allo shutdown.
 */
@Configuration
public class ProviderConfig {

    private static final Logger log = LoggerFactory.getLogger(ProviderConfig.class);

    @Bean
    @Qualifier("providerExecutor")
    public ExecutorService providerExecutor(@Value("${app.provider.concurrency:8}") int concurrency) {
        return Executors.newFixedThreadPool(concurrency, new CustomizableThreadFactory("provider-"));
    }

    @Bean
    @Qualifier("ingestionExecutor")
    public ExecutorService ingestionExecutor(@Value("${app.ingestion.concurrency:4}") int concurrency) {
        return Executors.newFixedThreadPool(concurrency, new CustomizableThreadFactory("ingest-"));
    }

    @Bean
    @Qualifier("labelExecutor")
    public ExecutorService labelExecutor(@Value("${app.labels.concurrency:4}") int concurrency) {
        return Executors.newFixedThreadPool(concurrency, new CustomizableThreadFactory("label-"));
    }

    /** Limite di attesa per ogni chiamata ai provider; allo scadere il task viene interrotto. */
    @Bean
    public TimeLimiter providerTimeLimiter(@Value("${app.provider.timeout:PT30S}") Duration timeout) {
        TimeLimiter limiter = TimeLimiter.of("provider", providerTimeLimiterConfig(timeout));
        limiter.getEventPublisher().onTimeout(event ->
                log.warn("Chiamata al provider oltre il limite di {}", timeout));
        return limiter;
    }

    public static TimeLimiterConfig providerTimeLimiterConfig(Duration timeout) {
        return TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build();
    }

    @Bean
    public ProviderCalls providerCalls(@Qualifier("providerExecutor") ExecutorService providerExecutor,
                                       TimeLimiter providerTimeLimiter) {
        return new ProviderCalls(providerExecutor, providerTimeLimiter);
    }

    @Bean
    public StructuredOutputDecoder structuredOutputDecoder(ObjectMapper objectMapper) {
        return new StructuredOutputDecoder(objectMapper);
    }

    /**
     * Retry con backoff esponenziale per gli stadi della pipeline: solo timeout
     * ed errori transitori del provider (rate limit, 5xx).
     */
    @Bean
    public Retry ingestionRetry(@Value("${app.ingestion.max-attempts:3}") int maxAttempts,
                                @Value("${app.ingestion.initial-backoff:PT2S}") Duration initialBackoff,
                                @Value("${app.ingestion.backoff-multiplier:2.0}") double multiplier) {
        Retry retry = Retry.of("ingestion", ingestionRetryConfig(maxAttempts, initialBackoff, multiplier));
        retry.getEventPublisher().onRetry(event -> log.warn("Retry stadio di ingestione (tentativo {}): {}",
                event.getNumberOfRetryAttempts(),
                event.getLastThrowable() == null ? "-" : event.getLastThrowable().getMessage()));
        return retry;
    }

    public static RetryConfig ingestionRetryConfig(int maxAttempts, Duration initialBackoff, double multiplier) {
        return RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff, multiplier))
                .retryOnException(ProviderConfig::isRetryable)
                .build();
    }

    static boolean isRetryable(Throwable t) {
        return t instanceof ProviderTimeoutException
                || (t instanceof ProviderException && ((ProviderException) t).isTransientFailure());
    }
}
