package com.workflow.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * A Spring configuration class responsible for creating the HTTP client used by connectors
 * that talk to webhooks and other remote services.
 */
@Configuration
public class HttpClientFactory {

    /**
     * Creates a singleton WebClient bean with a built-in retry mechanism.
     * <p>
     * Responses with HTTP 429 or any 5xx status, and requests that fail to connect, are retried
     * with exponential backoff. Once the attempts are exhausted the last error reaches the caller.
     *
     * @param maxAttempts      Total attempts per request, including the first.
     * @param initialBackoffMs Delay before the first retry; doubled for each further retry.
     * @return A fully configured {@link WebClient} instance.
     */
    @Bean
    public WebClient webClient(@Value("${workflow.retry.max-attempts:3}") int maxAttempts,
                               @Value("${workflow.retry.initial-backoff-ms:500}") long initialBackoffMs) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(initialBackoffMs), 2))
                .retryOnException(HttpClientFactory::isRetryable)
                .build();

        Retry retry = RetryRegistry.of(config).retry("workflow-http");

        return WebClient.builder()
                .filter((request, next) -> next.exchange(request)
                        .flatMap(HttpClientFactory::failOnRetryableStatus)
                        .transform(RetryOperator.of(retry)))
                .build();
    }

    // exchange() does not fail on status codes, so retryable ones are turned into errors here.
    private static Mono<ClientResponse> failOnRetryableStatus(ClientResponse response) {
        if (response.statusCode().is5xxServerError() || response.statusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
            return response.createException().flatMap(Mono::error);
        }
        return Mono.just(response);
    }

    static boolean isRetryable(Throwable e) {
        if (e instanceof WebClientResponseException responseException) {
            return responseException.getStatusCode().is5xxServerError()
                    || responseException.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value();
        }
        return e instanceof WebClientRequestException;
    }
}
