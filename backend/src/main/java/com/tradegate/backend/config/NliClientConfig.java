package com.tradegate.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradegate.backend.validation.DisabledEntailmentClassifier;
import com.tradegate.backend.validation.EntailmentClassifier;
import com.tradegate.backend.validation.HttpEntailmentClassifier;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Slf4j
@Configuration
public class NliClientConfig {

    @Bean
    public RestTemplate nliRestTemplate(
            @Value("${nli.http.connect-timeout-ms:2000}") int connectTimeoutMs,
            @Value("${nli.http.read-timeout-ms:1500}") int readTimeoutMs
    ) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);
        return new RestTemplate(factory);
    }

    @Bean
    public CircuitBreaker nliCircuitBreaker(
            @Value("${nli.resilience.circuit.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${nli.resilience.circuit.wait-open-seconds:30}") long waitOpenSeconds,
            @Value("${nli.resilience.circuit.sliding-window-size:20}") int slidingWindowSize
    ) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .waitDurationInOpenState(Duration.ofSeconds(waitOpenSeconds))
                .slidingWindowSize(slidingWindowSize)
                .build();
        return CircuitBreaker.of("nli", config);
    }

    @Bean
    public Retry nliRetry(
            @Value("${nli.resilience.retry.max-attempts:2}") int maxAttempts,
            @Value("${nli.resilience.retry.base-delay-ms:100}") long baseDelayMs
    ) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(baseDelayMs), 2.0))
                .retryExceptions(HttpServerErrorException.class, ResourceAccessException.class)
                .build();
        return Retry.of("nli", config);
    }

    @Bean
    public EntailmentClassifier entailmentClassifier(
            RestTemplate nliRestTemplate,
            CircuitBreaker nliCircuitBreaker,
            Retry nliRetry,
            ObjectMapper objectMapper,
            @Value("${nli.base-url:}") String baseUrl,
            @Value("${nli.classify-path:/classify}") String classifyPath
    ) {
        if (baseUrl == null || baseUrl.isBlank()) {
            log.warn("nli.base-url not configured; fact validation runs on keyword fallback");
            return new DisabledEntailmentClassifier();
        }
        log.info("Entailment classifier endpoint {}{}", baseUrl, classifyPath);
        return new HttpEntailmentClassifier(nliRestTemplate, nliCircuitBreaker, nliRetry, objectMapper, baseUrl + classifyPath);
    }
}
