package com.tradegate.backend.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradegate.backend.exception.ModelUnavailableException;
import com.tradegate.backend.model.Verdict;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Calls a remote NLI model over HTTP. Request body {@code {"premise", "hypothesis"}},
 * response body {@code {"label", "score"}} where the label names entailment,
 * contradiction or neutral.
 */
@Slf4j
@RequiredArgsConstructor
public class HttpEntailmentClassifier implements EntailmentClassifier {

    private final RestTemplate nliRestTemplate;
    private final CircuitBreaker nliCircuitBreaker;
    private final Retry nliRetry;
    private final ObjectMapper objectMapper;
    private final String classifyUrl;

    @Override
    public EntailmentResponse classify(String premise, String hypothesis) {
        Supplier<EntailmentResponse> supplier = () -> doRequest(premise, hypothesis);
        Supplier<EntailmentResponse> decorated = Retry.decorateSupplier(nliRetry, supplier);
        decorated = CircuitBreaker.decorateSupplier(nliCircuitBreaker, decorated);
        try {
            return decorated.get();
        } catch (CallNotPermittedException e) {
            return EntailmentResponse.unavailable("NLI circuit breaker open");
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                log.warn("NLI request to {} timed out: {}", classifyUrl, e.getMessage());
                return EntailmentResponse.timeout(e.getMessage());
            }
            log.warn("NLI request to {} failed: {}", classifyUrl, e.getMessage());
            return EntailmentResponse.unavailable(e.getMessage());
        } catch (RestClientException | ModelUnavailableException e) {
            log.warn("NLI request to {} failed: {}", classifyUrl, e.getMessage());
            return EntailmentResponse.unavailable(e.getMessage());
        }
    }

    private EntailmentResponse doRequest(String premise, String hypothesis) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<Map<String, String>> entity = new HttpEntity<>(Map.of(
                "premise", premise,
                "hypothesis", hypothesis
        ), headers);
        ResponseEntity<String> response = nliRestTemplate.exchange(classifyUrl, HttpMethod.POST, entity, String.class);
        return parse(response.getBody());
    }

    EntailmentResponse parse(String body) {
        if (body == null || body.isBlank()) {
            throw new ModelUnavailableException("Empty NLI response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ModelUnavailableException("Malformed NLI response", e);
        }
        String label = root.path("label").asText("").toLowerCase(Locale.ROOT);
        JsonNode score = root.has("score") ? root.get("score") : root.path("confidence");
        if (label.isEmpty() || !score.isNumber()) {
            throw new ModelUnavailableException("NLI response missing label or score: " + body);
        }
        return EntailmentResponse.ok(toVerdict(label), score.asDouble());
    }

    private Verdict toVerdict(String label) {
        if (label.contains("entail")) {
            return Verdict.ENTAILMENT;
        }
        if (label.contains("contradict")) {
            return Verdict.CONTRADICTION;
        }
        return Verdict.NEUTRAL;
    }
}
