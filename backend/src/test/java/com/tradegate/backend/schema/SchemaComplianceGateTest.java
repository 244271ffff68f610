package com.tradegate.backend.schema;

import com.tradegate.backend.config.GateProperties;
import com.tradegate.backend.model.MarketRegime;
import com.tradegate.backend.model.RegimeClassification;
import com.tradegate.backend.service.MetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaComplianceGateTest {

    private static final String VALID = "{\"action\":\"BUY\",\"confidence\":0.8,\"key_claims\":[\"Revenue grew 8%\"]}";
    private static final LocalDate DAY = LocalDate.of(2024, 3, 1);

    private GateProperties properties;
    private SchemaComplianceGate gate;
    private GenerationRequest request;

    @BeforeEach
    void setUp() {
        properties = new GateProperties();
        AgentOutputParser parser = new AgentOutputParser(
                Validation.buildDefaultValidatorFactory().getValidator(), properties);
        gate = new SchemaComplianceGate(parser, properties, new MetricsService(new SimpleMeterRegistry()));
        RegimeClassification regime = new RegimeClassification("AAPL", DAY, MarketRegime.SIDEWAYS,
                0.2, 15, 0.5, 0.01, 60);
        request = GenerationRequest.initial("AAPL", DAY, regime);
    }

    private static ProposalAgent scripted(List<GenerationRequest> seen, String... outputs) {
        Iterator<String> it = List.of(outputs).iterator();
        return req -> {
            seen.add(req);
            return it.next();
        };
    }

    @Test
    void validFirstAttemptNeedsNoRetry() {
        List<GenerationRequest> seen = new ArrayList<>();

        AgentOutputEnvelope envelope = gate.enforce(scripted(seen, VALID), request);

        assertThat(envelope.isSchemaValid()).isTrue();
        assertThat(envelope.getRetryCount()).isZero();
        assertThat(envelope.getRawText()).isEqualTo(VALID);
        assertThat(seen).hasSize(1);
        assertThat(gate.stats().firstTrySuccesses()).isEqualTo(1);
    }

    @Test
    void regenerationCarriesPreviousOutputAndErrors() {
        List<GenerationRequest> seen = new ArrayList<>();

        AgentOutputEnvelope envelope = gate.enforce(scripted(seen, "not json", "{\"action\":\"BUY\"}", VALID), request);

        assertThat(envelope.isSchemaValid()).isTrue();
        assertThat(envelope.getRetryCount()).isEqualTo(2);
        assertThat(seen).extracting(GenerationRequest::attempt).containsExactly(0, 1, 2);
        assertThat(seen.get(1).previousOutput()).isEqualTo("not json");
        assertThat(seen.get(1).validationErrors()).anyMatch(error -> error.contains("invalid JSON"));
        assertThat(seen.get(2).feedback()).contains("confidence");
        assertThat(gate.stats().retrySuccesses()).isEqualTo(1);
    }

    @Test
    void exhaustedRetriesYieldInvalidEnvelopeNotNull() {
        List<GenerationRequest> seen = new ArrayList<>();

        AgentOutputEnvelope envelope = gate.enforce(scripted(seen, "nope", "still nope", "never"), request);

        assertThat(envelope).isNotNull();
        assertThat(envelope.isSchemaValid()).isFalse();
        assertThat(envelope.parsedOutput()).isEmpty();
        assertThat(envelope.getRetryCount()).isEqualTo(2);
        assertThat(envelope.getErrors()).isNotEmpty();
        assertThat(seen).hasSize(3);
        assertThat(gate.stats().failures()).isEqualTo(1);
        assertThat(gate.stats().failureRate()).isEqualTo(1.0);
    }

    @Test
    void agentExceptionCountsAsFailedAttempt() {
        List<GenerationRequest> seen = new ArrayList<>();
        Iterator<String> outputs = List.of(VALID).iterator();
        ProposalAgent flaky = req -> {
            seen.add(req);
            if (req.attempt() == 0) {
                throw new IllegalStateException("agent offline");
            }
            return outputs.next();
        };

        AgentOutputEnvelope envelope = gate.enforce(flaky, request);

        assertThat(envelope.isSchemaValid()).isTrue();
        assertThat(envelope.getRetryCount()).isEqualTo(1);
        assertThat(seen.get(1).validationErrors()).containsExactly("agent call failed: agent offline");
    }

    @Test
    void zeroRetriesMeansSingleAttempt() {
        properties.getSchema().setMaxRetries(0);
        List<GenerationRequest> seen = new ArrayList<>();

        AgentOutputEnvelope envelope = gate.enforce(scripted(seen, "bad"), request);

        assertThat(envelope.isSchemaValid()).isFalse();
        assertThat(seen).hasSize(1);
    }
}
