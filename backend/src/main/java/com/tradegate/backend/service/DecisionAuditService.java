package com.tradegate.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tradegate.backend.model.PipelineOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes decision audit records as single-line JSON to the {@code DECISION_AUDIT} logger.
 * Persisting them is left to the log pipeline.
 */
@Service
@Slf4j(topic = "DECISION_AUDIT")
public class DecisionAuditService {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public void record(String assetId, LocalDate date, String decisionType, Map<String, Object> details) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("assetId", assetId);
        payload.put("date", date);
        payload.put("decisionType", decisionType);
        payload.put("details", details);
        log.info(toJson(payload, decisionType));
    }

    public void recordOutcome(PipelineOutcome outcome) {
        log.info(toJson(outcome, "OUTCOME"));
    }

    String toJson(Object payload, String decisionType) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize decision audit for {}", decisionType, e);
            return "{\"decisionType\":\"" + decisionType + "\",\"serializationError\":true}";
        }
    }
}
