package com.tradegate.backend.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.tradegate.backend.config.GateProperties;
import com.tradegate.backend.exception.SchemaViolationException;
import com.tradegate.backend.model.Claim;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Extracts the JSON object from agent text (markdown fences and surrounding prose are
 * tolerated) and checks it against {@link AgentDecisionPayload}.
 */
@Component
@RequiredArgsConstructor
public class AgentOutputParser {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private final Validator validator;
    private final GateProperties gateProperties;

    public ParsedAgentOutput parse(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            throw new SchemaViolationException(List.of("output is empty"));
        }
        String json = extractJson(rawText);
        AgentDecisionPayload payload;
        try {
            payload = MAPPER.readValue(json, AgentDecisionPayload.class);
        } catch (InvalidFormatException e) {
            throw new SchemaViolationException(describe(e), e);
        } catch (MismatchedInputException e) {
            throw new SchemaViolationException("wrong JSON type at " + path(e) + ": " + e.getOriginalMessage(), e);
        } catch (JsonProcessingException e) {
            throw new SchemaViolationException("invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (payload == null) {
            throw new SchemaViolationException(List.of("output is JSON null"));
        }

        List<String> errors = validate(payload);
        if (!errors.isEmpty()) {
            throw new SchemaViolationException(errors);
        }
        List<Claim> claims = payload.getKeyClaims().stream().map(Claim::of).toList();
        return new ParsedAgentOutput(payload.getAction(), payload.getConfidence(), claims,
                payload.getRiskFraction(), payload.getReasoning());
    }

    List<String> validate(AgentDecisionPayload payload) {
        Set<ConstraintViolation<AgentDecisionPayload>> violations = validator.validate(payload);
        List<String> errors = violations.stream()
                .sorted(Comparator.comparing(violation -> violation.getPropertyPath().toString()))
                .map(violation -> violation.getPropertyPath() + ": " + violation.getMessage())
                .collect(Collectors.toCollection(ArrayList::new));
        int maxClaims = gateProperties.getSchema().getMaxKeyClaims();
        if (payload.getKeyClaims() != null && payload.getKeyClaims().size() > maxClaims) {
            errors.add("keyClaims: at most " + maxClaims + " claims allowed, got " + payload.getKeyClaims().size());
        }
        return errors;
    }

    static String extractJson(String text) {
        int fence = text.indexOf("```");
        if (fence >= 0) {
            int start = text.indexOf('\n', fence);
            int end = start < 0 ? -1 : text.indexOf("```", start);
            if (end > start) {
                return text.substring(start + 1, end).strip();
            }
        }
        int open = text.indexOf('{');
        int close = text.lastIndexOf('}');
        if (open >= 0 && close > open) {
            return text.substring(open, close + 1);
        }
        return text.strip();
    }

    private static String describe(InvalidFormatException e) {
        Class<?> target = e.getTargetType();
        if (target != null && target.isEnum()) {
            return path(e) + ": '" + e.getValue() + "' is not one of " + Arrays.toString(target.getEnumConstants());
        }
        return path(e) + ": '" + e.getValue() + "' is not a valid " + (target == null ? "value" : target.getSimpleName());
    }

    private static String path(MismatchedInputException e) {
        return e.getPath().stream()
                .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : "[" + ref.getIndex() + "]")
                .collect(Collectors.joining("."));
    }
}
