package com.tradegate.backend.validation;

import com.tradegate.backend.config.GateProperties;
import com.tradegate.backend.model.Claim;
import com.tradegate.backend.model.FactCheckReport;
import com.tradegate.backend.model.GroundTruthFact;
import com.tradegate.backend.model.MetricUnit;
import com.tradegate.backend.model.ValidationResult;
import com.tradegate.backend.model.ValidationSource;
import com.tradegate.backend.model.Verdict;
import com.tradegate.backend.service.MetricsService;
import com.tradegate.backend.validation.NumericClaimParser.Direction;
import com.tradegate.backend.validation.NumericClaimParser.ParsedClaim;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * Checks agent claims against ground truth. A numeric contradiction is final; otherwise
 * the entailment model decides, with keyword matching standing in when it is down.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FactValidator {

    private final NumericClaimParser numericClaimParser;
    private final MetricResolver metricResolver;
    private final EntailmentClassifier entailmentClassifier;
    private final ValidationCache validationCache;
    private final GateProperties gateProperties;
    private final MetricsService metricsService;

    public FactCheckReport validate(String assetId, List<Claim> claims, Map<String, GroundTruthFact> groundTruth,
                                    LocalDate asOf) {
        validationCache.rotateTo(asOf);
        Map<String, GroundTruthFact> facts = groundTruth == null ? Map.of() : groundTruth;
        List<ValidationResult> results = new ArrayList<>(claims.size());
        int cacheHits = 0;
        for (Claim claim : claims) {
            Optional<ValidationResult> cached = validationCache.get(assetId, claim, asOf);
            metricsService.recordCacheLookup(cached.isPresent());
            if (cached.isPresent()) {
                cacheHits++;
                results.add(cached.get());
                continue;
            }
            ValidationResult result = validateClaim(claim, facts);
            validationCache.put(assetId, claim, asOf, result);
            results.add(result);
        }
        FactCheckReport report = FactCheckReport.of(results, cacheHits);
        if (report.degradedCount() > 0) {
            log.warn("Fact check for {} on {} ran degraded: {} of {} claims used keyword fallback",
                    assetId, asOf, report.degradedCount(), claims.size());
        }
        log.debug("Fact check for {} on {}: allValid={}, cacheHits={}", assetId, asOf, report.allValid(), cacheHits);
        return report;
    }

    ValidationResult validateClaim(Claim claim, Map<String, GroundTruthFact> facts) {
        ParsedClaim parsed = numericClaimParser.parse(claim.text());
        Optional<GroundTruthFact> relevant = metricResolver.resolve(claim.text(), facts.values());

        String numericNote = null;
        if (relevant.isPresent()) {
            GroundTruthFact fact = relevant.get();
            OptionalDouble claimed = numericClaimParser.claimedValue(parsed, fact.unit());
            if (claimed.isPresent()) {
                double divergence = divergence(claimed.getAsDouble(), fact.value());
                String comparison = String.format(Locale.ROOT, "claimed %s=%.4f vs actual %.4f (divergence %.2f)",
                        fact.metricName(), claimed.getAsDouble(), fact.value(), divergence);
                if (divergence > gateProperties.getFactCheck().getNumericTolerance()) {
                    return new ValidationResult(claim, Verdict.CONTRADICTION, 1.0,
                            "Numeric mismatch: " + comparison, ValidationSource.NUMERIC);
                }
                numericNote = "numeric check passed: " + comparison;
            }
        }
        return semanticCheck(claim, parsed, relevant, facts, numericNote);
    }

    static double divergence(double claimed, double truth) {
        if (truth == 0.0) {
            return Math.abs(claimed);
        }
        return Math.abs(claimed - truth) / Math.abs(truth);
    }

    private ValidationResult semanticCheck(Claim claim, ParsedClaim parsed, Optional<GroundTruthFact> relevant,
                                           Map<String, GroundTruthFact> facts, String numericNote) {
        if (facts.isEmpty()) {
            return new ValidationResult(claim, Verdict.NEUTRAL, 0.0,
                    withNote("no ground truth available", numericNote), ValidationSource.SEMANTIC);
        }
        List<GroundTruthFact> premiseFacts = relevant.map(List::of)
                .orElseGet(() -> facts.values().stream()
                        .sorted(Comparator.comparing(GroundTruthFact::metricName))
                        .toList());
        String premise = premise(premiseFacts);

        EntailmentResponse response;
        try {
            response = entailmentClassifier.classify(premise, claim.text());
        } catch (RuntimeException e) {
            response = EntailmentResponse.unavailable(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        if (response != null && response.isAvailable()) {
            return new ValidationResult(claim, response.label(), response.confidence(),
                    withNote("NLI " + response.label() + " against premise: " + premise, numericNote),
                    ValidationSource.SEMANTIC);
        }

        String cause = response == null ? "UNAVAILABLE" : response.status().name();
        log.debug("ModelUnavailable ({}), keyword fallback for claim '{}'",
                response == null ? "null response" : response.detail(), claim.text());
        metricsService.recordClassifierFallback(cause);
        return keywordFallback(claim, parsed, relevant, numericNote);
    }

    private ValidationResult keywordFallback(Claim claim, ParsedClaim parsed, Optional<GroundTruthFact> relevant,
                                             String numericNote) {
        double confidence = gateProperties.getFactCheck().getFallbackConfidence();
        if (relevant.isEmpty() || !relevant.get().unit().isChange()
                || parsed.direction() == Direction.NONE || relevant.get().value() == 0.0) {
            return new ValidationResult(claim, Verdict.NEUTRAL, confidence,
                    withNote("keyword fallback: no directional comparison possible", numericNote),
                    ValidationSource.FALLBACK);
        }
        GroundTruthFact fact = relevant.get();
        Direction actual = fact.value() > 0 ? Direction.RISE : Direction.FALL;
        boolean agrees = actual == parsed.direction();
        String evidence = String.format(Locale.ROOT, "keyword fallback: claim says %s, %s is %.4f",
                parsed.direction().name().toLowerCase(Locale.ROOT), fact.metricName(), fact.value());
        return new ValidationResult(claim, agrees ? Verdict.ENTAILMENT : Verdict.CONTRADICTION, confidence,
                withNote(evidence, numericNote), ValidationSource.FALLBACK);
    }

    static String premise(List<GroundTruthFact> facts) {
        return facts.stream().map(FactValidator::describe).collect(Collectors.joining(" "));
    }

    static String describe(GroundTruthFact fact) {
        String label = label(fact.metricName());
        double value = fact.value();
        if (fact.unit().isChange()) {
            double percent = fact.unit() == MetricUnit.RATIO ? value * 100.0 : value;
            if (percent == 0.0) {
                return label + " was unchanged.";
            }
            return String.format(Locale.ROOT, "%s %s by %.1f%%.", label,
                    percent > 0 ? "increased" : "decreased", Math.abs(percent));
        }
        if (fact.unit() == MetricUnit.CURRENCY) {
            return String.format(Locale.ROOT, "%s was $%,.2f.", label, value);
        }
        return String.format(Locale.ROOT, "%s was %.2f.", label, value);
    }

    private static String label(String metricName) {
        String spaced = metricName.replace('_', ' ').trim();
        return spaced.isEmpty() ? metricName : Character.toUpperCase(spaced.charAt(0)) + spaced.substring(1);
    }

    private static String withNote(String evidence, String numericNote) {
        return numericNote == null ? evidence : evidence + "; " + numericNote;
    }
}
