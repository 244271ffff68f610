package com.tradegate.backend.validation;

import com.tradegate.backend.config.GateProperties;
import com.tradegate.backend.model.GroundTruthFact;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Picks the ground-truth fact a claim talks about. The longest keyword that
 * appears in the claim wins, ties go to the metric name that sorts first.
 */
@Component
@RequiredArgsConstructor
public class MetricResolver {

    private final GateProperties gateProperties;

    public Optional<GroundTruthFact> resolve(String claimText, Collection<GroundTruthFact> facts) {
        String text = claimText.toLowerCase(Locale.ROOT);
        GroundTruthFact best = null;
        int bestScore = 0;
        List<GroundTruthFact> ordered = new ArrayList<>(facts);
        ordered.sort(Comparator.comparing(GroundTruthFact::metricName));
        for (GroundTruthFact fact : ordered) {
            int score = score(text, fact.metricName());
            if (score > bestScore) {
                best = fact;
                bestScore = score;
            }
        }
        return Optional.ofNullable(best);
    }

    List<String> keywords(String metricName) {
        List<String> keywords = new ArrayList<>();
        String normalized = metricName.toLowerCase(Locale.ROOT);
        keywords.add(normalized);
        keywords.add(normalized.replace('_', ' '));
        List<String> aliases = gateProperties.getFactCheck().getMetricAliases().get(metricName);
        if (aliases != null) {
            aliases.forEach(alias -> keywords.add(alias.toLowerCase(Locale.ROOT)));
        }
        return keywords;
    }

    private int score(String text, String metricName) {
        int best = 0;
        for (String keyword : keywords(metricName)) {
            if (keyword.length() > best && containsWord(text, keyword)) {
                best = keyword.length();
            }
        }
        return best;
    }

    private static boolean containsWord(String text, String keyword) {
        return Pattern.compile("(?<![a-z0-9])" + Pattern.quote(keyword) + "(?![a-z0-9])")
                .matcher(text)
                .find();
    }
}
