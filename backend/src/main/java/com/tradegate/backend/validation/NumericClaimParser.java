package com.tradegate.backend.validation;

import com.tradegate.backend.model.MetricUnit;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls numeric mentions and a direction of change out of free-text claims.
 */
@Component
public class NumericClaimParser {

    private static final Pattern PERCENT = Pattern.compile(
            "(?<![\\w.])([+-]?\\d{1,3}(?:,\\d{3})+(?:\\.\\d+)?|[+-]?\\d+(?:\\.\\d+)?)\\s*(?:%|percent\\b|pct\\b)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern CURRENCY = Pattern.compile(
            "([+-])?\\$\\s*(\\d{1,3}(?:,\\d{3})+(?:\\.\\d+)?|\\d+(?:\\.\\d+)?)\\s*(thousand|million|billion|trillion|bn|mm|k|m|b|t)?\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern PLAIN = Pattern.compile(
            "(?<![\\w.$,])([+-]?\\d+(?:\\.\\d+)?)(?![\\d%.,])");

    /** Lookback settings such as "RSI(14)" or "14-day", never the reading itself. */
    private static final Pattern INDICATOR_PARAMETER = Pattern.compile(
            "\\(\\s*\\d+(?:\\s*,\\s*\\d+)*\\s*\\)|\\b\\d+[- ](?:day|week|month|period|bar|session)s?\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern RISE = Pattern.compile(
            "\\b(?:increas|grew|grow|rose|rise|rising|up\\b|gain|higher|jump|surg|climb|soar|expand|improv|beat)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern FALL = Pattern.compile(
            "\\b(?:decreas|fell|fall|drop|declin|down\\b|loss|lost|lower|plung|slump|shrank|shrink|contract|tumbl|slid|miss)",
            Pattern.CASE_INSENSITIVE);

    public enum MentionKind {
        PERCENT,
        CURRENCY,
        PLAIN
    }

    public enum Direction {
        RISE,
        FALL,
        NONE
    }

    public record NumericMention(double value, MentionKind kind, int position) {
    }

    public record ParsedClaim(List<NumericMention> mentions, Direction direction) {

        public boolean hasNumbers() {
            return !mentions.isEmpty();
        }

        OptionalDouble first(MentionKind kind) {
            return mentions.stream()
                    .filter(mention -> mention.kind() == kind)
                    .mapToDouble(NumericMention::value)
                    .findFirst();
        }
    }

    public ParsedClaim parse(String text) {
        List<NumericMention> mentions = new ArrayList<>();
        List<int[]> taken = new ArrayList<>();

        Matcher percent = PERCENT.matcher(text);
        while (percent.find()) {
            mentions.add(new NumericMention(number(percent.group(1)), MentionKind.PERCENT, percent.start()));
            taken.add(new int[]{percent.start(), percent.end()});
        }

        Matcher currency = CURRENCY.matcher(text);
        while (currency.find()) {
            if (overlaps(taken, currency.start(), currency.end())) {
                continue;
            }
            double value = number(currency.group(2)) * multiplier(currency.group(3));
            if ("-".equals(currency.group(1))) {
                value = -value;
            }
            mentions.add(new NumericMention(value, MentionKind.CURRENCY, currency.start()));
            taken.add(new int[]{currency.start(), currency.end()});
        }

        Matcher parameter = INDICATOR_PARAMETER.matcher(text);
        while (parameter.find()) {
            taken.add(new int[]{parameter.start(), parameter.end()});
        }

        Matcher plain = PLAIN.matcher(text);
        while (plain.find()) {
            if (overlaps(taken, plain.start(), plain.end())) {
                continue;
            }
            double value = number(plain.group(1));
            if (looksLikeYear(plain.group(1))) {
                continue;
            }
            mentions.add(new NumericMention(value, MentionKind.PLAIN, plain.start()));
        }

        mentions.sort(Comparator.comparingInt(NumericMention::position));
        return new ParsedClaim(List.copyOf(mentions), direction(text));
    }

    /**
     * Converts the claim's mention into the fact's unit. Change-type units carry the
     * claim's direction as the sign, so "fell 5%" compares as -5%.
     */
    public OptionalDouble claimedValue(ParsedClaim parsed, MetricUnit unit) {
        OptionalDouble raw = switch (unit) {
            case RATIO -> scale(parsed.first(MentionKind.PERCENT), 0.01);
            case PERCENT -> parsed.first(MentionKind.PERCENT);
            case CURRENCY -> parsed.first(MentionKind.CURRENCY);
            case POINTS -> parsed.first(MentionKind.PLAIN);
        };
        if (raw.isEmpty() || !unit.isChange()) {
            return raw;
        }
        double value = raw.getAsDouble();
        if (parsed.direction() == Direction.FALL) {
            return OptionalDouble.of(-Math.abs(value));
        }
        if (parsed.direction() == Direction.RISE) {
            return OptionalDouble.of(Math.abs(value));
        }
        return OptionalDouble.of(value);
    }

    /**
     * Direction named by the earliest change word; an explicit minus sign reads as a fall.
     */
    Direction direction(String text) {
        Matcher rise = RISE.matcher(text);
        Matcher fall = FALL.matcher(text);
        int risePos = rise.find() ? rise.start() : Integer.MAX_VALUE;
        int fallPos = fall.find() ? fall.start() : Integer.MAX_VALUE;
        if (risePos == Integer.MAX_VALUE && fallPos == Integer.MAX_VALUE) {
            return text.matches("(?s).*(?<![\\w])-\\d.*") ? Direction.FALL : Direction.NONE;
        }
        return risePos < fallPos ? Direction.RISE : Direction.FALL;
    }

    private static OptionalDouble scale(OptionalDouble value, double factor) {
        return value.isPresent() ? OptionalDouble.of(value.getAsDouble() * factor) : value;
    }

    private static boolean overlaps(List<int[]> taken, int start, int end) {
        for (int[] span : taken) {
            if (start < span[1] && end > span[0]) {
                return true;
            }
        }
        return false;
    }

    private static boolean looksLikeYear(String token) {
        if (token.length() != 4 || token.contains(".")) {
            return false;
        }
        int year = Integer.parseInt(token);
        return year >= 1900 && year <= 2100;
    }

    private static double number(String token) {
        return Double.parseDouble(token.replace(",", ""));
    }

    private static double multiplier(String suffix) {
        if (suffix == null) {
            return 1.0;
        }
        return switch (suffix.toLowerCase(Locale.ROOT)) {
            case "k", "thousand" -> 1e3;
            case "m", "mm", "million" -> 1e6;
            case "b", "bn", "billion" -> 1e9;
            case "t", "trillion" -> 1e12;
            default -> 1.0;
        };
    }
}
