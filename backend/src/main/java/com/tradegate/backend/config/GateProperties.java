package com.tradegate.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "gate")
@Data
@Validated
public class GateProperties {

    @Valid
    private Regime regime = new Regime();
    @Valid
    private FactCheck factCheck = new FactCheck();
    @Valid
    private Schema schema = new Schema();
    @Valid
    private Risk risk = new Risk();
    @Valid
    private Pipeline pipeline = new Pipeline();

    @Data
    public static class Regime {
        @Min(20)
        private int minLookbackBars = 60;

        /** Trailing bars used for the statistics; 0 means same as the minimum lookback. */
        @PositiveOrZero
        private int windowBars = 0;

        @Positive
        private int periodsPerYear = 252;

        @Positive
        private double volatilityThreshold = 0.40;

        @Positive
        private double trendThreshold = 25.0;

        @Min(2)
        private int adxPeriod = 14;

        @Positive
        private double meanReversionThreshold = 0.40;

        @Min(3)
        private int hurstMaxLag = 20;

        public int effectiveWindow() {
            return windowBars > 0 ? Math.max(windowBars, minLookbackBars) : minLookbackBars;
        }
    }

    @Data
    public static class FactCheck {
        @Positive
        private double numericTolerance = 0.10;

        @Positive
        @DecimalMax("1.0")
        private double fallbackConfidence = 0.6;

        @Min(1)
        private int cacheCapacity = 10_000;

        @Min(1)
        private int cacheRetainedDays = 1;

        /**
         * Claim keywords that point at a ground-truth metric, beyond the metric name itself.
         */
        private Map<String, List<String>> metricAliases = defaultAliases();

        private static Map<String, List<String>> defaultAliases() {
            Map<String, List<String>> aliases = new LinkedHashMap<>();
            aliases.put("revenue_growth_yoy", List.of("revenue", "sales", "top line"));
            aliases.put("earnings_growth", List.of("earnings", "eps", "net income", "profit"));
            aliases.put("price_change_pct", List.of("share price", "stock price", "price", "shares"));
            aliases.put("rsi", List.of("rsi", "relative strength"));
            aliases.put("pe_ratio", List.of("p/e", "pe ratio", "price to earnings", "price-to-earnings"));
            aliases.put("gross_margin", List.of("gross margin"));
            return aliases;
        }
    }

    @Data
    public static class Schema {
        @Min(0)
        private int maxRetries = 2;

        @Min(1)
        private int maxKeyClaims = 5;
    }

    @Data
    public static class Risk {
        @Positive
        @DecimalMax("1.0")
        private double riskPerTradeMax = 0.02;

        @Positive
        @DecimalMax("1.0")
        private double portfolioHeatMax = 0.10;

        @Positive
        @DecimalMax("1.0")
        private double circuitBreakerDrawdown = 0.15;

        @Positive
        @DecimalMax("1.0")
        private double maxAssetExposure = 0.20;

        @Positive
        private double atrStopMultiple = 2.0;

        @Positive
        private double defaultVolatility = 0.02;
    }

    @Data
    public static class Pipeline {
        @Positive
        private long factCheckLatencyBudgetMs = 2000;

        @Min(1)
        private int atrPeriod = 14;
    }
}
