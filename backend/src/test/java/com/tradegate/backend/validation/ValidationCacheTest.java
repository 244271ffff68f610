package com.tradegate.backend.validation;

import com.tradegate.backend.config.GateProperties;
import com.tradegate.backend.model.Claim;
import com.tradegate.backend.model.ValidationResult;
import com.tradegate.backend.model.ValidationSource;
import com.tradegate.backend.model.Verdict;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class ValidationCacheTest {

    private static final LocalDate MONDAY = LocalDate.of(2024, 3, 4);
    private static final LocalDate TUESDAY = MONDAY.plusDays(1);
    private static final LocalDate WEDNESDAY = MONDAY.plusDays(2);

    private static ValidationCache cache(int capacity, int retainedDays) {
        GateProperties properties = new GateProperties();
        properties.getFactCheck().setCacheCapacity(capacity);
        properties.getFactCheck().setCacheRetainedDays(retainedDays);
        return new ValidationCache(properties);
    }

    private static ValidationResult result(Claim claim) {
        return new ValidationResult(claim, Verdict.ENTAILMENT, 0.9, "test", ValidationSource.SEMANTIC);
    }

    @Test
    void evictsLeastRecentlyUsedEntry() {
        ValidationCache cache = cache(2, 1);
        Claim a = Claim.of("a"), b = Claim.of("b"), c = Claim.of("c");
        cache.put("AAPL", a, MONDAY, result(a));
        cache.put("AAPL", b, MONDAY, result(b));
        assertThat(cache.get("AAPL", a, MONDAY)).isPresent();

        cache.put("AAPL", c, MONDAY, result(c));

        assertThat(cache.get("AAPL", a, MONDAY)).isPresent();
        assertThat(cache.get("AAPL", b, MONDAY)).isEmpty();
        assertThat(cache.get("AAPL", c, MONDAY)).isPresent();
        assertThat(cache.stats().size()).isEqualTo(2);
    }

    @Test
    void entriesAreScopedToDateAndAsset() {
        ValidationCache cache = cache(10, 2);
        Claim claim = Claim.of("Revenue grew 8%");
        cache.put("AAPL", claim, MONDAY, result(claim));

        assertThat(cache.get("AAPL", claim, TUESDAY)).isEmpty();
        assertThat(cache.get("MSFT", claim, MONDAY)).isEmpty();
        assertThat(cache.get("AAPL", claim, MONDAY)).isPresent();
    }

    @Test
    void scheduledRotationKeepsHistoricalReplayDay() {
        ValidationCache cache = cache(10, 2);
        Claim claim = Claim.of("Revenue grew 8%");
        cache.put("AAPL", claim, MONDAY, result(claim));
        cache.put("AAPL", claim, TUESDAY, result(claim));

        cache.rotateDaily();

        assertThat(cache.get("AAPL", claim, MONDAY)).isPresent();
        assertThat(cache.get("AAPL", claim, TUESDAY)).isPresent();
        assertThat(cache.stats().days()).isEqualTo(2);
    }

    @Test
    void scheduledRotationTrimsRelativeToNewestDay() {
        ValidationCache cache = cache(10, 1);
        Claim claim = Claim.of("Revenue grew 8%");
        cache.put("AAPL", claim, MONDAY, result(claim));
        cache.rotateDaily();

        assertThat(cache.get("AAPL", claim, MONDAY)).isPresent();
        assertThat(cache.stats().days()).isEqualTo(1);
    }

    @Test
    void rotatingToNewDayDropsPriorDay() {
        ValidationCache cache = cache(10, 1);
        Claim claim = Claim.of("Revenue grew 8%");
        cache.put("AAPL", claim, MONDAY, result(claim));

        cache.rotateTo(TUESDAY);

        assertThat(cache.stats().days()).isZero();
        assertThat(cache.get("AAPL", claim, MONDAY)).isEmpty();
    }

    @Test
    void retentionKeepsMostRecentDays() {
        ValidationCache cache = cache(10, 2);
        Claim claim = Claim.of("Revenue grew 8%");
        cache.put("AAPL", claim, MONDAY, result(claim));
        cache.put("AAPL", claim, TUESDAY, result(claim));

        cache.put("AAPL", claim, WEDNESDAY, result(claim));

        assertThat(cache.stats().days()).isEqualTo(2);
        assertThat(cache.get("AAPL", claim, MONDAY)).isEmpty();
        assertThat(cache.get("AAPL", claim, TUESDAY)).isPresent();
        assertThat(cache.get("AAPL", claim, WEDNESDAY)).isPresent();
    }

    @Test
    void statsTrackHitsAndMisses() {
        ValidationCache cache = cache(10, 1);
        Claim claim = Claim.of("Revenue grew 8%");
        cache.get("AAPL", claim, MONDAY);
        cache.put("AAPL", claim, MONDAY, result(claim));
        cache.get("AAPL", claim, MONDAY);

        ValidationCache.CacheStats stats = cache.stats();
        assertThat(stats.hits()).isEqualTo(1);
        assertThat(stats.misses()).isEqualTo(1);
        assertThat(stats.hitRate()).isEqualTo(0.5);

        cache.clear();
        assertThat(cache.stats().size()).isZero();
        assertThat(cache.stats().hits()).isZero();
    }

    @Test
    void keyIsStableHash() {
        assertThat(ValidationCache.key("AAPL", "claim", MONDAY))
                .isEqualTo(ValidationCache.key("AAPL", "claim", MONDAY))
                .hasSize(32)
                .isNotEqualTo(ValidationCache.key("AAPL", "claim", TUESDAY));
    }
}
