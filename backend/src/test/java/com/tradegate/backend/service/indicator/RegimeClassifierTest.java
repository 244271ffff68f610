package com.tradegate.backend.service.indicator;

import com.tradegate.backend.config.GateProperties;
import com.tradegate.backend.exception.InsufficientDataException;
import com.tradegate.backend.model.MarketRegime;
import com.tradegate.backend.model.PriceSeries;
import com.tradegate.backend.model.RegimeClassification;
import com.tradegate.backend.service.DecisionAuditService;
import com.tradegate.backend.util.TestPriceSeriesFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RegimeClassifierTest {

    private GateProperties properties;
    private RegimeClassifier classifier;

    @BeforeEach
    void setUp() {
        properties = new GateProperties();
        classifier = new RegimeClassifier(
                new AdxService(properties),
                new VolatilityService(properties),
                new HurstExponentService(properties),
                properties,
                mock(DecisionAuditService.class));
    }

    @Test
    void sixtyPercentVolatilityIsVolatile() {
        PriceSeries series = TestPriceSeriesFactory.alternatingLogReturns("VOL", 80, 100, 0.0378);

        RegimeClassification result = classifier.classify(series, TestPriceSeriesFactory.dateOf(79));

        assertThat(result.volatility()).isCloseTo(0.60, within(0.01));
        assertThat(result.regime()).isEqualTo(MarketRegime.VOLATILE);
        assertThat(result.barsUsed()).isEqualTo(60);
    }

    @Test
    void steadyRiseIsTrendingUp() {
        PriceSeries series = TestPriceSeriesFactory.trending("UP", 80, 100, 0.01);

        RegimeClassification result = classifier.classify(series, TestPriceSeriesFactory.dateOf(79));

        assertThat(result.trendStrength()).isGreaterThan(25);
        assertThat(result.trailingReturn()).isPositive();
        assertThat(result.regime()).isEqualTo(MarketRegime.TRENDING_UP);
    }

    @Test
    void steadyDeclineIsTrendingDown() {
        PriceSeries series = TestPriceSeriesFactory.trending("DOWN", 80, 100, -0.01);

        RegimeClassification result = classifier.classify(series, TestPriceSeriesFactory.dateOf(79));

        assertThat(result.regime()).isEqualTo(MarketRegime.TRENDING_DOWN);
    }

    @Test
    void zigzagIsMeanReverting() {
        PriceSeries series = TestPriceSeriesFactory.zigzag("ZIG", 80, 100, 1);

        RegimeClassification result = classifier.classify(series, TestPriceSeriesFactory.dateOf(79));

        assertThat(result.volatility()).isLessThan(0.40);
        assertThat(result.meanReversionScore()).isLessThan(0.40);
        assertThat(result.regime()).isEqualTo(MarketRegime.MEAN_REVERTING);
    }

    @Test
    void shortHistoryRaisesInsufficientData() {
        PriceSeries series = TestPriceSeriesFactory.trending("SHORT", 59, 100, 0.01);

        assertThatThrownBy(() -> classifier.classify(series, TestPriceSeriesFactory.dateOf(58)))
                .isInstanceOf(InsufficientDataException.class)
                .satisfies(e -> {
                    InsufficientDataException ex = (InsufficientDataException) e;
                    assertThat(ex.getAvailableBars()).isEqualTo(59);
                    assertThat(ex.getRequiredBars()).isEqualTo(60);
                });
    }

    @Test
    void barsAfterAsOfDateAreNotVisible() {
        PriceSeries series = TestPriceSeriesFactory.trending("REPLAY", 120, 100, 0.01);

        assertThatThrownBy(() -> classifier.classify(series, TestPriceSeriesFactory.dateOf(30)))
                .isInstanceOf(InsufficientDataException.class);
        assertThat(classifier.classify(series, TestPriceSeriesFactory.dateOf(59)).asOfDate())
                .isEqualTo(TestPriceSeriesFactory.dateOf(59));
    }

    @Test
    void volatilityTakesPrecedenceOverTrend() {
        AdxService adx = mock(AdxService.class);
        VolatilityService vol = mock(VolatilityService.class);
        HurstExponentService hurst = mock(HurstExponentService.class);
        when(adx.calculate(anyList())).thenReturn(new AdxService.AdxResult(45, 40, 5));
        when(vol.annualizedVolatility(anyList())).thenReturn(0.55);
        when(vol.trailingReturn(anyList())).thenReturn(0.30);
        when(hurst.calculate(anyList())).thenReturn(0.2);
        RegimeClassifier mocked = new RegimeClassifier(adx, vol, hurst, properties, mock(DecisionAuditService.class));

        PriceSeries series = TestPriceSeriesFactory.trending("MIX", 60, 100, 0.01);

        assertThat(mocked.classify(series, null).regime()).isEqualTo(MarketRegime.VOLATILE);
    }

    @Test
    void noSignalIsSideways() {
        AdxService adx = mock(AdxService.class);
        VolatilityService vol = mock(VolatilityService.class);
        HurstExponentService hurst = mock(HurstExponentService.class);
        when(adx.calculate(anyList())).thenReturn(new AdxService.AdxResult(12, 10, 9));
        when(vol.annualizedVolatility(anyList())).thenReturn(0.15);
        when(vol.trailingReturn(anyList())).thenReturn(0.01);
        when(hurst.calculate(anyList())).thenReturn(0.52);
        RegimeClassifier mocked = new RegimeClassifier(adx, vol, hurst, properties, mock(DecisionAuditService.class));

        PriceSeries series = TestPriceSeriesFactory.trending("FLAT", 60, 100, 0.001);

        RegimeClassification result = mocked.classify(series, null);
        assertThat(result.regime()).isEqualTo(MarketRegime.SIDEWAYS);
        assertThat(result.asOfDate()).isEqualTo(TestPriceSeriesFactory.dateOf(59));
    }
}
