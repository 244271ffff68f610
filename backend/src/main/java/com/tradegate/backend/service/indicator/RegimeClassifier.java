package com.tradegate.backend.service.indicator;

import com.tradegate.backend.config.GateProperties;
import com.tradegate.backend.exception.InsufficientDataException;
import com.tradegate.backend.model.MarketRegime;
import com.tradegate.backend.model.PriceBar;
import com.tradegate.backend.model.PriceSeries;
import com.tradegate.backend.model.RegimeClassification;
import com.tradegate.backend.service.DecisionAuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Classifies the market regime from trailing price statistics.
 * <p>
 * Precedence, first match wins: high volatility, strong trend (direction from the
 * trailing return), mean reversion, sideways. Volatility overrides trend, so a
 * violently trending market is reported as {@link MarketRegime#VOLATILE}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RegimeClassifier {

    private final AdxService adxService;
    private final VolatilityService volatilityService;
    private final HurstExponentService hurstExponentService;
    private final GateProperties gateProperties;
    private final DecisionAuditService decisionAuditService;

    /**
     * @throws InsufficientDataException when fewer than the minimum lookback bars are visible at {@code asOf}
     */
    public RegimeClassification classify(PriceSeries series, LocalDate asOf) {
        GateProperties.Regime config = gateProperties.getRegime();
        List<PriceBar> visible = series.upTo(asOf);
        if (visible.size() < config.getMinLookbackBars()) {
            throw new InsufficientDataException(series.assetId(), visible.size(), config.getMinLookbackBars());
        }
        List<PriceBar> window = series.trailing(asOf, config.effectiveWindow());

        double volatility = volatilityService.annualizedVolatility(window);
        double trendStrength = adxService.calculate(window).adx();
        double hurst = hurstExponentService.calculate(window);
        double trailingReturn = volatilityService.trailingReturn(window);

        MarketRegime regime;
        if (volatility > config.getVolatilityThreshold()) {
            regime = MarketRegime.VOLATILE;
        } else if (trendStrength > config.getTrendThreshold() && trailingReturn > 0) {
            regime = MarketRegime.TRENDING_UP;
        } else if (trendStrength > config.getTrendThreshold() && trailingReturn < 0) {
            regime = MarketRegime.TRENDING_DOWN;
        } else if (hurst < config.getMeanReversionThreshold()) {
            regime = MarketRegime.MEAN_REVERTING;
        } else {
            regime = MarketRegime.SIDEWAYS;
        }

        LocalDate asOfDate = asOf != null ? asOf : window.get(window.size() - 1).date();
        log.debug("Regime {} for {} on {} (vol={}, adx={}, hurst={}, return={})",
                regime, series.assetId(), asOfDate, volatility, trendStrength, hurst, trailingReturn);
        decisionAuditService.record(series.assetId(), asOfDate, "REGIME", Map.of(
                "regime", regime.name(),
                "volatility", volatility,
                "trendStrength", trendStrength,
                "hurst", hurst,
                "trailingReturn", trailingReturn
        ));
        return new RegimeClassification(series.assetId(), asOfDate, regime, volatility, trendStrength, hurst,
                trailingReturn, window.size());
    }
}
