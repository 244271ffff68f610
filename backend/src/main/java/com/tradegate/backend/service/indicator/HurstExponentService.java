package com.tradegate.backend.service.indicator;

import com.tradegate.backend.config.GateProperties;
import com.tradegate.backend.model.PriceBar;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Hurst exponent from the scaling of lagged price differences. Values under 0.5 point
 * to mean reversion, 0.5 to a random walk, above 0.5 to persistence.
 */
@Service
@RequiredArgsConstructor
public class HurstExponentService {

    static final double RANDOM_WALK = 0.5;

    private final GateProperties gateProperties;

    public double calculate(List<PriceBar> bars) {
        int maxLag = gateProperties.getRegime().getHurstMaxLag();
        if (bars == null || bars.size() <= maxLag) {
            return RANDOM_WALK;
        }
        double[] closes = bars.stream().mapToDouble(PriceBar::close).toArray();

        List<Double> logLags = new ArrayList<>();
        List<Double> logTaus = new ArrayList<>();
        for (int lag = 2; lag < maxLag; lag++) {
            double tau = stdDevOfDifferences(closes, lag);
            // zero dispersion at a lag carries no scaling information
            if (tau > 0) {
                logLags.add(Math.log(lag));
                logTaus.add(Math.log(tau));
            }
        }
        if (logLags.size() < 2) {
            return RANDOM_WALK;
        }
        return slope(logLags, logTaus);
    }

    private double stdDevOfDifferences(double[] closes, int lag) {
        int n = closes.length - lag;
        double mean = 0.0;
        for (int i = 0; i < n; i++) {
            mean += closes[i + lag] - closes[i];
        }
        mean /= n;
        double sumSq = 0.0;
        for (int i = 0; i < n; i++) {
            double d = closes[i + lag] - closes[i] - mean;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / n);
    }

    private double slope(List<Double> xs, List<Double> ys) {
        int n = xs.size();
        double meanX = xs.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double meanY = ys.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double cov = 0.0;
        double varX = 0.0;
        for (int i = 0; i < n; i++) {
            cov += (xs.get(i) - meanX) * (ys.get(i) - meanY);
            varX += (xs.get(i) - meanX) * (xs.get(i) - meanX);
        }
        return varX == 0 ? RANDOM_WALK : cov / varX;
    }
}
