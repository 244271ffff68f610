package com.tradegate.backend.service.indicator;

import com.tradegate.backend.config.GateProperties;
import com.tradegate.backend.model.PriceBar;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class VolatilityService {

    private final GateProperties gateProperties;

    /**
     * Annualized realized volatility: sample standard deviation of log close-to-close
     * returns scaled by the square root of periods per year.
     */
    public double annualizedVolatility(List<PriceBar> bars) {
        if (bars == null || bars.size() < 3) {
            return 0.0;
        }
        int n = bars.size() - 1;
        double[] returns = new double[n];
        double mean = 0.0;
        for (int i = 1; i < bars.size(); i++) {
            double prev = bars.get(i - 1).close();
            double curr = bars.get(i).close();
            if (prev <= 0 || curr <= 0) {
                throw new IllegalArgumentException("Non-positive close in price series at " + bars.get(i).date());
            }
            returns[i - 1] = Math.log(curr / prev);
            mean += returns[i - 1];
        }
        mean /= n;
        double sumSq = 0.0;
        for (double r : returns) {
            sumSq += (r - mean) * (r - mean);
        }
        double stdDev = Math.sqrt(sumSq / (n - 1));
        return stdDev * Math.sqrt(gateProperties.getRegime().getPeriodsPerYear());
    }

    public double trailingReturn(List<PriceBar> bars) {
        if (bars == null || bars.size() < 2) {
            return 0.0;
        }
        double first = bars.get(0).close();
        double last = bars.get(bars.size() - 1).close();
        return first <= 0 ? 0.0 : (last - first) / first;
    }
}
