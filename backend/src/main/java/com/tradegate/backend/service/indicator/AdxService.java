package com.tradegate.backend.service.indicator;

import com.tradegate.backend.config.GateProperties;
import com.tradegate.backend.model.PriceBar;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Wilder's average directional index, used as the trend-strength measure.
 */
@Service
@RequiredArgsConstructor
public class AdxService {

    private final GateProperties gateProperties;

    public AdxResult calculate(List<PriceBar> bars) {
        if (bars == null || bars.size() < 2) {
            return new AdxResult(0, 0, 0);
        }
        int period = gateProperties.getRegime().getAdxPeriod();
        if (bars.size() < period + 1) {
            return new AdxResult(0, 0, 0);
        }

        List<Double> tr = new ArrayList<>();
        List<Double> dmPlus = new ArrayList<>();
        List<Double> dmMinus = new ArrayList<>();

        for (int i = 1; i < bars.size(); i++) {
            PriceBar curr = bars.get(i);
            PriceBar prev = bars.get(i - 1);
            double highDiff = curr.high() - prev.high();
            double lowDiff = prev.low() - curr.low();
            tr.add(trueRange(curr, prev));
            dmPlus.add((highDiff > lowDiff && highDiff > 0) ? highDiff : 0.0);
            dmMinus.add((lowDiff > highDiff && lowDiff > 0) ? lowDiff : 0.0);
        }

        double smoothTr = sum(tr.subList(0, period));
        double smoothPlus = sum(dmPlus.subList(0, period));
        double smoothMinus = sum(dmMinus.subList(0, period));

        List<Double> dxValues = new ArrayList<>();
        double plusDi = 0.0;
        double minusDi = 0.0;

        for (int i = period - 1; i < tr.size(); i++) {
            if (i > period - 1) {
                smoothTr = smoothTr - (smoothTr / period) + tr.get(i);
                smoothPlus = smoothPlus - (smoothPlus / period) + dmPlus.get(i);
                smoothMinus = smoothMinus - (smoothMinus / period) + dmMinus.get(i);
            }
            if (smoothTr == 0) {
                continue;
            }
            plusDi = 100.0 * (smoothPlus / smoothTr);
            minusDi = 100.0 * (smoothMinus / smoothTr);
            double diSum = plusDi + minusDi;
            dxValues.add(diSum == 0 ? 0.0 : (Math.abs(plusDi - minusDi) / diSum) * 100.0);
        }

        if (dxValues.size() < period) {
            return new AdxResult(0, plusDi, minusDi);
        }

        double adx = dxValues.subList(0, period).stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        for (int i = period; i < dxValues.size(); i++) {
            adx = ((adx * (period - 1)) + dxValues.get(i)) / period;
        }
        return new AdxResult(adx, plusDi, minusDi);
    }

    static double trueRange(PriceBar curr, PriceBar prev) {
        return Math.max(curr.high() - curr.low(),
                Math.max(Math.abs(curr.high() - prev.close()), Math.abs(curr.low() - prev.close())));
    }

    private static double sum(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).sum();
    }

    public record AdxResult(double adx, double plusDi, double minusDi) {}
}
