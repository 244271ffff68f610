package com.tradegate.backend.service.indicator;

import com.tradegate.backend.config.GateProperties;
import com.tradegate.backend.model.PriceBar;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
public class AtrService {

    private final GateProperties gateProperties;

    public AtrResult calculate(List<PriceBar> bars) {
        if (bars == null || bars.size() < 2) {
            return new AtrResult(0, 0);
        }
        int period = gateProperties.getPipeline().getAtrPeriod();
        double atr = calculateAtrWilder(bars, period);
        double lastClose = bars.get(bars.size() - 1).close();
        double atrFraction = lastClose <= 0 ? 0 : atr / lastClose;
        return new AtrResult(atr, atrFraction);
    }

    private double calculateAtrWilder(List<PriceBar> bars, int period) {
        if (bars.size() < period + 1) {
            return 0.0;
        }
        List<Double> tr = new ArrayList<>();
        for (int i = 1; i < bars.size(); i++) {
            tr.add(AdxService.trueRange(bars.get(i), bars.get(i - 1)));
        }
        double atr = tr.subList(0, period).stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        for (int i = period; i < tr.size(); i++) {
            atr = ((atr * (period - 1)) + tr.get(i)) / period;
        }
        return atr;
    }

    /**
     * @param atr          average true range in price units
     * @param atrFraction  ATR relative to the last close, e.g. 0.02 for 2%
     */
    public record AtrResult(double atr, double atrFraction) {}
}
