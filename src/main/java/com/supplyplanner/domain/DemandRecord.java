package com.supplyplanner.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Observed demand of one store in one period. Forecasting features
 * ({@code seasonality_factor}, {@code trend_component}, {@code economic_indicator})
 * travel in the attribute map.
 */
@Value
@Builder(toBuilder = true)
public class DemandRecord {
    String storeId;
    String period;
    double quantity;
    @Singular
    Map<String, Object> attributes;

    /**
     * Numeric attribute value, or {@code fallback} when absent or not a number.
     */
    public double feature(String name, double fallback) {
        Object value = attributes.get(name);
        if (value instanceof Number number) {
            double v = number.doubleValue();
            return Double.isFinite(v) ? v : fallback;
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException ex) {
                return fallback;
            }
        }
        return fallback;
    }
}
