package com.supplyplanner.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
public class ForecastResult {
    List<Double> forecast;
    List<Double> lowerBound;
    List<Double> upperBound;
    Map<String, List<Double>> modelForecasts;
    Map<String, Double> storeShares;
    Map<String, Double> storeDemand;
    Map<String, Double> featureImportance;
    double modelAccuracy;
    int historyPeriods;
    List<String> periods;

    @Builder
    private ForecastResult(List<Double> forecast, List<Double> lowerBound, List<Double> upperBound,
                           Map<String, List<Double>> modelForecasts, Map<String, Double> storeShares,
                           Map<String, Double> storeDemand, Map<String, Double> featureImportance,
                           double modelAccuracy, int historyPeriods, List<String> periods) {
        this.forecast = ResultCollections.list(forecast);
        this.lowerBound = ResultCollections.list(lowerBound);
        this.upperBound = ResultCollections.list(upperBound);
        this.modelForecasts = ResultCollections.listMap(modelForecasts);
        this.storeShares = ResultCollections.map(storeShares);
        this.storeDemand = ResultCollections.map(storeDemand);
        this.featureImportance = ResultCollections.map(featureImportance);
        this.modelAccuracy = modelAccuracy;
        this.historyPeriods = historyPeriods;
        this.periods = ResultCollections.list(periods);
    }

    public double totalStoreDemand() {
        return storeDemand.values().stream().mapToDouble(Double::doubleValue).sum();
    }
}
