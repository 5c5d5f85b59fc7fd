package com.supplyplanner.service;

import com.supplyplanner.config.OptimizerProperties;
import com.supplyplanner.domain.DemandRecord;
import com.supplyplanner.domain.PeriodOrder;
import com.supplyplanner.dto.ForecastResult;
import com.supplyplanner.exception.InsufficientHistoryException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Forecasts aggregate demand with an ensemble of three models that are all linear in
 * the demand series (so scaling history scales the forecast), then splits the planning
 * demand across stores by their historical share.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DemandForecastService {

    public static final String LINEAR_TREND = "linear_trend";
    public static final String HOLT_SMOOTHING = "holt_smoothing";
    public static final String FEATURE_REGRESSION = "feature_regression";
    public static final List<String> FEATURES = List.of("seasonality_factor", "trend_component", "economic_indicator");

    private static final double[] FEATURE_DEFAULTS = {1.0, 0.0, 1.0};
    private static final double EPS = 1e-12;

    private final OptimizerProperties properties;

    private record ModelFit(double[] fitted, double[] forecast) {
    }

    private record RegressionFit(ModelFit fit, double[] importance) {
    }

    private record Bounds(double[] lower, double[] upper) {
    }

    /**
     * @param demands per-store demand history
     * @param seed    seed for the bootstrap confidence bounds
     */
    public ForecastResult forecast(List<DemandRecord> demands, long seed) {
        OptimizerProperties.Forecast config = properties.getForecast();
        int minHistory = config.getMinHistoryPeriods();
        if (demands == null || demands.isEmpty()) {
            throw new InsufficientHistoryException(
                    "No demand history supplied; at least " + minHistory + " period(s) per store required.");
        }

        Map<String, Map<String, DemandRecord>> byStore = new TreeMap<>();
        TreeSet<String> periodSet = new TreeSet<>(PeriodOrder.INSTANCE);
        for (DemandRecord record : demands) {
            byStore.computeIfAbsent(record.getStoreId(), k -> new TreeMap<>(PeriodOrder.INSTANCE))
                    .put(record.getPeriod(), record);
            periodSet.add(record.getPeriod());
        }
        for (Map.Entry<String, Map<String, DemandRecord>> store : byStore.entrySet()) {
            if (store.getValue().size() < minHistory) {
                throw new InsufficientHistoryException(store.getKey(), store.getValue().size(), minHistory);
            }
        }

        List<String> periods = new ArrayList<>(periodSet);
        double[] series = aggregateSeries(demands, periods);
        double[][] features = periodFeatures(demands, periods);
        int horizon = config.getHorizon();
        // planning demand may look further ahead than the published forecast
        int span = Math.max(horizon, config.getPlanningPeriods());

        ModelFit trend = linearTrend(series, span);
        ModelFit holt = holtSmoothing(series, span, config.getAlpha(), config.getBeta());
        RegressionFit regression = featureRegression(series, features, span, config.getRidgeLambda());
        ModelFit[] models = {trend, holt, regression.fit()};
        double[] weights = normalizedWeights(config);

        int n = series.length;
        double[] ensemble = new double[span];
        double[] fitted = new double[n];
        for (int m = 0; m < models.length; m++) {
            for (int h = 0; h < span; h++) {
                ensemble[h] += weights[m] * models[m].forecast()[h];
            }
            for (int t = 0; t < n; t++) {
                fitted[t] += weights[m] * models[m].fitted()[t];
            }
        }
        for (int h = 0; h < span; h++) {
            ensemble[h] = Math.max(0.0, ensemble[h]);
        }
        double[] forecast = Arrays.copyOf(ensemble, horizon);
        double[] residuals = new double[n];
        for (int t = 0; t < n; t++) {
            residuals[t] = series[t] - fitted[t];
        }

        Bounds bounds = bootstrapBounds(forecast, residuals, config, seed);
        Map<String, Double> shares = storeShares(byStore);
        double planningTotal = 0.0;
        for (int h = 0; h < config.getPlanningPeriods(); h++) {
            planningTotal += ensemble[h];
        }
        Map<String, Double> storeDemand = new LinkedHashMap<>();
        for (Map.Entry<String, Double> share : shares.entrySet()) {
            storeDemand.put(share.getKey(), share.getValue() * planningTotal);
        }

        Map<String, List<Double>> modelForecasts = new LinkedHashMap<>();
        modelForecasts.put(LINEAR_TREND, boxed(Arrays.copyOf(trend.forecast(), horizon)));
        modelForecasts.put(HOLT_SMOOTHING, boxed(Arrays.copyOf(holt.forecast(), horizon)));
        modelForecasts.put(FEATURE_REGRESSION, boxed(Arrays.copyOf(regression.fit().forecast(), horizon)));

        double accuracy = modelAccuracy(series, residuals);
        log.info("Forecast computed | stores={} | periods={} | horizon={} | planningDemand={} | accuracy={}",
                byStore.size(), n, horizon, planningTotal, accuracy);

        return ForecastResult.builder()
                .forecast(boxed(forecast))
                .lowerBound(boxed(bounds.lower()))
                .upperBound(boxed(bounds.upper()))
                .modelForecasts(modelForecasts)
                .storeShares(shares)
                .storeDemand(storeDemand)
                .featureImportance(featureImportance(regression.importance()))
                .modelAccuracy(accuracy)
                .historyPeriods(n)
                .periods(List.copyOf(periods))
                .build();
    }

    private double[] aggregateSeries(List<DemandRecord> demands, List<String> periods) {
        Map<String, Integer> index = periodIndex(periods);
        double[] series = new double[periods.size()];
        for (DemandRecord record : demands) {
            series[index.get(record.getPeriod())] += record.getQuantity();
        }
        return series;
    }

    /**
     * Quantity-weighted mean of each feature per period; plain mean when the period has no demand.
     */
    private double[][] periodFeatures(List<DemandRecord> demands, List<String> periods) {
        Map<String, Integer> index = periodIndex(periods);
        int n = periods.size();
        int k = FEATURES.size();
        double[][] weighted = new double[n][k];
        double[][] plain = new double[n][k];
        double[] weight = new double[n];
        int[] count = new int[n];
        for (DemandRecord record : demands) {
            int t = index.get(record.getPeriod());
            weight[t] += record.getQuantity();
            count[t]++;
            for (int f = 0; f < k; f++) {
                double value = record.feature(FEATURES.get(f), FEATURE_DEFAULTS[f]);
                weighted[t][f] += record.getQuantity() * value;
                plain[t][f] += value;
            }
        }
        double[][] features = new double[n][k];
        for (int t = 0; t < n; t++) {
            for (int f = 0; f < k; f++) {
                features[t][f] = weight[t] > EPS ? weighted[t][f] / weight[t] : plain[t][f] / count[t];
            }
        }
        return features;
    }

    private ModelFit linearTrend(double[] y, int span) {
        int n = y.length;
        double[] fitted = new double[n];
        double[] forecast = new double[span];
        if (n == 1) {
            Arrays.fill(fitted, y[0]);
            Arrays.fill(forecast, y[0]);
            return new ModelFit(fitted, forecast);
        }
        SimpleRegression regression = new SimpleRegression();
        for (int t = 0; t < n; t++) {
            regression.addData(t, y[t]);
        }
        for (int t = 0; t < n; t++) {
            fitted[t] = regression.predict(t);
        }
        for (int h = 0; h < span; h++) {
            forecast[h] = regression.predict(n + h);
        }
        return new ModelFit(fitted, forecast);
    }

    private ModelFit holtSmoothing(double[] y, int span, double alpha, double beta) {
        int n = y.length;
        double[] fitted = new double[n];
        double level = y[0];
        double trend = n > 1 ? y[1] - y[0] : 0.0;
        fitted[0] = y[0];
        for (int t = 1; t < n; t++) {
            fitted[t] = level + trend;
            double previousLevel = level;
            level = alpha * y[t] + (1 - alpha) * (level + trend);
            trend = beta * (level - previousLevel) + (1 - beta) * trend;
        }
        double[] forecast = new double[span];
        for (int h = 0; h < span; h++) {
            forecast[h] = level + (h + 1) * trend;
        }
        return new ModelFit(fitted, forecast);
    }

    /**
     * Ridge regression on standardized features with an unpenalized intercept, forecast with the
     * latest observed feature vector. Falls back to the mean with fewer than two periods.
     */
    private RegressionFit featureRegression(double[] y, double[][] x, int span, double lambda) {
        int n = y.length;
        int k = FEATURES.size();
        double yBar = StatUtils.mean(y);
        double[] fitted = new double[n];
        double[] forecast = new double[span];
        if (n < 2) {
            Arrays.fill(fitted, yBar);
            Arrays.fill(forecast, yBar);
            return new RegressionFit(new ModelFit(fitted, forecast), new double[k]);
        }

        RealMatrix z = new Array2DRowRealMatrix(n, k);
        StandardDeviation deviation = new StandardDeviation(false);
        for (int f = 0; f < k; f++) {
            double[] column = new double[n];
            for (int t = 0; t < n; t++) {
                column[t] = x[t][f];
            }
            double mu = StatUtils.mean(column);
            double sd = deviation.evaluate(column);
            for (int t = 0; t < n; t++) {
                z.setEntry(t, f, sd > EPS ? (column[t] - mu) / sd : 0.0);
            }
        }

        RealVector centered = new ArrayRealVector(y).mapSubtract(yBar);
        RealMatrix gram = z.transpose().multiply(z);
        for (int a = 0; a < k; a++) {
            gram.addToEntry(a, a, lambda);
        }
        RealVector coefficients;
        try {
            coefficients = new LUDecomposition(gram).getSolver().solve(z.transpose().operate(centered));
        } catch (SingularMatrixException ex) {
            log.debug("Feature regression singular, falling back to mean | periods={}", n);
            coefficients = new ArrayRealVector(k);
        }

        RealVector prediction = z.operate(coefficients).mapAdd(yBar);
        for (int t = 0; t < n; t++) {
            fitted[t] = prediction.getEntry(t);
        }
        Arrays.fill(forecast, prediction.getEntry(n - 1));
        double[] importance = new double[k];
        for (int f = 0; f < k; f++) {
            importance[f] = Math.abs(coefficients.getEntry(f));
        }
        return new RegressionFit(new ModelFit(fitted, forecast), importance);
    }

    private Bounds bootstrapBounds(double[] forecast, double[] residuals, OptimizerProperties.Forecast config, long seed) {
        int horizon = forecast.length;
        int n = residuals.length;
        double[] lower = new double[horizon];
        double[] upper = new double[horizon];
        SplittableRandom random = new SplittableRandom(seed);
        int samples = config.getBootstrapSamples();
        double tail = (1.0 - config.getConfidenceLevel()) / 2.0;
        double[] draws = new double[samples];
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        double lowerPercent = Math.max(tail * 100.0, 1e-9);
        double upperPercent = Math.min((1.0 - tail) * 100.0, 100.0);
        for (int h = 0; h < horizon; h++) {
            double spread = Math.sqrt(h + 1.0);
            for (int b = 0; b < samples; b++) {
                draws[b] = forecast[h] + residuals[random.nextInt(n)] * spread;
            }
            percentile.setData(draws);
            lower[h] = Math.max(0.0, Math.min(forecast[h], percentile.evaluate(lowerPercent)));
            upper[h] = Math.max(forecast[h], percentile.evaluate(upperPercent));
        }
        return new Bounds(lower, upper);
    }

    private Map<String, Double> storeShares(Map<String, Map<String, DemandRecord>> byStore) {
        Map<String, Double> totals = new LinkedHashMap<>();
        double grandTotal = 0.0;
        for (Map.Entry<String, Map<String, DemandRecord>> store : byStore.entrySet()) {
            double total = store.getValue().values().stream().mapToDouble(DemandRecord::getQuantity).sum();
            totals.put(store.getKey(), total);
            grandTotal += total;
        }
        Map<String, Double> shares = new LinkedHashMap<>();
        for (Map.Entry<String, Double> total : totals.entrySet()) {
            shares.put(total.getKey(), grandTotal > EPS ? total.getValue() / grandTotal : 1.0 / totals.size());
        }
        return shares;
    }

    private Map<String, Double> featureImportance(double[] importance) {
        double sum = Arrays.stream(importance).sum();
        Map<String, Double> result = new LinkedHashMap<>();
        for (int f = 0; f < FEATURES.size(); f++) {
            result.put(FEATURES.get(f), sum > EPS ? importance[f] / sum : 1.0 / FEATURES.size());
        }
        return result;
    }

    private double modelAccuracy(double[] actual, double[] residuals) {
        double errorSum = 0.0;
        int counted = 0;
        for (int t = 0; t < actual.length; t++) {
            if (actual[t] > EPS) {
                errorSum += Math.abs(residuals[t]) / actual[t];
                counted++;
            }
        }
        if (counted == 0) {
            return 1.0;
        }
        return clamp(1.0 - Math.min(1.0, errorSum / counted), 0.0, 1.0);
    }

    private double[] normalizedWeights(OptimizerProperties.Forecast config) {
        double[] weights = {
                Math.max(0.0, config.getLinearTrendWeight()),
                Math.max(0.0, config.getHoltWeight()),
                Math.max(0.0, config.getFeatureRegressionWeight())
        };
        double sum = Arrays.stream(weights).sum();
        if (sum <= EPS) {
            Arrays.fill(weights, 1.0 / weights.length);
            return weights;
        }
        for (int i = 0; i < weights.length; i++) {
            weights[i] /= sum;
        }
        return weights;
    }

    private static Map<String, Integer> periodIndex(List<String> periods) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < periods.size(); i++) {
            index.put(periods.get(i), i);
        }
        return index;
    }

    private static List<Double> boxed(double[] values) {
        return Arrays.stream(values).boxed().toList();
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
