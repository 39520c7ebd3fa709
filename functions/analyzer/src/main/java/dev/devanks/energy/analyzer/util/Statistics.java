package dev.devanks.energy.analyzer.util;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

import java.util.Collection;

/**
 * Order statistics with linear interpolation between closest ranks (R-7, the spreadsheet default).
 */
public final class Statistics {

    private Statistics() {
    }

    /**
     * @param p percentile in (0, 100]
     * @return NaN for an empty sample
     */
    public static double percentile(double[] values, double p) {
        if (values.length == 0) {
            return Double.NaN;
        }
        if (values.length == 1) {
            return values[0];
        }
        return new Percentile().withEstimationType(EstimationType.R_7).evaluate(values, p);
    }

    public static double median(double[] values) {
        return percentile(values, 50.0);
    }

    public static double mean(double[] values) {
        return values.length == 0 ? Double.NaN : StatUtils.mean(values);
    }

    public static double[] toArray(Collection<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
