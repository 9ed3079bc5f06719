package com.motaz.uptake.core.forecast;

import com.motaz.uptake.core.config.DetectionProperties;
import com.motaz.uptake.core.exception.InsufficientDataException;
import com.motaz.uptake.core.model.ForecastPoint;
import com.motaz.uptake.core.model.Observation;
import lombok.extern.slf4j.Slf4j;
import smile.math.blas.UPLO;
import smile.math.matrix.Matrix;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Additive trend + seasonality baseline.
 * <p>
 * The trend is piecewise linear with candidate changepoints spread over the
 * first {@code changepointRange} of the history; seasonality is a Fourier
 * series on the calendar (yearly, optionally weekly). Coefficients are the
 * MAP estimate under zero-mean Gaussian priors: a small
 * {@code changepointPriorScale} keeps the trend stiff. The noise level that
 * weighs the priors is taken from a first fit without changepoints.
 * <p>
 * Series shorter than {@code minimumCycles * observationsPerCycle} points
 * (104 weekly points by default) are rejected.
 */
@Slf4j
public class SeasonalTrendForecaster implements BaselineForecaster {

    private static final double YEAR_DAYS = 365.25;
    private static final double WEEK_DAYS = 7.0;
    private static final double MIN_NOISE_VARIANCE = 1e-8;

    private final DetectionProperties.Forecaster settings;

    public SeasonalTrendForecaster(DetectionProperties.Forecaster settings) {
        if (settings.isDailySeasonality()) {
            throw new IllegalArgumentException("Daily seasonality needs intra-day timestamps; observations are dated by day");
        }
        this.settings = settings;
    }

    @Override
    public List<ForecastPoint> fitPredict(List<Observation> history) {
        int n = history.size();
        if (n < Math.max(2, settings.minimumObservations())) {
            throw new InsufficientDataException(String.format(
                    "Need at least %d observations (%d seasonal cycles of %d) to fit the baseline, got %d",
                    settings.minimumObservations(), settings.getMinimumCycles(),
                    settings.getObservationsPerCycle(), n));
        }
        requireStrictlyOrdered(history);

        LocalDate first = history.get(0).getDate();
        double spanDays = ChronoUnit.DAYS.between(first, history.get(n - 1).getDate());
        double[] t = new double[n];
        double yScale = 0.0;
        for (int i = 0; i < n; i++) {
            Observation o = history.get(i);
            t[i] = ChronoUnit.DAYS.between(first, o.getDate()) / spanDays;
            yScale = Math.max(yScale, Math.abs(o.getActual()));
        }
        if (yScale == 0.0) {
            yScale = 1.0;
        }
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            y[i] = history.get(i).getActual() / yScale;
        }

        // first pass: trend + seasonality only, to size the observation noise
        Matrix baseDesign = new Matrix(design(history, t, new double[0]));
        double[] baseBeta = fitCoefficients(baseDesign, y, penalties(0, 1.0));
        double noiseVariance = residualVariance(baseDesign, y, baseBeta);

        double[] changepoints = changepoints(t);
        Matrix design = new Matrix(design(history, t, changepoints));
        double[] beta = fitCoefficients(design, y, penalties(changepoints.length, noiseVariance));
        double[] fitted = design.mv(beta);

        log.debug("Baseline fitted on {} points: {} changepoints, {} columns, noise variance {}",
                n, changepoints.length, beta.length, noiseVariance);

        List<ForecastPoint> forecast = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            forecast.add(ForecastPoint.of(history.get(i).getDate(), fitted[i] * yScale));
        }
        return forecast;
    }

    private static void requireStrictlyOrdered(List<Observation> history) {
        for (int i = 1; i < history.size(); i++) {
            if (!history.get(i).getDate().isAfter(history.get(i - 1).getDate())) {
                throw new IllegalArgumentException("Observations must be ordered by date without duplicates, offending date "
                        + history.get(i).getDate());
            }
        }
    }

    /** Changepoint locations on the scaled time axis, evenly spaced by index. */
    double[] changepoints(double[] t) {
        int histSize = (int) Math.floor(t.length * settings.getChangepointRange());
        int count = Math.min(settings.getChangepoints(), histSize - 1);
        if (count <= 0) {
            return new double[0];
        }
        double[] result = new double[count];
        for (int j = 1; j <= count; j++) {
            int idx = (int) Math.rint(j * (histSize - 1) / (double) count);
            result[j - 1] = t[idx];
        }
        return result;
    }

    private double[][] design(List<Observation> history, double[] t, double[] changepoints) {
        int n = t.length;
        double[][] x = new double[n][columns(changepoints.length)];
        for (int i = 0; i < n; i++) {
            double[] row = x[i];
            int c = 0;
            row[c++] = 1.0;
            row[c++] = t[i];
            for (double s : changepoints) {
                row[c++] = t[i] > s ? t[i] - s : 0.0;
            }
            double epochDays = history.get(i).getDate().toEpochDay();
            if (settings.isYearlySeasonality()) {
                c = fourier(row, c, epochDays, YEAR_DAYS, settings.getYearlyFourierOrder());
            }
            if (settings.isWeeklySeasonality()) {
                fourier(row, c, epochDays, WEEK_DAYS, settings.getWeeklyFourierOrder());
            }
        }
        return x;
    }

    private static int fourier(double[] row, int c, double epochDays, double period, int order) {
        for (int r = 1; r <= order; r++) {
            double angle = 2.0 * Math.PI * r * epochDays / period;
            row[c++] = Math.sin(angle);
            row[c++] = Math.cos(angle);
        }
        return c;
    }

    private int seasonalColumns() {
        int cols = 0;
        if (settings.isYearlySeasonality()) {
            cols += 2 * settings.getYearlyFourierOrder();
        }
        if (settings.isWeeklySeasonality()) {
            cols += 2 * settings.getWeeklyFourierOrder();
        }
        return cols;
    }

    private int columns(int changepointCount) {
        return 2 + changepointCount + seasonalColumns();
    }

    private double[] penalties(int changepointCount, double noiseVariance) {
        double[] penalty = new double[columns(changepointCount)];
        int c = 0;
        penalty[c++] = noiseVariance / square(settings.getTrendPriorScale());
        penalty[c++] = noiseVariance / square(settings.getTrendPriorScale());
        for (int j = 0; j < changepointCount; j++) {
            penalty[c++] = noiseVariance / square(settings.getChangepointPriorScale());
        }
        while (c < penalty.length) {
            penalty[c++] = noiseVariance / square(settings.getSeasonalityPriorScale());
        }
        return penalty;
    }

    /**
     * Minimises ||y - X b||^2 + sum_j penalty[j] * b[j]^2 by a Cholesky solve of
     * (X'X + diag(penalty)) b = X'y. Every penalty must be positive so the
     * system stays positive definite.
     */
    static double[] fitCoefficients(Matrix x, double[] y, double[] penalty) {
        Matrix gram = x.ata();
        for (int j = 0; j < penalty.length; j++) {
            if (!(penalty[j] > 0.0)) {
                throw new IllegalArgumentException("penalty[" + j + "] must be positive: " + penalty[j]);
            }
            gram.add(j, j, penalty[j]);
        }
        gram.uplo(UPLO.LOWER);
        return gram.cholesky().solve(x.tv(y));
    }

    private static double residualVariance(Matrix x, double[] y, double[] beta) {
        double[] fitted = x.mv(beta);
        double sse = 0.0;
        for (int i = 0; i < y.length; i++) {
            double r = y[i] - fitted[i];
            sse += r * r;
        }
        int dof = Math.max(1, y.length - beta.length);
        return Math.max(sse / dof, MIN_NOISE_VARIANCE);
    }

    private static double square(double v) {
        return v * v;
    }
}
