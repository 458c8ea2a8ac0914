package loadgen.engine.synthesis;

import loadgen.config.GenerationConstants;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;

/**
 * Передискретизация кривых.
 * <p>
 * resample - приведение к длительности duration на внутреннем шаге
 * (нормированная ось индексов [0;1], по умолчанию кубический сплайн not-a-knot);
 * toOutputGrid - перевод с внутреннего шага на выходной
 * (линейная интерполяция по прошедшим секундам).
 */
public final class CurveResampler {

    private CurveResampler() {}

    /** Целевое количество отсчётов: floor(duration * 60 / timestep). */
    public static int targetSteps(double durationMin, int timestepSec) {
        return (int) (durationMin * GenerationConstants.SECONDS_PER_MINUTE / timestepSec);
    }

    public static double[] resample(double[] curve, double durationMin, int timestepSec) {
        return resample(curve, durationMin, timestepSec, InterpolationKind.CUBIC);
    }

    /**
     * @return кривая длиной ровно targetSteps(durationMin, timestepSec)
     */
    public static double[] resample(double[] curve,
                                    double durationMin,
                                    int timestepSec,
                                    InterpolationKind kind) {
        int steps = targetSteps(durationMin, timestepSec);
        if (steps == curve.length) {
            return curve;
        }

        double[] out = new double[steps];
        if (steps == 0) {
            return out;
        }

        UnivariateFunction f = interpolant(unitAxis(curve.length), curve, kind);
        double[] xt = unitAxis(steps);
        for (int i = 0; i < steps; i++) {
            out[i] = f.value(xt[i]);
        }
        return out;
    }

    /**
     * Перевод кривой с шага nativeTimestepSec на outputTimestepSec.
     * Точки за последним отсчётом берут последнее значение.
     */
    public static double[] toOutputGrid(double[] nativeCurve,
                                        double durationMin,
                                        int nativeTimestepSec,
                                        int outputTimestepSec) {
        int outSteps = targetSteps(durationMin, outputTimestepSec);
        double[] out = new double[outSteps];
        int n = nativeCurve.length;
        if (n == 0 || outSteps == 0) {
            return out;
        }
        if (n == 1) {
            java.util.Arrays.fill(out, nativeCurve[0]);
            return out;
        }

        double[] xNative = new double[n];
        for (int i = 0; i < n; i++) {
            xNative[i] = (double) i * nativeTimestepSec;
        }
        UnivariateFunction f = new LinearInterpolator().interpolate(xNative, nativeCurve);
        double xLast = xNative[n - 1];

        for (int j = 0; j < outSteps; j++) {
            double x = Math.min((double) j * outputTimestepSec, xLast);
            out[j] = f.value(x);
        }
        return out;
    }

    /**
     * Нормировка шаблона, масштаб под номинал и приведение к длительности:
     * общий этап подготовки для всех способов синтеза.
     */
    public static double[] prepare(double[] powerSequence,
                                   double nominalW,
                                   double baselineW,
                                   double durationMin,
                                   int timestepSec) {
        double[] scaled = CurveMath.scale(CurveMath.normalize(powerSequence), nominalW, baselineW);
        return resample(scaled, durationMin, timestepSec);
    }

    private static UnivariateFunction interpolant(double[] x, double[] y, InterpolationKind kind) {
        if (y.length == 1) {
            final double c = y[0];
            return v -> c;
        }
        UnivariateFunction f;
        if (kind == InterpolationKind.CUBIC && y.length >= 3) {
            f = new NotAKnotSplineInterpolator().interpolate(x, y);
        } else {
            f = new LinearInterpolator().interpolate(x, y);
        }
        // узлы сплайна ограничены [0;1], за границы не выходим
        return v -> f.value(Math.max(0.0, Math.min(1.0, v)));
    }

    /** n равноотстоящих точек на [0;1], концы точные. */
    private static double[] unitAxis(int n) {
        double[] x = new double[n];
        if (n == 1) {
            return x;
        }
        for (int i = 0; i < n; i++) {
            x[i] = i / (double) (n - 1);
        }
        x[n - 1] = 1.0;
        return x;
    }
}
