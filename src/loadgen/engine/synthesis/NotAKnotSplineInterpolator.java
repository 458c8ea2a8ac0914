package loadgen.engine.synthesis;

import org.apache.commons.math3.analysis.interpolation.UnivariateInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NumberIsTooSmallException;
import org.apache.commons.math3.exception.util.LocalizedFormats;
import org.apache.commons.math3.util.MathArrays;

/**
 * Кубический интерполяционный сплайн с краевым условием not-a-knot:
 * третья производная непрерывна во втором и предпоследнем узлах,
 * т.е. первые два и последние два отрезка описываются одним кубическим многочленом.
 * <p>
 * Неизвестные - вторые производные M_i в узлах. M_0 и M_{n-1} выражаются
 * из краевых условий через соседние, остаётся трёхдиагональная система
 * для M_1..M_{n-2} (прогонка).
 * Три точки дают параболу через них, кубика воспроизводится точно.
 */
public final class NotAKnotSplineInterpolator implements UnivariateInterpolator {

    @Override
    public PolynomialSplineFunction interpolate(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new DimensionMismatchException(x.length, y.length);
        }
        if (x.length < 3) {
            throw new NumberIsTooSmallException(LocalizedFormats.NUMBER_OF_POINTS, x.length, 3, true);
        }
        MathArrays.checkOrder(x);

        int n = x.length;
        double[] h = new double[n - 1];
        double[] d = new double[n - 1];
        for (int i = 0; i < n - 1; i++) {
            h[i] = x[i + 1] - x[i];
            d[i] = (y[i + 1] - y[i]) / h[i];
        }

        double[] m = (n == 3) ? parabola(h, d) : secondDerivatives(h, d, n);

        PolynomialFunction[] segments = new PolynomialFunction[n - 1];
        for (int i = 0; i < n - 1; i++) {
            double b = d[i] - h[i] * (2.0 * m[i] + m[i + 1]) / 6.0;
            double c = m[i] / 2.0;
            double e = (m[i + 1] - m[i]) / (6.0 * h[i]);
            segments[i] = new PolynomialFunction(new double[]{y[i], b, c, e});
        }
        return new PolynomialSplineFunction(x, segments);
    }

    /** Единственный многочлен степени 2 через три точки: постоянная вторая производная. */
    private static double[] parabola(double[] h, double[] d) {
        double m = 2.0 * (d[1] - d[0]) / (h[0] + h[1]);
        return new double[]{m, m, m};
    }

    private static double[] secondDerivatives(double[] h, double[] d, int n) {
        int size = n - 2;
        double[] lower = new double[size];
        double[] diag = new double[size];
        double[] upper = new double[size];
        double[] rhs = new double[size];

        for (int k = 0; k < size; k++) {
            int i = k + 1;
            lower[k] = h[i - 1];
            diag[k] = 2.0 * (h[i - 1] + h[i]);
            upper[k] = h[i];
            rhs[k] = 6.0 * (d[i] - d[i - 1]);
        }

        // M_0 = ((h0 + h1) M_1 - h0 M_2) / h1
        diag[0] += h[0] * (h[0] + h[1]) / h[1];
        upper[0] -= h[0] * h[0] / h[1];
        // M_{n-1} = ((h_{n-3} + h_{n-2}) M_{n-2} - h_{n-2} M_{n-3}) / h_{n-3}
        double hp = h[n - 3];
        double hl = h[n - 2];
        diag[size - 1] += hl * (hp + hl) / hp;
        lower[size - 1] -= hl * hl / hp;

        double[] inner = solveTridiagonal(lower, diag, upper, rhs);

        double[] m = new double[n];
        System.arraycopy(inner, 0, m, 1, size);
        m[0] = ((h[0] + h[1]) * m[1] - h[0] * m[2]) / h[1];
        m[n - 1] = ((hp + hl) * m[n - 2] - hl * m[n - 3]) / hp;
        return m;
    }

    /** Прогонка; lower[0] и upper[size-1] не используются. */
    private static double[] solveTridiagonal(double[] lower, double[] diag, double[] upper, double[] rhs) {
        int size = diag.length;
        double[] c = new double[size];
        double[] r = new double[size];

        c[0] = upper[0] / diag[0];
        r[0] = rhs[0] / diag[0];
        for (int k = 1; k < size; k++) {
            double denom = diag[k] - lower[k] * c[k - 1];
            c[k] = upper[k] / denom;
            r[k] = (rhs[k] - lower[k] * r[k - 1]) / denom;
        }

        double[] out = new double[size];
        out[size - 1] = r[size - 1];
        for (int k = size - 2; k >= 0; k--) {
            out[k] = r[k] - c[k] * out[k + 1];
        }
        return out;
    }
}
