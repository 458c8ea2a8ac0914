package loadgen.engine.synthesis;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class DtwAlignerTest {

    @Test
    public void testIdenticalCurvesAlignOntoThemselves() {
        double[] x = new double[32];
        for (int i = 0; i < x.length; i++) x[i] = i * i;

        assertThat(DtwAligner.align(x, x)).containsExactly(x, within(1e-12));
    }

    @Test
    public void testResultHasReferenceLength() {
        double[] template = new double[37];
        double[] reference = new double[20];
        for (int i = 0; i < template.length; i++) template[i] = Math.sin(i / 6.0);
        for (int j = 0; j < reference.length; j++) reference[j] = Math.sin(j / 3.0);

        assertThat(DtwAligner.align(template, reference)).hasSize(20);
        assertThat(DtwAligner.align(reference, template)).hasSize(37);
    }

    @Test
    public void testShiftedPeakMovesOntoReference() {
        double[] reference = {0, 0, 0, 10, 0, 0, 0, 0, 0, 0};
        double[] template = {0, 0, 0, 0, 0, 0, 10, 0, 0, 0};

        double[] aligned = DtwAligner.align(template, reference);

        assertThat(aligned[3]).isEqualTo(10.0);
    }

    @Test
    public void testWarpPathIsContinuousAndMonotone() {
        Random rnd = new Random(17);
        for (int trial = 0; trial < 50; trial++) {
            double[] x = randomCurve(rnd, 2 + rnd.nextInt(80));
            double[] y = randomCurve(rnd, 2 + rnd.nextInt(80));

            List<int[]> path = DtwAligner.warpPath(x, y, 1);

            assertThat(path.get(0)).containsExactly(0, 0);
            assertThat(path.get(path.size() - 1)).containsExactly(x.length - 1, y.length - 1);
            for (int k = 1; k < path.size(); k++) {
                int di = path.get(k)[0] - path.get(k - 1)[0];
                int dj = path.get(k)[1] - path.get(k - 1)[1];
                assertThat(di).isBetween(0, 1);
                assertThat(dj).isBetween(0, 1);
                assertThat(di + dj).isPositive();
            }
        }
    }

    @Test
    public void testEmptyTemplateGivesZeros() {
        assertThat(DtwAligner.align(new double[0], new double[]{1, 2, 3})).containsExactly(0, 0, 0);
    }

    private static double[] randomCurve(Random rnd, int n) {
        double[] a = new double[n];
        for (int i = 0; i < n; i++) a[i] = rnd.nextDouble() * 1000;
        return a;
    }
}
