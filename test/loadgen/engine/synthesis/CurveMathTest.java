package loadgen.engine.synthesis;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class CurveMathTest {

    @Test
    public void testNormalize() {
        assertThat(CurveMath.normalize(new double[]{10, 20, 30}))
                .containsExactly(new double[]{0.0, 0.5, 1.0}, within(1e-12));
    }

    @Test
    public void testConstantSequenceNormalizesToHalf() {
        assertThat(CurveMath.normalize(new double[]{42, 42, 42, 42}))
                .containsOnly(CurveMath.DEGENERATE_LEVEL);
    }

    @Test
    public void testScaleBetweenBaselineAndNominal() {
        double[] scaled = CurveMath.scale(new double[]{0.0, 0.25, 1.0}, 2000, 100);

        assertThat(scaled).containsExactly(new double[]{100, 575, 2000}, within(1e-9));
    }

    @Test
    public void testScaledTemplateSpansBaselineToNominal() {
        double[] seq = {3, 250, 1900, 1720, 400, 12};

        double[] scaled = CurveMath.scale(CurveMath.normalize(seq), 2200, 40);

        assertThat(Arrays.stream(scaled).min().getAsDouble()).isCloseTo(40, within(1e-9));
        assertThat(Arrays.stream(scaled).max().getAsDouble()).isCloseTo(2200, within(1e-9));
    }

    @Test
    public void testClampNonNegative() {
        double[] curve = {-5, 0, 3, -0.1};

        assertThat(CurveMath.clampNonNegative(curve)).isSameAs(curve).containsExactly(0, 0, 3, 0);
    }
}
