package loadgen.engine.synthesis;

/**
 * Вид интерполяции при изменении числа отсчётов кривой.
 */
public enum InterpolationKind {
    LINEAR,  // кусочно-линейная
    CUBIC    // кубический сплайн not-a-knot
}
