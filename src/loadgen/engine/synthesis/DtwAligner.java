package loadgen.engine.synthesis;

import loadgen.config.GenerationConstants;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Выравнивание кривой на опорную по пути динамической трансформации времени (FastDTW).
 * Стоимость пары отсчётов - модуль разности.
 */
public final class DtwAligner {

    private DtwAligner() {}

    /**
     * Перенос шаблона на индексы опорной кривой.
     * Для каждой пары (i, j) пути значение template[i] добавляется в ячейку j,
     * результат - среднее по ячейке (пустая ячейка даёт 0).
     *
     * @return массив длины reference.length
     */
    public static double[] align(double[] template, double[] reference) {
        double[] aligned = new double[reference.length];
        int[] counts = new int[reference.length];
        if (template.length == 0 || reference.length == 0) {
            return aligned;
        }

        for (int[] step : warpPath(template, reference, GenerationConstants.FASTDTW_RADIUS)) {
            aligned[step[1]] += template[step[0]];
            counts[step[1]]++;
        }
        for (int j = 0; j < aligned.length; j++) {
            aligned[j] /= Math.max(1, counts[j]);
        }
        return aligned;
    }

    /**
     * Путь FastDTW: грубое решение на вдвое сжатых рядах, окно вокруг его проекции
     * с радиусом radius, затем точный DTW внутри окна.
     *
     * @return пары {i, j} от (0, 0) до (x.length - 1, y.length - 1)
     */
    public static List<int[]> warpPath(double[] x, double[] y, int radius) {
        int minSize = Math.max(0, radius) + 2;
        if (x.length < minSize || y.length < minSize) {
            return dtw(x, y, Window.full(x.length, y.length));
        }

        List<int[]> coarse = warpPath(reduceByHalf(x), reduceByHalf(y), radius);
        Window window = expandWindow(coarse, x.length, y.length, radius);
        return dtw(x, y, window);
    }

    private static double[] reduceByHalf(double[] x) {
        double[] out = new double[x.length / 2];
        for (int i = 0; i < out.length; i++) {
            out[i] = (x[2 * i] + x[2 * i + 1]) / 2.0;
        }
        return out;
    }

    private static Window expandWindow(List<int[]> path, int lenX, int lenY, int radius) {
        Set<Long> around = new HashSet<>();
        for (int[] p : path) {
            for (int a = -radius; a <= radius; a++) {
                for (int b = -radius; b <= radius; b++) {
                    around.add(key(p[0] + a, p[1] + b));
                }
            }
        }

        Set<Long> cells = new HashSet<>();
        for (long k : around) {
            int i = (int) (k >> 32);
            int j = (int) k;
            cells.add(key(2 * i, 2 * j));
            cells.add(key(2 * i, 2 * j + 1));
            cells.add(key(2 * i + 1, 2 * j));
            cells.add(key(2 * i + 1, 2 * j + 1));
        }

        // строки окна непрерывны; ищем отрезок столбцов начиная с начала предыдущей строки
        Window w = new Window(lenX);
        int startJ = 0;
        for (int i = 0; i < lenX; i++) {
            int newStart = -1;
            for (int j = startJ; j < lenY; j++) {
                if (cells.contains(key(i, j))) {
                    if (newStart < 0) {
                        newStart = j;
                        w.from[i] = j;
                    }
                    w.to[i] = j;
                } else if (newStart >= 0) {
                    break;
                }
            }
            if (newStart >= 0) startJ = newStart;
        }
        return w;
    }

    /**
     * DTW внутри окна. Порядок выбора предшественника при равенстве:
     * (i-1, j), (i, j-1), (i-1, j-1).
     */
    private static List<int[]> dtw(double[] x, double[] y, Window w) {
        int n = x.length;
        int m = y.length;

        // строки 1..n, столбцы 1..m (сдвиг на 1 относительно индексов рядов)
        double[][] cost = new double[n + 1][];
        byte[][] move = new byte[n + 1][];
        for (int i = 1; i <= n; i++) {
            int width = w.from[i - 1] < 0 ? 0 : w.to[i - 1] - w.from[i - 1] + 1;
            cost[i] = new double[width];
            move[i] = new byte[width];
        }

        for (int i = 1; i <= n; i++) {
            if (w.from[i - 1] < 0) continue;
            for (int j = w.from[i - 1] + 1; j <= w.to[i - 1] + 1; j++) {
                double d = Math.abs(x[i - 1] - y[j - 1]);

                double best = cellCost(cost, w, i - 1, j);
                byte dir = UP;
                double left = cellCost(cost, w, i, j - 1);
                if (left < best) {
                    best = left;
                    dir = LEFT;
                }
                double diag = cellCost(cost, w, i - 1, j - 1);
                if (diag < best) {
                    best = diag;
                    dir = DIAG;
                }
                int c = j - 1 - w.from[i - 1];
                cost[i][c] = best + d;
                move[i][c] = dir;
            }
        }

        List<int[]> path = new ArrayList<>(n + m);
        int i = n;
        int j = m;
        while (!(i == 0 && j == 0)) {
            path.add(new int[]{i - 1, j - 1});
            if (i == 0 || j == 0 || !w.contains(i - 1, j - 1)) {
                throw new IllegalStateException("DTW window does not reach cell (" + i + ", " + j + ")");
            }
            byte dir = move[i][j - 1 - w.from[i - 1]];
            if (dir == UP) {
                i--;
            } else if (dir == LEFT) {
                j--;
            } else {
                i--;
                j--;
            }
        }
        Collections.reverse(path);
        return path;
    }

    private static final byte UP = 0;
    private static final byte LEFT = 1;
    private static final byte DIAG = 2;

    private static double cellCost(double[][] cost, Window w, int i, int j) {
        if (i == 0 && j == 0) return 0.0;
        if (i == 0 || j == 0) return Double.POSITIVE_INFINITY;
        if (!w.contains(i - 1, j - 1)) return Double.POSITIVE_INFINITY;
        return cost[i][j - 1 - w.from[i - 1]];
    }

    private static long key(int i, int j) {
        return ((long) i << 32) | (j & 0xffffffffL);
    }

    /** Окно поиска: для строки i допустимы столбцы from[i]..to[i] (from = -1 - строка пуста). */
    private static final class Window {
        final int[] from;
        final int[] to;

        Window(int rows) {
            this.from = new int[rows];
            this.to = new int[rows];
            java.util.Arrays.fill(from, -1);
            java.util.Arrays.fill(to, -1);
        }

        static Window full(int rows, int cols) {
            Window w = new Window(rows);
            if (cols == 0) return w;
            for (int i = 0; i < rows; i++) {
                w.from[i] = 0;
                w.to[i] = cols - 1;
            }
            return w;
        }

        boolean contains(int i, int j) {
            return from[i] >= 0 && j >= from[i] && j <= to[i];
        }
    }
}
