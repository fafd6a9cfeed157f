package thinfilm.physics.math;

import java.util.Arrays;

/**
 * Interpolación lineal por tramos sobre abscisas estrictamente crecientes.
 * <p>
 * Existen dos políticas de borde y no deben mezclarse:
 * <ul>
 *     <li>{@link #interpolateExtrapolating}: fuera del rango extrapola linealmente con las dos
 *     muestras más cercanas, sin recortar (puede dar valores negativos). La usa la base de
 *     materiales.</li>
 *     <li>{@link #resampleZeroFloored}: fuera del rango devuelve 0 y todo valor negativo se
 *     sustituye por 0. La usa la colorimetría.</li>
 * </ul>
 * Clase utilidad sin estado, segura entre hilos.
 */
public final class LinearInterpolator {

    private LinearInterpolator() {
    }

    /**
     * Evalúa la poligonal (xs, ys) en cada punto de {@code targets}, extrapolando sin recorte.
     *
     * @param xs      abscisas estrictamente crecientes (al menos 2)
     * @param ys      ordenadas, misma longitud que {@code xs}
     * @param targets puntos a evaluar, en cualquier orden
     * @return array nuevo de la longitud de {@code targets}
     */
    public static double[] interpolateExtrapolating(double[] xs, double[] ys, double[] targets) {
        requireCompatible(xs, ys);
        double[] out = new double[targets.length];
        int last = xs.length - 1;
        for (int i = 0; i < targets.length; i++) {
            double x = targets[i];
            int lo;
            if (x <= xs[0]) {
                lo = 0;
            } else if (x >= xs[last]) {
                lo = last - 1;
            } else {
                lo = segmentIndex(xs, x);
            }
            out[i] = lerp(xs[lo], ys[lo], xs[lo + 1], ys[lo + 1], x);
        }
        return out;
    }

    /**
     * Remuestrea (xs, ys) en {@code targets}: 0 fuera de [xs[0], xs[n-1]] y valores negativos
     * recortados a 0.
     */
    public static double[] resampleZeroFloored(double[] xs, double[] ys, double[] targets) {
        requireCompatible(xs, ys);
        double[] out = new double[targets.length];
        int last = xs.length - 1;
        for (int i = 0; i < targets.length; i++) {
            double x = targets[i];
            double value;
            if (x < xs[0] || x > xs[last]) {
                value = 0.0;
            } else if (x == xs[last]) {
                value = ys[last];
            } else {
                int lo = segmentIndex(xs, x);
                value = lerp(xs[lo], ys[lo], xs[lo + 1], ys[lo + 1], x);
            }
            out[i] = Math.max(0.0, value);
        }
        return out;
    }

    /**
     * @return true si {@code values} es estrictamente creciente (un array vacío o de un elemento lo es)
     */
    public static boolean isStrictlyAscending(double[] values) {
        for (int i = 1; i < values.length; i++) {
            if (!(values[i] > values[i - 1])) {
                return false;
            }
        }
        return true;
    }

    // Índice lo tal que xs[lo] <= x < xs[lo + 1], con x dentro del rango.
    private static int segmentIndex(double[] xs, double x) {
        int pos = Arrays.binarySearch(xs, x);
        if (pos >= 0) {
            return Math.min(pos, xs.length - 2);
        }
        return -pos - 2;
    }

    private static double lerp(double x0, double y0, double x1, double y1, double x) {
        return y0 + (x - x0) * (y1 - y0) / (x1 - x0);
    }

    private static void requireCompatible(double[] xs, double[] ys) {
        if (xs.length != ys.length) {
            throw new IllegalArgumentException("Las abscisas y las ordenadas deben tener la misma longitud.");
        }
        if (xs.length < 2) {
            throw new IllegalArgumentException("Se necesitan al menos dos muestras para interpolar.");
        }
    }
}
