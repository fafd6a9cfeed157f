package thinfilm.domain.sweep;

/**
 * Rango de barrido [start, end] con paso {@code step}.
 * <p>
 * El extremo final es inclusivo con tolerancia de medio paso: se generan start + i·step
 * mientras el valor sea menor que end + step/2. De 0 a 5 con paso 1 salen 6 valores.
 * La validación física (signos, ángulos) la hace quien consume el rango.
 */
public record SweepRange(double start, double end, double step) {

    public static SweepRange of(double start, double end, double step) {
        return new SweepRange(start, end, step);
    }

    /**
     * Número de valores del rango; 0 si el paso no es positivo o el rango es inválido.
     */
    public int count() {
        if (!(step > 0.0) || !Double.isFinite(start) || !Double.isFinite(end) || end < start) {
            return 0;
        }
        return (int) Math.ceil((end + step / 2.0 - start) / step);
    }

    public double valueAt(int i) {
        return start + i * step;
    }

    public double[] values() {
        int count = count();
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = valueAt(i);
        }
        return values;
    }
}
