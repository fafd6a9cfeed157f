package thinfilm.physics.math;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LinearInterpolatorTest {

    private final double[] xs = {400.0, 500.0, 600.0};
    private final double[] ys = {1.0, 0.5, 0.2};

    @Test
    @DisplayName("La extrapolación de materiales no recorta y puede dar negativos")
    void interpolateExtrapolating_isUnclamped() {
        double[] out = LinearInterpolator.interpolateExtrapolating(xs, ys, new double[]{450.0, 700.0, 300.0});

        assertEquals(0.75, out[0], 1e-12);
        assertEquals(-0.1, out[1], 1e-12, "Por encima del rango sigue la pendiente del último tramo.");
        assertEquals(1.5, out[2], 1e-12);
    }

    @Test
    @DisplayName("El remuestreo colorimétrico devuelve 0 fuera de rango y recorta negativos")
    void resampleZeroFloored_floorsOutsideAndNegatives() {
        double[] negative = {-1.0, 1.0, 1.0};
        double[] out = LinearInterpolator.resampleZeroFloored(xs, negative, new double[]{390.0, 400.0, 425.0, 600.0, 610.0});

        assertArrayEquals(new double[]{0.0, 0.0, 0.0, 1.0, 0.0}, out, 1e-12);
    }

    @Test
    @DisplayName("Las muestras exactas se devuelven tal cual")
    void resample_exactSamples() {
        double[] out = LinearInterpolator.resampleZeroFloored(xs, ys, xs);
        assertArrayEquals(ys, out, 0.0);
    }

    @Test
    @DisplayName("Longitudes distintas o una sola muestra son un error")
    void invalidInputs() {
        assertThrows(IllegalArgumentException.class,
                () -> LinearInterpolator.interpolateExtrapolating(xs, new double[]{1.0}, xs));
        assertThrows(IllegalArgumentException.class,
                () -> LinearInterpolator.resampleZeroFloored(new double[]{1.0}, new double[]{1.0}, xs));
        assertTrue(LinearInterpolator.isStrictlyAscending(xs));
        assertFalse(LinearInterpolator.isStrictlyAscending(new double[]{1.0, 1.0}));
    }
}
