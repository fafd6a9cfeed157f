package thinfilm.domain.spectrum;

import thinfilm.domain.exception.InvalidInputException;
import thinfilm.physics.math.LinearInterpolator;

import java.util.Arrays;
import java.util.Objects;

/**
 * Pares (λ, valor) sobre una rejilla ordenada. Cualquier operación elemento a elemento entre
 * curvas exige rejillas idénticas.
 */
public final class SpectralCurve {

    private final double[] wavelengths;
    private final double[] values;

    public SpectralCurve(double[] wavelengths, double[] values) {
        Objects.requireNonNull(wavelengths, "La rejilla no puede ser nula.");
        Objects.requireNonNull(values, "Los valores no pueden ser nulos.");
        if (wavelengths.length != values.length) {
            throw new InvalidInputException(String.format(
                    "La curva espectral tiene %d longitudes de onda y %d valores.", wavelengths.length, values.length));
        }
        if (!LinearInterpolator.isStrictlyAscending(wavelengths)) {
            throw new InvalidInputException("La rejilla de la curva espectral debe ser estrictamente creciente.");
        }
        this.wavelengths = wavelengths.clone();
        this.values = values.clone();
    }

    public int size() {
        return wavelengths.length;
    }

    public double valueAt(int i) {
        return values[i];
    }

    public double[] cloneWavelengths() {
        return wavelengths.clone();
    }

    public boolean sharesGridWith(SpectralCurve other) {
        return Arrays.equals(wavelengths, other.wavelengths);
    }

    /**
     * Remuestreo con la política colorimétrica: 0 fuera de rango y negativos recortados a 0.
     */
    public SpectralCurve resampleZeroFloored(double[] targetGrid) {
        if (wavelengths.length < 2) {
            throw new InvalidInputException("Se necesitan al menos dos muestras para remuestrear una curva espectral.");
        }
        return new SpectralCurve(targetGrid, LinearInterpolator.resampleZeroFloored(wavelengths, values, targetGrid));
    }
}
