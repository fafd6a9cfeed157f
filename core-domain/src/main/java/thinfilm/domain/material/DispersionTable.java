package thinfilm.domain.material;

import lombok.Getter;
import thinfilm.domain.exception.InvalidInputException;
import thinfilm.physics.math.LinearInterpolator;

import java.util.Objects;

/**
 * Tabla de dispersión (λ, n, k) de un material, ordenada por longitud de onda.
 * <p>
 * Inmutable una vez construida: los arrays se clonan a la entrada y a la salida, de modo que
 * una misma instancia se comparte sin sincronización entre todos los hilos que la consultan.
 */
public final class DispersionTable {

    @Getter
    private final String materialId;
    @Getter
    private final String source;
    private final double[] wavelengths;
    private final double[] n;
    private final double[] k;

    /**
     * @param materialId  identificador del material
     * @param source      ubicación de la que se leyó (ruta o recurso), solo informativa
     * @param wavelengths longitudes de onda en nm, estrictamente crecientes (al menos 2)
     * @param n           parte real del índice
     * @param k           coeficiente de extinción
     */
    public DispersionTable(String materialId, String source, double[] wavelengths, double[] n, double[] k) {
        Objects.requireNonNull(materialId, "El identificador de material no puede ser nulo.");
        Objects.requireNonNull(wavelengths, "El array de longitudes de onda no puede ser nulo.");
        Objects.requireNonNull(n, "El array n no puede ser nulo.");
        Objects.requireNonNull(k, "El array k no puede ser nulo.");

        if (wavelengths.length != n.length || wavelengths.length != k.length) {
            throw new InvalidInputException("Las columnas λ, n y k deben tener la misma longitud.");
        }
        if (wavelengths.length < 2) {
            throw new InvalidInputException("Una tabla de dispersión necesita al menos dos muestras.");
        }
        if (!LinearInterpolator.isStrictlyAscending(wavelengths)) {
            throw new InvalidInputException("Las longitudes de onda de la tabla deben ser estrictamente crecientes.");
        }

        this.materialId = materialId;
        this.source = source;
        this.wavelengths = wavelengths.clone();
        this.n = n.clone();
        this.k = k.clone();
    }

    public int getSampleCount() {
        return wavelengths.length;
    }

    public double getMinWavelength() {
        return wavelengths[0];
    }

    public double getMaxWavelength() {
        return wavelengths[wavelengths.length - 1];
    }

    public double[] cloneWavelengths() {
        return wavelengths.clone();
    }

    public double[] cloneN() {
        return n.clone();
    }

    public double[] cloneK() {
        return k.clone();
    }

    /**
     * Evalúa N = n + ik en la rejilla pedida. Interpolación lineal por tramos y extrapolación
     * lineal sin recorte fuera del rango tabulado.
     */
    public ComplexRefractiveIndex evaluate(double[] targetWavelengths) {
        double[] nOut = LinearInterpolator.interpolateExtrapolating(wavelengths, n, targetWavelengths);
        double[] kOut = LinearInterpolator.interpolateExtrapolating(wavelengths, k, targetWavelengths);
        return new ComplexRefractiveIndex(materialId, targetWavelengths, nOut, kOut);
    }
}
