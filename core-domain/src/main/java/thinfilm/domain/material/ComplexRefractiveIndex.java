package thinfilm.domain.material;

import lombok.Getter;
import thinfilm.domain.exception.InvalidInputException;
import thinfilm.physics.math.Complex;

import java.util.Arrays;
import java.util.Objects;

/**
 * Índice de refracción complejo N(λ) = n(λ) + i·k(λ) evaluado sobre una rejilla concreta.
 */
public final class ComplexRefractiveIndex {

    @Getter
    private final String materialId;
    private final double[] wavelengths;
    private final double[] n;
    private final double[] k;

    public ComplexRefractiveIndex(String materialId, double[] wavelengths, double[] n, double[] k) {
        Objects.requireNonNull(wavelengths, "La rejilla de longitudes de onda no puede ser nula.");
        Objects.requireNonNull(n, "El array n no puede ser nulo.");
        Objects.requireNonNull(k, "El array k no puede ser nulo.");
        if (wavelengths.length != n.length || wavelengths.length != k.length) {
            throw new InvalidInputException("n, k y la rejilla deben tener la misma longitud.");
        }
        this.materialId = materialId;
        this.wavelengths = wavelengths.clone();
        this.n = n.clone();
        this.k = k.clone();
    }

    /**
     * Índice constante en toda la rejilla (medio incidente, por ejemplo).
     */
    public static ComplexRefractiveIndex constant(String materialId, double[] wavelengths, double n, double k) {
        double[] nArr = new double[wavelengths.length];
        double[] kArr = new double[wavelengths.length];
        Arrays.fill(nArr, n);
        Arrays.fill(kArr, k);
        return new ComplexRefractiveIndex(materialId, wavelengths, nArr, kArr);
    }

    public int length() {
        return wavelengths.length;
    }

    public Complex at(int i) {
        return new Complex(n[i], k[i]);
    }

    public double nAt(int i) {
        return n[i];
    }

    public double kAt(int i) {
        return k[i];
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
}
