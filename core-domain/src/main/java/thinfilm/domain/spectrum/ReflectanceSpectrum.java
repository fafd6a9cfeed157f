package thinfilm.domain.spectrum;

import thinfilm.domain.exception.InvalidInputException;

import java.util.Objects;

/**
 * Espectros de reflectancia s y p alineados con la rejilla de longitudes de onda.
 *
 * @param wavelengths rejilla en nm
 * @param rs          reflectancia s (|r_s|²)
 * @param rp          reflectancia p (|r_p|²)
 */
public record ReflectanceSpectrum(double[] wavelengths, double[] rs, double[] rp) {

    public ReflectanceSpectrum {
        Objects.requireNonNull(wavelengths, "La rejilla no puede ser nula.");
        Objects.requireNonNull(rs, "Rs no puede ser nulo.");
        Objects.requireNonNull(rp, "Rp no puede ser nulo.");
        if (rs.length != wavelengths.length || rp.length != wavelengths.length) {
            throw new InvalidInputException("Rs, Rp y la rejilla deben tener la misma longitud.");
        }
        wavelengths = wavelengths.clone();
        rs = rs.clone();
        rp = rp.clone();
    }

    public static ReflectanceSpectrum empty() {
        return new ReflectanceSpectrum(new double[0], new double[0], new double[0]);
    }

    @Override
    public double[] wavelengths() {
        return wavelengths.clone();
    }

    @Override
    public double[] rs() {
        return rs.clone();
    }

    @Override
    public double[] rp() {
        return rp.clone();
    }

    public int size() {
        return wavelengths.length;
    }

    public boolean isEmpty() {
        return wavelengths.length == 0;
    }

    /**
     * Reflectancia combinada según la polarización elegida.
     */
    public double[] combined(Polarization polarization) {
        Objects.requireNonNull(polarization, "La polarización no puede ser nula.");
        double[] out = new double[wavelengths.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = polarization.combine(rs[i], rp[i]);
        }
        return out;
    }
}
