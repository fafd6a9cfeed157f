package thinfilm.physics.colorimetry;

import lombok.extern.slf4j.Slf4j;
import thinfilm.domain.color.ColorResult;
import thinfilm.domain.color.Tristimulus;
import thinfilm.domain.exception.InvalidInputException;
import thinfilm.factory.WavelengthGridFactory;
import thinfilm.physics.i.IColorimetryConverter;
import thinfilm.physics.math.LinearInterpolator;

import java.util.Objects;

/**
 * Conversión reflectancia -> XYZ -> xy / sRGB bajo D65 con el observador CIE 1931 de 2°.
 * <ol>
 *     <li>Si la rejilla no es exactamente la canónica 380:1:780, remuestreo lineal (0 fuera de rango,
 *     negativos a 0).</li>
 *     <li>X, Y, Z = Σ R·S·x̄ / Y_blanco (idem ȳ, z̄), con Δλ = 1 nm y Y_blanco = Σ S·ȳ.</li>
 *     <li>Cromaticidad x = X/(X+Y+Z), y = Y/(X+Y+Z); (0, 0) si la suma es 0.</li>
 *     <li>Matriz XYZ -> sRGB lineal, gamma sRGB, recorte a [0, 1] y cuantización a 0-255.</li>
 * </ol>
 * Sin estado mutable: la misma instancia se comparte entre todos los hilos de un barrido.
 */
@Slf4j
public class CieColorimetryConverter implements IColorimetryConverter {

    private static final double[][] XYZ_TO_LINEAR_SRGB = {
            {3.2406, -1.5372, -0.4986},
            {-0.9689, 1.8758, 0.0415},
            {0.0557, -0.2040, 1.0570}
    };

    private final CieStandardData standard;
    private final double[] canonicalGrid;

    public CieColorimetryConverter() {
        this(CieStandardData.getInstance());
    }

    public CieColorimetryConverter(CieStandardData standard) {
        this.standard = Objects.requireNonNull(standard, "Los datos CIE no pueden ser nulos.");
        this.canonicalGrid = WavelengthGridFactory.visible();
    }

    @Override
    public ColorResult toColor(double[] reflectance, double[] wavelengths) {
        if (reflectance == null || wavelengths == null) {
            throw new InvalidInputException("La reflectancia y la rejilla no pueden ser nulas.");
        }
        if (reflectance.length != wavelengths.length) {
            throw new InvalidInputException(String.format(
                    "La reflectancia tiene %d valores y la rejilla %d.", reflectance.length, wavelengths.length));
        }
        if (reflectance.length == 0) {
            throw new InvalidInputException("No se puede calcular el color de un espectro vacío.");
        }

        double[] r = toCanonicalGrid(reflectance, wavelengths);
        Tristimulus xyz = integrate(r);
        return fromTristimulus(xyz);
    }

    private double[] toCanonicalGrid(double[] reflectance, double[] wavelengths) {
        if (WavelengthGridFactory.isCanonical(wavelengths)) {
            return reflectance;
        }
        if (wavelengths.length < 2) {
            throw new InvalidInputException("Se necesitan al menos dos muestras para remuestrear la reflectancia.");
        }
        if (!LinearInterpolator.isStrictlyAscending(wavelengths)) {
            throw new InvalidInputException("La rejilla de la reflectancia debe ser estrictamente creciente.");
        }
        log.debug("Remuestreando reflectancia de {} muestras a la rejilla canónica.", wavelengths.length);
        return LinearInterpolator.resampleZeroFloored(wavelengths, reflectance, canonicalGrid);
    }

    Tristimulus integrate(double[] canonicalReflectance) {
        double x = 0.0;
        double y = 0.0;
        double z = 0.0;
        for (int i = 0; i < canonicalReflectance.length; i++) {
            double weighted = canonicalReflectance[i] * standard.getIlluminant().valueAt(i);
            x += weighted * standard.getXBar().valueAt(i);
            y += weighted * standard.getYBar().valueAt(i);
            z += weighted * standard.getZBar().valueAt(i);
        }
        double white = standard.getWhiteLuminance();
        return new Tristimulus(x / white, y / white, z / white);
    }

    static ColorResult fromTristimulus(Tristimulus xyz) {
        double sum = xyz.sum();
        double cx = 0.0;
        double cy = 0.0;
        if (sum != 0.0) {
            cx = xyz.x() / sum;
            cy = xyz.y() / sum;
        }

        int[] rgb = new int[3];
        for (int c = 0; c < 3; c++) {
            double[] row = XYZ_TO_LINEAR_SRGB[c];
            double linear = row[0] * xyz.x() + row[1] * xyz.y() + row[2] * xyz.z();
            rgb[c] = quantize(gamma(linear));
        }

        return ColorResult.builder()
                .red(rgb[0])
                .green(rgb[1])
                .blue(rgb[2])
                .x(cx)
                .y(cy)
                .tristimulus(xyz)
                .build();
    }

    static double gamma(double linear) {
        if (linear <= 0.0031308) {
            return 12.92 * linear;
        }
        return 1.055 * Math.pow(linear, 1.0 / 2.4) - 0.055;
    }

    // Redondeo a par en empates.
    static int quantize(double value) {
        double clamped = Math.min(1.0, Math.max(0.0, value));
        return (int) Math.rint(clamped * 255.0);
    }
}
