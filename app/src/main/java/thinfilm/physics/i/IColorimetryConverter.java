package thinfilm.physics.i;

import thinfilm.domain.color.ColorResult;

public interface IColorimetryConverter {
    /**
     * Convierte un espectro de reflectancia en color sRGB y cromaticidad CIE xy bajo el iluminante estándar.
     *
     * @param reflectance reflectancia por longitud de onda
     * @param wavelengths rejilla en nm de la misma longitud
     */
    ColorResult toColor(double[] reflectance, double[] wavelengths);
}
