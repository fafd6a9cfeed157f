package thinfilm.domain.spectrum;

import lombok.Builder;
import lombok.Value;
import thinfilm.domain.color.ColorResult;

import java.util.Optional;

/**
 * Evaluación de un diseño sobre un intervalo espectral: Rs, Rp, la reflectancia combinada y,
 * si el intervalo cubre el visible completo, el color resultante.
 */
@Value
@Builder
public class SpectrumAnalysis {

    ReflectanceSpectrum spectrum;

    Polarization polarization;

    double[] combined;

    ColorResult color;

    public double[] getCombined() {
        return combined.clone();
    }

    public Optional<ColorResult> getColor() {
        return Optional.ofNullable(color);
    }

    public boolean hasColor() {
        return color != null;
    }
}
