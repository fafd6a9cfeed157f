package thinfilm.domain.sweep;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Value;
import lombok.With;
import thinfilm.domain.exception.InvalidSweepRangeException;
import thinfilm.domain.spectrum.Polarization;

/**
 * Parámetros de un barrido de color.
 * <p>
 * El tipo se deduce de los rangos presentes: solo espesor, solo ángulo, o ambos (2D).
 */
@Value
@Builder
@With
public class SweepSpec {

    /**
     * Rango de espesores en nm de la capa {@link #layerNumber}. Nulo si no se barre el espesor.
     */
    SweepRange thicknessRange;

    /**
     * Rango de ángulos de incidencia en grados. Nulo si no se barre el ángulo.
     */
    SweepRange angleRange;

    /**
     * Capa cuyo espesor se barre, con numeración visual: 1 = junto al sustrato, N = junto al medio incidente.
     */
    @Builder.Default
    int layerNumber = 1;

    /**
     * Ángulo de incidencia (grados) usado en el barrido de solo espesor.
     */
    double fixedAngle;

    @Builder.Default
    Polarization polarization = Polarization.MIXED;

    @Builder.Default
    String substrate = "Si";

    /**
     * Rejilla espectral de cálculo. Nula = visible canónica 380-780 nm / 1 nm.
     */
    @Getter(AccessLevel.NONE)
    double[] wavelengths;

    public double[] cloneWavelengths() {
        return wavelengths == null ? null : wavelengths.clone();
    }

    /**
     * @throws InvalidSweepRangeException si no se ha pedido ningún eje
     */
    public SweepType resolveType() {
        if (thicknessRange != null && angleRange != null) {
            return SweepType.THICKNESS_ANGLE;
        }
        if (thicknessRange != null) {
            return SweepType.THICKNESS;
        }
        if (angleRange != null) {
            return SweepType.ANGLE;
        }
        throw new InvalidSweepRangeException("Selecciona al menos un eje de barrido (espesor o ángulo).");
    }
}
