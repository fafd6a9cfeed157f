package thinfilm.physics.i;

import thinfilm.domain.spectrum.ReflectanceSpectrum;
import thinfilm.domain.stack.Layer;

import java.util.List;

public interface IReflectanceSolver {
    /**
     * Calcula Rs y Rp de la pila sobre el sustrato para cada longitud de onda de la rejilla.
     *
     * @param layers         capas desde el medio incidente hacia el sustrato (puede estar vacía)
     * @param substrateId    material del sustrato semi-infinito
     * @param wavelengths    rejilla en nm, estrictamente creciente; vacía = resultado vacío
     * @param incidenceAngle ángulo de incidencia en grados
     */
    ReflectanceSpectrum compute(List<Layer> layers, String substrateId, double[] wavelengths, double incidenceAngle);
}
