package thinfilm.domain.stack;

import lombok.Builder;
import lombok.With;
import thinfilm.domain.exception.InvalidInputException;

import java.util.List;

/**
 * Diseño completo de una multicapa tal como lo introduce el usuario: capas, sustrato y ángulo de incidencia.
 * Es el documento que se guarda y se lee en JSON.
 *
 * @param layers         capas ordenadas desde el medio incidente hacia el sustrato
 * @param substrate      identificador del sustrato semi-infinito
 * @param incidenceAngle ángulo de incidencia en grados
 */
@Builder
@With
public record StackDesign(List<Layer> layers, String substrate, double incidenceAngle) {

    public StackDesign {
        layers = (layers == null) ? List.of() : List.copyOf(layers);
        if (substrate == null || substrate.isBlank()) {
            throw new InvalidInputException("El sustrato no puede ser nulo ni vacío.");
        }
        if (!Double.isFinite(incidenceAngle)) {
            throw new InvalidInputException("El ángulo de incidencia debe ser finito.");
        }
    }

    public int layerCount() {
        return layers.size();
    }
}
