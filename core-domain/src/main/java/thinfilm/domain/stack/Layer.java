package thinfilm.domain.stack;

import lombok.Builder;
import lombok.With;
import thinfilm.domain.exception.InvalidInputException;

/**
 * Una capa plana y homogénea de la pila.
 * <p>
 * El espesor cero es válido: la capa es ópticamente transparente (no aporta fase)
 * pero conserva su posición en la pila.
 *
 * @param material  identificador del material (ej: "SiO2"), sin distinguir mayúsculas
 * @param thickness espesor físico en nanómetros (>= 0)
 */
@Builder
@With
public record Layer(String material, double thickness) {

    public Layer {
        if (material == null || material.isBlank()) {
            throw new InvalidInputException("El material de la capa no puede ser nulo ni vacío.");
        }
        if (!Double.isFinite(thickness) || thickness < 0.0) {
            throw new InvalidInputException(
                    String.format("El espesor de la capa %s debe ser finito y >= 0 nm (recibido %s).", material, thickness));
        }
    }

    public static Layer of(String material, double thickness) {
        return new Layer(material, thickness);
    }
}
