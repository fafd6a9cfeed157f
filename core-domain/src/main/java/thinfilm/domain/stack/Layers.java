package thinfilm.domain.stack;

import thinfilm.domain.exception.InvalidInputException;

import java.util.ArrayList;
import java.util.List;

/**
 * Operaciones sobre secuencias ordenadas de capas.
 * <p>
 * Posición 0 = capa junto al medio incidente; última posición = capa junto al sustrato.
 * La numeración "visual" usada por los barridos es la inversa: la capa 1 es la inferior
 * (junto al sustrato) y la capa N la superior.
 */
public final class Layers {

    private Layers() {
    }

    /**
     * Traduce un número de capa visual (1 = inferior, N = superior) al índice de lista.
     *
     * @throws InvalidInputException si el número está fuera de [1, layerCount]
     */
    public static int indexOfLayerNumber(int layerCount, int layerNumber) {
        if (layerNumber < 1 || layerNumber > layerCount) {
            throw new InvalidInputException(String.format(
                    "El número de capa debe estar entre 1 (capa inferior) y %d (capa superior); recibido %d.",
                    layerCount, layerNumber));
        }
        return layerCount - layerNumber;
    }

    /**
     * Clona la pila sustituyendo el espesor de la capa en {@code index}. La pila original no se modifica.
     */
    public static List<Layer> withThicknessAt(List<Layer> base, int index, double thickness) {
        if (index < 0 || index >= base.size()) {
            throw new InvalidInputException("Índice de capa fuera de rango: " + index);
        }
        List<Layer> copy = new ArrayList<>(base);
        copy.set(index, base.get(index).withThickness(thickness));
        return List.copyOf(copy);
    }
}
