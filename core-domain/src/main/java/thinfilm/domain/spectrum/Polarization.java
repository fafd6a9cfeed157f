package thinfilm.domain.spectrum;

import thinfilm.domain.exception.InvalidInputException;

import java.util.Locale;

/**
 * Polarización con la que se combina la reflectancia antes de pasar a color.
 * Se resuelve una sola vez en la frontera de entrada; el camino numérico solo ve el enum.
 */
public enum Polarization {
    S,      // Transversal eléctrica
    P,      // Transversal magnética
    MIXED;  // Luz no polarizada: (Rs + Rp) / 2

    /**
     * Interpreta etiquetas de texto libre ("s", "p-polarized", "Mixed (s+p)/2", "unpolarized"...).
     *
     * @throws InvalidInputException si la etiqueta no corresponde a ninguna polarización
     */
    public static Polarization fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new InvalidInputException("La polarización no puede ser nula ni vacía.");
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        if (normalized.contains("mix") || normalized.contains("unpol") || normalized.contains("s+p")) {
            return MIXED;
        }
        if (normalized.equals("s") || normalized.startsWith("s-") || normalized.startsWith("s ") || normalized.equals("te")) {
            return S;
        }
        if (normalized.equals("p") || normalized.startsWith("p-") || normalized.startsWith("p ") || normalized.equals("tm")) {
            return P;
        }
        throw new InvalidInputException("Polarización desconocida: '" + label + "'. Valores admitidos: s, p, mixed.");
    }

    /**
     * Combina una muestra de Rs y Rp según esta polarización.
     */
    public double combine(double rs, double rp) {
        switch (this) {
            case S:
                return rs;
            case P:
                return rp;
            case MIXED:
            default:
                return (rs + rp) / 2.0;
        }
    }
}
