package thinfilm.domain.sweep;

public enum SweepType {
    THICKNESS,        // 1D: espesor de una capa a ángulo fijo
    ANGLE,            // 1D: ángulo de incidencia con la pila fija
    THICKNESS_ANGLE   // 2D: ángulo (filas) x espesor (columnas)
}
