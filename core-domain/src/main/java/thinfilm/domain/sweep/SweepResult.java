package thinfilm.domain.sweep;

/**
 * Resultado de un barrido de color, 1D o 2D.
 */
public interface SweepResult {

    SweepType getType();

    /**
     * Número total de celdas calculadas.
     */
    int getCellCount();

    /**
     * Tiempo de cómputo en milisegundos.
     */
    long getElapsedMillis();
}
