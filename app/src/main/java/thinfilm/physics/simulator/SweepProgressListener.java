package thinfilm.physics.simulator;

/**
 * Canal de progreso de un barrido 2D.
 */
@FunctionalInterface
public interface SweepProgressListener {

    SweepProgressListener NONE = fraction -> {
    };

    /**
     * Se invoca cada vez que termina una fila completa de ángulo.
     *
     * @param fraction filas terminadas / filas totales, estrictamente creciente; la última vez vale 1.0
     */
    void onProgress(double fraction);
}
