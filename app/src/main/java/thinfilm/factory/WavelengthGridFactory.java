package thinfilm.factory;

import thinfilm.config.EngineConfig;
import thinfilm.domain.exception.InvalidInputException;
import thinfilm.domain.sweep.SweepRange;

/**
 * Construcción de rejillas espectrales.
 * <p>
 * La rejilla canónica de la colorimetría es 380-780 nm con paso de 1 nm (401 puntos).
 */
public final class WavelengthGridFactory {

    public static final int CANONICAL_SIZE = 401;

    private WavelengthGridFactory() {
    }

    /**
     * Rejilla visible canónica 380-780 nm / 1 nm. Devuelve siempre un array nuevo.
     */
    public static double[] visible() {
        double[] grid = new double[CANONICAL_SIZE];
        for (int i = 0; i < CANONICAL_SIZE; i++) {
            grid[i] = EngineConfig.COLORIMETRY_START_NM + i * EngineConfig.COLORIMETRY_STEP_NM;
        }
        return grid;
    }

    /**
     * Rejilla [start, end] con paso {@code step}, extremo final inclusivo con tolerancia de medio paso.
     *
     * @throws InvalidInputException si start >= end, el paso no es positivo o start no es positivo
     */
    public static double[] range(double start, double end, double step) {
        if (!(start > 0.0) || !(step > 0.0) || !(start < end)) {
            throw new InvalidInputException(String.format(
                    "Rejilla espectral inválida: inicio %s nm, fin %s nm, paso %s nm.", start, end, step));
        }
        return SweepRange.of(start, end, step).values();
    }

    /**
     * @return true si la rejilla es exactamente la canónica 380:1:780
     */
    public static boolean isCanonical(double[] grid) {
        if (grid == null || grid.length != CANONICAL_SIZE) {
            return false;
        }
        for (int i = 0; i < CANONICAL_SIZE; i++) {
            if (grid[i] != EngineConfig.COLORIMETRY_START_NM + i * EngineConfig.COLORIMETRY_STEP_NM) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return true si la rejilla cubre por completo el intervalo visible 380-780 nm
     */
    public static boolean coversVisible(double[] grid) {
        return grid != null && grid.length >= 2
                && grid[0] <= EngineConfig.COLORIMETRY_START_NM
                && grid[grid.length - 1] >= EngineConfig.COLORIMETRY_END_NM;
    }
}
