package thinfilm.factory;

import thinfilm.domain.color.ColorResult;
import thinfilm.domain.sweep.GridSweepResult;
import thinfilm.domain.sweep.LinearSweepResult;
import thinfilm.domain.sweep.SweepType;

import java.util.List;

/**
 * Fábrica de resultados de barrido a partir de las celdas calculadas por el orquestador.
 */
public class SweepResultFactory {

    private SweepResultFactory() {
    }

    /**
     * Resultado 1D (espesor o ángulo).
     */
    public static LinearSweepResult createLinear(SweepType type, double[] sweptValues, ColorResult[] colors, long elapsedMillis) {
        return LinearSweepResult.builder()
                .type(type)
                .sweptValues(sweptValues.clone())
                .colors(List.of(colors))
                .elapsedMillis(elapsedMillis)
                .build();
    }

    /**
     * Resultado 2D con filas de ángulo y columnas de espesor.
     */
    public static GridSweepResult createGrid(double[] angleValues, double[] thicknessValues, ColorResult[][] grid, long elapsedMillis) {
        ColorResult[][] copy = new ColorResult[grid.length][];
        for (int row = 0; row < grid.length; row++) {
            copy[row] = grid[row].clone();
        }
        return GridSweepResult.builder()
                .angleValues(angleValues.clone())
                .thicknessValues(thicknessValues.clone())
                .grid(copy)
                .elapsedMillis(elapsedMillis)
                .build();
    }
}
