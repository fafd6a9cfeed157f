package thinfilm.domain.sweep;

import lombok.Builder;
import lombok.Value;
import thinfilm.domain.color.ColorResult;

/**
 * Barrido 2D: rejilla de colores indexada por [fila de ángulo][columna de espesor].
 */
@Value
@Builder
public class GridSweepResult implements SweepResult {

    double[] angleValues;

    double[] thicknessValues;

    ColorResult[][] grid;

    long elapsedMillis;

    @Override
    public SweepType getType() {
        return SweepType.THICKNESS_ANGLE;
    }

    public int getRowCount() {
        return angleValues.length;
    }

    public int getColumnCount() {
        return thicknessValues.length;
    }

    public ColorResult colorAt(int angleRow, int thicknessColumn) {
        return grid[angleRow][thicknessColumn];
    }

    /**
     * Copia profunda de la rejilla de colores.
     */
    public ColorResult[][] getGrid() {
        ColorResult[][] copy = new ColorResult[grid.length][];
        for (int row = 0; row < grid.length; row++) {
            copy[row] = grid[row].clone();
        }
        return copy;
    }

    public double[] getAngleValues() {
        return angleValues.clone();
    }

    public double[] getThicknessValues() {
        return thicknessValues.clone();
    }

    @Override
    public int getCellCount() {
        return getRowCount() * getColumnCount();
    }
}
