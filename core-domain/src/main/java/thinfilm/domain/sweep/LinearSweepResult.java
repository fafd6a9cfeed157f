package thinfilm.domain.sweep;

import lombok.Builder;
import lombok.Value;
import thinfilm.domain.color.ColorResult;

import java.util.List;

/**
 * Barrido 1D: una secuencia de colores indexada por el valor barrido (espesor en nm o ángulo en grados).
 */
@Value
@Builder
public class LinearSweepResult implements SweepResult {

    SweepType type;

    double[] sweptValues;

    List<ColorResult> colors;

    long elapsedMillis;

    public double[] getSweptValues() {
        return sweptValues.clone();
    }

    public ColorResult colorAt(int index) {
        return colors.get(index);
    }

    public double valueAt(int index) {
        return sweptValues[index];
    }

    public int size() {
        return colors.size();
    }

    @Override
    public int getCellCount() {
        return colors.size();
    }
}
