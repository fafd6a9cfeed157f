package thinfilm.domain.sweep;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import thinfilm.domain.color.ColorResult;

import static org.junit.jupiter.api.Assertions.*;

class GridSweepResultTest {

    private static final ColorResult RED = ColorResult.builder().red(255).x(0.64).y(0.33).build();
    private static final ColorResult BLUE = ColorResult.builder().blue(255).x(0.15).y(0.06).build();

    @Test
    @DisplayName("getGrid devuelve una copia: modificarla no altera el resultado")
    void getGrid_returnsDeepCopy() {
        GridSweepResult result = GridSweepResult.builder()
                .angleValues(new double[]{0, 45})
                .thicknessValues(new double[]{10})
                .grid(new ColorResult[][]{{RED}, {RED}})
                .elapsedMillis(5)
                .build();

        ColorResult[][] copy = result.getGrid();
        copy[1][0] = BLUE;
        copy[0] = new ColorResult[]{BLUE};

        assertEquals(RED, result.colorAt(0, 0));
        assertEquals(RED, result.colorAt(1, 0));
        assertEquals(2, result.getCellCount());
        assertEquals(SweepType.THICKNESS_ANGLE, result.getType());
    }
}
