package thinfilm.factory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import thinfilm.domain.exception.InvalidInputException;

import static org.junit.jupiter.api.Assertions.*;

class WavelengthGridFactoryTest {

    @Test
    @DisplayName("La rejilla visible canónica tiene 401 puntos de 380 a 780 nm")
    void visible() {
        double[] grid = WavelengthGridFactory.visible();

        assertEquals(401, grid.length);
        assertEquals(380.0, grid[0]);
        assertEquals(780.0, grid[400]);
        assertTrue(WavelengthGridFactory.isCanonical(grid));
        assertTrue(WavelengthGridFactory.coversVisible(grid));
    }

    @Test
    @DisplayName("Una rejilla parcial o desplazada no es canónica")
    void nonCanonical() {
        double[] shifted = WavelengthGridFactory.range(380.5, 780.5, 1.0);

        assertFalse(WavelengthGridFactory.isCanonical(shifted));
        assertFalse(WavelengthGridFactory.isCanonical(WavelengthGridFactory.range(400, 700, 1.0)));
        assertFalse(WavelengthGridFactory.coversVisible(WavelengthGridFactory.range(400, 700, 1.0)));
        assertThrows(InvalidInputException.class, () -> WavelengthGridFactory.range(700, 400, 1.0));
    }
}
