package thinfilm.domain.color;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import thinfilm.domain.exception.InvalidInputException;

import static org.junit.jupiter.api.Assertions.*;

class ColorResultTest {

    @Test
    @DisplayName("Formato hexadecimal y validación de canales")
    void hexAndValidation() {
        ColorResult color = ColorResult.builder().red(255).green(128).blue(0).x(0.5).y(0.4).build();

        assertEquals("#FF8000", color.toHex());
        assertArrayEquals(new int[]{255, 128, 0}, color.rgb());
        assertEquals(Tristimulus.BLACK, color.tristimulus());
        assertThrows(InvalidInputException.class, () -> ColorResult.builder().red(256).build());
    }
}
