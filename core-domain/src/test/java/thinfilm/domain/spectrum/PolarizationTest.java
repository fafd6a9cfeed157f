package thinfilm.domain.spectrum;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import thinfilm.domain.exception.InvalidInputException;

import static org.junit.jupiter.api.Assertions.*;

class PolarizationTest {

    @Test
    @DisplayName("Las etiquetas de texto se resuelven a la enumeración")
    void fromLabel() {
        assertEquals(Polarization.S, Polarization.fromLabel("s"));
        assertEquals(Polarization.S, Polarization.fromLabel("s-polarized"));
        assertEquals(Polarization.P, Polarization.fromLabel(" P "));
        assertEquals(Polarization.P, Polarization.fromLabel("TM"));
        assertEquals(Polarization.MIXED, Polarization.fromLabel("Mixed (s+p)/2"));
        assertEquals(Polarization.MIXED, Polarization.fromLabel("unpolarized"));
        assertThrows(InvalidInputException.class, () -> Polarization.fromLabel("circular"));
    }

    @Test
    @DisplayName("La combinación mixta es la media de Rs y Rp")
    void combine() {
        assertEquals(0.2, Polarization.S.combine(0.2, 0.6));
        assertEquals(0.6, Polarization.P.combine(0.2, 0.6));
        assertEquals(0.4, Polarization.MIXED.combine(0.2, 0.6), 1e-15);

        ReflectanceSpectrum spectrum = new ReflectanceSpectrum(new double[]{500, 600}, new double[]{0.1, 0.3}, new double[]{0.3, 0.5});
        assertArrayEquals(new double[]{0.2, 0.4}, spectrum.combined(Polarization.MIXED), 1e-15);
    }
}
