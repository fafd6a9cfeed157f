package thinfilm.domain.color;

import lombok.Builder;
import thinfilm.domain.exception.InvalidInputException;

/**
 * Color percibido de un espectro de reflectancia.
 *
 * @param red          canal R sRGB [0, 255]
 * @param green        canal G sRGB [0, 255]
 * @param blue         canal B sRGB [0, 255]
 * @param x            cromaticidad CIE x [0, 1]
 * @param y            cromaticidad CIE y [0, 1]
 * @param tristimulus  XYZ normalizado al blanco del iluminante
 */
@Builder
public record ColorResult(int red, int green, int blue, double x, double y, Tristimulus tristimulus) {

    public ColorResult {
        checkChannel("R", red);
        checkChannel("G", green);
        checkChannel("B", blue);
        if (tristimulus == null) {
            tristimulus = Tristimulus.BLACK;
        }
    }

    public int[] rgb() {
        return new int[]{red, green, blue};
    }

    public String toHex() {
        return String.format("#%02X%02X%02X", red, green, blue);
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new InvalidInputException("Canal " + name + " fuera de [0, 255]: " + value);
        }
    }
}
