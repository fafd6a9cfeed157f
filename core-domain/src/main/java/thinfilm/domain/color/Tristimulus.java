package thinfilm.domain.color;

/**
 * Valores triestímulo CIE 1931 normalizados al blanco del iluminante (Y_blanco = 1).
 */
public record Tristimulus(double x, double y, double z) {

    public static final Tristimulus BLACK = new Tristimulus(0.0, 0.0, 0.0);

    public double sum() {
        return x + y + z;
    }
}
