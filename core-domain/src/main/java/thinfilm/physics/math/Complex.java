package thinfilm.physics.math;

/**
 * Número complejo inmutable de doble precisión.
 * <p>
 * Cubre exactamente la aritmética que necesita la recursión de Parratt: suma, resta,
 * producto, cociente, exponencial y raíz cuadrada con la rama de medio pasivo.
 */
public final class Complex {

    public static final Complex ZERO = new Complex(0.0, 0.0);
    public static final Complex ONE = new Complex(1.0, 0.0);

    public final double real;
    public final double imag;

    public Complex(double real, double imag) {
        this.real = real;
        this.imag = imag;
    }

    public static Complex of(double real, double imag) {
        return new Complex(real, imag);
    }

    public static Complex ofReal(double real) {
        return new Complex(real, 0.0);
    }

    public Complex add(Complex other) {
        return new Complex(this.real + other.real, this.imag + other.imag);
    }

    public Complex subtract(Complex other) {
        return new Complex(this.real - other.real, this.imag - other.imag);
    }

    public Complex subtract(double value) {
        return new Complex(this.real - value, this.imag);
    }

    public Complex multiply(Complex other) {
        double r = this.real * other.real - this.imag * other.imag;
        double i = this.real * other.imag + this.imag * other.real;
        return new Complex(r, i);
    }

    public Complex scale(double factor) {
        return new Complex(this.real * factor, this.imag * factor);
    }

    public Complex square() {
        return multiply(this);
    }

    /**
     * Cociente complejo (algoritmo de Smith para evitar desbordamientos intermedios).
     */
    public Complex divide(Complex other) {
        double c = other.real;
        double d = other.imag;
        if (Math.abs(c) >= Math.abs(d)) {
            double ratio = d / c;
            double denom = c + d * ratio;
            return new Complex((real + imag * ratio) / denom, (imag - real * ratio) / denom);
        }
        double ratio = c / d;
        double denom = c * ratio + d;
        return new Complex((real * ratio + imag) / denom, (imag * ratio - real) / denom);
    }

    /**
     * e^z = e^re · (cos im + i·sin im).
     */
    public Complex exp() {
        double magnitude = Math.exp(real);
        return new Complex(magnitude * Math.cos(imag), magnitude * Math.sin(imag));
    }

    /**
     * Raíz cuadrada principal (parte real ≥ 0).
     * <p>
     * Un radicando real negativo, incluido el caso de parte imaginaria {@code -0.0},
     * devuelve una parte imaginaria no negativa: es la convención de medio pasivo
     * (onda evanescente que decae, nunca ganancia).
     */
    public Complex sqrt() {
        if (real == 0.0 && imag == 0.0) {
            return ZERO;
        }
        double t = Math.sqrt((Math.abs(real) + Math.hypot(real, imag)) / 2.0);
        if (real >= 0.0) {
            return new Complex(t, imag / (2.0 * t));
        }
        double im = (imag == 0.0) ? t : Math.copySign(t, imag);
        return new Complex(Math.abs(imag) / (2.0 * t), im);
    }

    public double abs() {
        return Math.hypot(this.real, this.imag);
    }

    public double absSquared() {
        return this.real * this.real + this.imag * this.imag;
    }

    @Override
    public String toString() {
        return String.format("(%f %s %fi)", real, (imag < 0 ? "-" : "+"), Math.abs(imag));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Complex)) return false;
        Complex other = (Complex) obj;
        return Double.compare(real, other.real) == 0 && Double.compare(imag, other.imag) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(real) * 31 + Double.hashCode(imag);
    }
}
