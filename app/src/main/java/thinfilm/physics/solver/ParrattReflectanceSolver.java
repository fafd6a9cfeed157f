package thinfilm.physics.solver;

import thinfilm.domain.exception.InvalidInputException;
import thinfilm.domain.material.ComplexRefractiveIndex;
import thinfilm.domain.spectrum.ReflectanceSpectrum;
import thinfilm.domain.stack.Layer;
import thinfilm.physics.i.IReflectanceSolver;
import thinfilm.physics.material.MaterialDatabase;
import thinfilm.physics.math.Complex;
import thinfilm.physics.math.LinearInterpolator;

import java.util.List;
import java.util.Objects;

/**
 * Reflectancia espectral de una multicapa plana mediante la recursión de Parratt.
 * <p>
 * Para cada longitud de onda:
 * <ol>
 *     <li>Secuencia de medios: incidente, capas en orden, sustrato.</li>
 *     <li>Invariante lateral β = n0·sin(θ), con n0 la parte real del índice incidente.</li>
 *     <li>k_z,j = (2π/λ)·sqrt(N_j² − β²) con la raíz de medio pasivo ({@link Complex#sqrt()}).</li>
 *     <li>Término de admitancia: s → f_j = k_z,j ; p → f_j = k_z,j / N_j².</li>
 *     <li>Desde la interfaz más profunda hacia arriba:
 *     r_j = a_j·(F_j + r_{j+1}) / (1 + F_j·r_{j+1}), con F_j = (f_j − f_{j+1}) / (f_j + f_{j+1}),
 *     a_j = exp(2i·k_z,j·d_j) y semilla r_{N+1} = 0.</li>
 *     <li>R = |r_0|².</li>
 * </ol>
 * Todo es aritmética compleja cerrada: no hay iteraciones ni convergencia. El resultado no se recorta
 * a [0, 1]. Sin estado, thread-safe: la única dependencia compartida es la base de materiales.
 */
public class ParrattReflectanceSolver implements IReflectanceSolver {

    private final MaterialDatabase materials;
    private final String ambientMaterial;

    public ParrattReflectanceSolver(MaterialDatabase materials, String ambientMaterial) {
        this.materials = Objects.requireNonNull(materials, "La base de materiales no puede ser nula.");
        this.ambientMaterial = Objects.requireNonNull(ambientMaterial, "El medio incidente no puede ser nulo.");
    }

    @Override
    public ReflectanceSpectrum compute(List<Layer> layers, String substrateId, double[] wavelengths, double incidenceAngle) {
        if (layers == null) {
            throw new InvalidInputException("La lista de capas no puede ser nula (usa una lista vacía para el sustrato desnudo).");
        }
        if (wavelengths == null) {
            throw new InvalidInputException("La rejilla de longitudes de onda no puede ser nula.");
        }
        if (!Double.isFinite(incidenceAngle)) {
            throw new InvalidInputException("El ángulo de incidencia debe ser finito.");
        }
        if (wavelengths.length == 0) {
            return ReflectanceSpectrum.empty();
        }
        if (!LinearInterpolator.isStrictlyAscending(wavelengths) || !(wavelengths[0] > 0.0)) {
            throw new InvalidInputException("La rejilla de longitudes de onda debe ser positiva y estrictamente creciente.");
        }

        // 1. Índices de todos los medios (los materiales desconocidos fallan aquí)
        int filmCount = layers.size();
        int mediaCount = filmCount + 2;
        ComplexRefractiveIndex[] indices = new ComplexRefractiveIndex[mediaCount];
        double[] thicknesses = new double[mediaCount];
        indices[0] = materials.getIndex(ambientMaterial, wavelengths);
        for (int j = 0; j < filmCount; j++) {
            Layer layer = layers.get(j);
            indices[j + 1] = materials.getIndex(layer.material(), wavelengths);
            thicknesses[j + 1] = layer.thickness();
        }
        indices[mediaCount - 1] = materials.getIndex(substrateId, wavelengths);

        double sinTheta = Math.sin(Math.toRadians(incidenceAngle));
        double[] rs = new double[wavelengths.length];
        double[] rp = new double[wavelengths.length];

        Complex[] n = new Complex[mediaCount];
        Complex[] kz = new Complex[mediaCount];

        for (int w = 0; w < wavelengths.length; w++) {
            double k0 = 2.0 * Math.PI / wavelengths[w];
            double beta = indices[0].nAt(w) * sinTheta;
            double betaSquared = beta * beta;

            // 2. k_z compartido por ambas polarizaciones
            for (int j = 0; j < mediaCount; j++) {
                n[j] = indices[j].at(w);
                kz[j] = n[j].square().subtract(betaSquared).sqrt().scale(k0);
            }

            // 3. Recursión desde el sustrato hacia el medio incidente
            Complex rS = Complex.ZERO;
            Complex rP = Complex.ZERO;
            for (int j = filmCount; j >= 0; j--) {
                Complex phase = phaseTerm(kz[j], thicknesses[j]);

                Complex fS = kz[j];
                Complex fSNext = kz[j + 1];
                rS = combine(fresnel(fS, fSNext), rS, phase);

                Complex fP = kz[j].divide(n[j].square());
                Complex fPNext = kz[j + 1].divide(n[j + 1].square());
                rP = combine(fresnel(fP, fPNext), rP, phase);
            }

            rs[w] = rS.absSquared();
            rp[w] = rP.absSquared();
        }

        return new ReflectanceSpectrum(wavelengths, rs, rp);
    }

    /**
     * F_j = (f_j − f_{j+1}) / (f_j + f_{j+1}).
     */
    static Complex fresnel(Complex f, Complex fNext) {
        return f.subtract(fNext).divide(f.add(fNext));
    }

    /**
     * a_j = exp(i·2·k_z·d). Espesor cero (medio incidente, sustrato o capa transparente) -> 1 exacto.
     */
    static Complex phaseTerm(Complex kz, double thickness) {
        if (thickness == 0.0) {
            return Complex.ONE;
        }
        // i·2·kz·d = (−2·d·Im kz) + i·(2·d·Re kz)
        return new Complex(-2.0 * thickness * kz.imag, 2.0 * thickness * kz.real).exp();
    }

    /**
     * r_j = a_j·(F_j + r_{j+1}) / (1 + F_j·r_{j+1}).
     */
    static Complex combine(Complex interfaceTerm, Complex rNext, Complex phase) {
        Complex numerator = interfaceTerm.add(rNext);
        Complex denominator = Complex.ONE.add(interfaceTerm.multiply(rNext));
        return phase.multiply(numerator.divide(denominator));
    }
}
