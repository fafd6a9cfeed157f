package thinfilm.physics.impl;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import thinfilm.domain.color.ColorResult;
import thinfilm.domain.spectrum.Polarization;
import thinfilm.domain.spectrum.ReflectanceSpectrum;
import thinfilm.domain.stack.Layer;
import thinfilm.physics.i.IColorimetryConverter;
import thinfilm.physics.i.IReflectanceSolver;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Tarea que calcula el color de una única celda de un barrido: una pila concreta a un ángulo concreto.
 * No comparte estado mutable con otras celdas, así que puede ejecutarse en cualquier hilo del pool.
 */
@Getter
@RequiredArgsConstructor
public class ColorCellCalculatorTask implements Callable<ColorResult> {

    // --- Entradas de la celda ---
    private final IReflectanceSolver solver;
    private final IColorimetryConverter converter;
    private final List<Layer> layers;       // Pila ya clonada con el espesor de la celda
    private final String substrate;
    private final double[] wavelengths;     // Rejilla compartida, solo lectura
    private final double incidenceAngle;
    private final Polarization polarization;

    @Override
    public ColorResult call() {
        ReflectanceSpectrum spectrum = solver.compute(layers, substrate, wavelengths, incidenceAngle);
        return converter.toColor(spectrum.combined(polarization), wavelengths);
    }
}
