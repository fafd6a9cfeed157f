package thinfilm.physics.simulator;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import thinfilm.config.EngineConfig;
import thinfilm.domain.color.ColorResult;
import thinfilm.domain.exception.InvalidInputException;
import thinfilm.domain.spectrum.Polarization;
import thinfilm.domain.spectrum.ReflectanceSpectrum;
import thinfilm.domain.spectrum.SpectrumAnalysis;
import thinfilm.domain.stack.Layer;
import thinfilm.domain.stack.StackDesign;
import thinfilm.domain.sweep.SweepResult;
import thinfilm.domain.sweep.SweepSpec;
import thinfilm.factory.WavelengthGridFactory;
import thinfilm.physics.colorimetry.CieColorimetryConverter;
import thinfilm.physics.i.IColorimetryConverter;
import thinfilm.physics.i.IReflectanceSolver;
import thinfilm.physics.material.MaterialDatabase;
import thinfilm.physics.solver.ParrattReflectanceSolver;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Punto de entrada del motor: compone base de materiales, solver, conversor y orquestador a partir de
 * una única {@link EngineConfig}. Un front-end solo necesita esta clase.
 */
@Slf4j
public class ThinFilmEngine implements AutoCloseable {

    @Getter
    private final EngineConfig config;
    @Getter
    private final MaterialDatabase materials;
    private final IReflectanceSolver solver;
    private final IColorimetryConverter converter;
    private final SweepOrchestrator orchestrator;

    /**
     * Motor con {@link EngineConfig#defaults()}: datos y número de hilos desde las propiedades del sistema.
     */
    public ThinFilmEngine() {
        this(EngineConfig.defaults());
    }

    public ThinFilmEngine(EngineConfig config) {
        this(config, MaterialDatabase.fromConfig(config));
    }

    public ThinFilmEngine(EngineConfig config, MaterialDatabase materials) {
        this(config, materials, new ParrattReflectanceSolver(materials, config.ambientMaterial()), new CieColorimetryConverter());
    }

    public ThinFilmEngine(EngineConfig config, MaterialDatabase materials, IReflectanceSolver solver, IColorimetryConverter converter) {
        this.config = Objects.requireNonNull(config, "La configuración no puede ser nula.");
        this.materials = Objects.requireNonNull(materials, "La base de materiales no puede ser nula.");
        this.solver = Objects.requireNonNull(solver, "El solver no puede ser nulo.");
        this.converter = Objects.requireNonNull(converter, "El conversor no puede ser nulo.");
        this.orchestrator = new SweepOrchestrator(solver, converter, config);
        log.info("ThinFilmEngine listo (datos: {}, sustrato por defecto: {}).", config.dataDirectory(), config.defaultSubstrate());
    }

    public ReflectanceSpectrum computeReflectance(List<Layer> layers, String substrate, double[] wavelengths, double angleDeg) {
        return solver.compute(layers, substrate, wavelengths, angleDeg);
    }

    public ReflectanceSpectrum computeReflectance(StackDesign design, double[] wavelengths) {
        Objects.requireNonNull(design, "El diseño no puede ser nulo.");
        return solver.compute(design.layers(), design.substrate(), wavelengths, design.incidenceAngle());
    }

    public ColorResult computeColor(double[] reflectance, double[] wavelengths) {
        return converter.toColor(reflectance, wavelengths);
    }

    public SweepResult runSweep(List<Layer> baseLayers, SweepSpec spec, SweepProgressListener listener) {
        return orchestrator.run(baseLayers, spec, listener);
    }

    public CompletableFuture<SweepResult> submitSweep(List<Layer> baseLayers, SweepSpec spec, SweepProgressListener listener) {
        return orchestrator.submit(baseLayers, spec, listener);
    }

    /**
     * Evalúa un diseño en una rejilla de 1 nm entre {@code lambdaStart} y {@code lambdaEnd} (inclusive).
     * El color solo se calcula si la rejilla cubre 380-780 nm.
     *
     * @throws InvalidInputException si no hay capas o el intervalo espectral no es válido
     */
    public SpectrumAnalysis analyzeSpectrum(List<Layer> layers, String substrate, int lambdaStart, int lambdaEnd,
                                            double angleDeg, Polarization polarization) {
        if (layers == null || layers.isEmpty()) {
            throw new InvalidInputException("Añade al menos una capa para analizar el espectro.");
        }
        if (lambdaStart >= lambdaEnd) {
            throw new InvalidInputException(String.format(
                    "La longitud de onda inicial (%d nm) debe ser menor que la final (%d nm).", lambdaStart, lambdaEnd));
        }
        Objects.requireNonNull(polarization, "La polarización no puede ser nula.");

        double[] grid = WavelengthGridFactory.range(lambdaStart, lambdaEnd, 1.0);
        ReflectanceSpectrum spectrum = solver.compute(layers, substrate, grid, angleDeg);
        double[] combined = spectrum.combined(polarization);

        ColorResult color = null;
        if (WavelengthGridFactory.coversVisible(grid)) {
            color = converter.toColor(combined, grid);
        } else {
            log.debug("Intervalo {}-{} nm sin cobertura visible completa: no se calcula el color.", lambdaStart, lambdaEnd);
        }
        return SpectrumAnalysis.builder()
                .spectrum(spectrum)
                .polarization(polarization)
                .combined(combined)
                .color(color)
                .build();
    }

    public List<String> availableMaterials() {
        return materials.availableMaterials();
    }

    @Override
    public void close() {
        orchestrator.close();
    }
}
