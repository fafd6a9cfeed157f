package thinfilm.physics.simulator;

import lombok.extern.slf4j.Slf4j;
import thinfilm.config.EngineConfig;
import thinfilm.domain.color.ColorResult;
import thinfilm.domain.exception.InvalidInputException;
import thinfilm.domain.exception.InvalidSweepRangeException;
import thinfilm.domain.exception.ThinFilmException;
import thinfilm.domain.spectrum.Polarization;
import thinfilm.domain.stack.Layer;
import thinfilm.domain.stack.Layers;
import thinfilm.domain.sweep.SweepRange;
import thinfilm.domain.sweep.SweepResult;
import thinfilm.domain.sweep.SweepSpec;
import thinfilm.domain.sweep.SweepType;
import thinfilm.factory.SweepResultFactory;
import thinfilm.factory.WavelengthGridFactory;
import thinfilm.physics.i.IColorimetryConverter;
import thinfilm.physics.i.IReflectanceSolver;
import thinfilm.physics.impl.ColorCellCalculatorTask;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Orquestador de barridos de color.
 * <p>
 * Cada celda (espesor, ángulo) es una {@link ColorCellCalculatorTask} independiente que se ejecuta en un
 * pool fijo de hilos y escribe exactamente una celda del resultado. En el barrido 2D las filas son ángulos y
 * las columnas espesores; cuando termina la última celda de una fila se notifica el progreso.
 * <p>
 * Garantías:
 * <ul>
 *     <li>las notificaciones de progreso están serializadas y son estrictamente crecientes; la última vale 1.0
 *     y llega antes de completar el futuro;</li>
 *     <li>el futuro se completa una sola vez, con el resultado o con el error;</li>
 *     <li>no hay cancelación: un barrido iniciado llega al final o falla.</li>
 * </ul>
 */
@Slf4j
public class SweepOrchestrator implements AutoCloseable {

    private final IReflectanceSolver solver;
    private final IColorimetryConverter converter;
    private final ExecutorService threadPool;

    public SweepOrchestrator(IReflectanceSolver solver, IColorimetryConverter converter, EngineConfig config) {
        this.solver = Objects.requireNonNull(solver, "El solver no puede ser nulo.");
        this.converter = Objects.requireNonNull(converter, "El conversor colorimétrico no puede ser nulo.");
        int processorCount = config.cpuProcessorCount();
        this.threadPool = Executors.newFixedThreadPool(Math.max(processorCount, 1));
        log.info("SweepOrchestrator inicializado con {} hilos.", Math.max(processorCount, 1));
    }

    /**
     * Ejecuta el barrido y espera a que termine.
     *
     * @throws InvalidSweepRangeException si los rangos o la capa elegida no son válidos
     */
    public SweepResult run(List<Layer> baseLayers, SweepSpec spec, SweepProgressListener listener) {
        try {
            return submit(baseLayers, spec, listener).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ThinFilmException("Barrido interrumpido.", e);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        }
    }

    public SweepResult run(List<Layer> baseLayers, SweepSpec spec) {
        return run(baseLayers, spec, SweepProgressListener.NONE);
    }

    /**
     * Lanza el barrido en segundo plano. Los errores de validación también llegan por el futuro.
     */
    public CompletableFuture<SweepResult> submit(List<Layer> baseLayers, SweepSpec spec, SweepProgressListener listener) {
        try {
            SweepPlan plan = plan(baseLayers, spec);
            return execute(plan, listener == null ? SweepProgressListener.NONE : listener);
        } catch (RuntimeException e) {
            log.warn("Barrido rechazado: {}", e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
    }

    // --- VALIDACIÓN Y PLANIFICACIÓN ---

    private SweepPlan plan(List<Layer> baseLayers, SweepSpec spec) {
        if (spec == null) {
            throw new InvalidSweepRangeException("La especificación del barrido no puede ser nula.");
        }
        if (baseLayers == null || baseLayers.isEmpty()) {
            throw new InvalidSweepRangeException("Añade al menos una capa antes de lanzar un barrido.");
        }
        if (spec.getPolarization() == null) {
            throw new InvalidInputException("La polarización no puede ser nula.");
        }
        SweepType type = spec.resolveType();
        List<Layer> layers = List.copyOf(baseLayers);

        int layerIndex = -1;
        double[] thicknesses = null;
        double[] angles;

        if (type != SweepType.ANGLE) {
            validateThicknessRange(spec.getThicknessRange());
            try {
                layerIndex = Layers.indexOfLayerNumber(layers.size(), spec.getLayerNumber());
            } catch (InvalidInputException e) {
                throw new InvalidSweepRangeException(e.getMessage());
            }
            thicknesses = spec.getThicknessRange().values();
        }
        if (type == SweepType.THICKNESS) {
            double fixedAngle = spec.getFixedAngle();
            if (!(fixedAngle >= 0.0 && fixedAngle <= 90.0)) {
                throw new InvalidSweepRangeException("El ángulo fijo debe estar entre 0 y 90 grados: " + fixedAngle);
            }
            angles = new double[]{fixedAngle};
        } else {
            validateAngleRange(spec.getAngleRange());
            angles = spec.getAngleRange().values();
        }

        double[] wavelengths = spec.cloneWavelengths();
        if (wavelengths == null) {
            wavelengths = WavelengthGridFactory.visible();
        }
        return new SweepPlan(type, layers, layerIndex, thicknesses, angles, spec.getSubstrate(),
                wavelengths, spec.getPolarization());
    }

    private static void validateThicknessRange(SweepRange range) {
        if (range.start() < 0.0) {
            throw new InvalidSweepRangeException("El espesor inicial no puede ser negativo: " + range.start());
        }
        validateStepAndOrder("espesor", range);
    }

    private static void validateAngleRange(SweepRange range) {
        if (range.start() < 0.0 || range.end() > 90.0) {
            throw new InvalidSweepRangeException(String.format(
                    "El rango de ángulos debe estar dentro de [0, 90] grados: [%s, %s].", range.start(), range.end()));
        }
        validateStepAndOrder("ángulo", range);
    }

    private static void validateStepAndOrder(String axis, SweepRange range) {
        if (!(range.step() > 0.0)) {
            throw new InvalidSweepRangeException("El paso de " + axis + " debe ser positivo: " + range.step());
        }
        if (!(range.start() < range.end())) {
            throw new InvalidSweepRangeException(String.format(
                    "El inicio de %s debe ser menor que el final: %s >= %s.", axis, range.start(), range.end()));
        }
    }

    // --- EJECUCIÓN ---

    private CompletableFuture<SweepResult> execute(SweepPlan plan, SweepProgressListener listener) {
        long startTime = System.currentTimeMillis();
        int rows = plan.rowCount();
        int columns = plan.columnCount();
        ColorResult[][] cells = new ColorResult[rows][columns];
        AtomicInteger[] remainingPerRow = new AtomicInteger[rows];
        for (int row = 0; row < rows; row++) {
            remainingPerRow[row] = new AtomicInteger(columns);
        }
        CompletableFuture<SweepResult> result = new CompletableFuture<>();
        RowTracker tracker = new RowTracker(plan, cells, result, listener, startTime);

        log.info("Barrido {} lanzado: {} x {} celdas.", plan.type, rows, columns);
        for (int row = 0; row < rows; row++) {
            for (int column = 0; column < columns; column++) {
                final int r = row;
                final int c = column;
                ColorCellCalculatorTask task = plan.taskFor(r, c, solver, converter);
                CompletableFuture.supplyAsync(task::call, threadPool).whenComplete((color, error) -> {
                    if (error != null) {
                        tracker.fail(error);
                        return;
                    }
                    cells[r][c] = color;
                    if (remainingPerRow[r].decrementAndGet() == 0) {
                        tracker.rowFinished();
                    }
                });
            }
        }
        return result;
    }

    /**
     * Contador de filas terminadas. Todo pasa bajo el mismo cerrojo para que el progreso y la
     * finalización del futuro salgan en orden.
     */
    private static final class RowTracker {
        private final SweepPlan plan;
        private final ColorResult[][] cells;
        private final CompletableFuture<SweepResult> result;
        private final SweepProgressListener listener;
        private final long startTime;
        private int rowsDone;

        private RowTracker(SweepPlan plan, ColorResult[][] cells, CompletableFuture<SweepResult> result,
                           SweepProgressListener listener, long startTime) {
            this.plan = plan;
            this.cells = cells;
            this.result = result;
            this.listener = listener;
            this.startTime = startTime;
        }

        synchronized void rowFinished() {
            if (result.isDone()) {
                return;
            }
            rowsDone++;
            int totalRows = cells.length;
            log.debug("Barrido {}: fila {}/{} terminada.", plan.type, rowsDone, totalRows);
            try {
                if (plan.type == SweepType.THICKNESS_ANGLE) {
                    listener.onProgress(rowsDone == totalRows ? 1.0 : (double) rowsDone / totalRows);
                }
                if (rowsDone == totalRows) {
                    long elapsed = System.currentTimeMillis() - startTime;
                    log.info("Barrido {} completado en {} ms.", plan.type, elapsed);
                    result.complete(plan.buildResult(cells, elapsed));
                }
            } catch (RuntimeException e) {
                log.error("Error cerrando la fila {} del barrido.", rowsDone, e);
                result.completeExceptionally(e);
            }
        }

        synchronized void fail(Throwable error) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            if (result.completeExceptionally(cause)) {
                log.error("Barrido {} fallido: {}", plan.type, cause.getMessage());
            }
        }
    }

    /**
     * Ejes ya validados de un barrido.
     */
    private static final class SweepPlan {
        private final SweepType type;
        private final List<Layer> layers;
        private final int layerIndex;
        private final double[] thicknesses;
        private final double[] angles;
        private final String substrate;
        private final double[] wavelengths;
        private final Polarization polarization;

        private SweepPlan(SweepType type, List<Layer> layers, int layerIndex, double[] thicknesses, double[] angles,
                          String substrate, double[] wavelengths, Polarization polarization) {
            this.type = type;
            this.layers = layers;
            this.layerIndex = layerIndex;
            this.thicknesses = thicknesses;
            this.angles = angles;
            this.substrate = substrate;
            this.wavelengths = wavelengths;
            this.polarization = polarization;
        }

        // 1D: una sola fila con todas las muestras en columnas.
        int rowCount() {
            return type == SweepType.THICKNESS_ANGLE ? angles.length : 1;
        }

        int columnCount() {
            return type == SweepType.ANGLE ? angles.length : thicknesses.length;
        }

        ColorCellCalculatorTask taskFor(int row, int column, IReflectanceSolver solver, IColorimetryConverter converter) {
            List<Layer> cellLayers;
            double angle;
            switch (type) {
                case THICKNESS -> {
                    cellLayers = Layers.withThicknessAt(layers, layerIndex, thicknesses[column]);
                    angle = angles[0];
                }
                case ANGLE -> {
                    cellLayers = layers;
                    angle = angles[column];
                }
                default -> {
                    cellLayers = Layers.withThicknessAt(layers, layerIndex, thicknesses[column]);
                    angle = angles[row];
                }
            }
            return new ColorCellCalculatorTask(solver, converter, cellLayers, substrate, wavelengths, angle, polarization);
        }

        SweepResult buildResult(ColorResult[][] cells, long elapsed) {
            return switch (type) {
                case THICKNESS -> SweepResultFactory.createLinear(type, thicknesses, cells[0], elapsed);
                case ANGLE -> SweepResultFactory.createLinear(type, angles, cells[0], elapsed);
                case THICKNESS_ANGLE -> SweepResultFactory.createGrid(angles, thicknesses, cells, elapsed);
            };
        }
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new ThinFilmException("Error durante el barrido.", cause);
    }

    @Override
    public void close() {
        if (threadPool != null && !threadPool.isShutdown()) {
            threadPool.shutdown();
        }
        log.info("SweepOrchestrator cerrado.");
    }
}
