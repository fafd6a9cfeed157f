package thinfilm.physics.simulator;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import thinfilm.config.EngineConfig;
import thinfilm.domain.color.ColorResult;
import thinfilm.domain.exception.InvalidSweepRangeException;
import thinfilm.domain.exception.MaterialNotFoundException;
import thinfilm.domain.spectrum.Polarization;
import thinfilm.domain.spectrum.ReflectanceSpectrum;
import thinfilm.domain.stack.Layer;
import thinfilm.domain.sweep.GridSweepResult;
import thinfilm.domain.sweep.LinearSweepResult;
import thinfilm.domain.sweep.SweepRange;
import thinfilm.domain.sweep.SweepResult;
import thinfilm.domain.sweep.SweepSpec;
import thinfilm.domain.sweep.SweepType;
import thinfilm.physics.i.IColorimetryConverter;
import thinfilm.physics.i.IReflectanceSolver;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SweepOrchestratorTest {

    private static final ColorResult GREY = ColorResult.builder().red(128).green(128).blue(128).x(0.31).y(0.33).build();

    private IReflectanceSolver solver;
    private IColorimetryConverter converter;
    private SweepOrchestrator orchestrator;

    private final List<Layer> baseStack = List.of(Layer.of("TiO2", 50), Layer.of("SiO2", 100));

    @BeforeEach
    void setUp() {
        solver = mock(IReflectanceSolver.class);
        converter = mock(IColorimetryConverter.class);
        when(solver.compute(anyList(), anyString(), any(double[].class), anyDouble())).thenAnswer(invocation -> {
            double[] grid = invocation.getArgument(2);
            return new ReflectanceSpectrum(grid, new double[grid.length], new double[grid.length]);
        });
        when(converter.toColor(any(double[].class), any(double[].class))).thenReturn(GREY);

        orchestrator = new SweepOrchestrator(solver, converter, EngineConfig.builder().cpuProcessorCount(4).build());
    }

    @AfterEach
    void tearDown() {
        orchestrator.close();
    }

    @Test
    @DisplayName("Barrido de espesor de 0 a 5 con paso 1: seis muestras en orden")
    void thicknessSweep_sixSamples() {
        SweepSpec spec = SweepSpec.builder()
                .thicknessRange(SweepRange.of(0.0, 5.0, 1.0))
                .layerNumber(1)
                .fixedAngle(0.0)
                .build();

        SweepResult result = orchestrator.run(baseStack, spec);

        assertEquals(SweepType.THICKNESS, result.getType());
        LinearSweepResult linear = (LinearSweepResult) result;
        assertEquals(6, linear.size());
        assertArrayEquals(new double[]{0, 1, 2, 3, 4, 5}, linear.getSweptValues(), 1e-12);
        assertEquals(GREY, linear.colorAt(5));
    }

    @Test
    @DisplayName("La capa 1 es la inferior: se barre la capa junto al sustrato y la pila base no cambia")
    void thicknessSweep_overridesBottomLayer() {
        SweepSpec spec = SweepSpec.builder()
                .thicknessRange(SweepRange.of(0.0, 5.0, 1.0))
                .layerNumber(1)
                .fixedAngle(10.0)
                .substrate("Si")
                .build();

        orchestrator.run(baseStack, spec);

        verify(solver).compute(eq(List.of(Layer.of("TiO2", 50), Layer.of("SiO2", 3.0))), eq("Si"), any(double[].class), eq(10.0));
        assertEquals(100.0, baseStack.get(1).thickness());
    }

    @Test
    @DisplayName("Barrido de ángulo: pila fija, un color por ángulo")
    void angleSweep() {
        SweepSpec spec = SweepSpec.builder()
                .angleRange(SweepRange.of(0.0, 80.0, 20.0))
                .polarization(Polarization.S)
                .build();

        LinearSweepResult result = (LinearSweepResult) orchestrator.run(baseStack, spec);

        assertEquals(SweepType.ANGLE, result.getType());
        assertEquals(5, result.size());
        verify(solver).compute(eq(baseStack), anyString(), any(double[].class), eq(60.0));
    }

    @Test
    @DisplayName("Barrido 2D: filas de ángulo, columnas de espesor y progreso estrictamente creciente hasta 1.0")
    void gridSweep_dimensionsAndProgress() throws Exception {
        SweepSpec spec = SweepSpec.builder()
                .thicknessRange(SweepRange.of(0.0, 100.0, 25.0))
                .angleRange(SweepRange.of(0.0, 30.0, 10.0))
                .layerNumber(2)
                .build();
        List<Double> progress = new CopyOnWriteArrayList<>();

        CompletableFuture<SweepResult> future = orchestrator.submit(baseStack, spec, progress::add);
        GridSweepResult grid = (GridSweepResult) future.get(10, TimeUnit.SECONDS);

        assertEquals(4, grid.getRowCount(), "Filas = ángulos 0, 10, 20, 30");
        assertEquals(5, grid.getColumnCount(), "Columnas = espesores 0, 25, 50, 75, 100");
        assertEquals(20, grid.getCellCount());
        for (int row = 0; row < grid.getRowCount(); row++) {
            for (int col = 0; col < grid.getColumnCount(); col++) {
                assertNotNull(grid.colorAt(row, col), "Celda vacía en [" + row + "][" + col + "]");
            }
        }

        assertEquals(4, progress.size(), "Una notificación por fila terminada");
        for (int i = 1; i < progress.size(); i++) {
            assertTrue(progress.get(i) > progress.get(i - 1), "El progreso debe ser estrictamente creciente: " + progress);
        }
        assertEquals(1.0, progress.get(progress.size() - 1));
        verify(solver, times(20)).compute(anyList(), anyString(), any(double[].class), anyDouble());
    }

    @Test
    @DisplayName("Los barridos 1D no notifican progreso")
    void linearSweep_reportsNoProgress() {
        SweepProgressListener listener = mock(SweepProgressListener.class);
        SweepSpec spec = SweepSpec.builder().angleRange(SweepRange.of(0.0, 45.0, 15.0)).build();

        orchestrator.run(baseStack, spec, listener);

        verifyNoInteractions(listener);
    }

    @Test
    @DisplayName("Rangos inválidos lanzan InvalidSweepRangeException en run")
    void validation_run() {
        SweepRange thickness = SweepRange.of(0.0, 100.0, 10.0);

        assertThrows(InvalidSweepRangeException.class, () -> orchestrator.run(baseStack,
                SweepSpec.builder().thicknessRange(SweepRange.of(-10.0, 100.0, 10.0)).build()));
        assertThrows(InvalidSweepRangeException.class, () -> orchestrator.run(baseStack,
                SweepSpec.builder().thicknessRange(SweepRange.of(0.0, 100.0, 0.0)).build()));
        assertThrows(InvalidSweepRangeException.class, () -> orchestrator.run(baseStack,
                SweepSpec.builder().thicknessRange(SweepRange.of(100.0, 100.0, 10.0)).build()));
        assertThrows(InvalidSweepRangeException.class, () -> orchestrator.run(baseStack,
                SweepSpec.builder().angleRange(SweepRange.of(0.0, 95.0, 5.0)).build()));
        assertThrows(InvalidSweepRangeException.class, () -> orchestrator.run(baseStack,
                SweepSpec.builder().thicknessRange(thickness).fixedAngle(91.0).build()));
        assertThrows(InvalidSweepRangeException.class, () -> orchestrator.run(baseStack,
                SweepSpec.builder().thicknessRange(thickness).layerNumber(3).build()));
        assertThrows(InvalidSweepRangeException.class, () -> orchestrator.run(List.of(),
                SweepSpec.builder().thicknessRange(thickness).build()));
        assertThrows(InvalidSweepRangeException.class, () -> orchestrator.run(baseStack, SweepSpec.builder().build()));

        verifyNoInteractions(solver);
    }

    @Test
    @DisplayName("En submit los errores de validación llegan por el futuro")
    void validation_submit_deliveredThroughFuture() {
        SweepSpec spec = SweepSpec.builder().thicknessRange(SweepRange.of(0.0, 100.0, 10.0)).layerNumber(0).build();

        CompletableFuture<SweepResult> future = assertDoesNotThrow(() -> orchestrator.submit(baseStack, spec, null));

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(InvalidSweepRangeException.class, e.getCause());
    }

    @Test
    @DisplayName("Un fallo en una celda completa el futuro con el error, nunca con resultado")
    void cellFailure_completesExceptionally() {
        doThrow(new MaterialNotFoundException("Kryptonite"))
                .when(solver).compute(anyList(), anyString(), any(double[].class), eq(20.0));
        SweepSpec spec = SweepSpec.builder()
                .thicknessRange(SweepRange.of(0.0, 100.0, 50.0))
                .angleRange(SweepRange.of(0.0, 30.0, 10.0))
                .build();

        CompletableFuture<SweepResult> future = orchestrator.submit(baseStack, spec, SweepProgressListener.NONE);

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(10, TimeUnit.SECONDS));
        assertInstanceOf(MaterialNotFoundException.class, e.getCause());
        assertTrue(future.isCompletedExceptionally());

        // El camino síncrono relanza la excepción original.
        assertThrows(MaterialNotFoundException.class, () -> orchestrator.run(baseStack, spec));
    }
}
