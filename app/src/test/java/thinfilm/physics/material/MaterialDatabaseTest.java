package thinfilm.physics.material;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import thinfilm.domain.exception.DataLoadException;
import thinfilm.domain.exception.MaterialNotFoundException;
import thinfilm.domain.material.ComplexRefractiveIndex;
import thinfilm.domain.material.DispersionTable;
import thinfilm.physics.i.IDispersionTableLoader;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class MaterialDatabaseTest {

    private IDispersionTableLoader loader;
    private MaterialDatabase database;

    @BeforeEach
    void setUp() {
        loader = mock(IDispersionTableLoader.class);
        when(loader.describeLocation()).thenReturn("memoria");
        when(loader.load(anyString(), anyString())).thenAnswer(invocation -> {
            String id = invocation.getArgument(0);
            return new DispersionTable(id, "memoria",
                    new double[]{400, 500, 600}, new double[]{1.50, 1.46, 1.44}, new double[]{0.02, 0.01, 0.0});
        });
        database = new MaterialDatabase(loader);
    }

    @Test
    @DisplayName("Dos consultas del mismo material devuelven lo mismo y leen el fichero una sola vez")
    void getIndex_loadsOnce() {
        double[] grid = {450, 550};

        ComplexRefractiveIndex first = database.getIndex("SiO2", grid);
        ComplexRefractiveIndex second = database.getIndex("sio2", grid);

        assertArrayEquals(first.cloneN(), second.cloneN(), 0.0);
        assertArrayEquals(first.cloneK(), second.cloneK(), 0.0);
        verify(loader, times(1)).load("SiO2", "SiO2.txt");
        assertEquals(1, database.cachedMaterialCount());
    }

    @Test
    @DisplayName("Un material fuera del catálogo falla sin tocar el disco")
    void unknownMaterial() {
        MaterialNotFoundException e = assertThrows(MaterialNotFoundException.class,
                () -> database.getIndex("Unobtainium", new double[]{500}));

        assertEquals("Unobtainium", e.getMaterialId());
        verify(loader, never()).load(anyString(), anyString());
    }

    @Test
    @DisplayName("El medio incidente tiene índice 1 + 0i sin fichero")
    void ambientIsVacuumLike() {
        ComplexRefractiveIndex air = database.getIndex("air", new double[]{380, 500, 780});

        assertArrayEquals(new double[]{1, 1, 1}, air.cloneN(), 0.0);
        assertArrayEquals(new double[]{0, 0, 0}, air.cloneK(), 0.0);
        verify(loader, never()).load(anyString(), anyString());
    }

    @Test
    @DisplayName("Por debajo del mínimo tabulado la extrapolación no se recorta")
    void extrapolationBelowRange_isUnclamped() {
        ComplexRefractiveIndex index = database.getIndex("SiO2", new double[]{100});

        // k: 0.02 + (100 - 400) * (-0.01 / 100) = 0.05 ; a 1000 nm: 0.0 + 400 * (-0.01/100) = -0.04
        assertEquals(0.05, index.kAt(0), 1e-12);
        ComplexRefractiveIndex above = database.getIndex("SiO2", new double[]{1000});
        assertEquals(-0.04, above.kAt(0), 1e-12, "El k extrapolado puede ser negativo.");
    }

    @Test
    @DisplayName("Varios hilos pidiendo el mismo material a la vez provocan una única carga")
    void concurrentFirstLoad_loadsOnce() throws Exception {
        doAnswer(invocation -> {
            Thread.sleep(50);
            return new DispersionTable(invocation.getArgument(0), "memoria",
                    new double[]{400, 600}, new double[]{2.0, 2.0}, new double[]{0.0, 0.0});
        }).when(loader).load(anyString(), anyString());
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<DispersionTable>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return database.getTable("TiO2");
                }));
            }
            start.countDown();

            DispersionTable reference = futures.get(0).get(5, TimeUnit.SECONDS);
            for (Future<DispersionTable> f : futures) {
                assertSame(reference, f.get(5, TimeUnit.SECONDS), "Todos los hilos deben ver la misma tabla.");
            }
            verify(loader, times(1)).load("TiO2", "TiO2.txt");
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Los errores de carga se propagan y no se quedan en caché")
    void loadFailure_isNotCached() {
        doThrow(new DataLoadException("/datos/Ge.txt", "Fichero de datos del material no encontrado"))
                .when(loader).load(eq("Ge"), anyString());

        assertThrows(DataLoadException.class, () -> database.getTable("Ge"));
        assertThrows(DataLoadException.class, () -> database.getTable("Ge"));
        verify(loader, times(2)).load("Ge", "Ge.txt");
        assertEquals(0, database.cachedMaterialCount());
    }

    @Test
    @DisplayName("Vaciar la caché fuerza una nueva lectura")
    void clear_forcesReload() {
        database.getTable("Si");
        database.clear();
        database.getTable("Si");

        verify(loader, times(2)).load("Si", "Si.txt");
    }

    @Test
    @DisplayName("El catálogo empieza por el medio incidente")
    void availableMaterials() {
        List<String> names = database.availableMaterials();

        assertEquals("Air", names.get(0));
        assertTrue(names.contains("SiO2"));
        assertTrue(database.isKnown("poly-si"));
        assertFalse(database.isKnown("Unobtainium"));
        assertEquals("Al2O3.txt", database.fileNameOf("al2o3"));
    }
}
