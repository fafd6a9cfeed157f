package thinfilm.physics.material;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import thinfilm.config.EngineConfig;
import thinfilm.domain.exception.InvalidInputException;
import thinfilm.domain.exception.MaterialNotFoundException;
import thinfilm.domain.material.ComplexRefractiveIndex;
import thinfilm.domain.material.DispersionTable;
import thinfilm.physics.i.IDispersionTableLoader;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Base de datos de dispersión de materiales.
 * <p>
 * Resuelve un identificador (sin distinguir mayúsculas) a su tabla (λ, n, k), la carga la primera
 * vez que se pide y la mantiene en caché el resto de la vida de la instancia. La caché es el único
 * estado mutable compartido del motor:
 * <ul>
 *     <li>como máximo una carga física por identificador, aunque varios hilos lo pidan a la vez;</li>
 *     <li>una vez en caché, las lecturas no bloquean y nunca ven una tabla a medio construir.</li>
 * </ul>
 * El medio incidente ({@link EngineConfig#ambientMaterial()}) no tiene fichero: su índice es 1 + 0i.
 */
@Slf4j
public class MaterialDatabase {

    /**
     * Catálogo fijo: clave en minúsculas -> nombre canónico. El fichero es {@code <nombre>.txt}.
     */
    private static final Map<String, String> CATALOGUE = createCatalogue();

    private final IDispersionTableLoader loader;
    private final String ambientMaterial;
    private final Cache<String, DispersionTable> cache;

    public MaterialDatabase(IDispersionTableLoader loader) {
        this(loader, EngineConfig.DEFAULT_AMBIENT);
    }

    public MaterialDatabase(IDispersionTableLoader loader, String ambientMaterial) {
        this.loader = Objects.requireNonNull(loader, "El cargador de tablas no puede ser nulo.");
        this.ambientMaterial = Objects.requireNonNull(ambientMaterial, "El medio incidente no puede ser nulo.");
        this.cache = Caffeine.newBuilder().build();
        log.info("MaterialDatabase inicializada. Datos en {}, medio incidente '{}', {} materiales en catálogo.",
                loader.describeLocation(), ambientMaterial, CATALOGUE.size());
    }

    public static MaterialDatabase fromConfig(EngineConfig config) {
        return new MaterialDatabase(new FileDispersionTableLoader(config.dataPath()), config.ambientMaterial());
    }

    private static Map<String, String> createCatalogue() {
        Map<String, String> map = new LinkedHashMap<>();
        for (String name : new String[]{
                "a-Ge", "a-Si", "poly-Si", "Al", "Al2O3", "GaAs", "Ge", "HfN", "HfO2", "MgO",
                "RuO2", "Si", "Si3N4", "SiO", "SiO2", "SnO2", "TiO2", "W", "ZnO", "ZrO2"}) {
            map.put(name.toLowerCase(Locale.ROOT), name);
        }
        return Collections.unmodifiableMap(map);
    }

    /**
     * Índice complejo del material evaluado en {@code wavelengths}, con la misma longitud.
     * <p>
     * Interpolación lineal por tramos; fuera del rango tabulado, extrapolación lineal con las dos
     * muestras más cercanas, sin recortar (puede producir n o k negativos).
     *
     * @throws MaterialNotFoundException si el identificador no está en el catálogo
     * @throws thinfilm.domain.exception.DataLoadException si el fichero falta o está mal formado
     */
    public ComplexRefractiveIndex getIndex(String materialId, double[] wavelengths) {
        Objects.requireNonNull(wavelengths, "La rejilla de longitudes de onda no puede ser nula.");
        if (isAmbient(materialId)) {
            return ComplexRefractiveIndex.constant(ambientMaterial, wavelengths, 1.0, 0.0);
        }
        DispersionTable table = getTable(materialId);
        return table.evaluate(wavelengths);
    }

    /**
     * Tabla cruda del material, cargándola si es la primera vez.
     *
     * @throws MaterialNotFoundException si el identificador no está en el catálogo (el medio incidente no tiene tabla)
     */
    public DispersionTable getTable(String materialId) {
        String canonical = canonicalName(materialId);
        DispersionTable cached = cache.getIfPresent(canonical);
        if (cached != null) {
            log.debug("Tabla de {} servida desde caché.", canonical);
            return cached;
        }
        return cache.get(canonical, key -> loader.load(key, key + ".txt"));
    }

    public boolean isKnown(String materialId) {
        return materialId != null && (isAmbient(materialId) || CATALOGUE.containsKey(materialId.toLowerCase(Locale.ROOT)));
    }

    /**
     * Materiales disponibles en orden de catálogo, precedidos por el medio incidente.
     */
    public List<String> availableMaterials() {
        List<String> names = new ArrayList<>(CATALOGUE.size() + 1);
        names.add(ambientMaterial);
        names.addAll(CATALOGUE.values());
        return Collections.unmodifiableList(names);
    }

    public String fileNameOf(String materialId) {
        return canonicalName(materialId) + ".txt";
    }

    public long cachedMaterialCount() {
        return cache.estimatedSize();
    }

    /**
     * Vacía la caché. Las siguientes consultas vuelven a leer de disco.
     */
    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();
        log.info("Caché de materiales vaciada.");
    }

    private boolean isAmbient(String materialId) {
        return materialId != null && materialId.trim().equalsIgnoreCase(ambientMaterial);
    }

    private String canonicalName(String materialId) {
        if (materialId == null || materialId.isBlank()) {
            throw new InvalidInputException("El identificador de material no puede ser nulo ni vacío.");
        }
        String canonical = CATALOGUE.get(materialId.trim().toLowerCase(Locale.ROOT));
        if (canonical == null) {
            throw new MaterialNotFoundException(materialId);
        }
        return canonical;
    }
}
