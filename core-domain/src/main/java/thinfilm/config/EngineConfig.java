package thinfilm.config;

import lombok.Builder;
import lombok.With;
import thinfilm.domain.exception.InvalidInputException;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configuración del motor: dónde están las tablas de dispersión, qué medios usar por defecto
 * y cuántos hilos dedicar a los barridos.
 *
 * @param dataDirectory     carpeta con un fichero de texto (λ, n, k) por material
 * @param ambientMaterial   identificador del medio incidente (índice constante 1 + 0i)
 * @param defaultSubstrate  sustrato usado cuando el llamador no indica otro
 * @param cpuProcessorCount número de hilos del pool de barridos (>= 1)
 */
@Builder
@With
public record EngineConfig(
        String dataDirectory,
        String ambientMaterial,
        String defaultSubstrate,
        int cpuProcessorCount
) {

    /**
     * Propiedad JVM con la carpeta de datos de dispersión.
     */
    public static final String DATA_DIR_PROPERTY = "thinfilm.data.dir";
    /**
     * Propiedad JVM con el número de hilos de barrido.
     */
    public static final String CPU_COUNT_PROPERTY = "thinfilm.cpu.count";

    public static final String DEFAULT_DATA_DIR = "data";
    public static final String DEFAULT_AMBIENT = "Air";
    public static final String DEFAULT_SUBSTRATE = "Si";

    // Rejilla canónica de la colorimetría.
    public static final double COLORIMETRY_START_NM = 380.0;
    public static final double COLORIMETRY_END_NM = 780.0;
    public static final double COLORIMETRY_STEP_NM = 1.0;

    public EngineConfig {
        if (dataDirectory == null || dataDirectory.isBlank()) {
            dataDirectory = DEFAULT_DATA_DIR;
        }
        if (ambientMaterial == null || ambientMaterial.isBlank()) {
            ambientMaterial = DEFAULT_AMBIENT;
        }
        if (defaultSubstrate == null || defaultSubstrate.isBlank()) {
            defaultSubstrate = DEFAULT_SUBSTRATE;
        }
        if (cpuProcessorCount < 1) {
            cpuProcessorCount = Math.max(1, Runtime.getRuntime().availableProcessors());
        }
    }

    /**
     * Configuración por defecto, sobrescribible con {@value #DATA_DIR_PROPERTY} y {@value #CPU_COUNT_PROPERTY}.
     *
     * @throws InvalidInputException si {@value #CPU_COUNT_PROPERTY} no es un entero
     */
    public static EngineConfig defaults() {
        String dataDir = System.getProperty(DATA_DIR_PROPERTY, DEFAULT_DATA_DIR);
        int cpuCount = 0;
        String cpuProp = System.getProperty(CPU_COUNT_PROPERTY);
        if (cpuProp != null) {
            try {
                cpuCount = Integer.parseInt(cpuProp.trim());
            } catch (NumberFormatException e) {
                throw new InvalidInputException("La propiedad " + CPU_COUNT_PROPERTY + " debe ser un entero: " + cpuProp, e);
            }
        }
        return new EngineConfig(dataDir, DEFAULT_AMBIENT, DEFAULT_SUBSTRATE, cpuCount);
    }

    public Path dataPath() {
        return Paths.get(dataDirectory);
    }
}
