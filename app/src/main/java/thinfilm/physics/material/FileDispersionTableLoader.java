package thinfilm.physics.material;

import lombok.extern.slf4j.Slf4j;
import thinfilm.domain.exception.DataLoadException;
import thinfilm.domain.exception.InvalidInputException;
import thinfilm.domain.material.DispersionTable;
import thinfilm.io.SpectralTableReader;
import thinfilm.physics.i.IDispersionTableLoader;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Carga tablas (λ, n, k) desde una carpeta del sistema de ficheros.
 * <p>
 * Formato: cabecera de una línea y filas "longitud_onda_nm n k" separadas por espacios,
 * en orden creciente de longitud de onda.
 */
@Slf4j
public class FileDispersionTableLoader implements IDispersionTableLoader {

    private final Path dataDirectory;

    public FileDispersionTableLoader(Path dataDirectory) {
        this.dataDirectory = dataDirectory;
    }

    @Override
    public DispersionTable load(String materialId, String fileName) {
        Path path = dataDirectory.resolve(fileName);
        String location = path.toAbsolutePath().toString();

        if (!Files.isRegularFile(path)) {
            log.error("Fichero de dispersión no encontrado para {}: {}", materialId, location);
            throw new DataLoadException(location, "Fichero de datos del material no encontrado");
        }

        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            double[][] columns = SpectralTableReader.readColumns(reader, 3);
            DispersionTable table = new DispersionTable(materialId, location, columns[0], columns[1], columns[2]);
            log.info("Tabla de dispersión de {} cargada: {} muestras [{} - {} nm] desde {}",
                    materialId, table.getSampleCount(), table.getMinWavelength(), table.getMaxWavelength(), location);
            return table;
        } catch (NoSuchFileException e) {
            throw new DataLoadException(location, "Fichero de datos del material no encontrado", e);
        } catch (IOException e) {
            log.error("Error de E/S leyendo la tabla de {} en {}", materialId, location, e);
            throw new DataLoadException(location, "Error leyendo el fichero de datos del material", e);
        } catch (NumberFormatException | IllegalStateException | InvalidInputException e) {
            log.error("Tabla de dispersión mal formada para {} en {}: {}", materialId, location, e.getMessage());
            throw new DataLoadException(location, "Fichero de datos mal formado: " + e.getMessage(), e);
        }
    }

    @Override
    public String describeLocation() {
        return dataDirectory.toAbsolutePath().toString();
    }
}
