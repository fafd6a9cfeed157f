package thinfilm.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import thinfilm.config.EngineConfig;
import thinfilm.domain.stack.StackDesign;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Gestiona la lectura y escritura en JSON de los documentos de entrada del motor:
 * diseños de multicapa ({@link StackDesign}) y configuración ({@link EngineConfig}).
 * <p>
 * Es genérica: funciona con cualquier POJO o record compatible con Jackson.
 */
@Slf4j
public class JsonFileHandler {

    // El ObjectMapper es costoso de crear y thread-safe: una instancia compartida.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Serializa un objeto a un archivo JSON. Si el archivo ya existe, se sobrescribe.
     *
     * @throws IOException si ocurre un error durante la escritura
     */
    public <T> void writeToFile(T data, Path path) throws IOException {
        log.info("Serializando objeto de tipo {} a archivo: {}", data.getClass().getSimpleName(), path.toAbsolutePath());
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), data);
            log.debug("Escritura a JSON completada con éxito.");
        } catch (IOException e) {
            log.error("Error al escribir el archivo JSON en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Deserializa un archivo JSON al tipo indicado.
     *
     * @throws IOException si el archivo no existe o su contenido no es válido
     */
    public <T> T readFromFile(Path path, Class<T> objectType) throws IOException {
        log.info("Deserializando archivo {} a un objeto de tipo {}", path.toAbsolutePath(), objectType.getSimpleName());

        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }

        try {
            return objectMapper.readValue(path.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error al leer o parsear el archivo JSON desde {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    public StackDesign readStackDesign(Path path) throws IOException {
        return readFromFile(path, StackDesign.class);
    }

    public void writeStackDesign(StackDesign design, Path path) throws IOException {
        writeToFile(design, path);
    }

    public EngineConfig readEngineConfig(Path path) throws IOException {
        return readFromFile(path, EngineConfig.class);
    }
}
