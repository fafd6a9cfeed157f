package thinfilm.domain.exception;

import lombok.Getter;

/**
 * Fichero de dispersión (o tabla estándar) ausente o mal formado.
 * Siempre transporta la ubicación que se intentó leer.
 */
@Getter
public class DataLoadException extends ThinFilmException {

    private final String location;

    public DataLoadException(String location, String message) {
        super(message + " [" + location + "]");
        this.location = location;
    }

    public DataLoadException(String location, String message, Throwable cause) {
        super(message + " [" + location + "]", cause);
        this.location = location;
    }
}
