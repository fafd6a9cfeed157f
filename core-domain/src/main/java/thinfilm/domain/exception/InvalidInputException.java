package thinfilm.domain.exception;

/**
 * Entradas inconsistentes: longitudes distintas, rejillas no ordenadas o vacías cuando se requieren datos.
 */
public class InvalidInputException extends ThinFilmException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
