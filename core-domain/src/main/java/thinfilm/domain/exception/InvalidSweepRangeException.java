package thinfilm.domain.exception;

/**
 * Parámetros de barrido inválidos (rango, paso, ángulo o índice de capa).
 */
public class InvalidSweepRangeException extends ThinFilmException {

    public InvalidSweepRangeException(String message) {
        super(message);
    }
}
