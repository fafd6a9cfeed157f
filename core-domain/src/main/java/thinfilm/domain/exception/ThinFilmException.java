package thinfilm.domain.exception;

/**
 * Raíz de la taxonomía de errores del motor de películas delgadas.
 * <p>
 * Todas las excepciones son no comprobadas: se propagan de forma síncrona hasta el
 * llamador inmediato y nunca se reintentan (el cálculo es determinista).
 */
public class ThinFilmException extends RuntimeException {

    public ThinFilmException(String message) {
        super(message);
    }

    public ThinFilmException(String message, Throwable cause) {
        super(message, cause);
    }
}
