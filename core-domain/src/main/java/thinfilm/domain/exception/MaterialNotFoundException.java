package thinfilm.domain.exception;

import lombok.Getter;

/**
 * El identificador de material no figura en el catálogo de dispersión.
 */
@Getter
public class MaterialNotFoundException extends ThinFilmException {

    private final String materialId;

    public MaterialNotFoundException(String materialId) {
        super("Material '" + materialId + "' no encontrado en la base de datos de índices de refracción.");
        this.materialId = materialId;
    }
}
