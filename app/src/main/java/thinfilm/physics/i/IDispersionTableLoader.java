package thinfilm.physics.i;

import thinfilm.domain.material.DispersionTable;

/**
 * Acceso físico al almacenamiento de tablas de dispersión. Cada invocación es una carga real.
 */
public interface IDispersionTableLoader {

    /**
     * Carga la tabla de un material.
     *
     * @param materialId nombre canónico del material (ej: "SiO2")
     * @param fileName   nombre del fichero asociado en el catálogo (ej: "SiO2.txt")
     * @throws thinfilm.domain.exception.DataLoadException si el fichero falta o está mal formado
     */
    DispersionTable load(String materialId, String fileName);

    /**
     * Descripción de la ubicación para los logs.
     */
    String describeLocation();
}
