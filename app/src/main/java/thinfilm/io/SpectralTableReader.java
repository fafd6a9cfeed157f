package thinfilm.io;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Lector de tablas espectrales en texto plano.
 * <p>
 * Formato: una línea de cabecera (se ignora) y después filas de columnas numéricas separadas
 * por espacios o tabuladores. Las líneas en blanco y las que empiezan por {@code #} se saltan. Todas las filas deben tener el
 * número de columnas esperado.
 */
@Slf4j
public final class SpectralTableReader {

    private SpectralTableReader() {
    }

    /**
     * Lee la tabla y la devuelve por columnas: {@code result[columna][fila]}.
     *
     * @param reader          origen del texto; no se cierra aquí
     * @param expectedColumns número exacto de columnas por fila
     * @throws IOException           si falla la lectura
     * @throws NumberFormatException si un campo no es numérico (con el número de línea en el mensaje)
     * @throws IllegalStateException si una fila no tiene {@code expectedColumns} columnas o no hay filas de datos
     */
    public static double[][] readColumns(Reader reader, int expectedColumns) throws IOException {
        BufferedReader buffered = (reader instanceof BufferedReader) ? (BufferedReader) reader : new BufferedReader(reader);
        List<double[]> rows = new ArrayList<>();

        String header = buffered.readLine();
        if (header == null) {
            throw new IllegalStateException("El fichero está vacío (falta la cabecera).");
        }

        String line;
        int lineNumber = 1;
        while ((line = buffered.readLine()) != null) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            String[] fields = trimmed.split("\\s+");
            if (fields.length != expectedColumns) {
                throw new IllegalStateException(String.format(
                        "Línea %d: se esperaban %d columnas y hay %d.", lineNumber, expectedColumns, fields.length));
            }
            double[] row = new double[expectedColumns];
            for (int c = 0; c < expectedColumns; c++) {
                try {
                    row[c] = Double.parseDouble(fields[c]);
                } catch (NumberFormatException e) {
                    throw new NumberFormatException(String.format("Línea %d, columna %d: valor no numérico '%s'.",
                            lineNumber, c + 1, fields[c]));
                }
            }
            rows.add(row);
        }

        if (rows.isEmpty()) {
            throw new IllegalStateException("La tabla no contiene filas de datos.");
        }

        double[][] columns = new double[expectedColumns][rows.size()];
        for (int r = 0; r < rows.size(); r++) {
            double[] row = rows.get(r);
            for (int c = 0; c < expectedColumns; c++) {
                columns[c][r] = row[c];
            }
        }
        log.debug("Tabla espectral leída: {} filas x {} columnas.", rows.size(), expectedColumns);
        return columns;
    }
}
