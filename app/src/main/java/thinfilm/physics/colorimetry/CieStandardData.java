package thinfilm.physics.colorimetry;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import thinfilm.domain.exception.DataLoadException;
import thinfilm.domain.exception.InvalidInputException;
import thinfilm.domain.spectrum.SpectralCurve;
import thinfilm.factory.WavelengthGridFactory;
import thinfilm.io.SpectralTableReader;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

/**
 * Funciones de igualación de color CIE 1931 (2°) y distribución espectral del iluminante D65,
 * remuestreadas una sola vez sobre la rejilla canónica 380-780 nm / 1 nm.
 * <p>
 * Las tablas se distribuyen como recursos del classpath con tabulación de 5 nm. El remuestreo usa la
 * misma política que la reflectancia en colorimetría: 0 fuera de rango y negativos recortados a 0.
 * Una vez construida la instancia es inmutable y se comparte entre hilos.
 */
@Slf4j
public final class CieStandardData {

    public static final String CMF_RESOURCE = "/cie/cie1931_2deg.txt";
    public static final String ILLUMINANT_RESOURCE = "/cie/d65.txt";

    private static volatile CieStandardData INSTANCE = null;

    @Getter
    private final SpectralCurve xBar;
    @Getter
    private final SpectralCurve yBar;
    @Getter
    private final SpectralCurve zBar;
    @Getter
    private final SpectralCurve illuminant;

    /**
     * Luminancia del difusor perfecto (R = 1) bajo el iluminante: Σ S·ȳ·Δλ.
     */
    @Getter
    private final double whiteLuminance;

    /**
     * @throws InvalidInputException si las cuatro curvas no comparten la rejilla canónica 380:1:780
     */
    CieStandardData(SpectralCurve xBar, SpectralCurve yBar, SpectralCurve zBar, SpectralCurve illuminant) {
        if (!xBar.sharesGridWith(yBar) || !xBar.sharesGridWith(zBar) || !xBar.sharesGridWith(illuminant)) {
            throw new InvalidInputException("Las funciones CIE y el iluminante deben compartir la misma rejilla.");
        }
        if (!WavelengthGridFactory.isCanonical(xBar.cloneWavelengths())) {
            throw new InvalidInputException("Los datos CIE deben estar sobre la rejilla canónica 380-780 nm / 1 nm.");
        }
        this.xBar = xBar;
        this.yBar = yBar;
        this.zBar = zBar;
        this.illuminant = illuminant;
        double sum = 0.0;
        for (int i = 0; i < illuminant.size(); i++) {
            sum += illuminant.valueAt(i) * yBar.valueAt(i);
        }
        this.whiteLuminance = sum;
    }

    public static CieStandardData getInstance() {
        if (INSTANCE == null) {
            synchronized (CieStandardData.class) {
                if (INSTANCE == null) {
                    INSTANCE = load(CMF_RESOURCE, ILLUMINANT_RESOURCE);
                }
            }
        }
        return INSTANCE;
    }

    /**
     * Lee y remuestrea las tablas indicadas.
     *
     * @throws DataLoadException si algún recurso falta o está mal formado
     */
    static CieStandardData load(String cmfResource, String illuminantResource) {
        double[] grid = WavelengthGridFactory.visible();

        double[][] cmf = readResource(cmfResource, 4);
        double[][] spd = readResource(illuminantResource, 2);

        SpectralCurve xBar = new SpectralCurve(cmf[0], cmf[1]).resampleZeroFloored(grid);
        SpectralCurve yBar = new SpectralCurve(cmf[0], cmf[2]).resampleZeroFloored(grid);
        SpectralCurve zBar = new SpectralCurve(cmf[0], cmf[3]).resampleZeroFloored(grid);
        SpectralCurve illuminant = new SpectralCurve(spd[0], spd[1]).resampleZeroFloored(grid);

        CieStandardData data = new CieStandardData(xBar, yBar, zBar, illuminant);
        log.info("Datos CIE 1931 y D65 cargados ({} muestras en la rejilla canónica, Y_blanco = {}).",
                grid.length, data.getWhiteLuminance());
        return data;
    }

    private static double[][] readResource(String resource, int columns) {
        try (InputStream in = CieStandardData.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new DataLoadException(resource, "Recurso de datos colorimétricos no encontrado");
            }
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                return SpectralTableReader.readColumns(reader, columns);
            }
        } catch (IOException e) {
            log.error("Error leyendo el recurso colorimétrico {}", resource, e);
            throw new DataLoadException(resource, "Error leyendo datos colorimétricos", e);
        } catch (NumberFormatException | IllegalStateException e) {
            log.error("Recurso colorimétrico mal formado {}: {}", resource, e.getMessage());
            throw new DataLoadException(resource, "Datos colorimétricos mal formados: " + e.getMessage(), e);
        }
    }
}
