package tcdiags.io;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tcdiags.domain.diagnostics.ApplicationResult;
import tcdiags.domain.diagnostics.DiagnosticValue;
import tcdiags.domain.diagnostics.TcAttributes;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Escribe en JSON el resumen escalar de una aplicación.
 * <p>
 * Si la ruta contiene {@code %s} se escribe un documento por TC sustituyendo el
 * identificador; si no, un único documento con todos los TC.
 */
@Slf4j
@RequiredArgsConstructor
public class DiagnosticsReportWriter {

    private static final String TC_PLACEHOLDER = "%s";

    private final JsonFileHandler fileHandler;

    public DiagnosticsReportWriter() {
        this(new JsonFileHandler());
    }

    public record ScalarEntry(double value, String units, String description) {
    }

    public record TcSummary(String application, String tcId, Map<String, ScalarEntry> values) {
    }

    /**
     * @return Rutas escritas.
     * @throws IOException Si falla alguna escritura.
     */
    public List<String> write(ApplicationResult result, String outputFile) throws IOException {
        List<String> written = new ArrayList<>();
        String application = result.getApplication().key();
        if (outputFile.contains(TC_PLACEHOLDER)) {
            for (TcAttributes attributes : result.getPerTc().values()) {
                String path = outputFile.replace(TC_PLACEHOLDER, attributes.getTcId());
                fileHandler.writeToFile(summary(application, attributes), path);
                written.add(path);
            }
        } else {
            Map<String, TcSummary> all = new LinkedHashMap<>();
            for (TcAttributes attributes : result.getPerTc().values()) {
                all.put(attributes.getTcId(), summary(application, attributes));
            }
            fileHandler.writeToFile(all, outputFile);
            written.add(outputFile);
        }
        log.info("[{}] Resumen escrito en {}", application, written);
        return written;
    }

    static TcSummary summary(String application, TcAttributes attributes) {
        Map<String, ScalarEntry> values = new LinkedHashMap<>();
        for (DiagnosticValue value : attributes.values().values()) {
            if (value.isScalar()) {
                values.put(value.name(), new ScalarEntry(value.scalar(), value.units(), value.description()));
            }
        }
        return new TcSummary(application, attributes.getTcId(), values);
    }
}
