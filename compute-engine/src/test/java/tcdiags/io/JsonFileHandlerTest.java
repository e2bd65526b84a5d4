package tcdiags.io;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Pruebas de serialización JSON de {@link JsonFileHandler}.
 */
class JsonFileHandlerTest {

    private JsonFileHandler jsonFileHandler;

    @TempDir
    Path tempDir;

    private record Sample(String tcId, double vmax, List<Double> radii) {}

    @BeforeEach
    void setUp() {
        this.jsonFileHandler = new JsonFileHandler();
    }

    @Test
    @DisplayName("Debería escribir un objeto como JSON indentado creando los directorios padre")
    void writeToFile_shouldCreateParentsAndWriteJson() throws IOException {
        Sample sample = new Sample("09L", 55.5, List.of(0.0, 100000.0));
        Path outputFile = tempDir.resolve("salidas/09L.json");

        jsonFileHandler.writeToFile(sample, outputFile.toString());

        assertThat(outputFile).exists();
        assertThat(Files.readString(outputFile))
                .contains("\"tcId\" : \"09L\"")
                .contains("\"vmax\" : 55.5");
    }

    @Test
    @DisplayName("Los NaN se escriben como cadena y se vuelven a leer como NaN")
    void nanValues_shouldSurviveWriteAndRead() throws IOException {
        Path file = tempDir.resolve("nan.json");
        jsonFileHandler.writeToFile(new Sample("01E", Double.NaN, List.of()), file.toString());

        Sample read = jsonFileHandler.readFromFile(file.toString(), Sample.class);

        assertThat(Files.readString(file)).contains("\"NaN\"");
        assertThat(read.vmax()).isNaN();
    }

    @Test
    @DisplayName("Debería ignorar propiedades desconocidas al leer")
    void readFromFile_shouldIgnoreUnknownProperties() throws IOException {
        Path file = tempDir.resolve("extra.json");
        Files.writeString(file, """
                {"tcId": "02W", "vmax": 40.0, "radii": [1.0], "comentario": "sin uso"}
                """);

        Sample read = jsonFileHandler.readFromFile(file.toString(), Sample.class);

        assertThat(read).isEqualTo(new Sample("02W", 40.0, List.of(1.0)));
    }

    @Test
    @DisplayName("Debería lanzar IOException si el archivo no existe")
    void readFromFile_missingFile_shouldThrow() {
        Path missing = tempDir.resolve("no_existe.json");

        IOException ex = assertThrows(IOException.class,
                () -> jsonFileHandler.readFromFile(missing.toString(), Sample.class));

        assertThat(ex.getMessage()).contains("no existe");
    }
}
