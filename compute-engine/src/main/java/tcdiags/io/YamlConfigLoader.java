package tcdiags.io;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tcdiags.config.DerivedVariableSpec;
import tcdiags.config.FileVariableSpec;
import tcdiags.config.VariableSpec;
import tcdiags.config.schema.SchemaRegistry;
import tcdiags.config.schema.SchemaValidator;
import tcdiags.config.schema.ValidatedConfig;
import tcdiags.domain.diagnostics.Application;
import tcdiags.domain.exception.ConfigException;
import tcdiags.domain.grid.TcFix;
import tcdiags.physics.derived.DerivedMethod;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Carga los documentos YAML de la ejecución: variables de entrada, bloques de
 * aplicación y posiciones de los TC.
 * <p>
 * Cada bloque se valida con el esquema correspondiente del {@link SchemaRegistry}.
 */
@Slf4j
@RequiredArgsConstructor
public class YamlConfigLoader {

    private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    private final SchemaRegistry registry;
    private final SchemaValidator validator;

    public YamlConfigLoader() {
        this(SchemaRegistry.standard(), new SchemaValidator());
    }

    /**
     * Lee un documento YAML como mapa clave → valor.
     *
     * @throws ConfigException si el archivo no existe o no es YAML válido.
     */
    public Map<String, Object> readDocument(Path path) {
        if (!Files.exists(path)) {
            throw new ConfigException("El documento de configuración no existe: " + path.toAbsolutePath());
        }
        try {
            Map<String, Object> document = yamlMapper.readValue(path.toFile(), new TypeReference<>() {
            });
            log.info("Documento de configuración leído: {}", path.toAbsolutePath());
            return document == null ? Map.of() : document;
        } catch (IOException e) {
            throw new ConfigException("No se pudo interpretar el documento YAML " + path.toAbsolutePath(), e);
        }
    }

    public Map<String, VariableSpec> loadInputs(Path path) {
        return parseInputs(readDocument(path));
    }

    /**
     * Convierte un documento {@code nombre → bloque} en especificaciones de variables.
     * Las claves cuyo valor no es un bloque se ignoran (metadatos del documento).
     */
    public Map<String, VariableSpec> parseInputs(Map<String, Object> document) {
        Map<String, VariableSpec> specs = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : document.entrySet()) {
            if (!(entry.getValue() instanceof Map<?, ?> rawBlock)) {
                log.debug("Clave de documento '{}' ignorada: no es un bloque de variable.", entry.getKey());
                continue;
            }
            Map<String, Object> block = asStringMap(rawBlock);
            String source = inferSource(block);
            block.put("source", source);
            String name = entry.getKey();
            if (VariableSpec.SOURCE_DERIVED.equals(source)) {
                ValidatedConfig config = validator.validate(registry.get(SchemaRegistry.DERIVED_VARIABLE), block);
                DerivedVariableSpec spec = DerivedVariableSpec.from(name, config);
                DerivedMethod.fromKey(spec.method());
                specs.put(name, spec);
            } else if (VariableSpec.SOURCE_FILE.equals(source)) {
                ValidatedConfig config = validator.validate(registry.get(SchemaRegistry.FILE_VARIABLE), block);
                specs.put(name, FileVariableSpec.from(name, config));
            } else {
                throw new ConfigException(String.format(
                        "La variable '%s' declara un origen desconocido '%s' (file | derived).", name, source));
            }
        }
        log.info("Variables de entrada declaradas: {}", specs.keySet());
        return specs;
    }

    public List<TcFix> loadTcFixes(Path path) {
        return parseTcFixes(readDocument(path));
    }

    /**
     * Convierte {@code tcid → {lat_deg, lon_deg}} en posiciones de TC.
     */
    public List<TcFix> parseTcFixes(Map<String, Object> document) {
        List<TcFix> fixes = new ArrayList<>();
        for (Map.Entry<String, Object> entry : document.entrySet()) {
            if (!(entry.getValue() instanceof Map<?, ?> rawBlock)) {
                throw new ConfigException("El TC '" + entry.getKey() + "' no tiene un bloque {lat_deg, lon_deg}.");
            }
            ValidatedConfig config = validator.validate(registry.get(SchemaRegistry.TC_FIX), asStringMap(rawBlock));
            Instant validTime = config.has("valid_time") ? parseInstant(entry.getKey(), config.getString("valid_time")) : null;
            try {
                fixes.add(new TcFix(entry.getKey(), config.getDouble("lat_deg"), config.getDouble("lon_deg"), validTime));
            } catch (IllegalArgumentException e) {
                throw new ConfigException("Posición inválida para el TC '" + entry.getKey() + "'.", e);
            }
        }
        if (fixes.isEmpty()) {
            throw new ConfigException("No se ha especificado ningún TC.");
        }
        log.info("TC a diagnosticar: {}", fixes.stream().map(TcFix::tcId).toList());
        return fixes;
    }

    public Map<Application, ValidatedConfig> loadApplications(Path path) {
        return parseApplications(readDocument(path));
    }

    /**
     * Valida los bloques de aplicación presentes en el documento ({@code tcpi}, {@code tcmsi}...).
     * Un bloque vacío o nulo activa la aplicación con todos los valores por defecto.
     */
    public Map<Application, ValidatedConfig> parseApplications(Map<String, Object> document) {
        Map<Application, ValidatedConfig> out = new EnumMap<>(Application.class);
        for (Map.Entry<String, Object> entry : document.entrySet()) {
            Application application;
            try {
                application = Application.fromKey(entry.getKey());
            } catch (ConfigException e) {
                log.warn("Bloque '{}' ignorado: no corresponde a ninguna aplicación.", entry.getKey());
                continue;
            }
            Map<String, Object> block = entry.getValue() instanceof Map<?, ?> raw ? asStringMap(raw) : Map.of();
            out.put(application, validator.validate(registry.get(application.key()), block));
        }
        return out;
    }

    private static String inferSource(Map<String, Object> block) {
        Object source = block.get("source");
        if (source != null) {
            return source.toString().trim().toLowerCase(Locale.ROOT);
        }
        if (Boolean.TRUE.equals(block.get("derived")) || block.containsKey("method")) {
            return VariableSpec.SOURCE_DERIVED;
        }
        return VariableSpec.SOURCE_FILE;
    }

    private static Instant parseInstant(String tcId, String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new ConfigException("Tiempo de validez inválido para el TC '" + tcId + "': " + value, e);
        }
    }

    private static Map<String, Object> asStringMap(Map<?, ?> raw) {
        Map<String, Object> out = new LinkedHashMap<>();
        raw.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }
}
