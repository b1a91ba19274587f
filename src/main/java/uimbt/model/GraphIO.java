package uimbt.model;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Reads and writes {@link FsmGraph} documents as JSON.
 *
 * <p>On read: validates the JSON against {@code graph-schema.json} before
 * deserializing, and rejects graphs with unsupported schema versions.
 *
 * <p>On write: pretty-prints for human readability.
 */
public final class GraphIO {

    private static final Logger log = LoggerFactory.getLogger(GraphIO.class);
    private static final String SCHEMA_RESOURCE = "/graph-schema.json";

    /** Shared ObjectMapper, thread-safe after configuration. */
    private static final ObjectMapper MAPPER;

    static {
        MAPPER = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /** Loaded once from the classpath; null if the schema resource is missing. */
    private static volatile JsonSchema jsonSchema = null;

    private GraphIO() {}

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Reads a graph from a JSON file.
     *
     * @throws IOException               if the file cannot be read or parsed
     * @throws SchemaValidationException if the document violates the schema
     * @throws SchemaVersionException    if the schema version is not supported
     */
    public static FsmGraph read(Path path) throws IOException {
        log.debug("Reading graph from: {}", path);
        String json = Files.readString(path);
        validateSchema(json, path.toString());
        FsmGraph graph = MAPPER.readValue(json, FsmGraph.class);
        if (!graph.isVersionSupported()) {
            throw new SchemaVersionException("Unsupported schema version: " + graph.getSchemaVersion()
                    + " (expected: " + FsmGraph.CURRENT_SCHEMA_VERSION + ")");
        }
        log.info("Loaded graph with {} states and {} transitions from {}",
                graph.getNodes().size(), graph.getEdges().size(), path);
        return graph;
    }

    /**
     * Writes a graph to a JSON file, creating parent directories.
     */
    public static void write(FsmGraph graph, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        MAPPER.writeValue(path.toFile(), graph);
        log.info("Wrote graph ({} states, {} transitions) to {}",
                graph.getNodes().size(), graph.getEdges().size(), path);
    }

    public static String toJson(FsmGraph graph) throws IOException {
        return MAPPER.writeValueAsString(graph);
    }

    /** Deserializes without schema validation; use {@link #read(Path)} for files. */
    public static FsmGraph fromJson(String json) throws IOException {
        return MAPPER.readValue(json, FsmGraph.class);
    }

    public static ObjectMapper getMapper() { return MAPPER; }

    // ── Schema validation ─────────────────────────────────────────────────

    private static void validateSchema(String json, String source) throws IOException {
        JsonSchema schema = getSchema();
        if (schema == null) {
            log.warn("graph-schema.json not found on classpath, skipping schema validation");
            return;
        }
        Set<ValidationMessage> errors = schema.validate(MAPPER.readTree(json));
        if (!errors.isEmpty()) {
            StringBuilder sb = new StringBuilder("Schema validation failed for ").append(source).append(":\n");
            errors.forEach(e -> sb.append("  ").append(e.getMessage()).append("\n"));
            throw new SchemaValidationException(sb.toString());
        }
    }

    private static JsonSchema getSchema() {
        if (jsonSchema == null) {
            synchronized (GraphIO.class) {
                if (jsonSchema == null) {
                    try (InputStream is = GraphIO.class.getResourceAsStream(SCHEMA_RESOURCE)) {
                        if (is == null) {
                            log.warn("Schema resource not found: {}", SCHEMA_RESOURCE);
                            return null;
                        }
                        jsonSchema = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7).getSchema(is);
                        log.debug("JSON schema loaded from classpath: {}", SCHEMA_RESOURCE);
                    } catch (IOException e) {
                        log.warn("Failed to load schema: {}", e.getMessage());
                    }
                }
            }
        }
        return jsonSchema;
    }

    // ── Exceptions ────────────────────────────────────────────────────────

    /** Thrown when a graph declares a schema version this build cannot read. */
    public static class SchemaVersionException extends RuntimeException {
        public SchemaVersionException(String message) { super(message); }
    }

    /** Thrown when a graph document does not conform to graph-schema.json. */
    public static class SchemaValidationException extends RuntimeException {
        public SchemaValidationException(String message) { super(message); }
    }
}
