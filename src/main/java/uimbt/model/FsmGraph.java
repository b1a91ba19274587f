package uimbt.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The exported state-machine document: states as nodes, transitions as
 * edges, plus run statistics. Maps 1:1 to {@code graph-schema.json}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FsmGraph {

    /** Current schema version, must match graph-schema.json. */
    public static final String CURRENT_SCHEMA_VERSION = "1.0";
    public static final String GRAPH_TYPE = "fsm_mbt";

    @JsonProperty("schema_version")
    private String schemaVersion = CURRENT_SCHEMA_VERSION;

    @JsonProperty("graph_type")
    private String graphType = GRAPH_TYPE;

    @JsonProperty("base_url")
    private String baseUrl;

    @JsonProperty("discovery_method")
    private String discoveryMethod;

    @JsonProperty("generated_at")
    private Instant generatedAt;

    @JsonProperty("nodes")
    private List<UIState> nodes = new ArrayList<>();

    @JsonProperty("edges")
    private List<StateTransition> edges = new ArrayList<>();

    @JsonProperty("statistics")
    private GraphStatistics statistics = new GraphStatistics();

    public FsmGraph() {}

    // ── Getters ──────────────────────────────────────────────────────────

    public String                getSchemaVersion()   { return schemaVersion; }
    public String                getGraphType()       { return graphType; }
    public String                getBaseUrl()         { return baseUrl; }
    public String                getDiscoveryMethod() { return discoveryMethod; }
    public Instant               getGeneratedAt()     { return generatedAt; }
    public List<UIState>         getNodes()           { return nodes; }
    public List<StateTransition> getEdges()           { return edges; }
    public GraphStatistics       getStatistics()      { return statistics; }

    // ── Setters ──────────────────────────────────────────────────────────

    public void setSchemaVersion(String schemaVersion)     { this.schemaVersion = schemaVersion; }
    public void setBaseUrl(String baseUrl)                 { this.baseUrl = baseUrl; }
    public void setDiscoveryMethod(String discoveryMethod) { this.discoveryMethod = discoveryMethod; }
    public void setGeneratedAt(Instant generatedAt)        { this.generatedAt = generatedAt; }
    public void setNodes(List<UIState> nodes)              { this.nodes = new ArrayList<>(nodes); }
    public void setEdges(List<StateTransition> edges)      { this.edges = new ArrayList<>(edges); }
    public void setStatistics(GraphStatistics statistics)  { this.statistics = statistics; }

    // ── Convenience ──────────────────────────────────────────────────────

    @JsonIgnore
    public Optional<UIState> findNode(String id) {
        return nodes.stream().filter(n -> n.getId().equals(id)).findFirst();
    }

    @JsonIgnore
    public boolean isVersionSupported() {
        return CURRENT_SCHEMA_VERSION.equals(schemaVersion);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}
