package uimbt.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Summary counters of a graph. The merge counters are only present on graphs
 * produced by a merge.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GraphStatistics {

    @JsonProperty("state_count")
    private int stateCount;

    @JsonProperty("transition_count")
    private int transitionCount;

    @JsonProperty("explored_state_count")
    private int exploredStateCount;

    @JsonProperty("state_types")
    private Map<String, Integer> stateTypes = new TreeMap<>();

    @JsonProperty("max_states_reached")
    private boolean maxStatesReached;

    @JsonProperty("max_depth_reached")
    private boolean maxDepthReached;

    @JsonProperty("merged")
    private Boolean merged;

    @JsonProperty("new_states_added")
    private Integer newStatesAdded;

    @JsonProperty("new_transitions_added")
    private Integer newTransitionsAdded;

    @JsonProperty("duplicate_states_skipped")
    private Integer duplicateStatesSkipped;

    @JsonProperty("duplicate_transitions_skipped")
    private Integer duplicateTransitionsSkipped;

    @JsonProperty("merged_at")
    private Instant mergedAt;

    public GraphStatistics() {}

    // ── Getters ──────────────────────────────────────────────────────────

    public int                  getStateCount()                  { return stateCount; }
    public int                  getTransitionCount()             { return transitionCount; }
    public int                  getExploredStateCount()          { return exploredStateCount; }
    public Map<String, Integer> getStateTypes()                  { return stateTypes; }
    public boolean              isMaxStatesReached()             { return maxStatesReached; }
    public boolean              isMaxDepthReached()              { return maxDepthReached; }
    public Boolean              getMerged()                      { return merged; }
    public Integer              getNewStatesAdded()              { return newStatesAdded; }
    public Integer              getNewTransitionsAdded()         { return newTransitionsAdded; }
    public Integer              getDuplicateStatesSkipped()      { return duplicateStatesSkipped; }
    public Integer              getDuplicateTransitionsSkipped() { return duplicateTransitionsSkipped; }
    public Instant              getMergedAt()                    { return mergedAt; }

    // ── Setters ──────────────────────────────────────────────────────────

    public void setStateCount(int stateCount)                      { this.stateCount = stateCount; }
    public void setTransitionCount(int transitionCount)            { this.transitionCount = transitionCount; }
    public void setExploredStateCount(int exploredStateCount)      { this.exploredStateCount = exploredStateCount; }
    public void setStateTypes(Map<String, Integer> stateTypes)     { this.stateTypes = new TreeMap<>(stateTypes); }
    public void setMaxStatesReached(boolean maxStatesReached)      { this.maxStatesReached = maxStatesReached; }
    public void setMaxDepthReached(boolean maxDepthReached)        { this.maxDepthReached = maxDepthReached; }
    public void setMerged(Boolean merged)                          { this.merged = merged; }
    public void setNewStatesAdded(Integer n)                       { this.newStatesAdded = n; }
    public void setNewTransitionsAdded(Integer n)                  { this.newTransitionsAdded = n; }
    public void setDuplicateStatesSkipped(Integer n)               { this.duplicateStatesSkipped = n; }
    public void setDuplicateTransitionsSkipped(Integer n)          { this.duplicateTransitionsSkipped = n; }
    public void setMergedAt(Instant mergedAt)                      { this.mergedAt = mergedAt; }
}
