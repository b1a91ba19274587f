package uimbt.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A directed edge between two UI states, labelled with the action that
 * triggers it.
 *
 * <p>{@code actionData} holds field names and flags only, never literal input
 * values: credentials are injected by the test run at execution time.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StateTransition {

    public static final double DEFAULT_RELIABILITY = 1.0;

    @JsonProperty("id")
    private String id;

    @JsonProperty("from_state")
    private String fromState;

    @JsonProperty("to_state")
    private String toState;

    @JsonProperty("action_type")
    private ActionType actionType;

    @JsonProperty("trigger")
    private ElementDescriptor trigger;

    @JsonProperty("action_data")
    private Map<String, Object> actionData = new LinkedHashMap<>();

    @JsonProperty("reliability")
    private double reliability = DEFAULT_RELIABILITY;

    /** For Jackson. */
    StateTransition() {}

    public StateTransition(String id, String fromState, String toState, ActionType actionType,
                           ElementDescriptor trigger, Map<String, Object> actionData) {
        this.id         = id;
        this.fromState  = fromState;
        this.toState    = toState;
        this.actionType = actionType;
        this.trigger    = trigger;
        if (actionData != null) this.actionData.putAll(actionData);
    }

    public String             getId()          { return id; }
    public String             getFromState()   { return fromState; }
    public String             getToState()     { return toState; }
    public ActionType         getActionType()  { return actionType; }
    public ElementDescriptor  getTrigger()     { return trigger; }
    public double             getReliability() { return reliability; }

    public Map<String, Object> getActionData() {
        return Collections.unmodifiableMap(actionData);
    }

    /**
     * Returns a copy of this transition with different endpoints and id, used
     * when merging graphs re-points edges onto existing states.
     */
    public StateTransition repoint(String newId, String newFrom, String newTo) {
        StateTransition copy = new StateTransition(newId, newFrom, newTo, actionType, trigger, actionData);
        copy.reliability = reliability;
        return copy;
    }

    @JsonIgnore
    public TransitionSignature signature() {
        return new TransitionSignature(fromState, actionType, toState);
    }

    @Override
    public String toString() {
        return String.format("StateTransition{%s: %s -[%s]-> %s}", id, fromState, actionType, toState);
    }
}
