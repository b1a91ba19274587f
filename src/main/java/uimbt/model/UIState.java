package uimbt.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A distinct, verifiable screen/condition of the application under test.
 *
 * <p>States are append-only inside a discovery session: once registered, the
 * only mutation is {@link #mergeElementDescriptors} when a later observation
 * matches this state and reveals additional actionable elements.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UIState {

    @JsonProperty("id")
    private String id;

    @JsonProperty("state_type")
    private StateType stateType;

    @JsonProperty("origin")
    private StateOrigin origin = StateOrigin.EXPLORATION;

    @JsonProperty("entry_url")
    private String entryUrl;

    @JsonProperty("fingerprint")
    private Fingerprint fingerprint;

    @JsonProperty("verification_logic")
    private VerificationLogic verificationLogic;

    @JsonProperty("element_descriptors")
    private List<ElementDescriptor> elementDescriptors = new ArrayList<>();

    @JsonProperty("sequence")
    private long sequence;

    @JsonProperty("discovered_at")
    private Instant discoveredAt;

    /** For Jackson. */
    UIState() {}

    public UIState(String id, StateType stateType, StateOrigin origin, String entryUrl,
                   Fingerprint fingerprint, List<ElementDescriptor> elementDescriptors,
                   long sequence, Instant discoveredAt) {
        this.id                = id;
        this.stateType         = stateType;
        this.origin            = origin;
        this.entryUrl          = entryUrl;
        this.fingerprint       = fingerprint;
        this.verificationLogic = VerificationLogic.from(fingerprint);
        this.sequence          = sequence;
        this.discoveredAt      = discoveredAt;
        mergeElementDescriptors(elementDescriptors);
    }

    // ── Getters ──────────────────────────────────────────────────────────

    public String            getId()                 { return id; }
    public StateType         getStateType()          { return stateType; }
    public StateOrigin       getOrigin()             { return origin; }
    public String            getEntryUrl()           { return entryUrl; }
    public Fingerprint       getFingerprint()        { return fingerprint; }
    public VerificationLogic getVerificationLogic()  { return verificationLogic; }
    public long              getSequence()           { return sequence; }
    public Instant           getDiscoveredAt()       { return discoveredAt; }

    public List<ElementDescriptor> getElementDescriptors() {
        return Collections.unmodifiableList(elementDescriptors);
    }

    // ── Mutation ─────────────────────────────────────────────────────────

    /**
     * Adds descriptors not already known for this state, preserving the
     * order of first observation.
     *
     * @return number of descriptors added
     */
    public int mergeElementDescriptors(List<ElementDescriptor> observed) {
        if (observed == null) return 0;
        int added = 0;
        for (ElementDescriptor d : observed) {
            if (!elementDescriptors.contains(d)) {
                elementDescriptors.add(d);
                added++;
            }
        }
        return added;
    }

    /** Copy under a different id, for graph merges where the id is taken. */
    public UIState renamed(String newId) {
        UIState copy = new UIState(newId, stateType, origin, entryUrl, fingerprint,
                elementDescriptors, sequence, discoveredAt);
        copy.verificationLogic = verificationLogic;
        return copy;
    }

    // ── Convenience ──────────────────────────────────────────────────────

    /** Pinned states are exempt from similarity-based deduplication. */
    @JsonIgnore
    public boolean isPinned() {
        return origin == StateOrigin.LOGIN_FLOW;
    }

    @Override
    public String toString() {
        return String.format("UIState{id='%s', type=%s, url='%s'}", id, stateType,
                fingerprint == null ? null : fingerprint.urlPattern());
    }
}
