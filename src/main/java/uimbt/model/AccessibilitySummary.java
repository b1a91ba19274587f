package uimbt.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Semantic summary of a page's accessibility tree, the dominant input to
 * state matching.
 *
 * @param structureHash    topological hash over (role, truncated name) pairs
 * @param landmarkRoles    landmark roles present on the page
 * @param interactiveCount number of interactive nodes
 * @param headingHierarchy {@code h<level>: <name>} entries in document order
 * @param keyLandmarks     first navigation, main and search landmark, keyed by role
 * @param ariaStates       dynamic ARIA state
 * @param notableRoles     non-landmark signal roles (alert, dialog, table, ...)
 */
public record AccessibilitySummary(
        @JsonProperty("structure_hash") String structureHash,
        @JsonProperty("landmark_roles") Set<String> landmarkRoles,
        @JsonProperty("interactive_count") int interactiveCount,
        @JsonProperty("heading_hierarchy") List<String> headingHierarchy,
        @JsonProperty("key_landmarks") Map<String, KeyLandmark> keyLandmarks,
        @JsonProperty("aria_states") AriaStates ariaStates,
        @JsonProperty("notable_roles") Set<String> notableRoles) {

    public AccessibilitySummary {
        landmarkRoles    = sorted(landmarkRoles);
        notableRoles     = sorted(notableRoles);
        headingHierarchy = headingHierarchy == null ? List.of() : List.copyOf(headingHierarchy);
        keyLandmarks     = keyLandmarks == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(keyLandmarks));
        ariaStates       = ariaStates == null ? AriaStates.empty() : ariaStates;
    }

    private static Set<String> sorted(Set<String> roles) {
        return roles == null ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(roles));
    }
}
