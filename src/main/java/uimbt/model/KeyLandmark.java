package uimbt.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A landmark used as an anchor for relative navigation.
 *
 * @param role landmark role
 * @param name accessible name, empty when unnamed
 * @param path index path of the node inside the accessibility tree
 */
public record KeyLandmark(
        @JsonProperty("role") String role,
        @JsonProperty("name") String name,
        @JsonProperty("path") String path) {
}
