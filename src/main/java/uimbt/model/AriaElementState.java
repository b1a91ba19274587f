package uimbt.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One element carrying a dynamic ARIA state such as {@code expanded=true}. */
public record AriaElementState(
        @JsonProperty("role") String role,
        @JsonProperty("name") String name,
        @JsonProperty("value") String value) {
}
