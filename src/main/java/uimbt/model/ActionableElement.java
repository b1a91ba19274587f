package uimbt.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * An interactive element seen in a fingerprint, with its ARIA attributes and
 * the locator a test author would use for it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActionableElement(
        @JsonProperty("role") String role,
        @JsonProperty("name") String name,
        @JsonProperty("href") String href,
        @JsonProperty("aria_states") Map<String, String> ariaStates,
        @JsonProperty("locator_strategy") LocatorStrategy locatorStrategy) {

    public ActionableElement {
        name       = name == null ? "" : name;
        ariaStates = ariaStates == null ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(ariaStates));
    }

    /** True when the element carries {@code disabled}. */
    @JsonIgnore
    public boolean isDisabled() {
        return "true".equals(ariaStates.get("disabled"));
    }
}
