package uimbt.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable description of a page used to decide whether two observations are
 * the same UI state. {@code accessibilitySummary} is {@code null} when the
 * accessibility tree could not be captured.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Fingerprint(
        @JsonProperty("accessibility_summary") AccessibilitySummary accessibilitySummary,
        @JsonProperty("actionable_elements") ActionableElements actionableElements,
        @JsonProperty("url_pattern") String urlPattern,
        @JsonProperty("route_params") Map<String, Object> routeParams,
        @JsonProperty("title") String title,
        @JsonProperty("main_heading") String mainHeading) {

    public Fingerprint {
        actionableElements = actionableElements == null ? ActionableElements.empty() : actionableElements;
        urlPattern         = urlPattern == null || urlPattern.isEmpty() ? "root" : urlPattern;
        routeParams        = routeParams == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(routeParams));
        title              = title == null ? "" : title;
    }

    @JsonIgnore
    public boolean hasAccessibilitySummary() {
        return accessibilitySummary != null;
    }
}
