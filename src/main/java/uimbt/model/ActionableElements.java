package uimbt.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Interactive elements of a page grouped by category. */
@JsonIgnoreProperties(value = "total_count", allowGetters = true)
public record ActionableElements(
        @JsonProperty("buttons") List<ActionableElement> buttons,
        @JsonProperty("links") List<ActionableElement> links,
        @JsonProperty("inputs") List<ActionableElement> inputs) {

    public ActionableElements {
        buttons = buttons == null ? List.of() : List.copyOf(buttons);
        links   = links   == null ? List.of() : List.copyOf(links);
        inputs  = inputs  == null ? List.of() : List.copyOf(inputs);
    }

    public static ActionableElements empty() {
        return new ActionableElements(List.of(), List.of(), List.of());
    }

    @JsonProperty("total_count")
    public int totalCount() {
        return buttons.size() + links.size() + inputs.size();
    }
}
