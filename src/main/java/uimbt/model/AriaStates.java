package uimbt.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Dynamic ARIA state observed on a page: which widgets are expanded,
 * selected, checked or current, and how many are disabled.
 */
public record AriaStates(
        @JsonProperty("expanded") List<AriaElementState> expanded,
        @JsonProperty("selected") List<AriaElementState> selected,
        @JsonProperty("checked") List<AriaElementState> checked,
        @JsonProperty("disabled_count") int disabledCount,
        @JsonProperty("current") List<AriaElementState> current) {

    public AriaStates {
        expanded = expanded == null ? List.of() : List.copyOf(expanded);
        selected = selected == null ? List.of() : List.copyOf(selected);
        checked  = checked  == null ? List.of() : List.copyOf(checked);
        current  = current  == null ? List.of() : List.copyOf(current);
    }

    public static AriaStates empty() {
        return new AriaStates(List.of(), List.of(), List.of(), 0, List.of());
    }
}
