package uimbt.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Identifies one actionable element through an ordered list of locator
 * strategies, highest priority first. Value type: two descriptors with the
 * same strategies are equal.
 *
 * @param elementType {@code button}, {@code link} or {@code input}
 * @param strategies  at least one locator strategy
 */
public record ElementDescriptor(
        @JsonProperty("element_type") String elementType,
        @JsonProperty("strategies") List<LocatorStrategy> strategies) {

    public ElementDescriptor {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("Element descriptor requires at least one locator strategy");
        }
        List<LocatorStrategy> ordered = new ArrayList<>(new LinkedHashSet<>(strategies));
        ordered.sort(Comparator.comparingInt(s -> s.kind().ordinal()));
        strategies = List.copyOf(ordered);
    }

    public static ElementDescriptor of(String elementType, LocatorStrategy... strategies) {
        return new ElementDescriptor(elementType, Arrays.asList(strategies));
    }

    /** The highest-priority strategy. */
    @JsonIgnore
    public LocatorStrategy primary() {
        return strategies.get(0);
    }

    @Override
    public String toString() {
        return elementType + " " + primary().describe();
    }
}
