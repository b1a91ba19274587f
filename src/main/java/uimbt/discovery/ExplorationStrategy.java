package uimbt.discovery;

import java.util.Locale;

/** Order in which discovered states are explored. */
public enum ExplorationStrategy {
    /** Recurse into each new state before trying the next action (default). */
    DFS,
    /** Explore states level by level, reaching each by URL. */
    BFS;

    /** Parses a case-insensitive name; {@code null} or blank → {@link #DFS}. */
    public static ExplorationStrategy fromNullable(String value) {
        if (value == null || value.isBlank()) return DFS;
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /** The {@code discovery_method} recorded in the exported graph. */
    public String discoveryMethod() {
        return "selenium_state_machine_" + name().toLowerCase(Locale.ROOT);
    }
}
