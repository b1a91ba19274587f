package uimbt.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single way of finding an element on the page. The {@link Kind} order is
 * the resolution priority: a test id beats a role/name pair, which beats
 * label, placeholder and name attributes, which beat visible text and href.
 *
 * @param kind  locator kind
 * @param role  ARIA role, only used by {@link Kind#ROLE_NAME}
 * @param value the locator value (test id, accessible name, label text, ...)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LocatorStrategy(
        @JsonProperty("kind") Kind kind,
        @JsonProperty("role") String role,
        @JsonProperty("value") String value) {

    public enum Kind { TEST_ID, ROLE_NAME, LABEL, PLACEHOLDER, NAME, TEXT, HREF }

    public LocatorStrategy {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.ROLE_NAME && (role == null || role.isBlank())) {
            throw new IllegalArgumentException("ROLE_NAME locator requires a role");
        }
        if (kind != Kind.ROLE_NAME && (value == null || value.isBlank())) {
            throw new IllegalArgumentException(kind + " locator requires a value");
        }
    }

    public static LocatorStrategy testId(String id)             { return new LocatorStrategy(Kind.TEST_ID, null, id); }
    public static LocatorStrategy roleName(String role, String name) { return new LocatorStrategy(Kind.ROLE_NAME, role, name); }
    public static LocatorStrategy label(String label)           { return new LocatorStrategy(Kind.LABEL, null, label); }
    public static LocatorStrategy placeholder(String text)      { return new LocatorStrategy(Kind.PLACEHOLDER, null, text); }
    public static LocatorStrategy name(String name)             { return new LocatorStrategy(Kind.NAME, null, name); }
    public static LocatorStrategy text(String text)             { return new LocatorStrategy(Kind.TEXT, null, text); }
    public static LocatorStrategy href(String href)             { return new LocatorStrategy(Kind.HREF, null, href); }

    /** True for a {@link Kind#ROLE_NAME} locator that carries no accessible name. */
    @JsonIgnore
    public boolean isRoleOnly() {
        return kind == Kind.ROLE_NAME && (value == null || value.isBlank());
    }

    /**
     * Renders the locator in the query style BDD step authors use, e.g.
     * {@code getByRole('button', { name: 'Login' })}.
     */
    public String describe() {
        return switch (kind) {
            case TEST_ID     -> "getByTestId('" + value + "')";
            case ROLE_NAME   -> value == null || value.isEmpty()
                    ? "getByRole('" + role + "')"
                    : "getByRole('" + role + "', { name: '" + value + "' })";
            case LABEL       -> "getByLabel('" + value + "')";
            case PLACEHOLDER -> "getByPlaceholder('" + value + "')";
            case NAME        -> "[name='" + value + "']";
            case TEXT        -> "getByText('" + value + "')";
            case HREF        -> "a[href='" + value + "']";
        };
    }

    @Override
    public String toString() {
        return describe();
    }
}
