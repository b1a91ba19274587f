package uimbt.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Category of a discovered UI state, assigned by the state classifier.
 */
public enum StateType {
    FORM, ERROR, MODAL, LOADING, DASHBOARD, LIST, PAGE, SUCCESS, ADMIN;

    /**
     * Ephemeral states are recorded but never used as exploration roots:
     * actions taken from them mutate data or depend on timing.
     */
    public boolean isEphemeral() {
        return this == ERROR || this == FORM || this == LOADING;
    }

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static StateType fromJson(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
