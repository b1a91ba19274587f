package uimbt.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of user action that moves the application from one state to another.
 */
public enum ActionType {
    CLICK, FILL_FORM, NAVIGATE, SUBMIT;

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ActionType fromJson(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
