package uimbt.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** How a state entered the graph. */
public enum StateOrigin {
    EXPLORATION, LOGIN_FLOW, MANUAL;

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static StateOrigin fromJson(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
