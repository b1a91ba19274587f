package uimbt.state;

import uimbt.model.UIState;

/**
 * Result of matching a fingerprint against known states.
 *
 * @param state best state at or above the threshold, or {@code null}
 * @param score highest score observed, even when no state qualified
 */
public record StateMatch(UIState state, double score) {

    public boolean matched() {
        return state != null;
    }
}
