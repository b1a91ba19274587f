package uimbt.discovery;

import uimbt.model.UIState;

/**
 * Outcome of resolving an observation against the registry.
 *
 * @param state   matched or newly registered state; {@code null} when refused
 * @param created true when the observation produced a new state
 * @param score   best similarity against the states known beforehand
 */
public record StateResolution(UIState state, boolean created, double score) {

    static StateResolution existing(UIState state, double score) {
        return new StateResolution(state, false, score);
    }

    static StateResolution created(UIState state, double score) {
        return new StateResolution(state, true, score);
    }

    static StateResolution refused(double score) {
        return new StateResolution(null, false, score);
    }

    /** The state limit prevented registering a new state. */
    public boolean isRefused() {
        return state == null;
    }
}
