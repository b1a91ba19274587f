package uimbt.model;

/** Uniqueness key of an edge: at most one transition per (from, type, to). */
public record TransitionSignature(String fromState, ActionType actionType, String toState) {
}
