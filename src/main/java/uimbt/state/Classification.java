package uimbt.state;

import uimbt.model.StateType;

/** Output of {@link StateClassifier}: the state's category and proposed id. */
public record Classification(StateType stateType, String stateId) {
}
