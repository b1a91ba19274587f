package uimbt.discovery;

import uimbt.model.ActionType;
import uimbt.model.ElementDescriptor;

import java.util.List;
import java.util.Objects;

/**
 * An action worth trying from the current state.
 *
 * @param type    how the action is executed
 * @param trigger element recorded as the transition trigger
 * @param fields  controls to fill first ({@link ActionType#FILL_FORM} only)
 * @param submit  button to click after filling, or {@code null}
 * @param label   human-readable label for logs
 */
public record ActionCandidate(ActionType type, ElementDescriptor trigger, List<FormField> fields,
                              ElementDescriptor submit, String label) {

    public ActionCandidate {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(trigger, "trigger");
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public static ActionCandidate navigate(ElementDescriptor link, String label) {
        return new ActionCandidate(ActionType.NAVIGATE, link, List.of(), null, label);
    }

    public static ActionCandidate click(ElementDescriptor element, String label) {
        return new ActionCandidate(ActionType.CLICK, element, List.of(), null, label);
    }

    public static ActionCandidate fillForm(List<FormField> fields, ElementDescriptor submit, String label) {
        ElementDescriptor trigger = submit != null ? submit : fields.get(0).descriptor();
        return new ActionCandidate(ActionType.FILL_FORM, trigger, fields, submit, label);
    }

    public static ActionCandidate submit(ElementDescriptor submit, String label) {
        return new ActionCandidate(ActionType.SUBMIT, submit, List.of(), submit, label);
    }

    @Override
    public String toString() {
        return type + " '" + label + "'";
    }
}
