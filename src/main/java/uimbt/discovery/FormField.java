package uimbt.discovery;

import uimbt.model.ElementDescriptor;

/**
 * A fillable control inside a discovered form.
 *
 * @param name accessible name, recorded in transition data instead of the typed value
 */
public record FormField(ElementDescriptor descriptor, String role, String name) {
}
