package uimbt.fingerprint;

import uimbt.accessibility.AriaNode;
import uimbt.model.ActionableElement;
import uimbt.model.ElementDescriptor;
import uimbt.model.LocatorStrategy;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds {@link ElementDescriptor}s from accessibility nodes: the role/name
 * locator first, then the weaker strategies the node supports. Unnamed
 * elements get a role-only locator only when they support nothing else.
 */
public final class ElementDescriptors {

    private ElementDescriptors() {}

    /** {@code button}, {@code link} or {@code input} for an interactive role. */
    public static String elementType(String role) {
        return switch (role) {
            case "button" -> "button";
            case "link", "tab" -> "link";
            default -> "input";
        };
    }

    public static ElementDescriptor forNode(AriaNode node) {
        return build(node.role(), node.name(), node.href(), node.attribute("placeholder"));
    }

    public static ElementDescriptor forElement(ActionableElement element) {
        return build(element.role(), element.name(), element.href(), null);
    }

    private static ElementDescriptor build(String role, String name, String href, String placeholder) {
        String type = elementType(role);
        List<LocatorStrategy> strategies = new ArrayList<>();
        boolean named = name != null && !name.isBlank();
        if (named) strategies.add(LocatorStrategy.roleName(role, name));
        if ("input".equals(type)) {
            if (named) strategies.add(LocatorStrategy.label(name));
            if (placeholder != null && !placeholder.isBlank()) strategies.add(LocatorStrategy.placeholder(placeholder));
        } else if (named) {
            strategies.add(LocatorStrategy.text(name));
        }
        if (href != null && !href.isBlank()) strategies.add(LocatorStrategy.href(href));
        // role alone matches the first element of that role, so only as a last resort
        if (strategies.isEmpty()) strategies.add(LocatorStrategy.roleName(role, ""));
        return new ElementDescriptor(type, strategies);
    }
}
