package uimbt.accessibility;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders the Chrome DevTools {@code Accessibility.getFullAXTree} result into
 * the indented snapshot text understood by {@link AriaSnapshotParser}.
 *
 * <p>Rendering starts below the {@code RootWebArea} (the document body's
 * content). Ignored nodes and presentational containers are elided and their
 * children hoisted one level up. {@code StaticText} becomes a {@code text:}
 * line; a link's {@code url} property becomes a {@code /url:} annotation.
 */
public class AxTreeRenderer {

    private static final Set<String> ELIDED_ROLES = Set.of(
            "generic", "none", "presentation", "GenericContainer", "InlineTextBox",
            "LineBreak", "Ignored", "IgnoredRole", "Unknown");

    private static final List<String> BOOLEAN_FLAGS = List.of("disabled", "selected", "pressed", "busy");

    /**
     * @param axTree the CDP response, an object with a {@code nodes} array
     * @return snapshot text; empty when the tree has no renderable nodes
     */
    public String render(JsonNode axTree) {
        JsonNode nodes = axTree == null ? null : axTree.get("nodes");
        if (nodes == null || !nodes.isArray() || nodes.isEmpty()) return "";

        Map<String, JsonNode> byId = new HashMap<>();
        JsonNode root = null;
        for (JsonNode n : nodes) {
            byId.put(n.path("nodeId").asText(), n);
            if (root == null && "RootWebArea".equals(roleOf(n))) root = n;
        }
        if (root == null) root = nodes.get(0);

        StringBuilder sb = new StringBuilder();
        renderChildren(root, byId, 0, sb);
        return sb.toString();
    }

    private void renderChildren(JsonNode node, Map<String, JsonNode> byId, int depth, StringBuilder sb) {
        for (JsonNode childId : node.path("childIds")) {
            JsonNode child = byId.get(childId.asText());
            if (child != null) renderNode(child, byId, depth, sb);
        }
    }

    private void renderNode(JsonNode node, Map<String, JsonNode> byId, int depth, StringBuilder sb) {
        String role = roleOf(node);
        if (node.path("ignored").asBoolean(false) || role.isEmpty() || ELIDED_ROLES.contains(role)) {
            renderChildren(node, byId, depth, sb);
            return;
        }

        String name = clean(node.path("name").path("value").asText(""));
        if ("StaticText".equals(role)) {
            if (!name.isEmpty()) indent(sb, depth).append("- text: ").append(name).append('\n');
            return;
        }

        Map<String, JsonNode> props = properties(node);
        StringBuilder line = new StringBuilder("- ").append(role);
        if (!name.isEmpty()) line.append(" \"").append(name.replace("\"", "\\\"")).append('"');
        appendAttributes(line, props);

        StringBuilder body = new StringBuilder();
        String url = props.containsKey("url") ? props.get("url").asText("") : "";
        if (!url.isEmpty()) indent(body, depth + 1).append("- /url: ").append(url).append('\n');
        renderChildren(node, byId, depth + 1, body);

        indent(sb, depth).append(line);
        if (body.length() > 0) sb.append(':');
        sb.append('\n').append(body);
    }

    private static void appendAttributes(StringBuilder line, Map<String, JsonNode> props) {
        JsonNode level = props.get("level");
        if (level != null && level.asInt(0) > 0) line.append(" [level=").append(level.asInt()).append(']');

        JsonNode checked = props.get("checked");
        if (checked != null) {
            String v = checked.asText();
            if ("true".equals(v)) line.append(" [checked]");
            else if ("mixed".equals(v)) line.append(" [checked=mixed]");
        }
        JsonNode expanded = props.get("expanded");
        if (expanded != null) {
            line.append(expanded.asBoolean(false) ? " [expanded]" : " [expanded=false]");
        }
        for (String flag : BOOLEAN_FLAGS) {
            JsonNode v = props.get(flag);
            if (v != null && v.asBoolean(false)) line.append(" [").append(flag).append(']');
        }
    }

    /** Flattens {@code properties: [{name, value: {type, value}}]} to name → value. */
    private static Map<String, JsonNode> properties(JsonNode node) {
        Map<String, JsonNode> out = new HashMap<>();
        for (JsonNode p : node.path("properties")) {
            out.put(p.path("name").asText(), p.path("value").path("value"));
        }
        return out;
    }

    private static String roleOf(JsonNode node) {
        return node.path("role").path("value").asText("");
    }

    private static String clean(String s) {
        return s.replaceAll("\\s+", " ").strip();
    }

    private static StringBuilder indent(StringBuilder sb, int depth) {
        for (int i = 0; i < depth; i++) sb.append("  ");
        return sb;
    }
}
