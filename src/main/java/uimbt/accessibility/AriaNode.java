package uimbt.accessibility;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * One node of a parsed accessibility snapshot: role, accessible name, ARIA
 * attributes and children. The synthetic root has role {@value #ROOT_ROLE}.
 *
 * <p>Nodes are built by {@link AriaSnapshotParser} and read-only afterwards.
 */
public final class AriaNode {

    public static final String ROOT_ROLE = "document";

    private final String role;
    private final String name;
    private final AriaNode parent;
    private final String path;
    private final int depth;
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final List<AriaNode> children = new ArrayList<>();
    private String text;

    private AriaNode(String role, String name, AriaNode parent, String path, int depth) {
        this.role   = role;
        this.name   = name == null ? "" : name;
        this.parent = parent;
        this.path   = path;
        this.depth  = depth;
    }

    static AriaNode root() {
        return new AriaNode(ROOT_ROLE, "", null, "", 0);
    }

    AriaNode addChild(String role, String name) {
        String childPath = path.isEmpty()
                ? String.valueOf(children.size())
                : path + "/" + children.size();
        AriaNode child = new AriaNode(role, name, this, childPath, depth + 1);
        children.add(child);
        return child;
    }

    void setAttribute(String key, String value) {
        attributes.put(key, value);
    }

    void setText(String text) {
        this.text = text;
    }

    // ── Accessors ─────────────────────────────────────────────────────────

    public String         role()       { return role; }
    public String         name()       { return name; }
    public String         text()       { return text; }
    public AriaNode       parent()     { return parent; }
    /** Index path from the root, e.g. {@code 0/2/1}. */
    public String         path()       { return path; }
    /** Root is depth 0, its children depth 1. */
    public int            depth()      { return depth; }
    public List<AriaNode> children()   { return Collections.unmodifiableList(children); }

    public Map<String, String> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public String attribute(String key) {
        return attributes.get(key);
    }

    public boolean hasAttribute(String key) {
        return attributes.containsKey(key);
    }

    /** Link target from a {@code /url:} annotation, or null. */
    public String href() {
        return attributes.get("url");
    }

    public boolean isRoot() {
        return parent == null;
    }

    /** True for {@code [disabled]} or {@code [disabled=true]}. */
    public boolean isDisabled() {
        return "true".equals(attributes.get("disabled"));
    }

    /** Accessible name, falling back to inline text content. */
    public String label() {
        if (!name.isEmpty()) return name;
        return text == null ? "" : text;
    }

    // ── Traversal ─────────────────────────────────────────────────────────

    /** Visits every descendant in document (pre-)order, excluding this node. */
    public void forEachDescendant(Consumer<AriaNode> visitor) {
        for (AriaNode child : children) {
            visitor.accept(child);
            child.forEachDescendant(visitor);
        }
    }

    public List<AriaNode> descendants() {
        List<AriaNode> out = new ArrayList<>();
        forEachDescendant(out::add);
        return out;
    }

    public List<AriaNode> findAll(Set<String> roles) {
        List<AriaNode> out = new ArrayList<>();
        forEachDescendant(n -> { if (roles.contains(n.role)) out.add(n); });
        return out;
    }

    public Optional<AriaNode> findFirst(String role) {
        for (AriaNode n : descendants()) {
            if (n.role.equals(role)) return Optional.of(n);
        }
        return Optional.empty();
    }

    /** Nearest ancestor whose role is in {@code roles}. */
    public Optional<AriaNode> closestAncestor(Set<String> roles) {
        for (AriaNode p = parent; p != null; p = p.parent) {
            if (roles.contains(p.role)) return Optional.of(p);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return name.isEmpty() ? role : role + " \"" + name + "\"";
    }
}
