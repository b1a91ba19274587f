package uimbt.fingerprint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uimbt.accessibility.AriaNode;
import uimbt.accessibility.AriaSnapshotParser;
import uimbt.browser.BrowserSession;
import uimbt.model.AccessibilitySummary;
import uimbt.model.ActionableElement;
import uimbt.model.ActionableElements;
import uimbt.model.AriaElementState;
import uimbt.model.AriaStates;
import uimbt.model.Fingerprint;
import uimbt.model.KeyLandmark;
import uimbt.model.LocatorStrategy;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Produces the {@link Fingerprint} of the page a {@link BrowserSession} is
 * currently showing.
 *
 * <p>The accessibility tree is the primary signal. When it cannot be
 * captured the fingerprint still carries URL pattern, route parameters and
 * title, without an accessibility summary and with no actionable elements.
 */
public class StateFingerprinter {

    private static final Logger log = LoggerFactory.getLogger(StateFingerprinter.class);

    public static final Set<String> LANDMARK_ROLES = Set.of(
            "navigation", "main", "complementary", "contentinfo", "banner", "search", "form", "region");

    public static final Set<String> INTERACTIVE_ROLES = Set.of(
            "button", "link", "textbox", "combobox", "checkbox", "radio", "searchbox", "spinbutton");

    public static final Set<String> NOTABLE_ROLES = Set.of(
            "alert", "alertdialog", "dialog", "status", "table", "grid", "treegrid", "tablist", "progressbar");

    private static final List<String> KEY_LANDMARK_ROLES = List.of("navigation", "main", "search");

    /** Attributes that describe an element rather than its dynamic state. */
    private static final Set<String> STATIC_ATTRIBUTES = Set.of("url", "level", "placeholder");

    private static final int HASH_NAME_LENGTH = 20;
    private static final int HASH_HEX_LENGTH  = 16;
    private static final int DEFAULT_HEADING_LEVEL = 2;

    private final AriaSnapshotParser parser;

    public StateFingerprinter() {
        this(new AriaSnapshotParser());
    }

    public StateFingerprinter(AriaSnapshotParser parser) {
        this.parser = parser;
    }

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Captures URL, title and accessibility tree from the session and
     * fingerprints them.
     */
    public PageObservation observe(BrowserSession session) {
        String url   = session.currentUrl();
        String title = session.title();
        AriaNode tree = parser.parse(session.accessibilitySnapshot());
        if (tree == null) {
            log.warn("No accessibility tree for {}, fingerprinting from URL and title only", url);
        }
        return new PageObservation(url, tree, fingerprint(url, title, tree));
    }

    /**
     * Builds a fingerprint from already captured inputs.
     *
     * @param tree parsed accessibility tree, or {@code null} if capture failed
     */
    public Fingerprint fingerprint(String url, String title, AriaNode tree) {
        String pattern = UrlPatterns.urlPattern(url);
        Map<String, Object> params = UrlPatterns.routeParams(url);
        if (tree == null) {
            return new Fingerprint(null, ActionableElements.empty(), pattern, params, title, null);
        }
        List<AriaNode> nodes = tree.descendants();
        return new Fingerprint(
                summarize(nodes),
                actionableElements(nodes),
                pattern,
                params,
                title,
                mainHeading(nodes));
    }

    // ── Accessibility summary ─────────────────────────────────────────────

    private AccessibilitySummary summarize(List<AriaNode> nodes) {
        Set<String> landmarks = new TreeSet<>();
        Set<String> notable   = new TreeSet<>();
        Map<String, KeyLandmark> keyLandmarks = new LinkedHashMap<>();
        List<String> headings = new ArrayList<>();
        int interactive = 0;

        for (AriaNode n : nodes) {
            String role = n.role();
            if (LANDMARK_ROLES.contains(role)) landmarks.add(role);
            if (NOTABLE_ROLES.contains(role)) notable.add(role);
            if (INTERACTIVE_ROLES.contains(role)) interactive++;
            if (KEY_LANDMARK_ROLES.contains(role) && !keyLandmarks.containsKey(role)) {
                keyLandmarks.put(role, new KeyLandmark(role, n.name(), n.path()));
            }
            if ("heading".equals(role) && !n.label().isBlank()) {
                headings.add("h" + headingLevel(n) + ": " + n.label());
            }
        }
        return new AccessibilitySummary(structureHash(nodes), landmarks, interactive, headings,
                keyLandmarks, ariaStates(nodes), notable);
    }

    private static AriaStates ariaStates(List<AriaNode> nodes) {
        List<AriaElementState> expanded = new ArrayList<>();
        List<AriaElementState> selected = new ArrayList<>();
        List<AriaElementState> checked  = new ArrayList<>();
        List<AriaElementState> current  = new ArrayList<>();
        int disabled = 0;
        for (AriaNode n : nodes) {
            addState(n, "expanded", expanded);
            addState(n, "selected", selected);
            addState(n, "checked", checked);
            addState(n, "current", current);
            if (n.isDisabled()) disabled++;
        }
        return new AriaStates(expanded, selected, checked, disabled, current);
    }

    private static void addState(AriaNode n, String attribute, List<AriaElementState> into) {
        String value = n.attribute(attribute);
        if (value != null) into.add(new AriaElementState(n.role(), n.name(), value));
    }

    /** SHA-256 over the pre-order {@code depth:role:name} sequence. */
    static String structureHash(List<AriaNode> nodes) {
        StringBuilder sb = new StringBuilder();
        for (AriaNode n : nodes) {
            String name = n.name();
            if (name.length() > HASH_NAME_LENGTH) name = name.substring(0, HASH_NAME_LENGTH);
            sb.append(n.depth()).append(':').append(n.role()).append(':').append(name).append('\n');
        }
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(sb.toString().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, HASH_HEX_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    // ── Actionable elements ───────────────────────────────────────────────

    private static ActionableElements actionableElements(List<AriaNode> nodes) {
        List<ActionableElement> buttons = new ArrayList<>();
        List<ActionableElement> links   = new ArrayList<>();
        List<ActionableElement> inputs  = new ArrayList<>();
        for (AriaNode n : nodes) {
            if (!INTERACTIVE_ROLES.contains(n.role())) continue;
            ActionableElement element = toElement(n);
            switch (n.role()) {
                case "button" -> buttons.add(element);
                case "link"   -> links.add(element);
                default       -> inputs.add(element);
            }
        }
        return new ActionableElements(buttons, links, inputs);
    }

    private static ActionableElement toElement(AriaNode n) {
        Map<String, String> states = new LinkedHashMap<>();
        n.attributes().forEach((k, v) -> {
            if (!STATIC_ATTRIBUTES.contains(k)) states.put(k, v);
        });
        return new ActionableElement(n.role(), n.name(), n.href(), states,
                LocatorStrategy.roleName(n.role(), n.name()));
    }

    // ── Headings ──────────────────────────────────────────────────────────

    private static String mainHeading(List<AriaNode> nodes) {
        String first = null;
        for (AriaNode n : nodes) {
            if (!"heading".equals(n.role()) || n.label().isBlank()) continue;
            if (headingLevel(n) == 1) return n.label();
            if (first == null) first = n.label();
        }
        return first;
    }

    private static int headingLevel(AriaNode heading) {
        String level = heading.attribute("level");
        if (level == null) return DEFAULT_HEADING_LEVEL;
        try {
            return Integer.parseInt(level.trim());
        } catch (NumberFormatException e) {
            return DEFAULT_HEADING_LEVEL;
        }
    }
}
