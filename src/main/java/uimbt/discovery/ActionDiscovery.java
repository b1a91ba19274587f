package uimbt.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uimbt.accessibility.AriaNode;
import uimbt.fingerprint.ElementDescriptors;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Finds the actions worth trying from a state by reading its accessibility
 * tree: forms first, then safe navigation links, then safe buttons.
 *
 * <p>Only rendered elements appear in the tree, so everything returned is
 * visible. Destructive controls (delete, remove, ...) and external links are
 * never proposed.
 */
public class ActionDiscovery {

    private static final Logger log = LoggerFactory.getLogger(ActionDiscovery.class);

    static final Set<String> FORM_CONTAINERS = Set.of("form", "search");
    static final Set<String> LINK_CONTAINERS = Set.of("navigation", "tablist", "menubar", "menu", "banner");
    static final Set<String> FILLABLE_ROLES  = Set.of("textbox", "searchbox", "combobox", "spinbutton");

    private static final Set<String> SUBMIT_WORDS = Set.of(
            "submit", "save", "search", "login", "log in", "sign in", "ok", "confirm", "create",
            "add", "apply", "update", "send", "go");

    private final DiscoveryConfig config;
    private final String baseOrigin;
    private final Set<String> safeButtons;
    private final Set<String> safeLinkTokens;
    private final Set<String> destructiveTokens;

    public ActionDiscovery(DiscoveryConfig config, String baseUrl) {
        this.config            = config;
        this.baseOrigin        = origin(baseUrl);
        this.safeButtons       = config.getSafeButtons();
        this.safeLinkTokens    = config.getSafeLinkTokens();
        this.destructiveTokens = config.getDestructiveTokens();
    }

    /** Forms, then links, then buttons. */
    public List<ActionCandidate> discover(AriaNode tree) {
        if (tree == null) return List.of();
        List<ActionCandidate> out = new ArrayList<>();
        out.addAll(discoverForms(tree));
        out.addAll(discoverSafeLinks(tree));
        out.addAll(discoverSafeButtons(tree));
        log.debug("Discovered {} candidate actions", out.size());
        return out;
    }

    // ── Forms ─────────────────────────────────────────────────────────────

    public List<ActionCandidate> discoverForms(AriaNode tree) {
        if (!config.isFormsEnabled()) return List.of();
        List<ActionCandidate> out = new ArrayList<>();
        for (AriaNode form : tree.findAll(FORM_CONTAINERS)) {
            List<FormField> fields = new ArrayList<>();
            List<AriaNode> buttons = new ArrayList<>();
            for (AriaNode n : form.descendants()) {
                if (n.isDisabled()) continue;
                if (FILLABLE_ROLES.contains(n.role())) {
                    fields.add(new FormField(ElementDescriptors.forNode(n), n.role(), n.name()));
                } else if ("button".equals(n.role()) && !isDestructive(n.label())) {
                    buttons.add(n);
                }
            }
            AriaNode submit = submitButton(buttons);
            String label = form.name().isEmpty() ? form.role() : form.name();
            if (!fields.isEmpty()) {
                out.add(ActionCandidate.fillForm(fields,
                        submit == null ? null : ElementDescriptors.forNode(submit), label));
            } else if (submit != null) {
                out.add(ActionCandidate.submit(ElementDescriptors.forNode(submit), label));
            }
        }
        return out;
    }

    private static AriaNode submitButton(List<AriaNode> buttons) {
        for (AriaNode b : buttons) {
            if (SUBMIT_WORDS.contains(b.label().toLowerCase(Locale.ROOT).strip())) return b;
        }
        return buttons.isEmpty() ? null : buttons.get(buttons.size() - 1);
    }

    // ── Links ─────────────────────────────────────────────────────────────

    public List<ActionCandidate> discoverSafeLinks(AriaNode tree) {
        List<ActionCandidate> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (AriaNode n : tree.findAll(Set.of("link", "tab"))) {
            if (out.size() >= config.getMaxLinks()) {
                log.debug("Link cap {} reached", config.getMaxLinks());
                break;
            }
            boolean inContainer = "tab".equals(n.role()) || n.closestAncestor(LINK_CONTAINERS).isPresent();
            if (!inContainer || n.isDisabled()) continue;

            String text = n.label();
            String href = n.href();
            if (text.isBlank() && (href == null || href.isBlank())) continue;
            if (href != null && isExternal(href)) {
                log.debug("Skipping external link {}", href);
                continue;
            }
            if (!seen.add((href == null ? "" : href) + "|" + text)) continue;
            if (!isSafeLink(text, href)) {
                log.debug("Skipping unsafe link '{}'", text);
                continue;
            }
            out.add("tab".equals(n.role())
                    ? ActionCandidate.click(ElementDescriptors.forNode(n), text)
                    : ActionCandidate.navigate(ElementDescriptors.forNode(n), text));
        }
        return out;
    }

    /** Safe when it names a known section, or names nothing destructive. */
    boolean isSafeLink(String text, String href) {
        String haystack = (text + " " + (href == null ? "" : href)).toLowerCase(Locale.ROOT);
        for (String token : safeLinkTokens) {
            if (haystack.contains(token)) return true;
        }
        return !isDestructive(haystack);
    }

    private boolean isExternal(String href) {
        String h = href.toLowerCase(Locale.ROOT);
        if (h.startsWith("mailto:") || h.startsWith("tel:") || h.startsWith("javascript:")) return true;
        if (!h.startsWith("http://") && !h.startsWith("https://")) return false;
        return baseOrigin == null || !h.startsWith(baseOrigin);
    }

    // ── Buttons ───────────────────────────────────────────────────────────

    public List<ActionCandidate> discoverSafeButtons(AriaNode tree) {
        List<ActionCandidate> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (AriaNode n : tree.findAll(Set.of("button"))) {
            if (out.size() >= config.getMaxButtons()) {
                log.debug("Button cap {} reached", config.getMaxButtons());
                break;
            }
            String name = n.label();
            if (name.isBlank() || n.isDisabled()) continue;
            if (config.isFormsEnabled() && n.closestAncestor(FORM_CONTAINERS).isPresent()) continue;
            if (!isSafeButton(name) || !seen.add(name)) continue;
            out.add(ActionCandidate.click(ElementDescriptors.forNode(n), name));
        }
        return out;
    }

    /** Allow-listed word present, on word boundaries, and nothing destructive. */
    boolean isSafeButton(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        if (isDestructive(lower)) return false;
        for (String word : lower.split("[^\\p{L}\\p{N}]+")) {
            if (safeButtons.contains(word)) return true;
        }
        return false;
    }

    private boolean isDestructive(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String token : destructiveTokens) {
            if (lower.contains(token)) return true;
        }
        return false;
    }

    /** {@code scheme://host[:port]} of the base URL, lower-cased. */
    static String origin(String url) {
        if (url == null) return null;
        int scheme = url.indexOf("://");
        if (scheme < 0) return null;
        int end = url.indexOf('/', scheme + 3);
        return (end < 0 ? url : url.substring(0, end)).toLowerCase(Locale.ROOT);
    }
}
