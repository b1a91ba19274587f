package uimbt.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uimbt.accessibility.AriaNode;
import uimbt.browser.BrowserException;
import uimbt.browser.BrowserSession;
import uimbt.fingerprint.ElementDescriptors;
import uimbt.fingerprint.PageObservation;
import uimbt.fingerprint.StateFingerprinter;
import uimbt.model.ActionType;
import uimbt.model.ElementDescriptor;
import uimbt.model.LocatorStrategy;
import uimbt.model.StateType;
import uimbt.model.UIState;
import uimbt.state.Classification;
import uimbt.state.StateClassifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Logs in and records the login micro-sequence as four states (empty form,
 * username filled, ready to submit, landing page) joined by three
 * transitions. The form states are pinned: they are recorded even though
 * their fingerprints are nearly identical.
 *
 * <p>Credentials are typed into the page but only field names reach the
 * graph.
 */
public class LoginFlow {

    private static final Logger log = LoggerFactory.getLogger(LoginFlow.class);

    public static final String USERNAME_FILLED = "V_LOGIN_FORM_USERNAME_FILLED";
    public static final String READY           = "V_LOGIN_FORM_READY";

    static final ElementDescriptor DEFAULT_USERNAME = ElementDescriptor.of("input",
            LocatorStrategy.roleName("textbox", "Username"), LocatorStrategy.label("Username"),
            LocatorStrategy.placeholder("Username"), LocatorStrategy.name("username"));

    static final ElementDescriptor DEFAULT_PASSWORD = ElementDescriptor.of("input",
            LocatorStrategy.roleName("textbox", "Password"), LocatorStrategy.label("Password"),
            LocatorStrategy.placeholder("Password"), LocatorStrategy.name("password"));

    static final List<ElementDescriptor> DEFAULT_SUBMITS = List.of(
            ElementDescriptor.of("button", LocatorStrategy.roleName("button", "Login"), LocatorStrategy.text("Login")),
            ElementDescriptor.of("button", LocatorStrategy.roleName("button", "Log in"), LocatorStrategy.text("Log in")),
            ElementDescriptor.of("button", LocatorStrategy.roleName("button", "Sign in"), LocatorStrategy.text("Sign in")),
            ElementDescriptor.of("button", LocatorStrategy.roleName("button", "Submit"), LocatorStrategy.text("Submit")));

    private static final Set<String> SUBMIT_NAMES = Set.of("login", "log in", "sign in", "signin", "submit");

    /** Where the login sequence ended. */
    public record LoginResult(UIState landing, boolean completed) {}

    private final BrowserSession browser;
    private final TransitionExecutor executor;
    private final StateFingerprinter fingerprinter;
    private final DiscoverySession session;
    private final StateClassifier classifier;

    public LoginFlow(BrowserSession browser, TransitionExecutor executor, StateFingerprinter fingerprinter,
                     DiscoverySession session, StateClassifier classifier) {
        this.browser       = browser;
        this.executor      = executor;
        this.fingerprinter = fingerprinter;
        this.session       = session;
        this.classifier    = classifier;
    }

    /**
     * Runs the sequence from the login page.
     *
     * @param initial observation of the login page
     * @return the landing state, or the last recorded state when a step failed;
     *         {@code landing} is {@code null} only if no state could be recorded
     */
    public LoginResult perform(PageObservation initial, Credentials credentials) {
        ElementDescriptor username = usernameField(initial.tree());
        ElementDescriptor password = passwordField(initial.tree());

        if (browser.locate(username).isEmpty()) {
            log.warn("No username field on {}, continuing without login", initial.url());
            return new LoginResult(session.resolve(initial).state(), false);
        }

        Classification c = classifier.classify(initial.fingerprint());
        Optional<UIState> empty = session.registerPinned(initial, c.stateId(), c.stateType());
        if (empty.isEmpty()) return new LoginResult(null, false);
        UIState current = empty.get();

        try {
            log.info("Login: filling username");
            executor.fill(username, credentials.username());
            executor.awaitSettled();
            Optional<UIState> filled = pinnedStep(current, USERNAME_FILLED, username, Map.of("field", "username"));
            if (filled.isEmpty()) return new LoginResult(current, false);
            current = filled.get();

            log.info("Login: filling password");
            executor.fill(password, credentials.password());
            executor.awaitSettled();
            Optional<UIState> ready = pinnedStep(current, READY, password, Map.of("field", "password"));
            if (ready.isEmpty()) return new LoginResult(current, false);
            current = ready.get();

            ElementDescriptor submit = submitButton(initial.tree());
            log.info("Login: submitting");
            executor.click(submit);
            executor.awaitSettled();
            StateResolution landing = session.resolve(fingerprinter.observe(browser));
            if (landing.isRefused()) return new LoginResult(current, false);
            session.recordTransition(current.getId(), landing.state().getId(), ActionType.SUBMIT, submit,
                    Map.of("requires_credentials", true));
            if (landing.state().isPinned()) {
                log.warn("Login did not leave the login form (still at {})", landing.state().getId());
                return new LoginResult(landing.state(), false);
            }
            log.info("Logged in, landed on {}", landing.state().getId());
            return new LoginResult(landing.state(), true);
        } catch (BrowserException e) {
            log.error("Login flow failed after {}: {}", current.getId(), e.getMessage());
            return new LoginResult(current, false);
        }
    }

    private Optional<UIState> pinnedStep(UIState from, String id, ElementDescriptor trigger, Map<String, Object> data) {
        PageObservation obs = fingerprinter.observe(browser);
        Optional<UIState> next = session.registerPinned(obs, id, StateType.FORM);
        next.ifPresent(s -> session.recordTransition(from.getId(), s.getId(), ActionType.FILL_FORM, trigger, data));
        return next;
    }

    // ── Field lookup ──────────────────────────────────────────────────────

    static ElementDescriptor usernameField(AriaNode tree) {
        return fromTree(tree, DEFAULT_USERNAME, n -> {
            String l = n.label().toLowerCase(Locale.ROOT);
            return !l.contains("password") && (l.contains("user") || l.contains("email") || l.contains("login"));
        });
    }

    static ElementDescriptor passwordField(AriaNode tree) {
        return fromTree(tree, DEFAULT_PASSWORD, n -> n.label().toLowerCase(Locale.ROOT).contains("password"));
    }

    private static ElementDescriptor fromTree(AriaNode tree, ElementDescriptor fallback,
                                              Predicate<AriaNode> matches) {
        if (tree == null) return fallback;
        for (AriaNode n : tree.findAll(Set.of("textbox"))) {
            if (matches.test(n)) {
                List<LocatorStrategy> strategies = new ArrayList<>(ElementDescriptors.forNode(n).strategies());
                strategies.addAll(fallback.strategies());
                return new ElementDescriptor("input", strategies);
            }
        }
        return fallback;
    }

    private ElementDescriptor submitButton(AriaNode tree) {
        if (tree != null) {
            for (AriaNode n : tree.findAll(Set.of("button"))) {
                if (SUBMIT_NAMES.contains(n.label().toLowerCase(Locale.ROOT).strip())) {
                    return ElementDescriptors.forNode(n);
                }
            }
        }
        for (ElementDescriptor candidate : DEFAULT_SUBMITS) {
            if (browser.locate(candidate).isPresent()) return candidate;
        }
        throw new BrowserException("No login submit button found");
    }
}
