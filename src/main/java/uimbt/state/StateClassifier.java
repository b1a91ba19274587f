package uimbt.state;

import uimbt.model.AccessibilitySummary;
import uimbt.model.ActionableElement;
import uimbt.model.Fingerprint;
import uimbt.model.StateType;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Assigns a {@link StateType} and a state id to a fingerprint using ordered
 * rules; the first rule that fires wins.
 *
 * <ol>
 *   <li>Error: alert role, or "error" in URL/title, unless the page is a login form</li>
 *   <li>Modal: dialog role</li>
 *   <li>Loading: disabled "load" button, or "loading" in the URL</li>
 *   <li>Logged in: logout control plus navigation (overview, admin, list or page)</li>
 *   <li>Login form</li>
 *   <li>Dashboard: main landmark with dashboard/overview in URL/title</li>
 *   <li>List: navigation with a table-like element</li>
 *   <li>Success: status role</li>
 *   <li>Page</li>
 * </ol>
 *
 * <p>Ids are derived from the normalized URL pattern with a {@code V_} prefix;
 * only the login form and the overview page have canonical ids.
 */
public class StateClassifier {

    public static final String LOGIN_FORM_EMPTY = "V_LOGIN_FORM_EMPTY";
    public static final String LOGIN_FORM_ERROR = "V_LOGIN_FORM_ERROR";
    public static final String OVERVIEW_PAGE    = "V_OVERVIEW_PAGE";

    private static final Set<String> TABLE_ROLES  = Set.of("table", "grid", "treegrid");
    private static final List<String> LOGOUT_WORDS = List.of("logout", "log out", "sign out", "signout");
    private static final List<String> LOGIN_WORDS  = List.of("login", "log in", "sign in", "signin");

    public Classification classify(Fingerprint fp) {
        String url   = fp.urlPattern().toLowerCase(Locale.ROOT);
        String title = fp.title().toLowerCase(Locale.ROOT);
        String norm  = normalize(fp.urlPattern());
        Page page    = new Page(fp);

        boolean loginContext = page.hasPasswordInput() || containsAny(url, LOGIN_WORDS) || containsAny(title, LOGIN_WORDS);
        boolean loginForm    = page.hasLandmark("form") || page.hasPasswordInput();

        // ── 1. Error ─────────────────────────────────────────────────────
        boolean errorSignal = page.hasRole("alert") || page.hasRole("alertdialog")
                || url.contains("error") || title.contains("error");
        if (errorSignal && !(loginForm && page.hasLoginButton())) {
            return new Classification(StateType.ERROR, loginContext ? LOGIN_FORM_ERROR : "V_ERROR_" + norm);
        }

        // ── 2. Modal ─────────────────────────────────────────────────────
        if (page.hasRole("dialog") || page.hasRole("alertdialog")) {
            return new Classification(StateType.MODAL, "V_MODAL_" + norm);
        }

        // ── 3. Loading ───────────────────────────────────────────────────
        boolean loadingButton = fp.actionableElements().buttons().stream()
                .anyMatch(b -> b.isDisabled() && b.name().toLowerCase(Locale.ROOT).contains("load"));
        if (loadingButton || url.contains("loading")) {
            return new Classification(StateType.LOADING, "V_LOADING_" + norm);
        }

        // ── 4. Logged in ─────────────────────────────────────────────────
        boolean logout = page.hasLogoutControl();
        if (logout && page.hasLandmark("navigation")) {
            if (url.contains("overview") || title.contains("overview")) {
                return new Classification(StateType.DASHBOARD, OVERVIEW_PAGE);
            }
            StateType type;
            if (url.contains("admin")) {
                type = StateType.ADMIN;
            } else if (page.hasTable() || url.contains("list")) {
                type = StateType.LIST;
            } else {
                type = StateType.PAGE;
            }
            return new Classification(type, "V_" + norm);
        }

        // ── 5. Login form ────────────────────────────────────────────────
        if ((loginForm || loginContext) && page.hasLoginButton() && !logout) {
            return new Classification(StateType.FORM, LOGIN_FORM_EMPTY);
        }

        // ── 6. Dashboard ─────────────────────────────────────────────────
        if (page.hasLandmark("main") && (containsAny(url, List.of("dashboard", "overview"))
                || containsAny(title, List.of("dashboard", "overview")))) {
            return new Classification(StateType.DASHBOARD, "V_DASHBOARD_" + norm);
        }

        // ── 7. List ──────────────────────────────────────────────────────
        if (page.hasLandmark("navigation") && page.hasTable()) {
            return new Classification(StateType.LIST, "V_LIST_" + norm);
        }

        // ── 8. Success ───────────────────────────────────────────────────
        if (page.hasRole("status")) {
            return new Classification(StateType.SUCCESS, "V_SUCCESS_" + norm);
        }

        return new Classification(StateType.PAGE, "V_" + norm);
    }

    /**
     * Upper-cases the URL pattern and replaces every run of
     * non-alphanumerics with one underscore: {@code admin/config} →
     * {@code ADMIN_CONFIG}.
     */
    public static String normalize(String urlPattern) {
        if (urlPattern == null) return "UNKNOWN";
        String n = urlPattern.replaceAll("[^A-Za-z0-9]+", "_")
                .replaceAll("^_+|_+$", "")
                .toUpperCase(Locale.ROOT);
        return n.isEmpty() ? "UNKNOWN" : n;
    }

    private static boolean containsAny(String haystack, List<String> needles) {
        for (String n : needles) {
            if (haystack.contains(n)) return true;
        }
        return false;
    }

    /** Read-only view over the signals the rules consult. */
    private static final class Page {
        private final Fingerprint fp;
        private final AccessibilitySummary summary;

        Page(Fingerprint fp) {
            this.fp = fp;
            this.summary = fp.accessibilitySummary();
        }

        boolean hasLandmark(String role) {
            return summary != null && summary.landmarkRoles().contains(role);
        }

        boolean hasRole(String role) {
            return summary != null && summary.notableRoles().contains(role);
        }

        boolean hasTable() {
            return summary != null && summary.notableRoles().stream().anyMatch(TABLE_ROLES::contains);
        }

        boolean hasPasswordInput() {
            return fp.actionableElements().inputs().stream()
                    .anyMatch(i -> lower(i).contains("password"));
        }

        boolean hasLoginButton() {
            return fp.actionableElements().buttons().stream()
                    .anyMatch(b -> containsAny(lower(b), LOGIN_WORDS) || lower(b).equals("submit"));
        }

        boolean hasLogoutControl() {
            return Stream.concat(fp.actionableElements().buttons().stream(), fp.actionableElements().links().stream())
                    .anyMatch(e -> containsAny(lower(e), LOGOUT_WORDS));
        }

        private static String lower(ActionableElement e) {
            return e.name().toLowerCase(Locale.ROOT);
        }
    }
}
