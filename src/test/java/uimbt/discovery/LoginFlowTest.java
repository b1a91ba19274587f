package uimbt.discovery;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import uimbt.TestPages;
import uimbt.fingerprint.StateFingerprinter;
import uimbt.model.ActionType;
import uimbt.model.ElementDescriptor;
import uimbt.model.LocatorStrategy;
import uimbt.model.StateTransition;
import uimbt.model.UIState;
import uimbt.state.StateClassifier;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link LoginFlow}.
 */
public class LoginFlowTest {

    private static final Credentials ADMIN = new Credentials("admin", "s3cret");

    private FakeBrowser browser;
    private DiscoverySession session;
    private StateFingerprinter fingerprinter;
    private LoginFlow flow;

    @BeforeMethod
    public void setUp() {
        browser = new FakeBrowser()
                .page("login", "login", "ACS - Login", "login.txt")
                .page("overview", "overview", "ACS - Overview", "overview.txt");
        DiscoveryConfig config = DiscoveryConfig.defaults();
        config.setWaits(0, 0, 0, 1);
        session = new DiscoverySession(TestPages.BASE + "#!/login", config);
        fingerprinter = new StateFingerprinter();
        flow = new LoginFlow(browser, new TransitionExecutor(browser, config), fingerprinter, session,
                new StateClassifier());
    }

    private LoginFlow.LoginResult loginFrom(String route) {
        browser.navigate(TestPages.BASE + "#!/" + route);
        return flow.perform(fingerprinter.observe(browser), ADMIN);
    }

    // ── Sequence ──────────────────────────────────────────────────────────

    @Test(description = "A successful login records four states joined by three transitions")
    public void testSuccessfulLogin() {
        browser.onClick("login", "Login", "overview");

        LoginFlow.LoginResult result = loginFrom("login");

        assertThat(result.completed()).isTrue();
        assertThat(result.landing().getId()).isEqualTo("V_OVERVIEW_PAGE");
        assertThat(session.getStates()).extracting(UIState::getId).containsExactly(
                "V_LOGIN_FORM_EMPTY", LoginFlow.USERNAME_FILLED, LoginFlow.READY, "V_OVERVIEW_PAGE");
        assertThat(session.getTransitions()).extracting(StateTransition::getActionType)
                .containsExactly(ActionType.FILL_FORM, ActionType.FILL_FORM, ActionType.SUBMIT);
        assertThat(session.getTransitions()).extracting(StateTransition::getToState).containsExactly(
                LoginFlow.USERNAME_FILLED, LoginFlow.READY, "V_OVERVIEW_PAGE");
    }

    @Test(description = "Credentials are typed into the page but never recorded")
    public void testCredentialsNotRecorded() {
        browser.onClick("login", "Login", "overview");

        loginFrom("login");

        assertThat(browser.filledValues()).containsEntry("Username", "admin").containsEntry("Password", "s3cret");
        assertThat(session.getTransitions().get(0).getActionData()).containsEntry("field", "username");
        assertThat(session.getTransitions().get(1).getActionData()).containsEntry("field", "password");
        assertThat(session.getTransitions().get(2).getActionData()).containsEntry("requires_credentials", true);
        assertThat(session.getTransitions().toString() + session.getStates()).doesNotContain("s3cret");
    }

    @Test(description = "Login form states are pinned")
    public void testPinnedFormStates() {
        browser.onClick("login", "Login", "overview");

        loginFrom("login");

        assertThat(session.getState("V_LOGIN_FORM_EMPTY")).get().matches(UIState::isPinned);
        assertThat(session.getState(LoginFlow.READY)).get().matches(UIState::isPinned);
        assertThat(session.getState("V_OVERVIEW_PAGE")).get().matches(s -> !s.isPinned());
    }

    // ── Failure ───────────────────────────────────────────────────────────

    @Test(description = "A submit that stays on the form ends on the empty form state, not completed")
    public void testRejectedLogin() {
        LoginFlow.LoginResult result = loginFrom("login");

        assertThat(result.completed()).isFalse();
        assertThat(result.landing().getId()).isEqualTo("V_LOGIN_FORM_EMPTY");
        assertThat(session.stateCount()).isEqualTo(3);
        assertThat(session.getTransitions()).hasSize(3);
        assertThat(session.getTransitions().get(2).getToState()).isEqualTo("V_LOGIN_FORM_EMPTY");
    }

    @Test(description = "Without a username field the page is explored anonymously")
    public void testNoLoginForm() {
        LoginFlow.LoginResult result = loginFrom("overview");

        assertThat(result.completed()).isFalse();
        assertThat(result.landing().getId()).isEqualTo("V_OVERVIEW_PAGE");
        assertThat(result.landing().isPinned()).isFalse();
        assertThat(session.getTransitions()).isEmpty();
        assertThat(browser.filledValues()).isEmpty();
    }

    // ── Field lookup ──────────────────────────────────────────────────────

    @Test(description = "Fields found in the tree come first, the generic locators follow")
    public void testFieldLookup() {
        ElementDescriptor user = LoginFlow.usernameField(TestPages.tree("login.txt"));
        ElementDescriptor pass = LoginFlow.passwordField(TestPages.tree("login.txt"));

        assertThat(user.primary()).isEqualTo(LocatorStrategy.roleName("textbox", "Username"));
        assertThat(user.strategies()).contains(LocatorStrategy.name("username"));
        assertThat(pass.primary()).isEqualTo(LocatorStrategy.roleName("textbox", "Password"));
    }

    @Test(description = "Without a tree the generic locators are used")
    public void testFieldLookupFallback() {
        assertThat(LoginFlow.usernameField(null)).isEqualTo(LoginFlow.DEFAULT_USERNAME);
        assertThat(LoginFlow.passwordField(TestPages.tree("overview.txt"))).isEqualTo(LoginFlow.DEFAULT_PASSWORD);
    }

    @Test(description = "Credentials mask the password")
    public void testCredentialsToString() {
        assertThat(ADMIN.toString()).contains("admin").doesNotContain("s3cret");
    }
}
