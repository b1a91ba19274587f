package uimbt.discovery;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import uimbt.TestPages;
import uimbt.model.ActionType;
import uimbt.model.ElementDescriptor;
import uimbt.model.LocatorStrategy;
import uimbt.model.StateOrigin;
import uimbt.model.StateTransition;
import uimbt.model.StateType;
import uimbt.model.UIState;
import uimbt.state.StateClassifier;
import uimbt.state.StateComparer;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DiscoverySession}.
 */
public class DiscoverySessionTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final ElementDescriptor LINK =
            ElementDescriptor.of("link", LocatorStrategy.roleName("link", "Devices"));

    private DiscoverySession session;

    private static DiscoverySession session(double threshold, int maxStates) {
        return new DiscoverySession(TestPages.BASE, ExplorationStrategy.DFS, new StateComparer(),
                new StateClassifier(), threshold, maxStates, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @BeforeMethod
    public void setUp() {
        session = session(0.80, 100);
    }

    // ── resolve ───────────────────────────────────────────────────────────

    @Test(description = "An unknown page is classified and registered")
    public void testResolveCreates() {
        StateResolution r = session.resolve(TestPages.overview());

        assertThat(r.created()).isTrue();
        assertThat(r.isRefused()).isFalse();
        UIState state = r.state();
        assertThat(state.getId()).isEqualTo("V_OVERVIEW_PAGE");
        assertThat(state.getStateType()).isEqualTo(StateType.DASHBOARD);
        assertThat(state.getOrigin()).isEqualTo(StateOrigin.EXPLORATION);
        assertThat(state.getEntryUrl()).isEqualTo(TestPages.BASE + "#!/overview");
        assertThat(state.getSequence()).isEqualTo(1);
        assertThat(state.getDiscoveredAt()).isEqualTo(NOW);
        assertThat(state.getElementDescriptors()).isNotEmpty();
    }

    @Test(description = "The same page resolves to the existing state")
    public void testResolveExisting() {
        UIState first = session.resolve(TestPages.overview()).state();

        StateResolution again = session.resolve(TestPages.overview());

        assertThat(again.created()).isFalse();
        assertThat(again.state()).isSameAs(first);
        assertThat(again.score()).isEqualTo(1.0);
        assertThat(session.stateCount()).isEqualTo(1);
    }

    @Test(description = "Typing a username does not create a new state for the login form")
    public void testResolveFilledLoginForm() {
        UIState empty = session.resolve(TestPages.login()).state();
        assertThat(empty.getId()).isEqualTo(StateClassifier.LOGIN_FORM_EMPTY);

        StateResolution filled = session.resolve(TestPages.observeText(TestPages.BASE + "#!/login", "ACS - Login",
                TestPages.snapshot("login.txt").replace("textbox \"Username\"", "textbox \"Username\": admin")));

        assertThat(filled.created()).isFalse();
        assertThat(filled.state()).isSameAs(empty);
        assertThat(filled.score()).isGreaterThanOrEqualTo(0.80);
        assertThat(session.stateCount()).isEqualTo(1);
    }

    @Test(description = "Pages sharing navigation chrome but differing in content stay distinct")
    public void testDistinctPages() {
        session.resolve(TestPages.overview());
        StateResolution devices = session.resolve(TestPages.devices());

        assertThat(devices.created()).isTrue();
        assertThat(devices.state().getId()).isEqualTo("V_DEVICES");
        assertThat(devices.score()).isLessThan(0.80);
        assertThat(session.getStates()).extracting(UIState::getId).containsExactly("V_OVERVIEW_PAGE", "V_DEVICES");
    }

    @Test(description = "A match below the default threshold merges new element descriptors into the known state")
    public void testMergeDescriptors() {
        DiscoverySession loose = session(0.5, 100);
        UIState overview = loose.resolve(TestPages.overview()).state();
        ElementDescriptor refresh = ElementDescriptor.of("button",
                LocatorStrategy.roleName("button", "Refresh"), LocatorStrategy.text("Refresh"));
        assertThat(overview.getElementDescriptors()).doesNotContain(refresh);

        StateResolution r = loose.resolve(TestPages.devices());

        assertThat(r.created()).isFalse();
        assertThat(r.state()).isSameAs(overview);
        assertThat(overview.getElementDescriptors()).contains(refresh);
    }

    @Test(description = "No state is registered past the limit")
    public void testMaxStates() {
        DiscoverySession small = session(0.80, 2);
        small.resolve(TestPages.overview());
        small.resolve(TestPages.devices());

        StateResolution refused = small.resolve(TestPages.admin());

        assertThat(refused.isRefused()).isTrue();
        assertThat(small.stateCount()).isEqualTo(2);
        assertThat(small.isMaxStatesReached()).isTrue();
    }

    // ── registerPinned ────────────────────────────────────────────────────

    @Test(description = "Pinned states are recorded even when identical, with suffixed ids")
    public void testRegisterPinned() {
        UIState a = session.registerPinned(TestPages.login(), "V_LOGIN_FORM_EMPTY", StateType.FORM).orElseThrow();
        UIState b = session.registerPinned(TestPages.login(), "V_LOGIN_FORM_EMPTY", StateType.FORM).orElseThrow();

        assertThat(a.getId()).isEqualTo("V_LOGIN_FORM_EMPTY");
        assertThat(b.getId()).isEqualTo("V_LOGIN_FORM_EMPTY_2");
        assertThat(a.isPinned()).isTrue();
        assertThat(b.getSequence()).isEqualTo(2);
    }

    @Test(description = "Pinned registration also honours the limit")
    public void testRegisterPinnedAtLimit() {
        DiscoverySession one = session(0.80, 1);
        one.resolve(TestPages.overview());

        Optional<UIState> pinned = one.registerPinned(TestPages.login(), "V_LOGIN_FORM_EMPTY", StateType.FORM);

        assertThat(pinned).isEmpty();
        assertThat(one.isMaxStatesReached()).isTrue();
    }

    @Test(description = "matches compares an observation with one specific state")
    public void testMatches() {
        UIState overview = session.resolve(TestPages.overview()).state();

        assertThat(session.matches(TestPages.overview(), overview)).isTrue();
        assertThat(session.matches(TestPages.login(), overview)).isFalse();
    }

    // ── Transitions ───────────────────────────────────────────────────────

    @Test(description = "Transitions get deterministic ids")
    public void testRecordTransition() {
        String from = session.resolve(TestPages.overview()).state().getId();
        String to = session.resolve(TestPages.devices()).state().getId();

        StateTransition t = session.recordTransition(from, to, ActionType.NAVIGATE, LINK, Map.of()).orElseThrow();

        assertThat(t.getId()).isEqualTo("T_V_OVERVIEW_PAGE_TO_V_DEVICES_NAVIGATE");
        assertThat(t.getFromState()).isEqualTo(from);
        assertThat(t.getToState()).isEqualTo(to);
        assertThat(t.getTrigger()).isEqualTo(LINK);
        assertThat(session.getTransitions()).containsExactly(t);
    }

    @Test(description = "Self-loops and repeated (from, type, to) edges are not recorded")
    public void testNoDuplicateEdges() {
        String from = session.resolve(TestPages.overview()).state().getId();
        String to = session.resolve(TestPages.devices()).state().getId();

        assertThat(session.recordTransition(from, from, ActionType.CLICK, LINK, Map.of())).isEmpty();
        assertThat(session.recordTransition(from, to, ActionType.NAVIGATE, LINK, Map.of())).isPresent();
        assertThat(session.recordTransition(from, to, ActionType.NAVIGATE, LINK, Map.of())).isEmpty();
        assertThat(session.recordTransition(from, to, ActionType.CLICK, LINK, Map.of())).isPresent();
        assertThat(session.getTransitions()).hasSize(2);
    }

    @Test(description = "Edges need registered endpoints")
    public void testUnknownEndpoint() {
        String from = session.resolve(TestPages.overview()).state().getId();

        assertThatThrownBy(() -> session.recordTransition(from, "V_NOWHERE", ActionType.CLICK, LINK, Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("V_NOWHERE");
    }

    // ── Bookkeeping ───────────────────────────────────────────────────────

    @Test(description = "A state is explored once")
    public void testMarkExplored() {
        assertThat(session.markExplored("V_A")).isTrue();
        assertThat(session.markExplored("V_A")).isFalse();
        assertThat(session.isExplored("V_A")).isTrue();
        assertThat(session.exploredCount()).isEqualTo(1);
    }

    @Test(description = "Taken ids get the first free numeric suffix")
    public void testUniqueId() {
        assertThat(DiscoverySession.uniqueId("V_X", Set.of())).isEqualTo("V_X");
        assertThat(DiscoverySession.uniqueId("V_X", Set.of("V_X"))).isEqualTo("V_X_2");
        assertThat(DiscoverySession.uniqueId("V_X", Set.of("V_X", "V_X_2"))).isEqualTo("V_X_3");
    }
}
