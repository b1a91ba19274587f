package uimbt.discovery;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import uimbt.TestPages;
import uimbt.accessibility.AriaSnapshotParser;
import uimbt.browser.BrowserException;
import uimbt.browser.BrowserSession;
import uimbt.model.ElementDescriptor;
import uimbt.model.LocatorStrategy;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link TransitionExecutor}.
 */
public class TransitionExecutorTest {

    private FakeBrowser browser;
    private DiscoveryConfig config;
    private TransitionExecutor executor;
    private ActionDiscovery discovery;

    @BeforeMethod
    public void setUp() {
        browser = new FakeBrowser()
                .page("overview", "overview", "ACS - Overview", "overview.txt")
                .page("devices", "devices", "ACS - Devices", "devices.txt")
                .page("dialog", "admin/presets", "ACS - Admin", "presets-dialog.txt")
                .onClick("overview", "Devices", "devices");
        config = DiscoveryConfig.defaults();
        config.setWaits(0, 0, 0, 1);
        executor = new TransitionExecutor(browser, config);
        discovery = new ActionDiscovery(config, TestPages.BASE);
    }

    private ActionCandidate candidate(String label) {
        return discovery.discover(new AriaSnapshotParser().parse(browser.accessibilitySnapshot()))
                .stream()
                .filter(c -> c.label().equals(label))
                .findFirst()
                .orElseThrow();
    }

    // ── Clicks ────────────────────────────────────────────────────────────

    @Test(description = "A navigate action clicks its link and records no data")
    public void testNavigate() {
        browser.navigate(TestPages.BASE + "#!/overview");

        Map<String, Object> data = executor.execute(candidate("Devices"));

        assertThat(data).isEmpty();
        assertThat(browser.currentPage()).isEqualTo("devices");
        assertThat(browser.clicks()).containsExactly("Devices");
    }

    @Test(description = "A missing trigger fails the action")
    public void testMissingTrigger() {
        browser.navigate(TestPages.BASE + "#!/overview");
        ActionCandidate ghost = ActionCandidate.click(
                ElementDescriptor.of("button", LocatorStrategy.roleName("button", "Ghost")), "Ghost");

        assertThatThrownBy(() -> executor.execute(ghost))
                .isInstanceOf(BrowserException.class)
                .hasMessageContaining("Ghost");
    }

    // ── Forms ─────────────────────────────────────────────────────────────

    @Test(description = "Forms are filled with sample values and submitted; only field names are recorded")
    public void testFillForm() {
        browser.navigate(TestPages.BASE + "#!/admin/presets");

        Map<String, Object> data = executor.execute(candidate("Preset"));

        assertThat(browser.filledValues()).containsEntry("Name", "mbt-sample").containsEntry("Weight", "1");
        assertThat(browser.clicks()).containsExactly("Save");
        assertThat(data).containsEntry("fields", List.of("Name", "Weight")).containsEntry("submitted", true);
        assertThat(data.toString()).doesNotContain("mbt-sample");
    }

    @Test(description = "Fields that cannot be found are skipped")
    public void testFillFormSkipsMissingFields() {
        browser.navigate(TestPages.BASE + "#!/admin/presets");
        ElementDescriptor missing = ElementDescriptor.of("input", LocatorStrategy.roleName("textbox", "Missing"));
        ElementDescriptor name = ElementDescriptor.of("input", LocatorStrategy.roleName("textbox", "Name"));
        ActionCandidate form = ActionCandidate.fillForm(List.of(
                new FormField(missing, "textbox", "Missing"), new FormField(name, "textbox", "Name")), null, "Preset");

        Map<String, Object> data = executor.execute(form);

        assertThat(data).containsEntry("fields", List.of("Name")).doesNotContainKey("submitted");
        assertThat(browser.clicks()).isEmpty();
    }

    @Test(description = "A form whose fields all fail is a failed action")
    public void testFillFormNothingFilled() {
        browser.navigate(TestPages.BASE + "#!/overview");
        ElementDescriptor missing = ElementDescriptor.of("input", LocatorStrategy.roleName("textbox", "Missing"));
        ActionCandidate form = ActionCandidate.fillForm(List.of(new FormField(missing, "textbox", "")), null, "form");

        assertThatThrownBy(() -> executor.execute(form))
                .isInstanceOf(BrowserException.class)
                .hasMessageContaining("form");
    }

    @Test(description = "A submit action clicks the submit button")
    public void testSubmit() {
        browser.navigate(TestPages.BASE + "#!/admin/presets");
        ActionCandidate submit = ActionCandidate.submit(
                ElementDescriptor.of("button", LocatorStrategy.roleName("button", "Save")), "Preset");

        assertThat(executor.execute(submit)).isEmpty();
        assertThat(browser.clicks()).containsExactly("Save");
    }

    // ── Settling ──────────────────────────────────────────────────────────

    @Test(description = "Settling waits for the busy indicator to clear")
    public void testAwaitSettled() {
        BrowserSession session = mock(BrowserSession.class);
        when(session.waitForNetworkIdle(any(Duration.class))).thenReturn(false);
        when(session.isBusy()).thenReturn(true, true, false);
        when(session.locate(any())).thenReturn(Optional.empty());
        DiscoveryConfig slow = DiscoveryConfig.defaults();
        slow.setWaits(10, 1, 5000, 1);

        new TransitionExecutor(session, slow).awaitSettled();

        verify(session).waitForNetworkIdle(Duration.ofMillis(10));
        verify(session, times(3)).isBusy();
    }
}
