package uimbt.export;

import org.testng.annotations.Test;
import uimbt.TestPages;
import uimbt.fingerprint.PageObservation;
import uimbt.model.ActionableElement;
import uimbt.model.ActionableElements;
import uimbt.model.Fingerprint;
import uimbt.model.FsmGraph;
import uimbt.model.GraphIO;
import uimbt.model.StateOrigin;
import uimbt.model.StateType;
import uimbt.model.UIState;

import java.io.IOException;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ContentFingerprint}.
 */
public class ContentFingerprintTest {

    private static UIState state(String id, StateType type, PageObservation obs) {
        return new UIState(id, type, StateOrigin.EXPLORATION, obs.url(), obs.fingerprint(), List.of(), 1, Instant.EPOCH);
    }

    private static UIState withLinks(String url, String... names) {
        List<ActionableElement> links = Arrays.stream(names)
                .map(n -> new ActionableElement("link", n, null, null, null))
                .toList();
        Fingerprint fp = new Fingerprint(null, new ActionableElements(List.of(), links, List.of()),
                "devices", null, "Devices", null);
        return new UIState("V_X", StateType.LIST, StateOrigin.MANUAL, url, fp, List.of(), 1, Instant.EPOCH);
    }

    @Test(description = "The hash is a hex SHA-256 digest")
    public void testFormat() {
        assertThat(ContentFingerprint.of(state("V_A", StateType.DASHBOARD, TestPages.overview())))
                .hasSize(64)
                .matches("[0-9a-f]+");
    }

    @Test(description = "State ids, titles and sequence do not affect the key")
    public void testIgnoresIdentity() {
        PageObservation overview = TestPages.overview();
        PageObservation retitled = TestPages.observation(overview.url(), "Other title", "overview.txt");

        assertThat(ContentFingerprint.of(state("V_A", StateType.DASHBOARD, overview)))
                .isEqualTo(ContentFingerprint.of(state("V_B", StateType.DASHBOARD, retitled)));
    }

    @Test(description = "State type and page structure do affect the key")
    public void testSensitiveToContent() {
        String overview = ContentFingerprint.of(state("V_A", StateType.DASHBOARD, TestPages.overview()));

        assertThat(ContentFingerprint.of(state("V_A", StateType.PAGE, TestPages.overview()))).isNotEqualTo(overview);
        assertThat(ContentFingerprint.of(state("V_A", StateType.DASHBOARD, TestPages.devices()))).isNotEqualTo(overview);
    }

    @Test(description = "Numeric and percent-encoded link names are data, not structure")
    public void testDataLinkNames() {
        String a = ContentFingerprint.of(withLinks("http://acs.test/#!/devices", "Devices", "42", "50%"));
        String b = ContentFingerprint.of(withLinks("http://acs.test/#!/devices", "Devices", "7", "12%"));
        String c = ContentFingerprint.of(withLinks("http://acs.test/#!/devices", "Devices", "Faults", "12%"));

        assertThat(a).isEqualTo(b);
        assertThat(a).isNotEqualTo(c);
    }

    @Test(description = "Query strings are ignored; link order is irrelevant")
    public void testUrlBaseAndOrder() {
        String a = ContentFingerprint.of(withLinks("http://acs.test/#!/devices?page=2", "Devices", "Faults"));
        String b = ContentFingerprint.of(withLinks("http://acs.test/#!/devices", "Faults", "Devices"));

        assertThat(a).isEqualTo(b);
    }

    @Test(description = "The URL base comes from the entry URL, else the fingerprint's pattern")
    public void testUrlBase() {
        assertThat(ContentFingerprint.urlBase(withLinks("http://acs.test/#!/devices?x=1"))).isEqualTo("devices");
        assertThat(ContentFingerprint.urlBase(withLinks("http://acs.test/"))).isEqualTo("root");
        assertThat(ContentFingerprint.urlBase(withLinks(null))).isEqualTo("devices");
    }

    @Test(description = "A recorded overview matches the explored overview")
    public void testAcrossGraphs() throws IOException {
        FsmGraph existing = GraphIO.read(TestPages.resource("graphs/existing-graph.json"));
        FsmGraph recording = GraphIO.read(TestPages.resource("graphs/recording-graph.json"));

        assertThat(ContentFingerprint.of(recording.findNode("REC_OVERVIEW").orElseThrow()))
                .isEqualTo(ContentFingerprint.of(existing.findNode("V_OVERVIEW_PAGE").orElseThrow()));
        assertThat(ContentFingerprint.of(recording.findNode("V_DEVICES").orElseThrow()))
                .isNotEqualTo(ContentFingerprint.of(existing.findNode("V_DEVICES").orElseThrow()));
    }
}
