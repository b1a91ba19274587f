package uimbt.export;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import uimbt.TestPages;
import uimbt.model.FsmGraph;
import uimbt.model.GraphIO;
import uimbt.model.GraphStatistics;
import uimbt.model.StateTransition;
import uimbt.model.UIState;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link GraphMerger}, merging a manual recording into an
 * explored graph.
 */
public class GraphMergerTest {

    private static final Instant MERGED_AT = Instant.parse("2026-10-03T12:00:00Z");

    private FsmGraph existing;
    private FsmGraph recording;
    private GraphMerger merger;

    @BeforeMethod
    public void setUp() throws IOException {
        existing  = GraphIO.read(TestPages.resource("graphs/existing-graph.json"));
        recording = GraphIO.read(TestPages.resource("graphs/recording-graph.json"));
        merger    = new GraphMerger(Clock.fixed(MERGED_AT, ZoneOffset.UTC));
    }

    // ── States ────────────────────────────────────────────────────────────

    @Test(description = "Recorded screens with known content map onto existing states")
    public void testDuplicateStates() {
        GraphMerger.MergeResult result = merger.merge(existing, recording);

        assertThat(result.duplicateStates()).isEqualTo(2);
        assertThat(result.graph().findNode("REC_LOGIN")).isEmpty();
        assertThat(result.graph().findNode("REC_OVERVIEW")).isEmpty();
    }

    @Test(description = "A new state whose id is taken is renamed")
    public void testNewStateRenamed() {
        GraphMerger.MergeResult result = merger.merge(existing, recording);

        assertThat(result.newStates()).isEqualTo(1);
        assertThat(result.graph().getNodes()).extracting(UIState::getId).containsExactly(
                "V_LOGIN_FORM_EMPTY", "V_OVERVIEW_PAGE", "V_DEVICES", "V_DEVICES_2");
        UIState added = result.graph().findNode("V_DEVICES_2").orElseThrow();
        assertThat(added.getEntryUrl()).isEqualTo("http://app.test/#!/devices/ABC123");
        assertThat(added.getFingerprint().title()).isEqualTo("ACS - Device ABC123");
    }

    // ── Transitions ───────────────────────────────────────────────────────

    @Test(description = "Edges are re-pointed through the state mapping and deduplicated")
    public void testTransitions() {
        GraphMerger.MergeResult result = merger.merge(existing, recording);

        assertThat(result.duplicateTransitions()).isEqualTo(1);
        assertThat(result.newTransitions()).isEqualTo(1);
        assertThat(result.graph().getEdges()).hasSize(3);

        StateTransition added = result.graph().getEdges().get(2);
        assertThat(added.getId()).isEqualTo("T_V_OVERVIEW_PAGE_TO_V_DEVICES_2_NAVIGATE");
        assertThat(added.getFromState()).isEqualTo("V_OVERVIEW_PAGE");
        assertThat(added.getToState()).isEqualTo("V_DEVICES_2");
    }

    @Test(description = "Every merged edge points at merged states")
    public void testEdgeEndpoints() {
        FsmGraph merged = merger.merge(existing, recording).graph();

        for (StateTransition t : merged.getEdges()) {
            assertThat(merged.findNode(t.getFromState())).as(t.getId()).isPresent();
            assertThat(merged.findNode(t.getToState())).as(t.getId()).isPresent();
        }
    }

    @Test(description = "Merging a graph into itself adds nothing")
    public void testIdempotent() {
        GraphMerger.MergeResult result = merger.merge(existing, existing);

        assertThat(result.newStates()).isZero();
        assertThat(result.newTransitions()).isZero();
        assertThat(result.duplicateStates()).isEqualTo(existing.getNodes().size());
        assertThat(result.duplicateTransitions()).isEqualTo(existing.getEdges().size());
    }

    // ── Statistics ────────────────────────────────────────────────────────

    @Test(description = "Statistics are recomputed and carry the merge counters")
    public void testStatistics() {
        FsmGraph merged = merger.merge(existing, recording).graph();

        GraphStatistics stats = merged.getStatistics();
        assertThat(stats.getStateCount()).isEqualTo(4);
        assertThat(stats.getTransitionCount()).isEqualTo(3);
        assertThat(stats.getStateTypes()).containsEntry("page", 1).containsEntry("list", 1);
        assertThat(stats.getMerged()).isTrue();
        assertThat(stats.getNewStatesAdded()).isEqualTo(1);
        assertThat(stats.getNewTransitionsAdded()).isEqualTo(1);
        assertThat(stats.getDuplicateStatesSkipped()).isEqualTo(2);
        assertThat(stats.getDuplicateTransitionsSkipped()).isEqualTo(1);
        assertThat(stats.getMergedAt()).isEqualTo(MERGED_AT);
    }

    @Test(description = "Graph metadata comes from the existing graph")
    public void testMetadata() {
        FsmGraph merged = merger.merge(existing, recording).graph();

        assertThat(merged.getBaseUrl()).isEqualTo(existing.getBaseUrl());
        assertThat(merged.getDiscoveryMethod()).isEqualTo("selenium_state_machine_dfs");
        assertThat(merged.getGeneratedAt()).isEqualTo(existing.getGeneratedAt());
    }

    @Test(description = "The merged graph survives a write/read cycle with schema validation")
    public void testMergedGraphIsValid() throws IOException {
        FsmGraph merged = merger.merge(existing, recording).graph();
        Path out = Files.createTempFile("merged", ".json");

        GraphIO.write(merged, out);
        FsmGraph reread = GraphIO.read(out);

        assertThat(reread.getNodes()).hasSize(4);
        assertThat(reread.getStatistics().getMerged()).isTrue();
    }

    // ── Errors ────────────────────────────────────────────────────────────

    @Test(description = "Empty graphs cannot be merged")
    public void testEmptyGraphs() {
        assertThatThrownBy(() -> merger.merge(new FsmGraph(), recording))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Existing");
        assertThatThrownBy(() -> merger.merge(existing, new FsmGraph()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Incoming");
        assertThatThrownBy(() -> merger.merge(null, recording))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
