package uimbt.export;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uimbt.model.FsmGraph;
import uimbt.model.GraphStatistics;
import uimbt.model.StateTransition;
import uimbt.model.TransitionSignature;
import uimbt.model.UIState;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges a second graph (a manual recording or another run) into an existing
 * one.
 *
 * <p>States whose {@link ContentFingerprint} matches an existing state are
 * mapped onto it; the others are added, renamed with a numeric suffix if their
 * id is taken. Edges are re-pointed through that mapping and skipped when an
 * edge with the same (from, type, to) already exists.
 */
public class GraphMerger {

    private static final Logger log = LoggerFactory.getLogger(GraphMerger.class);

    /** The merged graph with what was added and skipped. */
    public record MergeResult(FsmGraph graph, int newStates, int newTransitions,
                              int duplicateStates, int duplicateTransitions) {}

    private final Clock clock;

    public GraphMerger() {
        this(Clock.systemUTC());
    }

    public GraphMerger(Clock clock) {
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException if either graph has no states
     */
    public MergeResult merge(FsmGraph existing, FsmGraph incoming) {
        if (existing == null || existing.isEmpty()) {
            throw new IllegalArgumentException("Existing graph has no states to merge into");
        }
        if (incoming == null || incoming.isEmpty()) {
            throw new IllegalArgumentException("Incoming graph has no states to merge");
        }

        // ── States ──────────────────────────────────────────────────────
        List<UIState> nodes = new ArrayList<>(existing.getNodes());
        Set<String> nodeIds = new HashSet<>();
        Map<String, String> byContent = new HashMap<>();
        for (UIState s : nodes) {
            nodeIds.add(s.getId());
            byContent.putIfAbsent(ContentFingerprint.of(s), s.getId());
        }

        Map<String, String> idMap = new HashMap<>();
        int newStates = 0;
        int duplicateStates = 0;
        for (UIState s : incoming.getNodes()) {
            String content = ContentFingerprint.of(s);
            String match = byContent.get(content);
            if (match != null) {
                log.debug("State {} duplicates {}", s.getId(), match);
                idMap.put(s.getId(), match);
                duplicateStates++;
                continue;
            }
            String id = uniqueId(s.getId(), nodeIds);
            UIState added = id.equals(s.getId()) ? s : s.renamed(id);
            nodes.add(added);
            nodeIds.add(id);
            byContent.put(content, id);
            idMap.put(s.getId(), id);
            newStates++;
        }

        // ── Transitions ─────────────────────────────────────────────────
        List<StateTransition> edges = new ArrayList<>(existing.getEdges());
        Set<String> edgeIds = new HashSet<>();
        Set<TransitionSignature> signatures = new HashSet<>();
        for (StateTransition t : edges) {
            edgeIds.add(t.getId());
            signatures.add(t.signature());
        }

        int newTransitions = 0;
        int duplicateTransitions = 0;
        for (StateTransition t : incoming.getEdges()) {
            String from = idMap.getOrDefault(t.getFromState(), t.getFromState());
            String to   = idMap.getOrDefault(t.getToState(), t.getToState());
            if (!nodeIds.contains(from) || !nodeIds.contains(to)) {
                log.warn("Skipping transition {} with unknown endpoint ({} -> {})", t.getId(), from, to);
                continue;
            }
            if (from.equals(to) || !signatures.add(new TransitionSignature(from, t.getActionType(), to))) {
                duplicateTransitions++;
                continue;
            }
            boolean repointed = !from.equals(t.getFromState()) || !to.equals(t.getToState());
            String base = repointed ? "T_" + from + "_TO_" + to + "_" + t.getActionType().name() : t.getId();
            String id = uniqueId(base, edgeIds);
            edgeIds.add(id);
            edges.add(t.repoint(id, from, to));
            newTransitions++;
        }

        FsmGraph merged = new FsmGraph();
        merged.setBaseUrl(existing.getBaseUrl());
        merged.setDiscoveryMethod(existing.getDiscoveryMethod());
        merged.setGeneratedAt(existing.getGeneratedAt());
        merged.setNodes(nodes);
        merged.setEdges(edges);
        merged.setStatistics(statistics(existing.getStatistics(), nodes, edges,
                newStates, newTransitions, duplicateStates, duplicateTransitions));

        log.info("Merged graph: +{} states (skipped {}), +{} transitions (skipped {})",
                newStates, duplicateStates, newTransitions, duplicateTransitions);
        return new MergeResult(merged, newStates, newTransitions, duplicateStates, duplicateTransitions);
    }

    private GraphStatistics statistics(GraphStatistics previous, List<UIState> nodes, List<StateTransition> edges,
                                       int newStates, int newTransitions, int dupStates, int dupTransitions) {
        GraphStatistics stats = GraphExporter.statistics(nodes, edges);
        if (previous != null) {
            stats.setExploredStateCount(previous.getExploredStateCount());
            stats.setMaxStatesReached(previous.isMaxStatesReached());
            stats.setMaxDepthReached(previous.isMaxDepthReached());
        }
        stats.setMerged(true);
        stats.setNewStatesAdded(newStates);
        stats.setNewTransitionsAdded(newTransitions);
        stats.setDuplicateStatesSkipped(dupStates);
        stats.setDuplicateTransitionsSkipped(dupTransitions);
        stats.setMergedAt(clock.instant());
        return stats;
    }

    private static String uniqueId(String base, Set<String> taken) {
        if (!taken.contains(base)) return base;
        int n = 2;
        while (taken.contains(base + "_" + n)) n++;
        return base + "_" + n;
    }
}
