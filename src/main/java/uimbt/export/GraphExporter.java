package uimbt.export;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uimbt.discovery.DiscoverySession;
import uimbt.model.FsmGraph;
import uimbt.model.GraphIO;
import uimbt.model.GraphStatistics;
import uimbt.model.StateTransition;
import uimbt.model.UIState;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns a finished {@link DiscoverySession} into an {@link FsmGraph} and
 * writes it to disk.
 */
public class GraphExporter {

    private static final Logger log = LoggerFactory.getLogger(GraphExporter.class);

    private final Clock clock;

    public GraphExporter() {
        this(Clock.systemUTC());
    }

    public GraphExporter(Clock clock) {
        this.clock = clock;
    }

    public FsmGraph export(DiscoverySession session) {
        FsmGraph graph = new FsmGraph();
        graph.setBaseUrl(session.getBaseUrl());
        graph.setDiscoveryMethod(session.getStrategy().discoveryMethod());
        graph.setGeneratedAt(clock.instant());
        graph.setNodes(List.copyOf(session.getStates()));
        graph.setEdges(session.getTransitions());

        GraphStatistics stats = statistics(session.getStates(), session.getTransitions());
        stats.setExploredStateCount(session.exploredCount());
        stats.setMaxStatesReached(session.isMaxStatesReached());
        stats.setMaxDepthReached(session.isMaxDepthReached());
        graph.setStatistics(stats);
        log.info("Exported graph: {} states, {} transitions", stats.getStateCount(), stats.getTransitionCount());
        return graph;
    }

    public FsmGraph exportTo(DiscoverySession session, Path output) throws IOException {
        FsmGraph graph = export(session);
        GraphIO.write(graph, output);
        return graph;
    }

    /** State/transition counts and state-type distribution. */
    static GraphStatistics statistics(Collection<UIState> states, Collection<StateTransition> transitions) {
        GraphStatistics stats = new GraphStatistics();
        stats.setStateCount(states.size());
        stats.setTransitionCount(transitions.size());
        Map<String, Integer> types = new TreeMap<>();
        for (UIState s : states) {
            types.merge(s.getStateType().jsonValue(), 1, Integer::sum);
        }
        stats.setStateTypes(types);
        return stats;
    }
}
