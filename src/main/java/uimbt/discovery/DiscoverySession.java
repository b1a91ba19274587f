package uimbt.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uimbt.fingerprint.ElementDescriptors;
import uimbt.fingerprint.PageObservation;
import uimbt.model.ActionType;
import uimbt.model.ElementDescriptor;
import uimbt.model.Fingerprint;
import uimbt.model.StateOrigin;
import uimbt.model.StateTransition;
import uimbt.model.StateType;
import uimbt.model.TransitionSignature;
import uimbt.model.UIState;
import uimbt.state.Classification;
import uimbt.state.StateClassifier;
import uimbt.state.StateComparer;
import uimbt.state.StateMatch;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * State registry and transition list of one discovery run.
 *
 * <p>Enforces the graph invariants: state ids are unique, a fingerprint that
 * matches a known state above the threshold never creates a new one, at most
 * one edge exists per (from, type, to), and no more than {@code maxStates}
 * states are registered. Owned by a single driver thread.
 */
public class DiscoverySession {

    private static final Logger log = LoggerFactory.getLogger(DiscoverySession.class);

    private final String baseUrl;
    private final ExplorationStrategy strategy;
    private final StateComparer comparer;
    private final StateClassifier classifier;
    private final double threshold;
    private final int maxStates;
    private final Clock clock;

    private final Map<String, UIState> states = new LinkedHashMap<>();
    private final List<StateTransition> transitions = new ArrayList<>();
    private final Set<String> transitionIds = new HashSet<>();
    private final Set<TransitionSignature> signatures = new HashSet<>();
    private final Set<String> explored = new LinkedHashSet<>();
    private long sequence;
    private boolean maxStatesReached;
    private boolean maxDepthReached;

    public DiscoverySession(String baseUrl, ExplorationStrategy strategy, StateComparer comparer,
                            StateClassifier classifier, double threshold, int maxStates, Clock clock) {
        this.baseUrl    = baseUrl;
        this.strategy   = strategy;
        this.comparer   = comparer;
        this.classifier = classifier;
        this.threshold  = threshold;
        this.maxStates  = maxStates;
        this.clock      = clock;
    }

    public DiscoverySession(String baseUrl, DiscoveryConfig config) {
        this(baseUrl, config.getStrategy(), new StateComparer(config.getSimilarityWeights()),
                new StateClassifier(), config.getSimilarityThreshold(), config.getMaxStates(), Clock.systemUTC());
    }

    // ── States ────────────────────────────────────────────────────────────

    /**
     * Resolves an observation to a state: merges its elements into the best
     * match at or above the threshold, or classifies and registers it.
     */
    public StateResolution resolve(PageObservation observation) {
        Fingerprint fp = observation.fingerprint();
        StateMatch match = comparer.findMatchingState(fp, states.values(), threshold);
        if (match.matched()) {
            UIState known = match.state();
            int added = known.mergeElementDescriptors(descriptorsOf(fp));
            if (added > 0) log.debug("Merged {} new element descriptors into {}", added, known.getId());
            return StateResolution.existing(known, match.score());
        }
        if (states.size() >= maxStates) {
            if (!maxStatesReached) log.warn("State limit {} reached, no further states will be registered", maxStates);
            maxStatesReached = true;
            return StateResolution.refused(match.score());
        }
        Classification c = classifier.classify(fp);
        UIState state = register(c.stateId(), c.stateType(), StateOrigin.EXPLORATION, observation);
        log.info("New state {} ({}) at {} [best prior similarity {}]", state.getId(), c.stateType().jsonValue(),
                fp.urlPattern(), String.format("%.3f", match.score()));
        return StateResolution.created(state, match.score());
    }

    /**
     * Registers an observation without similarity matching. Used for the
     * login micro-sequence, whose states look alike but must stay distinct.
     *
     * @return the new state, or empty when the state limit is reached
     */
    public Optional<UIState> registerPinned(PageObservation observation, String baseId, StateType type) {
        if (states.size() >= maxStates) {
            maxStatesReached = true;
            log.warn("State limit {} reached, cannot record {}", maxStates, baseId);
            return Optional.empty();
        }
        UIState state = register(baseId, type, StateOrigin.LOGIN_FLOW, observation);
        log.info("Recorded login-flow state {}", state.getId());
        return Optional.of(state);
    }

    /** Similarity of an observation to a specific known state, compared to the threshold. */
    public boolean matches(PageObservation observation, UIState state) {
        return comparer.similarity(observation.fingerprint(), state.getFingerprint()) >= threshold;
    }

    private UIState register(String baseId, StateType type, StateOrigin origin, PageObservation observation) {
        String id = uniqueId(baseId, states.keySet());
        UIState state = new UIState(id, type, origin, observation.url(), observation.fingerprint(),
                descriptorsOf(observation.fingerprint()), ++sequence, clock.instant());
        states.put(id, state);
        return state;
    }

    public Optional<UIState> getState(String id) {
        return Optional.ofNullable(states.get(id));
    }

    public Collection<UIState> getStates() {
        return Collections.unmodifiableCollection(states.values());
    }

    public int stateCount() {
        return states.size();
    }

    // ── Transitions ───────────────────────────────────────────────────────

    /**
     * Records an edge unless it is a self-loop or an edge with the same
     * (from, type, to) already exists.
     */
    public Optional<StateTransition> recordTransition(String from, String to, ActionType type,
                                                      ElementDescriptor trigger, Map<String, Object> actionData) {
        if (from.equals(to)) return Optional.empty();
        if (!states.containsKey(from) || !states.containsKey(to)) {
            throw new IllegalArgumentException("Transition endpoints must be registered states: " + from + " -> " + to);
        }
        TransitionSignature signature = new TransitionSignature(from, type, to);
        if (!signatures.add(signature)) {
            log.debug("Transition {} -[{}]-> {} already recorded", from, type, to);
            return Optional.empty();
        }
        String id = uniqueId("T_" + from + "_TO_" + to + "_" + type.name(), transitionIds);
        transitionIds.add(id);
        StateTransition t = new StateTransition(id, from, to, type, trigger, actionData);
        transitions.add(t);
        log.info("Transition {}", id);
        return Optional.of(t);
    }

    public List<StateTransition> getTransitions() {
        return Collections.unmodifiableList(transitions);
    }

    // ── Exploration bookkeeping ───────────────────────────────────────────

    /** @return {@code false} if the state was already explored */
    public boolean markExplored(String stateId) {
        return explored.add(stateId);
    }

    public boolean isExplored(String stateId) {
        return explored.contains(stateId);
    }

    public int exploredCount() {
        return explored.size();
    }

    public boolean isMaxStatesReached()          { return maxStatesReached; }
    public boolean isMaxDepthReached()           { return maxDepthReached; }
    public void    setMaxStatesReached()         { this.maxStatesReached = true; }
    public void    setMaxDepthReached()          { this.maxDepthReached = true; }
    public String  getBaseUrl()                  { return baseUrl; }
    public ExplorationStrategy getStrategy()     { return strategy; }
    public int     getMaxStates()                { return maxStates; }

    // ── Helpers ───────────────────────────────────────────────────────────

    static String uniqueId(String base, Set<String> taken) {
        if (!taken.contains(base)) return base;
        int n = 2;
        while (taken.contains(base + "_" + n)) n++;
        return base + "_" + n;
    }

    private static List<ElementDescriptor> descriptorsOf(Fingerprint fp) {
        List<ElementDescriptor> out = new ArrayList<>();
        Stream.of(fp.actionableElements().buttons(), fp.actionableElements().links(), fp.actionableElements().inputs())
                .flatMap(List::stream)
                .map(ElementDescriptors::forElement)
                .forEach(out::add);
        return out;
    }
}
