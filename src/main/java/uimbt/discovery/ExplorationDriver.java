package uimbt.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uimbt.browser.BrowserException;
import uimbt.browser.BrowserSession;
import uimbt.browser.StabilityWait;
import uimbt.fingerprint.PageObservation;
import uimbt.fingerprint.StateFingerprinter;
import uimbt.model.StateTransition;
import uimbt.model.UIState;
import uimbt.state.StateClassifier;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Drives a discovery run: loads the base URL, optionally logs in, then
 * explores depth-first (default) or breadth-first until no unexplored state
 * remains or a limit is hit.
 *
 * <p>Per-action failures are logged and contribute no transition; a browser
 * failure outside an action ends the run with whatever was discovered so far.
 * Only programmer errors (a blank base URL) escape {@link #run}.
 */
public class ExplorationDriver {

    private static final Logger log = LoggerFactory.getLogger(ExplorationDriver.class);

    /** Lifecycle of a run, logged as it advances. */
    public enum Phase { DISCOVERING_INITIAL, LOGGING_IN, EXPLORING, BACKTRACKING, DONE }

    private final BrowserSession browser;
    private final DiscoveryConfig config;
    private final String baseUrl;
    private final StateFingerprinter fingerprinter;
    private final DiscoverySession session;
    private final ActionDiscovery actions;
    private final TransitionExecutor executor;
    private final LoginFlow loginFlow;

    /** Actions behind the transitions this run recorded, by transition id. */
    private final Map<String, ActionCandidate> replayable = new HashMap<>();

    private Phase phase;
    private boolean stopRequested;

    public ExplorationDriver(BrowserSession browser, DiscoveryConfig config, String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Base URL is required");
        }
        this.browser       = browser;
        this.config        = config;
        this.baseUrl       = baseUrl;
        this.fingerprinter = new StateFingerprinter();
        this.session       = new DiscoverySession(baseUrl, config);
        this.actions       = new ActionDiscovery(config, baseUrl);
        this.executor      = new TransitionExecutor(browser, config);
        this.loginFlow     = new LoginFlow(browser, executor, fingerprinter, session, new StateClassifier());
    }

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Runs discovery.
     *
     * @param credentials login credentials, or {@code null} to explore anonymously
     * @return the session holding every discovered state and transition
     */
    public DiscoverySession run(Credentials credentials) {
        enter(Phase.DISCOVERING_INITIAL);
        try {
            browser.navigate(baseUrl);
            PageObservation initial = observe();

            UIState start;
            if (credentials != null) {
                enter(Phase.LOGGING_IN);
                start = loginFlow.perform(initial, credentials).landing();
            } else {
                start = session.resolve(initial).state();
            }
            if (start == null) {
                log.error("No initial state could be recorded for {}", baseUrl);
                return session;
            }

            enter(Phase.EXPLORING);
            switch (session.getStrategy()) {
                case DFS -> exploreDfs(start, 0);
                case BFS -> exploreBfs(start);
            }
        } catch (BrowserException e) {
            log.error("Discovery aborted: {}", e.getMessage(), e);
        } finally {
            enter(Phase.DONE);
            log.info("Discovery finished: {} states, {} transitions, {} explored{}{}",
                    session.stateCount(), session.getTransitions().size(), session.exploredCount(),
                    session.isMaxStatesReached() ? " [max states reached]" : "",
                    session.isMaxDepthReached() ? " [max depth reached]" : "");
        }
        return session;
    }

    public DiscoverySession getSession() { return session; }

    public Phase getPhase() { return phase; }

    // ── Depth-first ───────────────────────────────────────────────────────

    private void exploreDfs(UIState state, int depth) {
        if (stopRequested || session.isExplored(state.getId())) return;
        if (!admitExplored(state)) return;
        if (state.getStateType().isEphemeral()) {
            log.debug("Not exploring from {} state {}", state.getStateType().jsonValue(), state.getId());
            return;
        }

        PageObservation here = observe();
        if (!session.matches(here, state)) {
            if (!reach(state)) return;
            here = observe();
        }
        List<ActionCandidate> candidates = actions.discover(here.tree());
        log.info("Exploring {} at depth {} with {} candidate actions", state.getId(), depth, candidates.size());

        for (ActionCandidate candidate : candidates) {
            if (stopRequested) return;
            Optional<UIState> target = attempt(state, candidate);
            if (target.isPresent() && !session.isExplored(target.get().getId())) {
                if (depth + 1 > config.getMaxDepth()) {
                    if (!session.isMaxDepthReached()) log.warn("Max depth {} reached at {}", config.getMaxDepth(), state.getId());
                    session.setMaxDepthReached();
                } else {
                    exploreDfs(target.get(), depth + 1);
                    if (stopRequested) return;
                }
            }
            enter(Phase.BACKTRACKING);
            boolean back = returnTo(state);
            enter(Phase.EXPLORING);
            if (!back) {
                log.warn("Cannot get back to {}, abandoning its remaining actions", state.getId());
                return;
            }
        }
    }

    // ── Breadth-first ─────────────────────────────────────────────────────

    private void exploreBfs(UIState start) {
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start.getId());
        while (!queue.isEmpty() && !stopRequested) {
            UIState intended = session.getState(queue.poll()).orElseThrow();
            if (session.isExplored(intended.getId())) continue;

            UIState current = intended;
            if (!intended.getStateType().isEphemeral()) {
                Optional<PageObservation> reached = jumpTo(intended);
                if (reached.isEmpty() || !session.matches(reached.get(), intended)) {
                    reached = replay(intended) ? Optional.of(observe()) : jumpTo(intended);
                }
                if (reached.isEmpty()) {
                    session.markExplored(intended.getId());
                    continue;
                }
                if (!session.matches(reached.get(), intended)) {
                    StateResolution actual = session.resolve(reached.get());
                    if (actual.isRefused()) {
                        stopRequested = true;
                        break;
                    }
                    session.markExplored(intended.getId());
                    if (session.isExplored(actual.state().getId())) {
                        log.info("{} unreachable, landed on explored {}", intended.getId(), actual.state().getId());
                        continue;
                    }
                    log.info("{} unreachable, exploring {} instead", intended.getId(), actual.state().getId());
                    current = actual.state();
                }
            }
            if (!admitExplored(current)) break;
            if (current.getStateType().isEphemeral()) continue;

            List<ActionCandidate> candidates = actions.discover(observe().tree());
            log.info("Exploring {} with {} candidate actions", current.getId(), candidates.size());
            for (ActionCandidate candidate : candidates) {
                if (stopRequested) break;
                attempt(current, candidate)
                        .filter(t -> !session.isExplored(t.getId()))
                        .ifPresent(t -> queue.add(t.getId()));
                if (!returnTo(current)) {
                    log.warn("Cannot get back to {}, abandoning its remaining actions", current.getId());
                    break;
                }
            }
        }
    }

    // ── Steps ─────────────────────────────────────────────────────────────

    /**
     * Marks a state explored unless the explored-state limit is reached, in
     * which case the run stops.
     */
    private boolean admitExplored(UIState state) {
        if (session.exploredCount() >= config.getMaxStates()) {
            log.warn("Explored-state limit {} reached", config.getMaxStates());
            session.setMaxStatesReached();
            stopRequested = true;
            return false;
        }
        session.markExplored(state.getId());
        return true;
    }

    /**
     * Executes one action from {@code source} and records the transition.
     *
     * @return the state reached, when it differs from {@code source}
     */
    private Optional<UIState> attempt(UIState source, ActionCandidate candidate) {
        Map<String, Object> data;
        try {
            data = executor.execute(candidate);
        } catch (BrowserException e) {
            log.warn("Action {} from {} failed: {}", candidate, source.getId(), e.getMessage());
            return Optional.empty();
        }
        StateResolution resolution = session.resolve(observe());
        if (resolution.isRefused()) {
            stopRequested = true;
            return Optional.empty();
        }
        UIState target = resolution.state();
        if (target.getId().equals(source.getId())) {
            log.debug("Action {} stayed on {}", candidate, source.getId());
            return Optional.empty();
        }
        session.recordTransition(source.getId(), target.getId(), candidate.type(), candidate.trigger(), data)
                .ifPresent(t -> replayable.put(t.getId(), candidate));
        return Optional.of(target);
    }

    /** Back to {@code state}: nothing to do, history back, re-navigation or replay. */
    private boolean returnTo(UIState state) {
        if (session.matches(observe(), state)) return true;
        try {
            browser.back();
            if (session.matches(observe(), state)) return true;
        } catch (BrowserException e) {
            log.debug("History back failed: {}", e.getMessage());
        }
        return reach(state);
    }

    /**
     * Re-navigates to the state's entry URL and verifies arrival. States that
     * share a URL with their parent (dialogs, tabs, expanded panels) are
     * reached by replaying the recorded actions that lead to them.
     */
    private boolean reach(UIState state) {
        if (reachByUrl(state)) return true;
        return replay(state);
    }

    private boolean reachByUrl(UIState state) {
        return jumpTo(state).map(obs -> session.matches(obs, state)).orElse(false);
    }

    /**
     * Replays the shortest chain of recorded actions ending in {@code target},
     * starting from the nearest state that is current or reachable by URL.
     * Every step must land on its recorded target state.
     */
    private boolean replay(UIState target) {
        List<StateTransition> path = pathTo(target);
        if (path.isEmpty()) {
            log.debug("No recorded path leads to {}", target.getId());
            return false;
        }
        log.info("Replaying {} recorded action(s) to reach {}", path.size(), target.getId());
        for (StateTransition step : path) {
            try {
                executor.execute(replayable.get(step.getId()));
            } catch (BrowserException e) {
                log.warn("Replay of {} failed: {}", step.getId(), e.getMessage());
                return false;
            }
            UIState expected = session.getState(step.getToState()).orElseThrow();
            if (!session.matches(observe(), expected)) {
                log.warn("Replay of {} did not land on {}", step.getId(), expected.getId());
                return false;
            }
        }
        return true;
    }

    /**
     * Walks recorded transitions backwards from {@code target}, nearest
     * predecessors first, and returns the path from the first one the browser
     * is on or can reach by URL. The browser is left on that start state.
     */
    private List<StateTransition> pathTo(UIState target) {
        Map<String, StateTransition> towardTarget = new HashMap<>();
        Set<String> seen = new HashSet<>();
        seen.add(target.getId());
        Deque<String> frontier = new ArrayDeque<>();
        frontier.add(target.getId());
        while (!frontier.isEmpty()) {
            String node = frontier.poll();
            for (StateTransition t : session.getTransitions()) {
                if (!t.getToState().equals(node) || !replayable.containsKey(t.getId())) continue;
                String from = t.getFromState();
                if (!seen.add(from)) continue;
                towardTarget.put(from, t);
                UIState start = session.getState(from).orElseThrow();
                if (session.matches(observe(), start) || reachByUrl(start)) {
                    List<StateTransition> path = new ArrayList<>();
                    for (String at = from; !at.equals(target.getId()); at = towardTarget.get(at).getToState()) {
                        path.add(towardTarget.get(at));
                    }
                    return path;
                }
                frontier.add(from);
            }
        }
        return List.of();
    }

    private Optional<PageObservation> jumpTo(UIState state) {
        try {
            browser.navigate(state.getEntryUrl());
            return Optional.of(observe());
        } catch (BrowserException e) {
            log.warn("Navigation to {} ({}) failed: {}", state.getId(), state.getEntryUrl(), e.getMessage());
            return Optional.empty();
        }
    }

    private PageObservation observe() {
        StabilityWait.forStable(browser, config.getStabilityDeadline(), config.getStabilityPoll());
        return fingerprinter.observe(browser);
    }

    private void enter(Phase next) {
        if (next != phase) log.debug("Phase {} -> {}", phase, next);
        phase = next;
    }
}
