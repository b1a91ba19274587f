package uimbt.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uimbt.state.SimilarityWeights;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

/**
 * Reads {@code config.properties} from the classpath and exposes typed
 * discovery settings with defaults.
 *
 * <p>A {@code config.local.properties} file on the classpath overrides the
 * base file; CLI options override both through the setters.
 */
public class DiscoveryConfig {

    private static final Logger log = LoggerFactory.getLogger(DiscoveryConfig.class);

    private static final String CONFIG_FILE       = "config.properties";
    private static final String CONFIG_LOCAL_FILE = "config.local.properties";

    // Property keys
    static final String KEY_BROWSER             = "browser.name";
    static final String KEY_HEADLESS            = "browser.headless";
    static final String KEY_PAGE_LOAD_TIMEOUT   = "browser.page.load.timeout.sec";
    static final String KEY_STRATEGY            = "discovery.strategy";
    static final String KEY_MAX_STATES          = "discovery.max.states";
    static final String KEY_MAX_DEPTH           = "discovery.max.depth";
    static final String KEY_THRESHOLD           = "discovery.similarity.threshold";
    static final String KEY_MAX_LINKS           = "discovery.max.links";
    static final String KEY_MAX_BUTTONS         = "discovery.max.buttons";
    static final String KEY_SAFE_BUTTONS        = "discovery.safe.buttons";
    static final String KEY_SAFE_LINK_TOKENS    = "discovery.safe.link.tokens";
    static final String KEY_DESTRUCTIVE_TOKENS  = "discovery.destructive.tokens";
    static final String KEY_FORMS_ENABLED       = "discovery.forms.enabled";
    static final String KEY_FORM_SAMPLE_VALUE   = "discovery.form.sample.value";
    static final String KEY_NETWORK_IDLE_MS     = "discovery.network.idle.timeout.ms";
    static final String KEY_SETTLE_MS           = "discovery.action.settle.ms";
    static final String KEY_STABILITY_MS        = "discovery.stability.deadline.ms";
    static final String KEY_STABILITY_POLL_MS   = "discovery.stability.poll.ms";
    static final String KEY_OUTPUT_FILE         = "discovery.output.file";
    static final String KEY_WEIGHT_PREFIX       = "similarity.weight.";

    // Defaults
    private static final String  DEFAULT_BROWSER            = "chrome";
    private static final boolean DEFAULT_HEADLESS           = true;
    private static final int     DEFAULT_PAGE_LOAD_TIMEOUT  = 30;
    private static final int     DEFAULT_MAX_STATES         = 100;
    private static final int     DEFAULT_MAX_DEPTH          = 10;
    private static final double  DEFAULT_THRESHOLD          = 0.80;
    private static final int     DEFAULT_MAX_LINKS          = 30;
    private static final int     DEFAULT_MAX_BUTTONS        = 20;
    private static final String  DEFAULT_SAFE_BUTTONS       =
            "New,Add,Edit,View,Show,Cancel,Close,Search,Filter,Create,Upload,Refresh,Submit,Save,Update,Confirm,OK,Yes";
    private static final String  DEFAULT_SAFE_LINK_TOKENS   =
            "overview,dashboard,devices,faults,admin,config,presets,provisions,files,tasks,users,permissions,virtualparameters";
    private static final String  DEFAULT_DESTRUCTIVE_TOKENS = "delete,remove,destroy,drop,logout,log out,sign out";
    private static final boolean DEFAULT_FORMS_ENABLED      = true;
    private static final String  DEFAULT_FORM_SAMPLE_VALUE  = "mbt-sample";
    private static final long    DEFAULT_NETWORK_IDLE_MS    = 5000L;
    private static final long    DEFAULT_SETTLE_MS          = 500L;
    private static final long    DEFAULT_STABILITY_MS       = 2000L;
    private static final long    DEFAULT_STABILITY_POLL_MS  = 200L;
    private static final String  DEFAULT_OUTPUT_FILE        = "fsm_graph.json";

    private final Properties props;

    /**
     * Loads configuration from the classpath; a missing base file leaves
     * every setting at its default.
     */
    public DiscoveryConfig() {
        props = new Properties();
        loadBase();
        loadLocalOverrides();
    }

    /** Package-private constructor for tests. */
    DiscoveryConfig(Properties props) {
        this.props = props;
    }

    /** All defaults, no classpath lookup. */
    public static DiscoveryConfig defaults() {
        return new DiscoveryConfig(new Properties());
    }

    // ── Browser ───────────────────────────────────────────────────────────

    /** chrome, edge or firefox (default: chrome). */
    public String getBrowser() {
        return props.getProperty(KEY_BROWSER, DEFAULT_BROWSER).trim();
    }

    public boolean isHeadless() {
        return getBool(KEY_HEADLESS, DEFAULT_HEADLESS);
    }

    public Duration getPageLoadTimeout() {
        return Duration.ofSeconds(getInt(KEY_PAGE_LOAD_TIMEOUT, DEFAULT_PAGE_LOAD_TIMEOUT));
    }

    // ── Exploration limits ────────────────────────────────────────────────

    public ExplorationStrategy getStrategy() {
        String raw = props.getProperty(KEY_STRATEGY);
        try {
            return ExplorationStrategy.fromNullable(raw);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid strategy '{}', using DFS", raw);
            return ExplorationStrategy.DFS;
        }
    }

    /** Upper bound on registered states (default: 100). */
    public int getMaxStates() {
        return Math.max(1, getInt(KEY_MAX_STATES, DEFAULT_MAX_STATES));
    }

    /** Maximum DFS recursion depth (default: 10). */
    public int getMaxDepth() {
        return Math.max(0, getInt(KEY_MAX_DEPTH, DEFAULT_MAX_DEPTH));
    }

    /** Similarity at or above which an observation is a known state (default: 0.80). */
    public double getSimilarityThreshold() {
        double t = getDouble(KEY_THRESHOLD, DEFAULT_THRESHOLD);
        if (t <= 0.0 || t > 1.0) {
            log.warn("Similarity threshold {} outside (0, 1], using {}", t, DEFAULT_THRESHOLD);
            return DEFAULT_THRESHOLD;
        }
        return t;
    }

    // ── Action discovery ──────────────────────────────────────────────────

    public int getMaxLinks() {
        return getInt(KEY_MAX_LINKS, DEFAULT_MAX_LINKS);
    }

    public int getMaxButtons() {
        return getInt(KEY_MAX_BUTTONS, DEFAULT_MAX_BUTTONS);
    }

    /** Allow-list of button words, lower-cased. */
    public Set<String> getSafeButtons() {
        return splitToSet(props.getProperty(KEY_SAFE_BUTTONS, DEFAULT_SAFE_BUTTONS));
    }

    public Set<String> getSafeLinkTokens() {
        return splitToSet(props.getProperty(KEY_SAFE_LINK_TOKENS, DEFAULT_SAFE_LINK_TOKENS));
    }

    public Set<String> getDestructiveTokens() {
        return splitToSet(props.getProperty(KEY_DESTRUCTIVE_TOKENS, DEFAULT_DESTRUCTIVE_TOKENS));
    }

    public boolean isFormsEnabled() {
        return getBool(KEY_FORMS_ENABLED, DEFAULT_FORMS_ENABLED);
    }

    /** Neutral value typed into text fields during form exploration. */
    public String getFormSampleValue() {
        return props.getProperty(KEY_FORM_SAMPLE_VALUE, DEFAULT_FORM_SAMPLE_VALUE);
    }

    // ── Waits ─────────────────────────────────────────────────────────────

    public Duration getNetworkIdleTimeout() {
        return Duration.ofMillis(getLong(KEY_NETWORK_IDLE_MS, DEFAULT_NETWORK_IDLE_MS));
    }

    /** Fixed wait used when the network does not go idle in time. */
    public Duration getActionSettle() {
        return Duration.ofMillis(getLong(KEY_SETTLE_MS, DEFAULT_SETTLE_MS));
    }

    public Duration getStabilityDeadline() {
        return Duration.ofMillis(getLong(KEY_STABILITY_MS, DEFAULT_STABILITY_MS));
    }

    public Duration getStabilityPoll() {
        return Duration.ofMillis(getLong(KEY_STABILITY_POLL_MS, DEFAULT_STABILITY_POLL_MS));
    }

    public String getOutputFile() {
        return props.getProperty(KEY_OUTPUT_FILE, DEFAULT_OUTPUT_FILE).trim();
    }

    // ── Similarity ────────────────────────────────────────────────────────

    /**
     * Similarity weights; each {@code similarity.weight.<name>} key overrides
     * the matching default. Invalid combinations fall back to the defaults.
     */
    public SimilarityWeights getSimilarityWeights() {
        SimilarityWeights d = SimilarityWeights.defaults();
        try {
            return new SimilarityWeights(
                    weight("semantic", d.semantic()),
                    weight("functional", d.functional()),
                    weight("structural", d.structural()),
                    weight("content", d.content()),
                    weight("landmarks", d.landmarks()),
                    weight("interactive_count", d.interactiveCount()),
                    weight("headings", d.headings()),
                    weight("key_landmarks", d.keyLandmarks()),
                    weight("aria_states", d.ariaStates()),
                    weight("buttons", d.buttons()),
                    weight("links", d.links()),
                    weight("inputs", d.inputs()),
                    weight("title", d.title()),
                    weight("main_heading", d.mainHeading()),
                    weight("count_tolerance", d.countTolerance()));
        } catch (IllegalArgumentException e) {
            log.warn("Invalid similarity weights ({}), using defaults", e.getMessage());
            return d;
        }
    }

    // ── Overrides ─────────────────────────────────────────────────────────

    public void setBrowser(String browser)                  { props.setProperty(KEY_BROWSER, browser); }
    public void setHeadless(boolean headless)               { props.setProperty(KEY_HEADLESS, String.valueOf(headless)); }
    public void setStrategy(ExplorationStrategy strategy)   { props.setProperty(KEY_STRATEGY, strategy.name()); }
    public void setMaxStates(int maxStates)                 { props.setProperty(KEY_MAX_STATES, String.valueOf(maxStates)); }
    public void setMaxDepth(int maxDepth)                   { props.setProperty(KEY_MAX_DEPTH, String.valueOf(maxDepth)); }
    public void setSimilarityThreshold(double threshold)    { props.setProperty(KEY_THRESHOLD, String.valueOf(threshold)); }
    public void setFormsEnabled(boolean enabled)            { props.setProperty(KEY_FORMS_ENABLED, String.valueOf(enabled)); }
    public void setSafeButtons(List<String> words)          { props.setProperty(KEY_SAFE_BUTTONS, String.join(",", words)); }
    public void setOutputFile(String outputFile)            { props.setProperty(KEY_OUTPUT_FILE, outputFile); }

    /** Sets short waits, for tests that drive an in-memory browser. */
    public void setWaits(long networkIdleMs, long settleMs, long stabilityMs, long pollMs) {
        props.setProperty(KEY_NETWORK_IDLE_MS, String.valueOf(networkIdleMs));
        props.setProperty(KEY_SETTLE_MS, String.valueOf(settleMs));
        props.setProperty(KEY_STABILITY_MS, String.valueOf(stabilityMs));
        props.setProperty(KEY_STABILITY_POLL_MS, String.valueOf(pollMs));
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private void loadBase() {
        try (InputStream base = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (base == null) {
                log.warn("Classpath resource not found: {}, all discovery settings use defaults", CONFIG_FILE);
                return;
            }
            props.load(base);
            log.debug("Loaded base config from {}", CONFIG_FILE);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load " + CONFIG_FILE, e);
        }
    }

    private void loadLocalOverrides() {
        try (InputStream local = getClass().getClassLoader().getResourceAsStream(CONFIG_LOCAL_FILE)) {
            if (local != null) {
                props.load(local);
                log.debug("Applied local overrides from {}", CONFIG_LOCAL_FILE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {}, using base config only: {}", CONFIG_LOCAL_FILE, e.getMessage());
        }
    }

    private double weight(String name, double defaultValue) {
        return getDouble(KEY_WEIGHT_PREFIX + name, defaultValue);
    }

    private int getInt(String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private long getLong(String key, long defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid long for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private double getDouble(String key, double defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid number for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private boolean getBool(String key, boolean defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        return Boolean.parseBoolean(raw.trim());
    }

    /** Comma-separated → trimmed, lower-cased, ordered set. */
    private static Set<String> splitToSet(String csv) {
        if (csv == null || csv.isBlank()) return Collections.emptySet();
        Set<String> result = new LinkedHashSet<>();
        for (String token : csv.split(",")) {
            String trimmed = token.trim().toLowerCase(Locale.ROOT);
            if (!trimmed.isEmpty()) result.add(trimmed);
        }
        return Collections.unmodifiableSet(result);
    }
}
