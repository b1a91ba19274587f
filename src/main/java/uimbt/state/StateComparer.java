package uimbt.state;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uimbt.model.AccessibilitySummary;
import uimbt.model.ActionableElement;
import uimbt.model.AriaElementState;
import uimbt.model.AriaStates;
import uimbt.model.Fingerprint;
import uimbt.model.KeyLandmark;
import uimbt.model.UIState;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Weighted similarity between two fingerprints, used to decide whether an
 * observation is a known state.
 *
 * <p>Four dimensions are computed: semantic (accessibility summary),
 * functional (actionable element names), structural (URL pattern) and
 * content (title and main heading). Each dimension and the overall score are
 * weighted averages over {@link SimilarityWeights}, so {@code similarity(fp, fp)}
 * is exactly 1.0 and the score is symmetric.
 */
public class StateComparer {

    private static final Logger log = LoggerFactory.getLogger(StateComparer.class);

    public static final double DEFAULT_THRESHOLD = 0.80;

    private final SimilarityWeights weights;

    public StateComparer() {
        this(SimilarityWeights.defaults());
    }

    public StateComparer(SimilarityWeights weights) {
        this.weights = Objects.requireNonNull(weights, "weights");
    }

    public SimilarityWeights getWeights() { return weights; }

    // ── Public API ────────────────────────────────────────────────────────

    /** Similarity in [0, 1]. */
    public double similarity(Fingerprint a, Fingerprint b) {
        double structural = structuralScore(a, b);
        return weighted(
                new double[] {semanticScore(a, b, structural), functionalScore(a, b), structural, contentScore(a, b)},
                new double[] {weights.semantic(), weights.functional(), weights.structural(), weights.content()});
    }

    /**
     * Finds the known state most similar to {@code fp}. Ties keep the state
     * seen first.
     */
    public StateMatch findMatchingState(Fingerprint fp, Collection<UIState> known, double threshold) {
        UIState best = null;
        double bestScore = 0.0;
        double bestQualified = -1.0;
        for (UIState candidate : known) {
            double score = similarity(fp, candidate.getFingerprint());
            if (score > bestScore) bestScore = score;
            if (score >= threshold && score > bestQualified) {
                best = candidate;
                bestQualified = score;
            }
        }
        if (best != null) {
            log.debug("Matched {} with similarity {}", best.getId(), String.format("%.3f", bestQualified));
        }
        return new StateMatch(best, bestScore);
    }

    // ── Dimensions ────────────────────────────────────────────────────────

    /**
     * Accessibility-summary similarity. Without a summary on either side the
     * URL-based structural score stands in; with a summary on one side only
     * the pages cannot be semantically equal.
     */
    double semanticScore(Fingerprint a, Fingerprint b, double structuralFallback) {
        AccessibilitySummary sa = a.accessibilitySummary();
        AccessibilitySummary sb = b.accessibilitySummary();
        if (sa == null && sb == null) return structuralFallback;
        if (sa == null || sb == null) return 0.0;

        double headings = sa.headingHierarchy().equals(sb.headingHierarchy()) ? 1.0 : 0.5;
        return weighted(
                new double[] {
                        jaccard(sa.landmarkRoles(), sb.landmarkRoles()),
                        countProximity(sa.interactiveCount(), sb.interactiveCount(), weights.countTolerance()),
                        headings,
                        jaccard(landmarkNames(sa), landmarkNames(sb)),
                        ariaStateProximity(sa.ariaStates(), sb.ariaStates())},
                new double[] {weights.landmarks(), weights.interactiveCount(), weights.headings(),
                        weights.keyLandmarks(), weights.ariaStates()});
    }

    double functionalScore(Fingerprint a, Fingerprint b) {
        return weighted(
                new double[] {
                        jaccard(names(a.actionableElements().buttons()), names(b.actionableElements().buttons())),
                        jaccard(names(a.actionableElements().links()), names(b.actionableElements().links())),
                        jaccard(names(a.actionableElements().inputs()), names(b.actionableElements().inputs()))},
                new double[] {weights.buttons(), weights.links(), weights.inputs()});
    }

    /** 1.0 for equal URL patterns, else the share of positionally agreeing segments. */
    double structuralScore(Fingerprint a, Fingerprint b) {
        if (a.urlPattern().equals(b.urlPattern())) return 1.0;
        String[] sa = a.urlPattern().split("/");
        String[] sb = b.urlPattern().split("/");
        int agree = 0;
        for (int i = 0; i < Math.min(sa.length, sb.length); i++) {
            if (sa[i].equals(sb[i])) agree++;
        }
        return (double) agree / Math.max(sa.length, sb.length);
    }

    double contentScore(Fingerprint a, Fingerprint b) {
        return weighted(
                new double[] {
                        Objects.equals(a.title(), b.title()) ? 1.0 : 0.0,
                        Objects.equals(a.mainHeading(), b.mainHeading()) ? 1.0 : 0.0},
                new double[] {weights.title(), weights.mainHeading()});
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    /** Jaccard index; two empty sets are identical. */
    public static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) return 1.0;
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }

    /** 1.0 within {@code tolerance} relative difference, then falling linearly to 0. */
    static double countProximity(int a, int b, double tolerance) {
        if (a == b) return 1.0;
        double diff = (double) Math.abs(a - b) / Math.max(a, b);
        if (diff <= tolerance) return 1.0;
        return Math.max(0.0, 1.0 - (diff - tolerance) / (1.0 - tolerance));
    }

    /**
     * Expanded, selected and checked compare element by element including the
     * value, so a collapsed menu differs from the same menu expanded. Current
     * and disabled compare by count.
     */
    static double ariaStateProximity(AriaStates a, AriaStates b) {
        int max = Math.max(a.disabledCount(), b.disabledCount());
        int curMax = Math.max(a.current().size(), b.current().size());
        double[] scores = {
                jaccard(stateKeys(a.expanded()), stateKeys(b.expanded())),
                jaccard(stateKeys(a.selected()), stateKeys(b.selected())),
                jaccard(stateKeys(a.checked()), stateKeys(b.checked())),
                max == 0 ? 1.0 : (double) Math.min(a.disabledCount(), b.disabledCount()) / max,
                curMax == 0 ? 1.0 : (double) Math.min(a.current().size(), b.current().size()) / curMax};
        double sum = 0.0;
        for (double score : scores) sum += score;
        return sum / scores.length;
    }

    private static Set<String> stateKeys(List<AriaElementState> states) {
        Set<String> out = new HashSet<>();
        for (AriaElementState s : states) {
            out.add(s.role() + ":" + s.name() + "=" + s.value());
        }
        return out;
    }

    private static Set<String> landmarkNames(AccessibilitySummary s) {
        Set<String> out = new HashSet<>();
        for (KeyLandmark k : s.keyLandmarks().values()) {
            out.add(k.role() + ":" + k.name());
        }
        return out;
    }

    private static Set<String> names(List<ActionableElement> elements) {
        Set<String> out = new HashSet<>();
        for (ActionableElement e : elements) {
            out.add(e.name().isBlank() ? e.role() : e.name());
        }
        return out;
    }

    /** Weighted average; a zero total weight scores 0. */
    private static double weighted(double[] scores, double[] w) {
        double num = 0.0;
        double den = 0.0;
        for (int i = 0; i < scores.length; i++) {
            num += w[i] * scores[i];
            den += w[i];
        }
        if (den == 0.0) return 0.0;
        return Math.min(1.0, Math.max(0.0, num / den));
    }
}
