package uimbt.state;

/**
 * Weights of the similarity dimensions and their sub-scores.
 *
 * <p>Scores are normalized by the weights of the dimensions actually
 * computed, so weights need not sum to one. The style dimension is reserved
 * and carries no weight here.
 */
public record SimilarityWeights(
        double semantic,
        double functional,
        double structural,
        double content,
        double landmarks,
        double interactiveCount,
        double headings,
        double keyLandmarks,
        double ariaStates,
        double buttons,
        double links,
        double inputs,
        double title,
        double mainHeading,
        double countTolerance) {

    public SimilarityWeights {
        double[] all = {semantic, functional, structural, content, landmarks, interactiveCount, headings,
                keyLandmarks, ariaStates, buttons, links, inputs, title, mainHeading, countTolerance};
        for (double w : all) {
            if (w < 0 || Double.isNaN(w)) throw new IllegalArgumentException("Similarity weights must be >= 0");
        }
        if (semantic + functional + structural + content == 0) {
            throw new IllegalArgumentException("At least one similarity dimension needs a weight");
        }
        if (countTolerance >= 1.0) {
            throw new IllegalArgumentException("countTolerance must be < 1.0");
        }
    }

    public static SimilarityWeights defaults() {
        return new SimilarityWeights(
                0.60, 0.25, 0.10, 0.04,
                0.40, 0.20, 0.20, 0.10, 0.10,
                0.40, 0.40, 0.20,
                0.70, 0.30,
                0.20);
    }

    /** Copy with different top-level weights, sub-weights unchanged. */
    public SimilarityWeights withDimensions(double semantic, double functional, double structural, double content) {
        return new SimilarityWeights(semantic, functional, structural, content,
                landmarks, interactiveCount, headings, keyLandmarks, ariaStates,
                buttons, links, inputs, title, mainHeading, countTolerance);
    }
}
