package uimbt.fingerprint;

import uimbt.accessibility.AriaNode;
import uimbt.model.Fingerprint;

/**
 * What the engine saw at one moment: the concrete URL, the parsed
 * accessibility tree ({@code null} when capture failed) and the fingerprint
 * derived from both.
 */
public record PageObservation(String url, AriaNode tree, Fingerprint fingerprint) {

    public boolean hasTree() {
        return tree != null;
    }
}
