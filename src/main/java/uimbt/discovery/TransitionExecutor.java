package uimbt.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uimbt.browser.BrowserException;
import uimbt.browser.BrowserSession;
import uimbt.browser.PageElement;
import uimbt.browser.StabilityWait;
import uimbt.model.ElementDescriptor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes an {@link ActionCandidate} against the browser and waits for the
 * page to settle.
 *
 * <p>The returned action data names the fields that were filled; typed values
 * are never recorded.
 */
public class TransitionExecutor {

    private static final Logger log = LoggerFactory.getLogger(TransitionExecutor.class);

    private final BrowserSession browser;
    private final DiscoveryConfig config;

    public TransitionExecutor(BrowserSession browser, DiscoveryConfig config) {
        this.browser = browser;
        this.config  = config;
    }

    /**
     * @return action data for the transition
     * @throws BrowserException if the trigger cannot be located or activated
     */
    public Map<String, Object> execute(ActionCandidate action) {
        log.debug("Executing {}", action);
        Map<String, Object> data = switch (action.type()) {
            case CLICK, NAVIGATE -> {
                click(action.trigger());
                yield new LinkedHashMap<>();
            }
            case FILL_FORM -> fillForm(action);
            case SUBMIT -> {
                click(action.submit());
                yield new LinkedHashMap<>();
            }
        };
        awaitSettled();
        return data;
    }

    // ── Primitives, shared with the login flow ───────────────────────────

    public void click(ElementDescriptor descriptor) {
        require(descriptor).click();
    }

    public void fill(ElementDescriptor descriptor, String value) {
        require(descriptor).fill(value);
    }

    /**
     * Waits for network idle, falling back to a short fixed wait on timeout,
     * then for the page's busy indicator to clear.
     */
    public void awaitSettled() {
        if (!browser.waitForNetworkIdle(config.getNetworkIdleTimeout())) {
            StabilityWait.pause(config.getActionSettle());
        }
        StabilityWait.forStable(browser, config.getStabilityDeadline(), config.getStabilityPoll());
    }

    // ── Internal ──────────────────────────────────────────────────────────

    private Map<String, Object> fillForm(ActionCandidate action) {
        List<String> filled = new ArrayList<>();
        for (FormField field : action.fields()) {
            String value = "spinbutton".equals(field.role()) ? "1" : config.getFormSampleValue();
            try {
                fill(field.descriptor(), value);
                filled.add(field.name().isEmpty() ? field.role() : field.name());
            } catch (BrowserException e) {
                log.debug("Skipping field {}: {}", field.descriptor(), e.getMessage());
            }
        }
        if (filled.isEmpty()) {
            throw new BrowserException("No field of form '" + action.label() + "' could be filled");
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("fields", filled);
        if (action.submit() != null) {
            click(action.submit());
            data.put("submitted", true);
        }
        return data;
    }

    private PageElement require(ElementDescriptor descriptor) {
        return browser.locate(descriptor)
                .orElseThrow(() -> new BrowserException("Element not found: " + descriptor));
    }
}
