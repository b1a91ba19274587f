package uimbt.browser;

import uimbt.model.ElementDescriptor;

import java.time.Duration;
import java.util.Optional;

/**
 * The browser-automation collaborator the discovery engine drives: one page,
 * blocking calls, no parallelism.
 *
 * <p>Interaction methods throw {@link BrowserException} on failure, and so
 * does {@link #isBusy()}. {@link #accessibilitySnapshot()} and
 * {@link #locate} degrade to {@code null}/empty instead.
 */
public interface BrowserSession extends AutoCloseable {

    /** Loads {@code url} and waits for the document to be ready. */
    void navigate(String url);

    String currentUrl();

    String title();

    /**
     * Indented accessibility snapshot of the page body, or {@code null} when
     * the browser cannot provide one.
     */
    String accessibilitySnapshot();

    /**
     * True while the page shows a busy indicator ({@code aria-busy}, spinner).
     *
     * @throws BrowserException if the page cannot be queried;
     *         {@link StabilityWait} treats that as not busy
     */
    boolean isBusy();

    /**
     * Waits until no network request has been in flight for a short quiet
     * period.
     *
     * @return {@code false} if {@code timeout} elapsed first
     */
    boolean waitForNetworkIdle(Duration timeout);

    /** History back. */
    void back();

    /** Resolves the descriptor's strategies in priority order. */
    Optional<PageElement> locate(ElementDescriptor descriptor);

    @Override
    void close();
}
