package uimbt.browser;

import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.support.ui.FluentWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Waits for a page to settle after an action by polling the session's busy
 * indicator with a Selenium {@link FluentWait}. The deadline is soft: when it elapses the caller proceeds with
 * whatever the page shows.
 */
public final class StabilityWait {

    private static final Logger log = LoggerFactory.getLogger(StabilityWait.class);

    public static final Duration DEFAULT_POLL          = Duration.ofMillis(200);
    public static final Duration DEFAULT_SOFT_DEADLINE = Duration.ofMillis(2000);

    private StabilityWait() {}

    public static boolean forStable(BrowserSession session) {
        return forStable(session, DEFAULT_SOFT_DEADLINE, DEFAULT_POLL);
    }

    /**
     * @return {@code true} if the page reported not-busy before the deadline
     */
    public static boolean forStable(BrowserSession session, Duration softDeadline, Duration poll) {
        try {
            new FluentWait<>(session)
                    .withTimeout(softDeadline)
                    .pollingEvery(poll)
                    .until(s -> !busy(s));
            return true;
        } catch (TimeoutException e) {
            log.debug("Page still busy after {}ms, proceeding", softDeadline.toMillis());
            return false;
        } catch (WebDriverException e) {
            // FluentWait wraps an interrupted sleep; the interrupt flag is already restored
            log.debug("Stability wait interrupted: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Sleeps for {@code duration}.
     *
     * @return {@code false} if the thread was interrupted
     */
    public static boolean pause(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static boolean busy(BrowserSession session) {
        try {
            return session.isBusy();
        } catch (BrowserException e) {
            log.debug("Busy check failed: {}", e.getMessage());
            return false;
        }
    }
}
