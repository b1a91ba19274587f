package uimbt.browser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.openqa.selenium.ElementClickInterceptedException;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.chromium.HasCdp;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uimbt.accessibility.AxTreeRenderer;
import uimbt.model.ElementDescriptor;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * {@link BrowserSession} backed by a Selenium {@link WebDriver}.
 *
 * <p>The accessibility snapshot comes from the Chrome DevTools protocol
 * ({@code Accessibility.getFullAXTree}) and is rendered by
 * {@link AxTreeRenderer}; drivers without CDP return {@code null}. Network
 * idleness is tracked by counters injected around XHR and fetch.
 */
public class WebDriverSession implements BrowserSession {

    private static final Logger log = LoggerFactory.getLogger(WebDriverSession.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Duration POLL = Duration.ofMillis(200);
    private static final long NETWORK_QUIET_MS = 500L;

    private static final String INSTALL_NETWORK_COUNTERS = """
            if (!window.__mbtNetPending && window.__mbtNetPending !== 0) {
                window.__mbtNetPending = 0;
                window.__mbtLastActivity = Date.now();
                var origOpen = XMLHttpRequest.prototype.open;
                XMLHttpRequest.prototype.open = function() {
                    window.__mbtNetPending++;
                    window.__mbtLastActivity = Date.now();
                    this.addEventListener('loadend', function() {
                        window.__mbtNetPending = Math.max(0, window.__mbtNetPending - 1);
                        window.__mbtLastActivity = Date.now();
                    });
                    origOpen.apply(this, arguments);
                };
                var origFetch = window.fetch;
                if (origFetch) {
                    window.fetch = function() {
                        window.__mbtNetPending++;
                        window.__mbtLastActivity = Date.now();
                        return origFetch.apply(this, arguments).finally(function() {
                            window.__mbtNetPending = Math.max(0, window.__mbtNetPending - 1);
                            window.__mbtLastActivity = Date.now();
                        });
                    };
                }
            }
            """;

    private static final String BUSY_CHECK = """
            var nodes = document.querySelectorAll(
                '[aria-busy="true"], .loading, .spinner, .loader, [role="progressbar"]');
            for (var i = 0; i < nodes.length; i++) {
                var r = nodes[i].getBoundingClientRect();
                if (r.width > 0 && r.height > 0) return true;
            }
            return false;
            """;

    private final WebDriver driver;
    private final ElementResolver resolver;
    private final AxTreeRenderer renderer;
    private final Duration pageLoadTimeout;
    private boolean cdpWarningLogged;

    public WebDriverSession(WebDriver driver, Duration pageLoadTimeout) {
        this(driver, new ElementResolver(driver), new AxTreeRenderer(), pageLoadTimeout);
    }

    WebDriverSession(WebDriver driver, ElementResolver resolver, AxTreeRenderer renderer, Duration pageLoadTimeout) {
        this.driver          = driver;
        this.resolver        = resolver;
        this.renderer        = renderer;
        this.pageLoadTimeout = pageLoadTimeout;
    }

    // ── Navigation ────────────────────────────────────────────────────────

    @Override
    public void navigate(String url) {
        log.debug("Navigating to {}", url);
        try {
            driver.get(url);
        } catch (WebDriverException e) {
            throw new BrowserException("Navigation to " + url + " failed", e);
        }
        waitForDocumentReady();
    }

    @Override
    public void back() {
        try {
            driver.navigate().back();
        } catch (WebDriverException e) {
            throw new BrowserException("History back failed", e);
        }
        waitForDocumentReady();
    }

    @Override
    public String currentUrl() {
        try {
            return driver.getCurrentUrl();
        } catch (WebDriverException e) {
            throw new BrowserException("Cannot read current URL", e);
        }
    }

    @Override
    public String title() {
        try {
            String title = driver.getTitle();
            return title == null ? "" : title;
        } catch (WebDriverException e) {
            log.debug("Cannot read title: {}", e.getMessage());
            return "";
        }
    }

    // ── Page state ────────────────────────────────────────────────────────

    @Override
    public String accessibilitySnapshot() {
        if (!(driver instanceof HasCdp cdp)) {
            if (!cdpWarningLogged) {
                log.warn("{} has no DevTools protocol access, accessibility snapshots disabled",
                        driver.getClass().getSimpleName());
                cdpWarningLogged = true;
            }
            return null;
        }
        try {
            Map<String, Object> result = cdp.executeCdpCommand("Accessibility.getFullAXTree", Map.of());
            JsonNode tree = MAPPER.valueToTree(result);
            String snapshot = renderer.render(tree);
            return snapshot.isBlank() ? null : snapshot;
        } catch (WebDriverException | IllegalArgumentException e) {
            log.warn("Accessibility tree capture failed: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isBusy() {
        try {
            return Boolean.TRUE.equals(((JavascriptExecutor) driver).executeScript(BUSY_CHECK));
        } catch (WebDriverException | ClassCastException e) {
            throw new BrowserException("Busy check failed", e);
        }
    }

    @Override
    public boolean waitForNetworkIdle(Duration timeout) {
        JavascriptExecutor js = (JavascriptExecutor) driver;
        try {
            js.executeScript(INSTALL_NETWORK_COUNTERS);
            new WebDriverWait(driver, timeout, POLL).until(d -> {
                Object pending = js.executeScript("return window.__mbtNetPending || 0;");
                Object lastAct = js.executeScript("return window.__mbtLastActivity || 0;");
                long pendingCount = pending instanceof Number n ? n.longValue() : 0;
                long lastActivity = lastAct instanceof Number n ? n.longValue() : 0;
                return pendingCount == 0 && System.currentTimeMillis() - lastActivity >= NETWORK_QUIET_MS;
            });
            return true;
        } catch (TimeoutException e) {
            log.debug("Network not idle within {}ms", timeout.toMillis());
            return false;
        } catch (WebDriverException e) {
            log.debug("Network idle check unavailable: {}", e.getMessage());
            return false;
        }
    }

    // ── Elements ──────────────────────────────────────────────────────────

    @Override
    public Optional<PageElement> locate(ElementDescriptor descriptor) {
        try {
            return resolver.resolve(descriptor).map(el -> new WebPageElement(el, descriptor));
        } catch (WebDriverException e) {
            log.debug("Locating {} failed: {}", descriptor, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void close() {
        try {
            driver.quit();
        } catch (WebDriverException e) {
            log.warn("WebDriver quit failed: {}", e.getMessage());
        }
    }

    public WebDriver getDriver() { return driver; }

    // ── Internal ──────────────────────────────────────────────────────────

    private void waitForDocumentReady() {
        try {
            new WebDriverWait(driver, pageLoadTimeout, POLL).until(d ->
                    "complete".equals(((JavascriptExecutor) d).executeScript("return document.readyState;")));
        } catch (TimeoutException e) {
            log.warn("Document not ready after {}s, continuing", pageLoadTimeout.toSeconds());
        }
    }

    private final class WebPageElement implements PageElement {
        private final WebElement element;
        private final ElementDescriptor descriptor;

        WebPageElement(WebElement element, ElementDescriptor descriptor) {
            this.element    = element;
            this.descriptor = descriptor;
        }

        @Override
        public void click() {
            log.debug("Clicking {}", descriptor);
            try {
                element.click();
            } catch (ElementClickInterceptedException e) {
                log.debug("Native click intercepted, falling back to JS click on {}", descriptor);
                try {
                    ((JavascriptExecutor) driver).executeScript("arguments[0].click();", element);
                } catch (WebDriverException jsError) {
                    throw new BrowserException("Click failed on " + descriptor, jsError);
                }
            } catch (WebDriverException e) {
                throw new BrowserException("Click failed on " + descriptor, e);
            }
        }

        @Override
        public void fill(String value) {
            try {
                element.clear();
                element.sendKeys(value);
            } catch (WebDriverException e) {
                throw new BrowserException("Fill failed on " + descriptor, e);
            }
        }
    }
}
