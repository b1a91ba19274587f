package uimbt.browser;

import org.openqa.selenium.By;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uimbt.model.ElementDescriptor;
import uimbt.model.LocatorStrategy;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds the live {@link WebElement} for an {@link ElementDescriptor} by trying
 * its strategies in priority order: test id → role+name → label →
 * placeholder → name attribute → text → href.
 *
 * <p>Only displayed elements count as a match. Role+name lookups select
 * candidates by the role's native and ARIA selectors, then compare the
 * browser-computed accessible name.
 */
public class ElementResolver {

    private static final Logger log = LoggerFactory.getLogger(ElementResolver.class);

    /** CSS selecting the elements that carry each implicit or explicit role. */
    static final Map<String, String> ROLE_SELECTORS = Map.ofEntries(
            Map.entry("button", "button, [role='button'], input[type='submit'], input[type='button'], input[type='reset']"),
            Map.entry("link", "a[href], [role='link']"),
            Map.entry("textbox", "input:not([type]), input[type='text'], input[type='email'], input[type='password'], "
                    + "input[type='tel'], input[type='url'], textarea, [role='textbox']"),
            Map.entry("searchbox", "input[type='search'], [role='searchbox']"),
            Map.entry("combobox", "select, [role='combobox']"),
            Map.entry("checkbox", "input[type='checkbox'], [role='checkbox']"),
            Map.entry("radio", "input[type='radio'], [role='radio']"),
            Map.entry("spinbutton", "input[type='number'], [role='spinbutton']"),
            Map.entry("tab", "[role='tab']"),
            Map.entry("menuitem", "[role='menuitem']"));

    private final WebDriver driver;

    public ElementResolver(WebDriver driver) {
        this.driver = driver;
    }

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * A role-only strategy (no accessible name) is tried last whatever its
     * rank, since it matches any element of that role.
     *
     * @return the first displayed element matched by the highest-priority
     *         strategy that finds one, or empty if every strategy fails
     */
    public Optional<WebElement> resolve(ElementDescriptor descriptor) {
        List<LocatorStrategy> ordered = new ArrayList<>(descriptor.strategies());
        // a role without a name is ambiguous: try it after every other strategy
        ordered.sort(Comparator.comparing(LocatorStrategy::isRoleOnly));
        for (LocatorStrategy strategy : ordered) {
            log.debug("Trying [{}]: {}", strategy.kind(), strategy.describe());
            WebElement element = tryStrategy(strategy);
            if (element != null) {
                log.debug("Located {} with {}", descriptor, strategy.kind());
                return Optional.of(element);
            }
        }
        log.debug("All locator strategies failed for {}", descriptor);
        return Optional.empty();
    }

    // ── Strategies ────────────────────────────────────────────────────────

    private WebElement tryStrategy(LocatorStrategy s) {
        String v = s.value();
        try {
            return switch (s.kind()) {
                case TEST_ID     -> firstDisplayed(By.cssSelector("[data-testid=" + cssString(v) + "]"));
                case ROLE_NAME   -> byRoleAndName(s.role(), v);
                case LABEL       -> firstDisplayed(By.xpath(labelXpath(v)));
                case PLACEHOLDER -> firstDisplayed(By.cssSelector("[placeholder=" + cssString(v) + "]"));
                case NAME        -> firstDisplayed(By.name(v));
                case TEXT        -> firstDisplayed(By.xpath(textXpath(v)));
                case HREF        -> byHref(v);
            };
        } catch (NoSuchElementException | StaleElementReferenceException e) {
            log.debug("[{}] not found: {}", s.kind(), v);
            return null;
        }
    }

    private WebElement byRoleAndName(String role, String name) {
        String css = ROLE_SELECTORS.getOrDefault(role, "[role='" + role + "']");
        List<WebElement> candidates = driver.findElements(By.cssSelector(css));
        WebElement caseInsensitive = null;
        for (WebElement el : candidates) {
            if (!isDisplayed(el)) continue;
            if (name == null || name.isEmpty()) return el;
            String accessible = accessibleName(el);
            if (accessible.equals(name)) return el;
            if (caseInsensitive == null && accessible.equalsIgnoreCase(name)) caseInsensitive = el;
        }
        return caseInsensitive;
    }

    private WebElement byHref(String href) {
        for (WebElement el : driver.findElements(By.cssSelector("a[href]"))) {
            if (!isDisplayed(el)) continue;
            if (href.equals(el.getDomAttribute("href")) || href.equals(el.getDomProperty("href"))) return el;
        }
        return null;
    }

    private WebElement firstDisplayed(By by) {
        for (WebElement el : driver.findElements(by)) {
            if (isDisplayed(el)) return el;
        }
        return null;
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private static boolean isDisplayed(WebElement el) {
        try {
            return el.isDisplayed();
        } catch (WebDriverException e) {
            return false;
        }
    }

    /** Browser-computed accessible name, falling back to aria-label and text. */
    static String accessibleName(WebElement el) {
        try {
            String name = el.getAccessibleName();
            if (name != null && !name.isBlank()) return name.strip();
        } catch (WebDriverException | UnsupportedOperationException e) {
            log.debug("Accessible name unavailable: {}", e.getMessage());
        }
        String label = el.getDomAttribute("aria-label");
        if (label != null && !label.isBlank()) return label.strip();
        String text = el.getText();
        return text == null ? "" : text.strip();
    }

    static String labelXpath(String label) {
        String lit = xpathLiteral(label);
        String byFor = "//label[normalize-space(.)=" + lit + "]/@for";
        return "//input[@id=" + byFor + "] | //textarea[@id=" + byFor + "] | //select[@id=" + byFor + "]"
                + " | //label[normalize-space(.)=" + lit + "]//input"
                + " | //*[@aria-label=" + lit + "]";
    }

    static String textXpath(String text) {
        String lit = xpathLiteral(text);
        return "//*[normalize-space(text())=" + lit + "] | //input[@type='submit' and @value=" + lit + "]";
    }

    /** XPath string literal for arbitrary text, including mixed quotes. */
    static String xpathLiteral(String s) {
        if (!s.contains("'")) return "'" + s + "'";
        if (!s.contains("\"")) return "\"" + s + "\"";
        StringBuilder sb = new StringBuilder("concat(");
        String[] parts = s.split("'", -1);
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) sb.append(", \"'\", ");
            sb.append('\'').append(parts[i]).append('\'');
        }
        return sb.append(')').toString();
    }

    private static String cssString(String s) {
        return '"' + s.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
