package uimbt.browser;

import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.edge.EdgeDriver;
import org.openqa.selenium.edge.EdgeOptions;
import org.openqa.selenium.firefox.FirefoxDriver;
import org.openqa.selenium.firefox.FirefoxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Creates WebDriver instances. Selenium Manager resolves the matching driver
 * binary, so no chromedriver/msedgedriver path is configured.
 *
 * <p>Chrome and Edge expose the DevTools accessibility tree; Firefox works
 * but yields URL/title-only fingerprints.
 */
public final class BrowserFactory {

    private static final Logger log = LoggerFactory.getLogger(BrowserFactory.class);

    private BrowserFactory() {}

    public static WebDriver create(String browser, boolean headless) {
        String name = browser == null ? "chrome" : browser.toLowerCase(Locale.ROOT).trim();
        log.info("Starting {} WebDriver (headless={})", name, headless);
        return switch (name) {
            case "chrome" -> {
                ChromeOptions opts = new ChromeOptions();
                if (headless) opts.addArguments("--headless=new");
                opts.addArguments("--window-size=1920,1080");
                yield new ChromeDriver(opts);
            }
            case "edge" -> {
                EdgeOptions opts = new EdgeOptions();
                if (headless) opts.addArguments("--headless=new");
                opts.addArguments("--window-size=1920,1080");
                yield new EdgeDriver(opts);
            }
            case "firefox" -> {
                FirefoxOptions opts = new FirefoxOptions();
                if (headless) opts.addArguments("-headless");
                log.warn("Firefox has no DevTools accessibility tree; fingerprints will use URL and title only");
                yield new FirefoxDriver(opts);
            }
            default -> throw new IllegalArgumentException("Unsupported browser: " + browser
                    + " (expected chrome, edge or firefox)");
        };
    }
}
