package uimbt.browser;

/**
 * A live element located on the current page.
 */
public interface PageElement {

    /** Clicks the element. @throws BrowserException if the click fails */
    void click();

    /** Replaces the element's value with {@code value}. @throws BrowserException if it cannot be filled */
    void fill(String value);
}
