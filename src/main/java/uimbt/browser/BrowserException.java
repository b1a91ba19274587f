package uimbt.browser;

/**
 * Unchecked exception thrown by browser components when an interaction cannot
 * be completed: element not found, click intercepted, navigation failure, etc.
 */
public class BrowserException extends RuntimeException {

    public BrowserException(String msg) {
        super(msg);
    }

    public BrowserException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
