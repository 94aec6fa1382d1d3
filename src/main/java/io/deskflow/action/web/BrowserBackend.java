package io.deskflow.action.web;

import java.nio.file.Path;
import java.util.List;

/**
 * Browser automation capability. Locators are page/element selectors in the
 * backend's own syntax; {@code frame} is an optional frame locator and may be null.
 *
 * <p>Calls block until the backend has performed the operation. Waiting with a
 * deadline is done by the calling action through {@link #isSatisfied}.
 */
public interface BrowserBackend {
    void open(String url, BrowserOptions options);

    void click(String locator, String frame);

    void fill(String locator, String value, String frame);

    List<String> select(String locator, List<String> values, String frame);

    void upload(String locator, List<Path> files, String frame);

    /**
     * Non-blocking check of a wait condition.
     */
    boolean isSatisfied(WaitCondition condition);

    /**
     * Clicks {@code locator} to trigger a download and returns the file being
     * written: {@code target} when given, otherwise a file the backend picks.
     */
    Path startDownload(String locator, String frame, Path target);

    Object evaluate(String script, Object arg);

    byte[] screenshot(String locator, boolean fullPage);
}
