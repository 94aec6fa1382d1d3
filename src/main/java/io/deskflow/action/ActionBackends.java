package io.deskflow.action;

import io.deskflow.action.desktop.DesktopLocator;
import io.deskflow.action.desktop.PointerDevice;
import io.deskflow.action.image.ImageMatcher;
import io.deskflow.action.table.TableBackend;
import io.deskflow.action.web.BrowserBackend;
import io.deskflow.action.web.ScreenshotMask;

/**
 * External capabilities the built-in actions drive. {@link #unavailable()} gives
 * backends that fail every call with {@code backend_unavailable}, so flows using
 * an unconfigured family fail cleanly instead of at startup.
 */
public record ActionBackends(
        BrowserBackend browser,
        ScreenshotMask screenshotMask,
        ImageMatcher imageMatcher,
        PointerDevice pointer,
        DesktopLocator desktopLocator,
        TableBackend table
) {
    public static ActionBackends unavailable() {
        return new ActionBackends(
                UnavailableBackend.INSTANCE,
                ScreenshotMask.NONE,
                UnavailableBackend.INSTANCE,
                UnavailableBackend.INSTANCE,
                UnavailableBackend.INSTANCE,
                UnavailableBackend.INSTANCE
        );
    }

    public ActionBackends withBrowser(BrowserBackend value) {
        return new ActionBackends(value, screenshotMask, imageMatcher, pointer, desktopLocator, table);
    }

    public ActionBackends withImageMatcher(ImageMatcher value) {
        return new ActionBackends(browser, screenshotMask, value, pointer, desktopLocator, table);
    }

    public ActionBackends withPointer(PointerDevice value) {
        return new ActionBackends(browser, screenshotMask, imageMatcher, value, desktopLocator, table);
    }

    public ActionBackends withDesktopLocator(DesktopLocator value) {
        return new ActionBackends(browser, screenshotMask, imageMatcher, pointer, value, table);
    }

    public ActionBackends withTable(TableBackend value) {
        return new ActionBackends(browser, screenshotMask, imageMatcher, pointer, desktopLocator, value);
    }
}
