package io.deskflow.action;

import io.deskflow.action.desktop.Bounds;
import io.deskflow.action.desktop.DesktopLocator;
import io.deskflow.action.desktop.Point;
import io.deskflow.action.desktop.PointerDevice;
import io.deskflow.action.image.ImageMatcher;
import io.deskflow.action.image.ImageQuery;
import io.deskflow.action.table.TableBackend;
import io.deskflow.action.table.TableRow;
import io.deskflow.action.web.BrowserBackend;
import io.deskflow.action.web.BrowserOptions;
import io.deskflow.action.web.WaitCondition;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stands in for every backend that has not been configured. Each call fails with
 * reason {@code backend_unavailable}, so only flows that use the family fail.
 */
final class UnavailableBackend implements BrowserBackend, ImageMatcher, PointerDevice, DesktopLocator, TableBackend {
    static final UnavailableBackend INSTANCE = new UnavailableBackend();

    private UnavailableBackend() {
    }

    private static ActionException unavailable(String what) {
        return new ActionException("backend_unavailable", what + " backend is not configured");
    }

    @Override
    public void open(String url, BrowserOptions options) {
        throw unavailable("browser");
    }

    @Override
    public void click(String locator, String frame) {
        throw unavailable("browser");
    }

    @Override
    public void fill(String locator, String value, String frame) {
        throw unavailable("browser");
    }

    @Override
    public List<String> select(String locator, List<String> values, String frame) {
        throw unavailable("browser");
    }

    @Override
    public void upload(String locator, List<Path> files, String frame) {
        throw unavailable("browser");
    }

    @Override
    public boolean isSatisfied(WaitCondition condition) {
        throw unavailable("browser");
    }

    @Override
    public Path startDownload(String locator, String frame, Path target) {
        throw unavailable("browser");
    }

    @Override
    public Object evaluate(String script, Object arg) {
        throw unavailable("browser");
    }

    @Override
    public byte[] screenshot(String locator, boolean fullPage) {
        throw unavailable("browser");
    }

    @Override
    public Optional<Point> find(ImageQuery query) {
        throw unavailable("image matching");
    }

    @Override
    public Point position() {
        throw unavailable("pointer");
    }

    @Override
    public void click(Point screen) {
        throw unavailable("pointer");
    }

    @Override
    public Optional<Bounds> elementBounds(Map<String, Object> selector) {
        throw unavailable("desktop");
    }

    @Override
    public Optional<Bounds> windowBounds(Map<String, Object> selector) {
        throw unavailable("desktop");
    }

    @Override
    public List<TableRow> rows(Map<String, Object> selector) {
        throw unavailable("table");
    }

    @Override
    public void select(Map<String, Object> selector, TableRow row) {
        throw unavailable("table");
    }
}
