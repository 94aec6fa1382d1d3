package io.deskflow.action.web;

import io.deskflow.action.Action;
import io.deskflow.action.ActionException;
import io.deskflow.action.ActionParams;
import io.deskflow.action.ExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Web actions delegating to a {@link BrowserBackend}. {@code wait_for} and
 * {@code download} enforce their own deadlines; the runner never times out a step.
 */
public final class WebAction implements Action {
    private static final Logger log = LoggerFactory.getLogger(WebAction.class);
    private static final long DEFAULT_WAIT_TIMEOUT_MS = 10_000L;
    private static final long DEFAULT_DOWNLOAD_TIMEOUT_MS = 30_000L;
    private static final long DEFAULT_STABLE_MS = 1_000L;
    private static final long POLL_INTERVAL_MS = 100L;

    public enum Operation {
        OPEN("open"),
        CLICK("click"),
        FILL("fill"),
        SELECT("select"),
        UPLOAD("upload"),
        WAIT_FOR("wait_for"),
        DOWNLOAD("download"),
        EVALUATE("evaluate"),
        SCREENSHOT("screenshot");

        private final String actionName;

        Operation(String actionName) {
            this.actionName = actionName;
        }

        public String actionName() {
            return actionName;
        }
    }

    private final Operation operation;
    private final BrowserBackend backend;
    private final ScreenshotMask mask;

    public WebAction(Operation operation, BrowserBackend backend, ScreenshotMask mask) {
        this.operation = operation;
        this.backend = backend;
        this.mask = mask == null ? ScreenshotMask.NONE : mask;
    }

    public static List<WebAction> all(BrowserBackend backend, ScreenshotMask mask) {
        List<WebAction> out = new ArrayList<>();
        for (Operation op : Operation.values()) {
            out.add(new WebAction(op, backend, mask));
        }
        return out;
    }

    @Override
    public String name() {
        return operation.actionName();
    }

    @Override
    public Object execute(Map<String, Object> selector, Map<String, Object> params, ExecutionContext context) {
        ActionParams p = ActionParams.of(name(), withSelector(selector, params));
        try {
            return switch (operation) {
                case OPEN -> open(p);
                case CLICK -> click(p);
                case FILL -> fill(p);
                case SELECT -> select(p);
                case UPLOAD -> upload(p);
                case WAIT_FOR -> waitFor(p);
                case DOWNLOAD -> download(p);
                case EVALUATE -> evaluate(p);
                case SCREENSHOT -> screenshot(p);
            };
        } catch (ActionException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ActionException("interrupted", name() + " interrupted", e);
        } catch (RuntimeException e) {
            throw ActionException.backend(name(), e);
        }
    }

    private Object open(ActionParams p) {
        String url = p.requireString("url");
        backend.open(url, new BrowserOptions(
                p.string("profile", null),
                p.bool("headless", true),
                p.string("proxy", null)
        ));
        return url;
    }

    private Object click(ActionParams p) {
        String locator = p.requireString("selector");
        backend.click(locator, p.string("frame", null));
        return locator;
    }

    private Object fill(ActionParams p) {
        String locator = p.requireString("selector");
        String value = p.string("value", "");
        backend.fill(locator, value, p.string("frame", null));
        return value;
    }

    private Object select(ActionParams p) {
        String locator = p.requireString("selector");
        List<String> values = p.stringList(p.has("values") ? "values" : "value");
        if (values.isEmpty()) {
            throw ActionException.invalidParams(name(), "missing 'value'");
        }
        return backend.select(locator, values, p.string("frame", null));
    }

    private Object upload(ActionParams p) {
        String locator = p.requireString("selector");
        List<Path> files = new ArrayList<>();
        for (String raw : p.stringList(p.has("files") ? "files" : "path")) {
            Path file = Path.of(raw);
            if (!Files.isRegularFile(file)) {
                throw new ActionException("file_not_found", "upload file not found: " + file);
            }
            files.add(file);
        }
        if (files.isEmpty()) {
            throw ActionException.invalidParams(name(), "missing 'files'");
        }
        backend.upload(locator, files, p.string("frame", null));
        return files.stream().map(Path::toString).toList();
    }

    private Object waitFor(ActionParams p) throws InterruptedException {
        WaitCondition condition = WaitCondition.fromParams(p);
        long timeoutMs = p.longValue("timeout", DEFAULT_WAIT_TIMEOUT_MS);
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (true) {
            if (backend.isSatisfied(condition)) {
                return condition.kind() == WaitCondition.Kind.EXPRESSION ? Boolean.TRUE : condition.value();
            }
            if (System.currentTimeMillis() >= deadline) {
                throw ActionException.timeout(name(), timeoutMs);
            }
            Thread.sleep(POLL_INTERVAL_MS);
        }
    }

    private Object download(ActionParams p) throws InterruptedException {
        String locator = p.requireString("selector");
        long timeoutMs = p.longValue("timeout", DEFAULT_DOWNLOAD_TIMEOUT_MS);
        long stableMs = p.longValue("stable", DEFAULT_STABLE_MS);
        Path target = p.has("path") ? Path.of(p.string("path", "")) : null;
        Path saved = backend.startDownload(locator, p.string("frame", null), target);
        if (saved == null) {
            throw new ActionException("download_failed", "backend returned no download file");
        }
        long deadline = System.currentTimeMillis() + timeoutMs;
        long lastSize = -1L;
        long stableSince = -1L;
        while (true) {
            long now = System.currentTimeMillis();
            if (Files.exists(saved)) {
                long size = size(saved);
                if (size == lastSize) {
                    if (stableSince < 0L) {
                        stableSince = now;
                    } else if (now - stableSince >= stableMs) {
                        if (size == 0L) {
                            throw new ActionException("download_failed", "downloaded file is empty: " + saved);
                        }
                        return saved.toString();
                    }
                } else {
                    lastSize = size;
                    stableSince = -1L;
                }
            }
            if (now >= deadline) {
                throw ActionException.timeout(name(), timeoutMs);
            }
            Thread.sleep(POLL_INTERVAL_MS);
        }
    }

    private Object evaluate(ActionParams p) {
        return backend.evaluate(p.requireString("script"), p.raw("arg"));
    }

    private Object screenshot(ActionParams p) {
        byte[] image = backend.screenshot(p.string("selector", null), p.bool("fullPage", false));
        image = applyMask(image);
        String path = p.string("path", null);
        if (path == null || path.isBlank()) {
            return image.length;
        }
        Path file = Path.of(path);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(file, image);
        } catch (IOException e) {
            throw new ActionException("io_error", "failed to write screenshot: " + file, e);
        }
        return file.toString();
    }

    private byte[] applyMask(byte[] image) {
        try {
            return mask.apply(image);
        } catch (RuntimeException e) {
            log.warn("Screenshot mask failed, keeping original image: {}", e.getMessage());
            return image;
        }
    }

    private static long size(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            throw new ActionException("io_error", "failed to stat download: " + file, e);
        }
    }

    private static Map<String, Object> withSelector(Map<String, Object> selector, Map<String, Object> params) {
        // A step may carry the web locator either in params.selector or as selector.css.
        if (params.containsKey("selector") || selector == null || !selector.containsKey("css")) {
            return params;
        }
        Map<String, Object> merged = new LinkedHashMap<>(params);
        merged.put("selector", selector.get("css"));
        return merged;
    }
}
