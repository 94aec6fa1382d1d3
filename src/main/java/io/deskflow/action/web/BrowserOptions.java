package io.deskflow.action.web;

public record BrowserOptions(
        String profile,
        boolean headless,
        String proxy
) {
    public static BrowserOptions defaults() {
        return new BrowserOptions(null, true, null);
    }
}
