package io.deskflow.action.web;

@FunctionalInterface
public interface ScreenshotMask {
    ScreenshotMask NONE = bytes -> bytes;

    byte[] apply(byte[] image);
}
