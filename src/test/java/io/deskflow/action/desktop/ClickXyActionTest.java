package io.deskflow.action.desktop;

import io.deskflow.action.ActionException;
import io.deskflow.action.ExecutionContext;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.Map;
import java.util.Optional;

final class ClickXyActionTest {
    private static final Map<String, Object> WINDOW = Map.of("title", "Invoices");

    private final ExecutionContext context = new ExecutionContext("run-1", "desktop", Map.of());
    private PointerDevice pointer;
    private DesktopLocator locator;
    private ClickXyAction action;

    @BeforeEach
    void setUp() {
        pointer = Mockito.mock(PointerDevice.class);
        Mockito.when(pointer.dpi()).thenReturn(120);
        locator = Mockito.mock(DesktopLocator.class);
        Mockito.when(locator.windowBounds(WINDOW)).thenReturn(Optional.of(new Bounds(100, 50, 800, 600)));
        action = new ClickXyAction(pointer, new CoordinateResolver(locator));
    }

    @Test
    void previewReturnsBasisAdjustedCoordinateWithoutClicking() {
        Coordinate coordinate = (Coordinate) action.execute(WINDOW,
                Map.of("x", 10, "y", 20, "basis", "window", "preview", true), context);

        Assertions.assertEquals(new Point(110, 70), coordinate.screen());
        Assertions.assertEquals(new Point(10, 20), coordinate.relative());
        Assertions.assertEquals(Basis.WINDOW, coordinate.basis());
        Assertions.assertEquals(120, coordinate.dpi());
        Assertions.assertTrue(coordinate.preview());
        Mockito.verify(pointer, Mockito.never()).click(Mockito.any());
    }

    @Test
    void clicksAtTheSameCoordinateWhenNotPreviewing() {
        Coordinate preview = (Coordinate) action.execute(WINDOW,
                Map.of("x", 10, "y", 20, "basis", "window", "preview", true), context);
        Coordinate clicked = (Coordinate) action.execute(WINDOW,
                Map.of("x", 10, "y", 20, "basis", "window"), context);

        Assertions.assertEquals(preview.screen(), clicked.screen());
        Assertions.assertFalse(clicked.preview());
        Mockito.verify(pointer).click(new Point(110, 70));
    }

    @Test
    void screenBasisIsTheDefault() {
        Coordinate coordinate = (Coordinate) action.execute(Map.of(), Map.of("x", 5, "y", 6), context);

        Assertions.assertEquals(Basis.SCREEN, coordinate.basis());
        Mockito.verify(pointer).click(new Point(5, 6));
        Mockito.verifyNoInteractions(locator);
    }

    @Test
    void missingElementFailsWithoutClicking() {
        Mockito.when(locator.elementBounds(Mockito.any())).thenReturn(Optional.empty());

        ActionException error = Assertions.assertThrows(ActionException.class,
                () -> action.execute(Map.of("id", "gone"), Map.of("x", 1, "y", 1, "basis", "element"), context));

        Assertions.assertEquals("element_not_found", error.reason());
        Mockito.verify(pointer, Mockito.never()).click(Mockito.any());
    }

    @Test
    void rejectsUnknownBasisAndMissingCoordinates() {
        Assertions.assertEquals("invalid_params", Assertions.assertThrows(ActionException.class,
                () -> action.execute(Map.of(), Map.of("x", 1, "y", 1, "basis", "galaxy"), context)).reason());
        Assertions.assertEquals("invalid_params", Assertions.assertThrows(ActionException.class,
                () -> action.execute(Map.of(), Map.of("x", 1), context)).reason());
    }

    @Test
    void captureRecordsPointerPositionUnlessPreviewing() {
        CaptureStore store = new CaptureStore();
        Mockito.when(pointer.position()).thenReturn(new Point(150, 90));
        CaptureCoordinatesAction capture = new CaptureCoordinatesAction(pointer, new CoordinateResolver(locator), store);

        Coordinate previewed = (Coordinate) capture.execute(WINDOW, Map.of("basis", "window", "preview", true), context);
        Assertions.assertEquals(new Point(50, 40), previewed.relative());
        Assertions.assertTrue(store.list().isEmpty());

        capture.execute(WINDOW, Map.of("basis", "window"), context);
        Assertions.assertEquals(1, store.list().size());
        Assertions.assertEquals(new Point(50, 40), store.list().get(0).relative());
    }

    @Test
    void unknownBasisNamesTheActionBeingExecuted() {
        ActionException click = Assertions.assertThrows(ActionException.class,
                () -> action.execute(Map.of(), Map.of("x", 1, "y", 1, "basis", "galaxy"), context));
        Assertions.assertTrue(click.getMessage().startsWith("click_xy: "), click.getMessage());

        CaptureCoordinatesAction capture = new CaptureCoordinatesAction(pointer, new CoordinateResolver(locator),
                new CaptureStore());
        ActionException captured = Assertions.assertThrows(ActionException.class,
                () -> capture.execute(Map.of(), Map.of("basis", "galaxy"), context));
        Assertions.assertTrue(captured.getMessage().startsWith("capture_coordinates: "), captured.getMessage());
    }

    @Test
    void captureStoreKeepsOnlyTheMostRecentCoordinates() {
        CaptureStore store = new CaptureStore(2);
        Mockito.when(pointer.position()).thenReturn(new Point(1, 1), new Point(2, 2), new Point(3, 3));
        CaptureCoordinatesAction capture = new CaptureCoordinatesAction(pointer, new CoordinateResolver(locator), store);

        for (int i = 0; i < 3; i++) {
            capture.execute(Map.of(), Map.of(), context);
        }

        Assertions.assertEquals(2, store.list().size());
        Assertions.assertEquals(new Point(2, 2), store.list().get(0).screen());
        Assertions.assertEquals(new Point(3, 3), store.list().get(1).screen());
        Assertions.assertThrows(IllegalArgumentException.class, () -> new CaptureStore(0));
    }
}
