package io.deskflow.action;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

final class ExecutionContextTest {

    @Test
    void sessionLookupReturnsValueOnlyForMatchingType() {
        ExecutionContext context = new ExecutionContext("run-1", "flow", Map.of());
        context.putSession("page", "https://example.test");
        context.putSession("rows", List.of(1, 2));

        Assertions.assertEquals("https://example.test", context.session("page", String.class));
        Assertions.assertEquals(List.of(1, 2), context.session("rows", List.class));
        Assertions.assertNull(context.session("page", Integer.class));
        Assertions.assertNull(context.session("missing", String.class));
    }

    @Test
    void sessionStateIsNotExposedAsVariables() {
        ExecutionContext context = new ExecutionContext("run-1", "flow", Map.of("a", 1));
        context.putSession("page", "p");

        Assertions.assertFalse(context.has("page"));
        Assertions.assertEquals(Map.of("a", 1), context.variables());
        Assertions.assertThrows(IllegalArgumentException.class, () -> context.set(" ", 1));
    }
}
