package me.golemcore.repeater.adapter.outbound.browser;

import me.golemcore.repeater.domain.exception.ElementNotFoundException;
import me.golemcore.repeater.domain.model.ElementRef;
import me.golemcore.repeater.infrastructure.config.RepeaterProperties;
import me.golemcore.repeater.port.outbound.CompletionScope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlaywrightAdapterTest {

    private RepeaterProperties properties;
    private PlaywrightAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new RepeaterProperties();
        properties.getBrowser().setEnabled(false);
        adapter = new PlaywrightAdapter(properties);
    }

    @Test
    void shouldNotBeAvailableWhenDisabled() {
        assertFalse(adapter.isAvailable());
    }

    @Test
    void shouldFailNavigationWhenDisabled() {
        assertThrows(CompletionException.class, () -> adapter.navigate("https://example.com").join());
    }

    @Test
    void shouldRejectBlankReference() {
        ElementNotFoundException e = assertThrows(ElementNotFoundException.class,
                () -> adapter.locate(new ElementRef("  ", "Submit")));

        assertEquals("element reference is empty", e.getReason());
    }

    @Test
    void shouldRejectLocateWithoutOpenPage() {
        ElementNotFoundException e = assertThrows(ElementNotFoundException.class,
                () -> adapter.locate(new ElementRef("#submit", "Submit")));

        assertEquals("no page is open in the browser tab", e.getReason());
    }

    @Test
    void shouldBlockOtherThreadsUntilScopeIsClosed() throws Exception {
        AtomicBoolean acquired = new AtomicBoolean();
        CompletableFuture<Void> contender;

        try (CompletionScope ignored = adapter.openCompletionScope()) {
            contender = CompletableFuture.runAsync(() -> {
                try (CompletionScope inner = adapter.openCompletionScope()) {
                    acquired.set(true);
                }
            });
            Thread.sleep(100);
            assertFalse(acquired.get());
        }

        contender.get(5, TimeUnit.SECONDS);
        assertTrue(acquired.get());
    }

    @Test
    void shouldAllowNestedScopesOnSameThread() {
        assertDoesNotThrow(() -> {
            try (CompletionScope outer = adapter.openCompletionScope();
                    CompletionScope inner = adapter.openCompletionScope()) {
                assertFalse(adapter.isAvailable());
            }
        });
    }
}
