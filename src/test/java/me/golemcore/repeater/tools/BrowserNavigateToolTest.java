package me.golemcore.repeater.tools;

import me.golemcore.repeater.domain.model.BrowserPage;
import me.golemcore.repeater.domain.model.ToolFailureKind;
import me.golemcore.repeater.domain.model.ToolResult;
import me.golemcore.repeater.infrastructure.config.RepeaterProperties;
import me.golemcore.repeater.port.outbound.BrowserTabPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BrowserNavigateToolTest {

    private BrowserTabPort browserTabPort;
    private RepeaterProperties properties;
    private BrowserNavigateTool tool;

    @BeforeEach
    void setUp() {
        browserTabPort = mock(BrowserTabPort.class);
        properties = new RepeaterProperties();
        tool = new BrowserNavigateTool(browserTabPort, properties);
    }

    @Test
    void shouldReturnValidDefinition() {
        assertEquals("browser_navigate", tool.getDefinition().getName());
        assertFalse(tool.getDefinition().isReadOnly());
    }

    @Test
    void shouldFailWhenUrlIsMissing() {
        ToolResult result = tool.execute(Map.of()).join();

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.INVALID_INPUT, result.getFailureKind());
        assertTrue(result.getError().contains("URL is required"));
    }

    @ParameterizedTest
    @ValueSource(strings = { "javascript:alert(1)", "data:text/html,<h1>test</h1>", "file:///etc/passwd",
            "ftp://example.com" })
    void shouldRejectDangerousUrlSchemes(String url) {
        ToolResult result = tool.execute(Map.of("url", url)).join();

        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("Only http and https URLs are allowed"));
        verify(browserTabPort, never()).navigate(anyString());
    }

    @Test
    void shouldPrependHttpsWhenNoScheme() {
        BrowserPage page = BrowserPage.builder().url("https://example.com/").title("Example Domain").build();
        when(browserTabPort.navigate("https://example.com")).thenReturn(CompletableFuture.completedFuture(page));

        ToolResult result = tool.execute(Map.of("url", "example.com")).join();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().contains("Example Domain"));
        verify(browserTabPort).navigate("https://example.com");
    }

    @Test
    void shouldReturnFailureOnNavigationError() {
        when(browserTabPort.navigate("https://broken.example.com"))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("Browser not available")));

        ToolResult result = tool.execute(Map.of("url", "https://broken.example.com")).join();

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertTrue(result.getError().contains("Browser not available"));
    }
}
