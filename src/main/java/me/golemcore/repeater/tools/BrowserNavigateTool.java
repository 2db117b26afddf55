/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.repeater.tools;

import me.golemcore.repeater.domain.component.ToolComponent;
import me.golemcore.repeater.domain.model.BrowserPage;
import me.golemcore.repeater.domain.model.ToolDefinition;
import me.golemcore.repeater.domain.model.ToolFailureKind;
import me.golemcore.repeater.domain.model.ToolResult;
import me.golemcore.repeater.infrastructure.config.RepeaterProperties;
import me.golemcore.repeater.port.outbound.BrowserTabPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Tool that loads a URL into the shared browser tab, so that element
 * references used by repeat_action resolve against that page.
 *
 * <p>
 * Security:
 * <ul>
 * <li>Only http:// and https:// URLs allowed
 * <li>Blocks javascript:, data:, file:// schemes
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BrowserNavigateTool implements ToolComponent {

    private static final String PARAM_URL = "url";
    private static final long TIMEOUT_SECONDS = 60;

    private final BrowserTabPort browserTabPort;
    private final RepeaterProperties properties;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("browser_navigate")
                .title("Navigate to a URL")
                .description("Open a web page in the browser tab used by repeat_action.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_URL, Map.of(
                                        "type", "string",
                                        "description", "The URL to navigate to")),
                        "required", List.of(PARAM_URL)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            Object rawUrl = parameters.get(PARAM_URL);
            if (!(rawUrl instanceof String) || ((String) rawUrl).isBlank()) {
                return ToolResult.failure(ToolFailureKind.INVALID_INPUT, "URL is required");
            }
            String url = ((String) rawUrl).trim();

            // Only allow http/https schemes to prevent file://, javascript:, data: attacks
            if (!url.startsWith("http://") && !url.startsWith("https://")) {
                if (url.contains("://") || url.startsWith("javascript:") || url.startsWith("data:")
                        || url.startsWith("file:")) {
                    return ToolResult.failure(ToolFailureKind.INVALID_INPUT,
                            "Only http and https URLs are allowed");
                }
                url = "https://" + url;
            }

            try {
                BrowserPage page = browserTabPort.navigate(url).get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
                return ToolResult.success(
                        String.format("Navigated to %s%nTitle: %s", page.getUrl(), page.getTitle()),
                        Map.of("title", page.getTitle() != null ? page.getTitle() : "",
                                PARAM_URL, page.getUrl() != null ? page.getUrl() : url));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Navigation interrupted");
            } catch (Exception e) {
                log.error("Navigation failed for URL: {}", url, e);
                return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                        "Failed to navigate: " + rootMessage(e));
            }
        });
    }

    private static String rootMessage(Throwable e) {
        Throwable current = e;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getMessage();
    }

    @Override
    public boolean isEnabled() {
        return properties.getBrowser().isEnabled();
    }
}
