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
import me.golemcore.repeater.domain.exception.ElementActionException;
import me.golemcore.repeater.domain.exception.ElementNotFoundException;
import me.golemcore.repeater.domain.exception.LoopSpecException;
import me.golemcore.repeater.domain.model.RepeatReport;
import me.golemcore.repeater.domain.model.ToolDefinition;
import me.golemcore.repeater.domain.model.ToolFailureKind;
import me.golemcore.repeater.domain.model.ToolResult;
import me.golemcore.repeater.domain.service.RepeatActionService;
import me.golemcore.repeater.infrastructure.config.RepeaterProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Tool that repeats a single page interaction under for / while / do-while
 * semantics.
 *
 * <p>
 * Loop types:
 * <ul>
 * <li>for - {@code loop.iterations} actions, unconditionally
 * <li>while - stop condition checked before each action
 * <li>do-while - stop condition checked after each action
 * </ul>
 *
 * <p>
 * While / do-while loops are bounded by {@code limits.maxIterations} (default
 * 20) and by the element-attached timeout.
 *
 * <p>
 * The output is the JSON-serialized {@link RepeatReport}; the report object
 * itself is attached as structured data.
 *
 * @see RepeatActionService
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RepeatActionTool implements ToolComponent {

    private static final String TYPE_STRING = "string";
    private static final String TYPE_OBJECT = "object";
    private static final String TYPE_INTEGER = "integer";
    private static final String TYPE_BOOLEAN = "boolean";
    private static final String PARAM_REF = "ref";
    private static final String PARAM_ELEMENT = "element";

    private final RepeatActionRequestParser requestParser;
    private final RepeatActionService repeatActionService;
    private final ObjectMapper objectMapper;
    private final RepeaterProperties properties;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("repeat_action")
                .title("Repeat Action")
                .description("Repeats a user action (click, hover, fill, press) using for / while / do-while "
                        + "semantics")
                .readOnly(true)
                .inputSchema(Map.of(
                        "type", TYPE_OBJECT,
                        "properties", Map.of(
                                "loop", loopSchema(),
                                "action", actionSchema(),
                                "limits", Map.of(
                                        "type", TYPE_OBJECT,
                                        "properties", Map.of(
                                                "maxIterations", Map.of(
                                                        "type", TYPE_INTEGER,
                                                        "minimum", 1,
                                                        "description",
                                                        "Safety cap for while / do-while loops (default 20)")))),
                        "required", List.of("loop", "action")))
                .build();
    }

    private Map<String, Object> loopSchema() {
        return Map.of(
                "type", TYPE_OBJECT,
                "properties", Map.of(
                        "type", Map.of(
                                "type", TYPE_STRING,
                                "enum", List.of("for", "while", "do-while")),
                        "iterations", Map.of(
                                "type", TYPE_INTEGER,
                                "minimum", 0,
                                "description", "Number of repetitions, required for 'for' loops"),
                        "until", Map.of(
                                "type", TYPE_OBJECT,
                                "description", "Stop condition, required for 'while' and 'do-while' loops",
                                "properties", Map.of(
                                        PARAM_REF, elementRefSchema(),
                                        PARAM_ELEMENT, elementDescriptionSchema(),
                                        "assertion", Map.of(
                                                "type", TYPE_OBJECT,
                                                "properties", Map.of(
                                                        "assertionType", Map.of(
                                                                "type", TYPE_STRING,
                                                                "enum", List.of("toBeVisible", "toBeHidden",
                                                                        "toBeEnabled", "toBeDisabled"))),
                                                "required", List.of("assertionType")),
                                        "negate", Map.of(
                                                "type", TYPE_BOOLEAN,
                                                "description", "Invert the assertion result")),
                                "required", List.of(PARAM_REF, "assertion"))),
                "required", List.of("type"));
    }

    private Map<String, Object> actionSchema() {
        return Map.of(
                "type", TYPE_OBJECT,
                "properties", Map.of(
                        PARAM_REF, elementRefSchema(),
                        PARAM_ELEMENT, elementDescriptionSchema(),
                        "type", Map.of(
                                "type", TYPE_STRING,
                                "enum", List.of("click", "hover", "fill", "press")),
                        "value", Map.of(
                                "type", TYPE_STRING,
                                "description", "Text for 'fill', key name for 'press'")),
                "required", List.of(PARAM_REF, "type"));
    }

    private static Map<String, Object> elementRefSchema() {
        return Map.of("type", TYPE_STRING, "description", "Exact target element reference (selector)");
    }

    private static Map<String, Object> elementDescriptionSchema() {
        return Map.of("type", TYPE_STRING, "description", "Human-readable element description");
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                RepeatReport report = repeatActionService.repeat(requestParser.parse(parameters));
                String output = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
                return ToolResult.success(output, report);
            } catch (LoopSpecException e) {
                log.warn("repeat_action rejected: {}", e.getMessage());
                return ToolResult.failure(ToolFailureKind.INVALID_INPUT, "repeat_action: " + e.getMessage());
            } catch (ElementNotFoundException e) {
                log.warn("repeat_action aborted: {}", e.getMessage());
                return ToolResult.failure(ToolFailureKind.ELEMENT_NOT_FOUND, e.getMessage());
            } catch (ElementActionException e) {
                log.warn("repeat_action aborted: {}", e.getMessage());
                return ToolResult.failure(ToolFailureKind.ACTION_FAILED, e.getMessage());
            } catch (JsonProcessingException e) {
                log.error("Failed to serialize repeat_action report", e);
                return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                        "Failed to serialize report: " + e.getOriginalMessage());
            } catch (RuntimeException e) {
                log.error("repeat_action failed", e);
                return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                        "Failed to repeat action: " + e.getMessage());
            }
        });
    }

    @Override
    public boolean isEnabled() {
        return properties.getBrowser().isEnabled();
    }
}
