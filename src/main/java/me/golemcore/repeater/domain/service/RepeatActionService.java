package me.golemcore.repeater.domain.service;

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

import me.golemcore.repeater.domain.loop.LoopController;
import me.golemcore.repeater.domain.loop.LoopOutcome;
import me.golemcore.repeater.domain.model.RepeatActionRequest;
import me.golemcore.repeater.domain.model.RepeatReport;
import me.golemcore.repeater.infrastructure.config.RepeaterProperties;
import me.golemcore.repeater.port.outbound.BrowserTabPort;
import me.golemcore.repeater.port.outbound.CompletionScope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point of a repeat_action invocation: validates the request, runs the
 * loop inside a tab completion scope and builds the report.
 *
 * <p>
 * Invalid input and collaborator failures propagate to the caller unchanged.
 * The completion scope is released on every exit path.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RepeatActionService {

    private final RepeatActionRequestValidator validator;
    private final LoopController loopController;
    private final RepeatReportBuilder reportBuilder;
    private final BrowserTabPort browserTabPort;
    private final RepeaterProperties properties;

    public RepeatReport repeat(RepeatActionRequest request) {
        validator.validate(request);
        int maxIterations = resolveMaxIterations(request);

        log.info("[Repeat] starting {} loop: {} on {}", request.getLoop().getType().getCode(),
                request.getAction().getType().getCode(), request.getAction().elementRef().describe());

        LoopOutcome outcome;
        try (CompletionScope ignored = browserTabPort.openCompletionScope()) {
            outcome = loopController.run(request.getLoop(), request.getAction(), maxIterations);
        }

        return reportBuilder.build(outcome.iterations(), request.getLoop(), request.getAction(),
                outcome.evidence());
    }

    private int resolveMaxIterations(RepeatActionRequest request) {
        if (request.getLimits() != null && request.getLimits().getMaxIterations() != null) {
            return request.getLimits().getMaxIterations();
        }
        return properties.getLoop().getDefaultMaxIterations();
    }
}
