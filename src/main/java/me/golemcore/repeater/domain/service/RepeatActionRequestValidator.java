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

import me.golemcore.repeater.domain.exception.LoopSpecException;
import me.golemcore.repeater.domain.model.ActionSpec;
import me.golemcore.repeater.domain.model.LoopSpec;
import me.golemcore.repeater.domain.model.RepeatActionRequest;
import me.golemcore.repeater.domain.model.StopCondition;
import org.springframework.stereotype.Component;

/**
 * Rejects structurally invalid repeat requests before any iteration runs.
 */
@Component
public class RepeatActionRequestValidator {

    private static final String IS_REQUIRED = "is required";

    public void validate(RepeatActionRequest request) {
        if (request == null || request.getLoop() == null) {
            throw new LoopSpecException("loop", IS_REQUIRED);
        }
        if (request.getAction() == null) {
            throw new LoopSpecException("action", IS_REQUIRED);
        }
        validateLoop(request.getLoop());
        validateAction(request.getAction());

        if (request.getLimits() != null && request.getLimits().getMaxIterations() != null
                && request.getLimits().getMaxIterations() < 1) {
            throw new LoopSpecException("limits.maxIterations", "must be a positive integer");
        }
    }

    private void validateLoop(LoopSpec loop) {
        if (loop.getType() == null) {
            throw new LoopSpecException("loop.type", IS_REQUIRED);
        }
        if (loop.getType().isConditional()) {
            if (loop.getUntil() == null) {
                throw LoopSpecException.missingUntil(loop.getType());
            }
            validateCondition(loop.getUntil());
            return;
        }
        if (loop.getIterations() == null) {
            throw LoopSpecException.missingIterations();
        }
        if (loop.getIterations() < 0) {
            throw new LoopSpecException("loop.iterations", "must not be negative");
        }
    }

    private void validateCondition(StopCondition until) {
        if (isBlank(until.getRef())) {
            throw new LoopSpecException("loop.until.ref", IS_REQUIRED);
        }
        if (until.assertionType() == null) {
            throw new LoopSpecException("loop.until.assertion.assertionType", IS_REQUIRED);
        }
    }

    private void validateAction(ActionSpec action) {
        if (action.getType() == null) {
            throw new LoopSpecException("action.type", IS_REQUIRED);
        }
        if (isBlank(action.getRef())) {
            throw new LoopSpecException("action.ref", IS_REQUIRED);
        }
        if (action.getType().isValueRequired() && action.getValue() == null) {
            throw new LoopSpecException("action.value",
                    "is required for \"" + action.getType().getCode() + "\" actions");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
