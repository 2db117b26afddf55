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

import me.golemcore.repeater.domain.exception.LoopSpecException;
import me.golemcore.repeater.domain.model.ActionSpec;
import me.golemcore.repeater.domain.model.ActionType;
import me.golemcore.repeater.domain.model.AssertionType;
import me.golemcore.repeater.domain.model.Limits;
import me.golemcore.repeater.domain.model.LoopSpec;
import me.golemcore.repeater.domain.model.LoopType;
import me.golemcore.repeater.domain.model.RepeatActionRequest;
import me.golemcore.repeater.domain.model.StopCondition;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Maps raw repeat_action tool parameters onto a typed request.
 *
 * <p>
 * Unsupported enum values and wrongly typed fields are rejected here with the
 * offending parameter path. Missing fields are left {@code null} for
 * {@link me.golemcore.repeater.domain.service.RepeatActionRequestValidator}.
 */
@Component
public class RepeatActionRequestParser {

    public RepeatActionRequest parse(Map<String, Object> parameters) {
        Map<String, Object> loop = object(parameters, "loop", "loop");
        Map<String, Object> action = object(parameters, "action", "action");
        Map<String, Object> limits = object(parameters, "limits", "limits");

        return RepeatActionRequest.builder()
                .loop(loop != null ? parseLoop(loop) : null)
                .action(action != null ? parseAction(action) : null)
                .limits(limits != null ? parseLimits(limits) : null)
                .build();
    }

    private LoopSpec parseLoop(Map<String, Object> loop) {
        Map<String, Object> until = object(loop, "until", "loop.until");
        return LoopSpec.builder()
                .type(enumValue(loop, "type", "loop.type", LoopType::fromCode))
                .iterations(integer(loop, "iterations", "loop.iterations"))
                .until(until != null ? parseCondition(until) : null)
                .build();
    }

    private StopCondition parseCondition(Map<String, Object> until) {
        Map<String, Object> assertion = object(until, "assertion", "loop.until.assertion");
        AssertionType assertionType = assertion != null
                ? enumValue(assertion, "assertionType", "loop.until.assertion.assertionType",
                        AssertionType::fromCode)
                : null;
        Object negate = until.get("negate");
        if (negate != null && !(negate instanceof Boolean)) {
            throw new LoopSpecException("loop.until.negate", "must be a boolean");
        }

        return StopCondition.builder()
                .ref(string(until, "ref", "loop.until.ref"))
                .element(string(until, "element", "loop.until.element"))
                .assertion(assertionType != null ? new StopCondition.Assertion(assertionType) : null)
                .negate(Boolean.TRUE.equals(negate))
                .build();
    }

    private ActionSpec parseAction(Map<String, Object> action) {
        return ActionSpec.builder()
                .ref(string(action, "ref", "action.ref"))
                .element(string(action, "element", "action.element"))
                .type(enumValue(action, "type", "action.type", ActionType::fromCode))
                .value(string(action, "value", "action.value"))
                .build();
    }

    private Limits parseLimits(Map<String, Object> limits) {
        return Limits.builder()
                .maxIterations(integer(limits, "maxIterations", "limits.maxIterations"))
                .build();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> object(Map<String, Object> source, String key, String path) {
        Object value = source.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw new LoopSpecException(path, "must be an object");
        }
        return (Map<String, Object>) value;
    }

    private static String string(Map<String, Object> source, String key, String path) {
        Object value = source.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            throw new LoopSpecException(path, "must be a string");
        }
        return text;
    }

    private static Integer integer(Map<String, Object> source, String key, String path) {
        Object value = source.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number number) || !isInt(number.doubleValue())) {
            throw new LoopSpecException(path, "must be an integer");
        }
        return number.intValue();
    }

    private static boolean isInt(double value) {
        return Double.isFinite(value) && value == Math.rint(value)
                && value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
    }

    private static <E extends Enum<E>> E enumValue(Map<String, Object> source, String key, String path,
            Function<String, Optional<E>> lookup) {
        String code = string(source, key, path);
        if (code == null) {
            return null;
        }
        return lookup.apply(code)
                .orElseThrow(() -> new LoopSpecException(path, "has unsupported value \"" + code + "\""));
    }
}
