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

package me.golemcore.repeater.domain.exception;

import me.golemcore.repeater.domain.model.LoopType;

/**
 * Structurally invalid loop or action specification. Raised before the first
 * iteration, so no evidence exists.
 */
public class LoopSpecException extends RepeatActionException {

    private static final long serialVersionUID = 1L;

    private final String field;
    private final String constraint;

    public LoopSpecException(String field, String constraint) {
        super(field + " " + constraint);
        this.field = field;
        this.constraint = constraint;
    }

    public static LoopSpecException missingIterations() {
        return new LoopSpecException("loop.iterations",
                "is required when loop.type is \"" + LoopType.FOR.getCode() + "\"");
    }

    public static LoopSpecException missingUntil(LoopType type) {
        return new LoopSpecException("loop.until", "is required when loop.type is \"" + type.getCode() + "\"");
    }

    /**
     * Dotted path of the offending parameter, e.g. {@code loop.iterations}.
     */
    public String getField() {
        return field;
    }

    public String getConstraint() {
        return constraint;
    }
}
