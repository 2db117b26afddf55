package me.golemcore.repeater.domain.model;

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

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Page interaction performed once per loop iteration.
 */
public enum ActionType {
    CLICK("click", false), HOVER("hover", false), FILL("fill", true), PRESS("press", true);

    private final String code;
    private final boolean valueRequired;

    ActionType(String code, boolean valueRequired) {
        this.code = code;
        this.valueRequired = valueRequired;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Fill needs the text to type, press needs the key name.
     */
    public boolean isValueRequired() {
        return valueRequired;
    }

    public static Optional<ActionType> fromCode(String code) {
        return Arrays.stream(values())
                .filter(type -> type.code.equals(code))
                .findFirst();
    }
}
