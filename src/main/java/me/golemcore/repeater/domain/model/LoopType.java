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
 * Loop discipline of a repeat request.
 *
 * <ul>
 * <li>{@link #FOR} - fixed iteration count, no condition</li>
 * <li>{@link #WHILE} - condition checked before each action</li>
 * <li>{@link #DO_WHILE} - condition checked after each action, so at least one
 * action always runs</li>
 * </ul>
 */
public enum LoopType {
    FOR("for"), WHILE("while"), DO_WHILE("do-while");

    private final String code;

    LoopType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isConditional() {
        return this != FOR;
    }

    public static Optional<LoopType> fromCode(String code) {
        return Arrays.stream(values())
                .filter(type -> type.code.equals(code))
                .findFirst();
    }
}
