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

/**
 * Machine-readable classification of tool execution failures.
 *
 * <p>
 * This exists to avoid relying on string matching in tool error messages.
 */
public enum ToolFailureKind {

    /**
     * Tool input was missing a required field or used an unsupported value. No
     * page interaction happened.
     */
    INVALID_INPUT,

    /**
     * A referenced element could not be resolved on the current page.
     */
    ELEMENT_NOT_FOUND,

    /**
     * The element was found but the interaction (click, fill, ...) failed.
     */
    ACTION_FAILED,

    /**
     * Any other runtime failure (browser unavailable, timeouts, interruption,
     * serialization).
     */
    EXECUTION_FAILED
}
