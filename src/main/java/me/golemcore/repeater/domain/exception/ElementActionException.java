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

import me.golemcore.repeater.domain.model.ElementRef;

/**
 * An element was resolved but interacting with it or reading its state failed,
 * e.g. because it is not interactable.
 */
public class ElementActionException extends RepeatActionException {

    private static final long serialVersionUID = 1L;

    private final String operation;
    private final transient ElementRef elementRef;

    public ElementActionException(String operation, ElementRef elementRef, Throwable cause) {
        super(operation + " failed on " + (elementRef != null ? elementRef.describe() : "<none>") + ": "
                + (cause != null ? cause.getMessage() : "unknown error"), cause);
        this.operation = operation;
        this.elementRef = elementRef;
    }

    /**
     * Locator operation that failed, e.g. {@code click} or {@code isEnabled}.
     */
    public String getOperation() {
        return operation;
    }

    public ElementRef getElementRef() {
        return elementRef;
    }
}
