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
 * An element reference could not be resolved on the current page.
 */
public class ElementNotFoundException extends RepeatActionException {

    private static final long serialVersionUID = 1L;

    private final transient ElementRef elementRef;
    private final String reason;

    public ElementNotFoundException(ElementRef elementRef, String reason) {
        super("Element not found: " + (elementRef != null ? elementRef.describe() : "<none>") + " - " + reason);
        this.elementRef = elementRef;
        this.reason = reason;
    }

    public ElementRef getElementRef() {
        return elementRef;
    }

    public String getReason() {
        return reason;
    }
}
