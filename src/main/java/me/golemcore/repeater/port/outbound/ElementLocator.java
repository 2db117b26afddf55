package me.golemcore.repeater.port.outbound;

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
 * Handle to an element on the current page.
 *
 * <p>
 * Interactions fail with
 * {@link me.golemcore.repeater.domain.exception.ElementActionException} when
 * the element cannot be interacted with. State checks return {@code false}
 * for a missing element instead of failing.
 */
public interface ElementLocator {

    boolean isAttached();

    void click();

    void hover();

    void fill(String value);

    void press(String key);

    boolean isVisible();

    boolean isHidden();

    boolean isEnabled();

    boolean isDisabled();
}
