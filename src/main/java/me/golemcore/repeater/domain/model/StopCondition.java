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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Predicate over an element's state that ends a while / do-while loop. When
 * {@code negate} is set the loop stops once the assertion does NOT hold.
 */
@Value
@Builder(toBuilder = true)
@AllArgsConstructor
public class StopCondition {

    String ref;
    String element;
    Assertion assertion;
    boolean negate;

    public ElementRef elementRef() {
        return new ElementRef(ref, element);
    }

    public AssertionType assertionType() {
        return assertion != null ? assertion.assertionType() : null;
    }

    public record Assertion(AssertionType assertionType) {
    }
}
