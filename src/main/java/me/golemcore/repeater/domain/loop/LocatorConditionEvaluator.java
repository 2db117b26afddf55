package me.golemcore.repeater.domain.loop;

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

import me.golemcore.repeater.domain.model.StopCondition;
import me.golemcore.repeater.port.outbound.BrowserTabPort;
import me.golemcore.repeater.port.outbound.ElementLocator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Evaluates stop conditions through element locators of the browser tab. A
 * missing element is not an error: it is simply not visible / not enabled.
 */
@Component
@RequiredArgsConstructor
public class LocatorConditionEvaluator implements ConditionEvaluator {

    private final BrowserTabPort browserTabPort;

    @Override
    public boolean evaluate(StopCondition condition) {
        ElementLocator locator = browserTabPort.locate(condition.elementRef());
        boolean result = switch (condition.assertionType()) {
        case TO_BE_VISIBLE -> locator.isVisible();
        case TO_BE_HIDDEN -> locator.isHidden();
        case TO_BE_ENABLED -> locator.isEnabled();
        case TO_BE_DISABLED -> locator.isDisabled();
        };
        return condition.isNegate() ? !result : result;
    }
}
