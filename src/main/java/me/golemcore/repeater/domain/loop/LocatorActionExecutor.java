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

import me.golemcore.repeater.domain.exception.ElementNotFoundException;
import me.golemcore.repeater.domain.exception.LoopSpecException;
import me.golemcore.repeater.domain.model.ActionSpec;
import me.golemcore.repeater.domain.model.ElementRef;
import me.golemcore.repeater.port.outbound.BrowserTabPort;
import me.golemcore.repeater.port.outbound.ElementLocator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs actions through element locators of the browser tab.
 *
 * <p>
 * The value of fill / press is checked before the element is resolved, so a
 * malformed action never touches the page.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocatorActionExecutor implements ActionExecutor {

    private final BrowserTabPort browserTabPort;

    @Override
    public void run(ActionSpec action) {
        if (action.getType().isValueRequired() && action.getValue() == null) {
            throw new LoopSpecException("action.value",
                    "is required for \"" + action.getType().getCode() + "\" actions");
        }

        ElementRef elementRef = action.elementRef();
        ElementLocator locator = browserTabPort.locate(elementRef);
        if (!locator.isAttached()) {
            throw new ElementNotFoundException(elementRef, "no matching element on the current page");
        }

        Runnable interaction = switch (action.getType()) {
        case CLICK -> locator::click;
        case HOVER -> locator::hover;
        case FILL -> () -> locator.fill(action.getValue());
        case PRESS -> () -> locator.press(action.getValue());
        };
        log.trace("[Repeat] {} on {}", action.getType().getCode(), elementRef.describe());
        interaction.run();
    }
}
