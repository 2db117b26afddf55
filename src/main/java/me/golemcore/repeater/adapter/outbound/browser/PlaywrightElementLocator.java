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

package me.golemcore.repeater.adapter.outbound.browser;

import me.golemcore.repeater.domain.exception.ElementActionException;
import me.golemcore.repeater.domain.model.ElementRef;
import me.golemcore.repeater.port.outbound.ElementLocator;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.PlaywrightException;

import java.util.function.Supplier;

/**
 * {@link ElementLocator} over a Playwright {@link Locator}.
 *
 * <p>
 * State checks answer {@code false} when nothing matches instead of waiting for
 * the element to attach.
 */
class PlaywrightElementLocator implements ElementLocator {

    private final Locator locator;
    private final ElementRef elementRef;

    PlaywrightElementLocator(Locator locator, ElementRef elementRef) {
        this.locator = locator;
        this.elementRef = elementRef;
    }

    @Override
    public boolean isAttached() {
        return call("count", () -> locator.count() > 0);
    }

    @Override
    public void click() {
        run("click", locator::click);
    }

    @Override
    public void hover() {
        run("hover", locator::hover);
    }

    @Override
    public void fill(String value) {
        run("fill", () -> locator.fill(value));
    }

    @Override
    public void press(String key) {
        run("press", () -> locator.press(key));
    }

    @Override
    public boolean isVisible() {
        return call("isVisible", locator::isVisible);
    }

    @Override
    public boolean isHidden() {
        return call("isHidden", locator::isHidden);
    }

    @Override
    public boolean isEnabled() {
        return isAttached() && call("isEnabled", locator::isEnabled);
    }

    @Override
    public boolean isDisabled() {
        return isAttached() && call("isDisabled", locator::isDisabled);
    }

    private void run(String operation, Runnable interaction) {
        try {
            interaction.run();
        } catch (PlaywrightException e) {
            throw new ElementActionException(operation, elementRef, e);
        }
    }

    private <T> T call(String operation, Supplier<T> query) {
        try {
            return query.get();
        } catch (PlaywrightException e) {
            throw new ElementActionException(operation, elementRef, e);
        }
    }
}
