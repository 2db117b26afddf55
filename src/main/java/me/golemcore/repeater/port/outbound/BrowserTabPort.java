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

import me.golemcore.repeater.domain.model.BrowserPage;
import me.golemcore.repeater.domain.model.ElementRef;

import java.util.concurrent.CompletableFuture;

/**
 * Port for the browser tab the tools operate on. Resolves element references
 * on the currently loaded page and serializes multi-step interactions through
 * a completion scope.
 */
public interface BrowserTabPort {

    /**
     * Navigate the tab to a URL.
     */
    CompletableFuture<BrowserPage> navigate(String url);

    /**
     * Resolve an element reference on the current page. The returned locator is
     * lazy: it does not require the element to be attached.
     *
     * @throws me.golemcore.repeater.domain.exception.ElementNotFoundException
     *             if the reference is structurally invalid or no page is open
     */
    ElementLocator locate(ElementRef elementRef);

    /**
     * Open a scope during which no other tab operation interleaves. The scope
     * must be closed on every exit path.
     */
    CompletionScope openCompletionScope();

    /**
     * Check if browser is available.
     */
    boolean isAvailable();
}
