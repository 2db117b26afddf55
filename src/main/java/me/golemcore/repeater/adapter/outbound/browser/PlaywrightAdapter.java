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

import me.golemcore.repeater.domain.exception.ElementNotFoundException;
import me.golemcore.repeater.domain.model.BrowserPage;
import me.golemcore.repeater.domain.model.ElementRef;
import me.golemcore.repeater.infrastructure.config.RepeaterProperties;
import me.golemcore.repeater.port.outbound.BrowserTabPort;
import me.golemcore.repeater.port.outbound.CompletionScope;
import me.golemcore.repeater.port.outbound.ElementLocator;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.LoadState;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Playwright implementation of {@link BrowserTabPort}: one headless Chromium
 * tab shared by all tools.
 *
 * <p>
 * Element references are Playwright selectors ({@code css=}, {@code text=},
 * {@code role=}, or a bare CSS selector) resolved against the page currently
 * loaded in the tab.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code repeater.browser.enabled} - Enable/disable browser
 * <li>{@code repeater.browser.headless} - Run in headless mode
 * <li>{@code repeater.browser.element-attached-timeout-ms} - Default timeout of
 * element operations and navigation (ms)
 * <li>{@code repeater.browser.user-agent} - Custom user agent
 * </ul>
 *
 * <p>
 * Lazy initialization: Browser is only launched on first use. The completion
 * scope is a fair reentrant lock over the tab; closing it waits for the page to
 * reach DOMCONTENTLOADED before releasing.
 *
 * @see me.golemcore.repeater.tools.RepeatActionTool
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlaywrightAdapter implements BrowserTabPort {

    private final RepeaterProperties properties;
    private final ReentrantLock tabLock = new ReentrantLock(true);

    private Playwright playwright;
    private Browser browser;
    private BrowserContext context;
    private volatile Page page;
    private volatile boolean initialized = false;

    @SuppressWarnings("PMD.CloseResource")
    private synchronized void ensureInitialized() {
        if (initialized || !properties.getBrowser().isEnabled()) {
            return;
        }

        Playwright pw = null;
        Browser br = null;
        try {
            pw = Playwright.create();
            BrowserType.LaunchOptions launchOptions = new BrowserType.LaunchOptions()
                    .setHeadless(properties.getBrowser().isHeadless());
            br = pw.chromium().launch(launchOptions);

            Browser.NewContextOptions contextOptions = new Browser.NewContextOptions();
            String userAgent = properties.getBrowser().getUserAgent();
            if (userAgent != null && !userAgent.isBlank()) {
                contextOptions.setUserAgent(userAgent);
            }

            this.context = br.newContext(contextOptions);
            this.context.setDefaultTimeout(properties.getBrowser().getElementAttachedTimeoutMs());
            this.browser = br;
            this.playwright = pw;
            initialized = true;

            log.info("Playwright browser initialized (headless: {})", properties.getBrowser().isHeadless());
        } catch (Exception e) {
            log.warn("Failed to initialize Playwright: {}", e.getMessage());
            // Clean up partially created resources to prevent process leaks
            if (br != null) {
                try {
                    br.close();
                } catch (Exception ex) {
                    log.trace("Error closing browser resource: {}", ex.getMessage());
                }
            }
            if (pw != null) {
                try {
                    pw.close();
                } catch (Exception ex) {
                    log.trace("Error closing browser resource: {}", ex.getMessage());
                }
            }
        }
    }

    @PreDestroy
    public void destroy() {
        close();
    }

    @Override
    public CompletableFuture<BrowserPage> navigate(String url) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            if (!isAvailable()) {
                throw new IllegalStateException("Browser not available or disabled");
            }

            try (CompletionScope ignored = openCompletionScope()) {
                Page tab = currentTab();
                tab.navigate(url);
                tab.waitForLoadState(LoadState.DOMCONTENTLOADED);
                return BrowserPage.builder()
                        .url(tab.url())
                        .title(tab.title())
                        .build();
            }
        });
    }

    @Override
    public ElementLocator locate(ElementRef elementRef) {
        if (elementRef == null || elementRef.ref() == null || elementRef.ref().isBlank()) {
            throw new ElementNotFoundException(elementRef, "element reference is empty");
        }
        Page tab = page;
        if (tab == null || tab.isClosed()) {
            throw new ElementNotFoundException(elementRef, "no page is open in the browser tab");
        }
        try {
            return new PlaywrightElementLocator(tab.locator(elementRef.ref()), elementRef);
        } catch (PlaywrightException e) {
            throw new ElementNotFoundException(elementRef, "invalid selector: " + e.getMessage());
        }
    }

    @Override
    public CompletionScope openCompletionScope() {
        tabLock.lock();
        return () -> {
            try {
                awaitSettled();
            } finally {
                tabLock.unlock();
            }
        };
    }

    private void awaitSettled() {
        Page tab = page;
        if (tab == null || tab.isClosed()) {
            return;
        }
        try {
            tab.waitForLoadState(LoadState.DOMCONTENTLOADED);
        } catch (PlaywrightException e) {
            log.debug("Page did not settle before releasing the tab: {}", e.getMessage());
        }
    }

    private Page currentTab() {
        if (page == null || page.isClosed()) {
            page = context.newPage();
        }
        return page;
    }

    public void close() {
        try {
            if (page != null) {
                page.close();
            }
            if (context != null) {
                context.close();
            }
            if (browser != null) {
                browser.close();
            }
            if (playwright != null) {
                playwright.close();
            }
            log.info("Playwright browser closed");
        } catch (Exception e) {
            log.error("Error closing Playwright browser", e);
        }
    }

    @Override
    public boolean isAvailable() {
        return properties.getBrowser().isEnabled() && browser != null && browser.isConnected();
    }
}
