package me.golemcore.repeater.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties bound from application.properties under the
 * {@code repeater.*} prefix.
 *
 * <ul>
 * <li>{@link BrowserProperties} - headless browser and element timeouts</li>
 * <li>{@link LoopProperties} - repeat loop defaults and pacing</li>
 * </ul>
 *
 * @since 0.1
 */
@Component
@ConfigurationProperties(prefix = "repeater")
@Data
public class RepeaterProperties {

    private BrowserProperties browser = new BrowserProperties();
    private LoopProperties loop = new LoopProperties();

    // ==================== BROWSER ====================

    @Data
    public static class BrowserProperties {
        private boolean enabled = true;
        private boolean headless = true;
        private String userAgent;

        /**
         * How long element operations wait for the element to attach. Also bounds
         * the total wall-clock duration of a while / do-while repeat loop.
         */
        private long elementAttachedTimeoutMs = 30000L;
    }

    // ==================== LOOP ====================

    @Data
    public static class LoopProperties {

        /**
         * Iteration cap for while / do-while loops when the request has no
         * {@code limits.maxIterations}.
         */
        private int defaultMaxIterations = 20;

        // Pause after each for-loop iteration so DOM-mutating actions can settle.
        private long forDelayMs = 300L;

        private long conditionalDelayMs = 100L;
    }
}
