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

import me.golemcore.repeater.domain.component.ToolComponent;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.util.List;

/**
 * Shared infrastructure beans and startup logging.
 *
 * <p>
 * Logs the effective browser and loop settings and the tools that are
 * registered and enabled.
 *
 * @since 0.1
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final RepeaterProperties properties;
    private final List<ToolComponent> tools;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        RepeaterProperties.BrowserProperties browser = properties.getBrowser();
        RepeaterProperties.LoopProperties loop = properties.getLoop();
        log.info("Browser: enabled={}, headless={}, element timeout={}ms",
                browser.isEnabled(), browser.isHeadless(), browser.getElementAttachedTimeoutMs());
        log.info("Loop defaults: maxIterations={}, for delay={}ms, conditional delay={}ms",
                loop.getDefaultMaxIterations(), loop.getForDelayMs(), loop.getConditionalDelayMs());

        for (ToolComponent tool : tools) {
            log.info("Tool registered: {} (enabled: {})", tool.getToolName(), tool.isEnabled());
        }
    }
}
