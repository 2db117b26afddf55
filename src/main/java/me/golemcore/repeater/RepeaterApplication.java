package me.golemcore.repeater;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Repeater.
 *
 * <p>
 * Hosts the {@code repeat_action} browser tool: a single page interaction
 * (click, hover, fill, press) repeated under {@code for}, {@code while} or
 * {@code do-while} semantics, with structured per-iteration evidence and a
 * pass/fail report.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Tool Layer         → RepeatActionTool, BrowserNavigateTool
 * Domain Layer       → LoopController, EvidenceRecorder, RepeatReportBuilder
 * Infrastructure     → PlaywrightAdapter (BrowserTabPort)
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code repeater.*} prefix.
 *
 * @since 0.1
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class RepeaterApplication {

    public static void main(String[] args) {
        SpringApplication.run(RepeaterApplication.class, args);
    }

}
