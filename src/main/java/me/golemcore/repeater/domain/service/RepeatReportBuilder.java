package me.golemcore.repeater.domain.service;

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

import me.golemcore.repeater.domain.model.ActionSpec;
import me.golemcore.repeater.domain.model.CheckResult;
import me.golemcore.repeater.domain.model.IterationRecord;
import me.golemcore.repeater.domain.model.LoopSpec;
import me.golemcore.repeater.domain.model.RepeatReport;
import me.golemcore.repeater.domain.model.RepeatSummary;
import me.golemcore.repeater.domain.model.VerdictStatus;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Derives the verdict and the single execution check of a repeat run.
 *
 * <p>
 * A run passes iff at least one iteration completed. Whether a while /
 * do-while condition was actually met, or the loop stopped on its cap or
 * timeout, does not change the verdict.
 */
@Component
public class RepeatReportBuilder {

    static final String CHECK_PROPERTY = "action-execution";
    static final String CONDITIONAL_EXPECTATION = "condition met or maxIterations reached";

    public RepeatReport build(int iterationCount, LoopSpec loop, ActionSpec action,
            List<IterationRecord> evidence) {
        boolean passed = iterationCount > 0;
        VerdictStatus status = VerdictStatus.of(passed);

        RepeatSummary summary = new RepeatSummary(
                iterationCount,
                passed ? 1 : 0,
                passed ? 0 : 1,
                status,
                evidence);

        String expected = loop.getType().isConditional()
                ? CONDITIONAL_EXPECTATION
                : loop.getIterations() + " iterations";
        CheckResult check = new CheckResult(CHECK_PROPERTY, loop.getType().getCode(), expected, iterationCount,
                status);

        return new RepeatReport(action, loop, summary, List.of(check));
    }
}
