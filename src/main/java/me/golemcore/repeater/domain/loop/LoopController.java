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

import me.golemcore.repeater.domain.exception.LoopSpecException;
import me.golemcore.repeater.domain.model.ActionSpec;
import me.golemcore.repeater.domain.model.IterationRecord;
import me.golemcore.repeater.domain.model.LoopSpec;
import me.golemcore.repeater.domain.model.LoopType;
import me.golemcore.repeater.domain.model.StopCondition;
import me.golemcore.repeater.infrastructure.config.RepeaterProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Drives a repeat loop to termination.
 *
 * <p>
 * Disciplines:
 * <ul>
 * <li>for - run the action exactly {@code iterations} times, pausing after
 * each one</li>
 * <li>while - check the iteration cap, the safety timeout and the stop
 * condition before each action; the condition may stop the loop before any
 * action runs</li>
 * <li>do-while - act first, then check the condition, the iteration cap and
 * the safety timeout; at least one action always runs</li>
 * </ul>
 *
 * <p>
 * Reaching the cap or the timeout is normal termination. Failures of the
 * action executor or condition evaluator propagate immediately and no record
 * is produced for the failed iteration.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LoopController {

    private final ActionExecutor actionExecutor;
    private final ConditionEvaluator conditionEvaluator;
    private final EvidenceRecorder evidenceRecorder;
    private final IterationPacer pacer;
    private final RepeaterProperties properties;
    private final Clock clock;

    /**
     * Run the loop described by {@code loop}.
     *
     * @param maxIterations
     *            iteration cap for while / do-while loops; ignored for for-loops
     * @return completed iteration count, ordered evidence and stop reason
     */
    public LoopOutcome run(LoopSpec loop, ActionSpec action, int maxIterations) {
        List<IterationRecord> evidence = new ArrayList<>();
        long startMillis = clock.millis();

        StopReason stopReason = switch (loop.getType()) {
        case FOR -> runFor(requireIterations(loop), action, evidence);
        case WHILE -> runWhile(requireUntil(loop), action, maxIterations, startMillis, evidence);
        case DO_WHILE -> runDoWhile(requireUntil(loop), action, maxIterations, startMillis, evidence);
        };

        log.info("[Repeat] {} loop stopped after {} iteration(s): {} ({} ms)", loop.getType().getCode(),
                evidence.size(), stopReason, clock.millis() - startMillis);
        return new LoopOutcome(evidence.size(), evidence, stopReason);
    }

    private StopReason runFor(int iterations, ActionSpec action, List<IterationRecord> evidence) {
        Duration delay = Duration.ofMillis(properties.getLoop().getForDelayMs());
        for (int iteration = 1; iteration <= iterations; iteration++) {
            performIteration(iteration, action, LoopType.FOR, evidence);
            pacer.pause(delay);
        }
        return StopReason.COMPLETED;
    }

    private StopReason runWhile(StopCondition until, ActionSpec action, int maxIterations, long startMillis,
            List<IterationRecord> evidence) {
        Duration delay = Duration.ofMillis(properties.getLoop().getConditionalDelayMs());
        int iteration = 0;
        while (true) {
            if (iteration >= maxIterations) {
                return StopReason.MAX_ITERATIONS;
            }
            if (isTimedOut(startMillis)) {
                return StopReason.TIMEOUT;
            }
            if (conditionEvaluator.evaluate(until)) {
                return StopReason.CONDITION_MET;
            }
            iteration++;
            performIteration(iteration, action, LoopType.WHILE, evidence);
            pacer.pause(delay);
        }
    }

    private StopReason runDoWhile(StopCondition until, ActionSpec action, int maxIterations, long startMillis,
            List<IterationRecord> evidence) {
        Duration delay = Duration.ofMillis(properties.getLoop().getConditionalDelayMs());
        int iteration = 0;
        while (true) {
            iteration++;
            performIteration(iteration, action, LoopType.DO_WHILE, evidence);
            pacer.pause(delay);

            if (conditionEvaluator.evaluate(until)) {
                return StopReason.CONDITION_MET;
            }
            if (iteration >= maxIterations) {
                return StopReason.MAX_ITERATIONS;
            }
            if (isTimedOut(startMillis)) {
                return StopReason.TIMEOUT;
            }
        }
    }

    private void performIteration(int iteration, ActionSpec action, LoopType loopType,
            List<IterationRecord> evidence) {
        actionExecutor.run(action);
        IterationRecord record = evidenceRecorder.record(iteration, action, loopType);
        evidence.add(record);
        log.debug("[Repeat] {}", record.message());
    }

    private boolean isTimedOut(long startMillis) {
        return clock.millis() - startMillis > properties.getBrowser().getElementAttachedTimeoutMs();
    }

    private static int requireIterations(LoopSpec loop) {
        if (loop.getIterations() == null) {
            throw LoopSpecException.missingIterations();
        }
        return loop.getIterations();
    }

    private static StopCondition requireUntil(LoopSpec loop) {
        if (loop.getUntil() == null) {
            throw LoopSpecException.missingUntil(loop.getType());
        }
        return loop.getUntil();
    }
}
