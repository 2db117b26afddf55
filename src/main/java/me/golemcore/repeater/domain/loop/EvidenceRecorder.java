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

import me.golemcore.repeater.domain.model.ActionSpec;
import me.golemcore.repeater.domain.model.IterationRecord;
import me.golemcore.repeater.domain.model.LoopType;
import org.springframework.stereotype.Component;

/**
 * Builds the evidence record of a completed iteration.
 */
@Component
public class EvidenceRecorder {

    public IterationRecord record(int iteration, ActionSpec action, LoopType loopType) {
        String message = switch (loopType) {
        case FOR -> "Performed for-loop iteration " + iteration;
        case WHILE -> "Performed while-loop iteration " + iteration;
        case DO_WHILE -> "Performed do-while iteration " + iteration;
        };
        return new IterationRecord(iteration, action, message);
    }
}
