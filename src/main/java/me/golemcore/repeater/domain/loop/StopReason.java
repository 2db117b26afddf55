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

/**
 * Why a repeat loop stopped. All of these are normal termination.
 */
public enum StopReason {

    /**
     * A for-loop ran its full iteration count.
     */
    COMPLETED,

    /**
     * The stop condition of a while / do-while loop held.
     */
    CONDITION_MET,

    /**
     * The iteration cap was reached before the condition held.
     */
    MAX_ITERATIONS,

    /**
     * The wall-clock safety timeout elapsed before the condition held.
     */
    TIMEOUT
}
