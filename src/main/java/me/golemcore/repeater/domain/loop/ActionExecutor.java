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

/**
 * Performs the page interaction of one loop iteration.
 */
public interface ActionExecutor {

    /**
     * Run the action once.
     *
     * @throws me.golemcore.repeater.domain.exception.ElementNotFoundException
     *             if the target element cannot be resolved
     * @throws me.golemcore.repeater.domain.exception.ElementActionException
     *             if the interaction fails
     * @throws me.golemcore.repeater.domain.exception.LoopSpecException
     *             if a fill / press action carries no value
     */
    void run(ActionSpec action);
}
