/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */

package dev.mars.flowgate.metrics;

import dev.mars.flowgate.core.exceptions.EventLogException;

import java.util.function.UnaryOperator;

/**
 * Persistence backend for {@link MetricsRecorder}.
 */
public interface MetricsStore {

    MetricsSnapshot load() throws EventLogException;

    /**
     * Reads the stored snapshot, applies {@code change} and stores the result while holding
     * the store's exclusive lock.
     *
     * @return the snapshot as stored
     */
    MetricsSnapshot update(UnaryOperator<MetricsSnapshot> change) throws EventLogException;
}
