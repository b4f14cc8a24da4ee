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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable set of counter values and recorded durations.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public final class MetricsSnapshot {

    private static final MetricsSnapshot EMPTY = new MetricsSnapshot(Map.of(), Map.of());

    private final Map<String, Long> counters;
    private final Map<String, Double> durations;

    public MetricsSnapshot(Map<String, Long> counters, Map<String, Double> durations) {
        this.counters = Collections.unmodifiableMap(new TreeMap<>(counters));
        this.durations = Collections.unmodifiableMap(new LinkedHashMap<>(durations));
    }

    public static MetricsSnapshot empty() {
        return EMPTY;
    }

    public Map<String, Long> getCounters() {
        return counters;
    }

    public Map<String, Double> getDurations() {
        return durations;
    }

    public long getCounter(String name) {
        return counters.getOrDefault(name, 0L);
    }

    /**
     * Adds counter deltas to this snapshot and overlays recorded durations.
     */
    public MetricsSnapshot merge(Map<String, Long> counterDeltas, Map<String, Double> newDurations) {
        Map<String, Long> mergedCounters = new TreeMap<>(counters);
        counterDeltas.forEach((name, delta) -> mergedCounters.merge(name, delta, Long::sum));
        Map<String, Double> mergedDurations = new LinkedHashMap<>(durations);
        mergedDurations.putAll(newDurations);
        return new MetricsSnapshot(mergedCounters, mergedDurations);
    }

    @Override
    public String toString() {
        return "MetricsSnapshot{counters=" + counters + ", workflowDurations=" + durations + '}';
    }
}
