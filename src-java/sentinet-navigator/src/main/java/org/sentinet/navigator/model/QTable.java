/* Copyright 2023 Telstra Open Source
 *
 *   Licensed under the Apache License, Version 2.0 (the "License");
 *   you may not use this file except in compliance with the License.
 *   You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *   Unless required by applicable law or agreed to in writing, software
 *   distributed under the License is distributed on an "AS IS" BASIS,
 *   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *   See the License for the specific language governing permissions and
 *   limitations under the License.
 */

package org.sentinet.navigator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Learned value of moving from a switch (state) to one of its neighbours (action).
 */
public class QTable {
    private final Map<String, Map<String, Double>> values = new LinkedHashMap<>();

    public double get(String state, String action) {
        Map<String, Double> actions = values.get(state);
        if (actions == null) {
            return 0;
        }
        return actions.getOrDefault(action, 0.0);
    }

    public void put(String state, String action, double value) {
        values.computeIfAbsent(state, k -> new LinkedHashMap<>()).put(action, value);
    }

    /**
     * Best known action value of the state, 0 when the state has no entries.
     */
    public double maxValue(String state) {
        Map<String, Double> actions = values.get(state);
        if (actions == null || actions.isEmpty()) {
            return 0;
        }
        double best = Double.NEGATIVE_INFINITY;
        for (double value : actions.values()) {
            best = Math.max(best, value);
        }
        return best;
    }

    public int getStateCount() {
        return values.size();
    }

    public int getEntryCount() {
        int count = 0;
        for (Map<String, Double> actions : values.values()) {
            count += actions.size();
        }
        return count;
    }

    public void clear() {
        values.clear();
    }

    /**
     * Deep copy suitable for serialization.
     */
    public Map<String, Map<String, Double>> toMap() {
        Map<String, Map<String, Double>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Double>> entry : values.entrySet()) {
            copy.put(entry.getKey(), new LinkedHashMap<>(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }
}
