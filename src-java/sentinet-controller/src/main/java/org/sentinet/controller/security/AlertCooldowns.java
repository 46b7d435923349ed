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

package org.sentinet.controller.security;

import org.sentinet.controller.mitigation.FlowPair;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Suppresses repeated alerts about the same pair.
 */
public class AlertCooldowns {
    private final Map<FlowPair, Instant> cooldownUntil = new ConcurrentHashMap<>();

    public boolean isActive(FlowPair pair, Instant now) {
        Instant until = cooldownUntil.get(pair);
        return until != null && now.isBefore(until);
    }

    public void start(FlowPair pair, Instant until) {
        cooldownUntil.put(pair, until);
    }

    /**
     * Forget expired cooldowns.
     *
     * @return number of removed entries.
     */
    public int sweep(Instant now) {
        int before = cooldownUntil.size();
        cooldownUntil.values().removeIf(until -> !now.isBefore(until));
        return before - cooldownUntil.size();
    }

    /**
     * Cooldowns still in effect with the whole seconds left.
     */
    public List<ActiveAlert> getActive(Instant now) {
        List<ActiveAlert> result = new ArrayList<>();
        for (Map.Entry<FlowPair, Instant> entry : cooldownUntil.entrySet()) {
            if (now.isBefore(entry.getValue())) {
                long remaining = (Duration.between(now, entry.getValue()).toMillis() + 999) / 1000;
                result.add(new ActiveAlert(entry.getKey().getSrc(), entry.getKey().getDst(), remaining));
            }
        }
        return result;
    }

    public int size() {
        return cooldownUntil.size();
    }
}
