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

package org.sentinet.controller.mitigation;

import org.sentinet.controller.error.OfInstallException;
import org.sentinet.controller.switchmanager.SwitchManager;
import org.sentinet.controller.switchmanager.SwitchRecord;
import org.sentinet.controller.switchmanager.SwitchRegistry;
import org.sentinet.model.MacAddress;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Installs drop rules for attacking pairs and lifts them once the block expires.
 *
 * <p>The switches drop the rules on their own through the hard timeout, the scheduled unblock only removes the pair
 * from the blocked set so the forwarding path accepts it again.
 */
public class MitigationManager {
    private static final Logger logger = LoggerFactory.getLogger(MitigationManager.class);

    private final SwitchRegistry switchRegistry;
    private final SwitchManager switchManager;
    private final TaskScheduler scheduler;
    private final Clock clock;

    private final Map<FlowPair, BlockedFlow> blockedFlows = new ConcurrentHashMap<>();
    private final AtomicLong generations = new AtomicLong();

    public MitigationManager(SwitchRegistry switchRegistry, SwitchManager switchManager, TaskScheduler scheduler,
                             Clock clock) {
        this.switchRegistry = switchRegistry;
        this.switchManager = switchManager;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /**
     * Block traffic from {@code src} to {@code dst} on every active switch. Blocking a pair that is already blocked
     * extends the block.
     */
    public BlockedFlow block(MacAddress src, MacAddress dst, int durationSec) {
        Preconditions.checkArgument(durationSec > 0, "Block duration must be positive, got %s", durationSec);

        FlowPair pair = new FlowPair(src, dst);
        long generation = generations.incrementAndGet();
        Instant expiresAt = clock.instant().plusSeconds(durationSec);
        ScheduledTask task = scheduler.schedule(() -> expire(pair, generation), Duration.ofSeconds(durationSec));

        BlockedFlow blocked = new BlockedFlow(pair, expiresAt, generation, task);
        BlockedFlow previous = blockedFlows.put(pair, blocked);
        if (previous != null) {
            previous.getUnblockTask().cancel();
            logger.info("Block of {} extended until {}", pair, expiresAt);
        } else {
            logger.warn("Blocking {} for {} seconds", pair, durationSec);
        }

        for (SwitchRecord sw : switchRegistry.getActiveSwitches()) {
            installDropRule(sw, pair, durationSec);
        }
        return blocked;
    }

    /**
     * Lift the block of the pair. The drop rules already installed stay on the switches until their hard timeout.
     *
     * @return false if the pair was not blocked.
     */
    public boolean unblock(MacAddress src, MacAddress dst) {
        FlowPair pair = new FlowPair(src, dst);
        BlockedFlow blocked = blockedFlows.remove(pair);
        if (blocked == null) {
            logger.debug("Pair {} is not blocked", pair);
            return false;
        }

        blocked.getUnblockTask().cancel();
        logger.info("Unblocked {}", pair);
        return true;
    }

    public boolean isBlocked(MacAddress src, MacAddress dst) {
        return blockedFlows.containsKey(new FlowPair(src, dst));
    }

    /**
     * Install the drop rules of the active blocks on a switch that just became active.
     */
    public void reinstallOn(SwitchRecord sw) {
        Instant now = clock.instant();
        for (BlockedFlow blocked : blockedFlows.values()) {
            long remaining = (Duration.between(now, blocked.getExpiresAt()).toMillis() + 999) / 1000;
            if (remaining > 0) {
                installDropRule(sw, blocked.getPair(), (int) remaining);
            }
        }
    }

    public List<BlockedFlow> getBlockedFlows() {
        return new ArrayList<>(blockedFlows.values());
    }

    private void expire(FlowPair pair, long generation) {
        BlockedFlow current = blockedFlows.get(pair);
        if (current == null || current.getGeneration() != generation) {
            logger.debug("Skip stale unblock of {} (generation {})", pair, generation);
            return;
        }

        blockedFlows.remove(pair, current);
        logger.info("Block of {} expired", pair);
    }

    private void installDropRule(SwitchRecord sw, FlowPair pair, int hardTimeout) {
        try {
            switchManager.installDropRule(sw.getConnection(), pair.getSrc(), pair.getDst(), hardTimeout);
            logger.debug("Drop rule for {} installed on switch {} (hard timeout {})",
                    pair, sw.getSwitchId(), hardTimeout);
        } catch (OfInstallException e) {
            logger.error("Unable to install drop rule for {} on switch {}", pair, sw.getSwitchId(), e);
        }
    }
}
