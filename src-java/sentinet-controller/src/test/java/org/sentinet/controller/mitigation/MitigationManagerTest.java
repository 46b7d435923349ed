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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.sentinet.controller.utils.SwitchFlowUtils.toOf;

import org.sentinet.controller.switchmanager.SwitchManager;
import org.sentinet.controller.switchmanager.SwitchRecord;
import org.sentinet.controller.switchmanager.SwitchRegistry;
import org.sentinet.controller.testing.ManualClock;
import org.sentinet.controller.testing.ManualTaskScheduler;
import org.sentinet.controller.testing.RecordingSwitchConnection;
import org.sentinet.controller.utils.SwitchFlowUtils;
import org.sentinet.model.MacAddress;
import org.sentinet.model.topology.Topology;

import org.junit.Before;
import org.junit.Test;
import org.projectfloodlight.openflow.protocol.OFFlowAdd;
import org.projectfloodlight.openflow.protocol.match.MatchField;

import java.time.Duration;
import java.util.List;

public class MitigationManagerTest {
    private static final MacAddress ATTACKER = new MacAddress("00:00:00:00:00:01");
    private static final MacAddress VICTIM = new MacAddress("00:00:00:00:00:08");

    private ManualClock clock;
    private ManualTaskScheduler scheduler;
    private SwitchRegistry registry;
    private MitigationManager mitigationManager;
    private RecordingSwitchConnection s1;
    private RecordingSwitchConnection s3;

    @Before
    public void setUp() throws Exception {
        clock = new ManualClock();
        scheduler = new ManualTaskScheduler(clock);
        SwitchManager switchManager = new SwitchManager();
        registry = new SwitchRegistry(Topology.loadResource("topology-sample.json"), switchManager);
        mitigationManager = new MitigationManager(registry, switchManager, scheduler, clock);

        s1 = new RecordingSwitchConnection(1);
        s3 = new RecordingSwitchConnection(3);
        registry.handleConnect(s1);
        registry.handleConnect(s3);
        s1.clear();
        s3.clear();
    }

    @Test
    public void blockInstallsDropRuleOnEveryActiveSwitch() {
        mitigationManager.block(ATTACKER, VICTIM, 60);

        assertTrue(mitigationManager.isBlocked(ATTACKER, VICTIM));
        assertFalse(mitigationManager.isBlocked(VICTIM, ATTACKER));
        for (RecordingSwitchConnection sw : new RecordingSwitchConnection[]{s1, s3}) {
            List<OFFlowAdd> rules = sw.getWritten(OFFlowAdd.class);
            assertThat(rules, hasSize(1));
            OFFlowAdd rule = rules.get(0);
            assertEquals(SwitchFlowUtils.DROP_PRIORITY, rule.getPriority());
            assertEquals(60, rule.getHardTimeout());
            assertEquals(0, rule.getIdleTimeout());
            assertEquals(toOf(ATTACKER), rule.getMatch().get(MatchField.ETH_SRC));
            assertEquals(toOf(VICTIM), rule.getMatch().get(MatchField.ETH_DST));
            assertThat(rule.getInstructions(), empty());
        }
    }

    @Test
    public void blockExpiresAfterDuration() {
        mitigationManager.block(ATTACKER, VICTIM, 60);

        scheduler.advance(Duration.ofSeconds(59));
        assertTrue(mitigationManager.isBlocked(ATTACKER, VICTIM));

        scheduler.advance(Duration.ofSeconds(1));
        assertFalse(mitigationManager.isBlocked(ATTACKER, VICTIM));
        assertThat(mitigationManager.getBlockedFlows(), empty());
    }

    @Test
    public void repeatedBlockExtendsExpiry() {
        mitigationManager.block(ATTACKER, VICTIM, 60);
        scheduler.advance(Duration.ofSeconds(30));

        mitigationManager.block(ATTACKER, VICTIM, 60);
        assertEquals(1, scheduler.getPendingCount());

        // the unblock of the first block must not lift the extended one
        scheduler.advance(Duration.ofSeconds(40));
        assertTrue(mitigationManager.isBlocked(ATTACKER, VICTIM));

        scheduler.advance(Duration.ofSeconds(20));
        assertFalse(mitigationManager.isBlocked(ATTACKER, VICTIM));
    }

    @Test
    public void unblockCancelsPendingExpiry() {
        mitigationManager.block(ATTACKER, VICTIM, 60);

        assertTrue(mitigationManager.unblock(ATTACKER, VICTIM));

        assertFalse(mitigationManager.isBlocked(ATTACKER, VICTIM));
        assertEquals(0, scheduler.getPendingCount());
        assertFalse(mitigationManager.unblock(ATTACKER, VICTIM));
    }

    @Test
    public void staleExpiryDoesNotLiftNewBlock() {
        mitigationManager.block(ATTACKER, VICTIM, 10);
        mitigationManager.unblock(ATTACKER, VICTIM);
        mitigationManager.block(ATTACKER, VICTIM, 60);

        scheduler.advance(Duration.ofSeconds(10));

        assertTrue(mitigationManager.isBlocked(ATTACKER, VICTIM));
    }

    @Test
    public void writeFailureOnOneSwitchDoesNotAbortOthers() {
        s1.setWritable(false);

        mitigationManager.block(ATTACKER, VICTIM, 60);

        assertTrue(mitigationManager.isBlocked(ATTACKER, VICTIM));
        assertThat(s3.getWritten(OFFlowAdd.class), hasSize(1));
    }

    @Test
    public void reinstallUsesRemainingTimeout() throws Exception {
        mitigationManager.block(ATTACKER, VICTIM, 60);
        scheduler.advance(Duration.ofSeconds(20));

        RecordingSwitchConnection s5 = new RecordingSwitchConnection(5);
        SwitchRecord record = registry.handleConnect(s5);
        s5.clear();
        mitigationManager.reinstallOn(record);

        List<OFFlowAdd> rules = s5.getWritten(OFFlowAdd.class);
        assertThat(rules, hasSize(1));
        assertEquals(40, rules.get(0).getHardTimeout());
    }

    @Test(expected = IllegalArgumentException.class)
    public void nonPositiveDurationIsRejected() {
        mitigationManager.block(ATTACKER, VICTIM, 0);
    }
}
