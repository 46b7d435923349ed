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

import static org.easymock.EasyMock.anyDouble;
import static org.easymock.EasyMock.capture;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.newCapture;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.sentinet.controller.config.SentinetConfig;
import org.sentinet.controller.mitigation.MitigationManager;
import org.sentinet.controller.statistics.FlowRecord;
import org.sentinet.controller.switchmanager.SwitchManager;
import org.sentinet.controller.switchmanager.SwitchRegistry;
import org.sentinet.controller.testing.ManualClock;
import org.sentinet.controller.testing.ManualTaskScheduler;
import org.sentinet.controller.testing.TestConfigs;
import org.sentinet.model.MacAddress;
import org.sentinet.model.topology.Topology;

import org.easymock.Capture;
import org.easymock.CaptureType;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

public class ThreatDetectorTest {
    private static final MacAddress ATTACKER = new MacAddress("00:00:00:00:00:01");
    private static final MacAddress VICTIM = new MacAddress("00:00:00:00:00:08");

    private final SentinetConfig config = TestConfigs.sentinet();

    private ManualClock clock;
    private ManualTaskScheduler scheduler;
    private MitigationManager mitigationManager;
    private ThreatClassifier classifier;
    private AlertPublisher publisher;

    @Before
    public void setUp() {
        clock = new ManualClock();
        scheduler = new ManualTaskScheduler(clock);
        SwitchManager switchManager = new SwitchManager();
        SwitchRegistry registry = new SwitchRegistry(Topology.loadResource("topology-sample.json"), switchManager);
        mitigationManager = new MitigationManager(registry, switchManager, scheduler, clock);
        classifier = createMock(ThreatClassifier.class);
        publisher = createMock(AlertPublisher.class);
    }

    @Test
    public void anomalyWithNamedClassUsesClassLabel() {
        ThreatDetector detector = detectorWith(classification(true, "SYN Flood", 0.93));

        ThreatVerdict verdict = detector.classify(record(10, 100));

        assertTrue(verdict.isThreat());
        assertEquals("SYN Flood", verdict.getAttackType());
        assertEquals(0.93, verdict.getConfidence(), 0);
    }

    @Test
    public void anomalyWithoutClassIsUnknownAnomaly() {
        ThreatDetector detector = detectorWith(classification(true, null, 0.7));

        ThreatVerdict verdict = detector.classify(record(10, 100));

        assertTrue(verdict.isThreat());
        assertEquals(ThreatDetector.UNKNOWN_ANOMALY, verdict.getAttackType());
    }

    @Test
    public void anomalyClassifiedNormalIsStillThreat() {
        ThreatDetector detector = detectorWith(classification(true, "Normal", 0.6));

        ThreatVerdict verdict = detector.classify(record(10, 100));

        assertTrue(verdict.isThreat());
        assertEquals(ThreatDetector.UNKNOWN_ANOMALY, verdict.getAttackType());
    }

    @Test
    public void namedClassAloneIsThreat() {
        ThreatDetector detector = detectorWith(classification(false, "UDP Flood", 0.8));

        ThreatVerdict verdict = detector.classify(record(10, 100));

        assertTrue(verdict.isThreat());
        assertEquals("UDP Flood", verdict.getAttackType());
    }

    @Test
    public void normalTrafficIsNotThreat() {
        ThreatDetector detector = detectorWith(classification(false, "Normal", 0.99));

        assertFalse(detector.classify(record(5000, 1_000_000)).isThreat());
    }

    @Test
    public void unavailableClassifierFallsBackToThresholds() {
        ThreatDetector detector = new ThreatDetector(new UnavailableThreatClassifier(), mitigationManager,
                publisher, config);

        ThreatVerdict verdict = detector.classify(record(1500, 10));

        assertTrue(verdict.isThreat());
        assertEquals(ThreatDetector.THRESHOLD_EXCEEDED, verdict.getAttackType());
        assertEquals(1.0, verdict.getConfidence(), 0);
        assertTrue(detector.classify(record(10, 150_000)).isThreat());
        assertFalse(detector.classify(record(1000, 100_000)).isThreat());
    }

    @Test
    public void failingClassifierFallsBackToThresholds() {
        expect(classifier.classify(anyDouble(), anyDouble(), anyDouble()))
                .andThrow(new IllegalStateException("model is broken")).anyTimes();
        replay(classifier);
        ThreatDetector detector = new ThreatDetector(classifier, mitigationManager, publisher, config);

        assertTrue(detector.classify(record(2000, 10)).isThreat());
        assertFalse(detector.classify(record(20, 10)).isThreat());
    }

    @Test
    public void confirmedThreatIsBlockedAndAlertedOnce() {
        Capture<SecurityAlert> alerts = newCapture(CaptureType.ALL);
        publisher.publishAlert(capture(alerts));
        expectLastCall().once();
        replay(publisher);
        ThreatDetector detector = detectorWith(classification(true, "SYN Flood", 0.95));

        Instant now = clock.instant();
        Optional<SecurityAlert> first = detector.evaluate(record(5000, 2_560_000), now);
        for (int i = 1; i <= 3; i++) {
            assertFalse(detector.evaluate(record(5000, 2_560_000), now.plusSeconds(i)).isPresent());
        }

        verify(publisher);
        assertTrue(first.isPresent());
        SecurityAlert alert = alerts.getValue();
        assertEquals(ATTACKER, alert.getAttacker());
        assertEquals(VICTIM, alert.getTarget());
        assertEquals("SYN Flood", alert.getAttackType());
        assertEquals(SecurityAlert.ACTION_BLOCKED, alert.getActionTaken());
        assertEquals(60, alert.getBlockDurationSec());
        assertEquals(5000, alert.getPps(), 0);
        assertEquals(now.toEpochMilli(), alert.getTimestamp());
        assertTrue(mitigationManager.isBlocked(ATTACKER, VICTIM));
    }

    @Test
    public void cooldownSuppressesAlertsEvenWhenNotBlocked() {
        publisher.publishAlert(capture(newCapture()));
        expectLastCall().times(2);
        replay(publisher);
        ThreatDetector detector = detectorWith(classification(true, "SYN Flood", 0.95));
        Instant now = clock.instant();

        assertTrue(detector.evaluate(record(5000, 10), now).isPresent());
        mitigationManager.unblock(ATTACKER, VICTIM);

        assertFalse(detector.evaluate(record(5000, 10), now.plusSeconds(5)).isPresent());
        assertFalse(mitigationManager.isBlocked(ATTACKER, VICTIM));
        assertThat(detector.getActiveAlerts(now.plusSeconds(5)), hasSize(1));
        assertEquals(5, detector.getActiveAlerts(now.plusSeconds(5)).get(0).getRemainingSec());

        assertTrue(detector.evaluate(record(5000, 10), now.plusSeconds(10)).isPresent());
        verify(publisher);
    }

    @Test
    public void sweepRemovesExpiredCooldowns() {
        publisher.publishAlert(capture(newCapture()));
        expectLastCall().once();
        replay(publisher);
        ThreatDetector detector = detectorWith(classification(true, "SYN Flood", 0.95));
        Instant now = clock.instant();
        detector.evaluate(record(5000, 10), now);

        detector.sweepCooldowns(now.plus(Duration.ofSeconds(9)));
        assertThat(detector.getActiveAlerts(now.plusSeconds(9)), hasSize(1));

        detector.sweepCooldowns(now.plus(Duration.ofSeconds(10)));
        assertThat(detector.getActiveAlerts(now), empty());
    }

    @Test
    public void benignFlowIsLeftAlone() {
        replay(publisher);
        ThreatDetector detector = detectorWith(classification(false, "Normal", 0.99));

        assertFalse(detector.evaluate(record(10, 10), clock.instant()).isPresent());

        verify(publisher);
        assertFalse(mitigationManager.isBlocked(ATTACKER, VICTIM));
    }

    @Test
    public void blockedPairIsNotClassified() {
        replay(classifier, publisher);
        mitigationManager.block(ATTACKER, VICTIM, 60);
        ThreatDetector detector = new ThreatDetector(classifier, mitigationManager, publisher, config);

        assertFalse(detector.evaluate(record(5000, 10), clock.instant()).isPresent());

        verify(classifier, publisher);
    }

    private ThreatDetector detectorWith(Classification classification) {
        expect(classifier.classify(anyDouble(), anyDouble(), anyDouble())).andReturn(classification).anyTimes();
        replay(classifier);
        return new ThreatDetector(classifier, mitigationManager, publisher, config);
    }

    private static Classification classification(boolean threat, String attackType, double confidence) {
        return Classification.builder()
                .available(true)
                .threat(threat)
                .attackType(attackType)
                .confidence(confidence)
                .build();
    }

    private static FlowRecord record(double pps, double bps) {
        return FlowRecord.builder()
                .switchId("s3")
                .datapathId(3)
                .srcMac(ATTACKER)
                .dstMac(VICTIM)
                .pps(pps)
                .bps(bps)
                .avgPktSize(64)
                .build();
    }
}
