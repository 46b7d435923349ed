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

import org.sentinet.controller.config.SentinetConfig;
import org.sentinet.controller.mitigation.FlowPair;
import org.sentinet.controller.mitigation.MitigationManager;
import org.sentinet.controller.statistics.FlowRecord;

import com.google.common.annotations.VisibleForTesting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Judges flow rates and blocks the pairs found to be attacks.
 *
 * <p>A flow is a threat when either the anomaly detector flags it or the attack classifier names a class other than
 * {@value #NORMAL_CLASS}. Without a usable classifier the rate thresholds decide.
 */
public class ThreatDetector {
    private static final Logger logger = LoggerFactory.getLogger(ThreatDetector.class);

    public static final String NORMAL_CLASS = "Normal";
    public static final String UNKNOWN_ANOMALY = "Unknown Anomaly";
    public static final String THRESHOLD_EXCEEDED = "Threshold Exceeded";

    private final ThreatClassifier classifier;
    private final MitigationManager mitigationManager;
    private final AlertPublisher alertPublisher;
    private final SentinetConfig config;

    private final AlertCooldowns cooldowns = new AlertCooldowns();

    public ThreatDetector(ThreatClassifier classifier, MitigationManager mitigationManager,
                          AlertPublisher alertPublisher, SentinetConfig config) {
        this.classifier = classifier;
        this.mitigationManager = mitigationManager;
        this.alertPublisher = alertPublisher;
        this.config = config;
    }

    /**
     * Check the flow and block it if it is an attack outside of the alert cooldown.
     *
     * @return the published alert, empty if nothing was done.
     */
    public Optional<SecurityAlert> evaluate(FlowRecord record, Instant now) {
        if (mitigationManager.isBlocked(record.getSrcMac(), record.getDstMac())) {
            logger.trace("Skip blocked flow {} -> {}", record.getSrcMac(), record.getDstMac());
            return Optional.empty();
        }

        ThreatVerdict verdict = classify(record);
        if (!verdict.isThreat()) {
            return Optional.empty();
        }

        FlowPair pair = new FlowPair(record.getSrcMac(), record.getDstMac());
        if (cooldowns.isActive(pair, now)) {
            logger.debug("Alert for {} suppressed by cooldown", pair);
            return Optional.empty();
        }
        cooldowns.start(pair, now.plus(config.getAlertCooldown()));

        logger.warn("{} detected on switch {}: {} (pps={}, bps={}, confidence={})", verdict.getAttackType(),
                record.getSwitchId(), pair, String.format("%.2f", record.getPps()),
                String.format("%.2f", record.getBps()), verdict.getConfidence());

        mitigationManager.block(pair.getSrc(), pair.getDst(), config.getBlockDurationSec());

        SecurityAlert alert = SecurityAlert.builder()
                .attacker(pair.getSrc())
                .target(pair.getDst())
                .attackType(verdict.getAttackType())
                .confidence(verdict.getConfidence())
                .pps(record.getPps())
                .bps(record.getBps())
                .actionTaken(SecurityAlert.ACTION_BLOCKED)
                .blockDurationSec(config.getBlockDurationSec())
                .timestamp(now.toEpochMilli())
                .build();
        alertPublisher.publishAlert(alert);
        return Optional.of(alert);
    }

    /**
     * Rate threshold check used when no classifier verdict is available.
     */
    public ThreatVerdict evaluateThresholds(double pps, double bps) {
        if (pps > config.getAttackPpsThreshold() || bps > config.getAttackBpsThreshold()) {
            return new ThreatVerdict(true, THRESHOLD_EXCEEDED, 1.0);
        }
        return ThreatVerdict.benign();
    }

    /**
     * Forget expired cooldowns.
     */
    public void sweepCooldowns(Instant now) {
        int removed = cooldowns.sweep(now);
        if (removed > 0) {
            logger.debug("Removed {} expired alert cooldowns", removed);
        }
    }

    public List<ActiveAlert> getActiveAlerts(Instant now) {
        return cooldowns.getActive(now);
    }

    @VisibleForTesting
    ThreatVerdict classify(FlowRecord record) {
        Classification classification;
        try {
            classification = classifier.classify(record.getPps(), record.getBps(), record.getAvgPktSize());
        } catch (RuntimeException e) {
            logger.warn("Classifier failed on flow {} -> {}, falling back to thresholds",
                    record.getSrcMac(), record.getDstMac(), e);
            return evaluateThresholds(record.getPps(), record.getBps());
        }

        if (classification == null || !classification.isAvailable()) {
            return evaluateThresholds(record.getPps(), record.getBps());
        }

        String attackType = classification.getAttackType();
        boolean namedAttack = attackType != null && !attackType.isEmpty() && !NORMAL_CLASS.equals(attackType);
        if (!classification.isThreat() && !namedAttack) {
            return ThreatVerdict.benign();
        }
        return new ThreatVerdict(true, namedAttack ? attackType : UNKNOWN_ANOMALY, classification.getConfidence());
    }
}
