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

package org.sentinet.controller;

import org.sentinet.controller.bridge.BridgeGateway;
import org.sentinet.controller.bridge.BridgeStatus;
import org.sentinet.controller.bridge.KafkaBridgeTransport;
import org.sentinet.controller.bridge.PendingCommand;
import org.sentinet.controller.config.BridgeConfig;
import org.sentinet.controller.config.SentinetConfig;
import org.sentinet.controller.error.SwitchOperationException;
import org.sentinet.controller.event.ControllerEvent;
import org.sentinet.controller.event.PacketInEvent;
import org.sentinet.controller.event.StatsReplyEvent;
import org.sentinet.controller.event.SwitchDownEvent;
import org.sentinet.controller.event.SwitchUpEvent;
import org.sentinet.controller.forwarding.ForwardingDecision;
import org.sentinet.controller.forwarding.ForwardingDecisionEngine;
import org.sentinet.controller.mitigation.BlockedFlow;
import org.sentinet.controller.mitigation.ExecutorTaskScheduler;
import org.sentinet.controller.mitigation.MitigationManager;
import org.sentinet.controller.mitigation.TaskScheduler;
import org.sentinet.controller.security.ActiveAlert;
import org.sentinet.controller.security.ThreatClassifier;
import org.sentinet.controller.security.ThreatDetector;
import org.sentinet.controller.security.UnavailableThreatClassifier;
import org.sentinet.controller.statistics.FlowRecord;
import org.sentinet.controller.statistics.FlowStatisticsService;
import org.sentinet.controller.statistics.LinkStats;
import org.sentinet.controller.statistics.LinkUtilizationCalculator;
import org.sentinet.controller.switchmanager.SwitchManager;
import org.sentinet.controller.switchmanager.SwitchRecord;
import org.sentinet.controller.switchmanager.SwitchRegistry;
import org.sentinet.model.MacAddress;
import org.sentinet.model.topology.HostAttachment;
import org.sentinet.model.topology.Topology;
import org.sentinet.navigator.Navigator;
import org.sentinet.navigator.QLearningNavigator;
import org.sentinet.navigator.config.NavigatorConfig;
import org.sentinet.navigator.model.LinkInfo;
import org.sentinet.navigator.model.NavigatorStatus;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.projectfloodlight.openflow.types.DatapathId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Decision core of the controller. Every event and every periodic task runs on a single event loop thread, so the
 * components it wires together don't need to coordinate with each other.
 */
public class SentinetController {
    private static final Logger logger = LoggerFactory.getLogger(SentinetController.class);

    private final SentinetConfig config;
    private final Topology topology;
    private final Navigator navigator;
    private final BridgeGateway bridge;
    private final ScheduledExecutorService eventLoop;
    private final Clock clock;

    private final SwitchRegistry switchRegistry;
    private final FlowStatisticsService statisticsService;
    private final LinkUtilizationCalculator linkUtilization;
    private final MitigationManager mitigationManager;
    private final ThreatDetector threatDetector;
    private final ForwardingDecisionEngine forwardingEngine;

    public SentinetController(SentinetConfig config, Topology topology, Navigator navigator,
                              ThreatClassifier classifier, BridgeGateway bridge,
                              ScheduledExecutorService eventLoop, Clock clock) {
        this(config, topology, navigator, classifier, bridge, eventLoop, new ExecutorTaskScheduler(eventLoop), clock);
    }

    @VisibleForTesting
    SentinetController(SentinetConfig config, Topology topology, Navigator navigator,
                       ThreatClassifier classifier, BridgeGateway bridge,
                       ScheduledExecutorService eventLoop, TaskScheduler taskScheduler, Clock clock) {
        this.config = config;
        this.topology = topology;
        this.navigator = navigator;
        this.bridge = bridge;
        this.eventLoop = eventLoop;
        this.clock = clock;

        SwitchManager switchManager = new SwitchManager();
        switchRegistry = new SwitchRegistry(topology, switchManager);
        statisticsService = new FlowStatisticsService(switchRegistry, switchManager);
        linkUtilization = new LinkUtilizationCalculator(topology);
        mitigationManager = new MitigationManager(switchRegistry, switchManager, taskScheduler, clock);
        threatDetector = new ThreatDetector(classifier, mitigationManager, bridge, config);
        forwardingEngine = new ForwardingDecisionEngine(
                switchRegistry, switchManager, mitigationManager, navigator, config);

        if (config.isNavigatorEnabled()) {
            navigator.initialize(topology);
            loadNavigatorState();
        }
    }

    /**
     * Wire the controller from configuration: topology from the classpath, Q-learning navigator, Kafka bridge when
     * enabled and threshold based detection.
     */
    public static SentinetController create(SentinetConfig config, NavigatorConfig navigatorConfig,
                                           BridgeConfig bridgeConfig) {
        Topology topology = Topology.loadResource(config.getTopologyResource());
        Clock clock = Clock.systemUTC();
        BridgeGateway bridge = bridgeConfig.isEnabled()
                ? new BridgeGateway(bridgeConfig, new KafkaBridgeTransport(bridgeConfig), clock)
                : BridgeGateway.disabled(clock);
        ScheduledExecutorService eventLoop = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder().setNameFormat("sentinet-event-loop-%d").build());
        return new SentinetController(config, topology, new QLearningNavigator(navigatorConfig),
                new UnavailableThreatClassifier(), bridge, eventLoop, clock);
    }

    /**
     * Start the bridge and the periodic tasks.
     */
    public void startUp() {
        bridge.start();

        long pollMs = config.getPollInterval().toMillis();
        eventLoop.scheduleAtFixedRate(guarded("stats poll", this::pollStatistics),
                pollMs, pollMs, TimeUnit.MILLISECONDS);
        eventLoop.scheduleAtFixedRate(guarded("pending commands", this::processPendingCommands),
                pollMs, pollMs, TimeUnit.MILLISECONDS);
        long sweepMs = config.getCooldownSweepInterval().toMillis();
        eventLoop.scheduleAtFixedRate(guarded("cooldown sweep", this::sweepCooldowns),
                sweepMs, sweepMs, TimeUnit.MILLISECONDS);

        logger.info("SentiNet controller started: {} switches in topology, navigator {}, bridge {}",
                topology.getSwitches().size(), config.isNavigatorEnabled() ? "enabled" : "disabled",
                bridge.isEnabled() ? "enabled" : "disabled");
    }

    /**
     * Stop processing and persist the learned navigator state.
     */
    public void shutdown() {
        eventLoop.shutdownNow();
        try {
            if (!eventLoop.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Event loop did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        bridge.stop();
        saveNavigatorState();
        logger.info("SentiNet controller stopped");
    }

    /**
     * Queue the event for the event loop.
     */
    public void submit(ControllerEvent event) {
        eventLoop.execute(() -> dispatch(event));
    }

    /**
     * Handle the event in the calling thread. A failure is logged and does not affect later events.
     */
    public void dispatch(ControllerEvent event) {
        try {
            if (event instanceof SwitchUpEvent) {
                handleSwitchUp((SwitchUpEvent) event);
            } else if (event instanceof SwitchDownEvent) {
                handleSwitchDown((SwitchDownEvent) event);
            } else if (event instanceof PacketInEvent) {
                handlePacketIn((PacketInEvent) event);
            } else if (event instanceof StatsReplyEvent) {
                handleStatsReply((StatsReplyEvent) event);
            } else {
                logger.warn("Unsupported event {}", event);
            }
        } catch (Exception e) {
            logger.error("Failed to handle {} of switch {}", event.getClass().getSimpleName(), event.getDpId(), e);
        }
    }

    /**
     * Request flow counters of every active switch.
     */
    public void pollStatistics() {
        statisticsService.pollAll();
    }

    public void sweepCooldowns() {
        threatDetector.sweepCooldowns(clock.instant());
    }

    /**
     * Apply at most one operator command queued in the bridge.
     */
    public void processPendingCommands() {
        bridge.pollPendingCommand().ifPresent(this::applyCommand);
    }

    /**
     * Execute an operator command. Only blocking is supported: the target host gets blocked toward every other
     * topology host.
     *
     * @return number of blocked pairs.
     */
    public int applyCommand(PendingCommand command) {
        if (!PendingCommand.BLOCK.equalsIgnoreCase(command.getCommand())) {
            logger.warn("Ignore unsupported command {}", command);
            return 0;
        }

        Optional<HostAttachment> target = findHost(command.getTarget());
        if (!target.isPresent()) {
            logger.warn("Ignore {} command, unknown target {}", command.getCommand(), command.getTarget());
            return 0;
        }

        int duration = command.getDurationSec() > 0 ? command.getDurationSec() : PendingCommand.DEFAULT_DURATION_SEC;
        MacAddress attacker = target.get().getMac();
        int blocked = 0;
        for (HostAttachment other : topology.getHosts()) {
            if (!other.getMac().equals(attacker)) {
                mitigationManager.block(attacker, other.getMac(), duration);
                blocked++;
            }
        }
        logger.warn("Operator blocked host {} ({}) for {} seconds", target.get().getHost().getId(), attacker, duration);
        return blocked;
    }

    /**
     * Find topology host by MAC or IP address.
     */
    public Optional<HostAttachment> findHost(String macOrIp) {
        if (macOrIp == null) {
            return Optional.empty();
        }
        if (MacAddress.isValid(macOrIp.trim())) {
            return topology.findHost(new MacAddress(macOrIp));
        }
        return topology.findHostByIp(macOrIp.trim());
    }

    public List<LinkStats> getLinkStats() {
        return linkUtilization.getLinkStats(statisticsService.getLatestRecords());
    }

    /**
     * Latest flow records, optionally filtered by addresses.
     */
    public List<FlowRecord> getFlowFeatures(MacAddress src, MacAddress dst) {
        return statisticsService.getFlowFeatures(src, dst);
    }

    public List<ActiveAlert> getActiveAlerts() {
        return threatDetector.getActiveAlerts(clock.instant());
    }

    public List<BlockedFlow> getBlockedFlows() {
        return mitigationManager.getBlockedFlows();
    }

    public Collection<SwitchRecord> getActiveSwitches() {
        return switchRegistry.getActiveSwitches();
    }

    public NavigatorStatus getNavigatorStatus() {
        return navigator.getStatus();
    }

    public List<LinkInfo> getNavigatorLinks() {
        return navigator.getLinkInfo();
    }

    public BridgeStatus getBridgeStatus() {
        return bridge.getStatus();
    }

    @VisibleForTesting
    SwitchRegistry getSwitchRegistry() {
        return switchRegistry;
    }

    @VisibleForTesting
    MitigationManager getMitigationManager() {
        return mitigationManager;
    }

    private void handleSwitchUp(SwitchUpEvent event) {
        SwitchRecord sw;
        try {
            sw = switchRegistry.handleConnect(event.getConnection());
        } catch (SwitchOperationException e) {
            logger.error("Switch {} failed to come up: {}", event.getDpId(), e.getMessage());
            return;
        }

        bridge.publishTopology(topology);
        bridge.publishSwitchEvent(true, sw.getSwitchId(), sw.getDpId().getLong());
        mitigationManager.reinstallOn(sw);
    }

    private void handleSwitchDown(SwitchDownEvent event) {
        Optional<SwitchRecord> sw = switchRegistry.handleDisconnect(event.getDpId());
        if (sw.isPresent()) {
            statisticsService.forgetSwitch(event.getDpId(), sw.get().getSwitchId());
            bridge.publishSwitchEvent(false, sw.get().getSwitchId(), event.getDpId().getLong());
        }
    }

    private void handlePacketIn(PacketInEvent event) {
        Optional<SwitchRecord> sw = switchRegistry.getSwitch(event.getDpId());
        if (!sw.isPresent() || !sw.get().isActive()) {
            logger.debug("Ignore packet-in from inactive switch {}", event.getDpId());
            return;
        }
        ForwardingDecision decision = forwardingEngine.handlePacketIn(sw.get(), event.getPacketIn());
        logger.trace("Packet-in on {} handled: {}", sw.get().getSwitchId(), decision);
    }

    private void handleStatsReply(StatsReplyEvent event) {
        Instant now = clock.instant();
        Optional<List<FlowRecord>> records = statisticsService.handleStatsReply(event.getDpId(), event.getReply(), now);
        if (!records.isPresent()) {
            return;
        }

        DatapathId dpId = event.getDpId();
        String switchId = topology.switchIdOf(dpId.getLong());
        bridge.publishStats(switchId, dpId.getLong(), records.get());

        for (FlowRecord record : records.get()) {
            threatDetector.evaluate(record, now);
        }

        if (config.isNavigatorEnabled() && navigator.isInitialized()) {
            navigator.updateLinkWeights(linkUtilization.calculate(statisticsService.getLatestRecords()));
        }
    }

    private void loadNavigatorState() {
        Optional<Path> path = getNavigatorStatePath();
        if (!path.isPresent() || !Files.exists(path.get())) {
            return;
        }
        try {
            navigator.load(path.get());
            logger.info("Navigator state restored from {}", path.get());
        } catch (IOException e) {
            logger.warn("Unable to restore navigator state from {}, starting fresh: {}", path.get(), e.getMessage());
        }
    }

    private void saveNavigatorState() {
        Optional<Path> path = getNavigatorStatePath();
        if (!path.isPresent() || !navigator.isInitialized()) {
            return;
        }
        try {
            navigator.save(path.get());
            logger.info("Navigator state saved into {}", path.get());
        } catch (IOException e) {
            logger.error("Unable to save navigator state into {}", path.get(), e);
        }
    }

    private Optional<Path> getNavigatorStatePath() {
        String location = config.getNavigatorStatePath();
        if (location == null || location.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Paths.get(location));
    }

    private Runnable guarded(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                logger.error("Periodic task \"{}\" failed", name, e);
            }
        };
    }
}
