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

package org.sentinet.navigator;

import org.sentinet.model.topology.DirectedLink;
import org.sentinet.model.topology.SwitchDescriptor;
import org.sentinet.model.topology.Topology;
import org.sentinet.model.topology.TopologyLink;
import org.sentinet.navigator.config.NavigatorConfig;
import org.sentinet.navigator.model.Edge;
import org.sentinet.navigator.model.LinkInfo;
import org.sentinet.navigator.model.NavigatorStatus;
import org.sentinet.navigator.model.QTable;
import org.sentinet.navigator.model.QTableSnapshot;
import org.sentinet.navigator.model.RoutingGraph;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Epsilon-greedy Q-learning router over the congestion weighted switch graph.
 *
 * <p>State is the current switch and an action is the move to a neighbour. Every successful path search is
 * rewarded with the negated latency and congestion of the realized path and the reward is propagated backwards
 * along it. Path search and learning happen under one write lock so a concurrent {@link #updateLinkWeights(Map)}
 * never observes a half applied update.
 */
public class QLearningNavigator implements Navigator {
    private static final Logger logger = LoggerFactory.getLogger(QLearningNavigator.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final NavigatorConfig config;
    private final Random random;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private RoutingGraph graph = new RoutingGraph();
    private final QTable qtable = new QTable();

    private boolean initialized;
    private double epsilon;
    private long totalUpdates;
    private long pathsCalculated;

    public QLearningNavigator(NavigatorConfig config) {
        this(config, new Random());
    }

    public QLearningNavigator(NavigatorConfig config, Random random) {
        this.config = config;
        this.random = random;
        this.epsilon = config.getEpsilon();

        logger.info("Navigator created with alpha={}, gamma={}, epsilon={}",
                config.getAlpha(), config.getGamma(), config.getEpsilon());
    }

    @Override
    public void initialize(Topology topology) {
        lock.writeLock().lock();
        try {
            RoutingGraph target = new RoutingGraph();
            for (SwitchDescriptor entry : topology.getSwitches()) {
                target.getOrAddNode(entry.getId());
            }
            for (TopologyLink link : topology.getLinks()) {
                Edge forward = Edge.builder()
                        .srcSwitch(link.getFromSwitch())
                        .destSwitch(link.getToSwitch())
                        .bandwidthMbps(link.getBandwidthMbps())
                        .delayMs(link.getDelayMs())
                        .build();
                target.addEdge(forward);
                target.addEdge(forward.swap());
            }

            qtable.clear();
            for (Edge edge : target.getEdges()) {
                double jitter = config.getInitialJitter() > 0 ? random.nextDouble() * config.getInitialJitter() : 0;
                qtable.put(edge.getSrcSwitch(), edge.getDestSwitch(), -edge.getDelayMs() + jitter);
            }

            graph = target;
            epsilon = config.getEpsilon();
            totalUpdates = 0;
            pathsCalculated = 0;
            initialized = true;

            logger.info("Navigator initialized from topology: {} switches, {} links",
                    target.size(), target.getEdges().size() / 2);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean isInitialized() {
        lock.readLock().lock();
        try {
            return initialized;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void updateLinkWeights(Map<DirectedLink, Double> liveStats) {
        lock.writeLock().lock();
        try {
            for (Edge edge : graph.getEdges()) {
                Double bps = liveStats.get(new DirectedLink(edge.getSrcSwitch(), edge.getDestSwitch()));
                if (bps != null) {
                    edge.applyUtilization(bps, config.getCongestionPenaltyScale());
                }
            }
            totalUpdates++;

            if (epsilon > config.getEpsilonMin()) {
                epsilon = Math.max(config.getEpsilonMin(), epsilon * config.getEpsilonDecay());
            }
            logger.debug("Link weights updated from {} measurements, epsilon={}", liveStats.size(), epsilon);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<String> getOptimalPath(String srcSwitch, String dstSwitch) {
        lock.writeLock().lock();
        try {
            if (!initialized) {
                logger.warn("Navigator is not initialized, unable to route {} -> {}", srcSwitch, dstSwitch);
                return Collections.emptyList();
            }
            if (!graph.contains(srcSwitch) || !graph.contains(dstSwitch)) {
                logger.warn("Unknown switches in path request: {} -> {}", srcSwitch, dstSwitch);
                return Collections.emptyList();
            }
            if (srcSwitch.equals(dstSwitch)) {
                return Collections.singletonList(srcSwitch);
            }

            List<String> path = walk(srcSwitch, dstSwitch);
            pathsCalculated++;

            if (path.isEmpty()) {
                logger.warn("No valid path from {} to {}", srcSwitch, dstSwitch);
                return Collections.emptyList();
            }

            double reward = calculateReward(path);
            learn(path, reward);
            logger.debug("Path found: {} (reward: {})", path, reward);
            return ImmutableList.copyOf(path);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private List<String> walk(String srcSwitch, String dstSwitch) {
        LinkedList<String> path = new LinkedList<>();
        Set<String> visited = new HashSet<>();
        Map<String, Set<String>> deadEnds = new HashMap<>();
        path.add(srcSwitch);
        visited.add(srcSwitch);

        int maxHops = graph.size() + 1;
        String current = srcSwitch;
        while (!current.equals(dstSwitch) && path.size() < maxHops) {
            List<Edge> candidates = new ArrayList<>();
            Set<String> rejected = deadEnds.getOrDefault(current, Collections.emptySet());
            for (Edge edge : graph.getSwitch(current).getOutgoing()) {
                if (!visited.contains(edge.getDestSwitch()) && !rejected.contains(edge.getDestSwitch())) {
                    candidates.add(edge);
                }
            }

            if (candidates.isEmpty()) {
                if (path.size() == 1) {
                    return Collections.emptyList();
                }
                String stuck = path.removeLast();
                visited.remove(stuck);
                deadEnds.remove(stuck);
                current = path.getLast();
                deadEnds.computeIfAbsent(current, k -> new HashSet<>()).add(stuck);
                continue;
            }

            Edge next = chooseAction(current, dstSwitch, candidates);
            path.add(next.getDestSwitch());
            visited.add(next.getDestSwitch());
            current = next.getDestSwitch();
        }

        return current.equals(dstSwitch) ? path : Collections.emptyList();
    }

    private Edge chooseAction(String current, String dstSwitch, List<Edge> candidates) {
        if (epsilon > 0 && random.nextDouble() < epsilon) {
            return candidates.get(random.nextInt(candidates.size()));
        }

        Edge best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (Edge edge : candidates) {
            double score = score(current, dstSwitch, edge);
            if (best == null || score > bestScore) {
                best = edge;
                bestScore = score;
            }
        }
        return best;
    }

    @VisibleForTesting
    double score(String current, String dstSwitch, Edge edge) {
        double bonus = edge.getDestSwitch().equals(dstSwitch) ? config.getDestinationBonus() : 0;
        return qtable.get(current, edge.getDestSwitch()) + bonus - edge.getWeight() * config.getWeightPenaltyFactor();
    }

    @VisibleForTesting
    double calculateReward(List<String> path) {
        double latency = 0;
        double congestion = 0;
        for (int i = 0; i < path.size() - 1; i++) {
            Edge edge = graph.getEdge(path.get(i), path.get(i + 1));
            latency += edge.getDelayMs();
            congestion += edge.getCongestion();
        }
        return -(latency + congestion * config.getRewardCongestionFactor());
    }

    /**
     * Backward update along the realized path, each transition receives the terminal reward. The destination is
     * terminal and contributes no future value.
     */
    private void learn(List<String> path, double reward) {
        for (int i = path.size() - 2; i >= 0; i--) {
            String state = path.get(i);
            String action = path.get(i + 1);
            double future = i + 1 < path.size() - 1 ? qtable.maxValue(action) : 0;

            double old = qtable.get(state, action);
            qtable.put(state, action, old + config.getAlpha() * (reward + config.getGamma() * future - old));
        }
    }

    @Override
    public NavigatorStatus getStatus() {
        lock.readLock().lock();
        try {
            return NavigatorStatus.builder()
                    .initialized(initialized)
                    .switches(graph.size())
                    .epsilon(epsilon)
                    .totalUpdates(totalUpdates)
                    .pathsCalculated(pathsCalculated)
                    .qtableSize(qtable.getEntryCount())
                    .build();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<LinkInfo> getLinkInfo() {
        lock.readLock().lock();
        try {
            List<LinkInfo> result = new ArrayList<>();
            for (Edge edge : graph.getEdges()) {
                result.add(LinkInfo.of(edge));
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void save(Path target) throws IOException {
        QTableSnapshot snapshot;
        lock.readLock().lock();
        try {
            snapshot = QTableSnapshot.builder()
                    .values(qtable.toMap())
                    .epsilon(epsilon)
                    .totalUpdates(totalUpdates)
                    .pathsCalculated(pathsCalculated)
                    .build();
        } finally {
            lock.readLock().unlock();
        }

        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        MAPPER.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), snapshot);
        logger.info("Navigator state saved to {}", target);
    }

    @Override
    public void load(Path source) throws IOException {
        QTableSnapshot snapshot = MAPPER.readValue(source.toFile(), QTableSnapshot.class);

        lock.writeLock().lock();
        try {
            int restored = 0;
            int skipped = 0;
            for (Map.Entry<String, Map<String, Double>> state : snapshot.getValues().entrySet()) {
                for (Map.Entry<String, Double> action : state.getValue().entrySet()) {
                    if (action.getValue() != null && graph.getEdge(state.getKey(), action.getKey()) != null) {
                        qtable.put(state.getKey(), action.getKey(), action.getValue());
                        restored++;
                    } else {
                        skipped++;
                    }
                }
            }
            epsilon = snapshot.getEpsilon();
            totalUpdates = snapshot.getTotalUpdates();
            pathsCalculated = snapshot.getPathsCalculated();

            if (skipped > 0) {
                logger.warn("Ignored {} stored Q entries not matching the current topology", skipped);
            }
            logger.info("Navigator state loaded from {}: {} Q entries, epsilon={}", source, restored, epsilon);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @VisibleForTesting
    double getQValue(String state, String action) {
        lock.readLock().lock();
        try {
            return qtable.get(state, action);
        } finally {
            lock.readLock().unlock();
        }
    }

    @VisibleForTesting
    Edge getEdge(String from, String to) {
        return graph.getEdge(from, to);
    }
}
