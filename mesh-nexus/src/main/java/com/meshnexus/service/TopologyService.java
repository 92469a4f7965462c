package com.meshnexus.service;

import com.meshnexus.config.CoordinatorRole;
import com.meshnexus.config.MeshProperties;
import com.meshnexus.model.MeshNeighbor;
import com.meshnexus.model.MeshRoute;
import com.meshnexus.model.NetworkTopology;
import com.meshnexus.model.NetworkTopology.TopologyLink;
import com.meshnexus.model.NetworkTopology.TopologyNode;
import com.meshnexus.model.Node;
import com.meshnexus.model.NodeStatus;
import com.meshnexus.probe.NetworkProbe;
import com.meshnexus.util.ProbeCalls;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;

/**
 * Builds the node/link graph rendered by observers. Graph node ids are mesh addresses so that
 * link endpoints line up with registered and discovered nodes alike.
 */
@Service
@CoordinatorRole
@Slf4j
public class TopologyService {

    static final String DIRECT = "direct";
    static final String MULTI_HOP = "multi-hop";

    private final NodeRegistry nodeRegistry;
    private final NetworkProbe networkProbe;
    private final Executor probeExecutor;
    private final Clock clock;
    private final String coordinatorAddress;
    private final Duration probeTimeout;

    public TopologyService(NodeRegistry nodeRegistry,
                           NetworkProbe networkProbe,
                           @Qualifier("probeExecutor") Executor probeExecutor,
                           Clock clock,
                           MeshProperties properties) {
        this.nodeRegistry = nodeRegistry;
        this.networkProbe = networkProbe;
        this.probeExecutor = probeExecutor;
        this.clock = clock;
        this.coordinatorAddress = properties.getCoordinator().getAddress();
        this.probeTimeout = properties.getCoordinator().getProbeTimeout();
    }

    public NetworkTopology build() {
        List<MeshNeighbor> neighbors = ProbeCalls.orDefault(probeExecutor, probeTimeout, "Neighbor listing",
                networkProbe::listNeighbors, List.of());
        List<MeshRoute> routes = ProbeCalls.orDefault(probeExecutor, probeTimeout, "Route listing",
                networkProbe::listRoutes, List.of());
        List<Node> registered = nodeRegistry.nodes();

        Map<String, TopologyNode> graphNodes = new LinkedHashMap<>();
        graphNodes.put(coordinatorAddress, TopologyNode.builder()
                .id(coordinatorAddress)
                .address(coordinatorAddress)
                .name("Coordinator")
                .status(NodeStatus.ONLINE.value())
                .type("coordinator")
                .source("coordinator")
                .build());

        for (Node node : registered) {
            if (node.getAddress() == null) {
                continue;
            }
            graphNodes.putIfAbsent(node.getAddress(), TopologyNode.builder()
                    .id(node.getAddress())
                    .address(node.getAddress())
                    .name(node.getId())
                    .status(node.getStatus().value())
                    .type("node")
                    .source("registered")
                    .build());
        }

        for (MeshRoute route : routes) {
            graphNodes.putIfAbsent(route.getOriginator(),
                    discovered(route.getOriginator(), "mesh-route", route.getQuality()));
            if (isMultiHop(route)) {
                graphNodes.putIfAbsent(route.getNextHop(),
                        discovered(route.getNextHop(), "mesh-nexthop", route.getQuality()));
            }
        }

        for (MeshNeighbor neighbor : neighbors) {
            graphNodes.putIfAbsent(neighbor.getAddress(), TopologyNode.builder()
                    .id(neighbor.getAddress())
                    .address(neighbor.getAddress())
                    .status(NodeStatus.ONLINE.value())
                    .type("mesh-node")
                    .source("mesh-neighbor")
                    .quality(neighbor.getQuality())
                    .build());
        }

        List<TopologyLink> links = new ArrayList<>();
        Set<String> linkIds = new HashSet<>();

        for (MeshNeighbor neighbor : neighbors) {
            String linkId = coordinatorAddress + "-" + neighbor.getAddress();
            if (linkIds.add(linkId)) {
                links.add(TopologyLink.builder()
                        .linkId(linkId)
                        .source(coordinatorAddress)
                        .target(neighbor.getAddress())
                        .type(DIRECT)
                        .quality(neighbor.getQuality() != null ? neighbor.getQuality() : "unknown")
                        .iface(neighbor.getIface())
                        .build());
            }
        }

        for (MeshRoute route : routes) {
            if (!isMultiHop(route)) {
                continue;
            }
            String linkId = route.getNextHop() + "-" + route.getOriginator();
            String reverseId = route.getOriginator() + "-" + route.getNextHop();
            if (linkIds.contains(linkId) || linkIds.contains(reverseId)) {
                continue;
            }
            linkIds.add(linkId);
            links.add(TopologyLink.builder()
                    .linkId(linkId)
                    .source(route.getNextHop())
                    .target(route.getOriginator())
                    .type(MULTI_HOP)
                    .quality(route.getQuality())
                    .iface(route.getIface())
                    .bestPath(route.isBestPath())
                    .build());
        }

        long directLinks = links.stream().filter(l -> DIRECT.equals(l.getType())).count();
        long discoveredNodes = graphNodes.values().stream()
                .filter(n -> !"registered".equals(n.getSource()))
                .count();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("generated", clock.instant());
        metadata.put("nodeCount", graphNodes.size());
        metadata.put("linkCount", links.size());
        metadata.put("directLinks", directLinks);
        metadata.put("multiHopLinks", links.size() - directLinks);
        metadata.put("coordinatorAddress", coordinatorAddress);
        metadata.put("registeredNodes", registered.size());
        metadata.put("discoveredNodes", discoveredNodes);

        log.debug("Generated topology: {} nodes, {} links", graphNodes.size(), links.size());
        return new NetworkTopology(new ArrayList<>(graphNodes.values()), links, metadata);
    }

    private static boolean isMultiHop(MeshRoute route) {
        return route.getNextHop() != null && !route.getNextHop().equals(route.getOriginator());
    }

    private static TopologyNode discovered(String address, String source, String quality) {
        return TopologyNode.builder()
                .id(address)
                .address(address)
                .status("discovered")
                .type("mesh-node")
                .source(source)
                .quality(quality)
                .build();
    }
}
