package com.meshnexus.heartbeat;

import com.meshnexus.config.MeshProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NodeIdentityTest {

    @Test
    void derivedIdIsSixteenHexCharsAndStable() {
        String id = NodeIdentity.derive("mesh-node-7", "b8:27:eb:12:34:56");

        assertThat(id).hasSize(16).matches("[0-9a-f]{16}");
        assertThat(NodeIdentity.derive("mesh-node-7", "b8:27:eb:12:34:56")).isEqualTo(id);
    }

    @Test
    void differentHardwareGivesDifferentId() {
        assertThat(NodeIdentity.derive("mesh-node-7", "b8:27:eb:12:34:56"))
                .isNotEqualTo(NodeIdentity.derive("mesh-node-7", "b8:27:eb:12:34:57"));
    }

    @Test
    void configuredIdWins() {
        MeshProperties properties = new MeshProperties();
        properties.getHeartbeat().setNodeId("gateway-01");

        assertThat(new NodeIdentity(properties).resolve()).isEqualTo("gateway-01");
    }
}
