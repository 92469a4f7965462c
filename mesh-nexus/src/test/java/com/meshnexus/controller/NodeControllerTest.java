package com.meshnexus.controller;

import com.meshnexus.exception.NodeNotFoundException;
import com.meshnexus.model.ActionResult;
import com.meshnexus.model.HeartbeatRecord;
import com.meshnexus.model.Node;
import com.meshnexus.model.NodeAction;
import com.meshnexus.model.NodeCommand;
import com.meshnexus.model.NodeStatus;
import com.meshnexus.model.RegistrationRequest;
import com.meshnexus.realtime.RealtimeHub;
import com.meshnexus.service.NodeRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class NodeControllerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private NodeRegistry nodeRegistry;

    @Mock
    private RealtimeHub realtimeHub;

    @Mock
    private Clock clock;

    @InjectMocks
    private NodeController nodeController;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(nodeController)
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void listsNodes() throws Exception {
        when(nodeRegistry.nodes()).thenReturn(List.of(new Node("10.0.0.2", "10.0.0.2", NOW),
                new Node("a1b2c3d4e5f60718", "10.0.0.3", NOW)));

        mockMvc.perform(get("/api/nodes"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].status").value("online"))
                .andExpect(jsonPath("$[1].address").value("10.0.0.3"));
    }

    @Test
    void unknownNodeIs404() throws Exception {
        when(nodeRegistry.find("ghost")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/nodes/ghost"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Node ghost not found"));
    }

    @Test
    void registerUsesRemoteAddressAndBroadcasts() throws Exception {
        when(nodeRegistry.register(any(RegistrationRequest.class), eq("10.0.0.7")))
                .thenReturn(new Node("a1b2c3d4e5f60718", "10.0.0.7", NOW));
        when(nodeRegistry.nodes()).thenReturn(List.of());

        mockMvc.perform(post("/api/nodes/register")
                        .with(request -> {
                            request.setRemoteAddr("10.0.0.7");
                            return request;
                        })
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"nodeId\":\"a1b2c3d4e5f60718\",\"details\":{\"hostname\":\"mesh-node-7\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.nodeId").value("a1b2c3d4e5f60718"));

        ArgumentCaptor<RegistrationRequest> captor = ArgumentCaptor.forClass(RegistrationRequest.class);
        verify(nodeRegistry).register(captor.capture(), eq("10.0.0.7"));
        assertThat(captor.getValue().getDetails()).containsEntry("hostname", "mesh-node-7");
        verify(realtimeHub).broadcast(RealtimeHub.NODES_UPDATE, List.of());
    }

    @Test
    void registerWithoutNodeIdIsRejected() throws Exception {
        mockMvc.perform(post("/api/nodes/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"details\":{}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));

        verify(nodeRegistry, never()).register(any(), anyString());
    }

    @Test
    void heartbeatReturnsQueuedCommands() throws Exception {
        when(clock.instant()).thenReturn(NOW);
        when(nodeRegistry.ingestHeartbeat(eq("a1b2c3d4e5f60718"), any(HeartbeatRecord.class)))
                .thenReturn(Optional.of(List.of(new NodeCommand(NodeCommand.RUN_DIAGNOSTICS))));

        mockMvc.perform(post("/api/nodes/a1b2c3d4e5f60718/heartbeat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"online\",\"system\":{\"uptime\":120}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.registered").value(true))
                .andExpect(jsonPath("$.commands[0].type").value("run_diagnostics"));

        ArgumentCaptor<HeartbeatRecord> captor = ArgumentCaptor.forClass(HeartbeatRecord.class);
        verify(nodeRegistry).ingestHeartbeat(eq("a1b2c3d4e5f60718"), captor.capture());
        assertThat(captor.getValue().getNodeId()).isEqualTo("a1b2c3d4e5f60718");
        assertThat(captor.getValue().getTimestamp()).isEqualTo(NOW);
        assertThat(captor.getValue().getStatus()).isEqualTo(NodeStatus.ONLINE);
    }

    @Test
    void heartbeatFromUnregisteredNodeAsksForRegistration() throws Exception {
        when(clock.instant()).thenReturn(NOW);
        when(nodeRegistry.ingestHeartbeat(eq("stranger"), any(HeartbeatRecord.class))).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/nodes/stranger/heartbeat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"online\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.registered").value(false));
    }

    @Test
    void disconnectActionBroadcastsNodes() throws Exception {
        when(nodeRegistry.dispatchAction("10.0.0.2", NodeAction.DISCONNECT))
                .thenReturn(new ActionResult("10.0.0.2", NodeAction.DISCONNECT, true, true, "Node 10.0.0.2 disconnected"));
        when(nodeRegistry.nodes()).thenReturn(List.of());

        mockMvc.perform(post("/api/nodes/10.0.0.2/action")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"disconnect\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.action").value("disconnect"))
                .andExpect(jsonPath("$.success").value(true));

        verify(realtimeHub).broadcast(RealtimeHub.NODES_UPDATE, List.of());
    }

    @Test
    void pingActionDoesNotBroadcast() throws Exception {
        when(nodeRegistry.dispatchAction("10.0.0.2", NodeAction.PING))
                .thenReturn(new ActionResult("10.0.0.2", NodeAction.PING, true, false, "Node 10.0.0.2 is unreachable"));

        mockMvc.perform(post("/api/nodes/10.0.0.2/action")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"ping\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value(false));

        verify(realtimeHub, never()).broadcast(anyString(), any());
    }

    @Test
    void unknownActionIs400() throws Exception {
        mockMvc.perform(post("/api/nodes/10.0.0.2/action")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"reboot-everything\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unknown action: reboot-everything"));
    }

    @Test
    void actionOnUnknownNodeIs404() throws Exception {
        when(nodeRegistry.dispatchAction("ghost", NodeAction.RECONNECT)).thenThrow(new NodeNotFoundException("ghost"));

        mockMvc.perform(post("/api/nodes/ghost/action")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"reconnect\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void queuesCommandForNode() throws Exception {
        mockMvc.perform(post("/api/nodes/a1b2c3d4e5f60718/commands")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"apply_config\",\"config\":{\"heartbeatInterval\":10000}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.queued").value("apply_config"));

        ArgumentCaptor<NodeCommand> captor = ArgumentCaptor.forClass(NodeCommand.class);
        verify(nodeRegistry).queueCommand(eq("a1b2c3d4e5f60718"), captor.capture());
        assertThat(captor.getValue().getConfig()).containsEntry("heartbeatInterval", 10000);
    }

    @Test
    void commandWithoutTypeIs400() throws Exception {
        mockMvc.perform(post("/api/nodes/a1b2c3d4e5f60718/commands")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"config\":{}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Command type is required"));
    }

    @Test
    void statusReportForUnknownNodeIs404() throws Exception {
        doThrow(new NodeNotFoundException("ghost")).when(nodeRegistry).recordStatusReport(eq("ghost"), any());

        mockMvc.perform(post("/api/nodes/ghost/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"online\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void diagnosticsAreRecorded() throws Exception {
        mockMvc.perform(post("/api/nodes/a1b2c3d4e5f60718/diagnostics")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tests\":{\"internet\":{\"alive\":true}}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        verify(nodeRegistry).recordDiagnostics(eq("a1b2c3d4e5f60718"), any());
    }

    @Test
    void malformedBodyIs400() throws Exception {
        mockMvc.perform(post("/api/nodes/a1b2c3d4e5f60718/diagnostics")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed request body"));
    }
}
