package com.ktb.realtimechat.controller;

import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ktb.realtimechat.service.ServerInstance;
import com.ktb.realtimechat.websocket.RealtimeTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class RealtimeControllerTest {

    private final RealtimeTestFixture fixture = new RealtimeTestFixture();
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ServerInstance serverInstance = new ServerInstance();
        ReflectionTestUtils.setField(serverInstance, "hostName", "chat-1");
        serverInstance.init();

        mockMvc = MockMvcBuilders.standaloneSetup(new RealtimeController(
                fixture.registry, fixture.index, fixture.presenceTracker, serverInstance)).build();
    }

    @Test
    void healthReportsServerId() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.serverId").value(startsWith("chat-1-")));
    }

    @Test
    void statsReflectLocalState() throws Exception {
        var alice = fixture.connect("alice");
        fixture.connect("alice");
        var bob = fixture.connect("bob");
        fixture.join(alice, "r1");
        fixture.join(bob, "r1");
        fixture.join(bob, "r2");

        mockMvc.perform(get("/api/realtime/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_connections").value(3))
                .andExpect(jsonPath("$.online_users").value(2))
                .andExpect(jsonPath("$.active_chatrooms").value(2))
                .andExpect(jsonPath("$.total_subscriptions").value(3));
    }

    @Test
    void presenceOfConnectedAndUnknownUser() throws Exception {
        fixture.connect("alice");
        fixture.connect("alice");

        mockMvc.perform(get("/api/realtime/presence/alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user_id").value("alice"))
                .andExpect(jsonPath("$.online").value(true))
                .andExpect(jsonPath("$.connection_count").value(2));

        mockMvc.perform(get("/api/realtime/presence/nobody"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.online").value(false))
                .andExpect(jsonPath("$.connection_count").value(0));
    }
}
