package com.rebenew.watchParty.syncserver.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebenew.watchParty.syncserver.core.SessionCoordinator;
import com.rebenew.watchParty.syncserver.support.TestRig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class RoomControllerTest {

    private TestRig rig;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        rig = new TestRig();
        mvc = MockMvcBuilders.standaloneSetup(new RoomController(rig.coordinator, rig.registry, rig.clock)).build();
    }

    @Test
    void createRoomReturnsJoinableId() throws Exception {
        MvcResult result = mvc.perform(post("/create-room"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.roomId").isString())
                .andReturn();

        String roomId = new ObjectMapper().readTree(result.getResponse().getContentAsString())
                .get("roomId").asText();
        assertThat(roomId).hasSize(6);
        assertThat(rig.registry.roomExists(roomId)).isTrue();
    }

    @Test
    void createRoomFailureIsReportedAs500() throws Exception {
        SessionCoordinator failing = mock(SessionCoordinator.class);
        when(failing.createRoom()).thenThrow(new IllegalStateException("no ids left"));
        MockMvc failingMvc = MockMvcBuilders.standaloneSetup(new RoomController(failing, rig.registry, rig.clock)).build();

        failingMvc.perform(post("/create-room"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("internal_server_error"));
    }

    @Test
    void unknownRoomIs404() throws Exception {
        mvc.perform(get("/rooms/NOPE00")).andExpect(status().isNotFound());
    }

    @Test
    void roomSummaryListsMembers() throws Exception {
        rig.connect("host", "viewer");
        rig.coordinator.join("host", "ROOM01", "Host", true, false, null);
        rig.coordinator.join("viewer", "ROOM01", "Viewer", false, false, null);

        mvc.perform(get("/rooms/ROOM01"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.roomId").value("ROOM01"))
                .andExpect(jsonPath("$.hostId").value("host"))
                .andExpect(jsonPath("$.users.length()").value(2))
                .andExpect(jsonPath("$.streamingInfo.isStreaming").value(false));

        mvc.perform(get("/rooms"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalRooms").value(1))
                .andExpect(jsonPath("$.timestamp").value(rig.clock.millis()))
                .andExpect(jsonPath("$.rooms[0].roomId").value("ROOM01"));
    }

    @Test
    void healthReportsStatusAndCounts() throws Exception {
        rig.connect("host");
        rig.coordinator.join("host", "ROOM01", "Host", true, false, null);

        mvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.service").value("watch-party-sync"))
                .andExpect(jsonPath("$.rooms").value(1))
                .andExpect(jsonPath("$.participants").value(1));
    }
}
