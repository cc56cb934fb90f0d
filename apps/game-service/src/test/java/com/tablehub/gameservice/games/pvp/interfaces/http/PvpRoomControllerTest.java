package com.tablehub.gameservice.games.pvp.interfaces.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class PvpRoomControllerTest {

    private static final String TOKEN = PvpRoomController.TOKEN_HEADER;

    @Autowired
    private MockMvc mvc;

    @Autowired
    private ObjectMapper mapper;

    private JsonNode body(String raw) throws Exception {
        return mapper.readTree(raw);
    }

    private String createRoom() throws Exception {
        String json = mvc.perform(post("/api/pvp/rooms")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"roomName\":\"mvc\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data.name").value("mvc"))
                .andExpect(jsonPath("$.data.seats.length()").value(4))
                .andReturn().getResponse().getContentAsString();
        return body(json).path("data").path("roomId").asText();
    }

    private String join(String roomId, String name) throws Exception {
        String json = mvc.perform(post("/api/pvp/rooms/{id}/join", roomId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userName\":\"" + name + "\"}"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        return body(json).path("data").path("token").asText();
    }

    @Test
    void fullHappyPath() throws Exception {
        String roomId = createRoom();
        String alice = join(roomId, "alice");
        join(roomId, "bob");

        mvc.perform(get("/api/pvp/rooms/{id}/status", roomId).header(TOKEN, alice))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.you").value("RED"));

        mvc.perform(post("/api/pvp/rooms/{id}/start", roomId).header(TOKEN, alice))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.gameId").isNotEmpty());

        mvc.perform(get("/api/pvp/rooms/{id}/game", roomId).header(TOKEN, alice).param("state", "0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.version").value(0))
                .andExpect(jsonPath("$.data.game.phase").value("ROLL"))
                .andExpect(jsonPath("$.data.game.legalActions[0][1]").value("ROLL"));

        mvc.perform(post("/api/pvp/rooms/{id}/action", roomId).header(TOKEN, alice)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":[\"RED\",\"ROLL\",null],\"expected_state_index\":0}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.version").value(1))
                .andExpect(jsonPath("$.data.game.currentColor").value("RED"));
    }

    @Test
    void errorCodesFollowTheTaxonomy() throws Exception {
        String roomId = createRoom();
        String otherRoom = createRoom();
        String alice = join(roomId, "alice");
        String stranger = join(otherRoom, "zed");

        mvc.perform(post("/api/pvp/rooms/{id}/join", roomId)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"userName\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(400));
        mvc.perform(post("/api/pvp/rooms/{id}/join", "missing")
                        .contentType(MediaType.APPLICATION_JSON).content("{\"userName\":\"x\"}"))
                .andExpect(status().isNotFound());
        mvc.perform(get("/api/pvp/rooms/{id}/status", roomId).header(TOKEN, "bogus"))
                .andExpect(status().isUnauthorized());
        mvc.perform(get("/api/pvp/rooms/{id}/status", roomId).header(TOKEN, stranger))
                .andExpect(status().isForbidden());
        mvc.perform(post("/api/pvp/rooms/{id}/leave", roomId))
                .andExpect(status().isUnauthorized());
        mvc.perform(get("/api/pvp/rooms/{id}/game", roomId).header(TOKEN, alice))
                .andExpect(status().isBadRequest());
        mvc.perform(post("/api/pvp/rooms/{id}/start", roomId).header(TOKEN, alice))
                .andExpect(status().isBadRequest());

        String bob = join(roomId, "bob");
        mvc.perform(post("/api/pvp/rooms/{id}/board", roomId).header(TOKEN, bob))
                .andExpect(status().isForbidden());
        mvc.perform(post("/api/pvp/rooms/{id}/start", roomId).header(TOKEN, alice))
                .andExpect(status().isOk());
        mvc.perform(post("/api/pvp/rooms/{id}/board", roomId).header(TOKEN, alice))
                .andExpect(status().isBadRequest());
        mvc.perform(post("/api/pvp/rooms/{id}/leave", roomId).header(TOKEN, bob))
                .andExpect(status().isBadRequest());

        mvc.perform(post("/api/pvp/rooms/{id}/action", roomId).header(TOKEN, bob)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":[\"BLUE\",\"ROLL\"],\"expectedVersion\":0}"))
                .andExpect(status().isForbidden());
        mvc.perform(post("/api/pvp/rooms/{id}/action", roomId).header(TOKEN, alice)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":[\"RED\",\"ROLL\"],\"expectedVersion\":5}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value(409));
        mvc.perform(post("/api/pvp/rooms/{id}/action", roomId).header(TOKEN, alice)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":[\"RED\",\"BUILD\"]}"))
                .andExpect(status().isBadRequest());
        mvc.perform(get("/api/pvp/rooms/{id}/game", roomId).header(TOKEN, alice).param("state", "abc"))
                .andExpect(status().isBadRequest());
        mvc.perform(get("/api/pvp/rooms/{id}/game", roomId).header(TOKEN, alice).param("state", "9"))
                .andExpect(status().isNotFound());
    }

    @Test
    void listIncludesCreatedRooms() throws Exception {
        String roomId = createRoom();
        mvc.perform(get("/api/pvp/rooms"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[?(@.roomId == '" + roomId + "')]").exists());
    }
}
