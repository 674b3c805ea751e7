package org.crash.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;
import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class PlayerControllerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void inscriptionPuisLecture_soldeDeDepart() throws Exception {
        String wallet = "0x" + UUID.randomUUID();
        String body = objectMapper.writeValueAsString(Map.of("walletAddress", wallet));

        mockMvc.perform(post("/api/players").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.walletAddress").value(wallet))
                .andExpect(jsonPath("$.balances.USD").value(1000.0));

        mockMvc.perform(post("/api/players").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Wallet already registered."));

        mockMvc.perform(get("/api/players/{wallet}", wallet))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balances.USD").value(1000.0));
    }

    @Test
    void walletInconnu_404() throws Exception {
        mockMvc.perform(get("/api/players/{wallet}", "0xinconnu"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("User not found."));
    }

    @Test
    void verify_recalculPublic() throws Exception {
        mockMvc.perform(get("/api/crash/verify")
                        .param("serverSeed", "ab".repeat(32))
                        .param("nonce", "7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.clientSeed").value("global_client_seed"))
                .andExpect(jsonPath("$.crashPoint").value("1.01"));
    }
}
