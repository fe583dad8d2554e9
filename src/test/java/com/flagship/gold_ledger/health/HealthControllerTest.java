package com.flagship.gold_ledger.health;

import com.flagship.gold_ledger.IntegrationTestBase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
class HealthControllerTest extends IntegrationTestBase {

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("Health reports the ledger snapshot and both id sequences")
    void testHealth_Up() throws Exception {
        printTestHeader("Health");

        String owner = uniqueAddress("owner");
        openAccount(owner);

        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.database").value("UP"))
            .andExpect(jsonPath("$.ledger.sequences").value("UP"))
            .andExpect(jsonPath("$.ledger.accounts").isNumber());
    }

    @Test
    @DisplayName("Unreachable database turns health DOWN with 503")
    void testHealth_DatabaseDown() {
        JdbcTemplate failing = mock(JdbcTemplate.class);
        when(failing.queryForObject(anyString(), any(RowMapper.class)))
            .thenThrow(new CannotGetJdbcConnectionException("connection refused"));

        ResponseEntity<Map<String, Object>> response = new HealthController(failing).health();

        assertEquals(503, response.getStatusCode().value());
        assertEquals("DOWN", response.getBody().get("status"));
        assertEquals("DOWN", response.getBody().get("database"));
    }
}
