package com.delta.vms.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class EngineConfigTest {

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void sharedMapperWritesIsoDates() throws Exception {
        String json = objectMapper.writeValueAsString(Map.of(
            "at", Instant.parse("2026-03-01T10:15:30Z"),
            "day", LocalDate.of(2026, 3, 1)
        ));

        assertThat(objectMapper.isEnabled(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)).isFalse();
        assertThat(json).contains("\"at\":\"2026-03-01T10:15:30Z\"").contains("\"day\":\"2026-03-01\"");
    }
}
