package com.weatherline.backend.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.weatherline.backend.BaseE2ETest;
import com.weatherline.backend.config.IngestApiKeyAuthFilter;
import com.weatherline.backend.dto.ProductionEventRequest;
import com.weatherline.backend.dto.WeatherObservationRequest;
import com.weatherline.backend.model.ProductionStatus;
import com.weatherline.backend.model.WeatherAlert;
import com.weatherline.backend.repository.WeatherAlertRepository;
import com.weatherline.backend.repository.WeatherObservationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
class IngestControllerE2ETest extends BaseE2ETest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private WeatherObservationRepository weatherObservationRepository;

    @Autowired
    private WeatherAlertRepository weatherAlertRepository;

    @BeforeEach
    void setUp() {
        weatherObservationRepository.deleteAll();
        weatherAlertRepository.deleteAll();
    }

    @Test
    void shouldStoreReadingAndRaiseAlerts() throws Exception {
        Instant observedAt = Instant.parse("2024-07-15T14:00:00Z");
        WeatherObservationRequest request = WeatherObservationRequest.builder()
                .timestamp(observedAt)
                .locationId("ingest-hot")
                .temperature(97.0)
                .humidity(80.0)
                .pressure(29.9)
                .windSpeed(6.0)
                .precipitation(0.0)
                .build();

        mockMvc.perform(post("/internal/weather-observations")
                .header(IngestApiKeyAuthFilter.INGEST_API_KEY_HEADER, INGEST_API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("ingest-hot_" + observedAt.toEpochMilli()))
                .andExpect(jsonPath("$.accepted").value(true))
                .andExpect(jsonPath("$.alertsRaised").value(2));

        assertTrue(weatherObservationRepository.findById("ingest-hot_" + observedAt.toEpochMilli()).isPresent());
        List<WeatherAlert> alerts = weatherAlertRepository.findByLocationIdOrderByIssuedAtDesc("ingest-hot");
        assertEquals(2, alerts.size());

        mockMvc.perform(get("/api/locations/ingest-hot/weather-alerts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2));
    }

    @Test
    void shouldRejectReadingWithOutOfRangeHumidity() throws Exception {
        WeatherObservationRequest request = WeatherObservationRequest.builder()
                .timestamp(Instant.parse("2024-07-15T14:00:00Z"))
                .locationId("ingest-invalid")
                .temperature(75.0)
                .humidity(120.0)
                .pressure(30.0)
                .build();

        mockMvc.perform(post("/internal/weather-observations")
                .header(IngestApiKeyAuthFilter.INGEST_API_KEY_HEADER, INGEST_API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldAcceptProductionEvent() throws Exception {
        ProductionEventRequest request = ProductionEventRequest.builder()
                .eventId("evt-e2e-1")
                .timestamp(Instant.parse("2024-07-15T14:05:00Z"))
                .locationId("ingest-events")
                .machineId("M-07")
                .status(ProductionStatus.GAIN)
                .cycleTime(42.5)
                .detailParameters(Map.of("time", 60.0))
                .build();

        mockMvc.perform(post("/internal/production-events")
                .header(IngestApiKeyAuthFilter.INGEST_API_KEY_HEADER, INGEST_API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.id").value("evt-e2e-1"))
                .andExpect(jsonPath("$.accepted").value(true));
    }

    @Test
    void shouldRejectProductionEventWithoutLocation() throws Exception {
        ProductionEventRequest request = ProductionEventRequest.builder()
                .eventId("evt-e2e-2")
                .timestamp(Instant.parse("2024-07-15T14:05:00Z"))
                .machineId("M-07")
                .build();

        mockMvc.perform(post("/internal/production-events")
                .header(IngestApiKeyAuthFilter.INGEST_API_KEY_HEADER, INGEST_API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldRejectIngestWithoutApiKey() throws Exception {
        mockMvc.perform(post("/internal/production-events")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Ingest API key required in X-Ingest-Api-Key"));

        mockMvc.perform(post("/internal/production-events")
                .header(IngestApiKeyAuthFilter.INGEST_API_KEY_HEADER, "wrong-key")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Ingest API key not recognized"));
    }
}
