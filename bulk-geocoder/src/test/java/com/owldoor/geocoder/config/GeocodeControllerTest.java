package com.owldoor.geocoder.config;

import com.owldoor.geocoder.model.BatchState;
import com.owldoor.geocoder.model.GeocodeRun;
import com.owldoor.geocoder.service.BatchProcessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Optional;
import java.util.concurrent.Executor;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("GeocodeController Tests")
class GeocodeControllerTest {

    private BatchProcessor batchProcessor;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        batchProcessor = mock(BatchProcessor.class);
        mvc = MockMvcBuilders.standaloneSetup(new GeocodeController(batchProcessor)).build();
    }

    @Test
    @DisplayName("Providers endpoint lists all three providers with their limits")
    void testProviders() throws Exception {
        mvc.perform(get("/geocode/providers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(3))
                .andExpect(jsonPath("$[0].id").value("nominatim"))
                .andExpect(jsonPath("$[0].keyRequired").value(false))
                .andExpect(jsonPath("$[0].rateLimit").value("min interval 1000 ms"))
                .andExpect(jsonPath("$[1].id").value("google"))
                .andExpect(jsonPath("$[1].keyRequired").value(true))
                .andExpect(jsonPath("$[2].id").value("mapbox"));
    }

    @Test
    @DisplayName("Submitting while a run is active returns 409")
    void testSubmitWhileBusy() throws Exception {
        when(batchProcessor.isBusy()).thenReturn(true);

        mvc.perform(post("/geocode/jobs").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"input\":\"in.csv\",\"output\":\"out.csv\"}"))
                .andExpect(status().isConflict());

        verify(batchProcessor, never()).start(any(), any());
        verify(batchProcessor, never()).run(any());
    }

    @Test
    @DisplayName("Losing the race for the processor returns 409")
    void testSubmitLosesClaim() throws Exception {
        when(batchProcessor.start(any(), any())).thenReturn(false);

        mvc.perform(post("/geocode/jobs").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"input\":\"in.csv\",\"output\":\"out.csv\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error", containsString("already in progress")));
    }

    @Test
    @DisplayName("Keyed provider without a key is rejected with 400")
    void testSubmitMissingKey() throws Exception {
        mvc.perform(post("/geocode/jobs").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"input\":\"in.csv\",\"output\":\"out.csv\",\"provider\":\"google\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("API key")));
    }

    @Test
    @DisplayName("Unknown provider is rejected with 400")
    void testSubmitUnknownProvider() throws Exception {
        mvc.perform(post("/geocode/jobs").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"input\":\"in.csv\",\"output\":\"out.csv\",\"provider\":\"bing\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("nominatim, google, mapbox")));
    }

    @Test
    @DisplayName("Accepted job runs on a background thread")
    void testSubmitAccepted() throws Exception {
        when(batchProcessor.start(any(), any())).thenAnswer(invocation -> {
            Executor executor = invocation.getArgument(1);
            executor.execute(() -> batchProcessor.run(invocation.getArgument(0)));
            return true;
        });
        when(batchProcessor.run(any())).thenReturn(GeocodeRun.builder().state(BatchState.COMPLETED).build());

        mvc.perform(post("/geocode/jobs").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"input\":\"in.csv\",\"output\":\"out.csv\","
                                + "\"columns\":{\"addressColumn\":\"address\"}}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("accepted"));

        verify(batchProcessor, timeout(2000)).run(any());
    }

    @Test
    @DisplayName("Status reports the idle state before any run")
    void testStatusIdle() throws Exception {
        when(batchProcessor.getLastRun()).thenReturn(Optional.empty());
        when(batchProcessor.getState()).thenReturn(BatchState.IDLE);

        mvc.perform(get("/geocode/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("IDLE"));
    }

    @Test
    @DisplayName("Status returns the last run report")
    void testStatusLastRun() throws Exception {
        when(batchProcessor.getLastRun()).thenReturn(Optional.of(GeocodeRun.builder()
                .state(BatchState.ABORTED).lastCommittedIndex(999).errorMessage("disk full").build()));

        mvc.perform(get("/geocode/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("ABORTED"))
                .andExpect(jsonPath("$.lastCommittedIndex").value(999))
                .andExpect(jsonPath("$.errorMessage").value("disk full"));
    }
}
