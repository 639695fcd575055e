package com.incoresoft.blePresence.web;

import com.incoresoft.blePresence.config.BleProps;
import com.incoresoft.blePresence.domain.query.BeaconNotFoundException;
import com.incoresoft.blePresence.domain.query.dto.BeaconReceivers;
import com.incoresoft.blePresence.domain.query.dto.StatusSummary;
import com.incoresoft.blePresence.domain.query.service.PresenceQueryService;
import com.incoresoft.blePresence.domain.registry.RegistryWriter;
import com.incoresoft.blePresence.domain.registry.dto.BeaconDto;
import com.incoresoft.blePresence.domain.registry.dto.RegistryDocument;
import com.incoresoft.blePresence.domain.report.service.PresenceReportService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class BleControllerTest {
    private static final long NOW = 1_700_000_000_000L;

    private PresenceQueryService queries;
    private RegistryWriter writer;
    private BleProps props;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        queries = mock(PresenceQueryService.class);
        writer = mock(RegistryWriter.class);
        props = new BleProps();
        Clock clock = Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC);
        BleController controller = new BleController(queries, mock(PresenceReportService.class), writer, props, clock);
        mvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void dataSaysNoDataWhenEmpty() throws Exception {
        when(queries.snapshot()).thenReturn(RegistryDocument.empty());

        mvc.perform(get("/api/ble/data"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("No data"))
                .andExpect(jsonPath("$.timestamp").value(NOW));
    }

    @Test
    void dataReturnsDocument() throws Exception {
        RegistryDocument doc = RegistryDocument.empty();
        doc.getBeacons().put("AA:01", new BeaconDto("ESP-C3-1", 5L));
        when(queries.snapshot()).thenReturn(doc);

        mvc.perform(get("/api/ble/data"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.beacons['AA:01'].name").value("ESP-C3-1"))
                .andExpect(jsonPath("$.data.beacons['AA:01'].first_seen").value(5))
                .andExpect(jsonPath("$.message").doesNotExist());
    }

    @Test
    void receiversOfUnknownBeaconIs404() throws Exception {
        when(queries.receiversFor("ZZ", NOW)).thenThrow(new BeaconNotFoundException("ZZ"));

        mvc.perform(get("/api/ble/beacon/ZZ/receivers"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("not_found"));
    }

    @Test
    void receiversOfKnownBeacon() throws Exception {
        when(queries.receiversFor("AA", NOW)).thenReturn(new BeaconReceivers("ESP-C3-1", "AA", "Beacon #1", List.of(), NOW));

        mvc.perform(get("/api/ble/beacon/AA/receivers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.beaconMac").value("AA"))
                .andExpect(jsonPath("$.data.displayName").value("Beacon #1"));
    }

    @Test
    void statusUsesStatusEnvelope() throws Exception {
        when(queries.statusSummary(NOW)).thenReturn(new StatusSummary(
                new StatusSummary.Counts(3, 2), new StatusSummary.Counts(5, 1), 10_000L, NOW));

        mvc.perform(get("/api/ble/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status.receivers.total").value(3))
                .andExpect(jsonPath("$.status.beacons.active").value(1))
                .andExpect(jsonPath("$.status.active_window").value(10_000));
    }

    @Test
    void resetIsForbiddenWithoutConfiguredKey() throws Exception {
        mvc.perform(delete("/api/ble/data").header("X-Api-Key", "anything"))
                .andExpect(status().isForbidden());

        verify(writer, never()).reset();
    }

    @Test
    void resetNeedsMatchingKey() throws Exception {
        props.setAdminApiKey("s3cret");
        when(writer.reset()).thenReturn(true);

        mvc.perform(delete("/api/ble/data").header("X-Api-Key", "wrong"))
                .andExpect(status().isForbidden());
        mvc.perform(delete("/api/ble/data"))
                .andExpect(status().isForbidden());
        verify(writer, never()).reset();

        mvc.perform(delete("/api/ble/data").header("X-Api-Key", "s3cret"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));
        verify(writer).reset();
    }
}
