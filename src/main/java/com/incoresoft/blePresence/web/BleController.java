package com.incoresoft.blePresence.web;

import com.incoresoft.blePresence.config.BleProps;
import com.incoresoft.blePresence.domain.query.dto.BeaconReceivers;
import com.incoresoft.blePresence.domain.query.dto.StatusSummary;
import com.incoresoft.blePresence.domain.query.dto.TaggedBeacon;
import com.incoresoft.blePresence.domain.query.service.PresenceQueryService;
import com.incoresoft.blePresence.domain.registry.RegistryWriter;
import com.incoresoft.blePresence.domain.registry.dto.RegistryDocument;
import com.incoresoft.blePresence.domain.report.service.PresenceReportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.File;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Query surface over the beacon registry.
 */
@Slf4j
@RestController
@RequestMapping("/api/ble")
@RequiredArgsConstructor
public class BleController {

    private final PresenceQueryService queryService;
    private final PresenceReportService reportService;
    private final RegistryWriter registryWriter;
    private final BleProps props;
    private final Clock clock;

    /** GET /api/ble/data: every receiver and beacon, escaped names decoded. */
    @GetMapping("/data")
    public Map<String, Object> data() {
        RegistryDocument doc = queryService.snapshot();
        Map<String, Object> body = body(true);
        body.put("data", doc);
        if (doc.isEmpty()) body.put("message", "No data");
        return body;
    }

    /** GET /api/ble/esp-c3-beacons: tagged beacons with a fresh receiver, strongest first. */
    @GetMapping("/esp-c3-beacons")
    public Map<String, Object> taggedBeacons() {
        List<TaggedBeacon> beacons = queryService.taggedBeacons(clock.millis());
        Map<String, Object> body = body(true);
        body.put("data", beacons);
        return body;
    }

    /** GET /api/ble/beacon/{beaconMac}/receivers: MAC or name; 404 when unknown. */
    @GetMapping("/beacon/{beaconMac}/receivers")
    public Map<String, Object> receivers(@PathVariable String beaconMac) {
        BeaconReceivers receivers = queryService.receiversFor(beaconMac, clock.millis());
        Map<String, Object> body = body(true);
        body.put("data", receivers);
        return body;
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        StatusSummary summary = queryService.statusSummary(clock.millis());
        Map<String, Object> body = body(true);
        body.put("status", summary);
        return body;
    }

    /** GET /api/ble/report: XLSX snapshot. */
    @GetMapping("/report")
    public ResponseEntity<?> report() {
        try {
            File file = reportService.buildPresenceReport(clock.millis());
            String cd = "attachment; filename=\"" + URLEncoder.encode(file.getName(), StandardCharsets.UTF_8) + "\"";
            return ResponseEntity.ok()
                    .header(HttpHeaders.CONTENT_DISPOSITION, cd)
                    .header(HttpHeaders.CONTENT_TYPE, "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet")
                    .body(new FileSystemResource(file));
        } catch (Exception ex) {
            log.error("Presence report error: {}", ex.getMessage(), ex);
            return ResponseEntity.internalServerError().body("Failed to build report: " + ex.getMessage());
        }
    }

    /** DELETE /api/ble/data: wipes the registry. Needs X-Api-Key matching ble.adminApiKey. */
    @DeleteMapping("/data")
    public ResponseEntity<Map<String, Object>> reset(@RequestHeader(name = "X-Api-Key", required = false) String apiKey) {
        if (!authorized(apiKey)) {
            log.warn("Reset refused: missing or wrong api key");
            Map<String, Object> body = body(false);
            body.put("message", "Not authorized");
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(body);
        }
        boolean persisted = registryWriter.reset();
        Map<String, Object> body = body(persisted);
        body.put("message", persisted ? "Beacon data reset" : "Beacon data reset in memory, saving failed");
        return persisted ? ResponseEntity.ok(body) : ResponseEntity.internalServerError().body(body);
    }

    private boolean authorized(String apiKey) {
        String expected = props.getAdminApiKey();
        if (!StringUtils.hasText(expected) || !StringUtils.hasText(apiKey)) return false;
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), apiKey.getBytes(StandardCharsets.UTF_8));
    }

    private Map<String, Object> body(boolean success) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", success);
        body.put("timestamp", clock.millis());
        return body;
    }
}
