package com.incoresoft.blePresence.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.incoresoft.blePresence.domain.ingest.dto.IngestResult;
import com.incoresoft.blePresence.domain.ingest.dto.ReceiverReportDto;
import com.incoresoft.blePresence.domain.ingest.service.IngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/webhooks/ble")
@RequiredArgsConstructor
public class ReceiverWebhookController {

    private final IngestionService ingestionService;
    private final ObjectMapper objectMapper;

    /**
     * Receivers post one scan batch per call:
     * POST /webhooks/ble/report
     * {"device_id": "R1", "device_name": "Hall", "event_data": {"batch": 1, "total_batches": 1,
     *  "beacons": [{"mac": "AA:BB", "name": "ESP-C3-1", "rssi": -55, "online": true}]}}
     */
    @PostMapping(path = "/report", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<IngestResult> report(@RequestBody String raw) throws JsonProcessingException {
        log.debug("=== /webhooks/ble/report RAW ===\n{}\n=== END RAW ===", raw);
        ReceiverReportDto report = objectMapper.readValue(raw, ReceiverReportDto.class);
        IngestResult result = ingestionService.ingest(report);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(result);
    }
}
