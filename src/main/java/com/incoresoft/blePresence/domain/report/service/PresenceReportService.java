package com.incoresoft.blePresence.domain.report.service;

import com.incoresoft.blePresence.config.BleProps;
import com.incoresoft.blePresence.domain.presence.service.StalenessEvaluator;
import com.incoresoft.blePresence.domain.query.service.PresenceQueryService;
import com.incoresoft.blePresence.domain.registry.dto.BeaconDto;
import com.incoresoft.blePresence.domain.registry.dto.DetectionDto;
import com.incoresoft.blePresence.domain.registry.dto.ReceiverDto;
import com.incoresoft.blePresence.domain.registry.dto.RegistryDocument;
import com.incoresoft.blePresence.domain.shared.BeaconDisplayNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * XLSX snapshot of the registry: a "Beacons" sheet with one row per detection and a
 * "Receivers" sheet with one row per receiver.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PresenceReportService {
    static final List<String> BEACON_COLUMNS = List.of(
            "MAC", "Name", "Display name", "First seen", "Receiver ID", "Receiver", "RSSI", "Online",
            "Last update", "Fresh");
    static final List<String> RECEIVER_COLUMNS = List.of(
            "ID", "Name", "Type", "Last report", "Batch", "Total batches", "Active");
    private static final int COL_WIDTH = 22 * 256;
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final PresenceQueryService queryService;
    private final StalenessEvaluator staleness;
    private final BleProps props;

    public File buildPresenceReport(long now) throws IOException {
        Path dir = Paths.get(props.getReport().getOutputDir());
        Files.createDirectories(dir);
        String name = "ble_presence_" + FILE_STAMP.format(Instant.ofEpochMilli(now).atZone(staleness.zone())) + ".xlsx";
        return exportWorkbook(queryService.snapshot(), now, dir.resolve(name).toFile());
    }

    public File exportWorkbook(RegistryDocument doc, long now, File outFile) throws IOException {
        try (Workbook wb = new XSSFWorkbook()) {
            CellStyle headerStyle = wb.createCellStyle();
            Font headerFont = wb.createFont();
            headerFont.setBold(true);
            headerStyle.setFont(headerFont);

            Sheet beacons = wb.createSheet("Beacons");
            header(beacons, BEACON_COLUMNS, headerStyle);
            int rowIndex = 1;
            for (Map.Entry<String, BeaconDto> e : doc.getBeacons().entrySet()) {
                BeaconDto b = e.getValue();
                for (Map.Entry<String, DetectionDto> d : b.getDetections().entrySet()) {
                    DetectionDto det = d.getValue();
                    OptionalLong ts = staleness.resolveTimestamp(det);
                    Row row = beacons.createRow(rowIndex++);
                    text(row, 0, e.getKey());
                    text(row, 1, b.getName());
                    text(row, 2, BeaconDisplayNames.displayName(b.getName(), props.getTaggedPrefix()));
                    text(row, 3, b.getFirstSeen() == null ? "" : staleness.formatTime(b.getFirstSeen()));
                    text(row, 4, d.getKey());
                    text(row, 5, det.displayReceiverName());
                    if (det.getRssi() != null) row.createCell(6).setCellValue(det.getRssi());
                    text(row, 7, det.reportedOnline() ? "yes" : "no");
                    text(row, 8, ts.isPresent() ? staleness.formatTime(ts.getAsLong()) : "");
                    text(row, 9, staleness.isFresh(det, now) ? "yes" : "no");
                }
            }

            Sheet receivers = wb.createSheet("Receivers");
            header(receivers, RECEIVER_COLUMNS, headerStyle);
            rowIndex = 1;
            for (Map.Entry<String, ReceiverDto> e : doc.getDevices().entrySet()) {
                ReceiverDto r = e.getValue();
                Row row = receivers.createRow(rowIndex++);
                text(row, 0, e.getKey());
                text(row, 1, r.getName());
                text(row, 2, r.getType());
                text(row, 3, r.getUpdate() == null ? "" : staleness.formatTime(r.getUpdate()));
                if (r.getBatch() != null) row.createCell(4).setCellValue(r.getBatch());
                if (r.getTotalBatches() != null) row.createCell(5).setCellValue(r.getTotalBatches());
                text(row, 6, staleness.isReceiverActive(r, now) ? "yes" : "no");
            }

            for (int c = 0; c < BEACON_COLUMNS.size(); c++) beacons.setColumnWidth(c, COL_WIDTH);
            for (int c = 0; c < RECEIVER_COLUMNS.size(); c++) receivers.setColumnWidth(c, COL_WIDTH);

            try (FileOutputStream fos = new FileOutputStream(outFile)) {
                wb.write(fos);
            }
        }
        log.info("Presence report written to excel: {}", outFile.getAbsolutePath());
        return outFile;
    }

    private static void header(Sheet sheet, List<String> columns, CellStyle style) {
        Row header = sheet.createRow(0);
        header.setHeightInPoints(18f);
        for (int c = 0; c < columns.size(); c++) {
            Cell cell = header.createCell(c);
            cell.setCellValue(columns.get(c));
            cell.setCellStyle(style);
        }
    }

    private static void text(Row row, int col, String value) {
        row.createCell(col).setCellValue(StringUtils.defaultString(value));
    }
}
