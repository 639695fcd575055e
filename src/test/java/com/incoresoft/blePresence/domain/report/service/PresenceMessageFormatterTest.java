package com.incoresoft.blePresence.domain.report.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.incoresoft.blePresence.config.BleProps;
import com.incoresoft.blePresence.domain.presence.dto.RankedReceiver;
import com.incoresoft.blePresence.domain.presence.service.StalenessEvaluator;
import com.incoresoft.blePresence.domain.query.dto.ActiveBeacon;
import com.incoresoft.blePresence.domain.query.dto.BeaconDetail;
import com.incoresoft.blePresence.domain.query.dto.RssiStats;
import com.incoresoft.blePresence.domain.query.dto.StatusSummary;
import com.incoresoft.blePresence.domain.registry.dto.BeaconDto;
import com.incoresoft.blePresence.domain.registry.dto.DetectionDto;
import com.incoresoft.blePresence.domain.registry.dto.RegistryDocument;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PresenceMessageFormatterTest {

    private final PresenceMessageFormatter formatter = new PresenceMessageFormatter(staleness(), new ObjectMapper());

    private static StalenessEvaluator staleness() {
        BleProps props = new BleProps();
        props.setTimezone("UTC");
        return new StalenessEvaluator(props);
    }

    private static StatusSummary summary(int beacons) {
        return new StatusSummary(new StatusSummary.Counts(2, 1), new StatusSummary.Counts(beacons, 1), 10_000L, 0L);
    }

    private static ActiveBeacon beacon(int i) {
        return new ActiveBeacon("AA:" + i, "ESP-C3-" + i,
                List.of(new RankedReceiver("R1", "Hall", -55, true, 1_000L, "1970/1/1 00:00:01")));
    }

    @Test
    void statusExplainsEmptyStates() {
        assertThat(formatter.status(List.of(), summary(0), 0L)).isEqualTo("No beacon data yet");
        assertThat(formatter.status(List.of(), summary(3), 0L)).isEqualTo("No active beacons (last 10 s)");
    }

    @Test
    void statusListsReceiversWithSignalLevel() {
        String msg = formatter.status(List.of(beacon(1)), summary(1), 4_000L);

        assertThat(msg).contains("ESP-C3-1", "MAC: AA:1", "📶strong", "Hall", "-55dBm", "3s ago",
                "Active: 1/2 receivers | 1/1 beacons");
    }

    @Test
    void statusShowsTopBeaconsOnly() {
        List<ActiveBeacon> active = new ArrayList<>();
        for (int i = 0; i < 17; i++) active.add(beacon(i));

        String msg = formatter.status(active, summary(17), 1_000L);

        assertThat(msg).contains("ESP-C3-14").doesNotContain("ESP-C3-15\n").contains("... and 2 more active beacons");
    }

    @Test
    void signalLevelBands() {
        assertThat(PresenceMessageFormatter.signalLevel(-60)).isEqualTo("📶strong");
        assertThat(PresenceMessageFormatter.signalLevel(-61)).isEqualTo("📶medium");
        assertThat(PresenceMessageFormatter.signalLevel(-80)).isEqualTo("📶weak");
        assertThat(PresenceMessageFormatter.signalLevel(-81)).isEqualTo("📶very weak");
    }

    @Test
    void ageTexts() {
        assertThat(PresenceMessageFormatter.secondsAgo(500)).isEqualTo("just now");
        assertThat(PresenceMessageFormatter.minutesAgo(5 * 60_000L)).isEqualTo("5 min ago");
        assertThat(PresenceMessageFormatter.minutesAgo(125 * 60_000L)).isEqualTo("2 h ago");
    }

    @Test
    void detailShowsRecentStats() {
        BeaconDetail detail = new BeaconDetail("AA:01", "ESP-C3-3", 0L,
                List.of(new BeaconDetail.Line("R1", "Hall", -58, true, 1_000L, 1_000L, true)),
                RssiStats.of(List.of(-58)));

        assertThat(formatter.detail(detail)).contains("ESP-C3-3", "1970/1/1 00:00:00", "Average: -58.0dBm");
    }

    @Test
    void jsonIsTruncatedForChat() {
        RegistryDocument doc = RegistryDocument.empty();
        for (int i = 0; i < 60; i++) {
            BeaconDto b = new BeaconDto("ESP-C3-" + i, 0L);
            b.getDetections().put("R1", DetectionDto.builder().receiverName("Hall").rssi(-60).updateTime(0L).build());
            doc.getBeacons().put("AA:" + i, b);
        }

        String json = formatter.json(doc);

        assertThat(json).startsWith("```json\n").endsWith("\n... (truncated)\n```");
        assertThat(json.length()).isLessThan(PresenceMessageFormatter.JSON_LIMIT);
    }

    @Test
    void jsonOfEmptyRegistry() {
        assertThat(formatter.json(RegistryDocument.empty())).isEqualTo("No beacon data yet");
    }

    @Test
    void truncationKeepsEmojiWhole() {
        String head = "a".repeat(PresenceMessageFormatter.JSON_TRUNCATE_AT - 1);
        String text = head + "😀" + "b".repeat(200);

        String cut = PresenceMessageFormatter.truncateForChat(text);

        assertThat(cut).isEqualTo(head + "\n... (truncated)");
        assertThat(PresenceMessageFormatter.truncateForChat("short")).isEqualTo("short");
    }
}
