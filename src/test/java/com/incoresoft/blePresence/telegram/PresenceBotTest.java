package com.incoresoft.blePresence.telegram;

import com.incoresoft.blePresence.config.TelegramProps;
import com.incoresoft.blePresence.domain.query.dto.BeaconDetail;
import com.incoresoft.blePresence.domain.query.dto.StatusSummary;
import com.incoresoft.blePresence.domain.query.service.PresenceQueryService;
import com.incoresoft.blePresence.domain.registry.RegistryWriter;
import com.incoresoft.blePresence.domain.report.service.PresenceMessageFormatter;
import com.incoresoft.blePresence.domain.report.service.PresenceReportService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PresenceBotTest {

    private TelegramProps props;
    private PresenceQueryService queries;
    private PresenceMessageFormatter formatter;
    private PresenceReportService reports;
    private RegistryWriter writer;
    private PresenceBot bot;

    @BeforeEach
    void setUp() {
        props = new TelegramProps();
        props.setAdminChatIds(Set.of(42L));
        queries = mock(PresenceQueryService.class);
        formatter = mock(PresenceMessageFormatter.class);
        reports = mock(PresenceReportService.class);
        writer = mock(RegistryWriter.class);
        bot = new PresenceBot(props, queries, formatter, reports, writer, Clock.systemUTC());
    }

    @Test
    void statusCommandAndMenuLabelGiveSameView() {
        StatusSummary summary = new StatusSummary(new StatusSummary.Counts(0, 0), new StatusSummary.Counts(0, 0), 10_000L, 5L);
        when(queries.activeBeacons(5L)).thenReturn(List.of());
        when(queries.statusSummary(5L)).thenReturn(summary);
        when(formatter.status(List.of(), summary, 5L)).thenReturn("No beacon data yet");

        assertThat(bot.handleCommand(1L, "/status", 5L).text()).isEqualTo("No beacon data yet");
        assertThat(bot.handleCommand(1L, "Status", 5L).text()).isEqualTo("No beacon data yet");
    }

    @Test
    void detailPassesNameFragment() {
        BeaconDetail detail = new BeaconDetail("AA:01", "ESP-C3-003", 0L, List.of(), null);
        when(queries.beaconDetail("C3-003", 5L)).thenReturn(Optional.of(detail));
        when(formatter.detail(detail)).thenReturn("details");

        assertThat(bot.handleCommand(1L, "/detail  C3-003 ", 5L).text()).isEqualTo("details");
    }

    @Test
    void detailWithoutMatchOrArgument() {
        when(queries.beaconDetail(eq("zzz"), anyLong())).thenReturn(Optional.empty());

        assertThat(bot.handleCommand(1L, "/detail zzz", 5L).text()).contains("zzz");
        assertThat(bot.handleCommand(1L, "/detail", 5L).text()).startsWith("Give a beacon name");
    }

    @Test
    void reportCommandSendsWorkbook() throws Exception {
        File file = new File("ble_presence.xlsx");
        when(reports.buildPresenceReport(5L)).thenReturn(file);

        PresenceBot.BotReply reply = bot.handleCommand(1L, "/report", 5L);

        assertThat(reply.document()).isSameAs(file);
    }

    @Test
    void reportFailureIsReportedAsText() throws Exception {
        when(reports.buildPresenceReport(5L)).thenThrow(new IOException("disk full"));

        PresenceBot.BotReply reply = bot.handleCommand(1L, "/report", 5L);

        assertThat(reply.document()).isNull();
        assertThat(reply.text()).contains("disk full");
    }

    @Test
    void resetOnlyForAdminChats() {
        when(writer.reset()).thenReturn(true);

        assertThat(bot.handleCommand(7L, "/reset", 5L).text()).isEqualTo("Not authorized");
        verify(writer, never()).reset();

        assertThat(bot.handleCommand(42L, "/reset", 5L).text()).contains("reset");
        verify(writer).reset();
    }

    @Test
    void unknownCommandPointsToStart() {
        assertThat(bot.handleCommand(1L, "hello", 5L).text()).contains("/start");
        assertThat(bot.handleCommand(1L, null, 5L).text()).contains("/start");
    }
}
