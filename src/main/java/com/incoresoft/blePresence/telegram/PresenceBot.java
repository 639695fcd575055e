package com.incoresoft.blePresence.telegram;

import com.incoresoft.blePresence.config.TelegramProps;
import com.incoresoft.blePresence.domain.query.service.PresenceQueryService;
import com.incoresoft.blePresence.domain.registry.RegistryWriter;
import com.incoresoft.blePresence.domain.report.service.PresenceMessageFormatter;
import com.incoresoft.blePresence.domain.report.service.PresenceReportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.methods.send.SendDocument;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.InputFile;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.KeyboardRow;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.io.File;
import java.time.Clock;
import java.util.List;
import java.util.Locale;

/**
 * Chat front end for the presence views: /status, /list, /detail &lt;name&gt;, /stats,
 * /json, /report and, for admin chats, /reset.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "telegram.bot", name = "enabled", havingValue = "true")
public class PresenceBot extends TelegramLongPollingBot {

    private final TelegramProps telegramProps;
    private final PresenceQueryService queryService;
    private final PresenceMessageFormatter formatter;
    private final PresenceReportService reportService;
    private final RegistryWriter registryWriter;
    private final Clock clock;

    /** Reply for one command: text, or a document with a caption. */
    public record BotReply(String text, File document) {
        static BotReply text(String text) {
            return new BotReply(text, null);
        }
    }

    @Override
    public void onUpdateReceived(Update update) {
        if (update == null || !update.hasMessage() || !update.getMessage().hasText()) return;
        Long chatId = update.getMessage().getChatId();
        try {
            String text = update.getMessage().getText();
            if ("/start".equalsIgnoreCase(text.trim())) {
                sendStartMenu(chatId);
                return;
            }
            BotReply reply = handleCommand(chatId, text, clock.millis());
            if (reply.document() != null) {
                SendDocument doc = new SendDocument(chatId.toString(), new InputFile(reply.document()));
                doc.setCaption(reply.text());
                execute(doc);
            } else {
                execute(new SendMessage(chatId.toString(), reply.text()));
            }
        } catch (Exception ex) {
            log.error("Error processing update: {}", ex.getMessage(), ex);
        }
    }

    /** Maps a chat message to its reply. Menu button labels work as well as slash commands. */
    public BotReply handleCommand(Long chatId, String rawText, long now) {
        String text = rawText == null ? "" : rawText.trim();
        String command = text.split("\\s+", 2)[0].toLowerCase(Locale.ROOT);
        String argument = text.contains(" ") ? text.substring(text.indexOf(' ') + 1).trim() : "";

        switch (command) {
            case "/status", "status" -> {
                return BotReply.text(formatter.status(queryService.activeBeacons(now), queryService.statusSummary(now), now));
            }
            case "/list", "list" -> {
                return BotReply.text(formatter.beaconList(queryService.beaconList(now), now));
            }
            case "/detail" -> {
                if (argument.isEmpty()) {
                    return BotReply.text("Give a beacon name, e.g. /detail ESP-C3-003");
                }
                return queryService.beaconDetail(argument, now)
                        .map(d -> BotReply.text(formatter.detail(d)))
                        .orElseGet(() -> BotReply.text("No beacon with a name containing \"" + argument + "\""));
            }
            case "/stats", "stats" -> {
                return BotReply.text(formatter.statistics(queryService.statistics(now), now));
            }
            case "/json", "json" -> {
                return BotReply.text(formatter.json(queryService.snapshot()));
            }
            case "/report", "report" -> {
                try {
                    File report = reportService.buildPresenceReport(now);
                    return new BotReply("Beacon presence report", report);
                } catch (Exception ex) {
                    log.error("Report generation failed: {}", ex.getMessage(), ex);
                    return BotReply.text("Failed to generate report: " + ex.getMessage());
                }
            }
            case "/reset" -> {
                if (!telegramProps.getAdminChatIds().contains(chatId)) {
                    log.warn("Reset refused for chat {}", chatId);
                    return BotReply.text("Not authorized");
                }
                boolean persisted = registryWriter.reset();
                return BotReply.text(persisted ? "✅ Beacon data reset" : "Beacon data reset in memory, saving failed");
            }
            default -> {
                return BotReply.text("Send /start to see the commands.");
            }
        }
    }

    private void sendStartMenu(Long chatId) throws TelegramApiException {
        ReplyKeyboardMarkup kb = new ReplyKeyboardMarkup();
        kb.setResizeKeyboard(true);
        kb.setSelective(true);
        kb.setOneTimeKeyboard(false);

        KeyboardRow top = new KeyboardRow();
        top.add("Status");
        top.add("List");
        top.add("Stats");
        KeyboardRow bottom = new KeyboardRow();
        bottom.add("JSON");
        bottom.add("Report");
        kb.setKeyboard(List.of(top, bottom));

        String help = """
                Beacon presence:
                • Status: active beacons and their receivers
                • List: every known beacon
                • /detail <name>: one beacon
                • Stats: counts and signal summary
                """;
        SendMessage msg = new SendMessage(chatId.toString(), help);
        msg.setReplyMarkup(kb);
        execute(msg);
    }

    @Override
    public String getBotUsername() {
        return telegramProps.getUsername();
    }

    @Override
    public String getBotToken() {
        return telegramProps.getToken();
    }
}
