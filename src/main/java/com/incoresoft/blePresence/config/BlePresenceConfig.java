package com.incoresoft.blePresence.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

import java.time.Clock;
import java.util.List;

@Slf4j
@Configuration
@EnableConfigurationProperties({BleProps.class, TelegramProps.class})
public class BlePresenceConfig implements SchedulingConfigurer {
    static final String SCHEDULER_THREAD_PREFIX = "ble-scheduler-";

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /** Runs the reaper sweep; a failing run is logged and the next one still fires. */
    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix(SCHEDULER_THREAD_PREFIX);
        scheduler.setErrorHandler(t -> log.error("[SCHEDULER] Task failed: {}", t.getMessage(), t));
        scheduler.initialize();
        return scheduler;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        registrar.setTaskScheduler(taskScheduler());
    }

    @Configuration
    @ConditionalOnProperty(prefix = "telegram.bot", name = "enabled", havingValue = "true")
    static class PresenceBotRegistration {

        @Bean
        public TelegramBotsApi telegramBotsApi(List<TelegramLongPollingBot> bots) throws TelegramApiException {
            TelegramBotsApi api = new TelegramBotsApi(DefaultBotSession.class);
            for (TelegramLongPollingBot bot : bots) {
                api.registerBot(bot);
                log.info("[TELEGRAM] Registered bot {}", bot.getBotUsername());
            }
            return api;
        }
    }
}
