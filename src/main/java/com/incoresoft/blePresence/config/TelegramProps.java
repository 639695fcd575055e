package com.incoresoft.blePresence.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashSet;
import java.util.Set;

@Data
@ConfigurationProperties(prefix = "telegram.bot")
public class TelegramProps {
    private boolean enabled;
    private String username;
    private String token;
    /** Chats allowed to run /reset. */
    private Set<Long> adminChatIds = new HashSet<>();
}
