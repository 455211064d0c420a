package org.example.flower_shop.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Кто может заходить в админку (/admin).
 * <p>
 * app.admin.ids=123456789,987654321
 * Пустой список — админка открыта всем (удобно для локальной разработки).
 */
@Slf4j
@Configuration
public class AdminConfig {

    @Value("${app.admin.ids:}")
    private List<Long> adminIds;

    @PostConstruct
    public void init() {
        if (adminIds.isEmpty()) {
            log.warn("app.admin.ids не задан — админка доступна всем пользователям!");
        } else {
            log.info("Администраторы бота: {}", adminIds);
        }
    }

    public boolean isAdmin(Long telegramId) {
        return adminIds.isEmpty() || adminIds.contains(telegramId);
    }
}
