package org.example.flower_shop.service;

import lombok.extern.slf4j.Slf4j;
import org.example.flower_shop.model.UserSession;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Хранилище сессий пользователей (в памяти).
 * <p>
 * Разные юзеры обрабатываются параллельно, поэтому мапа — ConcurrentHashMap,
 * а создание сессии при первом сообщении атомарное (computeIfAbsent):
 * два одновременных первых сообщения не создадут две разные сессии.
 * <p>
 * Внутри одной сессии блокировка своя (монитор сессии) — чужие юзеры не ждут.
 */
@Slf4j
@Service
public class SessionService {

    private final Map<Long, UserSession> sessions = new ConcurrentHashMap<>();

    /**
     * Получить сессию юзера или создать новую.
     */
    public UserSession getOrCreate(Long userId) {
        return sessions.computeIfAbsent(userId, id -> {
            log.debug("Новая сессия: userId={}", id);
            return new UserSession(id);
        });
    }

    /**
     * Выполнить действие над сессией юзера. Пока действие идёт,
     * другие события этого же юзера ждут своей очереди.
     */
    public <T> T withSession(Long userId, Function<UserSession, T> action) {
        UserSession session = getOrCreate(userId);
        synchronized (session) {
            return action.apply(session);
        }
    }

    public int size() {
        return sessions.size();
    }
}
