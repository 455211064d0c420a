package org.example.flower_shop.model;

import java.util.List;

/**
 * Входящее событие от юзера: (userId, действие, данные).
 */
public record NavigationEvent(
        Long userId,
        NavigationAction action,
        List<String> payload
) {

    public NavigationEvent {
        payload = payload == null ? List.of() : List.copyOf(payload);
    }

    public static NavigationEvent of(Long userId, NavigationAction action) {
        return new NavigationEvent(userId, action, List.of());
    }

    public static NavigationEvent of(Long userId, NavigationAction action, String value) {
        return new NavigationEvent(userId, action, List.of(value));
    }

    /** Первое значение payload (id экрана, выбранная опция и т.п.) или null */
    public String value() {
        return payload.isEmpty() ? null : payload.get(0);
    }
}
