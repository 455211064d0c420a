package org.example.flower_shop.model;

import java.util.List;

/**
 * Снимок сессии, который получает рендерер экрана.
 * Рендерер может только читать — стек навигации он менять не должен.
 *
 * @param bouquetStep шаг конструктора букета или null, если конструктор не запущен
 */
public record SessionSnapshot(
        Long userId,
        String currentScreen,
        List<String> navStack,
        BouquetBuilderState bouquetStep
) {
}
