package org.example.flower_shop.model;

import lombok.Getter;
import lombok.Setter;
import org.example.flower_shop.navigation.ScreenId;

import java.util.ArrayList;
import java.util.List;

/**
 * Сессия пользователя — всё, что бот помнит о юзере между сообщениями.
 * <p>
 * - currentScreen — какой экран сейчас показан
 * - navStack — откуда пришли (последний элемент = вершина стека, туда ведёт "Назад")
 * - bouquetBuilder — состояние конструктора букета (null, если юзер не в нём)
 * - flowerDraft — черновик нового букета в админке (null, если админ его не добавляет)
 * <p>
 * Живёт в памяти (SessionService), после рестарта бота начинается заново.
 * Стек навигации и конструктор букета независимы: навигация не трогает конструктор,
 * конструктор не трогает стек.
 */
@Getter
public class UserSession {

    private final Long userId;

    @Setter
    private String currentScreen = ScreenId.START.getId();

    private final List<String> navStack = new ArrayList<>();

    @Setter
    private BouquetBuilderData bouquetBuilder;

    @Setter
    private FlowerDraft flowerDraft;

    public UserSession(Long userId) {
        this.userId = userId;
    }

    public boolean hasActiveBouquetBuilder() {
        return bouquetBuilder != null;
    }

    public boolean hasActiveFlowerDraft() {
        return flowerDraft != null;
    }

    /**
     * Неизменяемый снимок для рендереров экранов.
     */
    public SessionSnapshot snapshot() {
        return new SessionSnapshot(
                userId,
                currentScreen,
                List.copyOf(navStack),
                bouquetBuilder != null ? bouquetBuilder.getState() : null
        );
    }
}
