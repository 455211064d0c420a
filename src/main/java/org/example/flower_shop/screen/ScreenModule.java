package org.example.flower_shop.screen;

import org.example.flower_shop.navigation.ScreenRegistry;

/**
 * Группа экранов, которая сама регистрирует свои рендереры в реестре.
 * Каждый модуль — Spring-бин, ScreenRegistry собирает их при старте.
 */
public interface ScreenModule {

    void registerScreens(ScreenRegistry registry);
}
