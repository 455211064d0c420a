package org.example.flower_shop.handler;

import lombok.extern.slf4j.Slf4j;
import org.example.flower_shop.model.NavigationAction;
import org.example.flower_shop.model.NavigationEvent;
import org.example.flower_shop.navigation.CallbackData;
import org.example.flower_shop.navigation.ScreenId;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Переводит нажатия кнопок (callback_data) и команды в события навигации.
 */
@Slf4j
@Component
public class CallbackDataParser {

    /**
     * Разобрать callback_data.
     *
     * @return пусто, если формат незнакомый (старая кнопка из прошлой версии бота)
     */
    public Optional<NavigationEvent> parseCallback(Long userId, String data) {
        if (data == null) {
            return Optional.empty();
        }

        // Кнопки с параметром
        if (data.startsWith(CallbackData.NAV_ENTER)) {
            return withValue(userId, NavigationAction.ENTER_SCREEN, data, CallbackData.NAV_ENTER);
        }
        if (data.startsWith(CallbackData.BUILD_PICK)) {
            return withValue(userId, NavigationAction.GUIDED_ADVANCE, data, CallbackData.BUILD_PICK);
        }
        if (data.startsWith(CallbackData.BUILD_TOGGLE)) {
            return withValue(userId, NavigationAction.GUIDED_TOGGLE, data, CallbackData.BUILD_TOGGLE);
        }
        if (data.startsWith(CallbackData.CART_ADD)) {
            return withValue(userId, NavigationAction.CART_ADD, data, CallbackData.CART_ADD);
        }
        if (data.startsWith(CallbackData.ADMIN_FLOWER_DELETE)) {
            return withValue(userId, NavigationAction.ADMIN_FLOWER_DELETE, data, CallbackData.ADMIN_FLOWER_DELETE);
        }

        // Кнопки без параметра
        NavigationAction action = switch (data) {
            case CallbackData.NAV_BACK -> NavigationAction.NAV_BACK;
            case CallbackData.NAV_RESET -> NavigationAction.NAV_RESET;
            case CallbackData.BUILD_START -> NavigationAction.GUIDED_START;
            case CallbackData.BUILD_DONE -> NavigationAction.GUIDED_SUBMIT_ADDONS;
            case CallbackData.BUILD_BACK -> NavigationAction.GUIDED_BACK;
            case CallbackData.BUILD_FINALIZE -> NavigationAction.GUIDED_FINALIZE;
            case CallbackData.BUILD_CANCEL -> NavigationAction.GUIDED_CANCEL;
            case CallbackData.CART_CLEAR -> NavigationAction.CART_CLEAR;
            case CallbackData.CART_CHECKOUT -> NavigationAction.CART_CHECKOUT;
            case CallbackData.ADMIN_FLOWER_ADD -> NavigationAction.ADMIN_FLOWER_START;
            // Отмена одна на оба пошаговых диалога
            case CallbackData.ADMIN_FLOWER_CANCEL -> NavigationAction.GUIDED_CANCEL;
            default -> null;
        };
        if (action == null) {
            log.warn("Неизвестный callback: userId={}, data={}", userId, data);
            return Optional.empty();
        }
        return Optional.of(NavigationEvent.of(userId, action));
    }

    /**
     * Команда или просто текст от юзера.
     */
    public NavigationEvent parseText(Long userId, String text) {
        String command = text.trim().split("\\s+")[0];
        // "/start@FlowerBot" в группах
        int at = command.indexOf('@');
        if (command.startsWith("/") && at > 0) {
            command = command.substring(0, at);
        }

        return switch (command) {
            case "/start" -> NavigationEvent.of(userId, NavigationAction.NAV_RESET);
            case "/admin" -> NavigationEvent.of(userId, NavigationAction.ENTER_SECTION, ScreenId.ADMIN_MAIN.getId());
            case "/build" -> NavigationEvent.of(userId, NavigationAction.GUIDED_START);
            case "/cancel" -> NavigationEvent.of(userId, NavigationAction.GUIDED_CANCEL);
            case "/cart" -> NavigationEvent.of(userId, NavigationAction.ENTER_SCREEN, ScreenId.CART.getId());
            case "/recommend" -> NavigationEvent.of(userId, NavigationAction.ENTER_SCREEN, ScreenId.AI_MENU.getId());
            default -> NavigationEvent.of(userId, NavigationAction.TEXT, text.trim());
        };
    }

    private static Optional<NavigationEvent> withValue(Long userId, NavigationAction action, String data, String prefix) {
        String value = data.substring(prefix.length());
        if (value.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(NavigationEvent.of(userId, action, value));
    }
}
