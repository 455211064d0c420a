package org.example.flower_shop.navigation;

/**
 * Кнопка на экране: текст + callback_data, который придёт при нажатии.
 */
public record ScreenAction(String label, String callbackData) {

    /** Переход вперёд на экран */
    public static ScreenAction enter(String label, ScreenId screen) {
        return enter(label, screen.getId());
    }

    public static ScreenAction enter(String label, String screenId) {
        return new ScreenAction(label, CallbackData.enter(screenId));
    }

    public static ScreenAction of(String label, String callbackData) {
        return new ScreenAction(label, callbackData);
    }
}
