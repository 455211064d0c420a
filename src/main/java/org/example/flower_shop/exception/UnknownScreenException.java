package org.example.flower_shop.exception;

/**
 * Экран с таким id не зарегистрирован в ScreenRegistry.
 * В правильно собранном боте такого быть не должно — это ошибка конфигурации.
 */
public class UnknownScreenException extends BotFlowException {

    private final String screenId;

    public UnknownScreenException(String screenId) {
        super("Экран не зарегистрирован: " + screenId);
        this.screenId = screenId;
    }

    public String getScreenId() {
        return screenId;
    }
}
