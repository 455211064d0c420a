package org.example.flower_shop.navigation;

/**
 * Внешний контекст для рендерера: кто смотрит экран.
 *
 * @param firstName имя из Telegram (может быть null, если событие пришло не из Telegram)
 */
public record RenderContext(Long telegramId, String firstName) {

    public static RenderContext of(Long telegramId) {
        return new RenderContext(telegramId, null);
    }
}
