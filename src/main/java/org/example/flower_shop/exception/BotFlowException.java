package org.example.flower_shop.exception;

/**
 * Базовое исключение навигации и конструктора букета.
 * <p>
 * Все наследники — ожидаемые, восстановимые ситуации: их ловит
 * ConversationEngine и показывает юзеру понятный экран, бот не падает.
 */
public abstract class BotFlowException extends RuntimeException {

    protected BotFlowException(String message) {
        super(message);
    }
}
