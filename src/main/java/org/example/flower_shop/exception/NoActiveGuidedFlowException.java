package org.example.flower_shop.exception;

/**
 * Пришло действие конструктора букета, а конструктор не запущен
 * (например, старая кнопка после /start).
 */
public class NoActiveGuidedFlowException extends BotFlowException {

    public NoActiveGuidedFlowException(Long userId) {
        super("Конструктор букета не запущен: userId=" + userId);
    }
}
