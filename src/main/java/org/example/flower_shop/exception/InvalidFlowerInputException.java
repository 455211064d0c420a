package org.example.flower_shop.exception;

import org.example.flower_shop.model.FlowerDraftState;

/**
 * Админ ввёл что-то не то при добавлении букета (пустое название, цена не числом).
 * Черновик не меняется, шаг переспрашиваем.
 */
public class InvalidFlowerInputException extends BotFlowException {

    private final FlowerDraftState step;

    public InvalidFlowerInputException(FlowerDraftState step, String message) {
        super(message);
        this.step = step;
    }

    public FlowerDraftState getStep() {
        return step;
    }
}
