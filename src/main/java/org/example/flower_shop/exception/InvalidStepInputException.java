package org.example.flower_shop.exception;

import org.example.flower_shop.model.BouquetBuilderState;

/**
 * Значение не подходит для текущего шага конструктора букета.
 * Шаг и уже собранные поля при этом не меняются — юзера просто переспрашиваем.
 */
public class InvalidStepInputException extends BotFlowException {

    private final BouquetBuilderState step;

    public InvalidStepInputException(BouquetBuilderState step, String message) {
        super(message);
        this.step = step;
    }

    public BouquetBuilderState getStep() {
        return step;
    }
}
