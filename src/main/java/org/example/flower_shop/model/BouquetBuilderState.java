package org.example.flower_shop.model;

/**
 * Шаги конструктора букета.
 * <p>
 * Каждый шаг — один вопрос от бота. Флоу строго линейный:
 * CHOOSE_COLOR → CHOOSE_QUANTITY → CHOOSE_ADDONS → SUMMARY
 * <p>
 * SUMMARY — финальный шаг: всё собрано, ждём "Добавить в корзину".
 */
public enum BouquetBuilderState {

    /** Ждём цвет */
    CHOOSE_COLOR("color", 1),

    /** Ждём количество цветов */
    CHOOSE_QUANTITY("quantity", 2),

    /** Ждём дополнения (мультивыбор) */
    CHOOSE_ADDONS("addons", 3),

    /** Предпросмотр готового букета */
    SUMMARY("summary", 4);

    /** Сколько шагов с вводом (SUMMARY не считается) */
    public static final int INPUT_STEPS = 3;

    private final String tag;
    private final int stepNumber;

    BouquetBuilderState(String tag, int stepNumber) {
        this.tag = tag;
        this.stepNumber = stepNumber;
    }

    public String getTag() {
        return tag;
    }

    public int getStepNumber() {
        return stepNumber;
    }

    public boolean isFirst() {
        return this == CHOOSE_COLOR;
    }

    public boolean isTerminal() {
        return this == SUMMARY;
    }

    public BouquetBuilderState next() {
        return isTerminal() ? this : values()[ordinal() + 1];
    }

    public BouquetBuilderState previous() {
        return isFirst() ? this : values()[ordinal() - 1];
    }
}
