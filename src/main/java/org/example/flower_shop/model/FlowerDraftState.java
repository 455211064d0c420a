package org.example.flower_shop.model;

/**
 * Шаги добавления нового букета в каталог (админка).
 * <p>
 * NAME → DESCRIPTION → PRICE → CATEGORY, после категории букет сохраняется в БД.
 */
public enum FlowerDraftState {

    /** Ждём название */
    NAME("name", 1),

    /** Ждём описание ("-" — без описания) */
    DESCRIPTION("description", 2),

    /** Ждём цену в рублях */
    PRICE("price", 3),

    /** Ждём категорию — последний шаг */
    CATEGORY("category", 4);

    public static final int TOTAL_STEPS = 4;

    private final String tag;
    private final int stepNumber;

    FlowerDraftState(String tag, int stepNumber) {
        this.tag = tag;
        this.stepNumber = stepNumber;
    }

    public String getTag() {
        return tag;
    }

    public int getStepNumber() {
        return stepNumber;
    }

    public boolean isLast() {
        return this == CATEGORY;
    }

    public FlowerDraftState next() {
        return isLast() ? this : values()[ordinal() + 1];
    }
}
