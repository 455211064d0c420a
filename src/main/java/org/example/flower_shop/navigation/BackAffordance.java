package org.example.flower_shop.navigation;

/**
 * Какую кнопку "Назад" прикрепить к экрану.
 */
public enum BackAffordance {
    /** Обычная навигация — снять экран со стека */
    NAV_BACK,
    /** Шаг конструктора букета — вернуться на предыдущий шаг */
    GUIDED_BACK,
    /** Без кнопки (главное меню) */
    NONE
}
