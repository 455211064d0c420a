package org.example.flower_shop.model;

/**
 * Что юзер сделал (нажал кнопку / отправил команду).
 */
public enum NavigationAction {

    // ============================================
    // НАВИГАЦИЯ ПО ЭКРАНАМ
    // ============================================

    /** Перейти вперёд на экран (payload = id экрана) */
    ENTER_SCREEN,

    /** Кнопка "Назад" */
    NAV_BACK,

    /** В главное меню с очисткой стека (/start) */
    NAV_RESET,

    /** Войти в отдельный раздел со своим стеком (/admin), payload = корневой экран */
    ENTER_SECTION,

    // ============================================
    // КОНСТРУКТОР БУКЕТА
    // ============================================

    GUIDED_START,

    /** Ответ на текущий шаг (payload = значение или список значений) */
    GUIDED_ADVANCE,

    /** Поставить/снять галочку у дополнения */
    GUIDED_TOGGLE,

    /** "Готово" на шаге дополнений — отправить отмеченные галочки */
    GUIDED_SUBMIT_ADDONS,

    /** "Назад" внутри конструктора */
    GUIDED_BACK,

    /** "Добавить в корзину" на финальном шаге */
    GUIDED_FINALIZE,

    /** /cancel — выйти из конструктора (или из добавления букета в админке) без сохранения */
    GUIDED_CANCEL,

    // ============================================
    // КОРЗИНА
    // ============================================

    CART_ADD,
    CART_CLEAR,
    CART_CHECKOUT,

    // ============================================
    // АДМИНКА: КАТАЛОГ
    // ============================================

    /** "➕ Добавить цветок" — начать пошаговое добавление (ответы приходят как TEXT) */
    ADMIN_FLOWER_START,

    /** Удалить букет из каталога (payload = id букета) */
    ADMIN_FLOWER_DELETE,

    /** Просто текст от юзера */
    TEXT
}
