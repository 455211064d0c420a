package org.example.flower_shop.model;

import lombok.Data;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Данные конструктора букета (хранятся в сессии во время диалога).
 * <p>
 * Поля заполняются по мере прохождения шагов. Если юзер жмёт "Назад"
 * внутри конструктора — значение шага, на который вернулись, стирается.
 */
@Data
public class BouquetBuilderData {

    /** Текущий шаг */
    private BouquetBuilderState state = BouquetBuilderState.CHOOSE_COLOR;

    /** Выбранный цвет (после шага 1) */
    private BouquetColor color;

    /** Выбранное количество (после шага 2) */
    private BouquetQuantity quantity;

    /** Подтверждённые дополнения (после шага 3), null пока шаг не пройден */
    private List<BouquetAddon> addons;

    /** Отмеченные галочкой дополнения, ещё не подтверждённые кнопкой "Готово" */
    private Set<BouquetAddon> pendingAddons = new LinkedHashSet<>();

    /**
     * Стереть значение шага (используется при возврате назад).
     */
    public void clearValue(BouquetBuilderState step) {
        switch (step) {
            case CHOOSE_COLOR -> color = null;
            case CHOOSE_QUANTITY -> quantity = null;
            case CHOOSE_ADDONS -> {
                addons = null;
                pendingAddons.clear();
            }
            case SUMMARY -> {
                // на финальном шаге своего значения нет
            }
        }
    }
}
