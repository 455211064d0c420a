package org.example.flower_shop.screen;

import org.example.flower_shop.model.FlowerDraft;
import org.example.flower_shop.model.FlowerDraftState;
import org.example.flower_shop.navigation.BackAffordance;
import org.example.flower_shop.navigation.CallbackData;
import org.example.flower_shop.navigation.RenderResult;
import org.example.flower_shop.navigation.ScreenAction;
import org.example.flower_shop.navigation.ScreenView;
import org.springframework.stereotype.Component;

/**
 * Вопросы бота при добавлении букета в каталог.
 * Ответ админ присылает обычным сообщением, поэтому кнопка тут одна — "Отмена".
 */
@Component
public class FlowerDraftRenderer {

    public static final String SCREEN_PREFIX = "flower_draft:";

    public RenderResult renderStep(FlowerDraft draft, String error) {
        FlowerDraftState step = draft.getState();
        StringBuilder sb = new StringBuilder();
        if (step == FlowerDraftState.NAME) {
            sb.append("➕ Добавление нового цветка\n\n");
        }
        sb.append("Шаг ").append(step.getStepNumber()).append("/").append(FlowerDraftState.TOTAL_STEPS).append(": ");
        sb.append(switch (step) {
            case NAME -> "Введите название цветка:";
            case DESCRIPTION -> "Введите описание цветка (или «-», если без описания):";
            case PRICE -> "Введите цену (в рублях):";
            case CATEGORY -> "Введите категорию (Розы, Тюльпаны, Пионы, Сборные, другое):";
        });
        sb.append("\n\n/cancel — отменить");

        ScreenView view = ScreenView.of(sb.toString(), new ScreenView.Rows()
                .add(ScreenAction.of("❌ Отмена", CallbackData.ADMIN_FLOWER_CANCEL))
                .build());
        if (error != null) {
            view = view.withNotice("❌ " + error);
        }
        return new RenderResult(SCREEN_PREFIX + step.getTag(), view.withBack(BackAffordance.NONE));
    }
}
