package org.example.flower_shop.screen;

import lombok.RequiredArgsConstructor;
import org.example.flower_shop.model.BouquetAddon;
import org.example.flower_shop.model.BouquetBuilderData;
import org.example.flower_shop.model.BouquetBuilderState;
import org.example.flower_shop.model.BouquetColor;
import org.example.flower_shop.model.BouquetQuantity;
import org.example.flower_shop.model.CustomBouquet;
import org.example.flower_shop.navigation.BackAffordance;
import org.example.flower_shop.navigation.CallbackData;
import org.example.flower_shop.navigation.RenderResult;
import org.example.flower_shop.navigation.ScreenAction;
import org.example.flower_shop.navigation.ScreenId;
import org.example.flower_shop.navigation.ScreenView;
import org.example.flower_shop.service.BouquetBuilderService;
import org.example.flower_shop.service.BouquetPriceCalculator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Экраны шагов конструктора букета.
 * <p>
 * Это не экраны навигации: в ScreenRegistry их нет, в стек они не попадают.
 * "Назад" на них — шаг назад внутри конструктора (build:back).
 */
@Component
@RequiredArgsConstructor
public class BouquetStepRenderer {

    public static final String SCREEN_PREFIX = "bouquet:";
    public static final String DONE_SCREEN = SCREEN_PREFIX + "done";
    public static final String INACTIVE_SCREEN = SCREEN_PREFIX + "inactive";

    private final BouquetBuilderService bouquetBuilderService;
    private final BouquetPriceCalculator priceCalculator;

    public static String screenIdOf(BouquetBuilderState state) {
        return SCREEN_PREFIX + state.getTag();
    }

    /**
     * Показать текущий шаг конструктора.
     *
     * @param error текст ошибки ввода над вопросом (или null)
     */
    public RenderResult renderStep(BouquetBuilderData data, String error) {
        ScreenView view = switch (data.getState()) {
            case CHOOSE_COLOR -> colorStep();
            case CHOOSE_QUANTITY -> quantityStep(data);
            case CHOOSE_ADDONS -> addonsStep(data);
            case SUMMARY -> summaryStep(data);
        };
        if (error != null) {
            view = view.withNotice("❌ " + error);
        }
        return new RenderResult(screenIdOf(data.getState()), view.withBack(BackAffordance.GUIDED_BACK));
    }

    /**
     * Букет собран и лежит в корзине.
     */
    public RenderResult renderDone(CustomBouquet bouquet) {
        ScreenView view = ScreenView.of("🎉 Букет добавлен в корзину!\n\n" +
                        "🌸 " + bouquet.describe() + "\n" +
                        "💰 Цена: " + bouquet.price() + "₽",
                new ScreenView.Rows()
                        .add(ScreenAction.enter("🛒 Перейти в корзину", ScreenId.CART))
                        .add(ScreenAction.of("🎨 Собрать ещё", CallbackData.BUILD_START))
                        .add(ScreenAction.of("🏠 Главное меню", CallbackData.NAV_RESET))
                        .build());
        return new RenderResult(DONE_SCREEN, view.withBack(BackAffordance.NONE));
    }

    /**
     * Кнопка конструктора нажата, а конструктор уже закрыт (старое сообщение, /start и т.п.).
     */
    public RenderResult renderInactive() {
        ScreenView view = ScreenView.of("⚠️ Сборка букета не активна.\n\nНачните заново:",
                new ScreenView.Rows()
                        .add(ScreenAction.of("🎨 Собрать букет", CallbackData.BUILD_START))
                        .build());
        return new RenderResult(INACTIVE_SCREEN, view);
    }

    private ScreenView colorStep() {
        List<ScreenAction> buttons = new ArrayList<>();
        for (BouquetColor color : BouquetColor.values()) {
            buttons.add(ScreenAction.of(color.getDisplayName(), CallbackData.pick(color.getId())));
        }
        return ScreenView.of(header(BouquetBuilderState.CHOOSE_COLOR) + "Выберите основной цвет:",
                pairs(buttons));
    }

    private ScreenView quantityStep(BouquetBuilderData data) {
        List<ScreenAction> buttons = new ArrayList<>();
        for (BouquetQuantity quantity : BouquetQuantity.values()) {
            buttons.add(ScreenAction.of(quantity.getDisplayName(), CallbackData.pick(quantity.getId())));
        }
        return ScreenView.of("✅ Цвет выбран: " + data.getColor().getDisplayName() + "\n\n" +
                        header(BouquetBuilderState.CHOOSE_QUANTITY) + "Выберите количество цветов:",
                pairs(buttons));
    }

    private ScreenView addonsStep(BouquetBuilderData data) {
        ScreenView.Rows rows = new ScreenView.Rows();
        for (BouquetAddon addon : BouquetAddon.values()) {
            String mark = data.getPendingAddons().contains(addon) ? "✓ " : "";
            rows.add(ScreenAction.of(mark + addon.getDisplayName() + " (+" + priceCalculator.surcharge(addon) + "₽)",
                    CallbackData.toggle(addon.getId())));
        }
        rows.add(ScreenAction.of("❌ Отмена", CallbackData.BUILD_CANCEL),
                ScreenAction.of("✅ Готово", CallbackData.BUILD_DONE));

        return ScreenView.of("✅ Количество выбрано: " + data.getQuantity().getDisplayName() + "\n\n" +
                        header(BouquetBuilderState.CHOOSE_ADDONS) +
                        "Отметьте дополнения (можно несколько) и нажмите «Готово»:",
                rows.build());
    }

    private ScreenView summaryStep(BouquetBuilderData data) {
        CustomBouquet bouquet = bouquetBuilderService.preview(data);
        String addons = bouquet.addons().isEmpty()
                ? "без дополнений"
                : String.join(", ", bouquet.addons().stream().map(BouquetAddon::getDisplayName).toList());

        return ScreenView.of("🌸 Предпросмотр вашего букета:\n\n" +
                        "🎨 Цвет: " + bouquet.color().getDisplayName() + "\n" +
                        "📊 Количество: " + bouquet.quantity().getDisplayName() + "\n" +
                        "✨ Дополнения: " + addons + "\n\n" +
                        "💰 Цена: " + bouquet.price() + "₽ (база " + priceCalculator.getBasePrice() + "₽)",
                new ScreenView.Rows()
                        .add(ScreenAction.of("✅ Добавить в корзину", CallbackData.BUILD_FINALIZE))
                        .add(ScreenAction.of("❌ Отмена", CallbackData.BUILD_CANCEL))
                        .build());
    }

    private static String header(BouquetBuilderState step) {
        String title = step.isFirst() ? "🎨 Создание вашего букета\n\n" : "";
        return title + "Шаг " + step.getStepNumber() + "/" + BouquetBuilderState.INPUT_STEPS + ": ";
    }

    /**
     * Кнопки по две в ряд, последней строкой — "Отмена".
     */
    private static List<List<ScreenAction>> pairs(List<ScreenAction> buttons) {
        ScreenView.Rows rows = new ScreenView.Rows();
        for (int i = 0; i < buttons.size(); i += 2) {
            rows.addRow(buttons.subList(i, Math.min(i + 2, buttons.size())));
        }
        rows.add(ScreenAction.of("❌ Отмена", CallbackData.BUILD_CANCEL));
        return rows.build();
    }
}
