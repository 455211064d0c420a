package org.example.flower_shop.navigation;

import java.util.ArrayList;
import java.util.List;

/**
 * То, что рендерер отдаёт наружу: текст экрана и кнопки.
 * <p>
 * Кнопку "Назад" сюда не кладём — её добавляет ScreenViewSender
 * по полю back (у главного меню её нет).
 */
public record ScreenView(
        String text,
        List<List<ScreenAction>> rows,
        BackAffordance back,
        boolean error
) {

    public ScreenView {
        rows = rows == null ? List.of() : rows.stream().map(List::copyOf).toList();
    }

    public static ScreenView of(String text, List<List<ScreenAction>> rows) {
        return new ScreenView(text, rows, BackAffordance.NAV_BACK, false);
    }

    public static ScreenView text(String text) {
        return of(text, List.of());
    }

    /**
     * Экран ошибки: внешний сервис упал, но навигация жива — "Назад" работает.
     */
    public static ScreenView error(String text) {
        return new ScreenView(text, List.of(), BackAffordance.NAV_BACK, true);
    }

    public ScreenView withBack(BackAffordance affordance) {
        return new ScreenView(text, rows, affordance, error);
    }

    /**
     * Добавить строку-уведомление над текстом экрана ("✅ Добавлено в корзину").
     */
    public ScreenView withNotice(String notice) {
        return new ScreenView(notice + "\n\n" + text, rows, back, error);
    }

    /**
     * Удобный сборщик клавиатуры: одна кнопка — одна строка, либо несколько в ряд.
     */
    public static class Rows {
        private final List<List<ScreenAction>> rows = new ArrayList<>();

        public Rows add(ScreenAction... actions) {
            rows.add(List.of(actions));
            return this;
        }

        public Rows addRow(List<ScreenAction> row) {
            rows.add(row);
            return this;
        }

        public List<List<ScreenAction>> build() {
            return rows;
        }
    }
}
