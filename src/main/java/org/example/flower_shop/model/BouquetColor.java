package org.example.flower_shop.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Основной цвет букета (шаг 1 конструктора).
 */
public enum BouquetColor {
    RED("red", "🔴 Красный"),
    YELLOW("yellow", "🟡 Желтый"),
    BLUE("blue", "🔵 Синий"),
    PURPLE("purple", "🟣 Фиолетовый"),
    GREEN("green", "🟢 Зеленый"),
    WHITE("white", "⚪ Белый"),
    ORANGE("orange", "🟠 Оранжевый"),
    MIX("mix", "🟤 Микс");

    private final String id;
    private final String displayName;

    BouquetColor(String id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Найти цвет по id ("red") или по тексту кнопки ("🔴 Красный").
     */
    public static Optional<BouquetColor> fromInput(String input) {
        if (input == null) {
            return Optional.empty();
        }
        String value = input.trim();
        return Arrays.stream(values())
                .filter(c -> c.id.equalsIgnoreCase(value) || c.displayName.equalsIgnoreCase(value))
                .findFirst();
    }
}
