package org.example.flower_shop.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Дополнения к букету (шаг 3 конструктора, можно выбрать несколько).
 * <p>
 * Доплата за каждое дополнение задаётся в application.properties
 * (app.bouquet.surcharge.ribbon=100 и т.д.), здесь только значение по умолчанию.
 */
public enum BouquetAddon {
    RIBBON("ribbon", "🎀 Лента", 100),
    LUXURY("luxury", "🎁 Упаковка люкс", 300),
    TOY("toy", "🧸 Игрушка", 500),
    CHOCOLATE("chocolate", "🍫 Шоколад", 250);

    /** "Без дополнений" — явный пустой выбор. */
    public static final String NONE_ID = "none";

    private final String id;
    private final String displayName;
    private final int defaultSurcharge;

    BouquetAddon(String id, String displayName, int defaultSurcharge) {
        this.id = id;
        this.displayName = displayName;
        this.defaultSurcharge = defaultSurcharge;
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getDefaultSurcharge() {
        return defaultSurcharge;
    }

    public static Optional<BouquetAddon> fromInput(String input) {
        if (input == null) {
            return Optional.empty();
        }
        String value = input.trim();
        return Arrays.stream(values())
                .filter(a -> a.id.equalsIgnoreCase(value) || a.displayName.equalsIgnoreCase(value))
                .findFirst();
    }
}
