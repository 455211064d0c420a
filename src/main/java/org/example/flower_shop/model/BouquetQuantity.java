package org.example.flower_shop.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Количество цветов в букете (шаг 2 конструктора).
 */
public enum BouquetQuantity {
    FIVE(5, "5 цветов"),
    SEVEN(7, "7 цветов"),
    ELEVEN(11, "11 цветов"),
    FIFTEEN(15, "15 цветов"),
    TWENTY_ONE(21, "21 цветок"),
    TWENTY_FIVE(25, "25 цветов");

    private final int count;
    private final String displayName;

    BouquetQuantity(int count, String displayName) {
        this.count = count;
        this.displayName = displayName;
    }

    public int getCount() {
        return count;
    }

    /** Идентификатор — просто число строкой: "15". */
    public String getId() {
        return String.valueOf(count);
    }

    public String getDisplayName() {
        return displayName;
    }

    public static Optional<BouquetQuantity> fromInput(String input) {
        if (input == null) {
            return Optional.empty();
        }
        String value = input.trim();
        return Arrays.stream(values())
                .filter(q -> q.getId().equals(value) || q.displayName.equalsIgnoreCase(value))
                .findFirst();
    }
}
