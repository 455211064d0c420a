package org.example.flower_shop.model;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Готовый букет из конструктора (результат finalize).
 */
public record CustomBouquet(
        BouquetColor color,
        BouquetQuantity quantity,
        List<BouquetAddon> addons,
        BigDecimal price
) {

    public CustomBouquet {
        addons = List.copyOf(addons);
    }

    /**
     * Собранные поля в виде {color: "red", quantity: "15", addons: ["ribbon", "luxury"]}.
     */
    public Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("color", color.getId());
        fields.put("quantity", quantity.getId());
        fields.put("addons", addons.stream().map(BouquetAddon::getId).toList());
        return fields;
    }

    /**
     * Описание для корзины и заказа: "🔴 Красный, 15 цветов, 🎀 Лента + 🎁 Упаковка люкс".
     */
    public String describe() {
        String addonsText = addons.isEmpty()
                ? "без дополнений"
                : String.join(" + ", addons.stream().map(BouquetAddon::getDisplayName).toList());
        return color.getDisplayName() + ", " + quantity.getDisplayName() + ", " + addonsText;
    }
}
