package org.example.flower_shop.service;

import org.example.flower_shop.config.BouquetConfig;
import org.example.flower_shop.model.BouquetAddon;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Цена букета из конструктора: база + сумма доплат за выбранные дополнения.
 * Порядок выбора дополнений на цену не влияет.
 */
@Component
public class BouquetPriceCalculator {

    private final BigDecimal basePrice;
    private final Map<BouquetAddon, BigDecimal> surcharges;

    @Autowired
    public BouquetPriceCalculator(BouquetConfig config) {
        this(config.getBasePrice(), config.getSurcharges());
    }

    public BouquetPriceCalculator(BigDecimal basePrice, Map<BouquetAddon, BigDecimal> surcharges) {
        this.basePrice = basePrice;
        this.surcharges = new EnumMap<>(BouquetAddon.class);
        this.surcharges.putAll(surcharges);
    }

    public BigDecimal calculate(Collection<BouquetAddon> addons) {
        return addons.stream()
                .map(this::surcharge)
                .reduce(basePrice, BigDecimal::add);
    }

    public BigDecimal getBasePrice() {
        return basePrice;
    }

    public BigDecimal surcharge(BouquetAddon addon) {
        return surcharges.getOrDefault(addon, BigDecimal.valueOf(addon.getDefaultSurcharge()));
    }
}
