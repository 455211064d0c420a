package org.example.flower_shop.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.flower_shop.model.BouquetAddon;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

/**
 * Цены конструктора букета.
 * <p>
 * Загружаются из application.properties:
 * app.bouquet.base-price=2000
 * app.bouquet.surcharge.ribbon=100
 * app.bouquet.surcharge.luxury=300
 * и т.д. Если доплаты нет в конфиге — берём значение по умолчанию из BouquetAddon.
 */
@Slf4j
@Getter
@Configuration
@RequiredArgsConstructor
public class BouquetConfig {

    private final Environment env;

    @Value("${app.bouquet.base-price:2000}")
    private BigDecimal basePrice;

    private final Map<BouquetAddon, BigDecimal> surcharges = new EnumMap<>(BouquetAddon.class);

    @PostConstruct
    public void loadSurcharges() {
        for (BouquetAddon addon : BouquetAddon.values()) {
            String value = env.getProperty("app.bouquet.surcharge." + addon.getId());
            surcharges.put(addon, value != null
                    ? new BigDecimal(value)
                    : BigDecimal.valueOf(addon.getDefaultSurcharge()));
        }
        log.info("Цены конструктора букета: база {}₽, доплаты {}", basePrice, surcharges);
    }
}
