package org.example.flower_shop.model;

import java.math.BigDecimal;

/**
 * Позиция в корзине: букет из каталога или собранный в конструкторе.
 */
public record CartItem(String title, BigDecimal price) {

    public static CartItem of(Flower flower) {
        return new CartItem(flower.getName(), flower.getPrice());
    }

    public static CartItem of(CustomBouquet bouquet) {
        return new CartItem("Букет на заказ: " + bouquet.describe(), bouquet.price());
    }
}
