package org.example.flower_shop.model;

/**
 * Статусы заказа.
 */
public enum OrderStatus {
    NEW("Новый"),
    PAID("Оплачен"),
    PROCESSING("Собирается"),
    DELIVERED("Доставлен"),
    CANCELLED("Отменён");

    private final String displayName;

    OrderStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
