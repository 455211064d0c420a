package org.example.flower_shop.service;

import lombok.extern.slf4j.Slf4j;
import org.example.flower_shop.model.CartItem;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Корзина покупателя (в памяти, до оформления заказа).
 */
@Slf4j
@Service
public class CartService {

    // Корзины по telegramId
    private final Map<Long, List<CartItem>> carts = new ConcurrentHashMap<>();

    public void add(Long telegramId, CartItem item) {
        carts.computeIfAbsent(telegramId, id -> new CopyOnWriteArrayList<>()).add(item);
        log.info("Добавлено в корзину: telegramId={}, item={}", telegramId, item.title());
    }

    public List<CartItem> getItems(Long telegramId) {
        return new ArrayList<>(carts.getOrDefault(telegramId, List.of()));
    }

    public BigDecimal getTotal(Long telegramId) {
        return getItems(telegramId).stream()
                .map(CartItem::price)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public void clear(Long telegramId) {
        carts.remove(telegramId);
        log.debug("Корзина очищена: telegramId={}", telegramId);
    }
}
