package org.example.flower_shop.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.flower_shop.model.CartItem;
import org.example.flower_shop.model.Order;
import org.example.flower_shop.model.OrderStatus;
import org.example.flower_shop.repository.OrderRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class OrderService {

    private final OrderRepository orderRepository;

    /**
     * Оформить заказ из позиций корзины.
     *
     * @throws IllegalArgumentException если корзина пустая
     */
    @Transactional
    public Order checkout(Long telegramId, List<CartItem> items) {
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Корзина пуста!");
        }
        BigDecimal total = items.stream()
                .map(CartItem::price)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        String description = items.stream()
                .map(i -> i.title() + " — " + i.price() + "₽")
                .collect(Collectors.joining("\n"));

        Order order = Order.builder()
                .userTelegramId(telegramId)
                .itemsDescription(description)
                .totalPrice(total)
                .status(OrderStatus.NEW)
                .build();
        Order saved = orderRepository.save(order);
        log.info("Заказ создан: orderId={}, telegramId={}, сумма={}", saved.getId(), telegramId, total);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Order> getUserOrders(Long telegramId) {
        return orderRepository.findTop10ByUserTelegramIdOrderByCreatedAtDesc(telegramId);
    }

    @Transactional(readOnly = true)
    public Optional<Order> getLastOrder(Long telegramId) {
        return getUserOrders(telegramId).stream().findFirst();
    }

    @Transactional(readOnly = true)
    public List<Order> getLatestOrders() {
        return orderRepository.findTop20ByOrderByCreatedAtDesc();
    }
}
