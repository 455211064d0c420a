package org.example.flower_shop.repository;

import org.example.flower_shop.model.Order;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface OrderRepository extends JpaRepository<Order, UUID> {

    //История заказов покупателя (последние 10):
    List<Order> findTop10ByUserTelegramIdOrderByCreatedAtDesc(Long userTelegramId);

    //Последние заказы для админки:
    List<Order> findTop20ByOrderByCreatedAtDesc();

    long countByUserTelegramId(Long userTelegramId);
}
