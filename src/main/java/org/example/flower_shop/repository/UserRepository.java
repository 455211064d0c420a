package org.example.flower_shop.repository;

import org.example.flower_shop.model.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Репозиторий покупателей (таблица users).
 * SQL Spring Data генерирует сам из названий методов.
 */
@Repository
public interface UserRepository extends JpaRepository<User, UUID> {

    // SELECT * FROM users WHERE telegram_id = ?
    Optional<User> findByTelegramId(Long telegramId);

    // Последние зарегистрированные — для админки
    List<User> findTop20ByOrderByCreatedAtDesc();
}
