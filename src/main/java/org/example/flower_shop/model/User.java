package org.example.flower_shop.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Покупатель — Java представление таблицы users.
 * Запись создаётся при первом /start.
 */
@Entity
@Table(name = "users") // должно совпадать с миграцией V1__init.sql
@Getter
@Setter
@NoArgsConstructor  // нужен для Hibernate
@AllArgsConstructor
@Builder
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    /**
     * Telegram ID пользователя (уникальный).
     */
    @Column(name = "telegram_id", unique = true, nullable = false)
    private Long telegramId;

    /** @username в Telegram (может не быть) */
    @Column(name = "username")
    private String username;

    @Column(name = "first_name")
    private String firstName;

    @Column(name = "last_name")
    private String lastName;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * Имя для приветствия: "Анна Петрова" или просто "Анна".
     */
    public String getDisplayName() {
        if (firstName == null) {
            return username != null ? "@" + username : String.valueOf(telegramId);
        }
        return lastName != null ? firstName + " " + lastName : firstName;
    }
}
