package org.example.flower_shop.screen;

import lombok.RequiredArgsConstructor;
import org.example.flower_shop.model.Flower;
import org.example.flower_shop.model.Order;
import org.example.flower_shop.model.SessionSnapshot;
import org.example.flower_shop.model.User;
import org.example.flower_shop.navigation.CallbackData;
import org.example.flower_shop.navigation.RenderContext;
import org.example.flower_shop.navigation.ScreenAction;
import org.example.flower_shop.navigation.ScreenId;
import org.example.flower_shop.navigation.ScreenRegistry;
import org.example.flower_shop.navigation.ScreenView;
import org.example.flower_shop.service.FlowerService;
import org.example.flower_shop.service.OrderService;
import org.example.flower_shop.service.UserService;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Панель администратора. Вход через /admin — раздел со своим стеком.
 */
@Component
@RequiredArgsConstructor
public class AdminScreens implements ScreenModule {

    // Telegram режет сообщения длиннее 4096 символов
    private static final int MAX_TEXT_LENGTH = 4000;
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final FlowerService flowerService;
    private final OrderService orderService;
    private final UserService userService;

    @Override
    public void registerScreens(ScreenRegistry registry) {
        registry.register(ScreenId.ADMIN_MAIN, this::renderMain);
        registry.register(ScreenId.ADMIN_LIST_FLOWERS, this::renderFlowers);
        registry.register(ScreenId.ADMIN_ORDERS, this::renderOrders);
        registry.register(ScreenId.ADMIN_USERS, this::renderUsers);
        registry.register(ScreenId.ADMIN_DELETE_FLOWER, this::renderDeleteFlower);
    }

    ScreenView renderMain(SessionSnapshot session, RenderContext context) {
        return ScreenView.of("🔧 Панель администратора\n\nВыберите действие:", new ScreenView.Rows()
                .add(ScreenAction.of("➕ Добавить цветок", CallbackData.ADMIN_FLOWER_ADD))
                .add(ScreenAction.enter("📋 Список цветов", ScreenId.ADMIN_LIST_FLOWERS))
                .add(ScreenAction.enter("🗑️ Удалить цветок", ScreenId.ADMIN_DELETE_FLOWER))
                .add(ScreenAction.enter("📦 Заказы", ScreenId.ADMIN_ORDERS))
                .add(ScreenAction.enter("👥 Пользователи", ScreenId.ADMIN_USERS))
                .build());
    }

    ScreenView renderFlowers(SessionSnapshot session, RenderContext context) {
        List<Flower> flowers = flowerService.getAllFlowers();
        if (flowers.isEmpty()) {
            return ScreenView.text("📋 Цветов в базе нет");
        }
        StringBuilder sb = new StringBuilder("📋 Список цветов:\n\n");
        for (Flower flower : flowers) {
            String status = Boolean.TRUE.equals(flower.getAvailable()) ? "✅" : "❌";
            sb.append(status).append(" ID: ").append(flower.getId()).append("\n")
                    .append("   Название: ").append(flower.getName()).append("\n")
                    .append("   Цена: ").append(flower.getPrice()).append("₽\n")
                    .append("   Категория: ").append(flower.getCategory() != null ? flower.getCategory() : "не указана")
                    .append("\n\n");
        }
        return ScreenView.text(truncate(sb.toString()));
    }

    /**
     * Кнопка на каждый букет: нажал — букет удалён, экран перерисован.
     */
    ScreenView renderDeleteFlower(SessionSnapshot session, RenderContext context) {
        List<Flower> flowers = flowerService.getAllFlowers();
        if (flowers.isEmpty()) {
            return ScreenView.text("🗑️ Удалять нечего — каталог пуст");
        }
        ScreenView.Rows rows = new ScreenView.Rows();
        for (Flower flower : flowers) {
            rows.add(ScreenAction.of("🗑️ " + flower.getId() + ". " + flower.getName(),
                    CallbackData.deleteFlower(flower.getId())));
        }
        return ScreenView.of("🗑️ Удаление цветка\n\nВыберите, что убрать из каталога:", rows.build());
    }

    ScreenView renderOrders(SessionSnapshot session, RenderContext context) {
        List<Order> orders = orderService.getLatestOrders();
        if (orders.isEmpty()) {
            return ScreenView.text("📦 Заказов нет");
        }
        StringBuilder sb = new StringBuilder("📦 Последние заказы:\n\n");
        for (Order order : orders) {
            sb.append("🆔 Заказ ").append(order.getId()).append("\n")
                    .append("👤 User ID: ").append(order.getUserTelegramId()).append("\n")
                    .append("💰 Сумма: ").append(order.getTotalPrice()).append("₽\n")
                    .append("📊 Статус: ").append(order.getStatus().getDisplayName()).append("\n");
            if (order.getCreatedAt() != null) {
                sb.append("📅 Дата: ").append(order.getCreatedAt().format(DATE_FORMAT)).append("\n");
            }
            sb.append("\n");
        }
        return ScreenView.text(truncate(sb.toString()));
    }

    ScreenView renderUsers(SessionSnapshot session, RenderContext context) {
        List<User> users = userService.latestUsers();
        StringBuilder sb = new StringBuilder("👥 Пользователи (всего ")
                .append(userService.countUsers()).append("):\n\n");
        for (User user : users) {
            sb.append("• ").append(user.getDisplayName())
                    .append(" (").append(user.getTelegramId()).append(")\n");
        }
        return ScreenView.text(truncate(sb.toString()));
    }

    private static String truncate(String text) {
        if (text.length() <= MAX_TEXT_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_TEXT_LENGTH) + "\n\n... (показаны первые записи)";
    }
}
