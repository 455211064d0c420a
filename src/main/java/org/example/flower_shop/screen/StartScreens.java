package org.example.flower_shop.screen;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.flower_shop.model.Order;
import org.example.flower_shop.model.SessionSnapshot;
import org.example.flower_shop.navigation.BackAffordance;
import org.example.flower_shop.navigation.CallbackData;
import org.example.flower_shop.navigation.RenderContext;
import org.example.flower_shop.navigation.ScreenAction;
import org.example.flower_shop.navigation.ScreenId;
import org.example.flower_shop.navigation.ScreenRegistry;
import org.example.flower_shop.navigation.ScreenView;
import org.example.flower_shop.service.FlowerService;
import org.example.flower_shop.service.OrderService;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.util.Optional;

/**
 * Главное меню.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartScreens implements ScreenModule {

    private final FlowerService flowerService;
    private final OrderService orderService;

    @Override
    public void registerScreens(ScreenRegistry registry) {
        registry.register(ScreenId.START, this::renderStart);
    }

    ScreenView renderStart(SessionSnapshot session, RenderContext context) {
        StringBuilder sb = new StringBuilder();
        String name = context.firstName() != null ? ", " + context.firstName() : "";
        sb.append("👋 Привет").append(name).append("! 🌸\n\n");
        sb.append("Добро пожаловать в мир цветов!\n");

        // Последний заказ и хит недели — из БД. Если база лежит, меню всё равно показываем,
        // иначе юзер застрянет на экране ошибки без кнопок
        try {
            Optional<Order> lastOrder = orderService.getLastOrder(context.telegramId());
            lastOrder.ifPresent(order -> sb.append("\n📦 Ваш последний заказ: ")
                    .append(order.getTotalPrice()).append("₽ — ")
                    .append(order.getStatus().getDisplayName()).append("\n"));

            flowerService.getPopularFlower().ifPresent(flower -> sb.append("\n🔥 Хит недели: ")
                    .append(flower.getName()).append(" — ").append(flower.getPrice()).append("₽\n"));
        } catch (DataAccessException | TransactionException e) {
            log.warn("Главное меню без данных из БД: telegramId={}, причина={}", context.telegramId(), e.getMessage());
        }

        sb.append("\nВыберите действие:");

        ScreenView.Rows rows = new ScreenView.Rows()
                .add(ScreenAction.enter("🌸 Каталог", ScreenId.CATALOG),
                        ScreenAction.enter("🤖 AI подбор", ScreenId.AI_MENU))
                .add(ScreenAction.of("🎨 Собрать букет", CallbackData.BUILD_START))
                .add(ScreenAction.enter("🛒 Корзина", ScreenId.CART),
                        ScreenAction.enter("📜 Мои заказы", ScreenId.HISTORY));

        return ScreenView.of(sb.toString(), rows.build()).withBack(BackAffordance.NONE);
    }
}
