package org.example.flower_shop.screen;

import lombok.RequiredArgsConstructor;
import org.example.flower_shop.model.CartItem;
import org.example.flower_shop.model.Flower;
import org.example.flower_shop.model.Order;
import org.example.flower_shop.model.SessionSnapshot;
import org.example.flower_shop.navigation.CallbackData;
import org.example.flower_shop.navigation.RenderContext;
import org.example.flower_shop.navigation.ScreenAction;
import org.example.flower_shop.navigation.ScreenId;
import org.example.flower_shop.navigation.ScreenRegistry;
import org.example.flower_shop.navigation.ScreenView;
import org.example.flower_shop.service.CartService;
import org.example.flower_shop.service.FlowerService;
import org.example.flower_shop.service.OrderService;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Экраны покупателя: каталог, корзина, история заказов.
 */
@Component
@RequiredArgsConstructor
public class ShopScreens implements ScreenModule {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm");

    private final FlowerService flowerService;
    private final CartService cartService;
    private final OrderService orderService;

    @Override
    public void registerScreens(ScreenRegistry registry) {
        registry.register(ScreenId.CATALOG, this::renderCatalog);
        registry.register(ScreenId.CART, this::renderCart);
        registry.register(ScreenId.HISTORY, this::renderHistory);
    }

    ScreenView renderCatalog(SessionSnapshot session, RenderContext context) {
        List<Flower> flowers = flowerService.getAvailableFlowers();
        if (flowers.isEmpty()) {
            return ScreenView.text("🌸 Каталог пока пуст.\n\nЗагляните позже или соберите свой букет 🎨");
        }

        StringBuilder sb = new StringBuilder("🌸 Каталог\n\n");
        ScreenView.Rows rows = new ScreenView.Rows();
        for (Flower flower : flowers) {
            sb.append("💐 ").append(flower.getName()).append(" — ").append(flower.getPrice()).append("₽\n");
            if (flower.getDescription() != null) {
                sb.append("   ").append(flower.getDescription()).append("\n");
            }
            rows.add(ScreenAction.of("🛒 " + flower.getName(), CallbackData.addToCart(flower.getId())));
        }
        rows.add(ScreenAction.enter("🛒 Перейти в корзину", ScreenId.CART));
        return ScreenView.of(sb.toString(), rows.build());
    }

    ScreenView renderCart(SessionSnapshot session, RenderContext context) {
        List<CartItem> items = cartService.getItems(context.telegramId());
        if (items.isEmpty()) {
            return ScreenView.of("🛒 Ваша корзина пуста\n\nВыберите букет в каталоге или соберите свой",
                    new ScreenView.Rows()
                            .add(ScreenAction.enter("🌸 К каталогу", ScreenId.CATALOG))
                            .add(ScreenAction.of("🎨 Собрать букет", CallbackData.BUILD_START))
                            .build());
        }

        StringBuilder sb = new StringBuilder("🛒 Ваша корзина:\n\n");
        for (int i = 0; i < items.size(); i++) {
            CartItem item = items.get(i);
            sb.append(i + 1).append(". ").append(item.title()).append(" — ").append(item.price()).append("₽\n");
        }
        sb.append("\n💰 Итого: ").append(cartService.getTotal(context.telegramId())).append("₽");

        return ScreenView.of(sb.toString(), new ScreenView.Rows()
                .add(ScreenAction.of("✅ Оформить заказ", CallbackData.CART_CHECKOUT))
                .add(ScreenAction.of("🗑️ Очистить корзину", CallbackData.CART_CLEAR))
                .add(ScreenAction.enter("🌸 Продолжить покупки", ScreenId.CATALOG))
                .build());
    }

    ScreenView renderHistory(SessionSnapshot session, RenderContext context) {
        List<Order> orders = orderService.getUserOrders(context.telegramId());
        if (orders.isEmpty()) {
            return ScreenView.text("📜 У вас пока нет заказов.");
        }

        StringBuilder sb = new StringBuilder("📜 Мои заказы\n\n");
        for (Order order : orders) {
            sb.append("📦 ");
            if (order.getCreatedAt() != null) {
                sb.append(order.getCreatedAt().format(DATE_FORMAT)).append(" — ");
            }
            sb.append(order.getTotalPrice()).append("₽\n");
            sb.append("   📊 Статус: ").append(order.getStatus().getDisplayName()).append("\n");
            sb.append("   ").append(order.getItemsDescription().replace("\n", "\n   ")).append("\n\n");
        }
        return ScreenView.text(sb.toString());
    }
}
