package org.example.flower_shop.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.flower_shop.exception.InvalidFlowerInputException;
import org.example.flower_shop.exception.InvalidStepInputException;
import org.example.flower_shop.exception.NoActiveGuidedFlowException;
import org.example.flower_shop.exception.UnknownScreenException;
import org.example.flower_shop.model.CartItem;
import org.example.flower_shop.model.CustomBouquet;
import org.example.flower_shop.model.Flower;
import org.example.flower_shop.model.NavigationEvent;
import org.example.flower_shop.model.Order;
import org.example.flower_shop.model.UserSession;
import org.example.flower_shop.navigation.NavigationService;
import org.example.flower_shop.navigation.RenderContext;
import org.example.flower_shop.navigation.RenderResult;
import org.example.flower_shop.navigation.ScreenId;
import org.example.flower_shop.navigation.ScreenRegistry;
import org.example.flower_shop.navigation.ScreenRenderer;
import org.example.flower_shop.navigation.ScreenView;
import org.example.flower_shop.screen.BouquetStepRenderer;
import org.example.flower_shop.screen.FlowerDraftRenderer;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.List;
import java.util.Optional;

/**
 * "Мозг" диалога: принимает одно событие от юзера, меняет его сессию
 * и возвращает экран, который нужно показать.
 * <p>
 * Порядок всегда один: сначала меняем навигацию (стек/конструктор),
 * потом рендерим. Если рендерер упал (БД, внешний API) — показываем экран ошибки,
 * а навигация уже в согласованном состоянии, "Назад" работает.
 * <p>
 * Все ошибки навигации и конструктора обрабатываются здесь, наружу не летят.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationEngine {

    private final SessionService sessionService;
    private final NavigationService navigationService;
    private final BouquetBuilderService bouquetBuilderService;
    private final ScreenRegistry screenRegistry;
    private final BouquetStepRenderer bouquetStepRenderer;
    private final CartService cartService;
    private final FlowerService flowerService;
    private final OrderService orderService;
    private final UserService userService;
    private final FlowerDraftService flowerDraftService;
    private final FlowerDraftRenderer flowerDraftRenderer;

    public RenderResult handle(NavigationEvent event) {
        return handle(event, RenderContext.of(event.userId()));
    }

    public RenderResult handle(NavigationEvent event, RenderContext context) {
        log.debug("Событие: userId={}, action={}, payload={}", event.userId(), event.action(), event.payload());
        return sessionService.withSession(event.userId(), session -> dispatch(session, event, context));
    }

    private RenderResult dispatch(UserSession session, NavigationEvent event, RenderContext context) {
        try {
            return switch (event.action()) {
                case ENTER_SCREEN -> {
                    // Сначала проверяем, что такой экран вообще есть, и только потом трогаем стек
                    if (!screenRegistry.isRegistered(event.value())) {
                        throw new UnknownScreenException(event.value());
                    }
                    if (!mayOpen(session, event.value())) {
                        yield accessDenied(session);
                    }
                    navigationService.enter(session, event.value());
                    yield renderCurrent(session, context);
                }
                case NAV_BACK -> {
                    navigationService.back(session);
                    yield renderCurrent(session, context);
                }
                case NAV_RESET -> {
                    navigationService.reset(session);
                    yield renderCurrent(session, context);
                }
                case ENTER_SECTION -> {
                    ScreenId root = ScreenId.fromId(event.value())
                            .filter(id -> screenRegistry.isRegistered(id.getId()))
                            .orElseThrow(() -> new UnknownScreenException(event.value()));
                    if (!mayOpen(session, root.getId())) {
                        yield accessDenied(session);
                    }
                    navigationService.enterSection(session, root);
                    yield renderCurrent(session, context);
                }
                case GUIDED_START -> {
                    // Пошаговый диалог у юзера только один
                    flowerDraftService.cancel(session);
                    bouquetBuilderService.start(session);
                    yield renderStep(session, null);
                }
                case GUIDED_ADVANCE -> {
                    bouquetBuilderService.advance(session, event.payload());
                    yield renderStep(session, null);
                }
                case GUIDED_TOGGLE -> {
                    bouquetBuilderService.toggleAddon(session, event.value());
                    yield renderStep(session, null);
                }
                case GUIDED_SUBMIT_ADDONS -> {
                    bouquetBuilderService.submitPendingAddons(session);
                    yield renderStep(session, null);
                }
                case GUIDED_BACK -> {
                    bouquetBuilderService.stepBack(session);
                    yield renderStep(session, null);
                }
                case GUIDED_FINALIZE -> {
                    CustomBouquet bouquet = bouquetBuilderService.finalizeBouquet(session);
                    cartService.add(session.getUserId(), CartItem.of(bouquet));
                    yield bouquetStepRenderer.renderDone(bouquet);
                }
                case GUIDED_CANCEL -> {
                    // /cancel отменяет тот диалог, который сейчас идёт
                    if (session.hasActiveFlowerDraft()) {
                        flowerDraftService.cancel(session);
                        yield renderCurrent(session, context, "❌ Добавление цветка отменено");
                    }
                    bouquetBuilderService.abandon(session);
                    yield renderCurrent(session, context, "❌ Создание букета отменено.");
                }
                case CART_ADD -> addToCart(session, event.value(), context);
                case CART_CLEAR -> {
                    cartService.clear(session.getUserId());
                    yield renderCurrent(session, context, "🗑️ Корзина очищена");
                }
                case CART_CHECKOUT -> checkout(session, context);
                case ADMIN_FLOWER_START -> {
                    if (!userService.isAdmin(session.getUserId())) {
                        yield accessDenied(session);
                    }
                    flowerDraftService.start(session);
                    yield flowerDraftRenderer.renderStep(session.getFlowerDraft(), null);
                }
                case ADMIN_FLOWER_DELETE -> {
                    if (!userService.isAdmin(session.getUserId())) {
                        yield accessDenied(session);
                    }
                    yield deleteFlower(session, event.value(), context);
                }
                case TEXT -> handleText(session, event, context);
            };
        } catch (InvalidStepInputException e) {
            log.debug("Неверный ввод в конструкторе: userId={}, шаг={}, {}",
                    session.getUserId(), e.getStep(), e.getMessage());
            return renderStep(session, "Такого варианта нет — выберите из кнопок ниже");
        } catch (InvalidFlowerInputException e) {
            log.debug("Неверный ввод при добавлении букета: userId={}, шаг={}, {}",
                    session.getUserId(), e.getStep(), e.getMessage());
            return flowerDraftRenderer.renderStep(session.getFlowerDraft(), e.getMessage());
        } catch (NoActiveGuidedFlowException e) {
            log.warn("Действие конструктора без активной сборки: userId={}, action={}",
                    session.getUserId(), event.action());
            return bouquetStepRenderer.renderInactive();
        } catch (UnknownScreenException e) {
            log.error("Запрошен незарегистрированный раздел, показываем главное меню: screenId={}, userId={}",
                    e.getScreenId(), session.getUserId());
            navigationService.reset(session);
            return renderCurrent(session, context);
        }
    }

    /**
     * Экраны админки открываются только администраторам (кнопку можно подделать).
     */
    private boolean mayOpen(UserSession session, String screenId) {
        boolean adminScreen = ScreenId.fromId(screenId).map(ScreenId::isAdminScreen).orElse(false);
        return !adminScreen || userService.isAdmin(session.getUserId());
    }

    private RenderResult accessDenied(UserSession session) {
        log.warn("Попытка открыть админку без прав: userId={}", session.getUserId());
        return new RenderResult(session.getCurrentScreen(), ScreenView.error("❌ У вас нет прав администратора"));
    }

    /**
     * Текст от юзера: внутри пошагового диалога — ответ на шаг, иначе подсказка.
     */
    private RenderResult handleText(UserSession session, NavigationEvent event, RenderContext context) {
        if (session.hasActiveFlowerDraft()) {
            return acceptDraftInput(session, event.value(), context);
        }
        if (session.hasActiveBouquetBuilder() && event.value() != null) {
            bouquetBuilderService.advance(session, event.value());
            return renderStep(session, null);
        }
        return renderCurrent(session, context, "🤔 Не понял. Воспользуйтесь кнопками ниже.");
    }

    /**
     * Ответ админа при добавлении букета. После последнего шага букет уже в БД —
     * показываем список цветов, чтобы было видно новый.
     */
    private RenderResult acceptDraftInput(UserSession session, String text, RenderContext context) {
        Optional<Flower> saved;
        try {
            saved = flowerDraftService.accept(session, text);
        } catch (DataAccessException | TransactionException e) {
            // Черновик остался на последнем шаге, админ может отправить категорию ещё раз
            log.error("Не удалось сохранить букет: userId={}", session.getUserId(), e);
            return flowerDraftRenderer.renderStep(session.getFlowerDraft(),
                    "Не удалось сохранить букет. Отправьте категорию ещё раз");
        }
        if (saved.isEmpty()) {
            return flowerDraftRenderer.renderStep(session.getFlowerDraft(), null);
        }

        Flower flower = saved.get();
        if (!ScreenId.ADMIN_LIST_FLOWERS.getId().equals(session.getCurrentScreen())) {
            navigationService.enter(session, ScreenId.ADMIN_LIST_FLOWERS);
        }
        return renderCurrent(session, context, "✅ Цветок добавлен!\n\n" +
                "🆔 ID: " + flower.getId() + "\n" +
                "Название: " + flower.getName() + "\n" +
                "Цена: " + flower.getPrice() + "₽\n" +
                "Категория: " + flower.getCategory());
    }

    private RenderResult deleteFlower(UserSession session, String flowerIdValue, RenderContext context) {
        Optional<Long> flowerId = parseId(flowerIdValue);
        if (flowerId.isEmpty()) {
            return renderCurrent(session, context, "😔 Такого цветка нет");
        }
        try {
            boolean deleted = flowerService.deleteFlower(flowerId.get());
            return renderCurrent(session, context, deleted
                    ? "🗑️ Цветок " + flowerId.get() + " удалён из каталога"
                    : "😔 Цветок " + flowerId.get() + " уже удалён");
        } catch (DataAccessException | TransactionException e) {
            log.error("Ошибка удаления букета: userId={}, flowerId={}", session.getUserId(), flowerId.get(), e);
            return new RenderResult(session.getCurrentScreen(),
                    ScreenView.error("❌ Не удалось удалить цветок. Попробуйте позже."));
        }
    }

    private RenderResult addToCart(UserSession session, String flowerIdValue, RenderContext context) {
        Optional<Flower> flower = parseId(flowerIdValue).flatMap(flowerService::findAvailable);
        if (flower.isEmpty()) {
            log.warn("Букет не найден или закончился: userId={}, flowerId={}", session.getUserId(), flowerIdValue);
            return renderCurrent(session, context, "😔 Этого букета уже нет в наличии");
        }
        cartService.add(session.getUserId(), CartItem.of(flower.get()));
        return renderCurrent(session, context, "✅ " + flower.get().getName() + " — в корзине!");
    }

    private RenderResult checkout(UserSession session, RenderContext context) {
        List<CartItem> items = cartService.getItems(session.getUserId());
        if (items.isEmpty()) {
            return renderCurrent(session, context, "🛒 Корзина пуста — оформлять нечего");
        }
        try {
            Order order = orderService.checkout(session.getUserId(), items);
            cartService.clear(session.getUserId());
            navigationService.enter(session, ScreenId.HISTORY);
            return renderCurrent(session, context, "✅ Заказ оформлен на " + order.getTotalPrice() + "₽! " +
                    "Мы свяжемся с вами для уточнения доставки.");
        } catch (RuntimeException e) {
            log.error("Ошибка оформления заказа: userId={}", session.getUserId(), e);
            return new RenderResult(session.getCurrentScreen(),
                    ScreenView.error("❌ Не удалось оформить заказ. Попробуйте позже."));
        }
    }

    private RenderResult renderStep(UserSession session, String error) {
        if (!session.hasActiveBouquetBuilder()) {
            return bouquetStepRenderer.renderInactive();
        }
        return bouquetStepRenderer.renderStep(session.getBouquetBuilder(), error);
    }

    private RenderResult renderCurrent(UserSession session, RenderContext context) {
        return renderCurrent(session, context, null);
    }

    /**
     * Отрисовать текущий экран сессии. Незарегистрированный экран — ошибка конфигурации:
     * логируем и показываем главное меню.
     */
    private RenderResult renderCurrent(UserSession session, RenderContext context, String notice) {
        String screenId = session.getCurrentScreen();
        ScreenRenderer renderer;
        try {
            renderer = screenRegistry.resolve(screenId);
        } catch (UnknownScreenException e) {
            log.error("Экран не зарегистрирован, показываем главное меню: screenId={}, userId={}",
                    e.getScreenId(), session.getUserId());
            screenId = ScreenId.HOME.getId();
            // enter(home) чистит стек: в главном меню стек всегда пустой
            navigationService.enter(session, screenId);
            renderer = screenRegistry.resolve(screenId);
        }

        ScreenView view;
        try {
            view = renderer.render(session.snapshot(), context);
        } catch (RuntimeException e) {
            log.error("Ошибка отрисовки экрана: screenId={}, userId={}", screenId, session.getUserId(), e);
            view = ScreenView.error("❌ Не удалось загрузить экран. Попробуйте позже или нажмите «Назад».");
        }
        if (notice != null) {
            view = view.withNotice(notice);
        }
        return new RenderResult(screenId, view);
    }

    private static Optional<Long> parseId(String value) {
        try {
            return value == null ? Optional.empty() : Optional.of(Long.parseLong(value));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
