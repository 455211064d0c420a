package org.example.flower_shop.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.example.flower_shop.model.Flower;
import org.example.flower_shop.model.NavigationAction;
import org.example.flower_shop.model.NavigationEvent;
import org.example.flower_shop.model.Order;
import org.example.flower_shop.model.UserSession;
import org.example.flower_shop.navigation.NavigationService;
import org.example.flower_shop.navigation.RenderResult;
import org.example.flower_shop.navigation.ScreenId;
import org.example.flower_shop.navigation.ScreenRegistry;
import org.example.flower_shop.navigation.ScreenView;
import org.example.flower_shop.screen.BouquetStepRenderer;
import org.example.flower_shop.screen.FlowerDraftRenderer;
import org.example.flower_shop.screen.ScreenModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ConversationEngine Unit Tests")
class ConversationEngineTest {

    private static final Long USER = 555L;

    @Mock
    private FlowerService flowerService;

    @Mock
    private OrderService orderService;

    @Mock
    private UserService userService;

    private SessionService sessionService;
    private ScreenRegistry screenRegistry;
    private CartService cartService;
    private ConversationEngine engine;

    @BeforeEach
    void setUp() {
        sessionService = new SessionService();
        cartService = new CartService();

        // Каждый экран просто печатает свой id
        ScreenModule allScreens = registry -> {
            for (ScreenId id : ScreenId.values()) {
                registry.register(id, (snapshot, ctx) -> ScreenView.text(id.getId()));
            }
            registry.register("ai_preset:birthday", (snapshot, ctx) -> ScreenView.text("birthday"));
        };
        screenRegistry = new ScreenRegistry(List.of(allScreens));
        screenRegistry.init();

        BouquetPriceCalculator calculator = new BouquetPriceCalculator(new BigDecimal("2000"), Map.of());
        BouquetBuilderService builderService = new BouquetBuilderService(calculator);

        engine = new ConversationEngine(sessionService, new NavigationService(), builderService, screenRegistry,
                new BouquetStepRenderer(builderService, calculator), cartService, flowerService, orderService,
                userService, new FlowerDraftService(flowerService), new FlowerDraftRenderer());
    }

    private RenderResult send(NavigationAction action) {
        return engine.handle(NavigationEvent.of(USER, action));
    }

    private RenderResult send(NavigationAction action, String value) {
        return engine.handle(NavigationEvent.of(USER, action, value));
    }

    private UserSession session() {
        return sessionService.getOrCreate(USER);
    }

    @Test
    @DisplayName("enter from home then back returns home")
    void testEnterAndBack() {
        // When
        RenderResult aiMenu = send(NavigationAction.ENTER_SCREEN, "ai_menu");

        // Then
        assertEquals("ai_menu", aiMenu.screenId());
        assertEquals(List.of("start"), session().getNavStack());

        RenderResult home = send(NavigationAction.NAV_BACK);
        assertEquals("start", home.screenId());
        assertTrue(home.isHome());
        assertTrue(session().getNavStack().isEmpty());
    }

    @Test
    @DisplayName("dynamic preset screen is reachable and back-navigable")
    void testDynamicScreen() {
        send(NavigationAction.ENTER_SCREEN, "ai_menu");
        send(NavigationAction.ENTER_SCREEN, "recommend_presets");

        RenderResult preset = send(NavigationAction.ENTER_SCREEN, "ai_preset:birthday");

        assertEquals("birthday", preset.view().text());
        assertEquals("recommend_presets", send(NavigationAction.NAV_BACK).screenId());
    }

    @Test
    @DisplayName("unknown screen falls back to home with an empty stack")
    void testUnknownScreen_FallsBackHome() {
        // Given
        send(NavigationAction.ENTER_SCREEN, "catalog");

        // When
        RenderResult result = send(NavigationAction.ENTER_SCREEN, "no_such_screen");

        // Then
        assertEquals("start", result.screenId());
        assertEquals("start", session().getCurrentScreen());
        assertTrue(session().getNavStack().isEmpty());

        // Back from home stays home, no stale screen underneath
        assertEquals("start", send(NavigationAction.NAV_BACK).screenId());
    }

    @Test
    @DisplayName("unregistered screen found in history falls back to home with an empty stack")
    void testUnknownScreenInHistory_FallsBackHome() {
        // Given
        send(NavigationAction.ENTER_SCREEN, "catalog");
        session().getNavStack().add("removed_screen");
        send(NavigationAction.ENTER_SCREEN, "cart");
        send(NavigationAction.NAV_BACK);

        // When: back lands on a screen nobody renders
        RenderResult result = send(NavigationAction.NAV_BACK);

        // Then
        assertEquals("start", result.screenId());
        assertEquals("start", session().getCurrentScreen());
        assertTrue(session().getNavStack().isEmpty());
    }

    @Test
    @DisplayName("renderer failure shows an error screen and back still works")
    void testRendererFailure() {
        // Given
        screenRegistry.register(ScreenId.CATALOG, (snapshot, ctx) -> {
            throw new IllegalStateException("db down");
        });

        // When
        RenderResult result = send(NavigationAction.ENTER_SCREEN, "catalog");

        // Then
        assertTrue(result.view().error());
        assertEquals("catalog", session().getCurrentScreen());
        assertEquals("start", send(NavigationAction.NAV_BACK).screenId());
    }

    @Test
    @DisplayName("guided flow end to end puts the bouquet into the cart")
    void testGuidedFlow_EndToEnd() {
        // When
        assertEquals("bouquet:color", send(NavigationAction.GUIDED_START).screenId());
        assertEquals("bouquet:quantity", send(NavigationAction.GUIDED_ADVANCE, "red").screenId());
        assertEquals("bouquet:addons", send(NavigationAction.GUIDED_ADVANCE, "15").screenId());
        send(NavigationAction.GUIDED_TOGGLE, "ribbon");
        send(NavigationAction.GUIDED_TOGGLE, "luxury");
        assertEquals("bouquet:summary", send(NavigationAction.GUIDED_SUBMIT_ADDONS).screenId());
        RenderResult done = send(NavigationAction.GUIDED_FINALIZE);

        // Then
        assertEquals(BouquetStepRenderer.DONE_SCREEN, done.screenId());
        assertFalse(session().hasActiveBouquetBuilder());
        assertEquals(1, cartService.getItems(USER).size());
        assertEquals(0, new BigDecimal("2400").compareTo(cartService.getTotal(USER)));
    }

    @Test
    @DisplayName("invalid step input re-prompts the same step")
    void testGuidedFlow_InvalidInput() {
        // Given
        send(NavigationAction.GUIDED_START);

        // When
        RenderResult result = send(NavigationAction.TEXT, "not_a_color");

        // Then
        assertEquals("bouquet:color", result.screenId());
        assertTrue(result.view().text().startsWith("❌ "));
        assertTrue(session().hasActiveBouquetBuilder());
    }

    @Test
    @DisplayName("text input advances the guided flow")
    void testGuidedFlow_TextInput() {
        send(NavigationAction.GUIDED_START);

        RenderResult result = send(NavigationAction.TEXT, "Синий");

        assertEquals("bouquet:quantity", result.screenId());
    }

    @Test
    @DisplayName("nav back does not abandon the guided flow")
    void testNavBack_KeepsGuidedFlow() {
        // Given
        send(NavigationAction.GUIDED_START);
        send(NavigationAction.GUIDED_ADVANCE, "red");

        // When
        send(NavigationAction.NAV_BACK);

        // Then
        assertTrue(session().hasActiveBouquetBuilder());
        assertEquals("bouquet:quantity", send(NavigationAction.GUIDED_START).screenId());
    }

    @Test
    @DisplayName("reset abandons the guided flow")
    void testReset_AbandonsGuidedFlow() {
        // Given
        send(NavigationAction.GUIDED_START);

        // When
        RenderResult result = send(NavigationAction.NAV_RESET);

        // Then
        assertEquals("start", result.screenId());
        assertFalse(session().hasActiveBouquetBuilder());
    }

    @Test
    @DisplayName("guided action without a flow shows the inactive screen")
    void testGuidedAction_NoFlow() {
        RenderResult result = send(NavigationAction.GUIDED_FINALIZE);

        assertEquals(BouquetStepRenderer.INACTIVE_SCREEN, result.screenId());
    }

    @Test
    @DisplayName("cancel leaves the flow and shows the current screen")
    void testGuidedCancel() {
        send(NavigationAction.ENTER_SCREEN, "catalog");
        send(NavigationAction.GUIDED_START);

        RenderResult result = send(NavigationAction.GUIDED_CANCEL);

        assertEquals("catalog", result.screenId());
        assertFalse(session().hasActiveBouquetBuilder());
    }

    @Test
    @DisplayName("admin section is refused for non-admins")
    void testAdminSection_Denied() {
        // Given
        when(userService.isAdmin(USER)).thenReturn(false);

        // When
        RenderResult result = send(NavigationAction.ENTER_SECTION, "admin_main");

        // Then
        assertTrue(result.view().error());
        assertEquals("start", session().getCurrentScreen());
    }

    @Test
    @DisplayName("admin section opens with a fresh stack")
    void testAdminSection_Allowed() {
        // Given
        when(userService.isAdmin(USER)).thenReturn(true);
        send(NavigationAction.ENTER_SCREEN, "catalog");

        // When
        RenderResult result = send(NavigationAction.ENTER_SECTION, "admin_main");

        // Then
        assertEquals("admin_main", result.screenId());
        assertTrue(session().getNavStack().isEmpty());
    }

    @Test
    @DisplayName("adding a catalog flower puts it into the cart")
    void testCartAdd() {
        // Given
        Flower roses = Flower.builder().id(1L).name("Розы классические").price(new BigDecimal("2500")).build();
        when(flowerService.findAvailable(1L)).thenReturn(Optional.of(roses));
        send(NavigationAction.ENTER_SCREEN, "catalog");

        // When
        RenderResult result = send(NavigationAction.CART_ADD, "1");

        // Then
        assertEquals("catalog", result.screenId());
        assertTrue(result.view().text().contains("Розы классические"));
        assertEquals(1, cartService.getItems(USER).size());
    }

    @Test
    @DisplayName("garbage flower id does not touch the cart")
    void testCartAdd_BadId() {
        send(NavigationAction.CART_ADD, "abc");

        assertTrue(cartService.getItems(USER).isEmpty());
    }

    @Test
    @DisplayName("checkout creates an order, clears the cart and opens history")
    void testCheckout() {
        // Given
        Flower roses = Flower.builder().id(1L).name("Розы классические").price(new BigDecimal("2500")).build();
        when(flowerService.findAvailable(1L)).thenReturn(Optional.of(roses));
        Order order = Order.builder().userTelegramId(USER).itemsDescription("Розы классические — 2500₽")
                .totalPrice(new BigDecimal("2500")).build();
        when(orderService.checkout(eq(USER), anyList())).thenReturn(order);
        send(NavigationAction.ENTER_SCREEN, "cart");
        send(NavigationAction.CART_ADD, "1");

        // When
        RenderResult result = send(NavigationAction.CART_CHECKOUT);

        // Then
        assertEquals("history", result.screenId());
        assertTrue(cartService.getItems(USER).isEmpty());
        assertEquals(List.of("start", "cart"), session().getNavStack());
    }

    @Test
    @DisplayName("checkout of an empty cart creates nothing")
    void testCheckout_EmptyCart() {
        send(NavigationAction.CART_CHECKOUT);

        verify(orderService, never()).checkout(eq(USER), anyList());
    }

    @Test
    @DisplayName("admin adds a flower step by step")
    void testAdminAddFlower() {
        // Given
        when(userService.isAdmin(USER)).thenReturn(true);
        Flower saved = Flower.builder().id(6L).name("Ромашки").price(new BigDecimal("1200"))
                .category("Полевые").build();
        when(flowerService.addFlower("Ромашки", null, new BigDecimal("1200"), "Полевые")).thenReturn(saved);
        send(NavigationAction.ENTER_SECTION, "admin_main");

        // When
        assertEquals("flower_draft:name", send(NavigationAction.ADMIN_FLOWER_START).screenId());
        assertEquals("flower_draft:description", send(NavigationAction.TEXT, "Ромашки").screenId());
        assertEquals("flower_draft:price", send(NavigationAction.TEXT, "-").screenId());
        RenderResult badPrice = send(NavigationAction.TEXT, "дорого");
        assertEquals("flower_draft:price", badPrice.screenId());
        assertTrue(badPrice.view().text().startsWith("❌ "));
        assertEquals("flower_draft:category", send(NavigationAction.TEXT, "1200").screenId());
        RenderResult done = send(NavigationAction.TEXT, "Полевые");

        // Then
        assertEquals("admin_list_flowers", done.screenId());
        assertTrue(done.view().text().contains("Цветок добавлен"));
        assertFalse(session().hasActiveFlowerDraft());
        assertEquals("admin_main", send(NavigationAction.NAV_BACK).screenId());
    }

    @Test
    @DisplayName("non-admin cannot start adding a flower")
    void testAdminAddFlower_Denied() {
        when(userService.isAdmin(USER)).thenReturn(false);

        RenderResult result = send(NavigationAction.ADMIN_FLOWER_START);

        assertTrue(result.view().error());
        assertFalse(session().hasActiveFlowerDraft());
    }

    @Test
    @DisplayName("cancel stops adding a flower and saves nothing")
    void testAdminAddFlower_Cancel() {
        // Given
        when(userService.isAdmin(USER)).thenReturn(true);
        send(NavigationAction.ENTER_SECTION, "admin_main");
        send(NavigationAction.ADMIN_FLOWER_START);
        send(NavigationAction.TEXT, "Ромашки");

        // When
        RenderResult result = send(NavigationAction.GUIDED_CANCEL);

        // Then
        assertEquals("admin_main", result.screenId());
        assertTrue(result.view().text().contains("Добавление цветка отменено"));
        assertFalse(session().hasActiveFlowerDraft());
        verify(flowerService, never()).addFlower(anyString(), any(), any(), anyString());
    }

    @Test
    @DisplayName("admin deletes a flower from the catalog")
    void testAdminDeleteFlower() {
        // Given
        when(userService.isAdmin(USER)).thenReturn(true);
        when(flowerService.deleteFlower(3L)).thenReturn(true);
        send(NavigationAction.ENTER_SECTION, "admin_main");
        send(NavigationAction.ENTER_SCREEN, "admin_delete_flower");

        // When
        RenderResult result = send(NavigationAction.ADMIN_FLOWER_DELETE, "3");

        // Then
        assertEquals("admin_delete_flower", result.screenId());
        assertTrue(result.view().text().contains("удалён из каталога"));
    }

    @Test
    @DisplayName("non-admin delete is refused and nothing is deleted")
    void testAdminDeleteFlower_Denied() {
        when(userService.isAdmin(USER)).thenReturn(false);

        RenderResult result = send(NavigationAction.ADMIN_FLOWER_DELETE, "3");

        assertTrue(result.view().error());
        verify(flowerService, never()).deleteFlower(3L);
    }
}
