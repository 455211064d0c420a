package org.example.flower_shop.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.example.flower_shop.exception.InvalidStepInputException;
import org.example.flower_shop.exception.NoActiveGuidedFlowException;
import org.example.flower_shop.model.BouquetAddon;
import org.example.flower_shop.model.BouquetBuilderData;
import org.example.flower_shop.model.BouquetBuilderState;
import org.example.flower_shop.model.BouquetColor;
import org.example.flower_shop.model.BouquetQuantity;
import org.example.flower_shop.model.CustomBouquet;
import org.example.flower_shop.model.UserSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("BouquetBuilderService Unit Tests")
class BouquetBuilderServiceTest {

    private BouquetBuilderService builderService;
    private UserSession session;

    @BeforeEach
    void setUp() {
        builderService = new BouquetBuilderService(
                new BouquetPriceCalculator(new BigDecimal("2000"), Map.of()));
        session = new UserSession(100L);
    }

    @Test
    @DisplayName("full flow red / 15 / ribbon+luxury costs 2400")
    void testFullFlow_ProducesBouquet() {
        // Given
        builderService.start(session);

        // When
        builderService.advance(session, "red");
        builderService.advance(session, "15");
        builderService.advance(session, List.of("ribbon", "luxury"));
        CustomBouquet bouquet = builderService.finalizeBouquet(session);

        // Then
        assertEquals(BouquetColor.RED, bouquet.color());
        assertEquals(BouquetQuantity.FIFTEEN, bouquet.quantity());
        assertEquals(List.of(BouquetAddon.RIBBON, BouquetAddon.LUXURY), bouquet.addons());
        assertEquals(0, new BigDecimal("2400").compareTo(bouquet.price()));
        assertEquals(Map.of("color", "red", "quantity", "15", "addons", List.of("ribbon", "luxury")),
                bouquet.toFields());
        assertFalse(session.hasActiveBouquetBuilder());
    }

    @Test
    @DisplayName("invalid color keeps the step and the state untouched")
    void testAdvance_InvalidColor() {
        // Given
        builderService.start(session);

        // When
        InvalidStepInputException e = assertThrows(InvalidStepInputException.class,
                () -> builderService.advance(session, "not_a_color"));

        // Then
        assertEquals(BouquetBuilderState.CHOOSE_COLOR, e.getStep());
        assertEquals(BouquetBuilderState.CHOOSE_COLOR, session.getBouquetBuilder().getState());
        assertNull(session.getBouquetBuilder().getColor());
    }

    @Test
    @DisplayName("invalid quantity keeps the already chosen color")
    void testAdvance_InvalidQuantity_KeepsColor() {
        // Given
        builderService.start(session);
        builderService.advance(session, "blue");

        // When
        assertThrows(InvalidStepInputException.class, () -> builderService.advance(session, "13"));

        // Then
        assertEquals(BouquetBuilderState.CHOOSE_QUANTITY, session.getBouquetBuilder().getState());
        assertEquals(BouquetColor.BLUE, session.getBouquetBuilder().getColor());
    }

    @Test
    @DisplayName("color step accepts the button label and ignores case")
    void testAdvance_AcceptsLabel() {
        builderService.start(session);

        builderService.advance(session, "🟡 Желтый");

        assertEquals(BouquetColor.YELLOW, session.getBouquetBuilder().getColor());
    }

    @Test
    @DisplayName("explicit none means empty addon selection")
    void testAdvance_NoneAddons() {
        // Given
        builderService.start(session);
        builderService.advance(session, "white");
        builderService.advance(session, "5");

        // When
        BouquetBuilderState next = builderService.advance(session, List.of("none"));

        // Then
        assertEquals(BouquetBuilderState.SUMMARY, next);
        assertTrue(session.getBouquetBuilder().getAddons().isEmpty());
        assertEquals(0, new BigDecimal("2000").compareTo(builderService.finalizeBouquet(session).price()));
    }

    @Test
    @DisplayName("unknown addon rejects the whole selection")
    void testAdvance_UnknownAddon() {
        // Given
        builderService.start(session);
        builderService.advance(session, "mix");
        builderService.advance(session, "7");

        // When / Then
        assertThrows(InvalidStepInputException.class,
                () -> builderService.advance(session, List.of("ribbon", "diamonds")));
        assertEquals(BouquetBuilderState.CHOOSE_ADDONS, session.getBouquetBuilder().getState());
        assertNull(session.getBouquetBuilder().getAddons());
    }

    @Test
    @DisplayName("color step rejects multiple values")
    void testAdvance_MultipleColors() {
        builderService.start(session);

        assertThrows(InvalidStepInputException.class,
                () -> builderService.advance(session, List.of("red", "blue")));
    }

    @Test
    @DisplayName("toggled addons are submitted with Done")
    void testToggleAndSubmit() {
        // Given
        builderService.start(session);
        builderService.advance(session, "green");
        builderService.advance(session, "21");

        // When
        builderService.toggleAddon(session, "toy");
        builderService.toggleAddon(session, "chocolate");
        Set<BouquetAddon> pending = builderService.toggleAddon(session, "toy");
        builderService.submitPendingAddons(session);

        // Then
        assertEquals(Set.of(BouquetAddon.CHOCOLATE), pending);
        BouquetBuilderData data = session.getBouquetBuilder();
        assertEquals(BouquetBuilderState.SUMMARY, data.getState());
        assertEquals(List.of(BouquetAddon.CHOCOLATE), data.getAddons());
        assertTrue(data.getPendingAddons().isEmpty());
    }

    @Test
    @DisplayName("toggle outside the addons step is rejected")
    void testToggle_WrongStep() {
        builderService.start(session);

        assertThrows(InvalidStepInputException.class, () -> builderService.toggleAddon(session, "ribbon"));
    }

    @Test
    @DisplayName("step back discards the value of the step returned to")
    void testStepBack_DiscardsValue() {
        // Given
        builderService.start(session);
        builderService.advance(session, "red");
        builderService.advance(session, "11");

        // When
        BouquetBuilderState state = builderService.stepBack(session);

        // Then
        BouquetBuilderData data = session.getBouquetBuilder();
        assertEquals(BouquetBuilderState.CHOOSE_QUANTITY, state);
        assertNull(data.getQuantity());
        assertEquals(BouquetColor.RED, data.getColor());
    }

    @Test
    @DisplayName("step back on the first step is a no-op")
    void testStepBack_FirstStep() {
        builderService.start(session);

        assertEquals(BouquetBuilderState.CHOOSE_COLOR, builderService.stepBack(session));
        assertTrue(session.hasActiveBouquetBuilder());
    }

    @Test
    @DisplayName("start while a flow is running keeps the current progress")
    void testStart_AlreadyActive() {
        // Given
        builderService.start(session);
        builderService.advance(session, "orange");

        // When
        boolean started = builderService.start(session);

        // Then
        assertFalse(started);
        assertEquals(BouquetBuilderState.CHOOSE_QUANTITY, session.getBouquetBuilder().getState());
    }

    @Test
    @DisplayName("finalize before summary is rejected")
    void testFinalize_TooEarly() {
        builderService.start(session);
        builderService.advance(session, "purple");

        assertThrows(InvalidStepInputException.class, () -> builderService.finalizeBouquet(session));
        assertTrue(session.hasActiveBouquetBuilder());
    }

    @Test
    @DisplayName("advance at summary is rejected")
    void testAdvance_AtSummary() {
        builderService.start(session);
        builderService.advance(session, "red");
        builderService.advance(session, "5");
        builderService.advance(session, List.of());

        assertThrows(InvalidStepInputException.class, () -> builderService.advance(session, "red"));
    }

    @Test
    @DisplayName("guided actions without an active flow raise NoActiveGuidedFlowException")
    void testNoActiveFlow() {
        assertThrows(NoActiveGuidedFlowException.class, () -> builderService.advance(session, "red"));
        assertThrows(NoActiveGuidedFlowException.class, () -> builderService.stepBack(session));
        assertThrows(NoActiveGuidedFlowException.class, () -> builderService.finalizeBouquet(session));
    }

    @Test
    @DisplayName("abandon drops the flow")
    void testAbandon() {
        builderService.start(session);

        builderService.abandon(session);

        assertFalse(session.hasActiveBouquetBuilder());
    }
}
