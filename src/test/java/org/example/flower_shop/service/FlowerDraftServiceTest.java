package org.example.flower_shop.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.Optional;

import org.example.flower_shop.exception.InvalidFlowerInputException;
import org.example.flower_shop.exception.NoActiveGuidedFlowException;
import org.example.flower_shop.model.BouquetBuilderData;
import org.example.flower_shop.model.Flower;
import org.example.flower_shop.model.FlowerDraftState;
import org.example.flower_shop.model.UserSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
@DisplayName("FlowerDraftService Unit Tests")
class FlowerDraftServiceTest {

    @Mock
    private FlowerService flowerService;

    private FlowerDraftService draftService;
    private UserSession session;

    @BeforeEach
    void setUp() {
        draftService = new FlowerDraftService(flowerService);
        session = new UserSession(77L);
    }

    private void fillUpToCategory() {
        draftService.start(session);
        draftService.accept(session, "Пионы белые");
        draftService.accept(session, "9 белых пионов");
        draftService.accept(session, "3400");
    }

    @Test
    @DisplayName("all four answers save the flower and close the draft")
    void testAccept_SavesOnLastStep() {
        // Given
        Flower saved = Flower.builder().id(10L).name("Пионы белые").price(new BigDecimal("3400")).build();
        when(flowerService.addFlower("Пионы белые", "9 белых пионов", new BigDecimal("3400"), "Пионы"))
                .thenReturn(saved);
        fillUpToCategory();

        // When
        Optional<Flower> result = draftService.accept(session, "Пионы");

        // Then
        assertEquals(Optional.of(saved), result);
        assertFalse(session.hasActiveFlowerDraft());
    }

    @Test
    @DisplayName("intermediate steps do not touch the database")
    void testAccept_IntermediateSteps() {
        // Given
        draftService.start(session);

        // When
        Optional<Flower> result = draftService.accept(session, "Ромашки");

        // Then
        assertTrue(result.isEmpty());
        assertEquals(FlowerDraftState.DESCRIPTION, session.getFlowerDraft().getState());
        assertEquals("Ромашки", session.getFlowerDraft().getName());
        verify(flowerService, never()).addFlower(anyString(), any(), any(), anyString());
    }

    @Test
    @DisplayName("dash skips the description")
    void testAccept_SkipDescription() {
        draftService.start(session);
        draftService.accept(session, "Ромашки");

        draftService.accept(session, " - ");

        assertNull(session.getFlowerDraft().getDescription());
        assertEquals(FlowerDraftState.PRICE, session.getFlowerDraft().getState());
    }

    @Test
    @DisplayName("price accepts comma as decimal separator")
    void testAccept_PriceWithComma() {
        draftService.start(session);
        draftService.accept(session, "Ромашки");
        draftService.accept(session, "-");

        draftService.accept(session, "1500,50");

        assertEquals(new BigDecimal("1500.50"), session.getFlowerDraft().getPrice());
    }

    @Test
    @DisplayName("bad price keeps the step")
    void testAccept_BadPrice() {
        // Given
        draftService.start(session);
        draftService.accept(session, "Ромашки");
        draftService.accept(session, "-");

        // When / Then
        InvalidFlowerInputException e = assertThrows(InvalidFlowerInputException.class,
                () -> draftService.accept(session, "тысяча"));
        assertEquals(FlowerDraftState.PRICE, e.getStep());
        assertThrows(InvalidFlowerInputException.class, () -> draftService.accept(session, "0"));
        assertThrows(InvalidFlowerInputException.class, () -> draftService.accept(session, "-100"));
        assertEquals(FlowerDraftState.PRICE, session.getFlowerDraft().getState());
        assertNull(session.getFlowerDraft().getPrice());
    }

    @Test
    @DisplayName("blank name is rejected")
    void testAccept_BlankName() {
        draftService.start(session);

        assertThrows(InvalidFlowerInputException.class, () -> draftService.accept(session, "   "));
        assertEquals(FlowerDraftState.NAME, session.getFlowerDraft().getState());
    }

    @Test
    @DisplayName("database failure keeps the draft on the last step")
    void testAccept_DatabaseDown() {
        // Given
        when(flowerService.addFlower(anyString(), any(), any(), anyString()))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));
        fillUpToCategory();

        // When / Then
        assertThrows(DataAccessResourceFailureException.class, () -> draftService.accept(session, "Пионы"));
        assertTrue(session.hasActiveFlowerDraft());
        assertEquals(FlowerDraftState.CATEGORY, session.getFlowerDraft().getState());
    }

    @Test
    @DisplayName("starting a draft closes the bouquet builder")
    void testStart_ClosesBouquetBuilder() {
        // Given
        session.setBouquetBuilder(new BouquetBuilderData());

        // When
        boolean started = draftService.start(session);

        // Then
        assertTrue(started);
        assertFalse(session.hasActiveBouquetBuilder());
        assertFalse(draftService.start(session));
    }

    @Test
    @DisplayName("answer without a draft is an error")
    void testAccept_NoDraft() {
        assertThrows(NoActiveGuidedFlowException.class, () -> draftService.accept(session, "Ромашки"));
    }
}
