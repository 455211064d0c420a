package org.example.flower_shop.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.Optional;

import org.example.flower_shop.model.Flower;
import org.example.flower_shop.repository.FlowerRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("FlowerService Unit Tests")
class FlowerServiceTest {

    @Mock
    private FlowerRepository flowerRepository;

    private FlowerService flowerService;

    @BeforeEach
    void setUp() {
        flowerService = new FlowerService(flowerRepository);
    }

    @Test
    @DisplayName("addFlower saves an available flower")
    void testAddFlower() {
        // Given
        when(flowerRepository.save(any(Flower.class))).thenAnswer(invocation -> {
            Flower flower = invocation.getArgument(0);
            flower.setId(6L);
            return flower;
        });

        // When
        Flower saved = flowerService.addFlower("Ромашки", null, new BigDecimal("1200"), "Полевые");

        // Then
        assertEquals(6L, saved.getId());
        assertEquals("Ромашки", saved.getName());
        assertTrue(saved.getAvailable());
    }

    @Test
    @DisplayName("deleteFlower removes an existing flower")
    void testDeleteFlower_Existing() {
        // Given
        Flower flower = Flower.builder().id(3L).name("Пионы нежные").price(new BigDecimal("3200")).build();
        when(flowerRepository.findById(3L)).thenReturn(Optional.of(flower));

        // When
        boolean deleted = flowerService.deleteFlower(3L);

        // Then
        assertTrue(deleted);
        verify(flowerRepository).delete(flower);
    }

    @Test
    @DisplayName("deleteFlower of a missing id returns false")
    void testDeleteFlower_Missing() {
        when(flowerRepository.findById(99L)).thenReturn(Optional.empty());

        assertFalse(flowerService.deleteFlower(99L));
        verify(flowerRepository, never()).delete(any(Flower.class));
    }
}
