package org.example.flower_shop.model;

import lombok.Data;

import java.math.BigDecimal;

/**
 * Черновик нового букета, пока админ отвечает на вопросы бота.
 */
@Data
public class FlowerDraft {

    private FlowerDraftState state = FlowerDraftState.NAME;

    private String name;

    /** null — без описания */
    private String description;

    private BigDecimal price;

    private String category;
}
