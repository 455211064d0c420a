package org.example.flower_shop.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.flower_shop.exception.InvalidStepInputException;
import org.example.flower_shop.exception.NoActiveGuidedFlowException;
import org.example.flower_shop.model.BouquetAddon;
import org.example.flower_shop.model.BouquetBuilderData;
import org.example.flower_shop.model.BouquetBuilderState;
import org.example.flower_shop.model.BouquetColor;
import org.example.flower_shop.model.BouquetQuantity;
import org.example.flower_shop.model.CustomBouquet;
import org.example.flower_shop.model.UserSession;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Конструктор букета — пошаговый диалог "цвет → количество → дополнения → итог".
 * <p>
 * Состояние живёт в UserSession.bouquetBuilder и не зависит от стека навигации:
 * шаги конструктора ничего не кладут в стек и ничего из него не снимают.
 * <p>
 * Неверный ввод не двигает шаг и не портит уже собранные поля.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BouquetBuilderService {

    private final BouquetPriceCalculator priceCalculator;

    /**
     * Запустить конструктор.
     *
     * @return false если конструктор уже запущен (второй не создаём)
     */
    public boolean start(UserSession session) {
        if (session.hasActiveBouquetBuilder()) {
            log.debug("Конструктор уже запущен: userId={}, шаг={}",
                    session.getUserId(), session.getBouquetBuilder().getState());
            return false;
        }
        session.setBouquetBuilder(new BouquetBuilderData());
        log.info("Начало сборки букета: userId={}", session.getUserId());
        return true;
    }

    public void advance(UserSession session, String value) {
        advance(session, List.of(value));
    }

    /**
     * Ответ на текущий шаг. Для цвета и количества — ровно одно значение,
     * для дополнений — любой набор (в том числе пустой или "none").
     *
     * @throws InvalidStepInputException значение не из списка допустимых
     */
    public BouquetBuilderState advance(UserSession session, List<String> values) {
        BouquetBuilderData data = requireActive(session);
        BouquetBuilderState step = data.getState();

        switch (step) {
            case CHOOSE_COLOR -> data.setColor(BouquetColor.fromInput(single(step, values))
                    .orElseThrow(() -> invalid(step, values)));
            case CHOOSE_QUANTITY -> data.setQuantity(BouquetQuantity.fromInput(single(step, values))
                    .orElseThrow(() -> invalid(step, values)));
            case CHOOSE_ADDONS -> {
                data.setAddons(parseAddons(step, values));
                data.getPendingAddons().clear();
            }
            case SUMMARY -> throw new InvalidStepInputException(step,
                    "Букет уже собран — добавь его в корзину или вернись назад");
        }

        data.setState(step.next());
        log.debug("Шаг {} пройден: userId={}, следующий={}", step, session.getUserId(), data.getState());
        return data.getState();
    }

    /**
     * Поставить или снять галочку у дополнения (только на шаге дополнений).
     *
     * @return текущий набор отмеченных дополнений
     */
    public Set<BouquetAddon> toggleAddon(UserSession session, String value) {
        BouquetBuilderData data = requireActive(session);
        if (data.getState() != BouquetBuilderState.CHOOSE_ADDONS) {
            throw new InvalidStepInputException(data.getState(), "Сейчас не шаг выбора дополнений");
        }
        BouquetAddon addon = BouquetAddon.fromInput(value)
                .orElseThrow(() -> invalid(data.getState(), List.of(String.valueOf(value))));

        Set<BouquetAddon> pending = data.getPendingAddons();
        if (!pending.remove(addon)) {
            pending.add(addon);
        }
        return Set.copyOf(pending);
    }

    /**
     * Отправить отмеченные галочками дополнения ("Готово").
     */
    public BouquetBuilderState submitPendingAddons(UserSession session) {
        BouquetBuilderData data = requireActive(session);
        List<String> ids = data.getPendingAddons().stream().map(BouquetAddon::getId).toList();
        return advance(session, ids);
    }

    /**
     * Шаг назад внутри конструктора. Значение шага, на который вернулись, стирается —
     * юзер выбирает заново. На первом шаге ничего не делает.
     */
    public BouquetBuilderState stepBack(UserSession session) {
        BouquetBuilderData data = requireActive(session);
        BouquetBuilderState current = data.getState();
        if (current.isFirst()) {
            return current;
        }
        BouquetBuilderState previous = current.previous();
        data.clearValue(current);
        data.clearValue(previous);
        data.setState(previous);
        log.debug("Шаг назад: userId={}, {} → {}", session.getUserId(), current, previous);
        return previous;
    }

    /**
     * Завершить сборку: посчитать цену, выдать готовый букет и закрыть конструктор.
     * Работает только на финальном шаге.
     */
    public CustomBouquet finalizeBouquet(UserSession session) {
        BouquetBuilderData data = requireActive(session);
        if (!data.getState().isTerminal()) {
            throw new InvalidStepInputException(data.getState(), "Букет ещё не собран до конца");
        }

        CustomBouquet bouquet = preview(data);
        session.setBouquetBuilder(null);
        log.info("Букет собран: userId={}, поля={}, цена={}",
                session.getUserId(), bouquet.toFields(), bouquet.price());
        return bouquet;
    }

    /**
     * Выйти из конструктора без сохранения.
     */
    public void abandon(UserSession session) {
        if (session.hasActiveBouquetBuilder()) {
            log.info("Сборка букета отменена: userId={}, шаг={}",
                    session.getUserId(), session.getBouquetBuilder().getState());
        }
        session.setBouquetBuilder(null);
    }

    /**
     * Букет по данным финального шага (для предпросмотра и finalize).
     */
    public CustomBouquet preview(BouquetBuilderData data) {
        List<BouquetAddon> addons = data.getAddons() != null ? data.getAddons() : List.of();
        return new CustomBouquet(data.getColor(), data.getQuantity(), addons,
                priceCalculator.calculate(addons));
    }

    private BouquetBuilderData requireActive(UserSession session) {
        if (!session.hasActiveBouquetBuilder()) {
            throw new NoActiveGuidedFlowException(session.getUserId());
        }
        return session.getBouquetBuilder();
    }

    private List<BouquetAddon> parseAddons(BouquetBuilderState step, List<String> values) {
        Set<BouquetAddon> selected = new LinkedHashSet<>();
        for (String value : values) {
            if (BouquetAddon.NONE_ID.equalsIgnoreCase(value.trim())) {
                continue;
            }
            selected.add(BouquetAddon.fromInput(value).orElseThrow(() -> invalid(step, values)));
        }
        return new ArrayList<>(selected);
    }

    private static String single(BouquetBuilderState step, List<String> values) {
        if (values.size() != 1) {
            throw new InvalidStepInputException(step, "Нужно выбрать ровно один вариант");
        }
        return values.get(0);
    }

    private static InvalidStepInputException invalid(BouquetBuilderState step, List<String> values) {
        return new InvalidStepInputException(step, "Недопустимое значение для шага " + step.getTag() + ": " + values);
    }
}
