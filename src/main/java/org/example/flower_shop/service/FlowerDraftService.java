package org.example.flower_shop.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.flower_shop.exception.InvalidFlowerInputException;
import org.example.flower_shop.exception.NoActiveGuidedFlowException;
import org.example.flower_shop.model.Flower;
import org.example.flower_shop.model.FlowerDraft;
import org.example.flower_shop.model.FlowerDraftState;
import org.example.flower_shop.model.UserSession;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Пошаговое добавление букета в каталог (админка):
 * название → описание → цена → категория → сохраняем в БД.
 * <p>
 * Как и конструктор букета, живёт в сессии и в стек навигации ничего не кладёт.
 * Одновременно у юзера может идти только один пошаговый диалог:
 * начали добавлять букет — конструктор букета закрываем.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FlowerDraftService {

    // Ограничения колонок в таблице flowers
    private static final int MAX_NAME_LENGTH = 255;
    private static final int MAX_CATEGORY_LENGTH = 100;

    /** Ответ "без описания" */
    private static final String SKIP = "-";

    private final FlowerService flowerService;

    /**
     * @return false если добавление уже идёт (черновик не трогаем)
     */
    public boolean start(UserSession session) {
        if (session.hasActiveFlowerDraft()) {
            return false;
        }
        if (session.hasActiveBouquetBuilder()) {
            log.info("Конструктор букета закрыт, начато добавление в каталог: userId={}", session.getUserId());
            session.setBouquetBuilder(null);
        }
        session.setFlowerDraft(new FlowerDraft());
        log.info("Начато добавление букета в каталог: userId={}", session.getUserId());
        return true;
    }

    /**
     * Ответ админа на текущий шаг.
     *
     * @return сохранённый букет, если это был последний шаг; иначе пусто
     * @throws InvalidFlowerInputException ответ не подходит для шага
     */
    public Optional<Flower> accept(UserSession session, String input) {
        FlowerDraft draft = requireActive(session);
        FlowerDraftState step = draft.getState();
        String value = input == null ? "" : input.trim();

        switch (step) {
            case NAME -> draft.setName(requireText(step, value, MAX_NAME_LENGTH));
            case DESCRIPTION -> draft.setDescription(SKIP.equals(value) ? null : requireText(step, value, Integer.MAX_VALUE));
            case PRICE -> draft.setPrice(parsePrice(value));
            case CATEGORY -> draft.setCategory(requireText(step, value, MAX_CATEGORY_LENGTH));
        }

        if (!step.isLast()) {
            draft.setState(step.next());
            log.debug("Шаг добавления букета {} пройден: userId={}", step, session.getUserId());
            return Optional.empty();
        }

        // Последний шаг: сохраняем. Если БД упала — черновик остаётся, можно повторить категорию
        Flower saved = flowerService.addFlower(draft.getName(), draft.getDescription(), draft.getPrice(),
                draft.getCategory());
        session.setFlowerDraft(null);
        return Optional.of(saved);
    }

    public void cancel(UserSession session) {
        if (session.hasActiveFlowerDraft()) {
            log.info("Добавление букета отменено: userId={}, шаг={}",
                    session.getUserId(), session.getFlowerDraft().getState());
        }
        session.setFlowerDraft(null);
    }

    private FlowerDraft requireActive(UserSession session) {
        if (!session.hasActiveFlowerDraft()) {
            throw new NoActiveGuidedFlowException(session.getUserId());
        }
        return session.getFlowerDraft();
    }

    private static String requireText(FlowerDraftState step, String value, int maxLength) {
        if (value.isEmpty()) {
            throw new InvalidFlowerInputException(step, "Пустой ответ");
        }
        if (value.length() > maxLength) {
            throw new InvalidFlowerInputException(step, "Слишком длинно, максимум " + maxLength + " символов");
        }
        return value;
    }

    /**
     * "1500", "1500.50" и "1500,50" — всё цена. Ноль и минус — нет.
     */
    private static BigDecimal parsePrice(String value) {
        BigDecimal price;
        try {
            price = new BigDecimal(value.replace(',', '.').replace(" ", ""));
        } catch (NumberFormatException e) {
            throw new InvalidFlowerInputException(FlowerDraftState.PRICE, "Неверный формат цены. Введите число");
        }
        if (price.signum() <= 0) {
            throw new InvalidFlowerInputException(FlowerDraftState.PRICE, "Цена должна быть больше нуля");
        }
        if (price.scale() > 2 || price.precision() - price.scale() > 8) {
            throw new InvalidFlowerInputException(FlowerDraftState.PRICE, "Цена до 99 999 999₽, не больше двух знаков после запятой");
        }
        return price;
    }
}
