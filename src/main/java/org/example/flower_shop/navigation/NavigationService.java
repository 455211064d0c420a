package org.example.flower_shop.navigation;

import lombok.extern.slf4j.Slf4j;
import org.example.flower_shop.model.UserSession;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Навигация по экранам через стек.
 * <p>
 * Граф переходов нигде не описан: любой экран может ссылаться на любой.
 * Вместо этого при каждом переходе вперёд текущий экран кладётся в стек,
 * а "Назад" просто снимает последний — это всегда точный обратный путь.
 * <p>
 * Вызывать только внутри SessionService.withSession (события одного юзера
 * обрабатываются по очереди). Конструктор букета здесь не трогаем — кроме reset.
 */
@Slf4j
@Service
public class NavigationService {

    private static final String HOME = ScreenId.HOME.getId();

    /**
     * Переход вперёд: текущий экран в стек, target становится текущим.
     * Переход на главное меню стек очищает — в главном меню стек всегда пустой.
     */
    public void enter(UserSession session, String targetId) {
        // Главное меню — особый случай: стек не растёт, а обнуляется
        if (ScreenId.isHome(targetId)) {
            session.getNavStack().clear();
            session.setCurrentScreen(HOME);
            log.debug("Переход в главное меню, стек очищен: userId={}", session.getUserId());
            return;
        }
        // Запоминаем, откуда ушли (кладём на вершину стека = в конец списка)
        session.getNavStack().add(session.getCurrentScreen());
        session.setCurrentScreen(targetId);
        log.debug("Переход {} → {}, глубина стека {}: userId={}",
                peekOrHome(session), targetId, session.getNavStack().size(), session.getUserId());
    }

    public void enter(UserSession session, ScreenId target) {
        enter(session, target.getId());
    }

    /**
     * "Назад": снять экран со стека. Пустой стек — не ошибка, просто главное меню.
     *
     * @return id экрана, который стал текущим
     */
    public String back(UserSession session) {
        List<String> stack = session.getNavStack();

        // Некуда возвращаться (например, после рестарта бота юзер жмёт старую кнопку) — в главное меню
        if (stack.isEmpty()) {
            session.setCurrentScreen(HOME);
            log.debug("Стек пуст, возврат в главное меню: userId={}", session.getUserId());
            return HOME;
        }
        // Снимаем вершину стека — это экран, с которого пришли
        String previous = stack.remove(stack.size() - 1);
        session.setCurrentScreen(previous);
        log.debug("Назад → {}, глубина стека {}: userId={}", previous, stack.size(), session.getUserId());
        return previous;
    }

    /**
     * Полный сброс (/start, /admin): пустой стек, главное меню,
     * конструктор букета и черновик букета из админки выброшены.
     */
    public void reset(UserSession session) {
        session.getNavStack().clear();
        session.setCurrentScreen(HOME);

        // Пошаговые диалоги тоже обнуляем — после /start юзер начинает с чистого листа
        if (session.hasActiveBouquetBuilder()) {
            log.info("Конструктор букета сброшен вместе с навигацией: userId={}", session.getUserId());
        }
        if (session.hasActiveFlowerDraft()) {
            log.info("Добавление букета в каталог сброшено вместе с навигацией: userId={}", session.getUserId());
        }
        session.setBouquetBuilder(null);
        session.setFlowerDraft(null);
    }

    /**
     * Прыжок без записи в стек — на такой экран "Назад" не вернёт.
     */
    public void jump(UserSession session, String targetId) {
        session.setCurrentScreen(targetId);
    }

    /**
     * Вход в отдельный раздел (админка): свой стек с нуля, "Назад" из корня раздела — в главное меню.
     */
    public void enterSection(UserSession session, ScreenId root) {
        reset(session);
        jump(session, root.getId());
        log.info("Вход в раздел {}: userId={}", root.getId(), session.getUserId());
    }

    private String peekOrHome(UserSession session) {
        List<String> stack = session.getNavStack();
        return stack.isEmpty() ? HOME : stack.get(stack.size() - 1);
    }
}
