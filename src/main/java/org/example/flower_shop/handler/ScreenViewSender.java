package org.example.flower_shop.handler;

import lombok.extern.slf4j.Slf4j;
import org.example.flower_shop.Bot;
import org.example.flower_shop.navigation.BackAffordance;
import org.example.flower_shop.navigation.CallbackData;
import org.example.flower_shop.navigation.RenderResult;
import org.example.flower_shop.navigation.ScreenAction;
import org.example.flower_shop.navigation.ScreenView;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.ArrayList;
import java.util.List;

/**
 * Отправляет отрисованный экран в Telegram.
 * <p>
 * Нажатие кнопки — редактируем то же сообщение (меню "листается" на месте),
 * текст/команда — новое сообщение.
 */
@Slf4j
@Component
public class ScreenViewSender {

    public static final String BACK_LABEL = "◀️ Назад";

    // @Lazy — Bot сам зависит от этого класса
    @Autowired
    @Lazy
    private Bot bot;

    public void send(Long chatId, RenderResult result) {
        // Собираем сообщение: текст экрана + инлайн-кнопки под ним
        SendMessage message = new SendMessage();
        message.setChatId(chatId.toString());
        message.setText(result.view().text());
        InlineKeyboardMarkup keyboard = buildKeyboard(result);
        if (keyboard != null) {
            message.setReplyMarkup(keyboard);
        }

        try {
            bot.execute(message);
        } catch (TelegramApiException e) {
            log.error("Ошибка отправки экрана: chatId={}, screen={}", chatId, result.screenId(), e);
        }
    }

    /**
     * Заменить сообщение с кнопками новым экраном. Если Telegram не даёт
     * отредактировать (сообщение слишком старое, текст не изменился) — шлём новое.
     */
    public void edit(Long chatId, Integer messageId, RenderResult result) {
        // EditMessageText меняет текст и кнопки у уже отправленного сообщения
        EditMessageText edit = new EditMessageText();
        edit.setChatId(chatId.toString());
        edit.setMessageId(messageId);
        edit.setText(result.view().text());
        InlineKeyboardMarkup keyboard = buildKeyboard(result);
        if (keyboard != null) {
            edit.setReplyMarkup(keyboard);
        }

        try {
            bot.execute(edit);
        } catch (TelegramApiException e) {
            log.warn("Не удалось отредактировать сообщение {}, отправляем новое: chatId={}, причина={}",
                    messageId, chatId, e.getMessage());
            send(chatId, result);
        }
    }

    /**
     * Убрать "часики" на кнопке.
     */
    public void answerCallback(String callbackQueryId) {
        AnswerCallbackQuery answer = new AnswerCallbackQuery();
        answer.setCallbackQueryId(callbackQueryId);
        try {
            bot.execute(answer);
        } catch (TelegramApiException e) {
            log.warn("Не удалось ответить на callback {}: {}", callbackQueryId, e.getMessage());
        }
    }

    /**
     * Кнопки экрана + строка "Назад" (кроме главного меню).
     *
     * @return null если кнопок нет совсем
     */
    public InlineKeyboardMarkup buildKeyboard(RenderResult result) {
        ScreenView view = result.view();
        List<List<InlineKeyboardButton>> keyboard = new ArrayList<>();

        // Строки кнопок экрана как есть: одна строка ScreenView = один ряд в Telegram
        for (List<ScreenAction> row : view.rows()) {
            List<InlineKeyboardButton> buttons = new ArrayList<>();
            for (ScreenAction action : row) {
                buttons.add(button(action.label(), action.callbackData()));
            }
            keyboard.add(buttons);
        }

        // "Назад" всегда последней строкой
        String backData = backCallback(result);
        if (backData != null) {
            keyboard.add(List.of(button(BACK_LABEL, backData)));
        }

        // Пустую клавиатуру Telegram не принимает — просто не прикладываем её
        if (keyboard.isEmpty()) {
            return null;
        }
        InlineKeyboardMarkup markup = new InlineKeyboardMarkup();
        markup.setKeyboard(keyboard);
        return markup;
    }

    private static String backCallback(RenderResult result) {
        // Шаги конструктора: "Назад" = предыдущий шаг, а не предыдущий экран
        if (result.view().back() == BackAffordance.GUIDED_BACK) {
            return CallbackData.BUILD_BACK;
        }
        if (result.view().back() == BackAffordance.NONE || result.isHome()) {
            return null;
        }
        return CallbackData.NAV_BACK;
    }

    private static InlineKeyboardButton button(String text, String callbackData) {
        InlineKeyboardButton button = new InlineKeyboardButton();
        button.setText(text);
        button.setCallbackData(callbackData);
        return button;
    }
}
