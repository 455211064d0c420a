package org.example.flower_shop;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.flower_shop.handler.CallbackDataParser;
import org.example.flower_shop.handler.ScreenViewSender;
import org.example.flower_shop.handler.UpdateDispatcher;
import org.example.flower_shop.model.NavigationAction;
import org.example.flower_shop.model.NavigationEvent;
import org.example.flower_shop.navigation.RenderContext;
import org.example.flower_shop.navigation.RenderResult;
import org.example.flower_shop.service.ConversationEngine;
import org.example.flower_shop.service.UserService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;

import java.util.Optional;

/**
 * Главный класс бота: слушает Telegram (long polling) и отдаёт каждое
 * обновление в поток конкретного юзера. Вся логика — в ConversationEngine.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class Bot extends TelegramLongPollingBot {

    @Value("${telegram.bot.token}")
    private String botToken;

    @Value("${telegram.bot.username}")
    private String botUsername;

    private final UpdateDispatcher updateDispatcher;
    private final CallbackDataParser callbackDataParser;
    private final ConversationEngine conversationEngine;
    private final ScreenViewSender screenViewSender;
    private final UserService userService;

    @Override
    public void onUpdateReceived(Update update) {
        // Нажатие на инлайн-кнопку
        if (update.hasCallbackQuery()) {
            CallbackQuery query = update.getCallbackQuery();
            updateDispatcher.dispatch(query.getFrom().getId(), () -> handleCallback(query));
            return;
        }
        // Команда (/start, /build...) или просто текст
        if (update.hasMessage() && update.getMessage().hasText()) {
            Message message = update.getMessage();
            updateDispatcher.dispatch(message.getFrom().getId(), () -> handleText(message));
        }
        // Фото, стикеры и прочее бот не понимает — молча пропускаем
    }

    private void handleCallback(CallbackQuery query) {
        Long telegramId = query.getFrom().getId();
        // Сразу отвечаем Telegram, иначе на кнопке будут крутиться "часики"
        screenViewSender.answerCallback(query.getId());

        Optional<NavigationEvent> event = callbackDataParser.parseCallback(telegramId, query.getData());
        if (event.isEmpty()) {
            return;
        }

        RenderContext context = new RenderContext(telegramId, query.getFrom().getFirstName());
        RenderResult result = conversationEngine.handle(event.get(), context);

        // Сообщение, к которому прикреплена кнопка. Его и редактируем
        if (query.getMessage() != null) {
            screenViewSender.edit(query.getMessage().getChatId(), query.getMessage().getMessageId(), result);
        } else {
            screenViewSender.send(telegramId, result);
        }
    }

    private void handleText(Message message) {
        Long telegramId = message.getFrom().getId();
        NavigationEvent event = callbackDataParser.parseText(telegramId, message.getText());

        if (event.action() == NavigationAction.NAV_RESET) {
            registerUser(message);
        }

        RenderContext context = new RenderContext(telegramId, message.getFrom().getFirstName());
        RenderResult result = conversationEngine.handle(event, context);
        screenViewSender.send(message.getChatId(), result);
    }

    /**
     * /start: сохраняем покупателя. Если БД недоступна — меню всё равно показываем.
     */
    private void registerUser(Message message) {
        var from = message.getFrom();
        try {
            userService.registerOrUpdate(from.getId(), from.getUserName(), from.getFirstName(), from.getLastName());
        } catch (DataAccessException | TransactionException e) {
            log.error("Не удалось сохранить пользователя: telegramId={}", from.getId(), e);
        }
    }

    @Override
    public String getBotUsername() {
        return botUsername;
    }

    @Override
    public String getBotToken() {
        return botToken;
    }
}
