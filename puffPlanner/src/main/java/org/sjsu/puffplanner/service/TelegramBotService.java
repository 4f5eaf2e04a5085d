package org.sjsu.puffplanner.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.BotSession;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

@Service
@Slf4j
@ConditionalOnProperty(name = "telegram.bot.enabled", havingValue = "true", matchIfMissing = true)
public class TelegramBotService extends TelegramLongPollingBot {

    private final String botUsername;
    private final ChatCommandService chatCommandService;
    private final ChatUpdateDispatcher chatUpdateDispatcher;
    private BotSession botSession;

    public TelegramBotService(@Value("${telegram.bot.token}") String botToken,
                              @Value("${telegram.bot.username}") String botUsername,
                              ChatCommandService chatCommandService,
                              ChatUpdateDispatcher chatUpdateDispatcher) {
        super(botToken);
        this.botUsername = botUsername;
        this.chatCommandService = chatCommandService;
        this.chatUpdateDispatcher = chatUpdateDispatcher;
        log.info("TelegramBotService initialized with username: {}", this.botUsername);
    }

    @Override
    public void onUpdateReceived(Update update) {
        if (!update.hasMessage() || !update.getMessage().hasText()) {
            return;
        }
        Message message = update.getMessage();
        Long chatId = message.getChatId();
        User from = message.getFrom();
        // Sessions belong to the person, not the chat; fall back to the chat for anonymous senders
        Long userId = from != null ? from.getId() : chatId;
        String firstName = from != null ? from.getFirstName() : null;
        String userText = message.getText();

        log.info("Received message from userId {} in chatId {}: '{}'", userId, chatId, userText);
        chatUpdateDispatcher.dispatch(userId, () -> {
            String reply = chatCommandService.handleMessage(userId, firstName, userText);
            if (reply != null) {
                sendTextMessage(chatId, reply);
            }
        });
    }

    @Override
    public String getBotUsername() {
        return this.botUsername;
    }

    public void sendTextMessage(Long chatId, String text) {
        try {
            SendMessage message = new SendMessage();
            message.setChatId(chatId.toString());
            message.setText(text);
            message.setParseMode("MarkdownV2");
            execute(message);
        } catch (TelegramApiException e) {
            log.error("Error sending message to chat {}: {}", chatId, e.getMessage(), e);
            sendFallbackMessage(chatId);
        }
    }

    private void sendFallbackMessage(Long chatId) {
        try {
            SendMessage message = new SendMessage();
            message.setChatId(chatId.toString());
            message.setText("Sorry, there was an error formatting the message. Please try again.");
            message.disableWebPagePreview();
            execute(message);
        } catch (TelegramApiException ex) {
            log.error("Failed to send fallback message to chat {}: {}", chatId, ex.getMessage(), ex);
        }
    }

    @PostConstruct
    public void registerBot() {
        try {
            TelegramBotsApi telegramBotsApi = new TelegramBotsApi(DefaultBotSession.class);
            botSession = telegramBotsApi.registerBot(this);
            log.info("TelegramBotService registered successfully!");
        } catch (TelegramApiException e) {
            log.error("Error registering TelegramBotService: {}", e.getMessage(), e);
        }
    }

    @PreDestroy
    public void cleanUp() {
        log.info("TelegramBotService shutting down.");
        if (botSession != null && botSession.isRunning()) {
            botSession.stop();
        }
    }
}
