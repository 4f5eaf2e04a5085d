package org.sjsu.puffplanner.service;

import lombok.extern.slf4j.Slf4j;
import org.sjsu.puffplanner.model.WizardEvent;
import org.sjsu.puffplanner.model.WizardReply;
import org.sjsu.puffplanner.model.enums.BotCommand;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import static org.sjsu.puffplanner.util.MarkdownUtil.escapeMarkdownV2;

/**
 * Turns one incoming chat message into one MarkdownV2 reply. Wizard commands and answers go to the
 * {@link ConversationEngine}; the rest are static texts. Commands addressed to another bot get no reply.
 */
@Service
@Slf4j
public class ChatCommandService {

    static final String HELP_MESSAGE =
            "*Available commands:*\n" +
                    "• /start – welcome message\n" +
                    "• /setup – configure your reduction plan\n" +
                    "• /cancel – abort current setup\n" +
                    "• /help – this help";

    static final String UNKNOWN_COMMAND_MESSAGE =
            "🤷‍♂️ *I don't understand that command\\.* Type /help to see what I can do\\!";

    static final String FAILURE_MESSAGE =
            "😅 Oops\\! Something went wrong while processing your request\\. Please try again\\!";

    private final ConversationEngine conversationEngine;
    private final String botUsername;

    public ChatCommandService(ConversationEngine conversationEngine,
                              @Value("${telegram.bot.username}") String botUsername) {
        this.conversationEngine = conversationEngine;
        this.botUsername = botUsername;
    }

    /**
     * @return the MarkdownV2 reply, or {@code null} when the message was meant for a different bot
     */
    public String handleMessage(Long userId, String firstName, String text) {
        BotCommand command = BotCommand.parse(text, botUsername);
        try {
            return switch (command) {
                case START -> welcome(firstName);
                case HELP -> HELP_MESSAGE;
                case SETUP -> runWizard(userId, WizardEvent.start());
                case CANCEL -> runWizard(userId, WizardEvent.cancel());
                case UNKNOWN -> {
                    log.warn("Unknown command from userId {}: '{}'", userId, text);
                    yield UNKNOWN_COMMAND_MESSAGE;
                }
                case OTHER_BOT -> {
                    log.debug("Ignoring command for another bot from userId {}: '{}'", userId, text);
                    yield null;
                }
                case NONE -> runWizard(userId, WizardEvent.answer(text));
            };
        } catch (Exception e) {
            log.error("Error processing {} from userId {}: {}", command, userId, e.getMessage(), e);
            return FAILURE_MESSAGE;
        }
    }

    private String runWizard(Long userId, WizardEvent event) {
        WizardReply reply = conversationEngine.handle(userId, event);
        log.info("Wizard outcome for userId {}: {}", userId, reply.getOutcome());
        return escapeMarkdownV2(reply.getText());
    }

    private static String welcome(String firstName) {
        String name = firstName != null && !firstName.isBlank() ? escapeMarkdownV2(firstName) : "there";
        return "Hello " + name + "\\! 👋\n\n" +
                "I'm your personal vaping\\-reduction assistant\\.\n" +
                "Send /setup to build your plan, or /help for all commands\\.";
    }
}
