package org.sjsu.puffplanner.model.enums;

import java.util.Arrays;
import java.util.Locale;

public enum BotCommand {
    START("/start"),   // Welcome message
    HELP("/help"),     // Command list
    SETUP("/setup"),   // Begin (or restart) the wizard
    CANCEL("/cancel"), // Abort the wizard
    UNKNOWN(null),     // Any other slash command
    OTHER_BOT(null),   // Command addressed to a different bot, e.g. "/setup@SomeOtherBot"
    NONE(null);        // Plain text, i.e. an answer

    private final String keyword;

    BotCommand(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    /**
     * Classifies an incoming message. With {@code botUsername} "PuffPlannerBot", "/setup@PuffPlannerBot now"
     * resolves to {@link #SETUP} and "/setup@SomeOtherBot" to {@link #OTHER_BOT}.
     */
    public static BotCommand parse(String text, String botUsername) {
        if (text == null) {
            return NONE;
        }
        String trimmed = text.trim();
        if (!trimmed.startsWith("/")) {
            return NONE;
        }
        String word = trimmed.split("\\s+", 2)[0];
        int mention = word.indexOf('@');
        if (mention >= 0 && !word.substring(mention + 1).equalsIgnoreCase(botUsername)) {
            return OTHER_BOT;
        }
        String command = (mention >= 0 ? word.substring(0, mention) : word).toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(c -> c.keyword != null && c.keyword.equals(command))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
