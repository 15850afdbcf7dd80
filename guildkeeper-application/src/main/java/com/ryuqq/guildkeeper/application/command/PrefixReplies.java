package com.ryuqq.guildkeeper.application.command;

import com.ryuqq.guildkeeper.core.model.Prefix;

/**
 * Reply texts sent by {@link PrefixCommand}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PrefixReplies {

    private PrefixReplies() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String directMessage() {
        return "The bot's default prefix is ```" + Prefix.DEFAULT_VALUE + "```\n"
            + "Use `" + Prefix.DEFAULT_VALUE + "prefix <new prefix>` to change it in a server.";
    }

    public static String notAdministrator() {
        return "You must be an administrator to use this command.";
    }

    public static String current(Prefix prefix) {
        return "The bot's prefix is ```" + prefix.getValue() + "```\n"
            + "Use `" + prefix.getValue() + "prefix <new prefix>` to change it.";
    }

    public static String notConfigured() {
        return "This server has no stored settings yet. The default prefix is ```" + Prefix.DEFAULT_VALUE + "```";
    }

    public static String containsWhitespace() {
        return "Prefixes cannot contain spaces.";
    }

    public static String prefixSet(Prefix prefix) {
        return "Prefix set to ```" + prefix.getValue() + "```";
    }

    public static String readFailure() {
        return "Could not read this server's settings right now. Please try again later.";
    }

    public static String writeFailure() {
        return "Could not save the new prefix right now. Please try again later.";
    }
}
