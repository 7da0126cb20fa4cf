package com.phillippitts.shato.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The generative model's structured guess: either a conversational reply or a command invocation.
 *
 * <p>A {@code null} command denotes a conversational reply; its parameters are always empty.
 *
 * @param replyText  text shown or spoken to the user
 * @param command    proposed command name, or {@code null} for a chat reply
 * @param parameters proposed command parameters (unmodifiable, never null)
 */
public record CommandProposal(String replyText, String command, Map<String, Object> parameters) {

    public CommandProposal {
        Objects.requireNonNull(replyText, "replyText must not be null");
        if (command != null && command.isBlank()) {
            command = null;
        }
        parameters = (command == null || parameters == null)
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /**
     * Creates a conversational reply.
     *
     * @param replyText reply text
     * @return proposal without a command
     */
    public static CommandProposal chat(String replyText) {
        return new CommandProposal(replyText, null, Map.of());
    }

    /**
     * Creates a command proposal.
     *
     * @param replyText  accompanying reply text
     * @param command    command name
     * @param parameters command parameters (nullable, treated as empty)
     * @return proposal carrying a command
     */
    public static CommandProposal command(String replyText, String command, Map<String, Object> parameters) {
        Objects.requireNonNull(command, "command must not be null");
        return new CommandProposal(replyText, command, parameters);
    }

    /**
     * @return {@code true} if the model proposed a command
     */
    public boolean hasCommand() {
        return command != null;
    }

    /**
     * @return the proposed command name, empty for chat replies
     */
    public Optional<String> commandName() {
        return Optional.ofNullable(command);
    }
}
