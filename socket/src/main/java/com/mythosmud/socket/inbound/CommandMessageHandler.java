package com.mythosmud.socket.inbound;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.mythosmud.core.msg.ErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Handles {@code command} and {@code game_command} frames: {@code {command, args?}}.
 * <p>
 * Without {@code args} the command line is split on whitespace and the first word becomes
 * the command. The command name is lower-cased either way.
 * </p>
 */
public class CommandMessageHandler implements InboundMessageHandler {
    private static final Logger log = LoggerFactory.getLogger(CommandMessageHandler.class);
    private static final Splitter WORDS = Splitter.onPattern("\\s+").omitEmptyStrings().trimResults();

    private final GameCommandProcessor processor;

    public CommandMessageHandler(GameCommandProcessor processor) {
        this.processor = processor;
    }

    @Override
    public Mono<Void> handle(InboundContext context, Map<String, Object> data) {
        return Mono.defer(() -> {
            String commandLine = data.get("command") instanceof String s ? s : null;
            if (Strings.isNullOrEmpty(commandLine) || commandLine.isBlank()) {
                context.replyError(ErrorType.INVALID_COMMAND, "Empty command", Map.of("player_id", context.getPlayerId()));
                return Mono.empty();
            }

            String command;
            List<String> args;
            if (data.get("args") instanceof List<?> rawArgs) {
                command = commandLine.trim().toLowerCase(Locale.ROOT);
                args = new ArrayList<>(rawArgs.size());
                rawArgs.forEach(arg -> args.add(String.valueOf(arg)));
            } else {
                List<String> words = WORDS.splitToList(commandLine);
                command = words.get(0).toLowerCase(Locale.ROOT);
                args = words.subList(1, words.size());
            }

            log.debug("Processing command '{}' {} from {}", command, args, context.getPlayerId());
            return processor.process(context.getPlayerId(), command, args)
                .defaultIfEmpty(Map.of())
                .doOnNext(result -> context.reply("command_response", result))
                .then();
        });
    }
}
