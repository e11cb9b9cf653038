package com.alterante.filexfer.transfer;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * One parsed command line: space-separated tokens, command word case-insensitive.
 *
 * Shared by the blocking session and the event-loop state machine so both engines accept
 * exactly the same grammar.
 */
public record Request(CommandType type, List<String> args) {

    /** Arguments of {@code UPLOAD <name> <size>}. */
    public record Upload(String name, long size) {}

    public Request {
        args = List.copyOf(args);
    }

    public static Request parse(String line) throws ProtocolException {
        String trimmed = line.strip();
        if (trimmed.isEmpty()) {
            throw new ProtocolException("empty command");
        }
        String[] parts = trimmed.split(" ");
        String word = parts[0].toUpperCase(Locale.ROOT);
        CommandType type;
        try {
            type = CommandType.valueOf(word);
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("unknown command " + parts[0]);
        }
        return new Request(type, Arrays.asList(parts).subList(1, parts.length));
    }

    /** Text after the command word, single spaces preserved (for ECHO). */
    public String text() {
        return String.join(" ", args);
    }

    public Upload upload() throws ProtocolException {
        if (args.size() != 2) {
            throw new ProtocolException("usage: UPLOAD <name> <size>");
        }
        return new Upload(args.get(0), TransferProtocol.parseNonNegative(args.get(1), "size"));
    }

    public String downloadName() throws ProtocolException {
        if (args.size() != 1) {
            throw new ProtocolException("usage: DOWNLOAD <name>");
        }
        return args.get(0);
    }
}
