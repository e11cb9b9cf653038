package com.alterante.filexfer.transfer;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Replies to the stateless one-line commands. Both server engines answer them through here.
 */
public final class SimpleCommands {

    public static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    public static final String NO_FILES = "No files on server.";

    private SimpleCommands() {}

    /**
     * @return the single reply line for ECHO, TIME, LIST or CLOSE
     * @throws IllegalArgumentException for UPLOAD and DOWNLOAD, which are exchanges, not replies
     */
    public static String reply(Request request, FileStore store) throws StorageException {
        switch (request.type()) {
            case ECHO:
                return request.text();
            case TIME:
                return LocalDateTime.now().format(TIME_FORMAT);
            case LIST:
                List<String> names = store.list();
                return names.isEmpty() ? NO_FILES : String.join(", ", names);
            case CLOSE:
                return TransferProtocol.BYE;
            default:
                throw new IllegalArgumentException("not a one-line command: " + request.type());
        }
    }
}
