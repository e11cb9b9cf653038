package com.alterante.filexfer.transfer;

/**
 * Commands a client may open an exchange with.
 */
public enum CommandType {
    ECHO,
    TIME,
    LIST,
    CLOSE,
    UPLOAD,
    DOWNLOAD
}
