package com.alterante.filexfer.transfer;

import java.io.IOException;

/**
 * A filesystem operation on the storage directory failed (permissions, disk full, ...).
 */
public class StorageException extends IOException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
