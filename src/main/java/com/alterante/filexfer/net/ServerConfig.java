package com.alterante.filexfer.net;

import com.alterante.filexfer.transport.ArqConfig;

import java.nio.file.Path;

/**
 * Startup configuration of a {@link FileServer}.
 *
 * @param port       TCP and UDP port; 0 picks a free TCP port and binds UDP to the same number
 * @param storageDir flat directory holding stored files, created on start
 * @param mode       scheduling model for stream connections
 * @param arq        reliability knobs of the datagram service
 */
public record ServerConfig(int port, Path storageDir, Mode mode, ArqConfig arq) {

    public static final int DEFAULT_PORT = 12345;
    public static final String DEFAULT_STORAGE = "server_files";

    public enum Mode {
        THREADED,
        EVENT_LOOP
    }

    public ServerConfig {
        if (port < 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
        if (storageDir == null) throw new IllegalArgumentException("storageDir is required");
        if (mode == null) throw new IllegalArgumentException("mode is required");
        if (arq == null) throw new IllegalArgumentException("arq is required");
    }

    public static ServerConfig defaults() {
        return new ServerConfig(DEFAULT_PORT, Path.of(DEFAULT_STORAGE), Mode.THREADED, ArqConfig.defaults());
    }

    public ServerConfig withPort(int port) {
        return new ServerConfig(port, storageDir, mode, arq);
    }

    public ServerConfig withMode(Mode mode) {
        return new ServerConfig(port, storageDir, mode, arq);
    }
}
