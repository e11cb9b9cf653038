package com.alterante.filexfer.command;

import com.alterante.filexfer.net.FileServer;
import com.alterante.filexfer.net.ServerConfig;
import com.alterante.filexfer.transport.ArqConfig;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "server",
        description = "Run the file server on a TCP and a UDP port",
        mixinStandardHelpOptions = true
)
public class ServerCommand implements Callable<Integer> {

    @CommandLine.Option(names = {"--port", "-p"}, description = "TCP and UDP port (default: " + ServerConfig.DEFAULT_PORT + ")",
            defaultValue = "" + ServerConfig.DEFAULT_PORT)
    private int port;

    @CommandLine.Option(names = {"--storage", "-d"}, description = "Storage directory (default: " + ServerConfig.DEFAULT_STORAGE + ")",
            defaultValue = ServerConfig.DEFAULT_STORAGE)
    private Path storage;

    @CommandLine.Option(names = {"--mode", "-m"}, description = "threaded or event-loop (default: threaded)",
            defaultValue = "threaded", converter = ModeConverter.class)
    private ServerConfig.Mode mode;

    @Override
    public Integer call() throws Exception {
        FileServer server = FileServer.create(new ServerConfig(port, storage, mode, ArqConfig.defaults()));

        // Shut down cleanly on Ctrl+C
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            System.out.println("Shutting down...");
            server.close();
        }));

        server.start();
        System.out.println("Serving " + storage.toAbsolutePath() + " on port " + server.port()
                + " (TCP and UDP, " + mode.name().toLowerCase(Locale.ROOT).replace('_', '-') + ")");
        server.awaitTermination();
        return 0;
    }

    /** Accepts {@code threaded}, {@code event-loop} and the enum names. */
    static class ModeConverter implements CommandLine.ITypeConverter<ServerConfig.Mode> {
        @Override
        public ServerConfig.Mode convert(String value) {
            return ServerConfig.Mode.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        }
    }
}
