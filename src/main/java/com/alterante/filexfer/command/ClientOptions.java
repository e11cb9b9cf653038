package com.alterante.filexfer.command;

import com.alterante.filexfer.net.ServerConfig;
import com.alterante.filexfer.transfer.FileTransferClient;
import com.alterante.filexfer.transport.ArqConfig;
import com.alterante.filexfer.transport.TransportKind;
import picocli.CommandLine;

import java.io.IOException;

/**
 * Connection options shared by the client subcommands.
 */
public class ClientOptions {

    @CommandLine.Option(names = {"--host", "-H"}, description = "Server host (default: 127.0.0.1)", defaultValue = "127.0.0.1")
    String host;

    @CommandLine.Option(names = {"--port", "-p"}, description = "Server port (default: " + ServerConfig.DEFAULT_PORT + ")",
            defaultValue = "" + ServerConfig.DEFAULT_PORT)
    int port;

    @CommandLine.Option(names = {"--transport", "-t"}, description = "tcp or udp (default: tcp)", defaultValue = "TCP")
    TransportKind transport;

    @CommandLine.Option(names = {"--retries"}, description = "UDP retry rounds before giving up (default: 100)", defaultValue = "100")
    int retries;

    FileTransferClient connect() throws IOException {
        return FileTransferClient.connect(transport, host, port, ArqConfig.defaults().withMaxRetries(retries));
    }
}
