package com.alterante.filexfer.command;

import com.alterante.filexfer.transfer.FileTransferClient;
import com.alterante.filexfer.transfer.TransferResult;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "upload",
        description = "Upload a file, resuming a partial copy on the server",
        mixinStandardHelpOptions = true
)
public class UploadCommand implements Callable<Integer> {

    @CommandLine.Mixin
    private ClientOptions options;

    @CommandLine.Parameters(index = "0", description = "File to upload")
    private Path file;

    @CommandLine.Option(names = {"--quiet", "-q"}, description = "Do not print progress to stderr")
    private boolean quiet;

    @Override
    public Integer call() throws Exception {
        if (!Files.isRegularFile(file)) {
            System.err.println("Error: not a regular file: " + file);
            return 1;
        }
        try (FileTransferClient client = options.connect()) {
            if (!quiet) {
                client.onProgress(new ProgressPrinter(System.err));
            }
            TransferResult result = client.upload(file);
            if (!result.succeeded()) {
                System.err.println("Error: " + result.reason());
                return 1;
            }
            System.out.println(result.summary());
            client.quit();
            return 0;
        }
    }
}
