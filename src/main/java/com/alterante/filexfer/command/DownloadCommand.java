package com.alterante.filexfer.command;

import com.alterante.filexfer.transfer.FileTransferClient;
import com.alterante.filexfer.transfer.TransferResult;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "download",
        description = "Download a file, resuming a partial local copy",
        mixinStandardHelpOptions = true
)
public class DownloadCommand implements Callable<Integer> {

    @CommandLine.Mixin
    private ClientOptions options;

    @CommandLine.Parameters(index = "0", description = "Name of the stored file")
    private String name;

    @CommandLine.Option(names = {"--output", "-o"}, description = "Output directory (default: current directory)", defaultValue = ".")
    private Path outputDir;

    @CommandLine.Option(names = {"--quiet", "-q"}, description = "Do not print progress to stderr")
    private boolean quiet;

    @Override
    public Integer call() throws Exception {
        Files.createDirectories(outputDir);
        try (FileTransferClient client = options.connect()) {
            if (!quiet) {
                client.onProgress(new ProgressPrinter(System.err));
            }
            TransferResult result = client.download(name, outputDir);
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
