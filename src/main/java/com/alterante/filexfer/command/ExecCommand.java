package com.alterante.filexfer.command;

import com.alterante.filexfer.transfer.FileTransferClient;
import com.alterante.filexfer.transfer.TransferProtocol;
import picocli.CommandLine;

import java.util.List;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "exec",
        description = "Send one command (ECHO <text>, TIME, LIST) and print the reply",
        mixinStandardHelpOptions = true
)
public class ExecCommand implements Callable<Integer> {

    @CommandLine.Mixin
    private ClientOptions options;

    @CommandLine.Parameters(arity = "1..*", description = "Command words, e.g. ECHO hello")
    private List<String> words;

    @Override
    public Integer call() throws Exception {
        try (FileTransferClient client = options.connect()) {
            String reply = client.exec(String.join(" ", words));
            System.out.println(reply);
            if (TransferProtocol.isError(reply)) {
                return 1;
            }
            if (!reply.equals(TransferProtocol.BYE)) {
                client.quit();
            }
            return 0;
        }
    }
}
