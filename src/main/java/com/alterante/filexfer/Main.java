package com.alterante.filexfer;

import com.alterante.filexfer.command.DownloadCommand;
import com.alterante.filexfer.command.ExecCommand;
import com.alterante.filexfer.command.ServerCommand;
import com.alterante.filexfer.command.UploadCommand;
import picocli.CommandLine;

@CommandLine.Command(
        name = "alt-filexfer",
        description = "Resumable file transfer over TCP or reliable UDP",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        subcommands = {
                ServerCommand.class,
                UploadCommand.class,
                DownloadCommand.class,
                ExecCommand.class,
        }
)
public class Main implements Runnable {

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    public static CommandLine commandLine() {
        return new CommandLine(new Main()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
