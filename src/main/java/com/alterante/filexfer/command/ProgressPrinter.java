package com.alterante.filexfer.command;

import com.alterante.filexfer.transfer.TransferProgress;

import java.io.PrintStream;
import java.util.function.Consumer;

/**
 * Redraws a transfer's status line in place, at most every {@link #INTERVAL_MS}; the final
 * update is always printed and ends the line.
 */
class ProgressPrinter implements Consumer<TransferProgress> {

    static final long INTERVAL_MS = 250;

    private final PrintStream out;
    private long lastPrintMs;

    ProgressPrinter(PrintStream out) {
        this.out = out;
    }

    @Override
    public void accept(TransferProgress progress) {
        long now = System.currentTimeMillis();
        boolean done = progress.isComplete();
        if (!done && now - lastPrintMs < INTERVAL_MS) {
            return;
        }
        lastPrintMs = now;
        out.print("\r" + progress.statusLine());
        if (done) {
            out.println();
        }
        out.flush();
    }
}
