package com.alterante.filexfer.transfer;

import com.alterante.filexfer.transport.ArqConfig;
import com.alterante.filexfer.transport.Transport;
import com.alterante.filexfer.transport.TransportKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;

/**
 * Client half of the session protocol: resumable upload and download plus the one-line commands.
 *
 * Works over any {@link Transport}. One command at a time; not thread-safe.
 */
public class FileTransferClient implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(FileTransferClient.class);

    private final Transport transport;
    private Consumer<TransferProgress> progressListener = p -> {};

    public FileTransferClient(Transport transport) {
        this.transport = transport;
    }

    public static FileTransferClient connect(TransportKind kind, String host, int port, ArqConfig arq)
            throws IOException {
        return new FileTransferClient(kind.connect(host, port, arq));
    }

    /** Called after every chunk of a transfer. */
    public void onProgress(Consumer<TransferProgress> listener) {
        this.progressListener = listener;
    }

    // --- One-line commands ---

    public String echo(String text) throws IOException {
        return exec("ECHO " + text);
    }

    public String time() throws IOException {
        return exec("TIME");
    }

    public List<String> list() throws IOException {
        String reply = exec("LIST");
        if (reply.equals(SimpleCommands.NO_FILES)) {
            return List.of();
        }
        return Arrays.asList(reply.split(", "));
    }

    /** Send an arbitrary one-line command and return the single reply line. */
    public String exec(String line) throws IOException {
        transport.sendMessage(line);
        return transport.receiveLine();
    }

    // --- UPLOAD ---

    /**
     * Upload {@code file} under its basename, resuming from whatever prefix the server holds.
     */
    public TransferResult upload(Path file) throws IOException {
        String name = file.getFileName().toString();
        long size = Files.size(file);
        transport.sendMessage("UPLOAD " + name + " " + size);

        String reply = transport.receiveLine();
        if (TransferProtocol.isError(reply)) {
            log.info("Upload of {} refused: {}", name, reply);
            return TransferResult.refused(name, TransferResult.Direction.UPLOAD, reply);
        }
        TransferProtocol.Offset offered = parseOffset(reply);

        long offset = offered.offset();
        boolean restarted = false;
        if (offset <= size && ResumePolicy.localPrefixMatches(file, offered)) {
            transport.sendMessage(TransferProtocol.OK);
        } else {
            transport.sendMessage(TransferProtocol.RESTART);
            expect(TransferProtocol.READY);
            offset = 0;
            restarted = true;
            log.info("Server copy of {} diverges, restarting upload from 0", name);
        }

        TransferProgress progress = new TransferProgress(size, offset);
        long start = System.currentTimeMillis();
        streamFile(file, offset, size - offset, progress);
        expect(TransferProtocol.UPLOAD_COMPLETE);
        long elapsed = System.currentTimeMillis() - start;

        return new TransferResult(name, TransferResult.Direction.UPLOAD, TransferOutcome.COMPLETED,
                size, offset, size - offset, restarted, elapsed, null);
    }

    private void streamFile(Path file, long offset, long count, TransferProgress progress) throws IOException {
        byte[] buf = new byte[TransferProtocol.CHUNK_SIZE];
        long remaining = count;
        try (InputStream in = Files.newInputStream(file)) {
            in.skipNBytes(offset);
            while (remaining > 0) {
                int n = in.readNBytes(buf, 0, (int) Math.min(buf.length, remaining));
                if (n == 0) {
                    throw new IOException(file + " shrank during upload");
                }
                transport.sendRawData(buf, 0, n);
                remaining -= n;
                progress.addBytes(n);
                progressListener.accept(progress);
            }
        }
    }

    // --- DOWNLOAD ---

    /**
     * Download {@code name} into {@code dir}, resuming from the local partial copy if it agrees
     * with the server's.
     */
    public TransferResult download(String name, Path dir) throws IOException {
        Path local = dir.resolve(Path.of(name).getFileName().toString());
        transport.sendMessage("DOWNLOAD " + name);

        String reply = transport.receiveLine();
        if (TransferProtocol.isError(reply)) {
            log.info("Download of {} refused: {}", name, reply);
            return TransferResult.refused(name, TransferResult.Direction.DOWNLOAD, reply);
        }
        long size;
        try {
            size = TransferProtocol.parseSize(reply);
        } catch (ProtocolException e) {
            throw new IOException("unexpected reply to DOWNLOAD: " + reply, e);
        }

        long offset = Files.isRegularFile(local) ? Files.size(local) : 0;
        if (size > 0 && offset == size) {
            transport.sendMessage(TransferProtocol.ABORT);
            return new TransferResult(name, TransferResult.Direction.DOWNLOAD, TransferOutcome.ALREADY_COMPLETE,
                    size, size, 0, false, 0, null);
        }

        boolean restarted = false;
        transport.sendMessage(TransferProtocol.offset(offset, Checksums.prefix(local, offset)));
        String verdict = transport.receiveLine().strip();
        if (verdict.equalsIgnoreCase(TransferProtocol.RESTART)) {
            log.info("Local copy of {} diverges, restarting download from 0", name);
            restarted = true;
            offset = 0;
            Files.deleteIfExists(local);
            transport.sendMessage(TransferProtocol.offset(0, Checksums.EMPTY));
            verdict = transport.receiveLine().strip();
        }
        if (!verdict.equalsIgnoreCase(TransferProtocol.OK)) {
            throw new IOException("unexpected reply to OFFSET: " + verdict);
        }

        TransferProgress progress = new TransferProgress(size, offset);
        long start = System.currentTimeMillis();
        receiveFile(local, size - offset, progress);
        long elapsed = System.currentTimeMillis() - start;

        return new TransferResult(name, TransferResult.Direction.DOWNLOAD, TransferOutcome.COMPLETED,
                size, offset, size - offset, restarted, elapsed, null);
    }

    private void receiveFile(Path local, long count, TransferProgress progress) throws IOException {
        long remaining = count;
        try (FileChannel out = FileChannel.open(local, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                StandardOpenOption.APPEND)) {
            while (remaining > 0) {
                byte[] chunk = transport.receiveAvailable((int) Math.min(TransferProtocol.CHUNK_SIZE, remaining));
                int usable = (int) Math.min(chunk.length, remaining);
                FileStore.writeDurably(out, chunk, 0, usable);
                remaining -= usable;
                progress.addBytes(usable);
                progressListener.accept(progress);
            }
        }
    }

    // --- Session end ---

    /** Send CLOSE, wait for BYE, release the transport. */
    public void quit() throws IOException {
        try {
            transport.sendMessage("CLOSE");
            expect(TransferProtocol.BYE);
        } finally {
            transport.close();
        }
    }

    @Override
    public void close() {
        transport.close();
    }

    public Transport transport() { return transport; }

    private void expect(String expected) throws IOException {
        String line = transport.receiveLine().strip();
        if (TransferProtocol.isError(line)) {
            throw new TransferRefusedException(line);
        }
        if (!line.equalsIgnoreCase(expected)) {
            throw new IOException("expected " + expected + ", got: " + line);
        }
    }

    private static TransferProtocol.Offset parseOffset(String line) throws IOException {
        try {
            return TransferProtocol.parseOffset(line);
        } catch (ProtocolException e) {
            throw new IOException("unexpected reply to UPLOAD: " + line, e);
        }
    }
}
