package com.alterante.filexfer.transfer;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Flat storage directory of transferred files, addressed by basename only.
 *
 * Every name is reduced to its final path component before it touches the filesystem.
 * Uploads only ever append; a file is truncated only on an explicit RESTART.
 */
public class FileStore {

    private final Path root;
    private final UploadLocks uploadLocks = new UploadLocks();

    public FileStore(Path root) {
        this.root = root;
    }

    /** Create the storage directory if needed. */
    public void createRoot() throws StorageException {
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new StorageException("cannot create storage directory " + root, e);
        }
    }

    /**
     * Strip directory components; reject names that do not denote a file.
     */
    public static String sanitize(String name) throws ProtocolException {
        String base = name.replace('\\', '/');
        int slash = base.lastIndexOf('/');
        if (slash >= 0) {
            base = base.substring(slash + 1);
        }
        if (base.isEmpty() || base.equals(".") || base.equals("..")) {
            throw new ProtocolException("invalid filename");
        }
        return base;
    }

    public Path resolve(String name) throws ProtocolException {
        return root.resolve(sanitize(name));
    }

    public boolean exists(String name) throws ProtocolException {
        return Files.isRegularFile(resolve(name));
    }

    /** Stored size, 0 if absent. */
    public long size(String name) throws ProtocolException, StorageException {
        Path file = resolve(name);
        try {
            return Files.isRegularFile(file) ? Files.size(file) : 0;
        } catch (IOException e) {
            throw new StorageException("cannot stat " + file.getFileName(), e);
        }
    }

    public String checksum(String name, long length) throws ProtocolException, StorageException {
        Path file = resolve(name);
        try {
            return Checksums.prefix(file, length);
        } catch (IOException e) {
            throw new StorageException("cannot read " + file.getFileName(), e);
        }
    }

    /** Discard the stored content so an upload can restart at offset 0. */
    public void truncate(String name) throws ProtocolException, StorageException {
        Path file = resolve(name);
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            ch.force(true);
        } catch (IOException e) {
            throw new StorageException("cannot truncate " + file.getFileName(), e);
        }
    }

    /** Open for appending, creating the file if absent. */
    public FileChannel openAppend(String name) throws ProtocolException, StorageException {
        Path file = resolve(name);
        try {
            return FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                    StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new StorageException("cannot open " + file.getFileName() + " for writing", e);
        }
    }

    /** Open for reading, positioned at {@code offset}. */
    public FileChannel openRead(String name, long offset) throws ProtocolException, StorageException {
        Path file = resolve(name);
        try {
            FileChannel ch = FileChannel.open(file, StandardOpenOption.READ);
            ch.position(offset);
            return ch;
        } catch (IOException e) {
            throw new StorageException("cannot open " + file.getFileName() + " for reading", e);
        }
    }

    /** Names of stored files, sorted. */
    public List<String> list() throws StorageException {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(root)) {
            return entries.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new StorageException("cannot list " + root, e);
        }
    }

    /**
     * Append all of {@code data[offset, offset+length)} and force it to stable storage.
     */
    public static void writeDurably(FileChannel ch, byte[] data, int offset, int length) throws StorageException {
        ByteBuffer buf = ByteBuffer.wrap(data, offset, length);
        try {
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(false);
        } catch (IOException e) {
            throw new StorageException("write failed", e);
        }
    }

    public UploadLocks uploadLocks() { return uploadLocks; }
    public Path root() { return root; }
}
