package io.stagedconf.storage.atomic;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.UUID;

/**
 * Writes a file through a uniquely named sibling temp file.
 * <p>
 * Nothing is visible at {@link #getTarget()} until {@link #commit()} renames the temp file
 * into place. Closing an uncommitted writer deletes its temp file, so concurrent writers of
 * the same target never see or damage each other's data.
 */
@Slf4j
public final class AtomicFile implements AutoCloseable {
    private static final String TMP_SUFFIX = ".tmp";

    @Getter
    private final Path target;
    @Getter
    private final Path tempFile;
    private final FileChannel channel;
    private boolean committed;
    private boolean closed;

    public AtomicFile(final Path target) throws IOException {
        this.target = target;
        this.tempFile = target.resolveSibling(target.getFileName().toString() + "." + UUID.randomUUID() + TMP_SUFFIX);
        this.channel = FileChannel.open(tempFile,
                StandardOpenOption.CREATE_NEW,
                StandardOpenOption.WRITE);
    }

    public AtomicFile write(final String text) throws IOException {
        ensureOpen();
        final ByteBuffer buf = ByteBuffer.wrap(text.getBytes(StandardCharsets.UTF_8));
        while (buf.hasRemaining()) {
            channel.write(buf);
        }
        return this;
    }

    /**
     * Forces written bytes to the device so write errors surface before anything depends on them.
     */
    public void flush() throws IOException {
        ensureOpen();
        channel.force(true);
    }

    /**
     * Flushes and atomically moves the temp file over the target.
     */
    public void commit() throws IOException {
        ensureOpen();
        channel.force(true);
        channel.close();
        Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        committed = true;
    }

    public boolean isCommitted() {
        return committed;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;

        if (committed) return;

        try {
            channel.close();
        } catch (final IOException e) {
            log.debug("Failed to close temp file {}: {}", tempFile, e.toString());
        }

        try {
            Files.deleteIfExists(tempFile);
        } catch (final IOException e) {
            log.warn("Failed to discard uncommitted temp file {}", tempFile, e);
        }
    }

    private void ensureOpen() throws IOException {
        if (committed || closed) {
            throw new IOException("Atomic file for " + target + " is no longer writable");
        }
    }
}
