/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Equivalent to OutputStream except that it has to be committed in order to be
 * made visible under its final name. Bytes go to a sibling file named {@code <name>+}; if the stream is
 * closed before the commit, that file is deleted and nothing appears under the final name.
 */
public final class CommitableFile extends OutputStream {
    private static final Logger logger = LoggerFactory.getLogger(CommitableFile.class);
    private final Path newVersion;
    private final Path target;
    private final boolean commitOnClose;
    private final OutputStream out;
    private long bytesWritten;
    private boolean closed;

    private CommitableFile(Path n, Path t, boolean commitOnClose) throws IOException {
        super();
        newVersion = n;
        target = t;
        this.commitOnClose = commitOnClose;
        out = Files.newOutputStream(n, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING);
    }

    /**
     * Abandon on close is the usual choice: it interacts well with the implicit close() of a
     * try-with-resources block that is left through an exception.
     *
     * @param t Path to write to
     * @return an open CommitableFile
     * @throws IOException if the temporary file cannot be created
     */
    public static CommitableFile abandonOnClose(Path t) throws IOException {
        return of(t, false);
    }

    public static CommitableFile commitOnClose(Path t) throws IOException {
        return of(t, true);
    }

    /**
     * Get a CommitableFile for the given path.
     *
     * @param path          final path of the file.
     * @param commitOnClose true if the file should be automatically committed when closed.
     * @return CommitableFile.
     * @throws IOException if unable to create/delete the files.
     */
    public static CommitableFile of(Path path, boolean commitOnClose) throws IOException {
        Path n = getNewFile(path);
        Files.deleteIfExists(n);
        return new CommitableFile(n, path, commitOnClose);
    }

    public static Path getNewFile(Path path) {
        return path.resolveSibling(path.getFileName() + "+");
    }

    public Path getTarget() {
        return target;
    }

    public long getBytesWritten() {
        return bytesWritten;
    }

    @Override
    public void close() throws IOException {
        if (!closed) {
            if (commitOnClose) {
                commit();
            } else {
                abandon();
            }
        }
    }

    /**
     * Close and discard the new file. Whatever is under the final name remains untouched.
     */
    public void abandon() {
        if (!closed) {
            closed = true;
            try {
                out.close();
            } catch (IOException e) {
                logger.atDebug().addKeyValue("file", newVersion).setCause(e).log("Error closing abandoned file");
            }
            try {
                Files.deleteIfExists(newVersion);
            } catch (IOException e) {
                logger.atWarn().addKeyValue("file", newVersion).setCause(e).log("Unable to delete abandoned file");
            }
        }
    }

    /**
     * Close the file and move it to its final name, replacing whatever was there.
     *
     * @throws IOException if the data cannot be flushed or the rename fails; the new file is deleted in that case
     */
    public void commit() throws IOException {
        if (closed) {
            return;
        }
        try {
            out.flush();
            out.close();
            move(newVersion, target);
            closed = true;
        } catch (IOException e) {
            abandon();
            throw e;
        }
    }

    @Override
    public void write(byte[] b) throws IOException {
        write(b, 0, b.length);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        out.write(b, off, len);
        bytesWritten += len;
    }

    @Override
    public void write(int b) throws IOException {
        out.write(b);
        bytesWritten++;
    }

    @Override
    public void flush() throws IOException {
        out.flush();
    }

    public static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
