/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zeroturnaround.process.Processes;
import org.zeroturnaround.process.SystemProcess;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import javax.annotation.Nullable;

/**
 * Vaguely like ProcessBuilder, but more flexible and lambda-friendly.
 * <pre>
 * // copy a file out of HDFS and get told when the client exits
 * new Exec().withExec("hadoop", "fs", "-copyToLocal", src, dst)
 * .withErr(err::append)
 * .execAsync(executor)
 * .thenAccept(exit -&gt; System.out.println("exit " + exit));
 * </pre>
 */
public class Exec implements Closeable {
    private static final char PATH_SEP = File.pathSeparatorChar;
    public static final String PATH_ENVVAR = "PATH";
    private static final Logger staticLogger = LoggerFactory.getLogger(Exec.class);
    private static final Consumer<CharSequence> NOP = s -> {
    };

    protected static final List<Path> paths = Collections.synchronizedList(new ArrayList<>());

    static {
        addPathEntries(System.getenv(PATH_ENVVAR));
        // Ensure some level of sanity in the PATH
        for (String fn : new String[]{"/bin", "/usr/bin", "/usr/local/bin"}) {
            Path p = Paths.get(fn);
            if (Files.isDirectory(p) && !paths.contains(p)) {
                paths.add(p);
            }
        }
    }

    protected Logger logger = staticLogger;
    protected final AtomicBoolean isClosed = new AtomicBoolean(false);
    protected Process process;
    protected String[] cmds;
    protected Duration gracefulShutdownTimeout = Duration.ofSeconds(5);
    private Consumer<CharSequence> stdout = NOP;
    private Consumer<CharSequence> stderr = NOP;
    private long timeout = -1;
    private TimeUnit timeunit = TimeUnit.SECONDS;
    private Copier stderrc;
    private Copier stdoutc;

    public Exec logger(Logger logger) {
        this.logger = logger;
        return this;
    }

    /**
     * Find the path of a given command.
     *
     * @param fn command to lookup.
     * @return the Path of the command, or null if not found.
     */
    @Nullable
    public static Path which(String fn) {
        fn = Utils.deTilde(fn);
        if (fn.indexOf(File.separatorChar) >= 0) {
            Path f = Paths.get(fn);
            return Files.isExecutable(f) ? f : null;
        }
        synchronized (paths) {
            for (Path d : paths) {
                Path f = d.resolve(fn);
                if (Files.isExecutable(f)) {
                    return f;
                }
            }
        }
        return null;
    }

    protected static void addPathEntries(String path) {
        if (path != null && path.length() > 0) {
            for (String f : path.split("[" + PATH_SEP + ",] *")) {
                if (f.isEmpty()) {
                    continue;
                }
                Path p = Paths.get(Utils.deTilde(f));
                if (!paths.contains(p)) {
                    paths.add(p);
                }
            }
        }
    }

    /**
     * Set the command to execute.
     * @param c a command.
     * @return this.
     */
    public Exec withExec(String... c) {
        cmds = c;
        return this;
    }

    /**
     * Set the command to run with a given timeout. Applies to {@link #exec()} only.
     *
     * @param t timeout.
     * @param u units.
     * @return this.
     */
    public Exec withTimeout(long t, TimeUnit u) {
        timeout = t;
        timeunit = u;
        return this;
    }

    public Exec withOut(Consumer<CharSequence> o) {
        stdout = o;
        return this;
    }

    public Exec withErr(Consumer<CharSequence> o) {
        stderr = o;
        return this;
    }

    /**
     * Execute a command and wait for it.
     *
     * @return the process exit code, empty if the process had to be stopped because it ran past its timeout.
     * @throws InterruptedException if the command is interrupted while running.
     * @throws IOException if an error occurs while executing.
     */
    public Optional<Integer> exec() throws InterruptedException, IOException {
        // Don't run anything if the current thread is currently interrupted
        if (Thread.currentThread().isInterrupted()) {
            logger.atWarn().addKeyValue("command", this).log("Refusing to execute because the active thread is "
                    + "interrupted");
            throw new InterruptedException();
        }
        start();
        try {
            if (timeout < 0) {
                process.waitFor();
            } else if (!process.waitFor(timeout, timeunit)) {
                stderr.accept("\n[TIMEOUT]\n");
                close();
                return Optional.empty();
            }
        } catch (InterruptedException ie) {
            // Give the process a touch more time to exit cleanly
            if (!process.waitFor(5, TimeUnit.SECONDS)) {
                stderr.accept("\n[TIMEOUT after InterruptedException]\n");
                process.destroyForcibly();
            }
            throw ie;
        }
        stderrc.join(5000);
        stdoutc.join(5000);
        return Optional.of(process.exitValue());
    }

    /**
     * Start the command and return without waiting for it. The returned future completes with the exit code
     * once the process has exited and its output has been drained; no thread is parked while the process runs.
     *
     * @param executor executor that runs the completion work
     * @return future exit code
     * @throws IOException if the process cannot be started
     */
    public CompletableFuture<Integer> execAsync(Executor executor) throws IOException {
        start();
        return process.onExit().thenApplyAsync(p -> {
            try {
                stderrc.join(5000);
                stdoutc.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return p.exitValue();
        }, executor);
    }

    private void start() throws IOException {
        if (cmds == null || cmds.length == 0) {
            throw new IOException("No command to execute");
        }
        ProcessBuilder pb = new ProcessBuilder();
        process = pb.command(cmds).start();
        logger.atDebug().addKeyValue("command", this).addKeyValue("pid", process.pid()).log("Created process");

        stderrc = new Copier(process.getErrorStream(), stderr);
        stdoutc = new Copier(process.getInputStream(), stdout);
        stderrc.start();
        stdoutc.start();
    }

    /**
     * Stop the process if it is still running: politely first, forcibly once the graceful shutdown timeout expired.
     *
     * @throws IOException if the process could not be stopped
     */
    @Override
    public void close() throws IOException {
        if (!isClosed.compareAndSet(false, true)) {
            return;
        }
        Process p = process;
        if (p == null || !p.isAlive()) {
            return;
        }
        SystemProcess pp = Processes.newJavaProcess(p);
        try {
            pp.destroyGracefully();
            if (!pp.waitFor(gracefulShutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.atWarn().addKeyValue("command", this)
                        .log("Command did not respond to interruption within timeout. Going to kill it now");
                pp.destroyForcefully();
            }
            if (!p.waitFor(5, TimeUnit.SECONDS)) {
                throw new IOException("Could not stop " + this);
            }
        } catch (InterruptedException e) {
            // If we're interrupted make sure to kill the process before returning
            p.destroyForcibly();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public String toString() {
        return cmds == null ? "[]" : String.join(" ", cmds);
    }

    /**
     * Sends the lines of an InputStream to a consumer in the background.
     */
    private static class Copier extends Thread {
        private final Consumer<CharSequence> out;
        private final InputStream in;

        Copier(InputStream i, Consumer<CharSequence> s) {
            super("Copier");
            in = i;
            out = s;
            // Set as a daemon thread so that it dies when the main thread exits
            setDaemon(true);
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8), 200)) {
                StringBuilder sb = new StringBuilder();
                boolean cr = false;
                while (true) {
                    int c;
                    for (c = br.read(); c >= 0 && c != '\n' && c != '\r'; c = br.read()) {
                        sb.append((char) c);
                        cr = false;
                    }

                    // Append a newline to our builder if we get \n or if we are seeing \r for the first time.
                    // This prevents \r\n from causing 2 lines to be logged.
                    if (c >= 0 && !cr || c == '\r') {
                        if (c == '\r') {
                            cr = true;
                        }
                        sb.append('\n');
                    }
                    if (out != null && sb.length() > 0) {
                        out.accept(sb);
                    }
                    sb.setLength(0);
                    if (c < 0) {
                        break;
                    }
                }
            } catch (IOException e) {
                // the stream closes under us when the process is destroyed
                staticLogger.atTrace().setCause(e).log("Output copier stopped");
            }
        }
    }
}
