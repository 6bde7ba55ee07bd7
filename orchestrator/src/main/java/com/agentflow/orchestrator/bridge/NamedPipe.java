package com.agentflow.orchestrator.bridge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * A POSIX named pipe (FIFO) used as the agent's input channel.
 *
 * Opening a FIFO for writing blocks until some process opens it for reading.
 * The open therefore runs on a helper thread and is polled; if the caller
 * stops waiting (agent exited, run cancelled) the blocked open is released
 * by briefly opening the read end ourselves.
 */
public class NamedPipe implements InputChannel {

    private static final Logger log = LoggerFactory.getLogger(NamedPipe.class);

    private static final ExecutorService OPENERS = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "fifo-open");
        t.setDaemon(true);
        return t;
    });

    private final Path     path;
    private final Duration poll;

    public NamedPipe(Path path, Duration poll) {
        this.path = path;
        this.poll = poll;
    }

    public Path path() {
        return path;
    }

    /** Create the FIFO with {@code mkfifo} unless something already exists at the path. */
    public void ensureExists() throws IOException {
        if (Files.exists(path)) {
            return;
        }
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Process mkfifo = new ProcessBuilder("mkfifo", path.toString())
                .redirectErrorStream(true)
                .start();
        try {
            if (!mkfifo.waitFor(10, TimeUnit.SECONDS)) {
                mkfifo.destroyForcibly();
                throw new IOException("mkfifo timed out for " + path);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while creating " + path);
        }
        if (mkfifo.exitValue() != 0) {
            String out = new String(mkfifo.getInputStream().readAllBytes());
            throw new IOException("mkfifo failed for " + path + " (exit " + mkfifo.exitValue() + "): " + out.trim());
        }
        log.debug("Created named pipe {}", path);
    }

    @Override
    public OutputStream open(BooleanSupplier keepWaiting) throws IOException {
        CompletableFuture<FileOutputStream> opening = CompletableFuture.supplyAsync(() -> {
            try {
                return new FileOutputStream(path.toFile());
            } catch (FileNotFoundException e) {
                throw new UncheckedIOException(e);
            }
        }, OPENERS);

        while (true) {
            try {
                return opening.get(poll.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                if (!keepWaiting.getAsBoolean()) {
                    abandon(opening);
                    throw new IOException("No reader opened " + path);
                }
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() instanceof UncheckedIOException u ? u.getCause() : e.getCause();
                throw cause instanceof IOException io ? io : new IOException("Failed to open " + path, cause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abandon(opening);
                throw new InterruptedIOException("Interrupted while opening " + path);
            }
        }
    }

    @Override
    public String describe() {
        return "fifo:" + path;
    }

    /**
     * Release a writer blocked in open() by opening the read end, then close
     * whatever the writer ends up with.
     */
    private void abandon(CompletableFuture<FileOutputStream> opening) {
        opening.whenComplete((out, error) -> {
            if (out != null) {
                try {
                    out.close();
                } catch (IOException e) {
                    log.debug("Closing abandoned writer for {} failed: {}", path, e.getMessage());
                }
            }
        });
        if (!opening.isDone()) {
            try (InputStream ignored = new FileInputStream(path.toFile())) {
                log.debug("Released blocked writer on {}", path);
            } catch (IOException e) {
                log.warn("Could not release blocked writer on {}: {}", path, e.getMessage());
            }
        }
    }
}
