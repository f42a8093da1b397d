package com.questrail.osc.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * OscServerThread
 * -----------------------------------------------------------------------------
 * Runs {@link OscServer#receive(Duration)} in a loop on a dedicated daemon thread.
 *
 * <p>Handlers registered on the server run on this thread. {@link #stop()}
 * clears the running flag, wakes the server out of its readiness wait and
 * joins the thread. It must not be called from a handler, since the thread
 * would then wait for itself; that case is rejected with
 * {@link IllegalStateException}.</p>
 *
 * <p>Stopping the loop does not close the server.</p>
 */
public final class OscServerThread implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(OscServerThread.class);

    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    private final OscServer server;
    private final Duration pollInterval;
    private final AtomicBoolean running = new AtomicBoolean();
    private volatile Thread thread;

    public OscServerThread(OscServer server) {
        this(server, server.config().pollInterval());
    }

    public OscServerThread(OscServer server, Duration pollInterval) {
        this.server = Objects.requireNonNull(server, "server");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    }

    /**
     * Starts the receive loop. Has no effect if it is already running.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        Thread t = new Thread(this::runLoop, "osc-server-" + SEQUENCE.incrementAndGet());
        t.setDaemon(true);
        thread = t;
        t.start();
        log.info("Started receive loop for {} on {}", server.url(), t.getName());
    }

    /**
     * Stops the receive loop and waits for the thread to finish.
     *
     * @throws IllegalStateException if called from the receive thread
     */
    public void stop() {
        Thread t = thread;
        if (t == Thread.currentThread()) {
            throw new IllegalStateException("stop() called from the OSC server thread itself");
        }
        if (!running.compareAndSet(true, false)) {
            return;
        }
        server.wakeup();
        if (t != null) {
            try {
                t.join();
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for {} to stop", t.getName());
            }
        }
        thread = null;
        log.info("Stopped receive loop for {}", server.url());
    }

    public boolean isRunning() {
        return running.get();
    }

    public OscServer server() {
        return server;
    }

    @Override
    public void close() {
        stop();
    }

    private void runLoop() {
        try {
            while (running.get()) {
                if (server.isClosed()) {
                    log.debug("Server {} closed; leaving receive loop", server.url());
                    break;
                }
                try {
                    server.receive(pollInterval);
                }
                catch (RuntimeException e) {
                    log.error("Unexpected failure in receive loop for {}", server.url(), e);
                }
            }
        }
        catch (Error e) {
            log.error("Receive loop for {} terminated", server.url(), e);
            throw e;
        }
        finally {
            running.set(false);
        }
    }
}
