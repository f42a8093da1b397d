package com.questrail.osc.dispatch;

import com.questrail.osc.OscErrorCode;
import com.questrail.osc.OscException;
import com.questrail.osc.internal.time.SystemWallClock;
import com.questrail.osc.internal.time.WallClock;
import com.questrail.osc.model.OscBundle;
import com.questrail.osc.model.OscMessage;
import com.questrail.osc.model.OscPacket;
import com.questrail.osc.observability.OscErrorEvent;
import com.questrail.osc.observability.OscErrorHandler;
import com.questrail.osc.observability.Slf4jOscErrorHandler;
import com.questrail.osc.pattern.OscAddressPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * OscDispatcher
 * -----------------------------------------------------------------------------
 * Registry of (address pattern, type signature, handler) entries and the
 * routing of decoded packets to them.
 *
 * <h2>Matching</h2>
 * <p>A message is delivered to every non-default method whose pattern matches
 * its address and whose type signature is a prefix of its type tags, in
 * registration order. When no method matched, only the first registered
 * default method is invoked.</p>
 *
 * <h2>Bundles</h2>
 * <p>A bundle runs the start hook, then its elements in order (nested bundles
 * recursively, with their own hooks), then the end hook. Time tags are
 * carried to the hooks but not scheduled.</p>
 *
 * <h2>Failure isolation</h2>
 * <p>Each handler and hook call is guarded independently. A failure becomes a
 * {@link OscErrorCode#HANDLER_ERROR} event for the error handler and dispatch
 * continues with the next handler.</p>
 *
 * <h2>Threading</h2>
 * <p>Registration may race with dispatch from another thread. The registry is
 * guarded by a lock that is held only to take a snapshot; handlers run outside
 * it, so a handler may itself add or remove methods.</p>
 */
public final class OscDispatcher
{
    private static final Logger log = LoggerFactory.getLogger(OscDispatcher.class);

    static final String COMPONENT_MESSAGE = "OscDispatcher.dispatchMessage";
    static final String COMPONENT_BUNDLE = "OscDispatcher.dispatchBundle";

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<OscMethodId, OscMethod> methods = new LinkedHashMap<>();
    private final WallClock clock;
    private long nextId = 1;

    private OscBundleHandler bundleStart;
    private OscBundleHandler bundleEnd;
    private volatile OscErrorHandler errorHandler;

    public OscDispatcher() {
        this(Slf4jOscErrorHandler.INSTANCE, SystemWallClock.INSTANCE);
    }

    public OscDispatcher(OscErrorHandler errorHandler, WallClock clock) {
        this.errorHandler = Objects.requireNonNull(errorHandler, "errorHandler");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // -------------------------------------------------------------------------
    // Registration
    // -------------------------------------------------------------------------

    /**
     * Registers a handler for messages matching {@code pattern} whose type tags
     * start with {@code typeSignature} ({@code null} or empty accepts any).
     *
     * @throws OscException {@link OscErrorCode#PATTERN_ERROR} for invalid pattern
     *         syntax, {@link OscErrorCode#INVALID_ARGUMENT} for a null pattern or handler
     */
    public OscMethodId addMethod(String pattern, String typeSignature, OscMethodHandler handler) {
        if (pattern == null) {
            throw new OscException(OscErrorCode.INVALID_ARGUMENT, "pattern must not be null");
        }
        requireHandler(handler);
        OscAddressPattern compiled = OscAddressPattern.compile(pattern);
        String signature = typeSignature == null ? "" : typeSignature;

        lock.lock();
        try {
            OscMethodId id = new OscMethodId(nextId++);
            methods.put(id, OscMethod.of(id, compiled, signature, handler));
            log.debug("Registered {} for '{}' ,{}", id, pattern, signature);
            return id;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Registers a handler invoked for messages no other method matched. Only
     * the first registered default method is ever invoked.
     */
    public OscMethodId addDefaultMethod(OscMethodHandler handler) {
        requireHandler(handler);
        lock.lock();
        try {
            OscMethodId id = new OscMethodId(nextId++);
            methods.put(id, OscMethod.ofDefault(id, handler));
            log.debug("Registered default method {}", id);
            return id;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true if the method was registered and has been removed
     */
    public boolean removeMethod(OscMethodId id) {
        Objects.requireNonNull(id, "id");
        lock.lock();
        try {
            return methods.remove(id) != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sets the bundle start and end hooks; either may be null.
     */
    public void setBundleHandlers(OscBundleHandler start, OscBundleHandler end) {
        lock.lock();
        try {
            this.bundleStart = start;
            this.bundleEnd = end;
        } finally {
            lock.unlock();
        }
    }

    public void setErrorHandler(OscErrorHandler errorHandler) {
        this.errorHandler = Objects.requireNonNull(errorHandler, "errorHandler");
    }

    public OscErrorHandler errorHandler() {
        return errorHandler;
    }

    /**
     * Snapshot of the registry in registration order.
     */
    public List<OscMethod> methods() {
        lock.lock();
        try {
            return List.copyOf(methods.values());
        } finally {
            lock.unlock();
        }
    }

    // -------------------------------------------------------------------------
    // Dispatch
    // -------------------------------------------------------------------------

    public int dispatch(OscPacket packet) {
        Objects.requireNonNull(packet, "packet");
        if (packet instanceof OscBundle b) {
            return dispatchBundle(b);
        }
        return dispatchMessage((OscMessage) packet);
    }

    /**
     * @return the number of handlers invoked (0 or 1 when only default methods apply)
     */
    public int dispatchMessage(OscMessage message) {
        Objects.requireNonNull(message, "message");
        String path = message.path();
        String tags = message.typeTags();

        List<OscMethod> matched = new ArrayList<>();
        OscMethod fallback = null;
        for (OscMethod m : methods()) {
            if (m.isDefault()) {
                if (fallback == null) {
                    fallback = m;
                }
            }
            else if (m.matches(path, tags)) {
                matched.add(m);
            }
        }

        if (matched.isEmpty()) {
            if (fallback == null) {
                log.debug("No method for {} ,{}", path, tags);
                return 0;
            }
            matched.add(fallback);
        }

        for (OscMethod m : matched) {
            try {
                m.handler().handle(message);
            }
            catch (RuntimeException e) {
                String target = m.isDefault() ? "default method" : "'" + m.pathPattern() + "'";
                reportError(OscErrorCode.HANDLER_ERROR,
                        "Handler " + target + " failed on " + path + ": " + e.getMessage(),
                        COMPONENT_MESSAGE, e);
            }
        }
        return matched.size();
    }

    /**
     * @return the number of message handlers invoked across all nested elements
     */
    public int dispatchBundle(OscBundle bundle) {
        Objects.requireNonNull(bundle, "bundle");
        OscBundleHandler start;
        OscBundleHandler end;
        lock.lock();
        try {
            start = bundleStart;
            end = bundleEnd;
        } finally {
            lock.unlock();
        }

        runHook(start, bundle, "start");
        int invoked = 0;
        for (OscPacket element : bundle.elements()) {
            invoked += dispatch(element);
        }
        runHook(end, bundle, "end");
        return invoked;
    }

    private void runHook(OscBundleHandler hook, OscBundle bundle, String which) {
        if (hook == null) {
            return;
        }
        try {
            hook.onBundle(bundle);
        }
        catch (RuntimeException e) {
            reportError(OscErrorCode.HANDLER_ERROR,
                    "Bundle " + which + " handler failed: " + e.getMessage(),
                    COMPONENT_BUNDLE, e);
        }
    }

    /**
     * Delivers a failure to the current error handler. A handler that throws
     * is logged and otherwise ignored.
     */
    public void reportError(OscErrorCode code, String message, String component, Throwable cause) {
        OscErrorEvent event = new OscErrorEvent(clock.now(), code, message, component, cause);
        try {
            errorHandler.onError(event);
        }
        catch (RuntimeException e) {
            log.error("Error handler threw while reporting {}", event, e);
        }
    }

    private static void requireHandler(OscMethodHandler handler) {
        if (handler == null) {
            throw new OscException(OscErrorCode.INVALID_ARGUMENT, "handler must not be null");
        }
    }
}
