package com.questrail.osc;

import java.util.Objects;

/**
 * Unchecked exception raised by every layer of the OSC core.
 *
 * <p>Each instance carries an {@link OscErrorCode} so that callers (and the
 * server's error reporting) can react to the kind of failure without parsing
 * messages:</p>
 * <ul>
 *   <li>codec failures: {@link OscErrorCode#MALFORMED_PACKET},
 *       {@link OscErrorCode#DESERIALIZATION_ERROR}</li>
 *   <li>accessor misuse: {@link OscErrorCode#TYPE_MISMATCH}</li>
 *   <li>setup failures: {@link OscErrorCode#SOCKET_ERROR},
 *       {@link OscErrorCode#ADDRESS_ERROR}, {@link OscErrorCode#PATTERN_ERROR}</li>
 * </ul>
 */
public final class OscException extends RuntimeException
{
    private final OscErrorCode code;

    public OscException(OscErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public OscException(OscErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public OscErrorCode code() {
        return code;
    }

    /**
     * Returns a copy of this exception whose message is prefixed with
     * {@code context}, keeping the code and the original as cause.
     */
    public OscException withContext(String context) {
        return new OscException(code, context + ": " + getMessage(), this);
    }

    @Override
    public String toString() {
        return "OscException[" + code + "]: " + getMessage();
    }
}
