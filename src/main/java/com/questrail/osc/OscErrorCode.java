package com.questrail.osc;

/**
 * Classification of every failure raised or reported by the OSC core.
 *
 * <p>The code travels with {@link OscException} when a failure is thrown, and
 * with {@code OscErrorEvent} when a per-packet failure is reported to an error
 * handler instead.</p>
 */
public enum OscErrorCode
{
    /** Packet structure is invalid (missing terminator, bad element size, unknown tag). */
    MALFORMED_PACKET,

    /** A typed payload could not be read (truncated or inconsistent data). */
    DESERIALIZATION_ERROR,

    /** An in-memory packet could not be written. */
    SERIALIZATION_ERROR,

    /** A value was accessed through the wrong typed accessor. */
    TYPE_MISMATCH,

    /** A caller supplied an argument outside the accepted domain. */
    INVALID_ARGUMENT,

    /** An address pattern has invalid syntax. */
    PATTERN_ERROR,

    /** An OSC path or a network destination is invalid or cannot be resolved. */
    ADDRESS_ERROR,

    /** I/O on an open connection failed. */
    NETWORK_ERROR,

    /** A socket could not be created, configured, bound or connected. */
    SOCKET_ERROR,

    /** The networking subsystem itself is unavailable. */
    NETWORKING_ERROR,

    /** A payload exceeds the configured maximum size. */
    MESSAGE_TOO_LARGE,

    /** The requested feature is not supported on this platform. */
    NOT_IMPLEMENTED,

    /** A registered handler threw while a packet was being dispatched. */
    HANDLER_ERROR
}
