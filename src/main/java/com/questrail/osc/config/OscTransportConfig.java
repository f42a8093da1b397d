package com.questrail.osc.config;

import com.questrail.osc.OscErrorCode;
import com.questrail.osc.OscException;
import com.questrail.osc.transport.OscProtocol;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables shared by {@code OscAddress}, {@code OscServer} and
 * {@code OscServerThread}.
 *
 * <p>{@code timeout} of {@link Duration#ZERO} means "no timeout". For
 * {@link OscProtocol#UNIX} the {@code unixPath} is required and host/port are
 * ignored.</p>
 */
public record OscTransportConfig(
    OscProtocol protocol,
    String host,
    int port,
    String unixPath,
    int maxMessageSize,
    Duration timeout,
    Duration pollInterval,
    boolean noDelay,
    int ttl,
    boolean reuseAddress,
    int maxFrameRetries
) {
    public static final int DEFAULT_MAX_MESSAGE_SIZE = 65536;
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);
    public static final int DEFAULT_TTL = 1;
    public static final int DEFAULT_MAX_FRAME_RETRIES = 3;

    public OscTransportConfig {
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(pollInterval, "pollInterval");
        if (port < 0 || port > 65535) {
            throw invalid("port must be in range 0-65535 (was " + port + ")");
        }
        if (protocol == OscProtocol.UNIX && (unixPath == null || unixPath.isEmpty())) {
            throw invalid("unixPath is required for " + protocol);
        }
        if (maxMessageSize <= 0) {
            throw invalid("maxMessageSize must be > 0 (was " + maxMessageSize + ")");
        }
        if (timeout.isNegative()) {
            throw invalid("timeout must not be negative");
        }
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw invalid("pollInterval must be > 0");
        }
        if (ttl < 1 || ttl > 255) {
            throw invalid("ttl must be in range 1-255 (was " + ttl + ")");
        }
        if (maxFrameRetries < 0) {
            throw invalid("maxFrameRetries must be >= 0 (was " + maxFrameRetries + ")");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .withProtocol(protocol)
                .withHost(host)
                .withPort(port)
                .withUnixPath(unixPath)
                .withMaxMessageSize(maxMessageSize)
                .withTimeout(timeout)
                .withPollInterval(pollInterval)
                .withNoDelay(noDelay)
                .withTtl(ttl)
                .withReuseAddress(reuseAddress)
                .withMaxFrameRetries(maxFrameRetries);
    }

    public boolean hasTimeout() {
        return !timeout.isZero();
    }

    private static OscException invalid(String message) {
        return new OscException(OscErrorCode.INVALID_ARGUMENT, message);
    }

    public static final class Builder {
        private OscProtocol protocol = OscProtocol.UDP;
        private String host = "localhost";
        private int port;
        private String unixPath;
        private int maxMessageSize = DEFAULT_MAX_MESSAGE_SIZE;
        private Duration timeout = Duration.ZERO;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private boolean noDelay = true;
        private int ttl = DEFAULT_TTL;
        private boolean reuseAddress = true;
        private int maxFrameRetries = DEFAULT_MAX_FRAME_RETRIES;

        public Builder withProtocol(OscProtocol protocol) {
            this.protocol = protocol;
            return this;
        }

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withUnixPath(String unixPath) {
            this.unixPath = unixPath;
            return this;
        }

        public Builder withMaxMessageSize(int maxMessageSize) {
            this.maxMessageSize = maxMessageSize;
            return this;
        }

        public Builder withTimeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder withPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder withNoDelay(boolean noDelay) {
            this.noDelay = noDelay;
            return this;
        }

        public Builder withTtl(int ttl) {
            this.ttl = ttl;
            return this;
        }

        public Builder withReuseAddress(boolean reuseAddress) {
            this.reuseAddress = reuseAddress;
            return this;
        }

        public Builder withMaxFrameRetries(int maxFrameRetries) {
            this.maxFrameRetries = maxFrameRetries;
            return this;
        }

        public OscTransportConfig build() {
            return new OscTransportConfig(protocol, host, port, unixPath, maxMessageSize,
                    timeout, pollInterval, noDelay, ttl, reuseAddress, maxFrameRetries);
        }
    }
}
