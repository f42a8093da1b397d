package com.questrail.osc.transport;

import com.questrail.osc.OscErrorCode;
import com.questrail.osc.OscException;

import java.util.Objects;

/**
 * Parsed OSC transport URL.
 *
 * <pre>
 *   osc.udp://host:port/
 *   osc.tcp://host:port/
 *   osc.unix:///path/to/socket/
 * </pre>
 *
 * <p>IPv6 literals are written in brackets ({@code osc.udp://[::1]:9000/}).
 * For {@link OscProtocol#UNIX}, {@code host} is empty, {@code port} is 0 and
 * {@code path} holds the socket path; for the other protocols {@code path} is
 * null.</p>
 */
public record OscUrl(OscProtocol protocol, String host, int port, String path)
{
    private static final String SEPARATOR = "://";

    public OscUrl {
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(host, "host");
        if (protocol == OscProtocol.UNIX) {
            if (path == null || path.isEmpty()) {
                throw new OscException(OscErrorCode.ADDRESS_ERROR, "Unix OSC URL requires a path");
            }
        } else if (port < 0 || port > 65535) {
            throw new OscException(OscErrorCode.ADDRESS_ERROR, "Port out of range: " + port);
        }
    }

    public static OscUrl of(OscProtocol protocol, String host, int port) {
        return new OscUrl(protocol, host, port, null);
    }

    public static OscUrl unix(String path) {
        return new OscUrl(OscProtocol.UNIX, "", 0, path);
    }

    /**
     * Parses the textual form produced by {@link #toString()}.
     *
     * @throws OscException {@link OscErrorCode#ADDRESS_ERROR} if the text is not an OSC URL
     */
    public static OscUrl parse(String url) {
        Objects.requireNonNull(url, "url");
        int sep = url.indexOf(SEPARATOR);
        if (sep < 0) {
            throw invalid(url, "missing '://'");
        }
        OscProtocol protocol = OscProtocol.fromScheme(url.substring(0, sep));
        String rest = url.substring(sep + SEPARATOR.length());
        if (rest.endsWith("/")) {
            rest = rest.substring(0, rest.length() - 1);
        }

        if (protocol == OscProtocol.UNIX) {
            if (rest.isEmpty()) {
                throw invalid(url, "missing socket path");
            }
            return unix(rest);
        }

        String host;
        String portText;
        if (rest.startsWith("[")) {
            int close = rest.indexOf(']');
            if (close < 0 || close + 1 >= rest.length() || rest.charAt(close + 1) != ':') {
                throw invalid(url, "malformed IPv6 host");
            }
            host = rest.substring(1, close);
            portText = rest.substring(close + 2);
        } else {
            int colon = rest.lastIndexOf(':');
            if (colon < 0) {
                throw invalid(url, "missing port");
            }
            host = rest.substring(0, colon);
            portText = rest.substring(colon + 1);
        }
        if (host.isEmpty()) {
            throw invalid(url, "missing host");
        }

        int port;
        try {
            port = Integer.parseInt(portText);
        } catch (NumberFormatException e) {
            throw new OscException(OscErrorCode.ADDRESS_ERROR,
                    "Invalid OSC URL '" + url + "': bad port '" + portText + "'", e);
        }
        return new OscUrl(protocol, host, port, null);
    }

    @Override
    public String toString() {
        if (protocol == OscProtocol.UNIX) {
            return protocol.scheme() + SEPARATOR + path + "/";
        }
        String h = host.indexOf(':') >= 0 ? "[" + host + "]" : host;
        return protocol.scheme() + SEPARATOR + h + ":" + port + "/";
    }

    private static OscException invalid(String url, String detail) {
        return new OscException(OscErrorCode.ADDRESS_ERROR, "Invalid OSC URL '" + url + "': " + detail);
    }
}
