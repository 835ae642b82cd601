package com.questrail.plcsim.protocol.telegram.connection;

/**
 * HostPortValidator
 * -----------------------------------------------------------------------------
 * Pre-flight checks on a connect target. No name resolution happens here; an
 * unresolvable host surfaces later as a connect failure.
 */
public final class HostPortValidator
{
    public static final int MIN_PORT = 1;
    public static final int MAX_PORT = 65_535;

    private HostPortValidator()
    {
    }

    /**
     * @return the host with surrounding whitespace removed
     */
    public static String validate(String host, int port) throws InvalidEndpointException
    {
        if (host == null || host.isBlank()) {
            throw new InvalidEndpointException("Host must not be empty");
        }
        if (port < MIN_PORT || port > MAX_PORT) {
            throw new InvalidEndpointException(
                    "Port must be between " + MIN_PORT + " and " + MAX_PORT + ", got " + port);
        }
        return host.strip();
    }

    /** Parses operator-entered port text. */
    public static int parsePort(String text) throws InvalidEndpointException
    {
        if (text == null || text.isBlank()) {
            throw new InvalidEndpointException("Port must not be empty");
        }
        final int port;
        try {
            port = Integer.parseInt(text.strip());
        } catch (NumberFormatException e) {
            throw new InvalidEndpointException("Port must be a number, got '" + text.strip() + "'");
        }
        if (port < MIN_PORT || port > MAX_PORT) {
            throw new InvalidEndpointException(
                    "Port must be between " + MIN_PORT + " and " + MAX_PORT + ", got " + port);
        }
        return port;
    }
}
