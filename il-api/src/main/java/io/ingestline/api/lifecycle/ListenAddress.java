package io.ingestline.api.lifecycle;

/**
 * A {@code host:port} listen address. An empty host means every interface.
 * Accepted forms: {@code :8080}, {@code 0.0.0.0:8080}, {@code localhost:0},
 * {@code [::1]:8080}.
 */
public record ListenAddress(String host, int port) {
    public static final String DEFAULT = ":8080";

    public ListenAddress {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port out of range: " + port);
        }
        if (host != null && host.isBlank()) host = null;
    }

    public static ListenAddress parse(String value) {
        if (value == null || value.isBlank()) value = DEFAULT;
        String s = value.trim();

        int colon = s.lastIndexOf(':');
        if (colon < 0) {
            throw new IllegalArgumentException("Missing port in listen address: " + value);
        }
        String host = s.substring(0, colon);
        String port = s.substring(colon + 1);

        if (host.startsWith("[")) {
            if (!host.endsWith("]")) {
                throw new IllegalArgumentException("Unterminated IPv6 host in listen address: " + value);
            }
            host = host.substring(1, host.length() - 1);
        } else if (host.indexOf(':') >= 0) {
            throw new IllegalArgumentException("IPv6 hosts must be bracketed: " + value);
        }

        try {
            return new ListenAddress(host, Integer.parseInt(port));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in listen address: " + value, e);
        }
    }

    public boolean allInterfaces() {
        return host == null;
    }
}
