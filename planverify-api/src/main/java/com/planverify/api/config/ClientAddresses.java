package com.planverify.api.config;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Resolves the caller's network address.
 * <p>
 * Only the socket address is used. Forwarded headers are applied by the container's
 * RemoteIpValve, and only when the immediate peer matches {@code server.tomcat.remoteip.internal-proxies}.
 */
public final class ClientAddresses {

    private ClientAddresses() {}

    public static String resolve(HttpServletRequest request) {
        return request.getRemoteAddr();
    }
}
