/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.api.rest;

import io.quarkus.security.identity.SecurityIdentity;
import io.vertx.core.http.HttpServerRequest;
import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;
import villagecompute.imagepipeline.services.RequestIdentity;

/**
 * Builds the pipeline's view of the caller from the authenticated principal and the client address.
 *
 * <p>
 * The client address is taken from the first {@code X-Forwarded-For} entry when the request came through a reverse
 * proxy, otherwise from the connection.
 */
@RequestScoped
public class RequestIdentityResolver {

    @Inject
    SecurityIdentity securityIdentity;

    @Inject
    HttpServerRequest request;

    public RequestIdentity current() {
        String ipAddress = clientAddress(request.getHeader("X-Forwarded-For"),
                request.remoteAddress() == null ? null : request.remoteAddress().host());
        if (securityIdentity == null || securityIdentity.isAnonymous()) {
            return RequestIdentity.anonymous(ipAddress);
        }
        return RequestIdentity.user(securityIdentity.getPrincipal().getName(), ipAddress);
    }

    static String clientAddress(String forwardedFor, String remoteHost) {
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            int commaIndex = forwardedFor.indexOf(',');
            return commaIndex > 0 ? forwardedFor.substring(0, commaIndex).trim() : forwardedFor.trim();
        }
        return remoteHost != null ? remoteHost : "unknown";
    }
}
