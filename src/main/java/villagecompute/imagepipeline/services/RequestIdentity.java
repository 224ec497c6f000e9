/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.services;

import io.quarkus.security.ForbiddenException;
import io.quarkus.security.UnauthorizedException;
import villagecompute.imagepipeline.data.models.ImageRecord;

/**
 * Caller of a pipeline operation.
 *
 * @param userId
 *            authenticated user id, null for anonymous callers
 * @param ipAddress
 *            client address as seen by the edge
 * @param authenticated
 *            whether {@code userId} was established by authentication
 */
public record RequestIdentity(String userId, String ipAddress, boolean authenticated) {

    public static RequestIdentity user(String userId, String ipAddress) {
        return new RequestIdentity(userId, ipAddress, true);
    }

    public static RequestIdentity anonymous(String ipAddress) {
        return new RequestIdentity(null, ipAddress, false);
    }

    /**
     * Admission subject: the user id for authenticated callers, the IP address otherwise.
     */
    public String rateLimitKey() {
        if (authenticated && userId != null) {
            return "u:" + userId;
        }
        return "ip:" + (ipAddress == null ? "unknown" : ipAddress);
    }

    /**
     * @throws UnauthorizedException
     *             if the caller is anonymous
     */
    public void requireAuthenticated() {
        if (!authenticated || userId == null) {
            throw new UnauthorizedException("Authentication required");
        }
    }

    /**
     * @throws ForbiddenException
     *             if the caller does not own the image
     */
    public void requireOwnerOf(ImageRecord image) {
        if (!image.isOwnedBy(userId)) {
            throw new ForbiddenException("Image " + image.id() + " is not owned by the requester");
        }
    }
}
