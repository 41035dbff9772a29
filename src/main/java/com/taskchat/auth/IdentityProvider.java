package com.taskchat.auth;

/**
 * Resolves the verified owner id of a request.
 */
public interface IdentityProvider {

    /**
     * @param authorizationHeader raw {@code Authorization} header, may be null
     * @return the owner id, never blank
     * @throws UnauthorizedException when the credentials are missing or invalid
     */
    String resolveOwner(String authorizationHeader);
}
