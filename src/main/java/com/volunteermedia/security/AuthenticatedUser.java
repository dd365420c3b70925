package com.volunteermedia.security;

/**
 * Identity carried by a verified bearer token.
 *
 * @param userId id of the user the token was issued to
 * @param admin  site-admin flag at the time the token was issued
 */
public record AuthenticatedUser(Long userId, boolean admin) {
}
