package io.sultan.auth;

/**
 * Access token plus the refresh token that can mint its successor.
 */
public record TokenPair(IssuedToken access, IssuedToken refresh) {

    public String accessToken() {
        return access.token();
    }

    public String refreshToken() {
        return refresh.token();
    }
}
