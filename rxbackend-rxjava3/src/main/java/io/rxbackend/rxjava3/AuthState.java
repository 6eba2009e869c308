package io.rxbackend.rxjava3;

import io.rxbackend.vendor.auth.Auth;
import io.rxbackend.vendor.auth.User;

import java.util.Optional;

/**
 * One auth state notification.
 *
 * @param auth instance that notified
 * @param user signed-in user, empty when signed out
 */
public record AuthState(Auth auth, Optional<User> user) {

    public boolean isSignedIn() {
        return user.isPresent();
    }
}
