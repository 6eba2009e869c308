package io.rxbackend.rxjava3;

import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Single;
import io.rxbackend.core.CallbackObservables;
import io.rxbackend.core.CallbackOperation;
import io.rxbackend.vendor.auth.AuthCredential;
import io.rxbackend.vendor.auth.User;

import java.util.Objects;

/**
 * Account operations on a signed-in {@link User}.
 */
public final class RxUser {

    private RxUser() {}

    /**
     * Refreshes the profile, then emits the same user.
     */
    public static Single<User> reload(User user) {
        Objects.requireNonNull(user, "user");
        return CallbackObservables.completion(CallbackOperation.<Void>of(user::reload))
                .toSingleDefault(user);
    }

    /**
     * Attaches another provider's credential to the account.
     */
    public static Single<User> link(User user, AuthCredential credential) {
        Objects.requireNonNull(user, "user");
        Objects.requireNonNull(credential, "credential");
        return CallbackObservables.singleResult(CallbackOperation.of(callback -> user.link(credential, callback)));
    }

    public static Single<User> unlink(User user, String providerId) {
        Objects.requireNonNull(user, "user");
        Objects.requireNonNull(providerId, "providerId");
        return CallbackObservables.singleResult(CallbackOperation.of(callback -> user.unlink(providerId, callback)));
    }

    public static Single<String> getIdToken(User user, boolean forceRefresh) {
        Objects.requireNonNull(user, "user");
        return CallbackObservables.singleResult(CallbackOperation.of(callback -> user.getIdToken(forceRefresh, callback)));
    }

    public static Completable updateEmail(User user, String email) {
        Objects.requireNonNull(user, "user");
        Objects.requireNonNull(email, "email");
        return CallbackObservables.completion(CallbackOperation.<Void>of(callback -> user.updateEmail(email, callback)));
    }

    public static Completable updatePassword(User user, String password) {
        Objects.requireNonNull(user, "user");
        Objects.requireNonNull(password, "password");
        return CallbackObservables.completion(CallbackOperation.<Void>of(callback -> user.updatePassword(password, callback)));
    }

    /**
     * Deletes the account. The user is signed out on success.
     */
    public static Completable delete(User user) {
        Objects.requireNonNull(user, "user");
        return CallbackObservables.completion(CallbackOperation.<Void>of(user::delete));
    }
}
