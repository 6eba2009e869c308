package io.rxbackend.rxjava3;

import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.core.Single;
import io.rxbackend.core.CallbackObservables;
import io.rxbackend.core.CallbackOperation;
import io.rxbackend.vendor.ListenerHandle;
import io.rxbackend.vendor.auth.Auth;
import io.rxbackend.vendor.auth.AuthCredential;
import io.rxbackend.vendor.auth.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Authentication as RxJava streams.
 *
 * <p>Sign-in calls succeed with the signed-in user. A sign-in cannot be cancelled once dispatched.
 */
public final class RxAuth {

    private static final Logger logger = LoggerFactory.getLogger(RxAuth.class);

    private RxAuth() {}

    /**
     * Auth state notifications: once on subscription, then whenever the signed-in user changes.
     * Disposing removes the listener.
     */
    public static Observable<AuthState> authStateChanges(Auth auth) {
        Objects.requireNonNull(auth, "auth");
        return CallbackObservables.<AuthState>listener(handler -> {
            ListenerHandle handle = auth.addAuthStateListener(
                    (source, user) -> handler.accept(new AuthState(source, Optional.ofNullable(user))));
            logger.debug("Registered auth state listener on {}", auth);
            return () -> {
                auth.removeAuthStateListener(handle);
                logger.debug("Removed auth state listener from {}", auth);
            };
        });
    }

    /**
     * Like {@link #authStateChanges}, also notified when the user's id token changes.
     */
    public static Observable<AuthState> idTokenChanges(Auth auth) {
        Objects.requireNonNull(auth, "auth");
        return CallbackObservables.<AuthState>listener(handler -> {
            ListenerHandle handle = auth.addIdTokenListener(
                    (source, user) -> handler.accept(new AuthState(source, Optional.ofNullable(user))));
            logger.debug("Registered id token listener on {}", auth);
            return () -> {
                auth.removeIdTokenListener(handle);
                logger.debug("Removed id token listener from {}", auth);
            };
        });
    }

    public static Single<User> signInWithEmail(Auth auth, String email, String password) {
        Objects.requireNonNull(auth, "auth");
        Objects.requireNonNull(email, "email");
        Objects.requireNonNull(password, "password");
        return CallbackObservables.singleResult(CallbackOperation.of(callback -> auth.signInWithEmail(email, password, callback)));
    }

    public static Single<User> signInAnonymously(Auth auth) {
        Objects.requireNonNull(auth, "auth");
        return CallbackObservables.singleResult(CallbackOperation.of(auth::signInAnonymously));
    }

    /**
     * Signs in with a provider credential (OAuth token, phone code, ...).
     */
    public static Single<User> signInWithCredential(Auth auth, AuthCredential credential) {
        Objects.requireNonNull(auth, "auth");
        Objects.requireNonNull(credential, "credential");
        return CallbackObservables.singleResult(CallbackOperation.of(callback -> auth.signInWithCredential(credential, callback)));
    }

    public static Single<User> signInWithCustomToken(Auth auth, String token) {
        Objects.requireNonNull(auth, "auth");
        Objects.requireNonNull(token, "token");
        return CallbackObservables.singleResult(CallbackOperation.of(callback -> auth.signInWithCustomToken(token, callback)));
    }

    /**
     * Creates an account and signs it in.
     */
    public static Single<User> createUser(Auth auth, String email, String password) {
        Objects.requireNonNull(auth, "auth");
        Objects.requireNonNull(email, "email");
        Objects.requireNonNull(password, "password");
        return CallbackObservables.singleResult(CallbackOperation.of(callback -> auth.createUser(email, password, callback)));
    }

    public static Completable sendPasswordReset(Auth auth, String email) {
        Objects.requireNonNull(auth, "auth");
        Objects.requireNonNull(email, "email");
        return CallbackObservables.completion(CallbackOperation.<Void>of(callback -> auth.sendPasswordReset(email, callback)));
    }
}
