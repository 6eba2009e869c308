package io.rxbackend.reactor;

import io.rxbackend.core.AdapterOptions;
import io.rxbackend.rxjava3.AuthState;
import io.rxbackend.rxjava3.RxAuth;
import io.rxbackend.rxjava3.RxUser;
import io.rxbackend.vendor.auth.Auth;
import io.rxbackend.vendor.auth.AuthCredential;
import io.rxbackend.vendor.auth.User;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Objects;

/**
 * Reactor adapter over {@link RxAuth} and {@link RxUser}.
 */
public final class ReactorAuth {

    private final AdapterOptions options;

    public ReactorAuth() {
        this(AdapterOptions.load());
    }

    public ReactorAuth(AdapterOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public AdapterOptions options() {
        return options;
    }

    public Flux<AuthState> authStateChanges(Auth auth) {
        return Conversions.flux(RxAuth.authStateChanges(auth), options);
    }

    public Flux<AuthState> idTokenChanges(Auth auth) {
        return Conversions.flux(RxAuth.idTokenChanges(auth), options);
    }

    public Mono<User> signInWithEmail(Auth auth, String email, String password) {
        return Conversions.mono(RxAuth.signInWithEmail(auth, email, password));
    }

    public Mono<User> signInAnonymously(Auth auth) {
        return Conversions.mono(RxAuth.signInAnonymously(auth));
    }

    public Mono<User> signInWithCredential(Auth auth, AuthCredential credential) {
        return Conversions.mono(RxAuth.signInWithCredential(auth, credential));
    }

    public Mono<User> signInWithCustomToken(Auth auth, String token) {
        return Conversions.mono(RxAuth.signInWithCustomToken(auth, token));
    }

    public Mono<User> createUser(Auth auth, String email, String password) {
        return Conversions.mono(RxAuth.createUser(auth, email, password));
    }

    public Mono<Void> sendPasswordReset(Auth auth, String email) {
        return Conversions.mono(RxAuth.sendPasswordReset(auth, email));
    }

    public Mono<User> reload(User user) {
        return Conversions.mono(RxUser.reload(user));
    }

    public Mono<User> link(User user, AuthCredential credential) {
        return Conversions.mono(RxUser.link(user, credential));
    }

    public Mono<User> unlink(User user, String providerId) {
        return Conversions.mono(RxUser.unlink(user, providerId));
    }

    public Mono<String> getIdToken(User user, boolean forceRefresh) {
        return Conversions.mono(RxUser.getIdToken(user, forceRefresh));
    }

    public Mono<Void> updateEmail(User user, String email) {
        return Conversions.mono(RxUser.updateEmail(user, email));
    }

    public Mono<Void> updatePassword(User user, String password) {
        return Conversions.mono(RxUser.updatePassword(user, password));
    }

    public Mono<Void> delete(User user) {
        return Conversions.mono(RxUser.delete(user));
    }
}
