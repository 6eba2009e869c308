package io.rxbackend.rxjava3;

import io.reactivex.rxjava3.observers.TestObserver;
import io.rxbackend.testing.FakeCredential;
import io.rxbackend.testing.FakeUser;
import io.rxbackend.vendor.BackendException;
import io.rxbackend.vendor.auth.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RxUserTest {

    private FakeUser user;

    @BeforeEach
    void setUp() {
        user = FakeUser.anonymous("anon-1");
    }

    @Test
    void reloadEmitsTheSameUser() {
        TestObserver<User> observer = RxUser.reload(user).test();

        user.updates().succeed(null);

        observer.assertValues(user).assertComplete();
    }

    @Test
    void reloadFailureIsRelayed() {
        BackendException.AuthException error = new BackendException.AuthException("user-token-expired", "expired");
        TestObserver<User> observer = RxUser.reload(user).test();

        user.updates().fail(error);

        observer.assertNoValues().assertError(e -> e == error);
    }

    @Test
    void linkEmitsLinkedUser() {
        FakeUser linked = new FakeUser("anon-1", "ada@example.com");
        TestObserver<User> observer = RxUser.link(user, new FakeCredential("password", "pw")).test();

        user.links().succeed(linked);

        observer.assertValues(linked).assertComplete();
        assertThat(user.links().log()).containsExactly("link password");
    }

    @Test
    void unlinkAndTokenCalls() {
        TestObserver<User> unlinked = RxUser.unlink(user, "google.com").test();
        TestObserver<String> token = RxUser.getIdToken(user, true).test();

        user.links().succeed(user);
        user.tokens().succeed("jwt");

        unlinked.assertValues(user).assertComplete();
        token.assertValues("jwt").assertComplete();
        assertThat(user.tokens().log()).containsExactly("getIdToken true");
    }

    @Test
    void profileUpdatesComplete() {
        TestObserver<Void> email = RxUser.updateEmail(user, "new@example.com").test();
        TestObserver<Void> password = RxUser.updatePassword(user, "pw2").test();
        TestObserver<Void> delete = RxUser.delete(user).test();

        user.updates().succeed(null);
        user.updates().succeed(null);
        user.updates().fail(new BackendException.AuthException("requires-recent-login", "login again"));

        email.assertComplete();
        password.assertComplete();
        delete.assertError(BackendException.AuthException.class);
        assertThat(user.updates().log()).containsExactly("updateEmail new@example.com", "updatePassword", "delete");
    }
}
