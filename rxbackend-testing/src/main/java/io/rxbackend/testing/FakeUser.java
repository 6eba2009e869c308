package io.rxbackend.testing;

import io.rxbackend.vendor.ResultCallback;
import io.rxbackend.vendor.auth.AuthCredential;
import io.rxbackend.vendor.auth.User;

/**
 * User whose profile calls are answered by the test.
 */
public final class FakeUser implements User {

    private final String uid;
    private final String email;
    private final PendingCalls<Void> updates = new PendingCalls<>();
    private final PendingCalls<User> links = new PendingCalls<>();
    private final PendingCalls<String> tokens = new PendingCalls<>();

    public FakeUser(String uid, String email) {
        this.uid = uid;
        this.email = email;
    }

    public static FakeUser anonymous(String uid) {
        return new FakeUser(uid, null);
    }

    @Override
    public String uid() {
        return uid;
    }

    @Override
    public String email() {
        return email;
    }

    @Override
    public boolean isAnonymous() {
        return email == null;
    }

    /**
     * Pending reload, update and delete calls.
     */
    public PendingCalls<Void> updates() {
        return updates;
    }

    /**
     * Pending link and unlink calls.
     */
    public PendingCalls<User> links() {
        return links;
    }

    public PendingCalls<String> tokens() {
        return tokens;
    }

    @Override
    public void reload(ResultCallback<Void> callback) {
        updates.add("reload", callback);
    }

    @Override
    public void link(AuthCredential credential, ResultCallback<User> callback) {
        links.add("link " + credential.providerId(), callback);
    }

    @Override
    public void unlink(String providerId, ResultCallback<User> callback) {
        links.add("unlink " + providerId, callback);
    }

    @Override
    public void getIdToken(boolean forceRefresh, ResultCallback<String> callback) {
        tokens.add("getIdToken " + forceRefresh, callback);
    }

    @Override
    public void updateEmail(String newEmail, ResultCallback<Void> callback) {
        updates.add("updateEmail " + newEmail, callback);
    }

    @Override
    public void updatePassword(String password, ResultCallback<Void> callback) {
        updates.add("updatePassword", callback);
    }

    @Override
    public void delete(ResultCallback<Void> callback) {
        updates.add("delete", callback);
    }

    @Override
    public String toString() {
        return "FakeUser{" + uid + "}";
    }
}
