package com.inkblog.client.auth;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

public class InMemoryCredentialStore implements CredentialStore {

    private final AtomicReference<Credentials> ref = new AtomicReference<>();

    public InMemoryCredentialStore() {
    }

    public InMemoryCredentialStore(Credentials initial) {
        ref.set(initial);
    }

    @Override
    public Optional<Credentials> current() {
        return Optional.ofNullable(ref.get());
    }

    @Override
    public void save(Credentials credentials) {
        ref.set(Objects.requireNonNull(credentials, "credentials"));
    }

    @Override
    public void clear() {
        ref.set(null);
    }

    @Override
    public boolean clearIfCurrent(Credentials expected) {
        Credentials held = ref.get();
        if (held == null || !held.equals(expected)) {
            return false;
        }
        return ref.compareAndSet(held, null);
    }
}
