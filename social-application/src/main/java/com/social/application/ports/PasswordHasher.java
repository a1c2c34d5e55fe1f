package com.social.application.ports;

/** One-way hashing applied to passwords before they reach the store. */
public interface PasswordHasher {

    String hash(String rawPassword);
}
