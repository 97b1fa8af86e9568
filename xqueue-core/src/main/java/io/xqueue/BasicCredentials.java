package io.xqueue;

import java.util.Objects;

/**
 * HTTP basic credentials sent with every outbound request.
 *
 * @param username the user name
 * @param password the password
 */
public record BasicCredentials(String username, String password) {

    public BasicCredentials {
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(password, "password");
    }

    @Override
    public String toString() {
        return "BasicCredentials[username=" + username + ", password=****]";
    }
}
