package uimbt.discovery;

import java.util.Objects;

/**
 * Login credentials for the optional login micro-sequence. Never serialized;
 * {@link #toString()} masks the password.
 */
public record Credentials(String username, String password) {

    public Credentials {
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(password, "password");
    }

    @Override
    public String toString() {
        return "Credentials{username='" + username + "', password='***'}";
    }
}
