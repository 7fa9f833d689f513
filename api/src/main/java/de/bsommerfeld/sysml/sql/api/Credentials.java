package de.bsommerfeld.sysml.sql.api;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;

/**
 * HTTP basic auth credentials, read from {@code SYSML_USERNAME} and
 * {@code SYSML_PASSWORD}. A username alone is valid, a password alone is not.
 */
public record Credentials(String username, String password) {

    public static final String USERNAME_ENV = "SYSML_USERNAME";
    public static final String PASSWORD_ENV = "SYSML_PASSWORD";

    public static Credentials none() {
        return new Credentials(null, null);
    }

    public static Credentials fromEnvironment() {
        return from(System.getenv());
    }

    static Credentials from(Map<String, String> env) {
        String username = env.get(USERNAME_ENV);
        String password = env.get(PASSWORD_ENV);
        if (username == null && password != null) {
            throw new IllegalArgumentException(
                    PASSWORD_ENV + " is set but " + USERNAME_ENV + " is not, a username is required with a password");
        }
        return new Credentials(username, password);
    }

    public boolean isPresent() {
        return username != null;
    }

    Optional<String> authorizationHeader() {
        if (!isPresent()) {
            return Optional.empty();
        }
        String pair = username + ":" + (password == null ? "" : password);
        return Optional.of("Basic " + Base64.getEncoder().encodeToString(pair.getBytes(StandardCharsets.UTF_8)));
    }

    @Override
    public String toString() {
        return isPresent() ? "Credentials[" + username + ", ***]" : "Credentials[none]";
    }
}
