package dev.collateral.crawler.session;

import java.util.Objects;

/**
 * Portal login. The password never shows up in {@link #toString()}.
 *
 * @param username Account name
 * @param password Account password
 */
public record Credentials(String username, String password) {

	public Credentials {
		Objects.requireNonNull(username, "username");
		Objects.requireNonNull(password, "password");
	}

	@Override
	public String toString() {
		return "Credentials[username=" + username + ", password=****]";
	}
}
