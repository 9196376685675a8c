package dev.collateral.crawler.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps track of the authentication state of one {@link SessionCapability}. The orchestrator calls
 * {@link #ensureAuthenticated()} before every request and reports auth challenges through {@link
 * #markExpired(SessionExpiredException)}.
 *
 * <p>Re-authentication is capped: once the session expired more than {@code reauthLimit} times
 * without a successful request in between, the expiry is treated as fatal.
 */
public class SessionTracker {
	private static final Logger logger = LoggerFactory.getLogger(SessionTracker.class);

	public static final int DEFAULT_REAUTH_LIMIT = 1;

	private final SessionCapability session;
	private final Credentials credentials;
	private final int reauthLimit;

	private SessionState state = SessionState.UNAUTHENTICATED;
	private int consecutiveExpiries;
	private int loginCount;
	private int reauthCount;
	private AuthenticationException rejected;

	public SessionTracker(SessionCapability session, Credentials credentials) {
		this(session, credentials, DEFAULT_REAUTH_LIMIT);
	}

	public SessionTracker(SessionCapability session, Credentials credentials, int reauthLimit) {
		this.session = session;
		this.credentials = credentials;
		this.reauthLimit = Math.max(0, reauthLimit);
	}

	/**
	 * Return once the session is authenticated, logging in first if needed.
	 *
	 * @throws AuthenticationException if the credentials were rejected, now or earlier
	 * @throws FetchException if the portal could not be reached, the state is left unchanged
	 */
	public synchronized void ensureAuthenticated()
			throws AuthenticationException, FetchException, InterruptedException {
		if (rejected != null) {
			throw rejected;
		}
		if (state == SessionState.AUTHENTICATED) {
			return;
		}
		SessionState previous = state;
		state = SessionState.AUTHENTICATING;
		logger.info(previous == SessionState.EXPIRED ? "Session expired, logging in again as {}" : "Logging in as {}",
				credentials.username());
		try {
			session.login(credentials);
		} catch (AuthenticationException e) {
			rejected = e;
			state = SessionState.UNAUTHENTICATED;
			logger.error("Login rejected for {}: {}", credentials.username(), e.getMessage());
			throw e;
		} catch (FetchException | InterruptedException | RuntimeException e) {
			state = previous;
			throw e;
		}
		loginCount++;
		if (previous == SessionState.EXPIRED) {
			reauthCount++;
		}
		state = SessionState.AUTHENTICATED;
	}

	/**
	 * Record that a request was answered with an authentication challenge.
	 *
	 * @param cause The signal from the session
	 * @throws SessionExpiredException if the session expired too often in a row, this is fatal
	 */
	public synchronized void markExpired(SessionExpiredException cause) throws SessionExpiredException {
		state = SessionState.EXPIRED;
		consecutiveExpiries++;
		if (consecutiveExpiries > reauthLimit) {
			throw new SessionExpiredException(
					"Session expired again after " + reauthCount + " re-authentication(s), giving up", cause);
		}
		logger.warn("Session expired: {}", cause.getMessage());
	}

	/** Record a request that went through, clearing the expiry streak */
	public synchronized void confirmActive() {
		consecutiveExpiries = 0;
	}

	public synchronized SessionState state() {
		return state;
	}

	/** Number of successful logins, the first one included */
	public synchronized int loginCount() {
		return loginCount;
	}

	/** Number of successful logins after an expiry */
	public synchronized int reauthCount() {
		return reauthCount;
	}
}
