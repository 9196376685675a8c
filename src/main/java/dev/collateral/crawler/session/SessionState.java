package dev.collateral.crawler.session;

/** Authentication lifecycle of a portal session */
public enum SessionState {
	UNAUTHENTICATED,
	AUTHENTICATING,
	AUTHENTICATED,
	/** The portal answered a request with an authentication challenge */
	EXPIRED
}
