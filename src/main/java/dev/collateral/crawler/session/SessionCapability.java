package dev.collateral.crawler.session;

import dev.collateral.crawler.model.AssetKind;
import dev.collateral.crawler.model.Product;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

/**
 * Everything the orchestrator needs from an authenticated portal session. A session is used by
 * one thread at a time.
 */
public interface SessionCapability {

	/**
	 * Log in to the portal.
	 *
	 * @throws AuthenticationException if the portal rejects the credentials
	 * @throws FetchException if the portal could not be reached
	 */
	void login(Credentials credentials) throws AuthenticationException, FetchException, InterruptedException;

	/**
	 * List the asset kinds the portal offers for a product.
	 *
	 * @return The offered kinds, possibly empty
	 */
	Set<AssetKind> listAssets(Product product) throws FetchException, SessionExpiredException, InterruptedException;

	/**
	 * Retrieve one asset into a work directory. STEP models that have to be generated first are
	 * handled inside this call.
	 *
	 * @param product The product
	 * @param kind The asset kind
	 * @param workDir Empty directory owned by the caller
	 * @return The downloaded file, somewhere below {@code workDir}
	 */
	Path fetch(Product product, AssetKind kind, Path workDir)
			throws FetchException, SessionExpiredException, InterruptedException;

	/** Whether {@link #fetchBatch} is available */
	default boolean supportsBatch() {
		return false;
	}

	/**
	 * Retrieve several assets in one combined download.
	 *
	 * @param product The product
	 * @param kinds The kinds wanted
	 * @param workDir Empty directory owned by the caller
	 * @return The delivered file per kind. Kinds missing from the delivery are absent from the map.
	 */
	default Map<AssetKind, Path> fetchBatch(Product product, Set<AssetKind> kinds, Path workDir)
			throws FetchException, SessionExpiredException, InterruptedException {
		throw new UnsupportedOperationException("Batch retrieval is not supported");
	}
}
