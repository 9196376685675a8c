package dev.collateral.crawler.session;

import dev.collateral.crawler.model.AssetKind;
import dev.collateral.crawler.model.Product;
import java.nio.file.Path;
import java.util.Set;

/**
 * Low level portal navigation. Implementations know how to talk to one particular portal, the
 * crawler only sees them through a {@link DriverSession}.
 */
public interface BrowserDriver {

	void login(Credentials credentials) throws AuthenticationException, FetchException, InterruptedException;

	Set<AssetKind> listAssets(Product product) throws FetchException, SessionExpiredException, InterruptedException;

	/**
	 * Request one asset. STEP models may come back as a redirect to the CAD portal instead of a
	 * file.
	 */
	AssetResponse requestAsset(Product product, AssetKind kind, Path workDir)
			throws FetchException, SessionExpiredException, InterruptedException;

	default boolean supportsBatch() {
		return false;
	}

	/**
	 * Request a combined download of several assets.
	 *
	 * @return A single archive, or a single file when only one asset was delivered
	 */
	default Path requestBatch(Product product, Set<AssetKind> kinds, Path workDir)
			throws FetchException, SessionExpiredException, InterruptedException {
		throw new UnsupportedOperationException("Batch retrieval is not supported");
	}

	/** Switch to the CAD generation portal for a reference returned by {@link #requestAsset} */
	CadPortal openCadPortal(Product product, String cadPortalRef)
			throws FetchException, SessionExpiredException, InterruptedException;
}
