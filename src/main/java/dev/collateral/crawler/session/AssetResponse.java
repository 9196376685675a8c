package dev.collateral.crawler.session;

import java.nio.file.Path;

/**
 * What the portal answered to an asset request: either the downloaded file, or a reference to the
 * CAD generation portal that has to produce the file first.
 *
 * @param file The downloaded file, null for a redirect
 * @param cadPortalRef Opaque portal reference, null when the file was delivered directly
 */
public record AssetResponse(Path file, String cadPortalRef) {

	public static AssetResponse delivered(Path file) {
		return new AssetResponse(file, null);
	}

	public static AssetResponse redirect(String cadPortalRef) {
		return new AssetResponse(null, cadPortalRef);
	}

	public boolean isDelivered() {
		return file != null;
	}

	public boolean isRedirect() {
		return file == null && cadPortalRef != null;
	}
}
