package dev.collateral.crawler.packaging;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Called by the {@link Packager} after the temporary file has been written and verified, right
 * before it is renamed to its canonical path. Throwing aborts the promotion.
 */
@FunctionalInterface
public interface PromotionHook {
	PromotionHook NONE = (temp, target) -> {};

	void beforePromote(Path temp, Path target) throws IOException;
}
