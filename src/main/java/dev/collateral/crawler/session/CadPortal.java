package dev.collateral.crawler.session;

import java.nio.file.Path;

/**
 * A context switched to the CAD generation portal for one product. Closing it returns the driver
 * to the main portal.
 */
public interface CadPortal extends AutoCloseable {

	/** Select the output format, e.g. {@code STEP AP214} */
	void selectFormat(String formatProfile) throws FetchException, SessionExpiredException, InterruptedException;

	void startGeneration() throws FetchException, SessionExpiredException, InterruptedException;

	boolean generationComplete() throws FetchException, SessionExpiredException, InterruptedException;

	/** Download the generated model into a directory */
	Path download(Path targetDir) throws FetchException, SessionExpiredException, InterruptedException;

	@Override
	void close();
}
