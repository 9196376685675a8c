package dev.collateral.crawler.session;

import dev.collateral.crawler.SampleFiles;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** CAD portal for testing that finishes generation after a given number of status polls */
public class FakeCadPortal implements CadPortal {
	private final String modelCode;
	private final int pollsUntilComplete;
	private final List<String> calls = new ArrayList<>();
	private int polls;
	private boolean closed;
	private boolean failFormat;

	public FakeCadPortal(String modelCode, int pollsUntilComplete) {
		this.modelCode = modelCode;
		this.pollsUntilComplete = pollsUntilComplete;
	}

	/** Let the format selection fail with a transport error */
	public FakeCadPortal failFormatSelection() {
		failFormat = true;
		return this;
	}

	@Override
	public void selectFormat(String formatProfile) throws FetchException {
		calls.add("format:" + formatProfile);
		if (failFormat) {
			throw new FetchException("Format selection for " + modelCode + " failed: connection reset");
		}
	}

	@Override
	public void startGeneration() {
		calls.add("generate");
	}

	@Override
	public boolean generationComplete() {
		polls++;
		return polls > pollsUntilComplete;
	}

	@Override
	public Path download(Path targetDir) throws FetchException {
		calls.add("download");
		try {
			return SampleFiles.text(targetDir.resolve(modelCode + ".stp"), "ISO-10303-21;\n");
		} catch (IOException e) {
			throw new FetchException("Could not write model", e);
		}
	}

	@Override
	public void close() {
		closed = true;
	}

	public List<String> calls() {
		return calls;
	}

	public int polls() {
		return polls;
	}

	public boolean closed() {
		return closed;
	}
}
