package dev.collateral.crawler.orchestrator;

import dev.collateral.crawler.SampleFiles;
import dev.collateral.crawler.model.AssetKind;
import dev.collateral.crawler.model.Product;
import dev.collateral.crawler.session.AuthenticationException;
import dev.collateral.crawler.session.Credentials;
import dev.collateral.crawler.session.FetchException;
import dev.collateral.crawler.session.SessionCapability;
import dev.collateral.crawler.session.SessionExpiredException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scriptable session for testing. Delivers small valid files for every asset kind unless told to
 * fail, and records every request for verification in tests.
 */
public class FakeSession implements SessionCapability {
	private final Set<AssetKind> offered = EnumSet.allOf(AssetKind.class);
	private final Map<AssetKind, Integer> failuresLeft = new EnumMap<>(AssetKind.class);
	private final Set<AssetKind> broken = EnumSet.noneOf(AssetKind.class);
	private final Set<AssetKind> invalid = EnumSet.noneOf(AssetKind.class);
	private final Set<AssetKind> missingFromBatch = EnumSet.noneOf(AssetKind.class);
	private final Set<String> brokenProducts = new HashSet<>();
	private final List<String> fetched = Collections.synchronizedList(new ArrayList<>());
	private final List<Set<AssetKind>> batchRequests = Collections.synchronizedList(new ArrayList<>());
	private int expiriesLeft;
	private boolean rejectLogin;
	private boolean batch;
	private boolean cadExtras;
	private int logins;

	/** Offer only these kinds in the asset listing */
	public FakeSession offer(AssetKind... kinds) {
		offered.clear();
		offered.addAll(Arrays.asList(kinds));
		return this;
	}

	/** Fail the next {@code times} requests for a kind, then deliver */
	public FakeSession failTimes(AssetKind kind, int times) {
		failuresLeft.put(kind, times);
		return this;
	}

	public FakeSession alwaysFail(AssetKind kind) {
		broken.add(kind);
		return this;
	}

	/** Deliver DXF and STEP as zips holding a readme next to the CAD file in a sub folder */
	public FakeSession cadZipsWithExtras() {
		cadExtras = true;
		return this;
	}

	/** Deliver a kind normally again */
	public FakeSession heal(AssetKind kind) {
		broken.remove(kind);
		failuresLeft.remove(kind);
		invalid.remove(kind);
		return this;
	}

	/** Deliver an HTML error page instead of the asset */
	public FakeSession deliverInvalid(AssetKind kind) {
		invalid.add(kind);
		return this;
	}

	public FakeSession failProduct(String modelCode) {
		brokenProducts.add(modelCode);
		return this;
	}

	/** Answer the next {@code times} requests with an authentication challenge */
	public FakeSession expireTimes(int times) {
		expiriesLeft = times;
		return this;
	}

	public FakeSession rejectLogin() {
		rejectLogin = true;
		return this;
	}

	public FakeSession enableBatch(AssetKind... missing) {
		batch = true;
		missingFromBatch.addAll(Arrays.asList(missing));
		return this;
	}

	@Override
	public synchronized void login(Credentials credentials) throws AuthenticationException {
		if (rejectLogin) {
			throw new AuthenticationException("Invalid credentials for " + credentials.username());
		}
		logins++;
	}

	@Override
	public Set<AssetKind> listAssets(Product product) {
		return EnumSet.copyOf(offered);
	}

	@Override
	public synchronized Path fetch(Product product, AssetKind kind, Path workDir)
			throws FetchException, SessionExpiredException {
		fetched.add(product.modelCode() + "/" + kind.label());
		if (expiriesLeft > 0) {
			expiriesLeft--;
			throw new SessionExpiredException("Login required (HTTP 401)");
		}
		if (brokenProducts.contains(product.modelCode()) || broken.contains(kind)) {
			throw new FetchException("Portal error for " + product + " " + kind.label());
		}
		int failures = failuresLeft.getOrDefault(kind, 0);
		if (failures > 0) {
			failuresLeft.put(kind, failures - 1);
			throw new FetchException("Temporary portal error for " + product + " " + kind.label());
		}
		return writeAsset(product, kind, workDir);
	}

	@Override
	public boolean supportsBatch() {
		return batch;
	}

	@Override
	public synchronized Map<AssetKind, Path> fetchBatch(Product product, Set<AssetKind> kinds, Path workDir)
			throws FetchException, SessionExpiredException {
		batchRequests.add(EnumSet.copyOf(kinds));
		if (expiriesLeft > 0) {
			expiriesLeft--;
			throw new SessionExpiredException("Login required (HTTP 401)");
		}
		if (brokenProducts.contains(product.modelCode())) {
			throw new FetchException("Combined download failed for " + product);
		}
		Map<AssetKind, Path> delivered = new EnumMap<>(AssetKind.class);
		for (AssetKind kind : kinds) {
			if (!missingFromBatch.contains(kind) && !broken.contains(kind)) {
				delivered.put(kind, writeAsset(product, kind, workDir));
			}
		}
		return delivered;
	}

	private Path writeAsset(Product product, AssetKind kind, Path workDir) throws FetchException {
		String model = product.modelCode();
		try {
			if (invalid.contains(kind)) {
				return SampleFiles.text(workDir.resolve(model + "_" + kind.label() + ".pdf"), "<html>Error</html>");
			}
			if (cadExtras && kind.archive()) {
				String cad = model + (kind == AssetKind.DXF ? ".dxf" : ".stp");
				return SampleFiles.zip(workDir.resolve(model + "_" + kind.label() + ".zip"), "cad/" + cad, "readme.txt");
			}
			return switch (kind) {
				case DXF -> SampleFiles.text(workDir.resolve(model + ".dxf"), "0\nSECTION\n2\nENTITIES\n0\nENDSEC\n0\nEOF\n");
				case STEP -> SampleFiles.text(workDir.resolve(model + ".stp"), "ISO-10303-21;\nHEADER;\nENDSEC;\n");
				case IMAGE -> SampleFiles.png(workDir.resolve(model + ".png"));
				default -> SampleFiles.pdf(workDir.resolve(model + "_" + kind.label() + ".pdf"));
			};
		} catch (IOException e) {
			throw new FetchException("Could not write test asset", e);
		}
	}

	/** Fetch requests in order, as {@code model/kind} */
	public List<String> fetched() {
		synchronized (fetched) {
			return new ArrayList<>(fetched);
		}
	}

	public List<Set<AssetKind>> batchRequests() {
		synchronized (batchRequests) {
			return new ArrayList<>(batchRequests);
		}
	}

	public synchronized int logins() {
		return logins;
	}
}
