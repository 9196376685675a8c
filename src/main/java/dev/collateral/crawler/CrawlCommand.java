package dev.collateral.crawler;

import dev.collateral.crawler.ledger.ResumeLedger;
import dev.collateral.crawler.orchestrator.AssetOutcome;
import dev.collateral.crawler.orchestrator.DownloadOrchestrator;
import dev.collateral.crawler.orchestrator.ProductSummary;
import dev.collateral.crawler.orchestrator.RunConfig;
import dev.collateral.crawler.orchestrator.RunReport;
import dev.collateral.crawler.orchestrator.RunSummary;
import dev.collateral.crawler.orchestrator.WorkerPool;
import dev.collateral.crawler.packaging.Packager;
import dev.collateral.crawler.portal.ManifestDriver;
import dev.collateral.crawler.session.CadGenerationProtocol;
import dev.collateral.crawler.session.Credentials;
import dev.collateral.crawler.session.DriverSession;
import dev.collateral.crawler.session.SessionTracker;
import dev.collateral.crawler.source.HttpCatalogSource;
import dev.collateral.crawler.source.ProductFileSource;
import dev.collateral.crawler.source.ProductSource;
import dev.collateral.crawler.source.ProductSources;
import dev.collateral.crawler.util.HttpUtils;
import dev.collateral.crawler.util.Sleeper;
import dev.collateral.crawler.validate.ArtifactValidator;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Crawl command to download the collateral of all listed products */
@Command(
		name = "crawl",
		description = "Download catalogs, drawings, CAD models, datasheets, manuals and images of all products",
		mixinStandardHelpOptions = true)
public class CrawlCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Option(
			names = {"--manifest"},
			description = "File or URL of the portal manifest",
			required = true)
	private String manifest;

	@Option(
			names = {"-o", "--output-root"},
			description = "Root folder of the product archive (default: output)",
			defaultValue = "output")
	private Path outputRoot;

	@Option(
			names = {"--ledger"},
			description = "Resume ledger file (default: <output-root>/" + RunConfig.DEFAULT_LEDGER_NAME + ")")
	private Path ledgerFile;

	@Option(
			names = {"--download-dir"},
			description = "Scratch folder for downloads in progress (default: <output-root>/"
					+ RunConfig.DEFAULT_DOWNLOAD_DIR_NAME + ")")
	private Path downloadDir;

	@Option(
			names = {"--catalog-url"},
			description = "Paginated JSON product listing with a {page} placeholder, instead of the manifest listing")
	private String catalogUrl;

	@Option(
			names = {"--product-file"},
			description = "Text, CSV or TSV file with the model codes or product URLs to crawl")
	private Path productFile;

	@Option(
			names = {"--product"},
			description = "Comma-separated list of model codes to crawl",
			split = ",")
	private List<String> productCodes;

	@Option(
			names = {"--series"},
			description = "Only crawl products of this series")
	private String series;

	@Option(
			names = {"--max-products"},
			description = "Maximum number of products to process (default: unlimited)",
			defaultValue = "0")
	private int maxProducts;

	@Option(
			names = {"--overwrite"},
			description = "Download assets again even when the ledger has them")
	private boolean overwrite;

	@Option(
			names = {"--timeout"},
			description = "Timeout in seconds for downloads and CAD generation (default: 300)",
			defaultValue = "300")
	private long timeoutSeconds;

	@Option(
			names = {"--retries"},
			description = "Attempts per asset before giving up (default: 3)",
			defaultValue = "3")
	private int retries;

	@Option(
			names = {"--retry-delay"},
			description = "Backoff in milliseconds before the first retry, doubled on every further retry (default: 2000)",
			defaultValue = "2000")
	private long retryDelayMillis;

	@Option(
			names = {"--delay"},
			description = "Pause in milliseconds between products (default: 400)",
			defaultValue = "400")
	private long delayMillis;

	@Option(
			names = {"--reauth-limit"},
			description = "Re-authentications allowed when the session keeps expiring (default: 1)",
			defaultValue = "1")
	private int reauthLimit;

	@Option(
			names = {"-w", "--workers"},
			description = "Number of parallel portal sessions (default: 1)",
			defaultValue = "1")
	private int workers;

	@Option(
			names = {"-u", "--username"},
			description = "Portal user name (default: $COLLATERAL_USERNAME)",
			defaultValue = "${env:COLLATERAL_USERNAME}")
	private String username;

	@Option(
			names = {"-p", "--password"},
			description = "Portal password, prompted when given without value (default: $COLLATERAL_PASSWORD)",
			defaultValue = "${env:COLLATERAL_PASSWORD}",
			interactive = true,
			arity = "0..1")
	private String password;

	@Option(
			names = {"--cad-format"},
			description = "Format profile selected in the CAD generation portal (default: "
					+ CadGenerationProtocol.DEFAULT_FORMAT + ")",
			defaultValue = CadGenerationProtocol.DEFAULT_FORMAT)
	private String cadFormat;

	@Option(
			names = {"--keep-downloads"},
			description = "Keep the scratch folders of processed products")
	private boolean keepDownloads;

	@Option(
			names = {"--min-size"},
			description = "Smallest acceptable asset size in bytes (default: 1)",
			defaultValue = "1")
	private long minSize;

	@Option(
			names = {"--compact-ledger"},
			description = "Rewrite the ledger with one line per asset after the run")
	private boolean compactLedger;

	@Option(
			names = {"--report"},
			description = "Write a JSON report of the run to this file")
	private Path report;

	@Override
	public Integer call() throws Exception {
		RunConfig config = RunConfig.builder(outputRoot)
				.ledgerFile(ledgerFile)
				.downloadDir(downloadDir)
				.overwrite(overwrite)
				.maxProducts(maxProducts)
				.operationTimeout(Duration.ofSeconds(timeoutSeconds))
				.retryCeiling(retries)
				.baseDelay(Duration.ofMillis(retryDelayMillis))
				.productDelay(Duration.ofMillis(delayMillis))
				.reauthLimit(reauthLimit)
				.cadFormat(cadFormat)
				.keepDownloads(keepDownloads)
				.minSize(minSize)
				.build();
		Credentials credentials = new Credentials(
				username != null ? username : "", password != null ? password : "");

		logger.info("Collateral Crawler - Crawl");
		logger.info("==========================");
		logger.info("Manifest: {}", manifest);
		logger.info("Output root: {}", config.outputRoot().toAbsolutePath());
		logger.info("Ledger: {}", config.ledgerFile().toAbsolutePath());
		logger.info("Workers: {}", workers);
		logger.info("");

		ManifestDriver driver;
		ProductSource source;
		try {
			driver = ManifestDriver.open(manifest, newHttp(config));
			source = productSource(driver, config);
		} catch (IOException e) {
			logger.error("Error: {}", e.getMessage());
			return 2;
		}

		long startTime = System.currentTimeMillis();
		RunSummary summary;
		try (ResumeLedger ledger = new ResumeLedger(config.ledgerFile())) {
			ledger.load();
			if (workers <= 1) {
				summary = orchestrator(driver, ledger, config, credentials)
						.run(ProductSources.limit(source, config.maxProducts()));
			} else {
				WorkerPool pool = new WorkerPool(workers, index -> orchestrator(
						index == 0 ? driver : ManifestDriver.open(manifest, newHttp(config)),
						ledger,
						config,
						credentials));
				summary = pool.run(source, config.maxProducts());
			}
			if (compactLedger) {
				ledger.compact();
			}
		}

		printSummary(summary, System.currentTimeMillis() - startTime);
		if (report != null) {
			RunReport.write(summary, report);
			logger.info("Report written to {}", report.toAbsolutePath());
		}
		return summary.exitCode();
	}

	private ProductSource productSource(ManifestDriver driver, RunConfig config) throws IOException {
		ProductSource source = catalogUrl != null
				? new HttpCatalogSource(catalogUrl, newHttp(config))
				: ProductSources.of(driver.products());
		if (series != null) {
			source = ProductSources.series(source, series);
		}
		List<String> codes = new ArrayList<>();
		if (productCodes != null) {
			codes.addAll(productCodes);
		}
		if (productFile != null) {
			codes.addAll(new ProductFileSource(productFile).modelCodes());
		}
		if (!codes.isEmpty()) {
			logger.info("Restricting crawl to {} model codes", codes.size());
			source = ProductSources.only(source, codes);
		}
		return source;
	}

	private static HttpUtils newHttp(RunConfig config) {
		return new HttpUtils(config.operationTimeout(), Sleeper.SYSTEM);
	}

	private static DownloadOrchestrator orchestrator(
			ManifestDriver driver, ResumeLedger ledger, RunConfig config, Credentials credentials) {
		CadGenerationProtocol cadProtocol = new CadGenerationProtocol(
				config.cadFormat(),
				config.operationTimeout(),
				CadGenerationProtocol.DEFAULT_POLL_INTERVAL,
				Sleeper.SYSTEM);
		DriverSession session = new DriverSession(driver, cadProtocol);
		SessionTracker tracker = new SessionTracker(session, credentials, config.reauthLimit());
		ArtifactValidator validator = new ArtifactValidator(config.minSize());
		Packager packager = new Packager(config.outputRoot(), validator);
		return new DownloadOrchestrator(session, tracker, ledger, validator, packager, config, Sleeper.SYSTEM);
	}

	private void printSummary(RunSummary summary, long millis) {
		logger.info("");
		logger.info("Execution Summary");
		logger.info("=================");
		logger.info("{}", summary);
		for (ProductSummary product : summary.products()) {
			if (product.failed() == 0) {
				continue;
			}
			logger.info("  {}", product);
			for (AssetOutcome asset : product.assets()) {
				if (!asset.done() && asset.reason() != null) {
					logger.info("    {} {}: {}", asset.kind().label(), asset.state(), asset.reason());
				}
			}
		}
		logger.info("");
		logger.info("Products processed: {}", summary.productsProcessed());
		logger.info("Products complete: {}", summary.productsComplete());
		logger.info("Crawl finished in {} seconds", millis / 1000.0);
	}
}
