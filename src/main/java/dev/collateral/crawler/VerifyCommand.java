package dev.collateral.crawler;

import dev.collateral.crawler.orchestrator.RunConfig;
import dev.collateral.crawler.verify.OutputVerifier;
import dev.collateral.crawler.verify.VerificationReport;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Verify command to audit and repair crawl output */
@Command(
		name = "verify",
		description = "Check product folders for missing or invalid assets and repair what can be repaired",
		mixinStandardHelpOptions = true)
public class VerifyCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Option(
			names = {"-r", "--root"},
			description = "Output root folder to verify, repeatable (default: output)",
			defaultValue = "output")
	private List<Path> roots;

	@Option(
			names = {"--all"},
			description = "Also verify product folders that were not marked complete by the crawler")
	private boolean all;

	@Option(
			names = {"--ledger"},
			description = "Resume ledger to update for repaired files (default: <root>/" + RunConfig.DEFAULT_LEDGER_NAME + ")")
	private Path ledgerFile;

	@Option(
			names = {"--dry-run"},
			description = "Report repairs without changing any files")
	private boolean dryRun;

	@Override
	public Integer call() throws Exception {
		logger.info("Collateral Crawler - Verify");
		logger.info("===========================");
		for (Path root : roots) {
			logger.info("Output root: {}", root.toAbsolutePath());
		}
		if (dryRun) {
			logger.info("Dry run, no files will be changed");
		}
		logger.info("");

		List<VerificationReport> reports = new OutputVerifier(dryRun, all, ledgerFile).verifyRoots(roots);
		long ok = reports.stream().filter(VerificationReport::ok).count();
		logger.info("Verified {} product folders: OK={}, WARN={}", reports.size(), ok, reports.size() - ok);
		for (VerificationReport report : reports) {
			if (!report.ok()) {
				logger.info("- {}: WARN", report.product());
				for (String issue : report.issues()) {
					logger.info("  * {}", issue);
				}
			}
			for (String fix : report.fixes()) {
				logger.info("  fixed: {}", fix);
			}
		}
		return ok == reports.size() ? 0 : 1;
	}
}
