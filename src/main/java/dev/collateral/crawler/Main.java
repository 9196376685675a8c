package dev.collateral.crawler;

import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/** Main application class with CLI support */
@Command(
		name = "collateral-crawler",
		version = "1.0.0",
		description = "Downloads product collateral from a vendor portal into a resumable local archive",
		mixinStandardHelpOptions = true,
		subcommands = {CrawlCommand.class, VerifyCommand.class})
public class Main implements Callable<Integer> {

	@Override
	public Integer call() {
		new CommandLine(this).usage(System.out);
		return 0;
	}

	public static void main(String[] args) {
		int exitCode = new CommandLine(new Main()).execute(args);
		System.exit(exitCode);
	}
}
