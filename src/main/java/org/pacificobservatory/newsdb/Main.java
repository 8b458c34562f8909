package org.pacificobservatory.newsdb;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/** Main application class with CLI support */
@Command(
		name = "news-scraper",
		version = "1.0.0",
		description = "Config-driven scraper for Pacific news sources",
		mixinStandardHelpOptions = true,
		subcommands = {ScrapeCommand.class, StatusCommand.class})
public class Main implements Runnable {

	@Spec
	CommandSpec spec;

	@Override
	public void run() {
		spec.commandLine().usage(System.out);
	}

	public static void main(String[] args) {
		int exitCode = new CommandLine(new Main()).execute(args);
		System.exit(exitCode);
	}
}
