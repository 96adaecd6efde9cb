package dev.sidebarscraper;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Spec;

/** Main application class with CLI support */
@Command(
		name = "sidebar-scraper",
		version = "1.0.0",
		description = "Discovers the sidebar of a JS-rendered documentation site and extracts every page",
		mixinStandardHelpOptions = true,
		subcommands = {ScrapeCommand.class, DiscoverCommand.class, ResumeInfoCommand.class})
public class Main implements Runnable {

	@Spec
	CommandLine.Model.CommandSpec spec;

	@Override
	public void run() {
		spec.commandLine().usage(System.out);
	}

	public static void main(String[] args) {
		int exitCode = new CommandLine(new Main()).execute(args);
		System.exit(exitCode);
	}
}
