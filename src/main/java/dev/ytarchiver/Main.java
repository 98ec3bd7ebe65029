package dev.ytarchiver;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/** Main application class with CLI support */
@Command(
		name = "ytarchiver",
		version = "1.1.0",
		description = "Incrementally archives the uploads of YouTube channels",
		mixinStandardHelpOptions = true,
		subcommands = {ArchiveCommand.class, ChannelsCommand.class})
public class Main implements Runnable {

	@Spec
	CommandSpec spec;

	@Override
	public void run() {
		// No subcommand given
		spec.commandLine().usage(System.out);
	}

	public static void main(String[] args) {
		int exitCode = new CommandLine(new Main()).execute(args);
		System.exit(exitCode);
	}
}
