/*
 *     This file is part of MineralMap.
 *
 *     MineralMap is free software: you can redistribute it and/or modify
 *     it under the terms of the GNU General Public License as published by
 *     the Free Software Foundation, either version 3 of the License, or
 *     (at your option) any later version.
 *
 *     MineralMap is distributed in the hope that it will be useful,
 *     but WITHOUT ANY WARRANTY; without even the implied warranty of
 *     MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *     GNU General Public License for more details.
 *
 *     You should have received a copy of the GNU General Public License
 *     along with MineralMap.  If not, see <http://www.gnu.org/licenses/>.
 */

package mineralmap.cli;

import mineralmap.util.MineralMapVersion;
import mineralmap.util.ProcessingContext;
import org.scijava.log.LogLevel;
import org.scijava.log.LogService;
import org.scijava.log.StderrLogService;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.ForkJoinPool;

/**
 * Command line entry point: {@code mineralmap classify|filter|rgb}.
 * <p>
 * Failures are printed to standard error as {@code mineralmap: <message>} and exit with
 * code {@value #EXIT_FAILURE}, the same code picocli uses for usage errors.
 */
@Command(
		name = "mineralmap",
		mixinStandardHelpOptions = true,
		versionProvider = MineralMapCli.VersionProvider.class,
		description = "Classifies hyperspectral images into minerals using spectral angle mapping.",
		subcommands = {
				ClassifyCommand.class,
				FilterCommand.class,
				RgbCommand.class,
				CommandLine.HelpCommand.class
		}
)
public class MineralMapCli implements Runnable
{
	public static final int EXIT_FAILURE = 2;

	@Spec
	private CommandSpec spec;

	@Option(names = {"-v", "--verbose"}, description = "Log per-tile progress and timings.", scope = CommandLine.ScopeType.INHERIT)
	private boolean verbose;

	private final LogService log;

	public MineralMapCli()
	{
		this(new StderrLogService());
	}

	public MineralMapCli(LogService log)
	{
		this.log = log;
	}

	@Override
	public void run()
	{
		spec.commandLine().usage(spec.commandLine().getOut());
	}

	LogService getLog()
	{
		log.setLevel(verbose ? LogLevel.DEBUG : LogLevel.INFO);
		return log;
	}

	/** Context for one subcommand run. A null executor selects the shared worker pool. */
	ProcessingContext createContext(int tileRows, ExecutorService executor)
	{
		final LogService log = getLog();

		return ProcessingContext.defaults()
				.withTileRows(tileRows)
				.withExecutor(executor)
				.withLog(log)
				.withProgressListener((current, max, message) -> {
					if(log.isDebug())
						log.debug(message + " [" + current + "/" + max + "]");
				});
	}

	/** A pool of {@code threads} workers for one run, or null when unset. The caller shuts it down. */
	static ExecutorService createExecutor(Integer threads)
	{
		if(threads == null)
			return null;

		if(threads < 1)
			throw new IllegalArgumentException("--threads must be at least 1. Requested: " + threads);

		return new ForkJoinPool(threads);
	}

	public static CommandLine createCommandLine(LogService log)
	{
		final CommandLine commandLine = new CommandLine(new MineralMapCli(log));
		commandLine.setExecutionExceptionHandler((e, cmd, parseResult) -> {
			cmd.getErr().println("mineralmap: " + messageOf(e));
			cmd.getErr().flush();
			if(log.isDebug())
				log.debug(e);

			return EXIT_FAILURE;
		});

		return commandLine;
	}

	static String messageOf(Throwable e)
	{
		final String message = e.getMessage();
		return message == null || message.isEmpty() ? e.getClass().getSimpleName() : message;
	}

	public static void main(String[] args)
	{
		System.exit(createCommandLine(new StderrLogService()).execute(args));
	}

	static class VersionProvider implements CommandLine.IVersionProvider
	{
		@Override
		public String[] getVersion()
		{
			return new String[] {MineralMapVersion.getNameAndVersion()};
		}
	}
}
