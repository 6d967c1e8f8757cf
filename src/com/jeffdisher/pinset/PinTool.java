package com.jeffdisher.pinset;

import java.io.PrintStream;

import com.jeffdisher.pinset.commands.Context;
import com.jeffdisher.pinset.commands.ICommand;
import com.jeffdisher.pinset.logic.HttpCommandDispatcher;
import com.jeffdisher.pinset.logic.ICommandDispatcher;
import com.jeffdisher.pinset.logic.PinApi;
import com.jeffdisher.pinset.logic.StandardLogger;
import com.jeffdisher.pinset.types.CancelSignal;
import com.jeffdisher.pinset.types.PinsetException;
import com.jeffdisher.pinset.types.UsageException;


public class PinTool
{
	/**
	 * Exit code when there was a problem due to a static usage error.
	 */
	public static final int EXIT_STATIC_ERROR = 1;
	/**
	 * Exit code when there is a serious error which prevented the command from completing.
	 */
	public static final int EXIT_COMPLETE_ERROR = 3;

	/**
	 * The main entry-point for running the tool.  Run without arguments to see the usage string.
	 *
	 * @param args The command-line arguments.
	 */
	public static void main(String[] args)
	{
		int exitCode = run(args, System.out, System.err, System.getenv(EnvVars.ENV_VAR_PINSET_IPFS_CONNECT), (null != System.getenv(EnvVars.ENV_VAR_PINSET_VERBOSE)));
		if (0 != exitCode)
		{
			System.exit(exitCode);
		}
	}

	/**
	 * Runs the tool against a real daemon, returning the exit code instead of exiting.
	 *
	 * @param args The command-line arguments.
	 * @param output Where results and logs are written.
	 * @param error Where errors and usage are written.
	 * @param ipfsConnectString The daemon's API address (null for the default).
	 * @param verbose True if verbose logs should be written.
	 * @return The process exit code (0 on success).
	 */
	public static int run(String[] args, PrintStream output, PrintStream error, String ipfsConnectString, boolean verbose)
	{
		int exitCode = 0;
		if (0 == args.length)
		{
			CommandParser.printUsage(error);
			exitCode = EXIT_STATIC_ERROR;
		}
		else if ((1 == args.length) && "--help".equals(args[0]))
		{
			CommandParser.printUsage(output);
			CommandParser.printHelp(output);
		}
		else
		{
			try
			{
				ICommand<?> command = CommandParser.parseArgs(args, error);
				if (null == command)
				{
					CommandParser.printUsage(error);
					exitCode = EXIT_STATIC_ERROR;
				}
				else
				{
					EnvVars.ApiAddress address = EnvVars.parseConnectString((null != ipfsConnectString)
							? ipfsConnectString
							: EnvVars.DEFAULT_IPFS_CONNECT
					);
					StandardLogger logger = StandardLogger.topLogger(output, error, verbose);
					HttpCommandDispatcher dispatcher = new HttpCommandDispatcher(address.host(), address.port(), logger);
					exitCode = _runWithDispatcher(command, dispatcher, logger, output);
				}
			}
			catch (UsageException e)
			{
				error.println("Usage error in parsing command: " + e.getLocalizedMessage());
				exitCode = EXIT_STATIC_ERROR;
			}
		}
		return exitCode;
	}

	/**
	 * Runs an already-parsed command against the given dispatcher.  The dispatcher is expected to be ready for use.
	 *
	 * @param command The command to run.
	 * @param dispatcher The connection to the daemon.
	 * @param logger The top-level logger.
	 * @param output Where the result is written.
	 * @return The process exit code (0 on success).
	 */
	public static int runCommand(ICommand<?> command, ICommandDispatcher dispatcher, StandardLogger logger, PrintStream output)
	{
		int exitCode = 0;
		CancelSignal cancel = new CancelSignal();
		// If the process is asked to stop while waiting on the daemon, we abandon the call.
		Thread shutdownHook = new Thread(() -> cancel.cancel());
		Runtime.getRuntime().addShutdownHook(shutdownHook);
		try
		{
			Context context = new Context(new PinApi(dispatcher), logger, cancel);
			ICommand.Result result = command.runInContext(context);
			result.writeHumanReadable(output);
		}
		catch (PinsetException e)
		{
			logger.logError(e.getLocalizedMessage());
			exitCode = EXIT_COMPLETE_ERROR;
		}
		finally
		{
			try
			{
				Runtime.getRuntime().removeShutdownHook(shutdownHook);
			}
			catch (IllegalStateException e)
			{
				// The JVM is already shutting down, so the hook has run (or is running).
				logger.logVerbose("Shutdown in progress: " + e.getLocalizedMessage());
			}
		}
		return exitCode;
	}


	private static int _runWithDispatcher(ICommand<?> command, HttpCommandDispatcher dispatcher, StandardLogger logger, PrintStream output)
	{
		int exitCode;
		try
		{
			dispatcher.start();
		}
		catch (Exception e)
		{
			// Starting the client doesn't touch the network so this would be a local environment problem.
			logger.logError("Failed to start HTTP client: " + e.getLocalizedMessage());
			return EXIT_COMPLETE_ERROR;
		}
		try
		{
			exitCode = runCommand(command, dispatcher, logger, output);
		}
		finally
		{
			try
			{
				dispatcher.stop();
			}
			catch (Exception e)
			{
				logger.logError("Failed to stop HTTP client: " + e.getLocalizedMessage());
			}
		}
		return exitCode;
	}
}
