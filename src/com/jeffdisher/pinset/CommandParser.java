package com.jeffdisher.pinset;

import java.io.PrintStream;

import com.jeffdisher.pinset.commands.AddPinCommand;
import com.jeffdisher.pinset.commands.ICommand;
import com.jeffdisher.pinset.commands.ListPinsCommand;
import com.jeffdisher.pinset.commands.RemovePinCommand;
import com.jeffdisher.pinset.types.PinMode;
import com.jeffdisher.pinset.types.UsageException;
import com.jeffdisher.pinset.utils.Assert;


public class CommandParser
{
	private static record PreParse(ParameterType type, String pre) {
		<T> T parse(Class<T> clazz) throws UsageException
		{
			return this.type.parse(clazz, this.pre);
		}
	};
	// A "--name <value>" pair accepted by one of the commands.
	private static record ArgParameter(String name, ParameterType type, String description) {
		String usage()
		{
			return this.name + " <" + this.type.shortDescription + ">";
		}
	};
	@java.lang.FunctionalInterface
	private static interface IParseFunction
	{
		public ICommand<?> apply(PreParse[] required, PreParse[] optional) throws UsageException;
	}
	private static enum ArgPattern
	{
		ADD_PIN("--addPin"
				, new ArgParameter[] { new ArgParameter("--path", ParameterType.STRING
					, "The CID or IPFS path of the object to pin"
				) }
				, new ArgParameter[] { new ArgParameter("--recursive", ParameterType.BOOLEAN
					, "Set to \"false\" to only pin the object itself, not what it links to (defaults to \"true\")"
				) }
				, "Adds an object to the pinset of the IPFS daemon, fetching it if it isn't already stored."
				, (PreParse[] required, PreParse[] optional) ->
		{
			String path = required[0].parse(String.class);
			boolean recursive = _optionalBoolean(optional[0], true);
			return new AddPinCommand(path, recursive);
		}),
		REMOVE_PIN("--removePin"
				, new ArgParameter[] { new ArgParameter("--path", ParameterType.STRING
					, "The CID or IPFS path of the object to unpin"
				) }
				, new ArgParameter[] { new ArgParameter("--recursive", ParameterType.BOOLEAN
					, "Set to \"false\" to remove a direct pin instead of a recursive one (defaults to \"true\")"
				) }
				, "Removes an object from the pinset of the IPFS daemon, allowing it to be garbage collected."
				, (PreParse[] required, PreParse[] optional) ->
		{
			String path = required[0].parse(String.class);
			boolean recursive = _optionalBoolean(optional[0], true);
			return new RemovePinCommand(path, recursive);
		}),
		LIST_PINS("--listPins"
				, new ArgParameter[0]
				, new ArgParameter[] { new ArgParameter("--type", ParameterType.PIN_MODE
					, "The kind of pins to list (defaults to \"all\")"
				) }
				, "Lists the objects pinned on the IPFS daemon, with how each is pinned."
				, (PreParse[] required, PreParse[] optional) ->
		{
			PinMode mode = (null != optional[0])
					? optional[0].parse(PinMode.class)
					: PinMode.ALL
			;
			return new ListPinsCommand(mode);
		}),
		;
		
		private static boolean _optionalBoolean(PreParse value, boolean ifNull) throws UsageException
		{
			return (null != value)
					? value.parse(Boolean.class)
					: ifNull
			;
		}
		
		private final String _name;
		private final ArgParameter _params[];
		private final ArgParameter _optionalParams[];
		private final String _description;
		private final IParseFunction _factory;
		
		private ArgPattern(String name
				, ArgParameter params[]
				, ArgParameter optionalParams[]
				, String description
				, IParseFunction factory)
		{
			_name = name;
			_params = params;
			_optionalParams = optionalParams;
			_description = description;
			_factory = factory;
		}
		
		private boolean isValid(String arg)
		{
			return arg.equals(_name);
		}
		
		private ICommand<?> parse(String[] args, int[] startIndex) throws UsageException
		{
			// We update the startIndex in/out parameter once we have processed all of our known options.
			// We return null if required parameters are missing, and the top-level will fail.
			int scanIndex = startIndex[0];
			Assert.assertTrue(args[scanIndex].equals(_name));
			scanIndex += 1;
			
			PreParse[] required = new PreParse[_params.length];
			PreParse[] optional = new PreParse[_optionalParams.length];
			int requiredCount = 0;
			
			boolean keepRunning = true;
			while (keepRunning && ((scanIndex + 1) < args.length))
			{
				// We will set keepRunning to true when we match something in the argument stream.
				keepRunning = false;
				String next = args[scanIndex];
				String value = args[scanIndex + 1];
				for (int i = 0; i < _params.length; ++i)
				{
					if (next.equals(_params[i].name()))
					{
						if (null == required[i])
						{
							requiredCount += 1;
						}
						required[i] = new PreParse(_params[i].type(), value);
						keepRunning = true;
						break;
					}
				}
				if (!keepRunning)
				{
					for (int i = 0; i < _optionalParams.length; ++i)
					{
						if (next.equals(_optionalParams[i].name()))
						{
							optional[i] = new PreParse(_optionalParams[i].type(), value);
							keepRunning = true;
							break;
						}
					}
				}
				if (keepRunning)
				{
					scanIndex += 2;
				}
			}
			startIndex[0] = scanIndex;
			
			return (requiredCount == required.length)
					? _factory.apply(required, optional)
					: null
			;
		}
		
		private void printUsage(PrintStream stream)
		{
			stream.print(_name + " ");
			for(ArgParameter param : _params)
			{
				stream.print(param.usage() + " ");
			}
			for(ArgParameter param : _optionalParams)
			{
				stream.print("[" + param.usage() + "] ");
			}
		}
	}

	/**
	 * Parses the command-line into a command.
	 * 
	 * @param args The arguments (must not be empty).
	 * @param errorStream The stream where details of parsing problems are written.
	 * @return The command, or null if the arguments didn't describe one.
	 * @throws UsageException A parameter value couldn't be parsed.
	 */
	public static ICommand<?> parseArgs(String[] args, PrintStream errorStream) throws UsageException
	{
		// We assume that we only get this far is we have args.
		Assert.assertTrue(args.length > 0);
		
		ICommand<?> matched = null;
		boolean didMatchPattern = false;
		for (ArgPattern pattern : ArgPattern.values())
		{
			if (pattern.isValid(args[0]))
			{
				didMatchPattern = true;
				// We use index as in/out parameter here, hence the array.
				int[] index = {0};
				matched = pattern.parse(args, index);
				if (null == matched)
				{
					// This is a valid pattern, but didn't parse, meaning required parameters were missing.
					errorStream.println("Missing command sub-arguments.");
				}
				else if (args.length != index[0])
				{
					// The input must be completely consumed or something was misspelled.
					String unhandledArgs = "Unhandled args: ";
					for (int i = index[0]; i < args.length; ++i)
					{
						unhandledArgs += args[i] + ", ";
					}
					errorStream.println(unhandledArgs);
					matched = null;
				}
				break;
			}
		}
		if (!didMatchPattern)
		{
			errorStream.println("Unknown command: " + args[0]);
		}
		return matched;
	}

	public static void printUsage(PrintStream stream)
	{
		stream.println("Commands:");
		for (ArgPattern pattern : ArgPattern.values())
		{
			stream.print("\t");
			pattern.printUsage(stream);
			stream.println();
		}
		stream.println("\t--help");
	}

	public static void printHelp(PrintStream stream)
	{
		for (ArgPattern pattern : ArgPattern.values())
		{
			stream.println();
			stream.println(pattern._name);
			stream.println("\tDescription: " + pattern._description);
			stream.println("\tRequired parameters:");
			_describeParameterList(stream, "\t\t", pattern._params);
			stream.println("\tOptional parameters:");
			_describeParameterList(stream, "\t\t", pattern._optionalParams);
		}
		stream.println();
		stream.println("Environment:");
		stream.println("\t" + EnvVars.ENV_VAR_PINSET_IPFS_CONNECT + " : The IPFS daemon API address (defaults to " + EnvVars.DEFAULT_IPFS_CONNECT + ")");
		stream.println("\t" + EnvVars.ENV_VAR_PINSET_VERBOSE + " : Set to enable verbose logging");
	}


	private static void _describeParameterList(PrintStream stream, String prefix, ArgParameter[] list)
	{
		if (0 == list.length)
		{
			stream.println(prefix + "(none)");
		}
		else
		{
			for (ArgParameter param : list)
			{
				stream.println(prefix + param.usage());
				stream.println(prefix + "\t" + param.description());
			}
		}
	}
}
