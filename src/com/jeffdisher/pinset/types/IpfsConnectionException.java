package com.jeffdisher.pinset.types;


/**
 * Thrown when a command couldn't be run on the IPFS daemon:  it wasn't reachable, timed out, or reported an error for
 * the request (a malformed path or an object which doesn't exist, for example).
 * The command and its argument are kept since the daemon's own messages rarely say what was being attempted.
 */
public class IpfsConnectionException extends PinsetException
{
	private static final long serialVersionUID = 1L;

	private final String _command;
	private final String _argument;

	/**
	 * Creates the exception for a command which failed in the transport (connection refused, timeout, etc).
	 * 
	 * @param command The daemon command which failed (such as "pin/add").
	 * @param argument The argument given to the command (can be null).
	 * @param cause The underlying failure.
	 */
	public IpfsConnectionException(String command, String argument, Throwable cause)
	{
		super(_describe(command, argument) + ": " + cause.getLocalizedMessage(), cause);
		_command = command;
		_argument = argument;
	}

	/**
	 * Creates the exception for a command which reached the daemon but which it rejected.
	 * 
	 * @param command The daemon command which failed (such as "pin/add").
	 * @param argument The argument given to the command (can be null).
	 * @param daemonMessage The error description returned by the daemon.
	 */
	public IpfsConnectionException(String command, String argument, String daemonMessage)
	{
		super(_describe(command, argument) + ": " + daemonMessage);
		_command = command;
		_argument = argument;
	}

	public String getCommand()
	{
		return _command;
	}

	public String getArgument()
	{
		return _argument;
	}


	private static String _describe(String command, String argument)
	{
		return (null != argument)
				? "IPFS command \"" + command + "\" failed for \"" + argument + "\""
				: "IPFS command \"" + command + "\" failed"
		;
	}
}
