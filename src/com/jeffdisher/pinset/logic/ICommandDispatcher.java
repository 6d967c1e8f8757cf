package com.jeffdisher.pinset.logic;

import com.jeffdisher.pinset.types.CancelSignal;
import com.jeffdisher.pinset.types.IpfsConnectionException;
import com.jeffdisher.pinset.types.OperationCancelledException;


/**
 * The abstract interface sitting on top of the IPFS daemon's HTTP command API, allowing for local testing.
 * Implementations must be safe to call concurrently from multiple threads.
 */
public interface ICommandDispatcher
{
	/**
	 * Runs a single command on the daemon and returns its response.
	 * 
	 * @param command The command path under the API root, such as "pin/add".
	 * @param cancel The signal which, if cancelled, abandons the wait for the response.
	 * @param argument The primary argument of the command, sent as "arg" (can be null if the command takes none).
	 * @param queryString Additional options as "name=value" pairs joined by "&" (can be null or empty).
	 * @return The JSON text the daemon returned.
	 * @throws IpfsConnectionException The daemon couldn't be reached or reported an error for this command.
	 * @throws OperationCancelledException The signal was cancelled before the daemon answered.
	 */
	String execute(String command, CancelSignal cancel, String argument, String queryString) throws IpfsConnectionException, OperationCancelledException;
}
