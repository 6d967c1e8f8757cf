package com.jeffdisher.pinset.types;


/**
 * Thrown when a call was abandoned because its CancelSignal was cancelled (or its thread interrupted) before the
 * daemon answered.
 * Note that the daemon may still have applied the change:  cancellation only stops the wait.
 */
public class OperationCancelledException extends PinsetException
{
	private static final long serialVersionUID = 1L;

	public OperationCancelledException(String command)
	{
		super("IPFS command \"" + command + "\" was cancelled");
	}
}
