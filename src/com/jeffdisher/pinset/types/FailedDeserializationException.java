package com.jeffdisher.pinset.types;


/**
 * This exception is used when a response from the daemon couldn't be decoded since it didn't have the expected shape:
 * it wasn't JSON, or a field we rely on was missing or of the wrong type.
 */
public class FailedDeserializationException extends PinsetException
{
	private static final long serialVersionUID = 1L;

	public FailedDeserializationException(String command, String problem)
	{
		super("Response to \"" + command + "\" could not be deserialized: " + problem);
	}

	public FailedDeserializationException(String command, Throwable cause)
	{
		super("Response to \"" + command + "\" could not be deserialized: " + cause.getLocalizedMessage(), cause);
	}
}
