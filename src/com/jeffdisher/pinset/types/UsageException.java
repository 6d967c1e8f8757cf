package com.jeffdisher.pinset.types;


/**
 * This exception type is used when the tool has been told to do something invalid, either on the command-line or
 * through its environment.
 */
public class UsageException extends PinsetException
{
	private static final long serialVersionUID = 1L;

	public UsageException(String message)
	{
		super(message);
	}
}
