package com.jeffdisher.pinset.types;


/**
 * Superclass of all the checked exceptions thrown by the pinset library and tool.
 */
public class PinsetException extends Exception
{
	private static final long serialVersionUID = 1L;

	public PinsetException(String message)
	{
		super(message);
	}

	public PinsetException(String message, Throwable cause)
	{
		super(message, cause);
	}
}
