package com.jeffdisher.pinset.types;


/**
 * Thrown when the daemon describes a pin with a type we don't know how to map to a PinMode.
 */
public class UnknownPinModeException extends PinsetException
{
	private static final long serialVersionUID = 1L;

	private final String _value;

	public UnknownPinModeException(String value)
	{
		super("Unknown pin type: \"" + value + "\"");
		_value = value;
	}

	/**
	 * @return The type string, exactly as the daemon sent it.
	 */
	public String getValue()
	{
		return _value;
	}
}
