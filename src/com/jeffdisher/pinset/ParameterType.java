package com.jeffdisher.pinset;

import com.jeffdisher.pinset.types.PinMode;
import com.jeffdisher.pinset.types.UsageException;


public enum ParameterType
{
	STRING("string"
			, (String arg) -> arg
	),
	BOOLEAN("true|false"
			, (String arg) -> {
				// Boolean.parseBoolean treats anything other than "true" as false, which hides typos.
				if ("true".equalsIgnoreCase(arg))
				{
					return true;
				}
				else if ("false".equalsIgnoreCase(arg))
				{
					return false;
				}
				else
				{
					throw new UsageException("Not a boolean: \"" + arg + "\"");
				}
			}
	),
	PIN_MODE("direct|recursive|indirect|all"
			, (String arg) -> {
				PinMode mode = PinMode.fromRemoteName(arg);
				// We only accept the exact names here, not the "indirect through" form the daemon sometimes reports.
				if ((null == mode) || !mode.remoteName.equalsIgnoreCase(arg))
				{
					throw new UsageException("Unknown pin type: \"" + arg + "\"");
				}
				return mode;
			}
	),
	;

	public final String shortDescription;
	private final Parser<?> _parser;

	private ParameterType(String shortDescription, Parser<?> parser)
	{
		this.shortDescription = shortDescription;
		_parser = parser;
	}

	public <T> T parse(Class<T> clazz, String arg) throws UsageException
	{
		return clazz.cast(_parser.parse(arg));
	}


	private interface Parser<R>
	{
		R parse(String arg) throws UsageException;
	}
}
