package com.jeffdisher.pinset.types;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;


/**
 * How the daemon retains a pinned object.  ALL is only meaningful as a listing filter:  the daemon never reports an
 * individual pin as "all" (so listing rejects it as a reported type).
 */
public enum PinMode
{
	/**
	 * Only the object itself is pinned, not its children.
	 */
	DIRECT("direct"),
	/**
	 * The object and everything reachable from it is pinned.
	 */
	RECURSIVE("recursive"),
	/**
	 * The object is retained because an ancestor is recursively pinned.
	 */
	INDIRECT("indirect"),
	ALL("all"),
	;

	// When asked about a specific path, the daemon describes indirect pins as "indirect through <parent CID>".
	private static final String INDIRECT_THROUGH_PREFIX = "indirect through ";
	private static final Map<String, PinMode> BY_REMOTE_NAME = new HashMap<>();
	static
	{
		for (PinMode mode : PinMode.values())
		{
			BY_REMOTE_NAME.put(mode.remoteName, mode);
		}
	}

	/**
	 * Looks up the mode the daemon means by the given type string, ignoring case.
	 * 
	 * @param remoteName The "Type" string from the daemon.
	 * @return The matching mode, or null if the string isn't one we know.
	 */
	public static PinMode fromRemoteName(String remoteName)
	{
		PinMode mode = null;
		if (null != remoteName)
		{
			String lower = remoteName.toLowerCase(Locale.ROOT);
			mode = lower.startsWith(INDIRECT_THROUGH_PREFIX)
					? INDIRECT
					: BY_REMOTE_NAME.get(lower)
			;
		}
		return mode;
	}


	/**
	 * The lower-case name the daemon uses for this mode, both in responses and in the "type" query parameter.
	 */
	public final String remoteName;

	private PinMode(String remoteName)
	{
		this.remoteName = remoteName;
	}
}
