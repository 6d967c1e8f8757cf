package com.jeffdisher.pinset;

import com.jeffdisher.pinset.types.UsageException;


/**
 * Contains the environment variables the tool checks, and the parsing of the values which need it.
 */
public class EnvVars
{
	/**
	 * Set to the connect string of the IPFS daemon's API server (of the form "/ip4/127.0.0.1/tcp/5001").  If not set,
	 * DEFAULT_IPFS_CONNECT is used.
	 */
	public static final String ENV_VAR_PINSET_IPFS_CONNECT = "PINSET_IPFS_CONNECT";

	/**
	 * Enables verbose console logging.  If not set, verbose logs will not be written to the console.
	 */
	public static final String ENV_VAR_PINSET_VERBOSE = "PINSET_VERBOSE";

	/**
	 * The default IPFS API server connect string.
	 * This can be found in IPFS daemon startup output:  "API server listening on /ip4/127.0.0.1/tcp/5001".
	 */
	public static final String DEFAULT_IPFS_CONNECT = "/ip4/127.0.0.1/tcp/5001";

	/**
	 * The host and port of the daemon's API server.
	 */
	public static record ApiAddress(String host, int port) {}

	/**
	 * Parses an IPFS connect string (a multiaddr such as "/ip4/127.0.0.1/tcp/5001" or "/dns4/ipfs.local/tcp/5001").
	 * 
	 * @param connectString The multiaddr to parse.
	 * @return The host and port described.
	 * @throws UsageException The string was not a TCP address we understand.
	 */
	public static ApiAddress parseConnectString(String connectString) throws UsageException
	{
		// Splitting on "/" gives:  "", protocol, host, "tcp", port.
		String[] parts = connectString.split("/");
		if ((5 != parts.length) || !parts[0].isEmpty() || !"tcp".equals(parts[3]) || parts[2].isEmpty())
		{
			throw new UsageException("Not a valid IPFS connect string: \"" + connectString + "\"");
		}
		String protocol = parts[1];
		if (!"ip4".equals(protocol) && !"ip6".equals(protocol) && !"dns".equals(protocol) && !"dns4".equals(protocol) && !"dns6".equals(protocol))
		{
			throw new UsageException("Unsupported address protocol in IPFS connect string: \"" + protocol + "\"");
		}
		int port;
		try
		{
			port = Integer.parseInt(parts[4]);
		}
		catch (NumberFormatException e)
		{
			throw new UsageException("Not a valid port in IPFS connect string: \"" + parts[4] + "\"");
		}
		if ((port <= 0) || (port > 65535))
		{
			throw new UsageException("Port out of range in IPFS connect string: " + port);
		}
		// Jetty needs IPv6 literals in brackets.
		String host = "ip6".equals(protocol)
				? "[" + parts[2] + "]"
				: parts[2]
		;
		return new ApiAddress(host, port);
	}
}
