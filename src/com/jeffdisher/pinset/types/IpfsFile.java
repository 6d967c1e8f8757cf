package com.jeffdisher.pinset.types;

import java.util.regex.Pattern;


/**
 * A wrapper for a validated IPFS CID, so that identifiers can be passed around without re-checking them.
 * Only the string encodings the daemon hands back are accepted:  CIDv0 (base58btc, "Qm" prefix) and CIDv1 in the
 * default base32 multibase ("b" prefix).
 */
public class IpfsFile
{
	private static final Pattern CID_V0 = Pattern.compile("Qm[1-9A-HJ-NP-Za-km-z]{44}");
	// A CIDv1 is a version byte, a codec, and a multihash, which is never shorter than this in base32.
	private static final Pattern CID_V1_BASE32 = Pattern.compile("b[a-z2-7]{50,}");

	/**
	 * @param rawCid The string encoding of the IPFS CID.
	 * @return The IpfsFile or null if the encoding was invalid.
	 */
	public static IpfsFile fromIpfsCid(String rawCid)
	{
		IpfsFile file = null;
		if ((null != rawCid) && (CID_V0.matcher(rawCid).matches() || CID_V1_BASE32.matcher(rawCid).matches()))
		{
			file = new IpfsFile(rawCid);
		}
		return file;
	}


	private final String _cid;

	private IpfsFile(String cid)
	{
		_cid = cid;
	}

	/**
	 * @return The canonical string encoding of the CID, suitable for use as a daemon command argument.
	 */
	public String toSafeString()
	{
		return _cid;
	}

	@Override
	public boolean equals(Object obj)
	{
		boolean isEqual = false;
		if (obj instanceof IpfsFile)
		{
			isEqual = _cid.equals(((IpfsFile)obj)._cid);
		}
		return isEqual;
	}

	@Override
	public int hashCode()
	{
		return _cid.hashCode();
	}

	@Override
	public String toString()
	{
		return "IpfsFile(" + _cid + ")";
	}
}
