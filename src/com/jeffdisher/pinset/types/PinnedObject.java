package com.jeffdisher.pinset.types;


/**
 * An object in the daemon's pinset, as described by a single response.
 * 
 * @param id The identifier the daemon reported (typically a CID).
 * @param mode How the object is pinned, or null when the response didn't say (add and remove only report ids).
 */
public record PinnedObject(String id, PinMode mode)
{
}
