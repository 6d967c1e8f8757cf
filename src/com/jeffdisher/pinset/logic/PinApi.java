package com.jeffdisher.pinset.logic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.eclipsesource.json.Json;
import com.eclipsesource.json.JsonObject;
import com.eclipsesource.json.JsonValue;
import com.eclipsesource.json.ParseException;
import com.jeffdisher.pinset.types.CancelSignal;
import com.jeffdisher.pinset.types.FailedDeserializationException;
import com.jeffdisher.pinset.types.IpfsConnectionException;
import com.jeffdisher.pinset.types.IpfsFile;
import com.jeffdisher.pinset.types.OperationCancelledException;
import com.jeffdisher.pinset.types.PinMode;
import com.jeffdisher.pinset.types.PinnedObject;
import com.jeffdisher.pinset.types.UnknownPinModeException;
import com.jeffdisher.pinset.utils.Assert;


/**
 * Manages the pinset of the IPFS daemon:  the set of objects which are stored locally and never garbage collected.
 * This object holds no state beyond the dispatcher so it can be shared between threads.  Nothing is cached:  every
 * call is a round-trip to the daemon, which owns the pinset.
 */
public class PinApi
{
	public static final String COMMAND_ADD = "pin/add";
	public static final String COMMAND_LIST = "pin/ls";
	public static final String COMMAND_REMOVE = "pin/rm";

	private final ICommandDispatcher _dispatcher;

	public PinApi(ICommandDispatcher dispatcher)
	{
		Assert.assertTrue(null != dispatcher);
		_dispatcher = dispatcher;
	}

	/**
	 * Adds an object to the pinset, which also causes the daemon to fetch and store it.
	 *
	 * @param path A path to an existing object, such as "QmXarR6rgkQ2fDSHjSY5nM2kuCXKYGViky5nohtwgF65Ec/about" or
	 * just a CID.
	 * @param recursive True to also pin everything the object links to, false to only pin the object itself.
	 * @param cancel Cancelling this abandons the call.
	 * @return The objects the daemon reports as pinned (the mode is not reported, so it is null).
	 * @throws IpfsConnectionException The daemon couldn't be reached or rejected the path.
	 * @throws FailedDeserializationException The response didn't have the expected "Pins" array.
	 * @throws OperationCancelledException The call was cancelled before the daemon answered.
	 */
	public List<PinnedObject> add(String path, boolean recursive, CancelSignal cancel) throws IpfsConnectionException, FailedDeserializationException, OperationCancelledException
	{
		Assert.assertTrue(null != path);
		String json = _dispatcher.execute(COMMAND_ADD, cancel, path, _recursiveOption(recursive));
		return _parsePins(COMMAND_ADD, json);
	}

	public List<PinnedObject> add(String path) throws IpfsConnectionException, FailedDeserializationException, OperationCancelledException
	{
		return add(path, true, new CancelSignal());
	}

	public List<PinnedObject> add(IpfsFile cid, boolean recursive, CancelSignal cancel) throws IpfsConnectionException, FailedDeserializationException, OperationCancelledException
	{
		Assert.assertTrue(null != cid);
		return add(cid.toSafeString(), recursive, cancel);
	}

	public List<PinnedObject> add(IpfsFile cid) throws IpfsConnectionException, FailedDeserializationException, OperationCancelledException
	{
		return add(cid, true, new CancelSignal());
	}

	/**
	 * Lists the objects in the pinset.
	 *
	 * @param mode The kind of pins to return (ALL returns every kind).
	 * @param cancel Cancelling this abandons the call.
	 * @return The pinned objects, each with the mode the daemon reported for it (order is not meaningful).
	 * @throws IpfsConnectionException The daemon couldn't be reached or rejected the request.
	 * @throws FailedDeserializationException The response didn't have the expected "Keys" object.
	 * @throws UnknownPinModeException The daemon reported a pin type we don't know.
	 * @throws OperationCancelledException The call was cancelled before the daemon answered.
	 */
	public List<PinnedObject> list(PinMode mode, CancelSignal cancel) throws IpfsConnectionException, FailedDeserializationException, UnknownPinModeException, OperationCancelledException
	{
		Assert.assertTrue(null != mode);
		String json = _dispatcher.execute(COMMAND_LIST, cancel, null, "type=" + mode.remoteName);
		JsonObject keys = _requireObject(COMMAND_LIST, _parseRoot(COMMAND_LIST, json), "Keys");
		List<PinnedObject> pins = new ArrayList<>();
		for (JsonObject.Member member : keys)
		{
			if (!member.getValue().isObject())
			{
				throw new FailedDeserializationException(COMMAND_LIST, "entry for \"" + member.getName() + "\" is not an object");
			}
			JsonValue type = member.getValue().asObject().get("Type");
			if ((null == type) || !type.isString())
			{
				throw new FailedDeserializationException(COMMAND_LIST, "entry for \"" + member.getName() + "\" has no \"Type\" string");
			}
			PinMode pinMode = PinMode.fromRemoteName(type.asString());
			// "all" is only a filter so it can't describe a specific pin.
			if ((null == pinMode) || (PinMode.ALL == pinMode))
			{
				throw new UnknownPinModeException(type.asString());
			}
			pins.add(new PinnedObject(member.getName(), pinMode));
		}
		return Collections.unmodifiableList(pins);
	}

	public List<PinnedObject> list() throws IpfsConnectionException, FailedDeserializationException, UnknownPinModeException, OperationCancelledException
	{
		return list(PinMode.ALL, new CancelSignal());
	}

	/**
	 * Removes an object from the pinset, allowing the daemon to reclaim its space on the next garbage collection.
	 *
	 * @param path A path to an existing object, such as "QmXarR6rgkQ2fDSHjSY5nM2kuCXKYGViky5nohtwgF65Ec/about" or
	 * just a CID.
	 * @param recursive True to remove a recursive pin, false to only remove a direct one.
	 * @param cancel Cancelling this abandons the call.
	 * @return The objects the daemon reports as unpinned (the mode is not reported, so it is null).
	 * @throws IpfsConnectionException The daemon couldn't be reached or rejected the path (including if it wasn't
	 * pinned).
	 * @throws FailedDeserializationException The response didn't have the expected "Pins" array.
	 * @throws OperationCancelledException The call was cancelled before the daemon answered.
	 */
	public List<PinnedObject> remove(String path, boolean recursive, CancelSignal cancel) throws IpfsConnectionException, FailedDeserializationException, OperationCancelledException
	{
		Assert.assertTrue(null != path);
		String json = _dispatcher.execute(COMMAND_REMOVE, cancel, path, _recursiveOption(recursive));
		return _parsePins(COMMAND_REMOVE, json);
	}

	public List<PinnedObject> remove(String path) throws IpfsConnectionException, FailedDeserializationException, OperationCancelledException
	{
		return remove(path, true, new CancelSignal());
	}

	public List<PinnedObject> remove(IpfsFile cid, boolean recursive, CancelSignal cancel) throws IpfsConnectionException, FailedDeserializationException, OperationCancelledException
	{
		Assert.assertTrue(null != cid);
		return remove(cid.toSafeString(), recursive, cancel);
	}

	public List<PinnedObject> remove(IpfsFile cid) throws IpfsConnectionException, FailedDeserializationException, OperationCancelledException
	{
		return remove(cid, true, new CancelSignal());
	}


	private static String _recursiveOption(boolean recursive)
	{
		return "recursive=" + Boolean.toString(recursive);
	}

	private static List<PinnedObject> _parsePins(String command, String json) throws FailedDeserializationException
	{
		JsonObject root = _parseRoot(command, json);
		JsonValue pins = root.get("Pins");
		if ((null == pins) || !pins.isArray())
		{
			throw new FailedDeserializationException(command, "missing \"Pins\" array");
		}
		List<PinnedObject> result = new ArrayList<>();
		for (JsonValue pin : pins.asArray())
		{
			if (!pin.isString())
			{
				throw new FailedDeserializationException(command, "\"Pins\" entry is not a string: " + pin);
			}
			result.add(new PinnedObject(pin.asString(), null));
		}
		return Collections.unmodifiableList(result);
	}

	private static JsonObject _parseRoot(String command, String json) throws FailedDeserializationException
	{
		JsonValue root;
		try
		{
			root = Json.parse(json);
		}
		catch (ParseException e)
		{
			throw new FailedDeserializationException(command, e);
		}
		if (!root.isObject())
		{
			throw new FailedDeserializationException(command, "response is not a JSON object");
		}
		return root.asObject();
	}

	private static JsonObject _requireObject(String command, JsonObject root, String field) throws FailedDeserializationException
	{
		JsonValue value = root.get(field);
		if ((null == value) || !value.isObject())
		{
			throw new FailedDeserializationException(command, "missing \"" + field + "\" object");
		}
		return value.asObject();
	}
}
