package com.jeffdisher.pinset.commands;

import java.util.List;

import com.jeffdisher.pinset.logic.ILogger;
import com.jeffdisher.pinset.types.FailedDeserializationException;
import com.jeffdisher.pinset.types.IpfsConnectionException;
import com.jeffdisher.pinset.types.OperationCancelledException;
import com.jeffdisher.pinset.types.PinnedObject;


public record AddPinCommand(String _path, boolean _recursive) implements ICommand<PinListResult>
{
	@Override
	public PinListResult runInContext(Context context) throws IpfsConnectionException, FailedDeserializationException, OperationCancelledException
	{
		ILogger log = context.logger().logStart("Pinning " + _path + (_recursive ? " (recursive)" : " (direct)") + "...");
		List<PinnedObject> pins = context.pinApi().add(_path, _recursive, context.cancel());
		log.logFinish("Pinned " + pins.size() + " object(s)");
		return new PinListResult(pins);
	}
}
