package com.jeffdisher.pinset.commands;

import java.util.List;

import com.jeffdisher.pinset.logic.ILogger;
import com.jeffdisher.pinset.types.FailedDeserializationException;
import com.jeffdisher.pinset.types.IpfsConnectionException;
import com.jeffdisher.pinset.types.OperationCancelledException;
import com.jeffdisher.pinset.types.PinMode;
import com.jeffdisher.pinset.types.PinnedObject;
import com.jeffdisher.pinset.types.UnknownPinModeException;


public record ListPinsCommand(PinMode _mode) implements ICommand<PinListResult>
{
	@Override
	public PinListResult runInContext(Context context) throws IpfsConnectionException, FailedDeserializationException, UnknownPinModeException, OperationCancelledException
	{
		ILogger log = context.logger().logStart("Listing " + _mode.remoteName + " pins...");
		List<PinnedObject> pins = context.pinApi().list(_mode, context.cancel());
		log.logFinish("Found " + pins.size() + " pin(s)");
		return new PinListResult(pins);
	}
}
