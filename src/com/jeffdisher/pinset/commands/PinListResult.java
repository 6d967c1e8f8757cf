package com.jeffdisher.pinset.commands;

import java.io.PrintStream;
import java.util.List;

import com.jeffdisher.pinset.types.PinnedObject;


/**
 * The objects returned by a pin command, written one per line:  the id, then the mode if the daemon reported one.
 */
public record PinListResult(List<PinnedObject> pins) implements ICommand.Result
{
	@Override
	public void writeHumanReadable(PrintStream output)
	{
		for (PinnedObject pin : this.pins)
		{
			if (null != pin.mode())
			{
				output.println(pin.id() + " " + pin.mode().remoteName);
			}
			else
			{
				output.println(pin.id());
			}
		}
	}
}
