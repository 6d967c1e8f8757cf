package com.jeffdisher.pinset.commands;

import com.jeffdisher.pinset.logic.ILogger;
import com.jeffdisher.pinset.logic.PinApi;
import com.jeffdisher.pinset.types.CancelSignal;


/**
 * The resources a command needs to run.
 * 
 * @param pinApi The pin manager for the daemon the tool is connected to.
 * @param logger The logger for the command's operations.
 * @param cancel The signal which abandons the command if cancelled (the tool cancels it on shutdown).
 */
public record Context(PinApi pinApi, ILogger logger, CancelSignal cancel)
{
}
