package com.jeffdisher.pinset.logic;

import java.io.PrintStream;


public class StandardLogger implements ILogger
{
	public static StandardLogger topLogger(PrintStream stream, boolean verbose)
	{
		return new StandardLogger(null, stream, System.err, "", verbose);
	}

	/**
	 * Creates a top-level logger with an explicit error stream (mostly useful for tests which capture the output).
	 */
	public static StandardLogger topLogger(PrintStream stream, PrintStream errorStream, boolean verbose)
	{
		return new StandardLogger(null, stream, errorStream, "", verbose);
	}


	private final StandardLogger _parent;
	private final PrintStream _stream;
	private final PrintStream _errorStream;
	private final String _prefix;
	private final boolean _verbose;
	private int _nextOperationCounter;
	private boolean _errorOccurred;

	private StandardLogger(StandardLogger parent
			, PrintStream stream
			, PrintStream errorStream
			, String prefix
			, boolean verbose
	)
	{
		_parent = parent;
		_stream = stream;
		_errorStream = errorStream;
		_prefix = prefix;
		_verbose = verbose;
		_nextOperationCounter = 0;
	}

	@Override
	public synchronized ILogger logStart(String openingMessage)
	{
		int operationNumber = _nextOperationCounter + 1;
		_nextOperationCounter += 1;
		String prefix = _prefix.isEmpty()
				? "" + operationNumber
				: _prefix + "." + operationNumber
		;
		_stream.println(">" + prefix + "> " + openingMessage);
		return new StandardLogger(this, _stream, _errorStream, prefix, _verbose);
	}

	@Override
	public void logFinish(String finishMessage)
	{
		_stream.println("<" + _prefix + "< " + finishMessage);
		if (null != _parent)
		{
			_parent._inheritError(didErrorOccur());
		}
	}

	@Override
	public void logVerbose(String message)
	{
		if (_verbose)
		{
			_stream.println("*" + _prefix + "* " + message);
		}
	}

	@Override
	public synchronized void logError(String message)
	{
		_errorStream.println(message);
		_errorOccurred = true;
	}

	@Override
	public synchronized boolean didErrorOccur()
	{
		return _errorOccurred;
	}


	private synchronized void _inheritError(boolean childError)
	{
		_errorOccurred |= childError;
	}
}
