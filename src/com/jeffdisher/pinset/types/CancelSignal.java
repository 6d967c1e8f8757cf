package com.jeffdisher.pinset.types;

import java.util.ArrayList;
import java.util.List;

import com.jeffdisher.pinset.utils.Assert;


/**
 * A cooperative cancellation scope passed into calls which wait on the daemon.
 * Once cancelled, a signal stays cancelled.  The same signal can be given to several calls in order to cancel them
 * together, but it has no effect on calls it wasn't given to.
 */
public class CancelSignal
{
	private boolean _isCancelled;
	private final List<Runnable> _onCancel = new ArrayList<>();

	/**
	 * Cancels the signal, running any registered callbacks on the calling thread.  Calling this more than once has no
	 * further effect.
	 */
	public void cancel()
	{
		List<Runnable> toRun;
		synchronized (this)
		{
			if (_isCancelled)
			{
				toRun = List.of();
			}
			else
			{
				_isCancelled = true;
				toRun = new ArrayList<>(_onCancel);
				_onCancel.clear();
			}
		}
		// Run these outside the monitor since they may block (aborting a network request, for example).
		for (Runnable callback : toRun)
		{
			callback.run();
		}
	}

	public synchronized boolean isCancelled()
	{
		return _isCancelled;
	}

	/**
	 * Registers a callback to run when the signal is cancelled.  If it has already been cancelled, the callback is run
	 * immediately, on the calling thread.
	 * 
	 * @param onCancel The callback to run once.
	 */
	public void registerOnCancel(Runnable onCancel)
	{
		Assert.assertTrue(null != onCancel);
		boolean runNow;
		synchronized (this)
		{
			runNow = _isCancelled;
			if (!runNow)
			{
				_onCancel.add(onCancel);
			}
		}
		if (runNow)
		{
			onCancel.run();
		}
	}

	/**
	 * Removes a callback which is no longer needed (typically since the call it would cancel has completed).  This is
	 * safe to call even if the callback already ran.
	 * 
	 * @param onCancel The callback previously passed to registerOnCancel.
	 */
	public synchronized void unregisterOnCancel(Runnable onCancel)
	{
		_onCancel.remove(onCancel);
	}
}
