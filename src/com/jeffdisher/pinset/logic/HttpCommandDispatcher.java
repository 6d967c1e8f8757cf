package com.jeffdisher.pinset.logic;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import org.eclipse.jetty.client.HttpClient;
import org.eclipse.jetty.client.api.ContentResponse;
import org.eclipse.jetty.client.api.Request;
import org.eclipse.jetty.client.util.FutureResponseListener;
import org.eclipse.jetty.http.HttpMethod;
import org.eclipse.jetty.http.HttpStatus;

import com.eclipsesource.json.Json;
import com.eclipsesource.json.JsonValue;
import com.eclipsesource.json.ParseException;
import com.jeffdisher.pinset.types.CancelSignal;
import com.jeffdisher.pinset.types.IpfsConnectionException;
import com.jeffdisher.pinset.types.OperationCancelledException;
import com.jeffdisher.pinset.utils.Assert;


/**
 * Runs commands against the IPFS daemon's HTTP API ("/api/v0/") using the Jetty HTTP client.
 * Every command is a POST with its arguments in the query string, which is how the daemon expects all RPC calls, even
 * those which only read.
 * The client is created here but isn't started until "start()" is called.
 */
public class HttpCommandDispatcher implements ICommandDispatcher
{
	public static final String API_PATH_PREFIX = "/api/v0/";

	// Establishing the connection should be quick since the daemon is normally local.
	private static final long CONNECTION_TIMEOUT_MILLIS = 10_000L;
	// Pinning causes the daemon to fetch the entire DAG before it answers, which can take a very long time, so we are
	// generous here (this isn't based on any solid science so it may change).
	private static final long IDLE_TIMEOUT_MILLIS = 30L * 60L * 1000L;
	// Listing a large pinset produces a large response (the default limit in Jetty is 2 MiB).
	private static final int MAX_RESPONSE_BYTES = 16 * 1024 * 1024;

	private final String _host;
	private final int _port;
	private final ILogger _logger;
	private final HttpClient _client;

	/**
	 * Creates the dispatcher but doesn't start it (call "start()").
	 * 
	 * @param host The host of the daemon's API server.
	 * @param port The port of the daemon's API server.
	 * @param logger The logger for request-level details (written as verbose).
	 */
	public HttpCommandDispatcher(String host, int port, ILogger logger)
	{
		Assert.assertTrue(null != host);
		Assert.assertTrue(port > 0);
		Assert.assertTrue(null != logger);
		_host = host;
		_port = port;
		_logger = logger;
		_client = new HttpClient();
		_client.setConnectTimeout(CONNECTION_TIMEOUT_MILLIS);
		_client.setIdleTimeout(IDLE_TIMEOUT_MILLIS);
	}

	/**
	 * Starts the HTTP client.
	 * 
	 * @throws Exception Something went wrong.
	 */
	public void start() throws Exception
	{
		_client.start();
	}

	/**
	 * Stops the HTTP client.  Any in-flight requests are aborted.
	 * 
	 * @throws Exception Something went wrong.
	 */
	public void stop() throws Exception
	{
		_client.stop();
	}

	@Override
	public String execute(String command, CancelSignal cancel, String argument, String queryString) throws IpfsConnectionException, OperationCancelledException
	{
		Assert.assertTrue(null != command);
		Assert.assertTrue(null != cancel);
		if (cancel.isCancelled())
		{
			throw new OperationCancelledException(command);
		}
		
		Request request = _client.newRequest(_host, _port)
				.method(HttpMethod.POST)
				.path(API_PATH_PREFIX + command)
				.idleTimeout(IDLE_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)
		;
		if (null != argument)
		{
			request.param("arg", argument);
		}
		_addQueryParams(request, queryString);
		_logger.logVerbose("POST " + request.getURI());
		
		FutureResponseListener listener = new FutureResponseListener(request, MAX_RESPONSE_BYTES);
		Runnable onCancel = () -> request.abort(new OperationCancelledException(command));
		cancel.registerOnCancel(onCancel);
		ContentResponse response;
		try
		{
			request.send(listener);
			response = listener.get();
		}
		catch (InterruptedException e)
		{
			// Interruption is treated as cancellation of this one call.
			request.abort(e);
			Thread.currentThread().interrupt();
			throw new OperationCancelledException(command);
		}
		catch (ExecutionException e)
		{
			if (cancel.isCancelled())
			{
				throw new OperationCancelledException(command);
			}
			// Connection refused, timeouts, and malformed HTTP all end up here.
			Throwable cause = (null != e.getCause())
					? e.getCause()
					: e
			;
			throw new IpfsConnectionException(command, argument, cause);
		}
		finally
		{
			cancel.unregisterOnCancel(onCancel);
		}
		
		int status = response.getStatus();
		String body = response.getContentAsString();
		_logger.logVerbose("Status " + status + " from \"" + command + "\" (" + body.length() + " chars)");
		if (HttpStatus.OK_200 != status)
		{
			throw new IpfsConnectionException(command, argument, _describeError(status, body));
		}
		return body;
	}


	private static void _addQueryParams(Request request, String queryString)
	{
		if ((null != queryString) && !queryString.isEmpty())
		{
			for (String pair : queryString.split("&"))
			{
				int equals = pair.indexOf('=');
				if (equals > 0)
				{
					request.param(pair.substring(0, equals), pair.substring(equals + 1));
				}
				else if (!pair.isEmpty())
				{
					// A bare flag, which the daemon treats as "true".
					request.param(pair, "true");
				}
			}
		}
	}

	private static String _describeError(int status, String body)
	{
		// The daemon normally answers with {"Message": "...", "Code": 0, "Type": "error"} but proxies or old versions
		// may just send text.
		String message = null;
		try
		{
			JsonValue parsed = Json.parse(body);
			if (parsed.isObject())
			{
				JsonValue messageValue = parsed.asObject().get("Message");
				if ((null != messageValue) && messageValue.isString())
				{
					message = messageValue.asString();
				}
			}
		}
		catch (ParseException e)
		{
			message = null;
		}
		if (null == message)
		{
			message = body.trim();
		}
		return "HTTP " + status + (message.isEmpty() ? "" : " - " + message);
	}
}
