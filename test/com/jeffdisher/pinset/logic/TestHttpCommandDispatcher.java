package com.jeffdisher.pinset.logic;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.net.ServerSocket;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.server.handler.AbstractHandler;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.eclipsesource.json.JsonArray;
import com.eclipsesource.json.JsonObject;
import com.jeffdisher.pinset.testutils.MockKeys;
import com.jeffdisher.pinset.testutils.SilentLogger;
import com.jeffdisher.pinset.types.CancelSignal;
import com.jeffdisher.pinset.types.IpfsConnectionException;
import com.jeffdisher.pinset.types.OperationCancelledException;
import com.jeffdisher.pinset.types.PinMode;
import com.jeffdisher.pinset.types.PinnedObject;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;


public class TestHttpCommandDispatcher
{
	private Server _server;
	private FakeDaemon _daemon;
	private int _port;

	@Before
	public void startServer() throws Exception
	{
		_daemon = new FakeDaemon();
		_server = new Server(0);
		_server.setHandler(_daemon);
		_server.start();
		_port = ((ServerConnector)_server.getConnectors()[0]).getLocalPort();
	}

	@After
	public void stopServer() throws Exception
	{
		_daemon.release.countDown();
		_server.stop();
	}

	@Test
	public void requestShape() throws Throwable
	{
		ByteArrayOutputStream captured = new ByteArrayOutputStream();
		StandardLogger logger = StandardLogger.topLogger(new PrintStream(captured), true);
		HttpCommandDispatcher dispatcher = new HttpCommandDispatcher("127.0.0.1", _port, logger);
		dispatcher.start();
		String response = dispatcher.execute("pin/add", new CancelSignal(), MockKeys.F1.toSafeString(), "recursive=false");
		dispatcher.stop();

		Assert.assertEquals("{\"Pins\":[\"" + MockKeys.F1.toSafeString() + "\"]}", response);
		Assert.assertEquals("POST", _daemon.lastMethod);
		Assert.assertEquals("/api/v0/pin/add", _daemon.lastTarget);
		Assert.assertEquals(MockKeys.F1.toSafeString(), _daemon.lastArg);
		Assert.assertEquals("false", _daemon.lastRecursive);
		String log = new String(captured.toByteArray());
		Assert.assertTrue(log.contains("POST http://127.0.0.1:" + _port + "/api/v0/pin/add"));
		Assert.assertTrue(log.contains("Status 200"));
	}

	@Test
	public void argumentIsEncoded() throws Throwable
	{
		HttpCommandDispatcher dispatcher = new HttpCommandDispatcher("127.0.0.1", _port, new SilentLogger());
		dispatcher.start();
		String path = "/ipfs/" + MockKeys.F2.toSafeString() + "/a dir/file&name";
		dispatcher.execute("pin/add", new CancelSignal(), path, "recursive=true");
		dispatcher.stop();
		Assert.assertEquals(path, _daemon.lastArg);
		Assert.assertEquals("true", _daemon.lastRecursive);
	}

	@Test
	public void throughPinApi() throws Throwable
	{
		HttpCommandDispatcher dispatcher = new HttpCommandDispatcher("127.0.0.1", _port, new SilentLogger());
		dispatcher.start();
		PinApi api = new PinApi(dispatcher);
		List<PinnedObject> listed = api.list(PinMode.DIRECT, new CancelSignal());
		Assert.assertEquals("direct", _daemon.lastType);
		Assert.assertEquals(List.of(new PinnedObject(MockKeys.F1.toSafeString(), PinMode.DIRECT)), listed);

		List<PinnedObject> removed = api.remove(MockKeys.F3);
		dispatcher.stop();
		Assert.assertEquals(List.of(new PinnedObject(MockKeys.F3.toSafeString(), null)), removed);
		Assert.assertEquals("/api/v0/pin/rm", _daemon.lastTarget);
	}

	@Test
	public void daemonError() throws Throwable
	{
		HttpCommandDispatcher dispatcher = new HttpCommandDispatcher("127.0.0.1", _port, new SilentLogger());
		dispatcher.start();
		try
		{
			dispatcher.execute("pin/rm", new CancelSignal(), "QmBogus", "recursive=true");
			Assert.fail();
		}
		catch (IpfsConnectionException e)
		{
			Assert.assertEquals("pin/rm", e.getCommand());
			Assert.assertEquals("QmBogus", e.getArgument());
			Assert.assertTrue(e.getMessage().contains("HTTP 500"));
			Assert.assertTrue(e.getMessage().contains("invalid path \"QmBogus\""));
		}
		finally
		{
			dispatcher.stop();
		}
	}

	@Test
	public void nonJsonError() throws Throwable
	{
		HttpCommandDispatcher dispatcher = new HttpCommandDispatcher("127.0.0.1", _port, new SilentLogger());
		dispatcher.start();
		try
		{
			dispatcher.execute("missing", new CancelSignal(), null, null);
			Assert.fail();
		}
		catch (IpfsConnectionException e)
		{
			Assert.assertTrue(e.getMessage().contains("HTTP 404 - 404 page not found"));
		}
		finally
		{
			dispatcher.stop();
		}
	}

	@Test
	public void unreachableDaemon() throws Throwable
	{
		int closedPort;
		try (ServerSocket socket = new ServerSocket(0))
		{
			closedPort = socket.getLocalPort();
		}
		HttpCommandDispatcher dispatcher = new HttpCommandDispatcher("127.0.0.1", closedPort, new SilentLogger());
		dispatcher.start();
		try
		{
			dispatcher.execute("pin/ls", new CancelSignal(), null, "type=all");
			Assert.fail();
		}
		catch (IpfsConnectionException e)
		{
			Assert.assertEquals("pin/ls", e.getCommand());
			Assert.assertNotNull(e.getCause());
		}
		finally
		{
			dispatcher.stop();
		}
	}

	@Test
	public void alreadyCancelled() throws Throwable
	{
		HttpCommandDispatcher dispatcher = new HttpCommandDispatcher("127.0.0.1", _port, new SilentLogger());
		dispatcher.start();
		CancelSignal cancel = new CancelSignal();
		cancel.cancel();
		try
		{
			dispatcher.execute("pin/add", cancel, MockKeys.F1.toSafeString(), "recursive=true");
			Assert.fail();
		}
		catch (OperationCancelledException e)
		{
			// Expected.
		}
		finally
		{
			dispatcher.stop();
		}
		// Nothing should have been sent.
		Assert.assertNull(_daemon.lastTarget);
	}

	@Test
	public void cancelInFlight() throws Throwable
	{
		HttpCommandDispatcher dispatcher = new HttpCommandDispatcher("127.0.0.1", _port, new SilentLogger());
		dispatcher.start();
		CancelSignal cancel = new CancelSignal();
		CancelSignal bystander = new CancelSignal();
		// The daemon cancels the signal once the request arrives, then stalls until released.
		_daemon.cancelOnSlow = cancel;
		try
		{
			dispatcher.execute("slow", cancel, null, null);
			Assert.fail();
		}
		catch (OperationCancelledException e)
		{
			// Expected.
		}
		_daemon.release.countDown();
		Assert.assertTrue(cancel.isCancelled());
		Assert.assertFalse(bystander.isCancelled());

		// The dispatcher is still usable for other calls.
		String response = dispatcher.execute("pin/add", bystander, MockKeys.F2.toSafeString(), "recursive=true");
		Assert.assertEquals("{\"Pins\":[\"" + MockKeys.F2.toSafeString() + "\"]}", response);
		dispatcher.stop();
	}


	@Test
	public void interruptWhileWaiting() throws Throwable
	{
		HttpCommandDispatcher dispatcher = new HttpCommandDispatcher("127.0.0.1", _port, new SilentLogger());
		dispatcher.start();
		CancelSignal cancel = new CancelSignal();
		Thread caller = Thread.currentThread();
		Thread interrupter = new Thread(() -> {
			try
			{
				_daemon.stalled.await();
			}
			catch (InterruptedException e)
			{
				throw new AssertionError(e);
			}
			caller.interrupt();
		});
		interrupter.start();
		try
		{
			dispatcher.execute("stall", cancel, null, null);
			Assert.fail();
		}
		catch (OperationCancelledException e)
		{
			// Expected.
		}
		// The flag must still be set for the caller (this also clears it).
		Assert.assertTrue(Thread.interrupted());
		interrupter.join();
		// Only the call was abandoned, not the signal.
		Assert.assertFalse(cancel.isCancelled());
		_daemon.release.countDown();
		dispatcher.stop();
	}

	@Test
	public void responseTooLarge() throws Throwable
	{
		HttpCommandDispatcher dispatcher = new HttpCommandDispatcher("127.0.0.1", _port, new SilentLogger());
		dispatcher.start();
		try
		{
			dispatcher.execute("pin/ls", new CancelSignal(), "huge", "type=all");
			Assert.fail();
		}
		catch (IpfsConnectionException e)
		{
			Assert.assertEquals("pin/ls", e.getCommand());
			Assert.assertNotNull(e.getCause());
		}
		finally
		{
			dispatcher.stop();
		}
	}


	private static class FakeDaemon extends AbstractHandler
	{
		// Just over the 16 MiB the dispatcher will buffer.
		private static final int HUGE_CHUNK_COUNT = 257;
		private static final int HUGE_CHUNK_BYTES = 64 * 1024;

		public final CountDownLatch release = new CountDownLatch(1);
		public final CountDownLatch stalled = new CountDownLatch(1);
		public volatile CancelSignal cancelOnSlow;
		public volatile String lastMethod;
		public volatile String lastTarget;
		public volatile String lastArg;
		public volatile String lastRecursive;
		public volatile String lastType;

		@Override
		public void handle(String target, Request baseRequest, HttpServletRequest request, HttpServletResponse response) throws IOException
		{
			lastMethod = request.getMethod();
			lastTarget = target;
			lastArg = request.getParameter("arg");
			lastRecursive = request.getParameter("recursive");
			lastType = request.getParameter("type");
			baseRequest.setHandled(true);

			if ("/api/v0/stall".equals(target))
			{
				stalled.countDown();
				try
				{
					release.await(10, TimeUnit.SECONDS);
				}
				catch (InterruptedException e)
				{
					throw new IOException(e);
				}
				_writeJson(response, HttpServletResponse.SC_OK, "{}");
			}
			else if ("/api/v0/pin/ls".equals(target) && "huge".equals(lastArg))
			{
				byte[] chunk = new byte[HUGE_CHUNK_BYTES];
				Arrays.fill(chunk, (byte)' ');
				response.setStatus(HttpServletResponse.SC_OK);
				response.setContentType("application/json");
				for (int i = 0; i < HUGE_CHUNK_COUNT; ++i)
				{
					response.getOutputStream().write(chunk);
				}
			}
			else if ("/api/v0/slow".equals(target))
			{
				cancelOnSlow.cancel();
				try
				{
					release.await(10, TimeUnit.SECONDS);
				}
				catch (InterruptedException e)
				{
					throw new IOException(e);
				}
				_writeJson(response, HttpServletResponse.SC_OK, "{}");
			}
			else if (("/api/v0/pin/add".equals(target) || "/api/v0/pin/rm".equals(target)) && lastArg.startsWith("Qm") && !lastArg.equals("QmBogus"))
			{
				JsonArray pins = new JsonArray();
				pins.add(lastArg);
				JsonObject root = new JsonObject();
				root.add("Pins", pins);
				_writeJson(response, HttpServletResponse.SC_OK, root.toString());
			}
			else if ("/api/v0/pin/add".equals(target) || "/api/v0/pin/rm".equals(target))
			{
				if (lastArg.startsWith("/ipfs/"))
				{
					_writeJson(response, HttpServletResponse.SC_OK, "{\"Pins\":[]}");
				}
				else
				{
					JsonObject error = new JsonObject();
					error.add("Message", "invalid path \"" + lastArg + "\": selected encoding not supported");
					error.add("Code", 0);
					error.add("Type", "error");
					_writeJson(response, HttpServletResponse.SC_INTERNAL_SERVER_ERROR, error.toString());
				}
			}
			else if ("/api/v0/pin/ls".equals(target))
			{
				JsonObject entry = new JsonObject();
				entry.add("Type", "direct");
				JsonObject keys = new JsonObject();
				keys.add(MockKeys.F1.toSafeString(), entry);
				JsonObject root = new JsonObject();
				root.add("Keys", keys);
				_writeJson(response, HttpServletResponse.SC_OK, root.toString());
			}
			else
			{
				response.setStatus(HttpServletResponse.SC_NOT_FOUND);
				response.setContentType("text/plain");
				response.getWriter().print("404 page not found");
			}
		}

		private static void _writeJson(HttpServletResponse response, int status, String json) throws IOException
		{
			response.setStatus(status);
			response.setContentType("application/json");
			response.getWriter().print(json);
		}
	}
}
