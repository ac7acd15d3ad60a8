/*
 * Copyright (C) 2015-2018 SoftIndex LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.coedit.ot;

import io.coedit.ot.exceptions.MalformedOperationException;
import io.coedit.ot.exceptions.RejectReason;
import io.coedit.ot.exceptions.UnauthorizedException;
import io.coedit.ot.messages.AckMessage;
import io.coedit.ot.messages.BroadcastMessage;
import io.coedit.ot.messages.RejectMessage;
import io.coedit.util.SimpleThreadFactory;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static io.coedit.test.TestUtils.assertThrows;
import static io.coedit.test.TestUtils.await;
import static java.util.Arrays.asList;
import static org.junit.Assert.*;

public final class SessionTest {
	private static final Set<Capability> ALL = EnumSet.allOf(Capability.class);

	private ManualExecutor executor;
	private AccessControlList acl;
	private SyncController controller;

	@Before
	public void setUp() {
		executor = new ManualExecutor();
		acl = AccessControlList.create("owner");
		controller = SyncController.create("doc", DocumentState.create(), TextOT.create(), acl, executor);
	}

	@Test
	public void testLocalEditIsAppliedImmediately() throws Exception {
		acl.grant("x", Capability.READ, Capability.WRITE);
		Session x = controller.connect("x", ALL, new RecordingChannel());

		x.insert(0, "abc");
		x.insert(3, "d");

		assertEquals("abcd", x.getText());
		assertEquals(2, x.getPendingOps().size());
		assertEquals(0, x.getAckedRevision());
		assertEquals("abc", controller.getDocument().getContent());
	}

	@Test
	public void testPendingEditsAreForwardedOneAtATime() throws Exception {
		acl.grant("x", Capability.READ, Capability.WRITE);
		acl.grant("y", Capability.READ, Capability.WRITE);
		RecordingChannel xChannel = new RecordingChannel();
		Session x = controller.connect("x", ALL, xChannel);
		Session y = controller.connect("y", ALL, new RecordingChannel());

		x.insert(0, "abc");
		x.insert(3, "d");
		y.insert(0, "Y");
		assertEquals("abcY", controller.getDocument().getContent());

		executor.runAll();

		assertEquals("abcdY", controller.getDocument().getContent());
		assertEquals("abcdY", x.getText());
		assertEquals("abcdY", y.getText());
		assertEquals(3, x.getAckedRevision());
		assertEquals(3, y.getAckedRevision());
		assertTrue(x.isSettled());
		assertTrue(y.isSettled());
		assertEquals(asList(new AckMessage(OpId.of("x", 1), 1), new AckMessage(OpId.of("x", 2), 3)), xChannel.getAcks());
		assertEquals(1, xChannel.getBroadcasts().size());
	}

	@Test
	public void testPendingEditsKeepTheirOwnBaseRevision() throws Exception {
		acl.grant("x", Capability.READ, Capability.WRITE);
		acl.grant("y", Capability.READ, Capability.WRITE);
		Session x = controller.connect("x", ALL, new RecordingChannel());
		Session y = controller.connect("y", ALL, new RecordingChannel());

		y.insert(0, "Y");
		executor.runAll();
		x.insert(0, "a");
		x.insert(1, "b");

		List<TextOp> pending = x.getPendingOps();
		assertEquals(2, pending.size());
		assertEquals(1, pending.get(0).getBaseRevision());
		assertEquals(1, pending.get(1).getBaseRevision());
		assertEquals(2, controller.getRevision());

		executor.runAll();
		assertEquals("abY", controller.getDocument().getContent());
		assertTrue(x.getPendingOps().isEmpty());
	}

	@Test
	public void testEditComposesAgainstCurrentView() throws Exception {
		acl.grant("x", Capability.READ, Capability.WRITE);
		acl.grant("y", Capability.READ, Capability.WRITE);
		Session x = controller.connect("x", ALL, new RecordingChannel());
		Session y = controller.connect("y", ALL, new RecordingChannel());

		y.insert(0, "hello");
		executor.runAll();

		TextOp appended = x.edit(text -> InsertOp.of(x.nextOpId(), text.length(), "!", x.getAckedRevision()));
		assertEquals(InsertOp.of(OpId.of("x", 1), 5, "!", 1), appended);
		assertNull(x.edit(text -> null));

		executor.runAll();
		assertEquals("hello!", controller.getDocument().getContent());
		assertEquals("hello!", y.getText());
	}

	@Test
	public void testRemoteOperationTransformsThroughPending() throws Exception {
		acl.grant("x", Capability.READ, Capability.WRITE);
		acl.grant("y", Capability.READ, Capability.WRITE);
		Session x = controller.connect("x", ALL, new RecordingChannel());
		Session y = controller.connect("y", ALL, new RecordingChannel());

		y.insert(0, "hello world");
		executor.runAll();
		assertEquals("hello world", x.getText());

		y.delete(0, 6);
		x.insert(11, "!");
		assertEquals("hello world!", x.getText());

		executor.runAll();

		assertEquals("world!", controller.getDocument().getContent());
		assertEquals("world!", x.getText());
		assertEquals("world!", y.getText());
	}

	@Test
	public void testAckedRevisionNeverDecreases() throws Exception {
		acl.grant("x", Capability.READ, Capability.WRITE);
		acl.grant("y", Capability.READ, Capability.WRITE);
		List<Long> observed = new ArrayList<>();
		Session[] holder = new Session[1];
		holder[0] = controller.connect("x", ALL, new RecordingChannel() {
			@Override
			public synchronized void onBroadcast(BroadcastMessage message) {
				super.onBroadcast(message);
				observed.add(holder[0].getAckedRevision());
			}

			@Override
			public synchronized void onAck(AckMessage message) {
				super.onAck(message);
				observed.add(holder[0].getAckedRevision());
			}
		});
		Session y = controller.connect("y", ALL, new RecordingChannel());

		for (int i = 0; i < 5; i++) {
			holder[0].insert(0, "x");
			y.insert(0, "y");
		}
		executor.runAll();

		assertEquals(10, observed.size());
		for (int i = 1; i < observed.size(); i++) {
			assertTrue(observed + " is not increasing", observed.get(i) > observed.get(i - 1));
		}
		assertEquals(controller.getDocument().getContent(), holder[0].getText());
		assertEquals(controller.getDocument().getContent(), y.getText());
	}

	@Test
	public void testLocalChecks() throws Exception {
		acl.grant("reader", Capability.READ);
		acl.grant("x", Capability.READ, Capability.WRITE);
		Session reader = controller.connect("reader", EnumSet.of(Capability.READ), new RecordingChannel());
		Session x = controller.connect("x", ALL, new RecordingChannel());

		UnauthorizedException denied = assertThrows(UnauthorizedException.class, () -> reader.insert(0, "a"));
		assertEquals(OpId.of("reader", 1), denied.getOpId());

		assertThrows(MalformedOperationException.class, () -> x.insert(1, "a"));
		assertThrows(MalformedOperationException.class, () -> x.delete(0, 1));
		assertThrows(MalformedOperationException.class, () -> x.delete(0, Integer.MAX_VALUE));
		assertThrows(MalformedOperationException.class, () -> x.delete(Integer.MAX_VALUE, Integer.MAX_VALUE));
		assertFalse(x.hasPendingOps());
		assertEquals(0, controller.getRevision());

		assertThrows(IllegalArgumentException.class,
				() -> x.submitLocalEdit(InsertOp.of(OpId.of("y", 1), 0, "a", 0)));
	}

	@Test
	public void testRejectionResyncsFromSnapshot() throws Exception {
		acl.grant("x", Capability.READ, Capability.WRITE);
		RecordingChannel channel = new RecordingChannel();
		Session x = controller.connect("x", ALL, channel);

		x.insert(0, "a");
		acl.revoke("x", Capability.WRITE);
		x.insert(1, "b");
		x.insert(2, "c");
		assertEquals("abc", x.getText());

		executor.runAll();

		assertEquals("a", controller.getDocument().getContent());
		assertEquals("a", x.getText());
		assertEquals(1, x.getAckedRevision());
		assertFalse(x.hasPendingOps());
		List<RejectMessage> rejects = channel.getRejects();
		assertEquals(1, rejects.size());
		assertEquals(OpId.of("x", 2), rejects.get(0).getOpId());
		assertEquals(RejectReason.UNAUTHORIZED, rejects.get(0).getReason());
	}

	@Test
	public void testCursorFollowsEdits() throws Exception {
		acl.grant("x", Capability.READ, Capability.WRITE);
		acl.grant("y", Capability.READ, Capability.WRITE);
		Session x = controller.connect("x", ALL, new RecordingChannel());
		Session y = controller.connect("y", ALL, new RecordingChannel());

		x.insert(0, "abc");
		assertEquals(Cursor.at(3), x.getCursor());
		executor.runAll();

		x.moveCursor(2);
		y.insert(0, ">>");
		executor.runAll();
		assertEquals(Cursor.at(4), x.getCursor());

		y.moveCursor(5, 2);
		x.delete(1, 3);
		executor.runAll();
		assertEquals(Cursor.of(2, 1), y.getCursor());

		assertThrows(IllegalArgumentException.class, () -> x.moveCursor(10));
	}

	@Test
	public void testClosedSessionStopsReceiving() throws Exception {
		acl.grant("x", Capability.READ, Capability.WRITE);
		acl.grant("y", Capability.READ, Capability.WRITE);
		RecordingChannel yChannel = new RecordingChannel();
		Session x = controller.connect("x", ALL, new RecordingChannel());
		Session y = controller.connect("y", ALL, yChannel);

		y.close();
		x.insert(0, "a");
		executor.runAll();

		assertFalse(y.isOpen());
		assertTrue(yChannel.getBroadcasts().isEmpty());
		assertEquals("", y.getText());
		assertThrows(IllegalStateException.class, () -> y.insert(0, "b"));
		assertEquals(1, controller.getSessions().size());
	}

	@Test
	public void testResyncReplacesView() throws Exception {
		acl.grant("x", Capability.READ, Capability.WRITE);
		Session x = controller.connect("x", ALL, new RecordingChannel());
		x.insert(0, "abc");
		x.insert(0, "zz");

		DocumentSnapshot snapshot = x.resync();

		assertEquals(DocumentSnapshot.of(1, "abc"), snapshot);
		assertEquals("abc", x.getText());
		assertEquals(1, x.getAckedRevision());
		assertFalse(x.hasPendingOps());

		executor.runAll();
		assertEquals("abc", x.getText());
		assertEquals(1, x.getAckedRevision());
	}

	@Test
	public void testConvergenceUnderConcurrentEditing() throws Exception {
		int clients = 4;
		int editsPerClient = 200;
		ExecutorService delivery = Executors.newFixedThreadPool(4, SimpleThreadFactory.create("delivery-{}").withDaemon(true));
		ExecutorService editors = Executors.newFixedThreadPool(clients);
		SyncController controller = SyncController.create("doc", DocumentState.create(), TextOT.create(),
				PermissionChecker.allowAll(), delivery);
		try {
			List<Session> sessions = new ArrayList<>();
			for (int i = 0; i < clients; i++) {
				sessions.add(controller.connect("c" + i, ALL, new RecordingChannel()));
			}

			List<Future<?>> futures = new ArrayList<>();
			for (int i = 0; i < clients; i++) {
				Session session = sessions.get(i);
				Random random = new Random(i);
				futures.add(editors.submit(() -> {
					for (int n = 0; n < editsPerClient; n++) {
						session.edit(text -> {
							int length = text.length();
							if (length > 0 && random.nextInt(3) == 0) {
								int position = random.nextInt(length);
								return DeleteOp.of(session.nextOpId(), position,
										Math.min(1 + random.nextInt(3), length - position), session.getAckedRevision());
							}
							return InsertOp.of(session.nextOpId(), random.nextInt(length + 1),
									String.valueOf((char) ('a' + random.nextInt(26))), session.getAckedRevision());
						});
					}
					return null;
				}));
			}
			for (Future<?> future : futures) {
				future.get(30, TimeUnit.SECONDS);
			}

			await(() -> sessions.stream().allMatch(s -> s.isSettled() && s.getAckedRevision() == controller.getRevision()),
					Duration.ofSeconds(30),
					() -> "Sessions did not settle: " + sessions);

			assertEquals(clients * editsPerClient, controller.getRevision());
			String content = controller.getDocument().getContent();
			for (Session session : sessions) {
				assertEquals(content, session.getText());
			}
			assertEquals(content, controller.getDocument().getLog().replay(new TextState()).getText());
		} finally {
			editors.shutdownNow();
			delivery.shutdownNow();
		}
	}
}
