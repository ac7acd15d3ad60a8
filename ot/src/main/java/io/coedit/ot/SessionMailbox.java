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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Ordered hand-off of committed operations to one session.
 * <p>
 * Operations are enqueued inside the commit section, so the queue order is the revision
 * order. Draining happens on the delivery executor with at most one drainer at a time,
 * which keeps a slow consumer off the commit path.
 */
final class SessionMailbox {
	private static final Logger logger = LoggerFactory.getLogger(SessionMailbox.class);

	private final String name;
	private final Executor executor;
	private final Consumer<CommittedOperation> consumer;
	private final Consumer<Throwable> failureHandler;

	private final Queue<CommittedOperation> queue = new ConcurrentLinkedQueue<>();
	private final AtomicBoolean draining = new AtomicBoolean();
	private volatile boolean closed;

	SessionMailbox(String name, Executor executor, Consumer<CommittedOperation> consumer, Consumer<Throwable> failureHandler) {
		this.name = name;
		this.executor = executor;
		this.consumer = consumer;
		this.failureHandler = failureHandler;
	}

	void enqueue(CommittedOperation op) {
		if (!closed) {
			queue.offer(op);
		}
	}

	void flush() {
		if (closed || queue.isEmpty()) return;
		try {
			executor.execute(this::drain);
		} catch (RejectedExecutionException e) {
			logger.warn("Delivery to {} rejected by executor", name, e);
			failureHandler.accept(e);
		}
	}

	private void drain() {
		while (!closed && !queue.isEmpty() && draining.compareAndSet(false, true)) {
			try {
				CommittedOperation op;
				while (!closed && (op = queue.poll()) != null) {
					consumer.accept(op);
				}
			} catch (RuntimeException e) {
				logger.warn("Delivery to {} failed", name, e);
				failureHandler.accept(e);
			} finally {
				draining.set(false);
			}
		}
		if (closed) {
			queue.clear();
		}
	}

	void close() {
		closed = true;
		queue.clear();
	}

	int size() {
		return queue.size();
	}

	boolean isIdle() {
		return queue.isEmpty() && !draining.get();
	}

	@Override
	public String toString() {
		return "SessionMailbox{" + name + ", queued=" + queue.size() + (closed ? ", closed" : "") + '}';
	}
}
