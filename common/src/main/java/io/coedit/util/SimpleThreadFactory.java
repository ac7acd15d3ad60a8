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

package io.coedit.util;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import static io.coedit.util.Preconditions.checkArgument;
import static io.coedit.util.Preconditions.checkNotNull;

/**
 * Thread factory naming threads after a pattern, where {@code {}} is replaced
 * with a running counter.
 */
public final class SimpleThreadFactory implements ThreadFactory {
	public static final String NAME_PATTERN = "{}";

	private final String name;
	private boolean daemon;

	private final AtomicInteger count = new AtomicInteger(0);

	private SimpleThreadFactory(String name) {
		this.name = name;
	}

	public static SimpleThreadFactory create(String name) {
		checkNotNull(name);
		checkArgument(name.contains(NAME_PATTERN), "Thread name pattern should contain '%s'", NAME_PATTERN);
		return new SimpleThreadFactory(name);
	}

	public SimpleThreadFactory withDaemon(boolean daemon) {
		this.daemon = daemon;
		return this;
	}

	public int getCount() {
		return count.get();
	}

	@Override
	public Thread newThread(Runnable runnable) {
		Thread thread = new Thread(runnable, name.replace(NAME_PATTERN, Integer.toString(count.incrementAndGet())));
		thread.setDaemon(daemon);
		return thread;
	}
}
