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

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.Executor;

/**
 * Executor that holds tasks until {@link #runAll()} is called.
 */
final class ManualExecutor implements Executor {
	private final Queue<Runnable> tasks = new ArrayDeque<>();

	@Override
	public synchronized void execute(Runnable command) {
		tasks.add(command);
	}

	public void runAll() {
		Runnable task;
		while ((task = poll()) != null) {
			task.run();
		}
	}

	public synchronized int size() {
		return tasks.size();
	}

	private synchronized Runnable poll() {
		return tasks.poll();
	}
}
