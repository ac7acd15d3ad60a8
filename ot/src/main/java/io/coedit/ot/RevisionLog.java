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

import io.coedit.util.ApplicationSettings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static io.coedit.util.Preconditions.checkArgument;
import static io.coedit.util.Preconditions.checkNotNull;

/**
 * Append-only, ordered history of accepted operations.
 * <p>
 * Revision {@code r} is the state after the {@code r}-th accepted operation, so the entry
 * stored for revision {@code r} is the operation that led from {@code r - 1} to {@code r}.
 * A log restored from a snapshot starts at the snapshot revision and cannot serve
 * requests for earlier revisions.
 *
 * @param <D> type of operations
 */
public final class RevisionLog<D> {
	public static final int INITIAL_CAPACITY = ApplicationSettings.getInt(RevisionLog.class, "initialCapacity", 256);

	private final long startRevision;
	private final List<D> entries = new ArrayList<>(INITIAL_CAPACITY);

	private RevisionLog(long startRevision) {
		this.startRevision = startRevision;
	}

	public static <D> RevisionLog<D> create() {
		return new RevisionLog<>(0);
	}

	public static <D> RevisionLog<D> create(long startRevision) {
		checkArgument(startRevision >= 0, "Start revision cannot be negative");
		return new RevisionLog<>(startRevision);
	}

	/**
	 * Appends an operation and returns the revision it produced.
	 */
	public synchronized long append(D op) {
		entries.add(checkNotNull(op));
		return startRevision + entries.size();
	}

	public synchronized long getRevision() {
		return startRevision + entries.size();
	}

	/**
	 * Number of operations held, which is the revision minus the start revision.
	 */
	public synchronized int size() {
		return entries.size();
	}

	public long getStartRevision() {
		return startRevision;
	}

	public synchronized boolean contains(long revision) {
		return revision >= startRevision && revision <= startRevision + entries.size();
	}

	/**
	 * Returns the operation that produced the given revision.
	 */
	public synchronized D get(long revision) {
		checkArgument(revision > startRevision && revision <= startRevision + entries.size(),
				"Revision %s is not in the log [%s, %s]", revision, startRevision + 1, startRevision + entries.size());
		return entries.get((int) (revision - startRevision - 1));
	}

	/**
	 * Returns, in order, every operation committed after the given revision.
	 */
	public synchronized List<D> entriesSince(long revision) {
		checkArgument(contains(revision), "Revision %s is not in the log [%s, %s]", revision, startRevision, startRevision + entries.size());
		int from = (int) (revision - startRevision);
		if (from == entries.size()) {
			return Collections.emptyList();
		}
		return Collections.unmodifiableList(new ArrayList<>(entries.subList(from, entries.size())));
	}

	/**
	 * Replays the whole log onto a freshly initialized state.
	 */
	public <S extends OTState<D>> S replay(S state) {
		state.init();
		return replayOnto(state, startRevision, getRevision());
	}

	/**
	 * Applies entries {@code (fromRevision, toRevision]} onto a state that is at {@code fromRevision}.
	 */
	public <S extends OTState<D>> S replayOnto(S state, long fromRevision, long toRevision) {
		checkArgument(fromRevision <= toRevision, "Cannot replay backwards from %s to %s", fromRevision, toRevision);
		List<D> ops = entriesSince(fromRevision);
		checkArgument(toRevision - fromRevision <= ops.size(), "Revision %s is not in the log", toRevision);
		for (int i = 0; i < toRevision - fromRevision; i++) {
			state.apply(ops.get(i));
		}
		return state;
	}

	@Override
	public synchronized String toString() {
		return "RevisionLog{start=" + startRevision + ", revision=" + (startRevision + entries.size()) + '}';
	}
}
