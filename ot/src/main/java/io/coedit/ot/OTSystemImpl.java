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

import java.util.HashMap;
import java.util.Map;

import static io.coedit.util.Preconditions.checkNotNull;

public final class OTSystemImpl<D> implements OTSystem<D> {
	@FunctionalInterface
	public interface TransformFunction<D, L extends D, R extends D> {
		D transform(L left, R right);
	}

	@FunctionalInterface
	public interface EmptyPredicate<O> {
		boolean isEmpty(O op);
	}

	private static final class KeyPair {
		private final Class<?> left;
		private final Class<?> right;

		private KeyPair(Class<?> left, Class<?> right) {
			this.left = left;
			this.right = right;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			KeyPair key = (KeyPair) o;
			return left.equals(key.left) && right.equals(key.right);
		}

		@Override
		public int hashCode() {
			return 31 * left.hashCode() + right.hashCode();
		}

		@Override
		public String toString() {
			return left.getSimpleName() + "/" + right.getSimpleName();
		}
	}

	private final Map<KeyPair, TransformFunction<D, ?, ?>> transformers = new HashMap<>();
	private final Map<Class<?>, EmptyPredicate<?>> emptyPredicates = new HashMap<>();

	private OTSystemImpl() {
	}

	public static <D> OTSystemImpl<D> create() {
		return new OTSystemImpl<>();
	}

	public <L extends D, R extends D> OTSystemImpl<D> withTransformFunction(Class<L> leftType, Class<R> rightType,
			TransformFunction<D, L, R> transformer) {
		transformers.put(new KeyPair(leftType, rightType), transformer);
		return this;
	}

	public <O extends D> OTSystemImpl<D> withEmptyPredicate(Class<O> opType, EmptyPredicate<O> emptyPredicate) {
		emptyPredicates.put(opType, emptyPredicate);
		return this;
	}

	@SuppressWarnings("unchecked")
	@Override
	public D transform(D left, D right) {
		KeyPair key = new KeyPair(left.getClass(), right.getClass());
		TransformFunction<D, D, D> transformer = (TransformFunction<D, D, D>) transformers.get(key);
		checkNotNull(transformer, "No transform function registered for %s", key);
		return transformer.transform(left, right);
	}

	@SuppressWarnings("unchecked")
	@Override
	public boolean isEmpty(D op) {
		EmptyPredicate<D> emptyPredicate = (EmptyPredicate<D>) emptyPredicates.get(op.getClass());
		return emptyPredicate != null && emptyPredicate.isEmpty(op);
	}
}
