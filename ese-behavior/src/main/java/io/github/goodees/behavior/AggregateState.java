package io.github.goodees.behavior;

/*-
 * #%L
 * ese-behavior
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import java.util.Objects;
import java.util.Optional;

/**
 * State of a single aggregate, either {@linkplain Uninitialized uninitialized} or {@linkplain Initialized initialized}
 * with a snapshot.
 *
 * <p>The identity is assigned at first contact and never changes. The snapshot is an immutable value; applying an
 * event never modifies it, rather a new state holding new snapshot is created.</p>
 *
 * @param <S> type of snapshot
 */
public abstract class AggregateState<S> {
    private final String identity;

    private AggregateState(String identity) {
        this.identity = Objects.requireNonNull(identity, "Identity must be specified");
    }

    /**
     * State of an aggregate no event was applied to.
     * @param identity the identity of the aggregate
     * @param <S> type of snapshot
     * @return uninitialized state
     */
    public static <S> AggregateState<S> uninitialized(String identity) {
        return new Uninitialized<>(identity);
    }

    /**
     * State holding a snapshot.
     * @param identity the identity of the aggregate
     * @param snapshot the snapshot, not null
     * @param <S> type of snapshot
     * @return initialized state
     */
    public static <S> AggregateState<S> initialized(String identity, S snapshot) {
        return new Initialized<>(identity, snapshot);
    }

    public final String getIdentity() {
        return identity;
    }

    public abstract StateShape getShape();

    public final boolean isInitialized() {
        return getShape() == StateShape.INITIALIZED;
    }

    /**
     * The snapshot of the aggregate.
     * @return the snapshot, empty when uninitialized
     */
    public abstract Optional<S> getSnapshot();

    /**
     * Create successor state with new snapshot. Identity is kept.
     * @param snapshot the new snapshot
     * @return initialized state
     */
    public AggregateState<S> withSnapshot(S snapshot) {
        return initialized(identity, snapshot);
    }

    public static final class Uninitialized<S> extends AggregateState<S> {
        private Uninitialized(String identity) {
            super(identity);
        }

        @Override
        public StateShape getShape() {
            return StateShape.UNINITIALIZED;
        }

        @Override
        public Optional<S> getSnapshot() {
            return Optional.empty();
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Uninitialized && getIdentity().equals(((Uninitialized<?>) o).getIdentity()));
        }

        @Override
        public int hashCode() {
            return getIdentity().hashCode();
        }

        @Override
        public String toString() {
            return "Uninitialized(" + getIdentity() + ")";
        }
    }

    public static final class Initialized<S> extends AggregateState<S> {
        private final S snapshot;

        private Initialized(String identity, S snapshot) {
            super(identity);
            this.snapshot = Objects.requireNonNull(snapshot, "Initialized state requires a snapshot");
        }

        @Override
        public StateShape getShape() {
            return StateShape.INITIALIZED;
        }

        @Override
        public Optional<S> getSnapshot() {
            return Optional.of(snapshot);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Initialized)) {
                return false;
            }
            Initialized<?> that = (Initialized<?>) o;
            return getIdentity().equals(that.getIdentity()) && snapshot.equals(that.snapshot);
        }

        @Override
        public int hashCode() {
            return 31 * getIdentity().hashCode() + snapshot.hashCode();
        }

        @Override
        public String toString() {
            return "Initialized(" + getIdentity() + ", " + snapshot + ")";
        }
    }
}
