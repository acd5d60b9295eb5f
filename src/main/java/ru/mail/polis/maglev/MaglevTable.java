/*
 * Copyright 2021 (c) Odnoklassniki
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ru.mail.polis.maglev;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.hash.Funnel;
import com.google.common.math.IntMath;
import com.google.common.primitives.UnsignedLongs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.mail.polis.maglev.hash.HashStrategy;
import ru.mail.polis.maglev.hash.KeyFunnels;

import javax.annotation.Nonnull;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Maglev lookup table (Eisenbud et al., "Maglev: A Fast and Reliable Software Network Load Balancer").
 * <p>
 * Every node walks its own permutation of the table slots, and the nodes take turns claiming
 * the first free slot they see until the table is full. A key is routed by hashing it onto a slot.
 * The table size is prime so that every permutation covers all slots.
 * <p>
 * Instances are immutable and safe to share between threads. To change the node set build a new
 * table with the same {@link #capacity()} (see {@link #rebuild(Iterable)}) and swap the reference;
 * a different capacity reshuffles almost every key.
 *
 * @param <N> node type, identified by what its funnel writes rather than by position
 */
public final class MaglevTable<N> implements ConsistentHasher<N> {
    private static final Logger LOG = LoggerFactory.getLogger(MaglevTable.class);

    private final ImmutableList<N> nodes;
    private final int[] lookup;
    private final Funnel<? super N> nodeFunnel;
    private final MaglevConfig config;

    private MaglevTable(ImmutableList<N> nodes, int[] lookup, Funnel<? super N> nodeFunnel, MaglevConfig config) {
        this.nodes = nodes;
        this.lookup = lookup;
        this.nodeFunnel = nodeFunnel;
        this.config = config;
    }

    public static MaglevTable<String> forStrings(@Nonnull Iterable<String> nodes) {
        return create(nodes, KeyFunnels.string(), MaglevConfig.DEFAULT);
    }

    public static MaglevTable<String> forStrings(@Nonnull Iterable<String> nodes, int capacity) {
        return create(nodes, KeyFunnels.string(), new MaglevConfig(capacity));
    }

    public static <N> MaglevTable<N> create(@Nonnull Iterable<? extends N> nodes,
                                            @Nonnull Funnel<? super N> nodeFunnel) {
        return create(nodes, nodeFunnel, MaglevConfig.DEFAULT);
    }

    public static <N> MaglevTable<N> create(@Nonnull Iterable<? extends N> nodes,
                                            @Nonnull Funnel<? super N> nodeFunnel,
                                            int capacity) {
        return create(nodes, nodeFunnel, new MaglevConfig(capacity));
    }

    /**
     * Builds a table over {@code nodes}. Duplicate nodes are kept and compete for slots as distinct nodes.
     *
     * @throws NullPointerException if any node is null
     * @throws ArithmeticException  if the derived capacity does not fit into an int
     */
    public static <N> MaglevTable<N> create(@Nonnull Iterable<? extends N> nodes,
                                            @Nonnull Funnel<? super N> nodeFunnel,
                                            @Nonnull MaglevConfig config) {
        checkNotNull(nodeFunnel, "nodeFunnel");
        checkNotNull(config, "config");
        ImmutableList<N> nodeList = ImmutableList.copyOf(nodes);
        if (nodeList.isEmpty()) {
            LOG.debug("No nodes given, built an empty table");
            return new MaglevTable<>(nodeList, new int[0], nodeFunnel, config);
        }

        long start = System.nanoTime();
        int size = tableSize(nodeList.size(), config);
        if (size < nodeList.size()) {
            LOG.warn("Table of {} slots is smaller than the node count {}, {} nodes will get no slots",
                    size, nodeList.size(), nodeList.size() - size);
        }

        ImmutableList.Builder<Permutation> permutations = ImmutableList.builderWithExpectedSize(nodeList.size());
        for (N node : nodeList) {
            permutations.add(Permutation.of(node, nodeFunnel, config.hashStrategy, size));
        }
        int[] lookup = TablePopulator.populate(permutations.build(), size);

        LOG.debug("Built table of {} slots for {} nodes in {} us",
                size, nodeList.size(), TimeUnit.NANOSECONDS.toMicros(System.nanoTime() - start));
        return new MaglevTable<>(nodeList, lookup, nodeFunnel, config);
    }

    private static int tableSize(int nodeCount, MaglevConfig config) {
        int requested = config.capacity > 0
                ? config.capacity
                : IntMath.checkedMultiply(nodeCount, config.capacityFactor);
        return Primes.nextPrime(requested);
    }

    /**
     * New table over {@code newNodes} with this table's capacity, funnel and hash strategy,
     * so keys whose node survived mostly stay where they are.
     */
    public MaglevTable<N> rebuild(@Nonnull Iterable<? extends N> newNodes) {
        MaglevConfig rebuildConfig = isEmpty() ? config : config.withCapacity(capacity());
        return create(newNodes, nodeFunnel, rebuildConfig);
    }

    @Nonnull
    @Override
    public ImmutableList<N> nodes() {
        return nodes;
    }

    @Override
    public int capacity() {
        return lookup.length;
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    @Nonnull
    public HashStrategy hashStrategy() {
        return config.hashStrategy;
    }

    /**
     * Looks up a key of the node type, hashed with the node funnel.
     */
    @Nonnull
    public Optional<N> get(@Nonnull N key) {
        return get(key, nodeFunnel);
    }

    @Nonnull
    @Override
    public <K> Optional<N> get(@Nonnull K key, @Nonnull Funnel<? super K> keyFunnel) {
        if (isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(nodes.get(lookup[slotOf(key, keyFunnel)]));
    }

    /**
     * Like {@link #get(Object)} for callers that know the table is not empty.
     *
     * @throws EmptyTableException if the table has no nodes
     */
    @Nonnull
    public N route(@Nonnull N key) {
        return route(key, nodeFunnel);
    }

    @Nonnull
    public <K> N route(@Nonnull K key, @Nonnull Funnel<? super K> keyFunnel) {
        return get(key, keyFunnel).orElseThrow(() -> new EmptyTableException("No nodes to route " + key + " to"));
    }

    /**
     * Keys are hashed with the same seed as node offsets.
     */
    <K> int slotOf(K key, Funnel<? super K> keyFunnel) {
        checkNotNull(key, "key");
        long hash = config.hashStrategy.digest(Permutation.OFFSET_SEED, key, keyFunnel);
        return (int) UnsignedLongs.remainder(hash, lookup.length);
    }

    /**
     * Copy of the table: node index for every slot.
     */
    public int[] lookupTable() {
        return lookup.clone();
    }

    /**
     * Number of slots owned by each node, indexed like {@link #nodes()}.
     */
    public int[] slotCounts() {
        int[] counts = new int[nodes.size()];
        for (int nodeIndex : lookup) {
            counts[nodeIndex]++;
        }
        return counts;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("nodes", nodes.size())
                .add("capacity", capacity())
                .add("hashStrategy", config.hashStrategy)
                .toString();
    }
}
