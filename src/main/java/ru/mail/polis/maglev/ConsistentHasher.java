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

import com.google.common.hash.Funnel;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Optional;

/**
 * Maps keys to nodes so that a small change of the node set remaps only about
 * {@code K / n} of {@code K} keys.
 *
 * @param <N> node type
 */
public interface ConsistentHasher<N> {

    /**
     * Nodes in the order they were supplied.
     */
    @Nonnull
    List<N> nodes();

    /**
     * Number of slots in the lookup table, zero when there are no nodes.
     */
    int capacity();

    /**
     * Node owning {@code key}, or empty when there are no nodes.
     */
    @Nonnull
    <K> Optional<N> get(@Nonnull K key, @Nonnull Funnel<? super K> keyFunnel);
}
