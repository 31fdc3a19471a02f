package com.google.testbuilder.models;
/*
Copyright 2025 Google LLC

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    https://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * The rows produced by a data provider, in the order the provider produced them.
 * <p>
 * Each row has a key, either a {@link String} or an {@link Integer}, and the argument tuple
 * handed to the test. Arguments may be {@code null}.
 */
public final class DataSet implements Iterable<DataSet.Row> {

    private static final DataSet EMPTY = new DataSet(ImmutableList.of());

    private final ImmutableList<Row> rows;

    private DataSet(ImmutableList<Row> rows) {
        this.rows = rows;
    }

    /**
     * A single data set: the key it is reported under and the arguments for the test.
     */
    public record Row(Object key, List<Object> arguments) {
        public Row {
            Preconditions.checkNotNull(key, "key must not be null");
            Preconditions.checkArgument(key instanceof String || key instanceof Integer,
                    "Data set keys must be a String or an Integer but was %s", key.getClass().getName());
            Preconditions.checkNotNull(arguments, "arguments must not be null");
            arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
        }

        /**
         * @return {@code #0} for integer keys and {@code "name"} for string keys
         */
        public String describeKey() {
            return describeKey(key);
        }

        public static String describeKey(Object key) {
            return key instanceof Integer ? "#" + key : "\"%s\"".formatted(key);
        }
    }

    public static DataSet empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Row> rows() {
        return rows;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }

    @Override
    public Iterator<Row> iterator() {
        return rows.iterator();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof DataSet that && rows.equals(that.rows);
    }

    @Override
    public int hashCode() {
        return rows.hashCode();
    }

    @Override
    public String toString() {
        return "DataSet" + rows;
    }

    public static class Builder {
        private final ImmutableList.Builder<Row> rows = ImmutableList.builder();

        public Builder add(Object key, List<?> arguments) {
            Preconditions.checkNotNull(arguments, "arguments must not be null");
            rows.add(new Row(key, new ArrayList<>(arguments)));
            return this;
        }

        public DataSet build() {
            return new DataSet(rows.build());
        }
    }
}
