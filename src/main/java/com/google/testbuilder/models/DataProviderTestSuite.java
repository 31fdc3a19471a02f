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
import com.google.common.collect.ImmutableSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The tests expanded from one data-provider driven test method, named
 * {@code <className>::<methodName>}.
 * <p>
 * Children keep the order they were added in, which is the order the data provider produced
 * its rows. Every child is tagged with a set of groups the runner can filter on.
 */
public final class DataProviderTestSuite implements Test {

    public static final String DEFAULT_GROUP = "default";

    private final String name;
    private final List<Entry> entries = new ArrayList<>();

    private record Entry(Test test, ImmutableSet<String> groups) {
    }

    public DataProviderTestSuite(String name) {
        Preconditions.checkNotNull(name, "name must not be null");
        this.name = name;
    }

    public static DataProviderTestSuite forSpec(TestSpec spec) {
        Preconditions.checkNotNull(spec, "spec must not be null");
        return new DataProviderTestSuite(spec.displayName());
    }

    /**
     * Adds a child test. A test added without any group is put into {@value #DEFAULT_GROUP}.
     *
     * @param test   the child
     * @param groups the groups the child belongs to
     */
    public void addTest(Test test, Set<String> groups) {
        Preconditions.checkNotNull(test, "test must not be null");
        Preconditions.checkNotNull(groups, "groups must not be null");
        ImmutableSet<String> tags = groups.isEmpty() ? ImmutableSet.of(DEFAULT_GROUP) : ImmutableSet.copyOf(groups);
        entries.add(new Entry(test, tags));
    }

    @Override
    public Kind kind() {
        return Kind.SUITE;
    }

    @Override
    public String getName() {
        return name;
    }

    public List<Test> tests() {
        return entries.stream().map(Entry::test).toList();
    }

    /**
     * @param test a child of this suite, matched by identity
     * @return the groups the child was added with
     * @throws IllegalArgumentException if the test was never added to this suite
     */
    public Set<String> groupsOf(Test test) {
        return entries.stream()
                .filter(e -> e.test() == test)
                .findFirst()
                .map(Entry::groups)
                .orElseThrow(() -> new IllegalArgumentException(
                        "%s is not part of suite %s".formatted(test.getName(), name)));
    }

    /**
     * @return every group used by at least one child, in first-use order
     */
    public Set<String> getGroups() {
        ImmutableSet.Builder<String> groups = ImmutableSet.builder();
        entries.forEach(e -> groups.addAll(e.groups()));
        return groups.build();
    }

    public List<Test> testsInGroup(String group) {
        return entries.stream()
                .filter(e -> e.groups().contains(group))
                .map(Entry::test)
                .toList();
    }

    @Override
    public int count() {
        return entries.stream().mapToInt(e -> e.test().count()).sum();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof DataProviderTestSuite that)) {
            return false;
        }
        return name.equals(that.name) && entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, entries);
    }

    @Override
    public String toString() {
        return "DataProviderTestSuite[name=" + name + ", tests=" + tests() + ']';
    }
}
