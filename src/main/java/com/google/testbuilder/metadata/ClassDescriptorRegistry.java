package com.google.testbuilder.metadata;
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
import com.google.common.collect.ImmutableSortedSet;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Test classes known by name, so a build can start from a class name instead of a descriptor.
 */
public class ClassDescriptorRegistry {

    private final Logger logger = Logger.getLogger(this.getClass().getName());
    private final Map<String, ClassDescriptor> byName = new ConcurrentHashMap<>();

    public ClassDescriptorRegistry register(ClassDescriptor descriptor) {
        Preconditions.checkNotNull(descriptor, "descriptor must not be null");
        ClassDescriptor previous = byName.put(descriptor.getName(), descriptor);
        if (previous != null) {
            logger.fine(() -> "Replaced descriptor for %s: %s -> %s".formatted(descriptor.getName(), previous, descriptor));
        }
        return this;
    }

    public ClassDescriptorRegistry register(Class<?> testClass) {
        return register(new ReflectiveClassDescriptor(testClass));
    }

    public Optional<ClassDescriptor> lookup(String className) {
        Preconditions.checkNotNull(className, "className must not be null");
        return Optional.ofNullable(byName.get(className));
    }

    public Set<String> classNames() {
        return ImmutableSortedSet.copyOf(byName.keySet());
    }
}
