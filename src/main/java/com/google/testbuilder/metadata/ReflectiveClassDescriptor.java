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
import com.google.testbuilder.models.TestCase;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * A {@link ClassDescriptor} backed by reflection on a loaded class.
 * <p>
 * The class's constructor is taken to be its widest non-private constructor. Instances are
 * created with the constructor whose arity matches the arguments. Without an exact match the
 * widest narrower constructor is used and the surplus arguments are dropped, and a plain
 * instance may also be created through a {@code (String name)} constructor, which then
 * receives {@code null}.
 */
public class ReflectiveClassDescriptor implements ClassDescriptor {

    private final Class<?> type;

    public ReflectiveClassDescriptor(Class<?> type) {
        Preconditions.checkNotNull(type, "type must not be null");
        this.type = type;
    }

    @Override
    public String getName() {
        return type.getName();
    }

    @Override
    public boolean isInstantiable() {
        if (hasNoConstructors()) {
            return false;
        }
        int modifiers = type.getModifiers();
        if (Modifier.isAbstract(modifiers) || type.isEnum() || type.isAnonymousClass() || type.isLocalClass()) {
            return false;
        }
        if (type.isMemberClass() && !Modifier.isStatic(modifiers)) {
            return false;
        }
        return TestCase.class.isAssignableFrom(type) && !usableConstructors().isEmpty();
    }

    @Override
    public OptionalInt constructorParameterCount() {
        if (hasNoConstructors()) {
            return OptionalInt.empty();
        }
        List<Constructor<?>> candidates = usableConstructors();
        if (candidates.isEmpty()) {
            candidates = Arrays.asList(type.getDeclaredConstructors());
        }
        return candidates.stream()
                .mapToInt(Constructor::getParameterCount)
                .max();
    }

    @Override
    public TestCase instantiate(List<Object> arguments) {
        Preconditions.checkNotNull(arguments, "arguments must not be null");
        Constructor<?> constructor = findConstructor(arguments.size())
                .orElseThrow(() -> new TestInstantiationException(
                        "No constructor of %s accepts %d arguments".formatted(getName(), arguments.size())));
        Object[] actual = new Object[constructor.getParameterCount()];
        for (int i = 0; i < actual.length && i < arguments.size(); i++) {
            actual[i] = arguments.get(i);
        }
        try {
            constructor.trySetAccessible();
            return (TestCase) constructor.newInstance(actual);
        } catch (InvocationTargetException e) {
            throw new TestInstantiationException(
                    "Constructor of %s failed: %s".formatted(getName(), e.getTargetException().getMessage()),
                    e.getTargetException());
        } catch (ReflectiveOperationException | IllegalArgumentException | ClassCastException e) {
            throw new TestInstantiationException("Cannot create an instance of %s".formatted(getName()), e);
        }
    }

    private Optional<Constructor<?>> findConstructor(int argumentCount) {
        List<Constructor<?>> constructors = usableConstructors();
        Optional<Constructor<?>> exact = constructors.stream()
                .filter(c -> c.getParameterCount() == argumentCount)
                .findFirst();
        if (exact.isPresent()) {
            return exact;
        }
        Optional<Constructor<?>> narrower = constructors.stream()
                .filter(c -> c.getParameterCount() < argumentCount)
                .max(Comparator.comparingInt(Constructor::getParameterCount));
        if (narrower.isPresent() || argumentCount > 0) {
            return narrower;
        }
        return constructors.stream()
                .filter(c -> c.getParameterCount() == 1 && c.getParameterTypes()[0] == String.class)
                .findFirst();
    }

    private List<Constructor<?>> usableConstructors() {
        return Arrays.stream(type.getDeclaredConstructors())
                .filter(c -> !Modifier.isPrivate(c.getModifiers()))
                .toList();
    }

    private boolean hasNoConstructors() {
        return type.isInterface() || type.isPrimitive() || type.isArray();
    }

    @Override
    public String toString() {
        return "ReflectiveClassDescriptor[" + getName() + ']';
    }
}
