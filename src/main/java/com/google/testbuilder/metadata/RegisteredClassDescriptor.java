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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Supplier;

/**
 * A {@link ClassDescriptor} assembled from factories registered ahead of time, for test classes
 * that should not be created through reflection.
 *
 * <pre>{@code
 * ClassDescriptor descriptor = new RegisteredClassDescriptor.Builder("com.example.MathTest")
 *         .withPlainFactory(MathTest::new)
 *         .withDataFactory(MathTest::new)
 *         .build();
 * }</pre>
 */
public final class RegisteredClassDescriptor implements ClassDescriptor {

    /** Creates a test fed by a data provider. */
    @FunctionalInterface
    public interface DataFactory {
        TestCase create(String name, List<Object> data, Object dataName);
    }

    private static final int DATA_CONSTRUCTOR_ARITY = 3;

    private final String name;
    private final boolean instantiable;
    private final Optional<Supplier<? extends TestCase>> plainFactory;
    private final Optional<DataFactory> dataFactory;

    private RegisteredClassDescriptor(Builder builder) {
        this.name = builder.name;
        this.instantiable = builder.instantiable;
        this.plainFactory = builder.plainFactory;
        this.dataFactory = builder.dataFactory;
    }

    public static class Builder {
        private final String name;
        private boolean instantiable = true;
        private Optional<Supplier<? extends TestCase>> plainFactory = Optional.empty();
        private Optional<DataFactory> dataFactory = Optional.empty();

        public Builder(String name) {
            Preconditions.checkNotNull(name, "name must not be null");
            this.name = name;
        }

        public Builder withPlainFactory(Supplier<? extends TestCase> plainFactory) {
            Preconditions.checkNotNull(plainFactory);
            this.plainFactory = Optional.of(plainFactory);
            return this;
        }

        public Builder withDataFactory(DataFactory dataFactory) {
            Preconditions.checkNotNull(dataFactory);
            this.dataFactory = Optional.of(dataFactory);
            return this;
        }

        /**
         * Describes a class that exists but cannot be instantiated, such as an abstract base test.
         */
        public Builder notInstantiable() {
            this.instantiable = false;
            return this;
        }

        public RegisteredClassDescriptor build() {
            return new RegisteredClassDescriptor(this);
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isInstantiable() {
        return instantiable && (plainFactory.isPresent() || dataFactory.isPresent());
    }

    @Override
    public OptionalInt constructorParameterCount() {
        if (dataFactory.isPresent()) {
            return OptionalInt.of(DATA_CONSTRUCTOR_ARITY);
        }
        return plainFactory.isPresent() ? OptionalInt.of(0) : OptionalInt.empty();
    }

    @Override
    public TestCase instantiate(List<Object> arguments) {
        Preconditions.checkNotNull(arguments, "arguments must not be null");
        if (arguments.isEmpty()) {
            return plainFactory
                    .<TestCase>map(Supplier::get)
                    .orElseThrow(() -> new TestInstantiationException(
                            "No plain factory registered for %s".formatted(name)));
        }
        if (arguments.size() != DATA_CONSTRUCTOR_ARITY) {
            throw new TestInstantiationException("%s accepts no arguments or (name, data, dataName), got %d arguments"
                    .formatted(name, arguments.size()));
        }
        DataFactory factory = dataFactory.orElseThrow(() -> new TestInstantiationException(
                "No data factory registered for %s".formatted(name)));
        if (!(arguments.get(1) instanceof List<?> data)) {
            throw new TestInstantiationException("Data for %s must be a List".formatted(name));
        }
        return factory.create((String) arguments.get(0), new ArrayList<>(data), arguments.get(2));
    }

    @Override
    public String toString() {
        return "RegisteredClassDescriptor[" + name + ']';
    }
}
