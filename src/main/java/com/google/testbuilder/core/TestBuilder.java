package com.google.testbuilder.core;
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
import com.google.common.base.Strings;
import com.google.testbuilder.metadata.AnnotationMetadataResolver;
import com.google.testbuilder.metadata.ClassDescriptor;
import com.google.testbuilder.metadata.ClassDescriptorRegistry;
import com.google.testbuilder.metadata.MetadataResolver;
import com.google.testbuilder.metadata.ResolverSettings;
import com.google.testbuilder.models.DataProviderTestSuite;
import com.google.testbuilder.models.DataSet;
import com.google.testbuilder.models.DiagnosticTest;
import com.google.testbuilder.models.ExecutionPolicy;
import com.google.testbuilder.models.ProvidedData;
import com.google.testbuilder.models.Test;
import com.google.testbuilder.models.TestCase;
import com.google.testbuilder.models.TestSpec;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.logging.Logger;

/**
 * TestBuilder turns a declared test method into the {@link Test} a runner executes.
 * <p>
 * The result is one of:
 * <ul>
 * <li>a plain {@link TestCase} named after the method, for classes whose constructor takes at
 * most one parameter</li>
 * <li>a {@link DataProviderTestSuite} with one case per data set, for classes whose constructor
 * takes the data</li>
 * <li>a {@link DiagnosticTest} when the class cannot be instantiated or its data provider fails</li>
 * </ul>
 * Every case built by one call carries the same {@link ExecutionPolicy}.
 * <p>
 * The builder keeps no state between calls and may be shared between threads as long as its
 * {@link MetadataResolver} and the descriptors passed in can be.
 */
public class TestBuilder {

    private final Logger logger = Logger.getLogger(this.getClass().getName());
    private final MetadataResolver metadataResolver;
    private final ClassDescriptorRegistry registry;

    private TestBuilder(Builder builder) {
        this.metadataResolver = builder.metadataResolver
                .orElseGet(() -> new AnnotationMetadataResolver(builder.settings.orElseGet(ResolverSettings::defaults)));
        this.registry = builder.registry.orElseGet(ClassDescriptorRegistry::new);
    }

    public static class Builder {
        private Optional<MetadataResolver> metadataResolver = Optional.empty();
        private Optional<ResolverSettings> settings = Optional.empty();
        private Optional<ClassDescriptorRegistry> registry = Optional.empty();

        public Builder withMetadataResolver(MetadataResolver metadataResolver) {
            this.metadataResolver = Optional.ofNullable(metadataResolver);
            return this;
        }

        /**
         * Settings for the default annotation based resolver. Ignored when a resolver is given.
         */
        public Builder withResolverSettings(ResolverSettings settings) {
            this.settings = Optional.ofNullable(settings);
            return this;
        }

        public Builder withRegistry(ClassDescriptorRegistry registry) {
            this.registry = Optional.ofNullable(registry);
            return this;
        }

        public TestBuilder build() {
            Preconditions.checkArgument(metadataResolver.isEmpty() || settings.isEmpty(),
                    "Provide either a metadata resolver or settings for the default resolver, not both");
            return new TestBuilder(this);
        }
    }

    /**
     * Builds the test for a method of a class registered in this builder's registry.
     *
     * @param spec the class and method
     * @return the built test; a warning if the class is not registered
     * @throws NoValidTestException if the class has no constructor
     */
    public Test build(TestSpec spec) {
        Preconditions.checkNotNull(spec, "spec must not be null");
        return registry.lookup(spec.className())
                .map(descriptor -> build(descriptor, spec.methodName()))
                .orElseGet(() -> {
                    logger.fine(() -> "No descriptor registered for %s".formatted(spec.className()));
                    return cannotInstantiate(spec.className());
                });
    }

    /**
     * Builds the test for one method of a class.
     *
     * @param theClass   the class declaring the test method
     * @param methodName the test method
     * @return the built test
     * @throws NoValidTestException if the class has no constructor
     */
    public Test build(ClassDescriptor theClass, String methodName) {
        Preconditions.checkNotNull(theClass, "theClass must not be null");
        Preconditions.checkNotNull(methodName, "methodName must not be null");
        TestSpec spec = new TestSpec(theClass.getName(), methodName);

        if (!theClass.isInstantiable()) {
            logger.fine(() -> "%s is not instantiable".formatted(spec.className()));
            return cannotInstantiate(spec.className());
        }

        ExecutionPolicy policy = resolvePolicy(spec);
        Set<String> groups = metadataResolver.groups(spec.className(), spec.methodName());

        OptionalInt parameterCount = theClass.constructorParameterCount();
        if (parameterCount.isEmpty()) {
            throw new NoValidTestException(spec);
        }

        Test test;
        // TestCase() or TestCase(name)
        if (parameterCount.getAsInt() < 2) {
            test = theClass.instantiate(List.of());
        } else {
            test = buildFromProvidedData(theClass, spec, policy, groups);
        }

        if (test instanceof TestCase testCase) {
            testCase.setName(methodName);
            policy.applyTo(testCase);
        }
        return test;
    }

    private ExecutionPolicy resolvePolicy(TestSpec spec) {
        String className = spec.className();
        String methodName = spec.methodName();
        return ExecutionPolicy.of(
                metadataResolver.backupSettings(className, methodName),
                metadataResolver.preserveGlobalState(className, methodName),
                metadataResolver.processIsolation(className, methodName),
                metadataResolver.classProcessIsolation(className, methodName));
    }

    private Test buildFromProvidedData(ClassDescriptor theClass, TestSpec spec, ExecutionPolicy policy,
                                       Set<String> groups) {
        ProvidedData data = metadataResolver.providedData(spec.className(), spec.methodName());
        if (data instanceof ProvidedData.None) {
            logger.fine(() -> "%s declares no data provider, building a plain test".formatted(spec));
            return theClass.instantiate(List.of());
        }

        DataProviderTestSuite suite = DataProviderTestSuite.forSpec(spec);
        Optional<DiagnosticTest> diagnostic = diagnosticFor(spec, data);
        if (diagnostic.isPresent()) {
            suite.addTest(diagnostic.get(), groups);
            return suite;
        }

        DataSet dataSet = ((ProvidedData.Rows) data).dataSet();
        if (dataSet.isEmpty()) {
            suite.addTest(DiagnosticTest.warning("No tests found in suite \"%s\".".formatted(suite.getName())), groups);
            return suite;
        }
        for (DataSet.Row row : dataSet) {
            TestCase test = theClass.instantiate(List.of(spec.methodName(), row.arguments(), row.key()));
            policy.applyTo(test);
            suite.addTest(test, groups);
        }
        logger.fine(() -> "Built %d tests for %s".formatted(dataSet.size(), spec));
        return suite;
    }

    private Optional<DiagnosticTest> diagnosticFor(TestSpec spec, ProvidedData data) {
        if (data instanceof ProvidedData.Incomplete incomplete) {
            return Optional.of(DiagnosticTest.incomplete(spec, withNestedMessage(
                    "Test for %s marked incomplete by data provider".formatted(spec.displayName()),
                    incomplete.message())));
        }
        if (data instanceof ProvidedData.Skipped skipped) {
            return Optional.of(DiagnosticTest.skipped(spec, withNestedMessage(
                    "Test for %s skipped by data provider".formatted(spec.displayName()),
                    skipped.message())));
        }
        if (data instanceof ProvidedData.Invalid invalid) {
            logger.warning(() -> "Invalid data provider for %s: %s".formatted(spec, invalid.message()));
            return Optional.of(DiagnosticTest.warning(withNestedMessage(
                    "The data provider specified for %s is invalid.".formatted(spec.displayName()),
                    invalid.message())));
        }
        return Optional.empty();
    }

    private static String withNestedMessage(String message, String nested) {
        return Strings.isNullOrEmpty(nested) ? message : message + "\n" + nested;
    }

    private static DiagnosticTest cannotInstantiate(String className) {
        return DiagnosticTest.warning("Cannot instantiate class \"%s\".".formatted(className));
    }
}
