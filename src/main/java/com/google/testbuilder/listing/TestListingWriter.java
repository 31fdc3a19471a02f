package com.google.testbuilder.listing;
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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.google.testbuilder.models.DataProviderTestSuite;
import com.google.testbuilder.models.DiagnosticTest;
import com.google.testbuilder.models.Test;
import com.google.testbuilder.models.TestCase;

import java.util.List;

/**
 * Writes built tests as JSON, e.g.
 *
 * <pre>{@code
 * {"name":"com.example.MathTest::testAdd","kind":"SUITE","tests":[
 *   {"name":"testAdd","kind":"PARAMETERIZED_CASE","dataName":"zeros","groups":["math"],
 *    "policy":{"runTestInSeparateProcess":false,"runClassInSeparateProcess":false}}]}
 * }</pre>
 */
public class TestListingWriter {

    private final ObjectMapper objectMapper;

    public TestListingWriter() {
        this(new ObjectMapper());
    }

    public TestListingWriter(ObjectMapper objectMapper) {
        Preconditions.checkNotNull(objectMapper, "objectMapper must not be null");
        this.objectMapper = objectMapper.copy().setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * @param test a built test
     * @return the JSON listing of the test and, for suites, its children
     * @throws IllegalStateException if the listing cannot be serialized
     */
    public String write(Test test) {
        try {
            return objectMapper.writeValueAsString(toListing(test));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Error writing listing for %s: %s".formatted(test.getName(), e.getMessage()), e);
        }
    }

    public ListedTest toListing(Test test) {
        Preconditions.checkNotNull(test, "test must not be null");
        return toListing(test, null);
    }

    private static ListedTest toListing(Test test, List<String> groups) {
        String kind = test.kind().name();
        if (test instanceof TestCase testCase) {
            return new ListedTest(testCase.getName(), kind,
                    testCase.getDataName().map(String::valueOf).orElse(null),
                    null, groups, policyOf(testCase), null);
        }
        if (test instanceof DiagnosticTest diagnostic) {
            return new ListedTest(diagnostic.getName(), kind, null, diagnostic.getMessage(), groups, null, null);
        }
        DataProviderTestSuite suite = (DataProviderTestSuite) test;
        List<ListedTest> children = suite.tests().stream()
                .map(child -> toListing(child, List.copyOf(suite.groupsOf(child))))
                .toList();
        return new ListedTest(suite.getName(), kind, null, null, groups, null, children);
    }

    private static ListedTest.Policy policyOf(TestCase testCase) {
        return new ListedTest.Policy(
                testCase.isRunTestInSeparateProcess(),
                testCase.isRunClassInSeparateProcess(),
                testCase.getPreserveGlobalState().orElse(null),
                testCase.getBackupGlobals().orElse(null),
                testCase.getBackupStaticAttributes().orElse(null));
    }
}
