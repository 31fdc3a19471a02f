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

/**
 * The result of building a declared test method.
 * <p>
 * The set of implementations is closed. A runner is expected to dispatch on {@link #kind()}
 * rather than inspect the concrete class:
 * <ul>
 * <li>{@link TestCase} - a plain or a parameterized case backed by real test logic</li>
 * <li>{@link DiagnosticTest} - a warning, skipped or incomplete pseudo-test with a fixed outcome</li>
 * <li>{@link DataProviderTestSuite} - the cases expanded from a data provider</li>
 * </ul>
 */
public sealed interface Test permits TestCase, DiagnosticTest, DataProviderTestSuite {

    enum Kind {
        PLAIN_CASE,
        PARAMETERIZED_CASE,
        WARNING,
        SKIPPED,
        INCOMPLETE,
        SUITE;

        public boolean isDiagnostic() {
            return this == WARNING || this == SKIPPED || this == INCOMPLETE;
        }
    }

    Kind kind();

    String getName();

    /**
     * @return the number of runnable units this test stands for
     */
    int count();
}
