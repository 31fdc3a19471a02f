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

import com.google.testbuilder.models.TestSpec;

/**
 * Thrown when a test class has no constructor at all, so no test can be built from it. Unlike
 * other build problems this is not turned into a diagnostic test.
 */
public class NoValidTestException extends RuntimeException {

    private final TestSpec spec;

    public NoValidTestException(TestSpec spec) {
        super("No valid test provided.");
        this.spec = spec;
    }

    public TestSpec getSpec() {
        return spec;
    }
}
