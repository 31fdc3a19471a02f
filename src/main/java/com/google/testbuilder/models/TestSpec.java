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

/**
 * Identifies a declared test method by its owning class and its name.
 *
 * @param className  fully qualified name of the test class
 * @param methodName name of the test method
 */
public record TestSpec(String className, String methodName) {

    public TestSpec {
        Preconditions.checkNotNull(className, "className must not be null");
        Preconditions.checkNotNull(methodName, "methodName must not be null");
    }

    /**
     * @return {@code <className>::<methodName>}, the name used for suites and diagnostics
     */
    public String displayName() {
        return "%s::%s".formatted(className, methodName);
    }

    @Override
    public String toString() {
        return displayName();
    }
}
