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

import com.google.testbuilder.models.TestCase;

import java.util.List;
import java.util.OptionalInt;

/**
 * What the test builder needs to know about a test class and how to create instances of it.
 */
public interface ClassDescriptor {

    /**
     * @return the fully qualified class name
     */
    String getName();

    /**
     * @return false for abstract classes, interfaces and classes without an accessible constructor
     */
    boolean isInstantiable();

    /**
     * @return the number of parameters of the class's constructor, or empty if the class has no
     * constructor at all
     */
    OptionalInt constructorParameterCount();

    /**
     * Creates a new instance.
     *
     * @param arguments either empty, or {@code (methodName, data, dataName)}
     * @return the new test case
     * @throws TestInstantiationException if no constructor accepts the arguments or the
     *                                    constructor fails
     */
    TestCase instantiate(List<Object> arguments);
}
