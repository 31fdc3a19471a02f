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

/**
 * Thrown when a test class cannot be instantiated with the arguments the builder passes.
 */
public class TestInstantiationException extends RuntimeException {

    public TestInstantiationException(String message) {
        super(message);
    }

    public TestInstantiationException(String message, Throwable cause) {
        super(message, cause);
    }
}
