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
import com.google.common.base.Strings;

/**
 * What asking a test method for its provided data produced.
 * <p>
 * Provider failures are values rather than exceptions, so the builder can turn each of them
 * into the matching diagnostic test.
 */
public sealed interface ProvidedData {

    ProvidedData NONE = new None();

    /** The method declares no data provider. */
    record None() implements ProvidedData {
    }

    record Rows(DataSet dataSet) implements ProvidedData {
        public Rows {
            Preconditions.checkNotNull(dataSet, "dataSet must not be null");
        }
    }

    /** The provider marked the test as incomplete. */
    record Incomplete(String message) implements ProvidedData {
        public Incomplete {
            message = Strings.nullToEmpty(message);
        }
    }

    /** The provider asked for the test to be skipped. */
    record Skipped(String message) implements ProvidedData {
        public Skipped {
            message = Strings.nullToEmpty(message);
        }
    }

    /** The provider failed for any other reason or produced something unusable. */
    record Invalid(String message) implements ProvidedData {
        public Invalid {
            message = Strings.nullToEmpty(message);
        }
    }

    static ProvidedData rows(DataSet dataSet) {
        return new Rows(dataSet);
    }

    static ProvidedData incomplete(String message) {
        return new Incomplete(message);
    }

    static ProvidedData skipped(String message) {
        return new Skipped(message);
    }

    static ProvidedData invalid(String message) {
        return new Invalid(message);
    }
}
