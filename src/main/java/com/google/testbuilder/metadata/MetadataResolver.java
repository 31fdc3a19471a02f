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

import com.google.testbuilder.models.BackupSettings;
import com.google.testbuilder.models.ProvidedData;

import java.util.Optional;
import java.util.Set;

/**
 * Answers questions about a test method's declared settings.
 * <p>
 * Implementations never throw: a method without settings gets the empty or false default, and
 * data-provider failures are reported through {@link ProvidedData}.
 */
public interface MetadataResolver {

    BackupSettings backupSettings(String className, String methodName);

    Optional<Boolean> preserveGlobalState(String className, String methodName);

    boolean processIsolation(String className, String methodName);

    boolean classProcessIsolation(String className, String methodName);

    ProvidedData providedData(String className, String methodName);

    Set<String> groups(String className, String methodName);
}
