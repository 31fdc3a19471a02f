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

import java.util.Optional;

/**
 * The isolation and state backup flags that apply to every case built from one test method.
 * <p>
 * The optional fields are tri-state: present and true, present and false, or absent. Absent
 * fields are never written to a test so the runner keeps its own default.
 *
 * @param runInSeparateProcess      run each case in its own process
 * @param runClassInSeparateProcess run the whole class in one separate process
 * @param preserveGlobalState       carry global state into the separate process
 * @param backupGlobals             back up and restore global variables around the test
 * @param backupStaticAttributes    back up and restore static attributes around the test
 */
public record ExecutionPolicy(boolean runInSeparateProcess,
                              boolean runClassInSeparateProcess,
                              Optional<Boolean> preserveGlobalState,
                              Optional<Boolean> backupGlobals,
                              Optional<Boolean> backupStaticAttributes) {

    public static final ExecutionPolicy DEFAULT =
            new ExecutionPolicy(false, false, Optional.empty(), Optional.empty(), Optional.empty());

    public ExecutionPolicy {
        Preconditions.checkNotNull(preserveGlobalState, "preserveGlobalState must not be null");
        Preconditions.checkNotNull(backupGlobals, "backupGlobals must not be null");
        Preconditions.checkNotNull(backupStaticAttributes, "backupStaticAttributes must not be null");
    }

    public static ExecutionPolicy of(BackupSettings backupSettings,
                                     Optional<Boolean> preserveGlobalState,
                                     boolean runInSeparateProcess,
                                     boolean runClassInSeparateProcess) {
        Preconditions.checkNotNull(backupSettings, "backupSettings must not be null");
        return new ExecutionPolicy(runInSeparateProcess, runClassInSeparateProcess, preserveGlobalState,
                backupSettings.backupGlobals(), backupSettings.backupStaticAttributes());
    }

    public BackupSettings backupSettings() {
        return new BackupSettings(backupGlobals, backupStaticAttributes);
    }

    /**
     * Writes this policy onto a test case. Applying the same policy twice leaves the case unchanged.
     *
     * @param test the case to configure
     */
    public void applyTo(TestCase test) {
        Preconditions.checkNotNull(test, "test must not be null");
        if (runInSeparateProcess) {
            test.setRunTestInSeparateProcess(true);
        }
        if (runClassInSeparateProcess) {
            test.setRunClassInSeparateProcess(true);
        }
        // Written once even when both isolation flags are set.
        if (runInSeparateProcess || runClassInSeparateProcess) {
            preserveGlobalState.ifPresent(test::setPreserveGlobalState);
        }
        backupGlobals.ifPresent(test::setBackupGlobals);
        backupStaticAttributes.ifPresent(test::setBackupStaticAttributes);
    }
}
