package com.google.testbuilder.annotations;
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

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Names the method that provides the data sets for a test method.
 * <p>
 * The provider must be a public static method without parameters, declared on the test class or
 * on {@link #location()}. It may return a {@code Map} (whose keys name the data sets), an
 * {@code Iterable}, an {@code Iterator}, a {@code Stream} or an {@code Object[][]}. Every data set
 * is an {@code Object[]} or a {@code List} of arguments.
 * <p>
 * A test method may have several providers; their data sets are concatenated in declaration
 * order.
 *
 * <pre>{@code
 * @DataProvider("additions")
 * public void testAdd(int a, int b, int sum) { ... }
 *
 * public static Map<String, Object[]> additions() {
 *     return Map.of("zeros", new Object[]{0, 0, 0});
 * }
 * }</pre>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
@Repeatable(DataProviders.class)
public @interface DataProvider {

    /**
     * @return the name of the provider method
     */
    String value();

    /**
     * @return the class declaring the provider method, {@code void.class} for the test class itself
     */
    Class<?> location() default void.class;
}
