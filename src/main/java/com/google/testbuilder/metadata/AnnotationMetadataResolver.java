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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.testbuilder.annotations.BackupGlobals;
import com.google.testbuilder.annotations.BackupStaticAttributes;
import com.google.testbuilder.annotations.DataProvider;
import com.google.testbuilder.annotations.Group;
import com.google.testbuilder.annotations.PreserveGlobalState;
import com.google.testbuilder.annotations.RunClassInSeparateProcess;
import com.google.testbuilder.annotations.RunInSeparateProcess;
import com.google.testbuilder.annotations.RunTestsInSeparateProcesses;
import com.google.testbuilder.models.BackupSettings;
import com.google.testbuilder.models.DataSet;
import com.google.testbuilder.models.ProvidedData;

import java.lang.annotation.Annotation;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * A {@link MetadataResolver} reading the annotations in {@code com.google.testbuilder.annotations}.
 * <p>
 * A method-level annotation overrides the same annotation on the class; without either, the
 * {@link ResolverSettings} default applies. Groups declared on the class and on the method add up.
 * <p>
 * Data providers named by {@link DataProvider} are invoked on every call; nothing is cached.
 * Integer keys and the positions of unkeyed data sets are renumbered from zero across all
 * providers of a method. String keys are kept and must be unique.
 */
public class AnnotationMetadataResolver implements MetadataResolver {

    private final Logger logger = Logger.getLogger(this.getClass().getName());
    private final ResolverSettings settings;
    private final ClassLoader classLoader;

    public AnnotationMetadataResolver() {
        this(ResolverSettings.defaults());
    }

    public AnnotationMetadataResolver(ResolverSettings settings) {
        this(settings, AnnotationMetadataResolver.class.getClassLoader());
    }

    public AnnotationMetadataResolver(ResolverSettings settings, ClassLoader classLoader) {
        Preconditions.checkNotNull(settings, "settings must not be null");
        Preconditions.checkNotNull(classLoader, "classLoader must not be null");
        this.settings = settings;
        this.classLoader = classLoader;
    }

    /** The annotated elements of one test method. */
    private record Declaration(Optional<Class<?>> type, Optional<Method> method) {

        <A extends Annotation> Optional<Boolean> flag(Class<A> annotation, Predicate<A> value) {
            return method.map(m -> m.getAnnotation(annotation)).map(value::test)
                    .or(() -> type.map(t -> t.getAnnotation(annotation)).map(value::test));
        }

        boolean onMethod(Class<? extends Annotation> annotation) {
            return method.map(m -> m.isAnnotationPresent(annotation)).orElse(false);
        }

        boolean onType(Class<? extends Annotation> annotation) {
            return type.map(t -> t.isAnnotationPresent(annotation)).orElse(false);
        }
    }

    @Override
    public BackupSettings backupSettings(String className, String methodName) {
        Declaration target = target(className, methodName);
        return new BackupSettings(
                target.flag(BackupGlobals.class, BackupGlobals::value).or(settings::backupGlobals),
                target.flag(BackupStaticAttributes.class, BackupStaticAttributes::value)
                        .or(settings::backupStaticAttributes));
    }

    @Override
    public Optional<Boolean> preserveGlobalState(String className, String methodName) {
        return target(className, methodName)
                .flag(PreserveGlobalState.class, PreserveGlobalState::value)
                .or(settings::preserveGlobalState);
    }

    @Override
    public boolean processIsolation(String className, String methodName) {
        Declaration target = target(className, methodName);
        return settings.processIsolation()
                || target.onMethod(RunInSeparateProcess.class)
                || target.onType(RunTestsInSeparateProcesses.class);
    }

    @Override
    public boolean classProcessIsolation(String className, String methodName) {
        return target(className, methodName).onType(RunClassInSeparateProcess.class);
    }

    @Override
    public Set<String> groups(String className, String methodName) {
        Declaration target = target(className, methodName);
        ImmutableSet.Builder<String> groups = ImmutableSet.builder();
        target.type().map(t -> t.getAnnotation(Group.class)).ifPresent(g -> groups.add(g.value()));
        target.method().map(m -> m.getAnnotation(Group.class)).ifPresent(g -> groups.add(g.value()));
        ImmutableSet<String> result = groups.build();
        return result.isEmpty() ? ImmutableSet.of(settings.defaultGroup()) : result;
    }

    @Override
    public ProvidedData providedData(String className, String methodName) {
        Optional<Class<?>> type = loadClass(className);
        if (type.isEmpty()) {
            return ProvidedData.invalid("Class %s could not be loaded".formatted(className));
        }
        Optional<Method> method = findMethod(type.get(), methodName);
        if (method.isEmpty()) {
            return ProvidedData.invalid("Method %s::%s does not exist".formatted(className, methodName));
        }
        DataProvider[] providers = method.get().getAnnotationsByType(DataProvider.class);
        if (providers.length == 0) {
            return ProvidedData.NONE;
        }

        DataSet.Builder dataSet = DataSet.builder();
        Set<String> stringKeys = new HashSet<>();
        int nextIndex = 0;
        for (DataProvider provider : providers) {
            Class<?> location = provider.location() == void.class ? type.get() : provider.location();
            List<Map.Entry<Object, Object>> entries;
            try {
                Object produced = invokeProvider(location, provider.value());
                Optional<List<Map.Entry<Object, Object>>> producedEntries = entriesOf(produced);
                if (producedEntries.isEmpty()) {
                    return ProvidedData.invalid(
                            "Data provider %s::%s must return a Map, Iterable, Iterator, Stream or array but returned %s"
                                    .formatted(location.getName(), provider.value(),
                                            produced == null ? "null" : produced.getClass().getName()));
                }
                entries = producedEntries.get();
            } catch (InvocationTargetException e) {
                return providerFailure(location, provider.value(), e.getTargetException());
            } catch (ReflectiveOperationException e) {
                return ProvidedData.invalid(e.getMessage());
            } catch (ExceptionInInitializerError e) {
                // The provider call is the first use of its class.
                return providerFailure(location, provider.value(), e.getCause() == null ? e : e.getCause());
            } catch (VirtualMachineError e) {
                throw e;
            } catch (RuntimeException | Error e) {
                // Lazily evaluated providers fail while their rows are read.
                return providerFailure(location, provider.value(), e);
            }

            for (Map.Entry<Object, Object> entry : entries) {
                Object key;
                if (entry.getKey() == null || entry.getKey() instanceof Integer) {
                    key = nextIndex++;
                } else {
                    key = String.valueOf(entry.getKey());
                    if (!stringKeys.add((String) key)) {
                        return ProvidedData.invalid(
                                "The key \"%s\" has already been defined by a previous data provider".formatted(key));
                    }
                }
                Optional<List<Object>> arguments = argumentsOf(entry.getValue());
                if (arguments.isEmpty()) {
                    return ProvidedData.invalid("Data set %s is invalid.".formatted(DataSet.Row.describeKey(key)));
                }
                dataSet.add(key, arguments.get());
            }
        }
        return ProvidedData.rows(dataSet.build());
    }

    private Object invokeProvider(Class<?> location, String providerName) throws ReflectiveOperationException {
        Method provider;
        try {
            provider = location.getMethod(providerName);
        } catch (NoSuchMethodException e) {
            throw new NoSuchMethodException("Method %s::%s does not exist".formatted(location.getName(), providerName));
        }
        if (!Modifier.isStatic(provider.getModifiers())) {
            throw new IllegalAccessException(
                    "Data provider method %s::%s must be static".formatted(location.getName(), providerName));
        }
        provider.trySetAccessible();
        return provider.invoke(null);
    }

    private ProvidedData providerFailure(Class<?> location, String providerName, Throwable failure) {
        if (failure instanceof MarkedIncompleteException) {
            return ProvidedData.incomplete(failure.getMessage());
        }
        if (failure instanceof MarkedSkippedException) {
            return ProvidedData.skipped(failure.getMessage());
        }
        logger.warning(() -> "Data provider %s::%s failed: %s".formatted(location.getName(), providerName, failure));
        return ProvidedData.invalid(failure.getMessage());
    }

    private static Optional<List<Map.Entry<Object, Object>>> entriesOf(Object produced) {
        List<Map.Entry<Object, Object>> entries = new ArrayList<>();
        if (produced instanceof Map<?, ?> map) {
            map.forEach((k, v) -> entries.add(new AbstractMap.SimpleImmutableEntry<>(k, v)));
            return Optional.of(entries);
        }
        Iterator<?> rows;
        if (produced instanceof Iterable<?> iterable) {
            rows = iterable.iterator();
        } else if (produced instanceof Iterator<?> iterator) {
            rows = iterator;
        } else if (produced instanceof Stream<?> stream) {
            try (Stream<?> closing = stream) {
                closing.forEachOrdered(row -> entries.add(new AbstractMap.SimpleImmutableEntry<>(null, row)));
            }
            return Optional.of(entries);
        } else if (produced instanceof Object[] array) {
            rows = Arrays.asList(array).iterator();
        } else {
            return Optional.empty();
        }
        rows.forEachRemaining(row -> entries.add(new AbstractMap.SimpleImmutableEntry<>(null, row)));
        return Optional.of(entries);
    }

    private static Optional<List<Object>> argumentsOf(Object row) {
        if (row instanceof Object[] array) {
            return Optional.of(Arrays.asList(array));
        }
        if (row instanceof List<?> list) {
            return Optional.of(new ArrayList<>(list));
        }
        return Optional.empty();
    }

    private Declaration target(String className, String methodName) {
        Optional<Class<?>> type = loadClass(className);
        return new Declaration(type, type.flatMap(t -> findMethod(t, methodName)));
    }

    private Optional<Class<?>> loadClass(String className) {
        Preconditions.checkNotNull(className, "className must not be null");
        try {
            return Optional.of(Class.forName(className, false, classLoader));
        } catch (ClassNotFoundException | LinkageError e) {
            logger.fine(() -> "Cannot load %s, using defaults: %s".formatted(className, e));
            return Optional.empty();
        }
    }

    private static Optional<Method> findMethod(Class<?> type, String methodName) {
        Preconditions.checkNotNull(methodName, "methodName must not be null");
        // Among overloads the one declaring a data provider wins, then the lowest signature.
        return Arrays.stream(type.getMethods())
                .filter(m -> m.getName().equals(methodName))
                .min(Comparator.comparing((Method m) -> m.getAnnotationsByType(DataProvider.class).length == 0)
                        .thenComparing(Method::toGenericString));
    }
}
