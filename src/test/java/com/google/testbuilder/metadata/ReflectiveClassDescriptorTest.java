package com.google.testbuilder.metadata;

import com.google.testbuilder.fixtures.AbstractFixture;
import com.google.testbuilder.fixtures.DataDrivenFixture;
import com.google.testbuilder.fixtures.FailingConstructorFixture;
import com.google.testbuilder.fixtures.NamedOnlyFixture;
import com.google.testbuilder.fixtures.PlainFixture;
import com.google.testbuilder.fixtures.PrivateConstructorFixture;
import com.google.testbuilder.models.TestCase;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReflectiveClassDescriptorTest {

    @Test
    void isInstantiable_concreteTestCase_isTrue() {
        assertTrue(new ReflectiveClassDescriptor(PlainFixture.class).isInstantiable());
        assertTrue(new ReflectiveClassDescriptor(DataDrivenFixture.class).isInstantiable());
    }

    @ParameterizedTest
    @ValueSource(classes = {AbstractFixture.class, PrivateConstructorFixture.class, Runnable.class,
            String.class, int.class, PlainFixture[].class, TimeUnit.class})
    void isInstantiable_unusableClass_isFalse(Class<?> type) {
        assertFalse(new ReflectiveClassDescriptor(type).isInstantiable());
    }

    @Test
    void constructorParameterCount_usesWidestConstructor() {
        assertEquals(OptionalInt.of(1), new ReflectiveClassDescriptor(PlainFixture.class).constructorParameterCount());
        assertEquals(OptionalInt.of(3),
                new ReflectiveClassDescriptor(DataDrivenFixture.class).constructorParameterCount());
    }

    @Test
    void constructorParameterCount_interface_isEmpty() {
        assertEquals(OptionalInt.empty(), new ReflectiveClassDescriptor(Runnable.class).constructorParameterCount());
    }

    @Test
    void instantiate_dataArguments_usesDataConstructor() {
        TestCase test = new ReflectiveClassDescriptor(DataDrivenFixture.class)
                .instantiate(List.of("testAdd", List.of(1, 1, 2), "ones"));

        DataDrivenFixture fixture = assertInstanceOf(DataDrivenFixture.class, test);
        assertEquals("testAdd", fixture.getName());
        assertEquals(List.of(1, 1, 2), fixture.getProvidedData());
        assertEquals("ones", fixture.getDataName().orElseThrow());
    }

    @Test
    void instantiate_noArguments_usesNoArgConstructor() {
        TestCase test = new ReflectiveClassDescriptor(PlainFixture.class).instantiate(List.of());

        assertInstanceOf(PlainFixture.class, test);
        assertNull(test.getName());
    }

    @Test
    void instantiate_onlyNameConstructor_receivesNull() {
        TestCase test = new ReflectiveClassDescriptor(NamedOnlyFixture.class).instantiate(List.of());

        assertInstanceOf(NamedOnlyFixture.class, test);
        assertNull(test.getName());
    }

    @Test
    void instantiate_surplusArguments_areDropped() {
        TestCase test = new ReflectiveClassDescriptor(PlainFixture.class)
                .instantiate(List.of("testAdd", List.of(), 0));

        assertEquals("testAdd", test.getName());
        assertFalse(test.getDataName().isPresent());
    }

    @Test
    void instantiate_failingConstructor_throwsTestInstantiationException() {
        TestInstantiationException e = assertThrows(TestInstantiationException.class,
                () -> new ReflectiveClassDescriptor(FailingConstructorFixture.class).instantiate(List.of()));

        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertTrue(e.getMessage().contains("fixture cannot start"), e.getMessage());
    }

    @Test
    void instantiate_wrongArgumentTypes_throwsTestInstantiationException() {
        assertThrows(TestInstantiationException.class,
                () -> new ReflectiveClassDescriptor(DataDrivenFixture.class).instantiate(List.of(1, 2, 3)));
    }
}
