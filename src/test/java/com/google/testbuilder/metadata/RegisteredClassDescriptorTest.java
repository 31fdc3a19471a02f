package com.google.testbuilder.metadata;

import com.google.testbuilder.fixtures.DataDrivenFixture;
import com.google.testbuilder.fixtures.PlainFixture;
import com.google.testbuilder.models.TestCase;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RegisteredClassDescriptorTest {

    @Test
    void plainFactoryOnly_hasZeroArity() {
        RegisteredClassDescriptor descriptor = new RegisteredClassDescriptor.Builder("com.example.PlainTest")
                .withPlainFactory(PlainFixture::new)
                .build();

        assertTrue(descriptor.isInstantiable());
        assertEquals(OptionalInt.of(0), descriptor.constructorParameterCount());
        assertInstanceOf(PlainFixture.class, descriptor.instantiate(List.of()));
    }

    @Test
    void dataFactory_receivesNameDataAndKey() {
        RegisteredClassDescriptor descriptor = new RegisteredClassDescriptor.Builder("com.example.MathTest")
                .withPlainFactory(DataDrivenFixture::new)
                .withDataFactory(DataDrivenFixture::new)
                .build();

        TestCase test = descriptor.instantiate(List.of("testAdd", List.of(1, 1, 2), 4));

        assertEquals(OptionalInt.of(3), descriptor.constructorParameterCount());
        assertEquals("testAdd with data set #4", test.getDisplayName());
        assertEquals(List.of(1, 1, 2), test.getProvidedData());
    }

    @Test
    void withoutFactories_isNotInstantiableAndHasNoConstructor() {
        RegisteredClassDescriptor descriptor = new RegisteredClassDescriptor.Builder("com.example.Empty").build();

        assertFalse(descriptor.isInstantiable());
        assertEquals(OptionalInt.empty(), descriptor.constructorParameterCount());
    }

    @Test
    void notInstantiable_overridesFactories() {
        RegisteredClassDescriptor descriptor = new RegisteredClassDescriptor.Builder("com.example.AbstractTest")
                .withPlainFactory(PlainFixture::new)
                .notInstantiable()
                .build();

        assertFalse(descriptor.isInstantiable());
    }

    @Test
    void instantiate_dataFactory_receivesCopyOfData() {
        RegisteredClassDescriptor descriptor = new RegisteredClassDescriptor.Builder("com.example.MathTest")
                .withDataFactory((name, data, dataName) -> {
                    data.add("extra");
                    return new DataDrivenFixture(name, data, dataName);
                })
                .build();
        List<Integer> data = List.of(1, 2);

        TestCase test = descriptor.instantiate(List.of("testAdd", data, 0));

        assertEquals(List.of(1, 2, "extra"), test.getProvidedData());
        assertEquals(List.of(1, 2), data);
    }

    @Test
    void instantiate_nonListData_throwsTestInstantiationException() {
        RegisteredClassDescriptor descriptor = new RegisteredClassDescriptor.Builder("com.example.MathTest")
                .withDataFactory(DataDrivenFixture::new)
                .build();

        assertThrows(TestInstantiationException.class, () -> descriptor.instantiate(List.of("testAdd", "oops", 0)));
    }

    @Test
    void instantiate_unsupportedArguments_throwsTestInstantiationException() {
        RegisteredClassDescriptor descriptor = new RegisteredClassDescriptor.Builder("com.example.PlainTest")
                .withPlainFactory(PlainFixture::new)
                .build();

        assertThrows(TestInstantiationException.class, () -> descriptor.instantiate(List.of("testAdd")));
        assertThrows(TestInstantiationException.class,
                () -> descriptor.instantiate(List.of("testAdd", List.of(), 0)));
    }
}
