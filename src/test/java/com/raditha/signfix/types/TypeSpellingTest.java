package com.raditha.signfix.types;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class TypeSpellingTest {

    @ParameterizedTest
    @ValueSource(strings = {"int", "unsigned int", "const uint8_t", "size_t", "long long", "volatile unsigned short",
            "int32_t", "my_int_t"})
    void testIntegerSpellings(String spelling) {
        assertTrue(TypeSpelling.isInteger(spelling));
    }

    @ParameterizedTest
    @ValueSource(strings = {"float", "double", "char *", "int [4]", "struct point", "int (int)", ""})
    void testNonIntegerSpellings(String spelling) {
        assertFalse(TypeSpelling.isInteger(spelling));
    }

    @ParameterizedTest
    @CsvSource({
            "unsigned int, true",
            "unsigned, true",
            "uint16_t, true",
            "const size_t, true",
            "int, false",
            "char, false",
            "long unsigned int, true",
            "int64_t, false"
    })
    void testUnsigned(String spelling, boolean unsigned) {
        assertEquals(unsigned, TypeSpelling.isUnsigned(spelling));
    }

    @Test
    void testStripQualifiers() {
        assertEquals("uint8_t", TypeSpelling.stripQualifiers("const volatile uint8_t"));
        assertEquals("int", TypeSpelling.stripQualifiers("static  int"));
    }

    @Test
    void testCanonicalize() {
        assertEquals("unsigned int", TypeSpelling.canonicalize("unsigned"));
        assertEquals("unsigned char", TypeSpelling.canonicalize("uint8_t"));
        assertEquals("const unsigned long", TypeSpelling.canonicalize("const size_t"));
        assertEquals("struct point", TypeSpelling.canonicalize("struct  point"));
    }

    @ParameterizedTest
    @CsvSource({
            "10, true, 10U",
            "10U, false, 10",
            "0x1Fu, true, 0x1FU",
            "7uLL, false, 7LL",
            "7LL, true, 7ULL",
            "5L, false, 5L"
    })
    void testUnsignedSuffix(String literal, boolean makeUnsigned, String expected) {
        assertEquals(expected, TypeSpelling.withUnsignedSuffix(literal, makeUnsigned));
    }

    @Test
    void testLiterals() {
        assertTrue(TypeSpelling.isIntegerLiteral("0x10"));
        assertFalse(TypeSpelling.isIntegerLiteral("1.5"));
        assertFalse(TypeSpelling.isIntegerLiteral("-3"));
        assertEquals(16L, TypeSpelling.literalValue("0x10"));
        assertEquals(8L, TypeSpelling.literalValue("010"));
        assertEquals(10L, TypeSpelling.literalValue("10UL"));
        assertNull(TypeSpelling.literalValue("abc"));
        assertEquals("unsigned long", TypeSpelling.literalType("3ul"));
        assertEquals("int", TypeSpelling.literalType("3"));
    }

    @Test
    void testReturnAndElementTypes() {
        assertEquals("unsigned int", TypeSpelling.returnTypeOf("unsigned int (int, char *)"));
        assertEquals("int", TypeSpelling.returnTypeOf("int"));
        assertEquals("char", TypeSpelling.elementType("char *"));
        assertEquals("int", TypeSpelling.elementType("int [8]"));
    }
}
