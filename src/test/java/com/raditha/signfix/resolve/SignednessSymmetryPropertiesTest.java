package com.raditha.signfix.resolve;

import com.raditha.signfix.tree.Binary;
import com.raditha.signfix.tree.Leaf;
import com.raditha.signfix.types.TypeSpelling;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

import static com.raditha.signfix.resolve.ConflictResolverTest.bin;
import static com.raditha.signfix.resolve.ConflictResolverTest.var;
import static org.junit.jupiter.api.Assertions.*;

class SignednessSymmetryPropertiesTest {

    private final ConflictResolver resolver = new ConflictResolver(new TypeResolver(null), false);

    @Provide
    Arbitrary<String> signedTypes() {
        return Arbitraries.of("int", "short", "long", "long long", "signed char", "int32_t", "ptrdiff_t");
    }

    @Provide
    Arbitrary<String> unsignedTypes() {
        return Arbitraries.of("unsigned int", "unsigned short", "unsigned long", "unsigned char", "size_t",
                "uint8_t", "uint64_t");
    }

    @Provide
    Arbitrary<String> operators() {
        return Arbitraries.of("+", "-", "*", "/", "%", "<", ">", "<=", ">=", "==", "!=", "&", "|", "^");
    }

    @Property
    void swappingOperandsCastsTheOtherVariable(@ForAll("signedTypes") String signed,
                                                @ForAll("unsignedTypes") String unsigned,
                                                @ForAll("operators") String op) {
        Resolution forward = resolver.resolve(bin(op, var("s", signed), var("u", unsigned)));
        Resolution swapped = resolver.resolve(bin(op, var("u", unsigned), var("s", signed)));

        assertEquals(1, forward.casts().size());
        assertEquals(1, swapped.casts().size());
        assertEquals("u", forward.casts().get(0).original());
        assertEquals(signed, forward.casts().get(0).castType());
        assertEquals("s", swapped.casts().get(0).original());
        assertEquals(unsigned, swapped.casts().get(0).castType());
        assertEquals("s " + op + " (" + signed + ")u", forward.text());
        assertEquals("u " + op + " (" + unsigned + ")s", swapped.text());
    }

    @Property
    void sameSignednessNeverCasts(@ForAll("unsignedTypes") String left, @ForAll("unsignedTypes") String right,
                                  @ForAll("operators") String op) {
        Binary tree = bin(op, var("x", left), var("y", right));

        Resolution r = resolver.resolve(tree);

        assertFalse(r.changed());
        assertEquals("x " + op + " y", r.text());
    }

    @Property
    void literalAlwaysTakesTheCast(@ForAll("unsignedTypes") String unsigned,
                                   @ForAll("operators") String op,
                                   @ForAll("literals") String literal) {
        Leaf number = ConflictResolverTest.lit(literal);
        Resolution r = resolver.resolve(bin(op, var("u", unsigned), number));

        assertTrue(r.casts().get(0).literal());
        assertEquals(TypeSpelling.withUnsignedSuffix(literal, true), r.casts().get(0).replacement());
    }

    @Provide
    Arbitrary<String> literals() {
        return Arbitraries.of("0", "1", "42", "0x7F", "010", "5L", "9LL");
    }
}
