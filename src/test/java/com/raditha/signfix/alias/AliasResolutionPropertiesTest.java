package com.raditha.signfix.alias;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AliasResolutionPropertiesTest {

    /**
     * Random macro graphs over a small name set, cycles included.
     */
    @Provide
    Arbitrary<List<String>> defineLines() {
        Arbitrary<String> name = Arbitraries.of("A", "B", "C", "D", "E");
        Arbitrary<String> value = Arbitraries.oneOf(
                name,
                Arbitraries.integers().between(0, 500).map(String::valueOf),
                name.list().ofMinSize(1).ofMaxSize(3).map(names -> "(" + String.join(" + ", names) + ")"));
        return Arbitraries.entries(name, value).list().ofMaxSize(8).map(entries -> {
            List<String> lines = new ArrayList<>();
            entries.forEach(e -> lines.add("#define " + e.getKey() + " " + e.getValue()));
            return lines;
        });
    }

    @Property
    void resolutionTerminates(@ForAll("defineLines") List<String> lines) {
        MacroTable macros = MacroTable.parse("p.c", lines);
        for (String name : List.of("A", "B", "C", "D", "E")) {
            assertNotNull(macros.resolve(name).value());
        }
    }

    @Property
    void resolutionIsIdempotent(@ForAll("defineLines") List<String> lines) {
        MacroTable macros = MacroTable.parse("p.c", lines);
        for (String name : List.of("A", "B", "C", "D", "E")) {
            AliasResolution once = macros.resolve(name);
            if (once.cycleDetected()) {
                continue;
            }
            AliasResolution twice = macros.resolveSpelling(once.value());
            assertEquals(once.value(), twice.value(), "resolving " + name + " twice");
        }
    }

    @Property
    void typedefChainsResolveToTheirBase(@ForAll("chainLength") int length) {
        List<String> lines = new ArrayList<>();
        lines.add("typedef unsigned short t0;");
        for (int i = 1; i <= length; i++) {
            lines.add("typedef t" + (i - 1) + " t" + i + ";");
        }
        TypeTable types = TypeTable.parse("chain.c", lines);
        AliasResolution r = types.resolve("t" + length);
        assertEquals("unsigned short", r.value());
        assertFalse(r.cycleDetected());
    }

    @Provide
    Arbitrary<Integer> chainLength() {
        return Arbitraries.integers().between(0, 60);
    }
}
