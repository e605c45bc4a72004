package info.isaksson.erland.composetoflutter.mapping;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TypeMapperTest {

    private final TypeMapper mapper = new TypeMapper();

    @Test
    void mapsPrimitivesCollectionsAndFunctions() {
        assertEquals("int", mapper.map("Int"));
        assertEquals("int", mapper.map("Long"));
        assertEquals("bool?", mapper.map("Boolean?"));
        assertEquals("List<String>?", mapper.map("List<String>?"));
        assertEquals("Map<String, int>", mapper.map("MutableMap<String, Long>"));
        assertEquals("List<int>", mapper.map("IntArray"));
        assertEquals("void Function(int)", mapper.map("(Int) -> Unit"));
        assertEquals("void Function()", mapper.map("() -> Unit"));
    }

    @Test
    void blankAndAnyBecomeDynamicWithoutNullableMarker() {
        assertEquals("dynamic", mapper.map(null));
        assertEquals("dynamic", mapper.map("  "));
        assertEquals("dynamic", mapper.map("Any?"));
    }

    @Test
    void mappingIsIdempotentOnTargetTypes() {
        List<String> targets = List.of(
                "int", "double", "bool?", "String", "List<int>", "Map<String, dynamic>",
                "Future<void>", "dynamic", "void Function(int)", "Widget", "Color", "EdgeInsets");
        for (String t : targets) {
            assertEquals(t, mapper.map(t), t);
            assertEquals(mapper.map(t), mapper.map(mapper.map(t)), t);
        }
    }

    @Test
    void unknownProjectTypesPassThrough() {
        assertEquals("List<Note>", mapper.map("List<Note>"));
        assertEquals("Note?", mapper.map("Note?"));
    }

    @Test
    void overridesWinOverBuiltInTables() {
        TypeMapper custom = new TypeMapper(Map.of("UUID", "String", "Int", "num"));
        assertEquals("List<String>", custom.map("List<UUID>"));
        assertEquals("num", custom.map("Int"));
    }

    @Test
    void unmappedNamesSkipKnownAndTargetNames() {
        assertEquals(Set.of("Foo"), mapper.unmappedNames("Foo<Bar, Int>", Set.of("Bar")));
        assertTrue(mapper.unmappedNames("List<String>", Set.of()).isEmpty());
        assertTrue(mapper.unmappedNames("void Function(Widget)", Set.of()).isEmpty());
    }
}
