package info.isaksson.erland.composetoflutter.emitter;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GenerationWarningsTest {

    @Test
    void deterministicOrderIgnoresInsertionOrder() {
        GenerationWarnings a = new GenerationWarnings();
        a.warn(GenerationWarnings.UNKNOWN_WIDGET, "Widget rendered as-is: Chart", "unit", "b.kt");
        a.warn(GenerationWarnings.CYCLE, "Dependency cycle: a.kt -> b.kt");
        a.warn(GenerationWarnings.UNKNOWN_WIDGET, "Widget rendered as-is: Chart", "unit", "a.kt");

        GenerationWarnings b = new GenerationWarnings();
        b.warn(GenerationWarnings.UNKNOWN_WIDGET, "Widget rendered as-is: Chart", "unit", "a.kt");
        b.warn(GenerationWarnings.UNKNOWN_WIDGET, "Widget rendered as-is: Chart", "unit", "b.kt");
        b.warn(GenerationWarnings.CYCLE, "Dependency cycle: a.kt -> b.kt");

        List<GenerationWarning> first = a.toDeterministicList();
        List<GenerationWarning> second = b.toDeterministicList();
        assertEquals(first.toString(), second.toString());
        assertEquals(GenerationWarnings.CYCLE, first.get(0).code);
        assertEquals("a.kt", first.get(1).context.get("unit"));
        assertEquals("b.kt", first.get(2).context.get("unit"));
    }

    @Test
    void addAllMergesAnotherCollector() {
        GenerationWarnings total = new GenerationWarnings();
        GenerationWarnings unit = new GenerationWarnings();
        unit.warn(GenerationWarnings.UNMAPPED_TYPE, "Type kept as-is: Clock", "unit", "a.kt", "name", "clock");
        total.addAll(unit);
        total.addAll(total);
        total.addAll(null);
        assertEquals(1, total.size());
        assertEquals("clock", total.toDeterministicList().get(0).context.get("name"));
    }

    @Test
    void warningRequiresCodeAndMessage() {
        assertThrows(NullPointerException.class, () -> new GenerationWarning(null, "m", null));
        assertTrue(new GenerationWarning("X", "m", null).context.isEmpty());
    }
}
