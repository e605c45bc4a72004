package info.isaksson.erland.composetoflutter.extract;

import info.isaksson.erland.composetoflutter.ir.ArgumentValue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static info.isaksson.erland.composetoflutter.testutil.Sources.*;
import static org.junit.jupiter.api.Assertions.*;

public class ArgumentClassifierTest {

    private final ArgumentClassifier classifier = new ArgumentClassifier(e -> List.of());

    @Test
    void literalsAreTyped() {
        assertEquals(42L, ((ArgumentValue.IntValue) ArgumentClassifier.literal("42")).value);
        assertEquals(7L, ((ArgumentValue.IntValue) ArgumentClassifier.literal("7L")).value);
        assertEquals(1.5, ((ArgumentValue.DoubleValue) ArgumentClassifier.literal("1.5f")).value);
        assertEquals(0.5, ((ArgumentValue.DoubleValue) ArgumentClassifier.literal("0.5")).value);
        assertTrue(((ArgumentValue.BoolValue) ArgumentClassifier.literal("true")).value);
        assertSame(ArgumentValue.NullValue.INSTANCE, ArgumentClassifier.literal("null"));
        assertInstanceOf(ArgumentValue.Reference.class, ArgumentClassifier.literal("Color.Red"));
        assertInstanceOf(ArgumentValue.Raw.class, ArgumentClassifier.literal("a + b"));
        assertInstanceOf(ArgumentValue.Raw.class, ArgumentClassifier.literal("16.dp"));
    }

    @Test
    void expressionKindsAreClassified() {
        assertEquals("Hi", ((ArgumentValue.StringValue) classifier.classify(str("Hi"))).value);
        assertInstanceOf(ArgumentValue.Reference.class, classifier.classify(dot(name("a"), name("b"))));
        assertSame(ArgumentValue.NullValue.INSTANCE, classifier.classify(name("null")));

        ArgumentValue.CallValue call = (ArgumentValue.CallValue) classifier.classify(
                call("RoundedCornerShape", arg(other("8.dp")), arg("topStart", other("4.dp"))));
        assertEquals("RoundedCornerShape", call.name);
        assertEquals(List.of("8.dp", "topStart = 4.dp"), call.arguments);

        ArgumentValue.Closure closure = (ArgumentValue.Closure) classifier.classify(lambda(other("count++")));
        assertEquals(List.of("count++"), closure.statements);
    }
}
