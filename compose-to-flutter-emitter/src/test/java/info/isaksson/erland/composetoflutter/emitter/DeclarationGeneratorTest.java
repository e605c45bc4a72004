package info.isaksson.erland.composetoflutter.emitter;

import info.isaksson.erland.composetoflutter.ir.DeclarationKind;
import info.isaksson.erland.composetoflutter.ir.SourceDeclaration;
import info.isaksson.erland.composetoflutter.ir.SourceExpr;
import info.isaksson.erland.composetoflutter.ir.SourceParameter;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class DeclarationGeneratorTest {

    private final GenerationWarnings warnings = new GenerationWarnings();
    private final GenerationContext ctx = new GenerationContext("model/Note.kt", Set.of("Note", "UiState", "BaseRepository"),
            GeneratorOptions.defaults(), warnings);
    private final DeclarationGenerator generator = new DeclarationGenerator();

    private static SourceDeclaration declaration(DeclarationKind kind, String name, List<String> modifiers, List<String> superTypes,
                                                 List<SourceParameter> params, List<SourceDeclaration> members, List<String> entries) {
        return new SourceDeclaration(kind, name, modifiers, null, superTypes, params, members, entries,
                null, null, false, null, null);
    }

    private static SourceDeclaration function(String name, List<String> modifiers, List<SourceParameter> params,
                                              String returnType, SourceExpr body) {
        return new SourceDeclaration(DeclarationKind.FUNCTION, name, modifiers, null, null, params, null, null,
                returnType, null, false, null, body);
    }

    @Test
    void dataClassGetsValueSemantics() {
        SourceDeclaration note = SourceDeclaration.type(DeclarationKind.DATA_CLASS, "Note", null, List.of(
                SourceParameter.of("id", "Int"),
                SourceParameter.of("title", "String"),
                SourceParameter.of("done", "Boolean", "false")), null);

        String expected = "class Note {\n"
                + "  final int id;\n"
                + "  final String title;\n"
                + "  final bool done;\n"
                + "\n"
                + "  const Note({\n"
                + "    required this.id,\n"
                + "    required this.title,\n"
                + "    this.done = false,\n"
                + "  });\n"
                + "\n"
                + "  Note copyWith({\n"
                + "    int? id,\n"
                + "    String? title,\n"
                + "    bool? done,\n"
                + "  }) {\n"
                + "    return Note(\n"
                + "      id: id ?? this.id,\n"
                + "      title: title ?? this.title,\n"
                + "      done: done ?? this.done,\n"
                + "    );\n"
                + "  }\n"
                + "\n"
                + "  @override\n"
                + "  String toString() => 'Note(id: $id, title: $title, done: $done)';\n"
                + "\n"
                + "  @override\n"
                + "  bool operator ==(Object other) =>\n"
                + "      identical(this, other) ||\n"
                + "      other is Note &&\n"
                + "          runtimeType == other.runtimeType &&\n"
                + "          other.id == id &&\n"
                + "          other.title == title &&\n"
                + "          other.done == done;\n"
                + "\n"
                + "  @override\n"
                + "  int get hashCode => Object.hash(id, title, done);\n"
                + "}\n";
        assertEquals(expected, generator.generate(note, ctx));
        assertTrue(warnings.toDeterministicList().isEmpty());
    }

    @Test
    void singleFieldDataClassHashesTheField() {
        SourceDeclaration tag = SourceDeclaration.type(DeclarationKind.DATA_CLASS, "Tag", null,
                List.of(SourceParameter.of("label", "String")), null);
        assertTrue(generator.generate(tag, ctx).contains("  int get hashCode => label.hashCode;\n"));
    }

    @Test
    void simpleEnumIsACommaList() {
        SourceDeclaration priority = declaration(DeclarationKind.ENUM_CLASS, "Priority", null, null, null, null,
                List.of("LOW", "HIGH_PRIORITY"));
        assertEquals("enum Priority {\n  low,\n  highPriority\n}\n", generator.generate(priority, ctx));
    }

    @Test
    void enumWithFieldsIsEnhanced() {
        SourceDeclaration level = declaration(DeclarationKind.ENUM_CLASS, "Level", null, null,
                List.of(SourceParameter.of("label", "String")), null,
                List.of("LOW(\"Low\")", "HIGH(\"High\")"));
        String expected = "enum Level {\n"
                + "  low('Low'),\n"
                + "  high('High');\n"
                + "\n"
                + "  final String label;\n"
                + "\n"
                + "  const Level(this.label);\n"
                + "}\n";
        assertEquals(expected, generator.generate(level, ctx));
    }

    @Test
    void sealedHierarchyEmitsSubtypesAfterTheBase() {
        SourceDeclaration loading = declaration(DeclarationKind.OBJECT, "Loading", null, List.of("UiState()"), null, null, null);
        SourceDeclaration failure = SourceDeclaration.type(DeclarationKind.DATA_CLASS, "Failure", List.of("UiState()"),
                List.of(SourceParameter.of("message", "String")), null);
        SourceDeclaration state = SourceDeclaration.type(DeclarationKind.SEALED_CLASS, "UiState", null, null, List.of(loading, failure));

        String code = generator.generate(state, ctx);
        assertTrue(code.startsWith("sealed class UiState {\n  const UiState();\n}\n\n"
                + "class Loading extends UiState {\n  const Loading();\n}\n\n"
                + "class Failure extends UiState {\n  final String message;\n"), code);
        assertEquals(1, code.split("class Failure ", -1).length - 1, code);
    }

    @Test
    void suspendFunctionReturnsFuture() {
        SourceExpr body = SourceExpr.Block.of(new SourceExpr.Other("val x: Int = 1"), new SourceExpr.Other("return repo.all()"));
        SourceDeclaration load = function("load", List.of("suspend"), List.of(SourceParameter.of("id", "String")), "List<Note>", body);
        assertEquals("Future<List<Note>> load(String id) async {\n"
                + "  int x = 1;\n"
                + "  return repo.all();\n"
                + "}\n", generator.generate(load, ctx));
    }

    @Test
    void expressionBodyUsesArrowAndOptionalParameters() {
        SourceDeclaration twice = function("scale", null, List.of(
                SourceParameter.of("x", "Int"),
                SourceParameter.of("factor", "Int", "2")), null, new SourceExpr.Other("x * factor"));
        assertEquals("dynamic scale(int x, [int factor = 2]) => x * factor;\n", generator.generate(twice, ctx));
    }

    @Test
    void interfaceBecomesAbstractClass() {
        SourceDeclaration all = function("all", null, null, "List<Note>", null);
        SourceDeclaration count = SourceDeclaration.property("count", "Int", false, null);
        SourceDeclaration repo = SourceDeclaration.type(DeclarationKind.INTERFACE, "Repository", null, null, List.of(all, count));
        assertEquals("abstract class Repository {\n  List<Note> all();\n\n  int get count;\n}\n", generator.generate(repo, ctx));
    }

    @Test
    void objectBecomesClassWithStaticMembers() {
        SourceDeclaration url = SourceDeclaration.property("baseUrl", null, false, "\"https://example.org\"");
        SourceDeclaration config = SourceDeclaration.type(DeclarationKind.OBJECT, "Config", null, null, List.of(url));
        assertEquals("class Config {\n  Config._();\n\n  static final baseUrl = 'https://example.org';\n}\n",
                generator.generate(config, ctx));
    }

    @Test
    void regularClassExtendsTheConstructorCallSupertype() {
        SourceDeclaration repo = declaration(DeclarationKind.CLASS, "NoteRepository", null,
                List.of("BaseRepository()", "Closeable"),
                List.of(new SourceParameter("hits", "Int", "0", null, false, true)), null, null);
        assertEquals("class NoteRepository extends BaseRepository implements Closeable {\n"
                + "  int hits;\n"
                + "\n"
                + "  NoteRepository({\n"
                + "    this.hits = 0,\n"
                + "  });\n"
                + "}\n", generator.generate(repo, ctx));
    }

    @Test
    void nestedTypesFollowTheirOwner() {
        SourceDeclaration mode = declaration(DeclarationKind.ENUM_CLASS, "Mode", null, null, null, null, List.of("A"));
        SourceDeclaration outer = SourceDeclaration.type(DeclarationKind.CLASS, "Outer", null, null, List.of(mode));
        assertEquals("class Outer {\n  Outer();\n}\n\nenum Mode {\n  a\n}\n", generator.generate(outer, ctx));
    }

    @Test
    void topLevelProperties() {
        assertEquals("int retries = 3;\n", generator.generate(SourceDeclaration.property("retries", "Int", true, "3"), ctx));
        assertEquals("late final String token;\n", generator.generate(SourceDeclaration.property("token", "String", false, null), ctx));
        assertEquals("final greeting = 'Hi';\n", generator.generate(SourceDeclaration.property("greeting", null, false, "\"Hi\""), ctx));
    }

    @Test
    void unknownTypesAreReported() {
        generator.generate(SourceDeclaration.property("clock", "Clock", false, "Clock()"), ctx);
        List<GenerationWarning> list = warnings.toDeterministicList();
        assertEquals(1, list.size());
        assertEquals(GenerationWarnings.UNMAPPED_TYPE, list.get(0).code);
        assertEquals("Type kept as-is: Clock", list.get(0).message);
    }

    @Test
    void enumConstantNames() {
        assertEquals("inProgress", DeclarationGenerator.enumConstant("IN_PROGRESS"));
        assertEquals("red", DeclarationGenerator.enumConstant("Red"));
        assertEquals("a", DeclarationGenerator.enumConstant("A"));
    }
}
