package info.isaksson.erland.composetoflutter.testutil;

import info.isaksson.erland.composetoflutter.ir.DeclarationKind;
import info.isaksson.erland.composetoflutter.ir.SourceDeclaration;
import info.isaksson.erland.composetoflutter.ir.SourceExpr;
import info.isaksson.erland.composetoflutter.ir.SourceParameter;
import info.isaksson.erland.composetoflutter.ir.SourceProject;
import info.isaksson.erland.composetoflutter.ir.SourceUnit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Small hand-written projects for pipeline tests. */
public final class Sources {
    private Sources() {}

    public static SourceProject project(String name, SourceUnit... units) {
        return SourceProject.of(name, Arrays.asList(units));
    }

    public static SourceUnit unit(String path, String pkg, List<String> imports, SourceDeclaration... declarations) {
        return new SourceUnit(path, pkg, imports, Arrays.asList(declarations), null);
    }

    public static SourceDeclaration cls(String name) {
        return SourceDeclaration.type(DeclarationKind.CLASS, name, null, null, null);
    }

    /** {@code @Composable fun name() { Text("text") }} */
    public static SourceDeclaration textComponent(String name, String text) {
        SourceExpr.Call call = new SourceExpr.Call("Text(\"" + text + "\")", "Text",
                List.of(SourceExpr.Argument.positional(SourceExpr.StringLiteral.of(text))), List.of());
        return SourceDeclaration.function(name, List.of("Composable"), List.of(), null, SourceExpr.Block.of(call));
    }

    /** {@code @Composable fun name(params) { callee(arg0, ...) }} with name references as arguments. */
    public static SourceDeclaration callingComponent(String name, List<SourceParameter> params, String callee, String... refs) {
        List<SourceExpr.Argument> args = new ArrayList<>();
        for (String r : refs) args.add(SourceExpr.Argument.positional(SourceExpr.NameRef.of(r)));
        SourceExpr.Call call = new SourceExpr.Call(callee + "(" + String.join(", ", refs) + ")", callee, args, List.of());
        return SourceDeclaration.function(name, List.of("Composable"), params, null, SourceExpr.Block.of(call));
    }
}
