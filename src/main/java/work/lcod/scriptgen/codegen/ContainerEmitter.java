package work.lcod.scriptgen.codegen;

import java.util.ArrayList;
import java.util.List;
import work.lcod.scriptgen.graph.Block;
import work.lcod.scriptgen.graph.ContainerKind;

/**
 * Emits one control-flow container: opening syntax, each zone as a nested scope, closing syntax.
 * A bound container is written as the right-hand side of its assignment.
 */
final class ContainerEmitter implements ContainerKind.Visitor<List<Binding>> {
    private final ScopeEmitter scopes;
    private final ScriptWriter out;
    private final Block container;
    private final String input;
    private final Binding target;
    private final int indent;

    ContainerEmitter(ScopeEmitter scopes, Block container, String input, Binding target, int indent) {
        this.scopes = scopes;
        this.out = scopes.writer();
        this.container = container;
        this.input = input;
        this.target = target;
        this.indent = indent;
    }

    @Override
    public List<Binding> visitConditional(ContainerKind.Conditional conditional) {
        var created = new ArrayList<Binding>();
        out.line(indent, assignment() + "if (" + conditional.condition() + ") {");
        created.addAll(zone(ContainerKind.Conditional.THEN, input));
        out.line(indent, "}");
        if (scopes.hasChildren(container, ContainerKind.Conditional.ELSE)) {
            out.line(indent, "else {");
            created.addAll(zone(ContainerKind.Conditional.ELSE, input));
            out.line(indent, "}");
        }
        return created;
    }

    @Override
    public List<Binding> visitForEach(ContainerKind.ForEach forEach) {
        var head = input == null || input.isEmpty() ? "ForEach-Object {" : input + " | ForEach-Object {";
        out.line(indent, assignment() + head);
        var created = zone(ContainerKind.ForEach.BODY, ContainerKind.ForEach.LOOP_VARIABLE);
        out.line(indent, "}");
        return created;
    }

    @Override
    public List<Binding> visitWhile(ContainerKind.While loop) {
        out.line(indent, assignment() + "while (" + loop.condition() + ") {");
        var created = zone(ContainerKind.While.BODY, input);
        out.line(indent, "}");
        return created;
    }

    @Override
    public List<Binding> visitErrorIsolation(ContainerKind.ErrorIsolation errorIsolation) {
        var created = new ArrayList<Binding>();
        out.line(indent, assignment() + "try {");
        if (!errorIsolation.errorAction().isEmpty()) {
            out.line(indent + 1, "$ErrorActionPreference = '" + errorIsolation.errorAction() + "'");
        }
        created.addAll(zone(ContainerKind.ErrorIsolation.TRY, input));
        out.line(indent, "}");
        out.line(indent, "catch {");
        // TODO: expose the caught error ($_) to the recovery zone once the editor can wire it.
        created.addAll(zone(ContainerKind.ErrorIsolation.CATCH, null));
        out.line(indent, "}");
        return created;
    }

    private List<Binding> zone(String name, String implicitInput) {
        return scopes.emitZone(container, name, indent + 1, implicitInput);
    }

    private String assignment() {
        return target == null ? "" : target.reference() + " = ";
    }
}
