package work.lcod.scriptgen.codegen;

import java.util.List;
import work.lcod.scriptgen.graph.Block;
import work.lcod.scriptgen.graph.ContainerKind;

/**
 * Writes the hoisted definition of a named callable. Call sites are ordinary chain members.
 */
final class CallableEmitter {
    private final ScopeEmitter scopes;
    private final ScriptWriter out;

    CallableEmitter(ScopeEmitter scopes) {
        this.scopes = scopes;
        this.out = scopes.writer();
    }

    List<Binding> emitDefinition(Block block, ContainerKind.Callable callable) {
        out.line(0, "function " + callable.name() + " {");
        if (!callable.returnType().isEmpty()) {
            out.line(1, "[OutputType([" + callable.returnType() + "])]");
        }

        List<Binding> created;
        if (callable.hasInputParam()) {
            var parameter = "$" + VariableBinder.stripSigil(callable.inputParam());
            out.line(1, "param(");
            out.line(2, "[Parameter(ValueFromPipeline)]");
            out.line(2, parameter);
            out.line(1, ")");
            out.line(1, "process {");
            created = scopes.emitZone(block, ContainerKind.Callable.BODY, 2, parameter);
            emitReturn(callable, 2);
            out.line(1, "}");
        } else {
            if (!callable.returnType().isEmpty()) {
                out.line(1, "param()");
            }
            created = scopes.emitZone(block, ContainerKind.Callable.BODY, 1, null);
            emitReturn(callable, 1);
        }

        out.line(0, "}");
        out.blank();
        return created;
    }

    private void emitReturn(ContainerKind.Callable callable, int indent) {
        if (!callable.returnVariable().isEmpty()) {
            out.line(indent, "return $" + VariableBinder.stripSigil(callable.returnVariable()));
        }
    }
}
