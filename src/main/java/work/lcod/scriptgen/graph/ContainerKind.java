package work.lcod.scriptgen.graph;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Closed set of container kinds. Control-flow kinds wrap their zones in a construct at the point of use;
 * {@link Callable} is hoisted into a standalone definition and referenced by name everywhere else.
 */
public sealed interface ContainerKind permits ContainerKind.ControlFlow, ContainerKind.Callable {

    /** Zone names in the order the editor creates them. */
    List<String> zoneNames();

    sealed interface ControlFlow extends ContainerKind
        permits Conditional, ForEach, While, ErrorIsolation {

        <R> R accept(Visitor<R> visitor);
    }

    interface Visitor<R> {
        R visitConditional(Conditional conditional);

        R visitForEach(ForEach forEach);

        R visitWhile(While loop);

        R visitErrorIsolation(ErrorIsolation errorIsolation);
    }

    record Conditional(String condition) implements ControlFlow {
        public static final String THEN = "Then";
        public static final String ELSE = "Else";

        public Conditional {
            condition = orDefault(condition, "$true");
        }

        @Override
        public List<String> zoneNames() {
            return List.of(THEN, ELSE);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConditional(this);
        }
    }

    record ForEach() implements ControlFlow {
        public static final String BODY = "Body";
        public static final String LOOP_VARIABLE = "$_";

        @Override
        public List<String> zoneNames() {
            return List.of(BODY);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitForEach(this);
        }
    }

    record While(String condition) implements ControlFlow {
        public static final String BODY = "Body";

        public While {
            condition = orDefault(condition, "$true");
        }

        @Override
        public List<String> zoneNames() {
            return List.of(BODY);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWhile(this);
        }
    }

    /**
     * Protected region plus recovery region. The recovery zone receives no implicit input.
     */
    record ErrorIsolation(String errorAction) implements ControlFlow {
        public static final String TRY = "Try";
        public static final String CATCH = "Catch";

        public ErrorIsolation {
            errorAction = errorAction == null ? "" : errorAction.trim();
        }

        @Override
        public List<String> zoneNames() {
            return List.of(TRY, CATCH);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitErrorIsolation(this);
        }
    }

    record Callable(String name, String inputParam, String returnType, String returnVariable) implements ContainerKind {
        public static final String BODY = "Body";
        public static final String DEFAULT_NAME = "Invoke-MyFunction";

        public Callable {
            name = orDefault(name, DEFAULT_NAME);
            inputParam = inputParam == null ? "" : inputParam.trim();
            returnType = returnType == null ? "" : returnType.trim();
            returnVariable = returnVariable == null ? "" : returnVariable.trim();
        }

        @Override
        public List<String> zoneNames() {
            return List.of(BODY);
        }

        public boolean hasInputParam() {
            return !inputParam.isEmpty();
        }
    }

    /**
     * Builds a kind from its declared name and the container's parameters. Returns {@code null} for plain blocks.
     */
    static ContainerKind fromDeclaration(String declared, List<Parameter> parameters) {
        if (declared == null || declared.isBlank()) {
            return null;
        }
        var params = parameters == null ? List.<Parameter>of() : parameters;
        var key = declared.trim().toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
        return switch (key) {
            case "none" -> null;
            case "if", "ifelse", "conditional" -> new Conditional(param(params, "Condition"));
            case "foreach" -> new ForEach();
            case "while" -> new While(param(params, "Condition"));
            case "try", "trycatch", "errorisolation" -> new ErrorIsolation(param(params, "ErrorAction"));
            case "function", "callable" -> new Callable(
                param(params, "FunctionName"),
                param(params, "InputParam"),
                param(params, "ReturnType"),
                param(params, "ReturnVariable")
            );
            default -> throw new IllegalArgumentException("Unsupported container kind: " + declared);
        };
    }

    private static String param(List<Parameter> parameters, String name) {
        for (var parameter : parameters) {
            if (Objects.equals(parameter.name(), name)) {
                return parameter.effectiveValue();
            }
        }
        return null;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }
}
