package work.lcod.scriptgen.codegen;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import work.lcod.scriptgen.graph.Block;
import work.lcod.scriptgen.graph.ContainerKind;
import work.lcod.scriptgen.graph.Parameter;

/**
 * Renders leaf blocks, call sites and parameters as PowerShell pipeline stages.
 */
final class BlockExpressions {
    static final String PIPE = " | ";

    private BlockExpressions() {}

    static String pipeline(String upstream, List<Block> members) {
        var segments = new ArrayList<String>();
        if (upstream != null && !upstream.isEmpty()) {
            segments.add(upstream);
        }
        for (var member : members) {
            var expression = expression(member);
            if (!expression.isEmpty()) {
                segments.add(expression);
            }
        }
        return segments.isEmpty() ? "$null" : String.join(PIPE, segments);
    }

    static String expression(Block block) {
        if (block.container() instanceof ContainerKind.Callable callable) {
            return callable.name();
        }
        if (block.isCommand()) {
            var args = arguments(block);
            return args.isEmpty() ? block.command() : block.command() + " " + args;
        }
        return block.script().trim();
    }

    static String arguments(Block block) {
        var args = new ArrayList<String>();
        for (var parameter : block.parameters()) {
            var arg = argument(parameter);
            if (!arg.isEmpty()) {
                args.add(arg);
            }
        }
        return String.join(" ", args);
    }

    /** Empty when the parameter has no effective value or is a switch turned off. */
    static String argument(Parameter parameter) {
        var value = parameter.effectiveValue();
        if (value.isBlank()) {
            return "";
        }
        var name = parameter.name();
        return switch (parameter.type()) {
            case STRING, PATH -> "-" + name + " " + quote(value);
            case INT -> "-" + name + " " + value;
            case BOOL -> "true".equals(value.toLowerCase(Locale.ROOT)) ? "-" + name : "";
            case STRING_ARRAY -> "-" + name + " @(" + arrayItems(value) + ")";
            case SCRIPT_BLOCK -> "-" + name + " { " + value + " }";
            case ENUM, CREDENTIAL -> "-" + name + " \"" + value + "\"";
        };
    }

    private static String quote(String value) {
        return "\"" + value.replace("\"", "`\"") + "\"";
    }

    private static String arrayItems(String value) {
        var items = new ArrayList<String>();
        for (var item : value.split(",")) {
            items.add("\"" + item.trim() + "\"");
        }
        return String.join(", ", items);
    }
}
