package work.lcod.scriptgen.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One node of the authoring graph: a leaf block (command or script fragment) or a container with zones.
 */
public record Block(
    String id,
    String title,
    String category,
    String command,
    String script,
    String outputVariable,
    List<Parameter> parameters,
    ContainerKind container,
    List<Zone> zones,
    List<Port> inputs,
    List<Port> outputs
) {
    public Block {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Block id must not be blank");
        }
        title = title == null ? "" : title;
        category = category == null ? "" : category;
        command = command == null ? "" : command.trim();
        script = script == null ? "" : script;
        outputVariable = outputVariable == null ? "" : outputVariable.trim();
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        zones = zones == null || container == null ? List.of() : List.copyOf(zones);
        inputs = inputs == null ? List.of(Port.input(Port.DEFAULT_INPUT)) : List.copyOf(inputs);
        outputs = outputs == null ? List.of(Port.output(Port.DEFAULT_OUTPUT)) : List.copyOf(outputs);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public boolean isContainer() {
        return container != null;
    }

    public boolean isControlFlow() {
        return container instanceof ContainerKind.ControlFlow;
    }

    public boolean isCallable() {
        return container instanceof ContainerKind.Callable;
    }

    public boolean isCommand() {
        return !command.isEmpty();
    }

    public Optional<Parameter> parameter(String name) {
        for (var parameter : parameters) {
            if (parameter.name().equals(name)) {
                return Optional.of(parameter);
            }
        }
        return Optional.empty();
    }

    public boolean hasPort(String name, PortDirection direction) {
        var ports = direction == PortDirection.INPUT ? inputs : outputs;
        for (var port : ports) {
            if (port.name().equals(name)) {
                return true;
            }
        }
        return false;
    }

    public static final class Builder {
        private final String id;
        private String title = "";
        private String category = "";
        private String command = "";
        private String script = "";
        private String outputVariable = "";
        private final List<Parameter> parameters = new ArrayList<>();
        private ContainerKind container;
        private final List<Zone> zones = new ArrayList<>();
        private List<Port> inputs;
        private List<Port> outputs;

        private Builder(String id) {
            this.id = id;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder command(String command) {
            this.command = command;
            return this;
        }

        public Builder script(String script) {
            this.script = script;
            return this;
        }

        public Builder outputVariable(String outputVariable) {
            this.outputVariable = outputVariable;
            return this;
        }

        public Builder parameter(Parameter parameter) {
            this.parameters.add(parameter);
            return this;
        }

        public Builder parameters(List<Parameter> parameters) {
            this.parameters.addAll(parameters);
            return this;
        }

        public Builder container(ContainerKind container) {
            this.container = container;
            return this;
        }

        public Builder zone(String name, List<String> children) {
            this.zones.add(new Zone(name, children));
            return this;
        }

        public Builder inputs(List<Port> inputs) {
            this.inputs = inputs;
            return this;
        }

        public Builder outputs(List<Port> outputs) {
            this.outputs = outputs;
            return this;
        }

        public Block build() {
            return new Block(id, title, category, command, script, outputVariable, parameters, container, zones, inputs, outputs);
        }
    }
}
