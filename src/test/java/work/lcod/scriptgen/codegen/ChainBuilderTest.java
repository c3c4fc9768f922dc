package work.lcod.scriptgen.codegen;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static work.lcod.scriptgen.support.GraphTestSupport.graph;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.scriptgen.graph.Block;
import work.lcod.scriptgen.graph.Connection;
import work.lcod.scriptgen.graph.ContainerKind;
import work.lcod.scriptgen.graph.GraphSnapshot;
import work.lcod.scriptgen.graph.Port;

class ChainBuilderTest {
    private static List<List<String>> chains(GraphSnapshot snapshot) {
        var sorted = TopologicalSorter.sort(snapshot, snapshot.topLevel()).order();
        var scope = new ScopeGraph(snapshot, sorted);
        return ChainBuilder.build(sorted, scope).stream()
            .map(chain -> chain.members().stream().map(Block::id).toList())
            .toList();
    }

    @Test
    void oneToOneLinksFuse() {
        var snapshot = graph()
            .command("a", "Get-Process")
            .command("b", "Sort-Object")
            .command("c", "Select-Object")
            .connect("a", "b")
            .connect("b", "c")
            .build();

        assertEquals(List.of(List.of("a", "b", "c")), chains(snapshot));
    }

    @Test
    void fanOutEndsTheChain() {
        var snapshot = graph()
            .command("a", "Get-Process")
            .command("b", "Sort-Object")
            .command("c", "Measure-Object")
            .connect("a", "b")
            .connect("a", "c")
            .build();

        assertEquals(List.of(List.of("a"), List.of("b"), List.of("c")), chains(snapshot));
    }

    @Test
    void fanInStartsANewChain() {
        var snapshot = graph()
            .command("a", "Get-Process")
            .command("b", "Get-Service")
            .block(Block.builder("c")
                .title("Compare-Object")
                .command("Compare-Object")
                .inputs(List.of(Port.input("In"), Port.input("Difference")))
                .build())
            .connect("a", "c")
            .connect(new Connection("b", "Out", "c", "Difference"))
            .build();

        assertEquals(List.of(List.of("a"), List.of("b"), List.of("c")), chains(snapshot));
    }

    @Test
    void controlFlowContainersSplitChains() {
        var snapshot = graph()
            .command("a", "Get-ChildItem")
            .container("loop", "Loop", new ContainerKind.ForEach(), ContainerKind.ForEach.BODY)
            .command("b", "Out-File")
            .command("c", "Out-Null")
            .connect("a", "loop")
            .connect("loop", "b")
            .connect("b", "c")
            .build();

        assertEquals(List.of(List.of("a"), List.of("b", "c")), chains(snapshot));
    }

    @Test
    void callablesTakePartInChains() {
        var snapshot = graph()
            .block(Block.builder("fn")
                .title("Function")
                .container(new ContainerKind.Callable("Get-Data", null, null, null))
                .build())
            .command("b", "Write-Output")
            .connect("fn", "b")
            .build();

        assertEquals(List.of(List.of("fn", "b")), chains(snapshot));
    }
}
