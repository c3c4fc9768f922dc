package work.lcod.scriptgen.codegen;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.scriptgen.support.GraphTestSupport.graph;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.scriptgen.config.GeneratorSettings;
import work.lcod.scriptgen.diagnostics.DiagnosticCode;
import work.lcod.scriptgen.graph.Block;
import work.lcod.scriptgen.graph.Connection;
import work.lcod.scriptgen.graph.ContainerKind;
import work.lcod.scriptgen.graph.Port;

class ScriptGeneratorTest {
    private static final String EXECUTION = "# ── Execution ───────────────────────────────";
    private static final String FUNCTIONS = "# ── Function Definitions ────────────────────";

    private static ScriptGenerator headless() {
        return new ScriptGenerator(GeneratorSettings.builder().includeHeader(false).build());
    }

    private static String lines(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    @Test
    void emptyGraphProducesOnlyTheHeader() {
        var script = new ScriptGenerator().generate(graph().build());
        assertEquals(lines(
            "# ===========================================",
            "# Auto-generated PowerShell 5.1 Script",
            "# ===========================================",
            ""
        ), script);
    }

    @Test
    void linearChainCollapsesIntoOnePipeline() {
        var snapshot = graph()
            .command("a0000001", "Get-Process")
            .command("b0000001", "Sort-Object")
            .command("c0000001", "Select-Object")
            .connect("a0000001", "b0000001")
            .connect("b0000001", "c0000001")
            .build();

        var generator = headless();
        assertEquals(lines(
            EXECUTION,
            "",
            "Get-Process | Sort-Object | Select-Object",
            ""
        ), generator.generate(snapshot));
        assertTrue(generator.bindings().isEmpty());
        assertTrue(generator.diagnostics().isEmpty());
    }

    @Test
    void fanOutCapturesTheSharedResult() {
        var snapshot = graph()
            .command("aaaa1111", "Get-Process")
            .command("bbbb2222", "Sort-Object")
            .command("cccc3333", "Measure-Object")
            .connect("aaaa1111", "bbbb2222")
            .connect("aaaa1111", "cccc3333")
            .build();

        var generator = headless();
        assertEquals(lines(
            EXECUTION,
            "",
            "$GetProcess_aaaa = Get-Process",
            "",
            "$GetProcess_aaaa | Sort-Object",
            "",
            "$GetProcess_aaaa | Measure-Object",
            ""
        ), generator.generate(snapshot));
        assertEquals(Map.of("aaaa1111", "GetProcess_aaaa"), generator.bindings());
    }

    @Test
    void consumersFollowTheirProducerRegardlessOfAuthoringOrder() {
        var snapshot = graph()
            .command("c0000001", "Select-Object")
            .command("a0000001", "Get-Process")
            .connect("a0000001", "c0000001")
            .build();

        var script = headless().generate(snapshot);
        assertTrue(script.contains("Get-Process | Select-Object\n"), script);
    }

    @Test
    void topLevelCycleYieldsOnlyTheMarker() {
        var snapshot = graph()
            .command("a0000001", "Get-Process")
            .command("b0000001", "Sort-Object")
            .connect("a0000001", "b0000001")
            .connect("b0000001", "a0000001")
            .build();

        var generator = new ScriptGenerator();
        assertEquals(ScriptGenerator.CYCLE_MARKER + "\n", generator.generate(snapshot));
        assertTrue(generator.aborted());
        assertTrue(generator.diagnostics().stream().anyMatch(d -> d.code() == DiagnosticCode.CYCLE));
    }

    @Test
    void generationIsDeterministic() {
        var snapshot = graph()
            .command("aaaa1111", "Get-ChildItem")
            .container("loop0001", "For Each", new ContainerKind.ForEach(), ContainerKind.ForEach.BODY, "body0001")
            .command("body0001", "Write-Output")
            .command("tail0001", "Out-Null")
            .connect("aaaa1111", "loop0001")
            .connect("aaaa1111", "tail0001")
            .build();

        var first = new ScriptGenerator().generate(snapshot);
        var generator = new ScriptGenerator();
        generator.generate(snapshot);
        var again = generator.generate(snapshot);
        assertEquals(first, again);
        assertEquals(Map.of("aaaa1111", "GetChildItem_aaaa"), generator.bindings());
    }

    @Test
    void topLevelCallablesAreHoistedAndCalledByName() {
        var callable = Block.builder("fn000001")
            .title("Function")
            .container(new ContainerKind.Callable("Get-Data", "", "", ""))
            .zone(ContainerKind.Callable.BODY, List.of("inner001"))
            .build();
        var snapshot = graph()
            .block(callable)
            .command("inner001", "Get-Content")
            .command("use00001", "Write-Output")
            .connect("fn000001", "use00001")
            .build();

        assertEquals(lines(
            FUNCTIONS,
            "",
            "function Get-Data {",
            "    Get-Content",
            "",
            "}",
            "",
            EXECUTION,
            "",
            "Get-Data | Write-Output",
            ""
        ), headless().generate(snapshot));
    }

    @Test
    void callableIsHoistedEvenWhenItsCallSiteIsAuthoredFirst() {
        var callable = Block.builder("fn000001")
            .title("Function")
            .container(new ContainerKind.Callable("Get-Data", "", "", ""))
            .zone(ContainerKind.Callable.BODY, List.of("inner001"))
            .build();
        var snapshot = graph()
            .command("use00001", "Write-Output")
            .command("inner001", "Get-Content")
            .block(callable)
            .connect("fn000001", "use00001")
            .build();

        var script = headless().generate(snapshot);
        var definition = script.indexOf("function Get-Data {");
        assertTrue(definition >= 0, script);
        assertTrue(definition < script.indexOf(EXECUTION), script);
        assertEquals(definition, script.lastIndexOf("function Get-Data {"), script);
        assertTrue(script.endsWith(EXECUTION + "\n\nGet-Data | Write-Output\n\n"), script);
    }

    @Test
    void nestedCallableIsReportedAndOnlyCalled() {
        var nested = Block.builder("fn000002")
            .title("Inner")
            .container(new ContainerKind.Callable("Invoke-Inner", "", "", ""))
            .build();
        var snapshot = graph()
            .container("loop0001", "Loop", new ContainerKind.ForEach(), ContainerKind.ForEach.BODY, "fn000002")
            .block(nested)
            .build();

        var generator = headless();
        var script = generator.generate(snapshot);
        assertFalse(script.contains("function Invoke-Inner"), script);
        assertTrue(script.contains("    $_ | Invoke-Inner\n"), script);
        assertTrue(generator.diagnostics().stream()
            .anyMatch(d -> d.code() == DiagnosticCode.UNHOISTED_CALLABLE && "fn000002".equals(d.blockId())));
    }

    @Test
    void competingUpstreamsLeaveTheInputUnresolved() {
        var join = Block.builder("join0001")
            .title("Join-Path")
            .command("Join-Path")
            .inputs(List.of(Port.input("In"), Port.input("Child")))
            .build();
        var snapshot = graph()
            .command("a0000001", "Get-Location")
            .command("b0000001", "Get-Date")
            .block(join)
            .connect("a0000001", "join0001")
            .connect(new Connection("b0000001", "Out", "join0001", "Child"))
            .build();

        var generator = headless();
        var script = generator.generate(snapshot);
        assertTrue(script.contains("\nJoin-Path\n"), script);
        assertTrue(generator.diagnostics().stream()
            .anyMatch(d -> d.code() == DiagnosticCode.AMBIGUOUS_UPSTREAM && "join0001".equals(d.blockId())));
    }

    @Test
    void snapshotAnomaliesAreReportedButDoNotStopGeneration() {
        var snapshot = graph()
            .command("a0000001", "Get-Process")
            .connect("a0000001", "missing1")
            .build();

        var generator = headless();
        var script = generator.generate(snapshot);
        assertTrue(script.contains("Get-Process\n"), script);
        assertFalse(generator.aborted());
        assertEquals(DiagnosticCode.MALFORMED_REFERENCE, generator.diagnostics().get(0).code());
    }

    @Test
    void explicitOutputVariableWinsOverSynthesizedName() {
        var source = Block.builder("aaaa1111")
            .title("Get-Service")
            .command("Get-Service")
            .outputVariable("$services")
            .build();
        var snapshot = graph()
            .block(source)
            .command("b0000001", "Where-Object")
            .command("c0000001", "Measure-Object")
            .connect("aaaa1111", "b0000001")
            .connect("aaaa1111", "c0000001")
            .build();

        var script = headless().generate(snapshot);
        assertTrue(script.contains("$Services = Get-Service\n"), script);
        assertTrue(script.contains("$Services | Where-Object\n"), script);
    }

    @Test
    void sameTitlesGetDistinctNames() {
        var snapshot = graph()
            .command("abcd0001", "Get-Item")
            .command("abcd0002", "Get-Item")
            .command("x0000001", "Write-Output")
            .command("x0000002", "Write-Output")
            .command("y0000001", "Write-Output")
            .command("y0000002", "Write-Output")
            .connect("abcd0001", "x0000001")
            .connect("abcd0001", "x0000002")
            .connect("abcd0002", "y0000001")
            .connect("abcd0002", "y0000002")
            .build();

        var generator = headless();
        generator.generate(snapshot);
        assertEquals("GetItem_abcd", generator.bindings().get("abcd0001"));
        assertEquals("GetItem_abcd0", generator.bindings().get("abcd0002"));
    }

    @Test
    void bindingsCreatedInsideZonesArePartOfThePassResult() {
        var snapshot = graph()
            .command("src00001", "Get-ChildItem")
            .container("loop0001", "Loop", new ContainerKind.ForEach(), ContainerKind.ForEach.BODY, "x0000001", "y0000001", "z0000001")
            .command("x0000001", "Get-Item")
            .command("y0000001", "Write-Output")
            .command("z0000001", "Write-Host")
            .connect("src00001", "loop0001")
            .connect("x0000001", "y0000001")
            .connect("x0000001", "z0000001")
            .build();

        var generator = headless();
        var script = generator.generate(snapshot);
        assertTrue(script.contains("    $GetItem_x000 = $_ | Get-Item\n"), script);
        assertEquals(Map.of("src00001", "GetChildItem_src0", "x0000001", "GetItem_x000"), generator.bindings());
    }

    @Test
    void reusedExplicitOutputVariableIsReported() {
        var first = Block.builder("a0000001").title("Get-ChildItem").command("Get-ChildItem").outputVariable("$files").build();
        var second = Block.builder("d0000001").title("Get-Item").command("Get-Item").outputVariable("$files").build();
        var snapshot = graph()
            .block(first)
            .command("b0000001", "Measure-Object")
            .command("c0000001", "Sort-Object")
            .block(second)
            .command("e0000001", "Measure-Object")
            .command("f0000001", "Sort-Object")
            .connect("a0000001", "b0000001")
            .connect("a0000001", "c0000001")
            .connect("d0000001", "e0000001")
            .connect("d0000001", "f0000001")
            .build();

        var generator = headless();
        generator.generate(snapshot);
        var duplicates = generator.diagnostics().stream()
            .filter(d -> d.code() == DiagnosticCode.DUPLICATE_BINDING_NAME)
            .toList();
        assertEquals(1, duplicates.size());
        assertEquals("d0000001", duplicates.get(0).blockId());
    }

    @Test
    void indentWidthComesFromSettings() {
        var snapshot = graph()
            .container("loop0001", "Loop", new ContainerKind.ForEach(), ContainerKind.ForEach.BODY, "body0001")
            .command("body0001", "Write-Output")
            .build();

        var settings = GeneratorSettings.builder().includeHeader(false).indentWidth(2).build();
        var script = new ScriptGenerator(settings).generate(snapshot);
        assertTrue(script.contains("\n  $_ | Write-Output\n"), script);
    }

    @Test
    void customHeaderTitle() {
        var settings = GeneratorSettings.builder().headerTitle("Nightly cleanup").build();
        var script = new ScriptGenerator(settings).generate(graph().command("a0000001", "Get-Date").build());
        assertTrue(script.startsWith("# ===========================================\n# Nightly cleanup\n"), script);
    }
}
