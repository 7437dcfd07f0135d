package com.eisenscript.xml.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.eisenscript.xml.loader.ast.CallNode;
import com.eisenscript.xml.loader.ast.LoopNode;
import com.eisenscript.xml.loader.ast.RuleCallNode;
import com.eisenscript.xml.loader.ast.RuleDefinitionNode;
import com.eisenscript.xml.loader.ast.ScriptNode;
import com.eisenscript.xml.loader.ast.ShapeCallNode;
import com.eisenscript.xml.loader.ast.TransformNode;
import java.util.List;
import org.junit.jupiter.api.Test;

class EisenScriptAstBuilderTest {

    private static final String SAMPLE_SCRIPT =
            String.join(
                    "\n",
                    "set maxdepth 400",
                    "R1",
                    "2 * { y 1 } box",
                    "rule R1 md 10 > R2 w 2 {",
                    "  { x 1 rx 6 } R1",
                    "  box",
                    "}",
                    "rule R2 weight 0.5 maxdepth 3 {",
                    "  sphere",
                    "}",
                    "");

    @Test
    void parsesSettingsEntryBlockAndRules() throws Exception {
        ScriptNode script = new EisenScriptAstBuilder().parse("sample.es", SAMPLE_SCRIPT);

        assertEquals("400", script.getGlobalMaxDepth());
        assertEquals(2, script.getEntryCalls().size());

        RuleCallNode first = assertInstanceOf(RuleCallNode.class, script.getEntryCalls().get(0));
        assertEquals("R1", first.getRuleName());
        assertTrue(first.getLoops().isEmpty());
        assertEquals(2, first.getLocation().getLine());

        ShapeCallNode second = assertInstanceOf(ShapeCallNode.class, script.getEntryCalls().get(1));
        assertEquals("box", second.getShape());
        LoopNode loop = second.getLoops().get(0);
        assertEquals("2", loop.getCount());
        assertEquals(1, loop.getTransforms().size());
        assertEquals("y", loop.getTransforms().get(0).getId());
        assertEquals(List.of("1"), loop.getTransforms().get(0).getValues());

        List<RuleDefinitionNode> rules = script.getRuleDefinitions();
        assertEquals(2, rules.size());
        RuleDefinitionNode r1 = rules.get(0);
        assertEquals("R1", r1.getName());
        assertEquals("10", r1.getMaxDepth());
        assertEquals("R2", r1.getSuccessor());
        assertEquals("2", r1.getWeight());
        assertEquals(2, r1.getCalls().size());
        RuleCallNode recursive = assertInstanceOf(RuleCallNode.class, r1.getCalls().get(0));
        assertNull(recursive.getLoops().get(0).getCount());
        List<TransformNode> transforms = recursive.getLoops().get(0).getTransforms();
        assertEquals(List.of("x", "rx"), List.of(transforms.get(0).getId(), transforms.get(1).getId()));
        assertEquals(List.of("6"), transforms.get(1).getValues());

        RuleDefinitionNode r2 = rules.get(1);
        assertEquals("0.5", r2.getWeight());
        assertEquals("3", r2.getMaxDepth());
        assertNull(r2.getSuccessor());
        assertEquals(4, r1.getLocation().getLine());
    }

    @Test
    void scriptMadeOfRulesOnlyHasEmptyEntryBlock() throws Exception {
        ScriptNode script = new EisenScriptAstBuilder().parse("foo.es", "rule foo { 3 * {x 1} box }");

        assertTrue(script.getEntryCalls().isEmpty());
        assertNull(script.getGlobalMaxDepth());
        assertEquals(1, script.getRuleDefinitions().size());
        CallNode call = script.getRuleDefinitions().get(0).getCalls().get(0);
        assertEquals("box", call.getTarget());
        assertEquals("3", call.getLoops().get(0).getCount());
    }

    @Test
    void groupedLoopsReadLikePlainLoops() throws Exception {
        ScriptNode script = new EisenScriptAstBuilder().parse("nested.es", "rule bar { {3*{ry 10}}{2*{rz 5}} foo }");

        CallNode call = script.getRuleDefinitions().get(0).getCalls().get(0);
        assertEquals("foo", call.getTarget());
        assertEquals(2, call.getLoops().size());
        assertEquals("3", call.getLoops().get(0).getCount());
        assertEquals("ry", call.getLoops().get(0).getTransforms().get(0).getId());
        assertEquals("2", call.getLoops().get(1).getCount());
        assertEquals(List.of("5"), call.getLoops().get(1).getTransforms().get(0).getValues());
    }

    @Test
    void colorAndMaterialClausesAreDropped() throws Exception {
        ScriptNode script =
                new EisenScriptAstBuilder()
                        .parse("color.es", "{ hue 120 x 1 color #ff0000 blend red 0.5 sat 0.5 a 0.9 } box");

        List<TransformNode> transforms = script.getEntryCalls().get(0).getLoops().get(0).getTransforms();
        assertEquals(1, transforms.size());
        assertEquals("x", transforms.get(0).getId());
    }

    @Test
    void shapeKeywordIsLowercasedAndSuffixKept() throws Exception {
        ScriptNode script = new EisenScriptAstBuilder().parse("shapes.es", "Sphere::glossy BOX gridx");

        assertEquals("sphere::glossy", ((ShapeCallNode) script.getEntryCalls().get(0)).getShape());
        assertEquals("box", ((ShapeCallNode) script.getEntryCalls().get(1)).getShape());
        assertEquals("gridx", ((ShapeCallNode) script.getEntryCalls().get(2)).getShape());
    }

    @Test
    void transformMnemonicsAreUsableAsRuleNames() throws Exception {
        ScriptNode script = new EisenScriptAstBuilder().parse("soft.es", "x\nrule x { b }\nrule b { { x 1 } x }");

        assertEquals("x", script.getEntryCalls().get(0).getTarget());
        assertEquals("x", script.getRuleDefinitions().get(0).getName());
        assertEquals("b", script.getRuleDefinitions().get(0).getCalls().get(0).getTarget());
        CallNode recursive = script.getRuleDefinitions().get(1).getCalls().get(0);
        assertEquals("x", recursive.getTarget());
        assertEquals(1, recursive.getLoops().size());
    }

    @Test
    void lastGlobalDepthSettingWins() throws Exception {
        ScriptNode script = new EisenScriptAstBuilder().parse("depth.es", "set md 10\nbox\nset maxdepth 20\n");

        assertEquals("20", script.getGlobalMaxDepth());
    }

    @Test
    void rejectsMacroDefinitions() {
        EisenScriptParseException ex =
                assertThrows(
                        EisenScriptParseException.class,
                        () -> new EisenScriptAstBuilder().parse("macro.es", "#define W 10\n{ x W } box\n"));

        assertEquals(1, ex.getLocation().getLine());
        assertEquals("macro.es", ex.getLocation().getSourceName());
        assertTrue(ex.getMessage().startsWith("line 1:1"), ex.getMessage());
    }

    @Test
    void rejectsRepeatedModifier() {
        EisenScriptParseException ex =
                assertThrows(
                        EisenScriptParseException.class,
                        () -> new EisenScriptAstBuilder().parse("dup.es", "rule r md 10 w 1 maxdepth 20 { box }"));

        assertTrue(ex.getMessage().contains("duplicate maxdepth modifier"), ex.getMessage());
        assertEquals(18, ex.getLocation().getColumn());
    }

    @Test
    void reportsPositionOfEmptyRuleBody() {
        EisenScriptParseException ex =
                assertThrows(
                        EisenScriptParseException.class,
                        () -> new EisenScriptAstBuilder().parse("empty.es", "box\nrule r { }"));

        assertEquals(2, ex.getLocation().getLine());
        assertEquals(10, ex.getLocation().getColumn());
    }

    @Test
    void rejectsCallsAfterRuleDefinitions() {
        assertThrows(
                EisenScriptParseException.class,
                () -> new EisenScriptAstBuilder().parse("late.es", "rule r { box }\nsphere\n"));
    }

    @Test
    void rejectsUnknownCharacters() {
        EisenScriptParseException ex =
                assertThrows(
                        EisenScriptParseException.class,
                        () -> new EisenScriptAstBuilder().parse("bad.es", "{ x 1, 2 } box"));

        assertEquals(6, ex.getLocation().getColumn());
    }

    @Test
    void acceptsRuleNamesStartingWithShapeWords() throws Exception {
        ScriptNode script =
                new EisenScriptAstBuilder()
                        .parse("shapes.es", "linear\nrule linear md 5 > boxes { sphere }\nrule boxes { box }");

        RuleDefinitionNode linear = script.getRuleDefinitions().get(0);
        assertEquals("linear", linear.getName());
        assertEquals("5", linear.getMaxDepth());
        assertEquals("boxes", linear.getSuccessor());
        assertEquals("boxes", script.getRuleDefinitions().get(1).getName());

        ShapeCallNode call = assertInstanceOf(ShapeCallNode.class, script.getEntryCalls().get(0));
        assertEquals("linear", call.getShape());
    }

    @Test
    void rejectsRuleNamedEntry() {
        EisenScriptParseException ex =
                assertThrows(
                        EisenScriptParseException.class,
                        () -> new EisenScriptAstBuilder().parse("entry.es", "box\nrule entry { sphere }"));

        assertEquals(2, ex.getLocation().getLine());
        assertEquals(6, ex.getLocation().getColumn());
        assertTrue(ex.getMessage().contains("rule name 'entry' is reserved"), ex.getMessage());
    }

    @Test
    void rejectsMacroDefinitionBetweenCalls() {
        EisenScriptParseException ex =
                assertThrows(
                        EisenScriptParseException.class,
                        () -> new EisenScriptAstBuilder().parse("macro.es", "box\n#define X 1\nsphere\n"));

        assertEquals(2, ex.getLocation().getLine());
        assertEquals(1, ex.getLocation().getColumn());
        assertTrue(ex.getMessage().startsWith("line 2:1"), ex.getMessage());
    }
}
