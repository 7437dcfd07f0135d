package com.eisenscript.xml.graph;

import com.eisenscript.xml.loader.ast.CallNode;
import com.eisenscript.xml.loader.ast.LoopNode;
import com.eisenscript.xml.loader.ast.RuleDefinitionNode;
import com.eisenscript.xml.loader.ast.ScriptNode;
import com.eisenscript.xml.loader.ast.ShapeCallNode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Turns a parsed script into a {@link RuleGraph}.
 *
 * <p>The entry block becomes the rule {@code entry}, always first. A call wrapped in a single loop
 * carries that loop's transforms and count. A call wrapped in several loops is flattened: the call
 * site keeps the outermost loop and targets a synthesized helper rule named
 * {@code <target>_NN}; each helper holds the next loop inward, and the innermost helper invokes the
 * called shape or rule. Helpers are listed right after the rule whose call created them.</p>
 */
public final class RuleGraphBuilder {

    public RuleGraph build(ScriptNode script) {
        Objects.requireNonNull(script, "script");
        Set<String> explicitNames = new HashSet<>();
        explicitNames.add(RuleGraph.ENTRY_RULE);
        for (RuleDefinitionNode definition : script.getRuleDefinitions()) {
            explicitNames.add(definition.getName());
        }

        BuildContext context = new BuildContext(explicitNames);
        List<RuleRecord> rules = new ArrayList<>();
        rules.add(new RuleRecord(RuleGraph.ENTRY_RULE, null, null, null, buildCalls(script.getEntryCalls(), context)));
        rules.addAll(context.drainHelpers());

        for (RuleDefinitionNode definition : script.getRuleDefinitions()) {
            List<CallRecord> calls = buildCalls(definition.getCalls(), context);
            rules.add(
                    new RuleRecord(
                            definition.getName(),
                            definition.getWeight(),
                            definition.getMaxDepth(),
                            definition.getSuccessor(),
                            calls));
            rules.addAll(context.drainHelpers());
        }

        String maxDepth = script.getGlobalMaxDepth() != null ? script.getGlobalMaxDepth() : RuleGraph.DEFAULT_MAX_DEPTH;
        return new RuleGraph(maxDepth, rules);
    }

    private List<CallRecord> buildCalls(List<CallNode> calls, BuildContext context) {
        List<CallRecord> records = new ArrayList<>(calls.size());
        for (CallNode call : calls) {
            records.add(buildCall(call, context));
        }
        return records;
    }

    private CallRecord buildCall(CallNode call, BuildContext context) {
        List<LoopNode> loops = call.getLoops();
        if (loops.isEmpty()) {
            return targetCall(call, "", null);
        }
        LoopNode outer = loops.get(0);
        if (loops.size() == 1) {
            return targetCall(call, TransformNormalizer.serialize(outer.getTransforms()), outer.getCount());
        }

        String helperName = context.nextHelperName(call.getTarget());
        CallRecord site = new RuleCallRecord(helperName, TransformNormalizer.serialize(outer.getTransforms()), outer.getCount());
        for (int i = 1; i < loops.size(); i++) {
            LoopNode loop = loops.get(i);
            String transforms = TransformNormalizer.serialize(loop.getTransforms());
            CallRecord helperCall;
            String nextName = null;
            if (i == loops.size() - 1) {
                helperCall = targetCall(call, transforms, loop.getCount());
            } else {
                nextName = context.nextHelperName(call.getTarget());
                helperCall = new RuleCallRecord(nextName, transforms, loop.getCount());
            }
            context.addHelper(new RuleRecord(helperName, null, null, null, List.of(helperCall)));
            helperName = nextName;
        }
        return site;
    }

    private static CallRecord targetCall(CallNode call, String transforms, String count) {
        if (call instanceof ShapeCallNode shape) {
            return new InstanceCallRecord(shape.getShape(), transforms, count);
        }
        return new RuleCallRecord(call.getTarget(), transforms, count);
    }

    /** Mutable state of a single build: the helper-name sequence and helpers awaiting placement. */
    static final class BuildContext {
        private final Set<String> usedNames;
        private final List<RuleRecord> pendingHelpers = new ArrayList<>();
        private int sequence;

        BuildContext(Set<String> explicitNames) {
            this.usedNames = new HashSet<>(explicitNames);
        }

        String nextHelperName(String target) {
            String name;
            do {
                name = target + "_" + String.format(Locale.ROOT, "%02d", sequence++);
            } while (!usedNames.add(name));
            return name;
        }

        void addHelper(RuleRecord helper) {
            pendingHelpers.add(helper);
        }

        List<RuleRecord> drainHelpers() {
            List<RuleRecord> drained = new ArrayList<>(pendingHelpers);
            pendingHelpers.clear();
            return drained;
        }
    }
}
