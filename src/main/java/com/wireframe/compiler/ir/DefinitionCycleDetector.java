package com.wireframe.compiler.ir;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wireframe.compiler.ir.error.CyclicComponentDefinition;
import com.wireframe.compiler.syntax.CellSyntax;
import com.wireframe.compiler.syntax.ComponentSyntax;
import com.wireframe.compiler.syntax.DefinitionSyntax;
import com.wireframe.compiler.syntax.LayoutSyntax;
import com.wireframe.compiler.syntax.SyntaxNode;
import com.wireframe.compiler.syntax.SyntaxNodeVisitor;

/**
 * Finds definitions that reach themselves through their bodies.
 *
 * The walk is an explicit-stack DFS over the definition graph. {@code expanding} holds the
 * definitions on the current path; reaching one of them again closes a cycle. Roots and edges are
 * visited in lexical order so the same input always reports the same chain.
 */
public class DefinitionCycleDetector {
    private static final Logger log = LoggerFactory.getLogger(DefinitionCycleDetector.class);

    private final DefinitionTable definitions;

    public DefinitionCycleDetector(DefinitionTable definitions) {
        this.definitions = definitions;
    }

    public Optional<CyclicComponentDefinition> detect() {
        Map<String, Set<String>> edges = buildEdges();
        Set<String> finished = new HashSet<>();

        for (String start : edges.keySet()) {
            if (finished.contains(start)) {
                continue;
            }

            Set<String> expanding = new HashSet<>();
            List<String> path = new ArrayList<>();
            Deque<Frame> stack = new ArrayDeque<>();

            stack.push(new Frame(start, edges.get(start).iterator()));
            expanding.add(start);
            path.add(start);

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (!frame.next.hasNext()) {
                    stack.pop();
                    expanding.remove(frame.name);
                    path.remove(path.size() - 1);
                    finished.add(frame.name);
                    continue;
                }

                String target = frame.next.next();
                if (expanding.contains(target)) {
                    List<String> chain = new ArrayList<>(path.subList(path.indexOf(target), path.size()));
                    chain.add(target);
                    log.debug("Definition cycle found: {}", chain);
                    return Optional.of(new CyclicComponentDefinition(chain,
                            definitions.get(target).map(DefinitionSyntax::getSpan).orElse(null)));
                }
                if (finished.contains(target)) {
                    continue;
                }

                stack.push(new Frame(target, edges.get(target).iterator()));
                expanding.add(target);
                path.add(target);
            }
        }
        return Optional.empty();
    }

    /**
     * Edge A to B for every use of definition B anywhere inside A's body, in order of first use.
     */
    Map<String, Set<String>> buildEdges() {
        Map<String, Set<String>> edges = new LinkedHashMap<>();
        for (DefinitionSyntax definition : definitions.all()) {
            Set<String> targets = new LinkedHashSet<>();
            collectUses(definition.getBody(), targets);
            edges.put(definition.getName(), targets);
        }
        return edges;
    }

    private void collectUses(SyntaxNode body, Set<String> targets) {
        Deque<SyntaxNode> pending = new ArrayDeque<>();
        pending.push(body);
        UseCollector collector = new UseCollector(targets);

        while (!pending.isEmpty()) {
            SyntaxNode node = pending.pop();
            node.accept(collector);
            List<SyntaxNode> children = node.getChildNodes();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
    }

    private final class UseCollector implements SyntaxNodeVisitor {
        private final Set<String> targets;

        private UseCollector(Set<String> targets) {
            this.targets = targets;
        }

        @Override
        public void visit(LayoutSyntax node) {
            definitions.layout(node.getLayoutType()).ifPresent(def -> targets.add(def.getName()));
        }

        @Override
        public void visit(ComponentSyntax node) {
            definitions.component(node.getComponentType()).ifPresent(def -> targets.add(def.getName()));
        }

        @Override
        public void visit(CellSyntax node) {
            // cells only group children
        }
    }

    private static final class Frame {
        private final String name;
        private final Iterator<String> next;

        private Frame(String name, Iterator<String> next) {
            this.name = name;
            this.next = next;
        }
    }
}
