package com.wireframe.compiler.ir;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.wireframe.compiler.ir.error.StructuralViolation;
import com.wireframe.compiler.syntax.DefinitionKind;
import com.wireframe.compiler.syntax.DefinitionSyntax;

/**
 * Name to definition table, filled before any expansion so a definition may be used
 * lexically before it is declared. Component and layout definitions share one namespace.
 */
public final class DefinitionTable {
    private final Map<String, DefinitionSyntax> definitions;

    private DefinitionTable(Map<String, DefinitionSyntax> definitions) {
        this.definitions = Collections.unmodifiableMap(definitions);
    }

    /**
     * Hoists every definition in lexical order. A repeated name is reported once per redefinition;
     * the first declaration stays in the table.
     */
    public static DefinitionTable hoist(List<DefinitionSyntax> declarations, BuildDiagnostics diagnostics) {
        Map<String, DefinitionSyntax> table = new LinkedHashMap<>();
        for (DefinitionSyntax definition : declarations) {
            DefinitionSyntax previous = table.get(definition.getName());
            if (previous != null) {
                diagnostics.error(new StructuralViolation(
                        StructuralViolation.DUPLICATE_DEFINITION,
                        null,
                        "'" + definition.getName() + "' is already defined as a " + previous.getKind().tag()
                                + (previous.getSpan() == null ? "" : " at " + previous.getSpan()),
                        definition.getSpan()));
                continue;
            }
            table.put(definition.getName(), definition);
        }
        return new DefinitionTable(table);
    }

    public Optional<DefinitionSyntax> component(String name) {
        return find(name, DefinitionKind.COMPONENT);
    }

    public Optional<DefinitionSyntax> layout(String name) {
        return find(name, DefinitionKind.LAYOUT);
    }

    public Optional<DefinitionSyntax> get(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    /**
     * All definitions in lexical order.
     */
    public Collection<DefinitionSyntax> all() {
        return definitions.values();
    }

    public int size() {
        return definitions.size();
    }

    private Optional<DefinitionSyntax> find(String name, DefinitionKind kind) {
        DefinitionSyntax definition = definitions.get(name);
        return definition != null && definition.getKind() == kind ? Optional.of(definition) : Optional.empty();
    }
}
