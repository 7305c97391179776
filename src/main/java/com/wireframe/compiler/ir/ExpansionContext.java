package com.wireframe.compiler.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.wireframe.compiler.syntax.DefinitionKind;
import com.wireframe.compiler.syntax.SyntaxNode;

import lombok.Getter;

/**
 * Scope of one definition expansion: the invocation arguments, the arguments consumed so far,
 * and for layout definitions the content that fills the {@code Children} slot.
 */
@Getter
final class ExpansionContext {
    static final String ARGUMENT_PREFIX = "prop_";

    private static final ExpansionContext SCREEN = new ExpansionContext(null, null, Map.of(), false, null, null);

    private final String definitionName;
    private final DefinitionKind definitionKind;
    private final Map<String, Object> args;
    private final Set<String> usedArgs = new LinkedHashSet<>();
    private final boolean childrenSlotAllowed;
    /** Content placed into {@code Children}; null when the invocation supplied none. */
    private final SyntaxNode childrenSlot;
    /** Scope the slot content is expanded in, which is the scope of the invocation site. */
    private final ExpansionContext slotScope;

    private ExpansionContext(String definitionName, DefinitionKind definitionKind, Map<String, Object> args,
                             boolean childrenSlotAllowed, SyntaxNode childrenSlot, ExpansionContext slotScope) {
        this.definitionName = definitionName;
        this.definitionKind = definitionKind;
        this.args = Collections.unmodifiableMap(new LinkedHashMap<>(args));
        this.childrenSlotAllowed = childrenSlotAllowed;
        this.childrenSlot = childrenSlot;
        this.slotScope = slotScope;
    }

    static ExpansionContext screen() {
        return SCREEN;
    }

    static ExpansionContext forComponent(String name, Map<String, Object> args) {
        return new ExpansionContext(name, DefinitionKind.COMPONENT, args, false, null, null);
    }

    static ExpansionContext forLayout(String name, Map<String, Object> args, SyntaxNode slot, ExpansionContext invocationScope) {
        return new ExpansionContext(name, DefinitionKind.LAYOUT, args, true, slot, invocationScope);
    }

    boolean isInsideDefinition() {
        return definitionName != null;
    }

    boolean hasArg(String name) {
        return args.containsKey(name);
    }

    Object useArg(String name) {
        usedArgs.add(name);
        return args.get(name);
    }

    String describe() {
        return definitionKind.tag() + " '" + definitionName + "'";
    }
}
