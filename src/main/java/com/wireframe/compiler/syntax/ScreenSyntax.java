package com.wireframe.compiler.syntax;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A {@code screen Name { layout ... }} block. The parser keeps every top-level layout it sees;
 * the IR builder requires exactly one.
 */
@Data
@NoArgsConstructor
public class ScreenSyntax {
    private String name;
    private Map<String, Object> params = new LinkedHashMap<>();
    private List<LayoutSyntax> layouts = new ArrayList<>();
    private SourceSpan span;
    private String nodeId;

    @Builder
    public ScreenSyntax(String name, Map<String, Object> params, List<LayoutSyntax> layouts,
                        SourceSpan span, String nodeId) {
        this.name = name;
        this.params = params != null ? params : new LinkedHashMap<>();
        this.layouts = layouts != null ? layouts : new ArrayList<>();
        this.span = span;
        this.nodeId = nodeId;
    }
}
