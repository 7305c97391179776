package com.wireframe.compiler.syntax;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Data;

/**
 * Parser output for one wireframe project.
 */
@Data
@Builder
public class SyntaxTree {
    private String name;
    private Map<String, String> style;
    private Map<String, String> colors;
    private Map<String, String> mocks;
    private List<DefinitionSyntax> definitions;
    private List<ScreenSyntax> screens;
    private SourceSpan span;

    public static SyntaxTreeBuilder builder() {
        return new SyntaxTreeBuilder()
                .style(new LinkedHashMap<>())
                .colors(new LinkedHashMap<>())
                .mocks(new LinkedHashMap<>())
                .definitions(new ArrayList<>())
                .screens(new ArrayList<>());
    }
}
