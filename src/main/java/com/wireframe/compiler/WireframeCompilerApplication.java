package com.wireframe.compiler;

import com.wireframe.compiler.cli.CompileCommand;

import picocli.CommandLine;

/**
 * Main entry point for the wireframe compiler.
 * Reads a parsed wireframe as JSON and writes its node graph and screen layouts as JSON.
 */
public class WireframeCompilerApplication {

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String... args) {
        return new CommandLine(new CompileCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }
}
