package com.wireframe.compiler.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "compile" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class CompileOptions {

	@Option(names = { "--input", "-i" }, description = "Syntax tree JSON file to compile")
	private Path input;

	@Option(names = { "--screen", "-s" }, description = "Id or name of the only screen to lay out (default: all screens)")
	private String screen;

	@Option(names = { "--width", "-w" }, description = "Viewport width in pixels, overriding each screen's device width")
	private Double width;

	@Option(names = { "--output-dir", "-o" }, description = "Output directory (defaults to current directory)")
	private Path outputDir;

	@Option(names = { "--force", "-f" }, description = "Overwrite existing output files")
	private boolean force;

	@Option(names = { "--report-only" }, description = "Print diagnostics without writing any file")
	private boolean reportOnly;

}
