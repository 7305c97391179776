package com.wireframe.compiler.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.wireframe.compiler.cli.exception.OptionsValidationException;
import com.wireframe.compiler.cli.model.CompileOptions;
import com.wireframe.compiler.cli.model.ValidatedCompileOptions;

public class CompileOptionsValidator {

	public ValidatedCompileOptions validate(CompileOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getInput() == null) {
			errors.add("Input syntax tree is required (--input / -i).");
		} else if (!Files.isRegularFile(o.getInput())) {
			errors.add("Input file does not exist or is not a regular file: " + o.getInput());
		}

		if (o.getScreen() != null && o.getScreen().isBlank()) {
			errors.add("Screen selector must not be blank (--screen / -s).");
		}

		if (o.getWidth() != null && !(o.getWidth() > 0)) {
			errors.add("Width must be a positive number of pixels. Got: " + o.getWidth());
		}

		Path normalizedOutputDir = (o.getOutputDir() == null ? Path.of(".") : o.getOutputDir()).toAbsolutePath()
				.normalize();

		if (!o.isReportOnly() && Files.exists(normalizedOutputDir) && !Files.isDirectory(normalizedOutputDir)) {
			errors.add("Output path exists and is not a directory: " + normalizedOutputDir);
		}

		if (o.isReportOnly() && o.isForce()) {
			errors.add("--force has no effect together with --report-only.");
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedCompileOptions(o.getInput().toAbsolutePath().normalize(), normalizedOutputDir);
	}
}
