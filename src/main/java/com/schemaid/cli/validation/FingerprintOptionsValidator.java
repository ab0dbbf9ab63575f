package com.schemaid.cli.validation;

import com.schemaid.cli.exception.OptionsValidationException;
import com.schemaid.cli.model.FingerprintOptions;
import com.schemaid.cli.model.ValidatedFingerprintOptions;
import com.schemaid.model.IdentitySettings;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

public class FingerprintOptionsValidator {

	private static final Pattern CLASS_NAME = Pattern
			.compile("[\\p{L}_$][\\p{L}\\p{N}_$]*(\\.[\\p{L}_$][\\p{L}\\p{N}_$]*)*");

	public ValidatedFingerprintOptions validate(FingerprintOptions o) {
		List<String> errors = new ArrayList<>();

		List<String> modelNames = o.getModels() == null ? List.of()
				: o.getModels().stream().map(String::trim).toList();
		if (modelNames.isEmpty()) {
			errors.add("At least one model class is required (--model / -m).");
		}
		for (String name : modelNames) {
			if (!CLASS_NAME.matcher(name).matches()) {
				errors.add("Not a valid class name: '" + name + "'");
			}
		}

		if (o.isCompare() && modelNames.size() != 2) {
			errors.add("--compare needs exactly two models. Got: " + modelNames.size());
		}

		if (o.getDigestLength() < IdentitySettings.MIN_DIGEST_LENGTH
				|| o.getDigestLength() > IdentitySettings.FULL_DIGEST) {
			errors.add("Digest length must be in range " + IdentitySettings.MIN_DIGEST_LENGTH + "-"
					+ IdentitySettings.FULL_DIGEST + ". Got: " + o.getDigestLength());
		}
		if (o.getMaxNodes() <= 0) {
			errors.add("Max nodes must be > 0. Got: " + o.getMaxNodes());
		}

		Map<String, String> extraData = o.getExtraData() == null ? Map.of() : o.getExtraData();
		for (String key : extraData.keySet()) {
			if (isBlank(key)) {
				errors.add("Extra data keys must not be blank.");
			}
		}

		List<Path> classpathEntries = parseClasspath(o.getClasspath(), errors);

		Path reportFile = o.getReportFile() == null ? null : o.getReportFile().toAbsolutePath().normalize();
		if (reportFile != null && Files.isDirectory(reportFile)) {
			errors.add("Report file is a directory: " + reportFile);
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		IdentitySettings settings = IdentitySettings.builder()
				.trackDescriptions(o.isTrackDescriptions())
				.trackFieldOrder(o.isTrackFieldOrder())
				.trackTypeOrder(o.isTrackTypeOrder())
				.trackedExtraData(extraData)
				.digestLength(o.getDigestLength())
				.maxNodes(o.getMaxNodes())
				.build();

		return new ValidatedFingerprintOptions(modelNames, classpathEntries, settings, reportFile);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}

	private static List<Path> parseClasspath(String raw, List<String> errors) {
		if (raw == null || raw.isBlank()) {
			return List.of();
		}

		// path separator is ':' or ';', both literal inside a character class
		String separators = "[," + File.pathSeparator + "]";
		List<Path> result = Arrays.stream(raw.split(separators)).map(String::trim).filter(s -> !s.isEmpty())
				.map(Path::of).toList();

		for (Path p : result) {
			if (!Files.exists(p)) {
				errors.add("Class path entry does not exist: " + p);
			} else if (!Files.isDirectory(p) && !p.getFileName().toString().endsWith(".jar")) {
				errors.add("Class path entry is neither a directory nor a jar: " + p);
			}
		}

		return result;
	}
}
