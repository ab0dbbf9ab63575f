package com.schemaid.cli.model;

import com.schemaid.model.IdentitySettings;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.nio.file.Path;
import java.util.List;

/**
 * Derived values needed by the executor. Keeps FingerprintCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedFingerprintOptions {
    List<String> modelNames;
    List<Path> classpathEntries;
    IdentitySettings settings;
    Path reportFile;
}
