package com.taxdoc.core.naming;

import com.taxdoc.core.model.SplitUnit;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Copies each unit's file into the output folder under its final name. Name collisions get a
 * {@code _2}, {@code _3}, ... suffix; existing files are never overwritten.
 */
public final class PdfRenameSink implements RenameSink {

    private static final int MAX_COLLISIONS = 999;

    private final Path outputDir;

    public PdfRenameSink(Path outputDir) {
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir");
    }

    @Override
    public RenameOutcome finalize(SplitUnit unit, String finalCode, String qualifierText, String period) {
        if (unit.pageFile() == null || !Files.isRegularFile(unit.pageFile())) {
            return RenameOutcome.failed("no file available for " + unit.describe());
        }
        String extension = FinalNameBuilder.extensionOf(unit.pageFile().getFileName().toString());
        String name = FinalNameBuilder.build(finalCode, qualifierText, period, extension);
        try {
            Files.createDirectories(outputDir);
            Path target = outputDir.resolve(name);
            String stem = name.substring(0, name.length() - extension.length() - 1);
            for (int attempt = 2; attempt <= MAX_COLLISIONS + 1; attempt++) {
                try {
                    Files.copy(unit.pageFile(), target);
                    return RenameOutcome.written(target);
                } catch (FileAlreadyExistsException exists) {
                    target = outputDir.resolve("%s_%d.%s".formatted(stem, attempt, extension));
                }
            }
            return RenameOutcome.failed("too many files named " + name);
        } catch (IOException ex) {
            return RenameOutcome.failed("write failed for %s: %s".formatted(name, ex.getMessage()));
        } catch (InvalidPathException ex) {
            return RenameOutcome.failed("name %s not representable on this file system: %s".formatted(name, ex.getReason()));
        }
    }
}
