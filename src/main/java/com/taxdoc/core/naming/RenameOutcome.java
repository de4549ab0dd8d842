package com.taxdoc.core.naming;

import java.nio.file.Path;

public record RenameOutcome(boolean success, Path target, String message) {

    public static RenameOutcome written(Path target) {
        return new RenameOutcome(true, target, "");
    }

    public static RenameOutcome failed(String message) {
        return new RenameOutcome(false, null, message == null ? "" : message);
    }
}
