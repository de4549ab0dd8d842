package com.taxdoc.core.naming;

import com.taxdoc.core.model.SplitUnit;

/**
 * Receives each finalized unit. Implementations report failures through {@link RenameOutcome}
 * instead of throwing, so one bad unit never stops the rest of its file.
 */
public interface RenameSink {

    RenameOutcome finalize(SplitUnit unit, String finalCode, String qualifierText, String period);
}
