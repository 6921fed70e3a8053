package org.pgninja.query;

import java.nio.file.Path;

/**
 * Writes the rows of a {@code SELECT} result to a spreadsheet.
 */
@FunctionalInterface
public interface ExportHook {

    /** @return the file that was written */
    Path export();
}
