package com.codestyle.api;

import java.util.List;
import java.util.logging.Logger;

import com.codestyle.workspace.FormattableDocument;
import com.codestyle.workspace.Workspace;

/**
 * A formatting step over a workspace. Steps either report what they would change or
 * return a new workspace snapshot with the changes applied, depending on {@link FormatOptions}.
 */
public interface CodeFormatter {

    FormatType getFormatType();

    /**
     * Formats the given documents of {@code workspace}.
     *
     * @param logger receives progress traces and, in report mode, one line per finding
     */
    FormatterResult format(Workspace workspace,
                           List<FormattableDocument> formattableDocuments,
                           FormatOptions options,
                           Logger logger,
                           CancellationToken cancellationToken);
}
