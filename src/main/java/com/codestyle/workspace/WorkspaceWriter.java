package com.codestyle.workspace;

import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.codestyle.util.LoggerUtil;

/**
 * Persists the documents that changed between two workspace snapshots.
 */
public class WorkspaceWriter {
    private static final Logger logger = LoggerUtil.getLogger(WorkspaceWriter.class);

    /**
     * Writes every document of {@code updated} whose content differs from {@code original}.
     *
     * @return the documents written
     * @throws IOException if a file cannot be written; files written before the failure stay written
     */
    public List<Document> writeChanges(Workspace original, Workspace updated) throws IOException {
        List<Document> written = new ArrayList<>();
        for (DocumentId documentId : updated.getChangedDocuments(original)) {
            Document document = updated.getDocument(documentId)
                    .orElseThrow(() -> new IllegalStateException("Changed document missing: " + documentId));
            try {
                Files.write(document.getFilePath(), document.getEncoding().encode(document.getText()));
                written.add(document);
                logger.fine("Wrote " + document.getFilePath() + " (" + document.getEncoding() + ")");
            } catch (IOException e) {
                logger.log(Level.SEVERE, "Failed to write " + document.getFilePath(), e);
                throw e;
            }
        }
        return written;
    }
}
