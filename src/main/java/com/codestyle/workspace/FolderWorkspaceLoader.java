package com.codestyle.workspace;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.codestyle.util.LoggerUtil;

/**
 * Loads a folder into a {@link Workspace}: one project per {@link FileType}, holding every
 * file of that type under the folder.
 */
public class FolderWorkspaceLoader {
    private static final Logger logger = LoggerUtil.getLogger(FolderWorkspaceLoader.class);

    private final List<String> ignorePatterns;
    private final TextEncoding defaultEncoding;

    public FolderWorkspaceLoader(List<String> ignorePatterns, TextEncoding defaultEncoding) {
        this.ignorePatterns = ignorePatterns != null ? List.copyOf(ignorePatterns) : List.of();
        this.defaultEncoding = defaultEncoding != null ? defaultEncoding : TextEncoding.UTF_8;
    }

    /**
     * Loads the folder. When {@code filesToInclude} is empty every supported file is loaded,
     * otherwise only the listed files that exist.
     */
    public Workspace load(Path folderPath, Set<Path> filesToInclude) throws IOException {
        Path folder = folderPath.toAbsolutePath().normalize();
        if (!Files.isDirectory(folder)) {
            throw new IOException("Not a directory: " + folderPath);
        }

        List<Project> projects = new ArrayList<>();
        for (FileType fileType : FileType.values()) {
            if (fileType == FileType.UNKNOWN) {
                continue;
            }
            Project project = loadProject(folder, fileType, filesToInclude);
            if (project != null) {
                projects.add(project);
            }
        }

        logger.fine("Loaded " + projects.size() + " projects from " + folder);
        return new Workspace(folder, projects);
    }

    /**
     * Every document of the workspace, in project and document order.
     */
    public static List<FormattableDocument> getFormattableDocuments(Workspace workspace) {
        List<FormattableDocument> documents = new ArrayList<>();
        for (Project project : workspace.getProjects()) {
            for (Document document : project.getDocuments()) {
                documents.add(FormattableDocument.of(document));
            }
        }
        return documents;
    }

    private Project loadProject(Path folder, FileType fileType, Set<Path> filesToInclude) throws IOException {
        List<Path> filePaths = _findFiles(folder, fileType, filesToInclude);
        if (filePaths.isEmpty()) {
            return null;
        }

        ProjectId projectId = ProjectId.createNewId(folder.toString());
        List<Document> documents = new ArrayList<>(filePaths.size());
        for (Path filePath : filePaths) {
            TextEncoding.DecodedText decoded = TextEncoding.decode(Files.readAllBytes(filePath), defaultEncoding);
            documents.add(new Document(
                    DocumentId.createNewId(projectId, filePath.toString()),
                    filePath.getFileName().toString(),
                    filePath,
                    decoded.getText(),
                    decoded.getEncoding()));
        }

        logger.fine("Loaded " + documents.size() + " " + fileType.getDescription() + "s into " + fileType.getProjectName());
        return new Project(projectId, fileType.getProjectName(), fileType.getLanguage(), folder, documents);
    }

    private List<Path> _findFiles(Path folder, FileType fileType, Collection<Path> filesToInclude) throws IOException {
        if (filesToInclude != null && !filesToInclude.isEmpty()) {
            return filesToInclude.stream()
                    .map(p -> p.isAbsolute() ? p.normalize() : folder.resolve(p).normalize())
                    .filter(fileType::matches)
                    .filter(Files::isRegularFile)
                    .filter(p -> !_isIgnored(p, folder))
                    .distinct()
                    .collect(Collectors.toList());
        }

        try (Stream<Path> paths = Files.walk(folder)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(fileType::matches)
                    .filter(p -> !_isIgnored(p, folder))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private boolean _isIgnored(Path file, Path basePath) {
        if (ignorePatterns.isEmpty() || !file.startsWith(basePath)) {
            return false;
        }

        String relativePath = basePath.relativize(file).toString().replace("\\", "/");

        for (String pattern : ignorePatterns) {
            if (pattern.startsWith("**/")) {
                String suffix = pattern.substring(3);
                if (relativePath.endsWith(suffix)
                        || _matchesGlob(relativePath, suffix)
                        || _matchesGlob(relativePath, "*/" + suffix)) {
                    return true;
                }
            } else if (pattern.endsWith("/**")) {
                String prefix = pattern.substring(0, pattern.length() - 3);
                if (relativePath.startsWith(prefix + "/")) {
                    return true;
                }
            } else if (pattern.contains("*")) {
                if (_matchesGlob(relativePath, pattern)) {
                    return true;
                }
            } else if (pattern.equals(relativePath)) {
                return true;
            }
        }

        return false;
    }

    private static boolean _matchesGlob(String path, String pattern) {
        String regex = pattern
                .replace(".", "\\.")
                .replace("?", ".")
                .replace("*", ".*");
        return path.matches(regex);
    }
}
