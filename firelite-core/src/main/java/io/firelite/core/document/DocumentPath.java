package io.firelite.core.document;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.firelite.core.error.FireliteException;

/**
 * A parsed document resource name of the form
 * {@code projects/{projectId}/databases/{database}/documents/{collection}/{docId}(/{collection}/{docId})*}.
 */
public record DocumentPath(String projectId, String database, String collectionPath, String documentId) {
    public static final String DEFAULT_DATABASE = "(default)";

    private static final Pattern RESOURCE = Pattern.compile("^projects/([^/]+)/databases/([^/]+)/documents/(.+)$");
    private static final Pattern PROJECT_ID = Pattern.compile("^[A-Za-z0-9-]+$");

    /**
     * Parses the syntax of a document name. The database is not checked here;
     * see {@link #resolve(String)}.
     */
    public static DocumentPath parse(String name) {
        if (name == null) {
            throw FireliteException.invalidArgument("Document path is required");
        }
        Matcher m = RESOURCE.matcher(name);
        if (!m.matches() || !PROJECT_ID.matcher(m.group(1)).matches()) {
            throw FireliteException.invalidArgument("Invalid document path: " + name);
        }
        String[] segments = m.group(3).split("/", -1);
        if (segments.length < 2 || segments.length % 2 != 0) {
            throw FireliteException.invalidArgument("Invalid document path: " + name);
        }
        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw FireliteException.invalidArgument("Invalid document path: " + name);
            }
        }
        int cut = m.group(3).lastIndexOf('/');
        return new DocumentPath(m.group(1), m.group(2), m.group(3).substring(0, cut), m.group(3).substring(cut + 1));
    }

    /**
     * Parses the name and requires the default database.
     */
    public static DocumentPath resolve(String name) {
        DocumentPath path = parse(name);
        checkDatabase(path.database());
        return path;
    }

    public static void checkDatabase(String database) {
        if (!DEFAULT_DATABASE.equals(database)) {
            throw FireliteException.notFound("Database " + database + " not found");
        }
    }

    public String name() {
        return "projects/" + projectId + "/databases/" + database + "/documents/" + collectionPath + "/" + documentId;
    }
}
