package io.repoinsight.learning;

import java.util.List;

/**
 * Caller-supplied context of a detection. Stored for reporting and querying only;
 * it never influences scoring.
 *
 * @param framework   Framework the code was written against, if known
 * @param fileContext Kind of file, e.g. "api-route", "test", "script"
 * @param imports     Relevant imports of the file
 * @param tags        Free-form tags
 */
public record PatternContext(String framework, String fileContext, List<String> imports, List<String> tags) {

    public PatternContext {
        if (framework == null) {
            framework = "";
        }
        if (fileContext == null) {
            fileContext = "unknown";
        }
        imports = imports == null ? List.of() : List.copyOf(imports);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static PatternContext empty() {
        return new PatternContext("", "unknown", List.of(), List.of());
    }

    public static PatternContext ofFramework(String framework) {
        return new PatternContext(framework, "unknown", List.of(), List.of());
    }

    /**
     * Returns true if the tag equals the framework or one of the tags (case-insensitive).
     */
    public boolean hasTag(String tag) {
        if (framework.equalsIgnoreCase(tag)) {
            return true;
        }
        return tags.stream().anyMatch(t -> t.equalsIgnoreCase(tag));
    }
}
