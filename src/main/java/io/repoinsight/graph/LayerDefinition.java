package io.repoinsight.graph;

import java.nio.file.FileSystems;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * An architectural layer: the node ids it covers (a glob) and the layers it may depend on.
 * <p>
 * A leading {@code **}{@code /} also matches at the root of a node id, so {@code **}{@code /components/**}
 * covers both {@code src/components/Button.tsx} and {@code components/Button.tsx}.
 */
public final class LayerDefinition {

    private static final String ANY_PREFIX = "**/";

    private final String name;
    private final String pattern;
    private final Set<String> allowedDependencies;
    private final List<PathMatcher> matchers;

    /**
     * @param name                Layer name, e.g. "Services"
     * @param pattern             Glob matched against node ids
     * @param allowedDependencies Names of every layer this layer may depend on
     * @throws IllegalArgumentException if the name or pattern is blank or the pattern is not a valid glob
     */
    public LayerDefinition(String name, String pattern, Set<String> allowedDependencies) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("layer name cannot be null or blank");
        }
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("pattern for layer " + name + " cannot be null or blank");
        }
        this.name = name;
        this.pattern = pattern;
        this.allowedDependencies = allowedDependencies == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(allowedDependencies));
        this.matchers = compile(name, pattern);
    }

    private static List<PathMatcher> compile(String name, String pattern) {
        try {
            PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
            if (pattern.startsWith(ANY_PREFIX) && pattern.length() > ANY_PREFIX.length()) {
                PathMatcher rootMatcher = FileSystems.getDefault()
                        .getPathMatcher("glob:" + pattern.substring(ANY_PREFIX.length()));
                return List.of(matcher, rootMatcher);
            }
            return List.of(matcher);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid pattern for layer " + name + ": " + e.getMessage(), e);
        }
    }

    public String name() {
        return name;
    }

    public String pattern() {
        return pattern;
    }

    public Set<String> allowedDependencies() {
        return allowedDependencies;
    }

    /**
     * Returns true if the node id matches this layer's glob.
     */
    public boolean matches(String nodeId) {
        Path path;
        try {
            path = Path.of(nodeId);
        } catch (InvalidPathException e) {
            return false;
        }
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(path)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LayerDefinition)) {
            return false;
        }
        LayerDefinition that = (LayerDefinition) o;
        return name.equals(that.name)
                && pattern.equals(that.pattern)
                && allowedDependencies.equals(that.allowedDependencies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, pattern, allowedDependencies);
    }

    @Override
    public String toString() {
        return "LayerDefinition[name=" + name + ", pattern=" + pattern
                + ", allowedDependencies=" + allowedDependencies + "]";
    }
}
