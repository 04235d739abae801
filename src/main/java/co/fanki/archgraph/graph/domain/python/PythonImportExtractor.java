package co.fanki.archgraph.graph.domain.python;

import co.fanki.archgraph.graph.domain.ExtractionContext;
import co.fanki.archgraph.graph.domain.FileImports;
import co.fanki.archgraph.graph.domain.ImportExtractor;
import co.fanki.archgraph.graph.domain.ImportTarget;
import co.fanki.archgraph.graph.domain.Language;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Python implementation of {@link ImportExtractor}.
 *
 * <p>A file's node id is its dotted module name: {@code pkg/a.py} is
 * {@code pkg.a} and {@code pkg/__init__.py} is {@code pkg}. Both
 * {@code import a, b.c as x} and {@code from x.y import z} are matched;
 * comma lists are split, aliases dropped, and every target is truncated
 * to its first {@value #MAX_SEGMENTS} dotted segments.</p>
 *
 * <p>Targets are never checked against the filesystem. They become
 * internal only when another sampled file produces the same module
 * id. Relative {@code from .x import y} forms are resolved against the
 * importing module's package by name only.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class PythonImportExtractor implements ImportExtractor {

    private static final int MAX_SEGMENTS = 3;

    private static final String PACKAGE_MARKER = "__init__";

    /** Matches "import a, b.c as x" (group 1) and "from x.y import" (group 2). */
    private static final Pattern IMPORT_PATTERN = Pattern.compile(
            "^[ \\t]*(?:import[ \\t]+([\\w.,\\t ]+)"
                    + "|from[ \\t]+([\\w.]+)[ \\t]+import\\b)",
            Pattern.MULTILINE);

    private static final Pattern COMMA = Pattern.compile("\\s*,\\s*");

    private static final Pattern ALIAS = Pattern.compile("\\s+as\\s+");

    /** {@inheritDoc} */
    @Override
    public Language language() {
        return Language.PYTHON;
    }

    /** {@inheritDoc} */
    @Override
    public Optional<FileImports> extract(final Path file, final String content,
            final ExtractionContext context) {

        final Optional<String> moduleId = moduleName(file, context);
        if (moduleId.isEmpty()) {
            return Optional.empty();
        }
        final String module = moduleId.get();
        final String packageName = isPackageMarker(file)
                ? module : parentOf(module);

        final List<ImportTarget> targets = new ArrayList<>();
        final Matcher matcher = IMPORT_PATTERN.matcher(content);
        while (matcher.find()) {
            if (matcher.group(1) != null) {
                for (final String part : COMMA.split(matcher.group(1))) {
                    final String name = ALIAS.split(part.trim())[0].trim();
                    if (!name.isEmpty()) {
                        addTarget(targets, name);
                    }
                }
            } else {
                resolveFrom(matcher.group(2), packageName)
                        .ifPresent(name -> addTarget(targets, name));
            }
        }

        return Optional.of(new FileImports(module, language().tag(), targets));
    }

    /**
     * Builds the dotted module name of a Python file.
     *
     * @param file the .py file
     * @param context the extraction context
     * @return the module name, empty for a root-level package marker
     */
    public Optional<String> moduleName(final Path file,
            final ExtractionContext context) {
        return context.resolver().fileId(file, Language.PYTHON, '.')
                .map(id -> {
                    if (id.equals(PACKAGE_MARKER)) {
                        return "";
                    }
                    if (id.endsWith("." + PACKAGE_MARKER)) {
                        return id.substring(0,
                                id.length() - PACKAGE_MARKER.length() - 1);
                    }
                    return id;
                })
                .filter(id -> !id.isEmpty());
    }

    private Optional<String> resolveFrom(final String base,
            final String packageName) {
        if (!base.startsWith(".")) {
            return Optional.of(base);
        }
        int dots = 0;
        while (dots < base.length() && base.charAt(dots) == '.') {
            dots++;
        }
        final String remainder = base.substring(dots);

        String anchor = packageName;
        for (int i = 1; i < dots; i++) {
            if (anchor.isEmpty()) {
                return Optional.empty();
            }
            anchor = parentOf(anchor);
        }

        if (anchor.isEmpty()) {
            return remainder.isEmpty() ? Optional.empty()
                    : Optional.of(remainder);
        }
        return Optional.of(remainder.isEmpty()
                ? anchor : anchor + "." + remainder);
    }

    private void addTarget(final List<ImportTarget> targets,
            final String name) {
        final String[] segments = name.split("\\.");
        final String truncated = String.join(".", Arrays.copyOf(segments,
                Math.min(MAX_SEGMENTS, segments.length)));
        if (!truncated.isEmpty()) {
            targets.add(ImportTarget.external(truncated, language().tag()));
        }
    }

    private static boolean isPackageMarker(final Path file) {
        return file.getFileName().toString().equals(PACKAGE_MARKER + ".py");
    }

    private static String parentOf(final String module) {
        final int lastDot = module.lastIndexOf('.');
        return lastDot < 0 ? "" : module.substring(0, lastDot);
    }

}
