package co.fanki.archgraph.graph.domain.golang;

import co.fanki.archgraph.graph.domain.ExtractionContext;
import co.fanki.archgraph.graph.domain.FileImports;
import co.fanki.archgraph.graph.domain.ImportExtractor;
import co.fanki.archgraph.graph.domain.ImportTarget;
import co.fanki.archgraph.graph.domain.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Go implementation of {@link ImportExtractor}.
 *
 * <h3>Identifier strategy</h3>
 * <p>The importing node is the file's repository-relative path without
 * {@code .go}. Imported packages are matched in single-line form (with
 * an optional alias) and inside parenthesized import blocks.</p>
 *
 * <p>When the repository root declares a module in {@code go.mod},
 * imports under that module path are rewritten to module-relative ids
 * ({@code example.com/app/util} becomes {@code util}) and marked
 * internal. Every other import path is external and kept verbatim.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class GoImportExtractor implements ImportExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(
            GoImportExtractor.class);

    private static final String GO_MOD = "go.mod";

    private static final Pattern MODULE_PATTERN = Pattern.compile(
            "^\\s*module\\s+(\\S+)", Pattern.MULTILINE);

    /** Matches {@code import "x"} and {@code import alias "x"}. */
    private static final Pattern SINGLE_IMPORT_PATTERN = Pattern.compile(
            "^\\s*import\\s+(?:[\\w.]+\\s+)?\"([^\"]+)\"", Pattern.MULTILINE);

    private static final Pattern IMPORT_BLOCK_PATTERN = Pattern.compile(
            "^\\s*import\\s*\\((.*?)\\)", Pattern.MULTILINE | Pattern.DOTALL);

    private static final Pattern QUOTED_PATTERN = Pattern.compile(
            "\"([^\"]+)\"");

    /** {@inheritDoc} */
    @Override
    public Language language() {
        return Language.GO;
    }

    /**
     * Reads the module path declared by the go.mod at the repository root.
     *
     * @param root the repository root
     * @return the module path, empty when there is no readable declaration
     */
    public static Optional<String> detectModule(final Path root) {
        final Path goMod = root.resolve(GO_MOD);
        if (!Files.isRegularFile(goMod)) {
            return Optional.empty();
        }
        try {
            final String content = Files.readString(goMod,
                    StandardCharsets.UTF_8);
            final Matcher matcher = MODULE_PATTERN.matcher(content);
            if (!matcher.find()) {
                return Optional.empty();
            }
            final String module = matcher.group(1).replace("\"", "")
                    .replace("`", "").trim();
            return module.isEmpty() ? Optional.empty() : Optional.of(module);
        } catch (final IOException e) {
            LOG.warn("Failed to read {}: {}", goMod, e.getMessage());
            return Optional.empty();
        }
    }

    /** {@inheritDoc} */
    @Override
    public Optional<FileImports> extract(final Path file, final String content,
            final ExtractionContext context) {

        final Optional<String> sourceId = context.resolver().fileId(file,
                Language.GO, '/');
        if (sourceId.isEmpty()) {
            return Optional.empty();
        }

        final String module = context.goModule().orElse(null);
        final List<ImportTarget> targets = new ArrayList<>();

        final Matcher single = SINGLE_IMPORT_PATTERN.matcher(content);
        while (single.find()) {
            targets.add(toTarget(single.group(1), module));
        }

        final Matcher block = IMPORT_BLOCK_PATTERN.matcher(content);
        while (block.find()) {
            final Matcher quoted = QUOTED_PATTERN.matcher(block.group(1));
            while (quoted.find()) {
                targets.add(toTarget(quoted.group(1), module));
            }
        }

        return Optional.of(new FileImports(sourceId.get(), language().tag(),
                targets));
    }

    private ImportTarget toTarget(final String importPath,
            final String module) {
        if (module != null) {
            if (importPath.equals(module)) {
                return ImportTarget.internal(module, language().tag());
            }
            if (importPath.startsWith(module + "/")) {
                return ImportTarget.internal(
                        importPath.substring(module.length() + 1),
                        language().tag());
            }
        }
        return ImportTarget.external(importPath, language().tag());
    }

}
