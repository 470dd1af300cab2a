package com.analystpilot.orchestrator.executor;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Finds the third-party packages a Python script needs.
 *
 * Looks at every line of the form {@code import a.b} or {@code from a.b import c},
 * keeps the root name ({@code a}) and drops anything in the standard library.
 * Relative imports ({@code from . import x}) never match.
 */
public class ImportScanner {

    static final String STDLIB_RESOURCE = "/python-stdlib-modules.txt";

    private static final Pattern IMPORT_LINE =
            Pattern.compile("^\\s*(?:import|from)\\s+([A-Za-z0-9_][A-Za-z0-9_.]*)");

    private final Set<String> stdlib;

    public ImportScanner(Set<String> stdlib) {
        this.stdlib = Set.copyOf(stdlib);
    }

    /** Scanner using the bundled CPython 3.11 module list. */
    public static ImportScanner withBundledStdlib() {
        try (InputStream in = ImportScanner.class.getResourceAsStream(STDLIB_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + STDLIB_RESOURCE);
            }
            BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            Set<String> names = reader.lines()
                    .map(String::strip)
                    .filter(l -> !l.isEmpty() && !l.startsWith("#"))
                    .collect(Collectors.toSet());
            return new ImportScanner(names);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + STDLIB_RESOURCE, e);
        }
    }

    /**
     * Root package names imported by {@code script} that are not part of the
     * standard library, in first-seen order.
     */
    public Set<String> thirdPartyPackages(String script) {
        Set<String> packages = new LinkedHashSet<>();
        for (String line : script.split("\\R")) {
            Matcher m = IMPORT_LINE.matcher(line);
            if (m.find()) {
                String root = m.group(1).split("\\.")[0];
                if (!stdlib.contains(root)) {
                    packages.add(root);
                }
            }
        }
        return packages;
    }
}
