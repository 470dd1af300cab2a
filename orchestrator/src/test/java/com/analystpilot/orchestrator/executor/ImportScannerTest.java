package com.analystpilot.orchestrator.executor;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ImportScannerTest {

    private final ImportScanner scanner = ImportScanner.withBundledStdlib();

    @Test
    void bundledList_coversCommonStdlibModules() {
        String script = "import os\nimport json\nimport sqlite3\nimport pandas\n";
        assertThat(scanner.thirdPartyPackages(script)).containsExactly("pandas");
    }

    @Test
    void thirdPartyPackages_excludesStdlibAndKeepsOrder() {
        String script = """
                import os
                import pandas as pd
                from matplotlib.pyplot import plot
                import json, sys
                from collections import Counter
                import numpy
                """;
        assertThat(scanner.thirdPartyPackages(script)).containsExactly("pandas", "matplotlib", "numpy");
    }

    @Test
    void thirdPartyPackages_usesRootOfDottedName() {
        assertThat(scanner.thirdPartyPackages("from bs4.element import Tag")).containsExactly("bs4");
        assertThat(scanner.thirdPartyPackages("import xml.etree.ElementTree as ET")).isEmpty();
    }

    @Test
    void thirdPartyPackages_matchesIndentedImports() {
        String script = """
                def load():
                    import duckdb
                    return duckdb.connect()
                """;
        assertThat(scanner.thirdPartyPackages(script)).containsExactly("duckdb");
    }

    @Test
    void thirdPartyPackages_ignoresRelativeImportsAndProse() {
        String script = """
                from . import helpers
                # we import nothing else here
                print("import requests")
                """;
        assertThat(scanner.thirdPartyPackages(script)).isEmpty();
    }

    @Test
    void thirdPartyPackages_deduplicates() {
        assertThat(scanner.thirdPartyPackages("import requests\nfrom requests import get\n"))
                .containsExactly("requests");
    }
}
