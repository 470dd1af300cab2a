package com.analystpilot.orchestrator.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FileNamesTest {

    @Test
    void sanitize_plainName_isUnchanged() {
        assertThat(FileNames.sanitize("sales-2024.csv")).isEqualTo("sales-2024.csv");
    }

    @Test
    void sanitize_dropsDirectoryParts() {
        assertThat(FileNames.sanitize("../../etc/passwd")).isEqualTo("passwd");
        assertThat(FileNames.sanitize("C:\\Users\\me\\data.xlsx")).isEqualTo("data.xlsx");
    }

    @Test
    void sanitize_replacesReservedCharacters() {
        assertThat(FileNames.sanitize("what?<is>:this|\"*.txt")).isEqualTo("what__is__this___.txt");
    }

    @Test
    void sanitize_trimsSpacesAndDots() {
        assertThat(FileNames.sanitize("  .hidden.csv. ")).isEqualTo("hidden.csv");
    }

    @Test
    void sanitize_emptyResult_becomesUntitled() {
        assertThat(FileNames.sanitize("..")).isEqualTo("untitled");
        assertThat(FileNames.sanitize("dir/")).isEqualTo("untitled");
        assertThat(FileNames.sanitize(null)).isEqualTo("untitled");
    }
}
