package com.phillippitts.scalogram.service.io;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OutputNamesTest {

    @Test
    void stemShouldStopAtFirstDot() {
        assertThat(OutputNames.stem("run1.aaa")).isEqualTo("run1");
        assertThat(OutputNames.stem("run1.v2.aaa")).isEqualTo("run1");
        assertThat(OutputNames.stem("plain")).isEqualTo("plain");
        assertThat(OutputNames.stem(".hidden")).isEqualTo(".hidden");
    }

    @Test
    void pngFileNameShouldReplaceExtension() {
        assertThat(OutputNames.pngFileName("signal.aaa")).isEqualTo("signal.png");
    }
}
