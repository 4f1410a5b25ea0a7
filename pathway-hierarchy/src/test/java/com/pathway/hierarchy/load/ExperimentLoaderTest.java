package com.pathway.hierarchy.load;

import com.pathway.hierarchy.ConfigurationException;
import com.pathway.hierarchy.config.ExperimentDefinition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ExperimentLoaderTest {

    private static final String MINIMAL = "{\"experiment_id\":\"%s\",\"version\":\"%s\",\"phases\":[{\"id\":\"p\"}]}";

    @TempDir
    Path tempDir;

    @Test
    void load_prefersSourceOverLocalFile() throws Exception {
        Files.writeString(tempDir.resolve("study.json"), String.format(MINIMAL, "study", "file"));
        ExperimentLoader loader = new ExperimentLoader((id, v) -> Optional.of(String.format(MINIMAL, id, "source")), tempDir);

        assertEquals("source", loader.load("study", null).getVersion());
    }

    @Test
    void load_prefersVersionedFileOverPlainFile() throws Exception {
        Files.writeString(tempDir.resolve("study.json"), String.format(MINIMAL, "study", "plain"));
        Files.writeString(tempDir.resolve("study-2.json"), String.format(MINIMAL, "study", "2"));
        ExperimentLoader loader = new ExperimentLoader(null, tempDir);

        assertEquals("2", loader.load("study", "2").getVersion());
        assertEquals("plain", loader.load("study", "9").getVersion());
    }

    @Test
    void load_fallsBackToFileWhenSourceFails() throws Exception {
        Files.writeString(tempDir.resolve("study.json"), String.format(MINIMAL, "study", "file"));
        ExperimentLoader loader = new ExperimentLoader((id, v) -> {
            throw new IllegalStateException("store down");
        }, tempDir);

        ExperimentDefinition def = loader.load("study", null);

        assertEquals("file", def.getVersion());
    }

    @Test
    void load_throwsWhenNothingFound() throws Exception {
        Files.writeString(tempDir.resolve("broken.json"), "{not json");
        ExperimentLoader loader = new ExperimentLoader(null, tempDir);

        assertThrows(ConfigurationException.class, () -> loader.load("missing", null));
        assertThrows(ConfigurationException.class, () -> loader.load("broken", null));
    }
}
