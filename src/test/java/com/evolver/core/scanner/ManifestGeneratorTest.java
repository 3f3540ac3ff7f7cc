package com.evolver.core.scanner;

import com.evolver.core.model.ProjectContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ManifestGeneratorTest {

    @TempDir
    Path root;

    private ManifestGenerator generator;

    @BeforeEach
    void setUp() throws IOException {
        generator = new ManifestGenerator(2);
        Files.writeString(root.resolve("requirements.txt"), "pytest\n");
        Files.writeString(root.resolve("app.py"), "print('app')\n");
        Files.createDirectories(root.resolve("tests"));
        Files.writeString(root.resolve("tests/test_app.py"), "def test_app():\n    pass\n");
        Files.createDirectories(root.resolve(".git"));
        Files.writeString(root.resolve(".git/HEAD"), "ref\n");
        Files.createDirectories(root.resolve(".evolver"));
        Files.writeString(root.resolve(".evolver/memory.json"), "{}");
        Files.createDirectories(root.resolve("__pycache__"));
        Files.writeString(root.resolve("__pycache__/app.cpython-311.pyc"), "x");
    }

    @Test
    void scanListsSourceFilesAndDetectsPython() throws IOException {
        ProjectContext context = generator.scan(root);

        assertEquals("python", context.language());
        assertEquals("pip", context.buildTool());
        assertEquals(List.of("app.py", "requirements.txt", "tests/test_app.py"), context.fileTree());
        assertEquals(3, context.fileCount());
    }

    @Test
    void generateRendersMarkdownManifest() throws IOException {
        String manifest = generator.generate(root);

        assertTrue(manifest.startsWith("# Project Manifest"));
        assertTrue(manifest.contains("- Language: python"));
        assertTrue(manifest.contains("- tests/test_app.py"));
        assertFalse(manifest.contains(".evolver"));
        assertFalse(manifest.contains("__pycache__"));
    }

    @Test
    void fileContextInlinesMentionedFiles() throws IOException {
        String context = generator.fileContext(root, "Add logging to app.py and cover it in tests/test_app.py");

        assertTrue(context.contains("### app.py\n```\nprint('app')\n```"));
        assertTrue(context.contains("### tests/test_app.py"));
    }

    @Test
    void fileContextIsEmptyWhenNothingIsMentioned() throws IOException {
        assertEquals("", generator.fileContext(root, "Improve the documentation"));
    }

    @Test
    void fileContextRespectsTheFileLimit() throws IOException {
        var one = new ManifestGenerator(1);

        String context = one.fileContext(root, "app.py requirements.txt");

        assertEquals(1, context.split("### ", -1).length - 1);
    }
}
