package com.evolver.core.patch;

import com.evolver.core.config.EvolverProperties;
import com.evolver.core.model.PatchInstruction;
import com.evolver.core.model.ValidationResult;
import com.evolver.sandbox.ProtectedPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static com.evolver.core.patch.PatchReasons.*;

/**
 * Applies structured edit instructions to files under a base directory.
 * <p>
 * Every failure is reported as a {@link ValidationResult}; no exception escapes for
 * a bad instruction or an I/O problem on a single file.
 */
@Component
public class PatchApplicator {

    private static final Logger log = LoggerFactory.getLogger(PatchApplicator.class);

    static final String STATUS_APPLIED = "applied";

    private final ProtectedPaths protectedPaths;

    public PatchApplicator() {
        this(ProtectedPaths.defaults());
    }

    @Autowired
    public PatchApplicator(EvolverProperties properties) {
        this(ProtectedPaths.from(properties));
    }

    public PatchApplicator(ProtectedPaths protectedPaths) {
        this.protectedPaths = protectedPaths;
    }

    /**
     * Applies instructions strictly in order. The first failure aborts the remaining ones.
     */
    public ApplyReport applyAll(Path basePath, List<PatchInstruction> instructions) {
        var statuses = new LinkedHashMap<String, String>();
        int applied = 0;
        for (var instruction : instructions) {
            ValidationResult result = apply(basePath, instruction);
            String key = instruction.filePath() != null ? instruction.filePath() : "<missing path>";
            if (!result.success()) {
                statuses.put(key, "failed: " + result.reasonCode());
                log.warn("Patch {} of {} failed on {}: {}", applied + 1, instructions.size(), key, result.reasonCode());
                return new ApplyReport(result, statuses, applied);
            }
            statuses.put(key, STATUS_APPLIED);
            applied++;
        }
        return new ApplyReport(
                ValidationResult.success(PATCH_APPLIED, "Applied " + applied + " patch instruction(s)"),
                statuses, applied);
    }

    public ValidationResult apply(Path basePath, PatchInstruction instruction) {
        if (instruction == null || instruction.operation() == null
                || instruction.filePath() == null || instruction.filePath().isBlank()) {
            return ValidationResult.failure(INVALID_PATCH_INSTRUCTION,
                    "Instruction needs an operation and a file path: " + instruction);
        }

        Path base = basePath.toAbsolutePath().normalize();
        Path target = base.resolve(instruction.filePath()).normalize();
        if (!target.startsWith(base) || target.equals(base)) {
            return ValidationResult.failure(INVALID_PATCH_PATH,
                    "Path escapes the project root: " + instruction.filePath());
        }
        Optional<String> reserved = protectedPaths.protectedSegment(base.relativize(target));
        if (reserved.isPresent()) {
            return ValidationResult.failure(INVALID_PATCH_PATH,
                    "Path is inside protected '%s': %s".formatted(reserved.get(), instruction.filePath()));
        }

        try {
            return switch (instruction.operation()) {
                case INSERT -> insert(target, instruction);
                case REPLACE -> replace(target, instruction);
                case DELETE -> delete(target, instruction);
            };
        } catch (PatternSyntaxException e) {
            return ValidationResult.failure(INVALID_MATCH_PATTERN,
                    "Invalid regex for " + instruction.filePath() + ": " + e.getDescription());
        } catch (IOException e) {
            log.error("I/O error applying {} to {}", instruction.operation(), target, e);
            return ValidationResult.failure(PATCH_IO_ERROR,
                    instruction.operation() + " on " + instruction.filePath() + " failed: " + e.getMessage());
        }
    }

    // --- Operations ---

    private ValidationResult insert(Path target, PatchInstruction instruction) throws IOException {
        String content = instruction.content() != null ? instruction.content() : "";
        if (!Files.exists(target)) {
            write(target, content);
            return ValidationResult.success(PATCH_APPLIED, "Created " + instruction.filePath());
        }

        String original = Files.readString(target, StandardCharsets.UTF_8);
        boolean trailingNewline = original.endsWith("\n");
        List<String> lines = splitLines(original);
        List<String> inserted = splitLines(content);
        if (inserted.isEmpty()) {
            inserted = List.of("");
        }

        int index;
        if (instruction.lineNumber() == null) {
            index = lines.size();
        } else {
            index = Math.max(0, Math.min(instruction.lineNumber() - 1, lines.size()));
        }
        lines.addAll(index, inserted);

        String updated = String.join("\n", lines) + (trailingNewline ? "\n" : "");
        write(target, updated);
        return ValidationResult.success(PATCH_APPLIED,
                "Inserted %d line(s) into %s at line %d".formatted(inserted.size(), instruction.filePath(), index + 1));
    }

    private ValidationResult replace(Path target, PatchInstruction instruction) throws IOException {
        String content = instruction.content() != null ? instruction.content() : "";
        if (instruction.targetsWholeFile()) {
            write(target, content);
            return ValidationResult.success(PATCH_APPLIED, "Replaced whole file " + instruction.filePath());
        }
        if (instruction.match().isEmpty()) {
            return ValidationResult.failure(INVALID_PATCH_INSTRUCTION, "Empty match block for " + instruction.filePath());
        }
        if (!Files.isRegularFile(target)) {
            return ValidationResult.failure(BLOCK_NOT_FOUND, "File not found: " + instruction.filePath());
        }

        String original = Files.readString(target, StandardCharsets.UTF_8);
        int[] span = locate(original, instruction);
        if (span == null) {
            return blockNotFound(instruction);
        }
        write(target, original.substring(0, span[0]) + content + original.substring(span[1]));
        return ValidationResult.success(PATCH_APPLIED, "Replaced block in " + instruction.filePath());
    }

    private ValidationResult delete(Path target, PatchInstruction instruction) throws IOException {
        if (instruction.targetsWholeFile()) {
            boolean existed = Files.deleteIfExists(target);
            return ValidationResult.success(PATCH_APPLIED,
                    existed ? "Deleted " + instruction.filePath() : "Already absent: " + instruction.filePath());
        }
        if (instruction.match().isEmpty()) {
            return ValidationResult.failure(INVALID_PATCH_INSTRUCTION, "Empty match block for " + instruction.filePath());
        }
        if (!Files.isRegularFile(target)) {
            return ValidationResult.failure(BLOCK_NOT_FOUND, "File not found: " + instruction.filePath());
        }

        String original = Files.readString(target, StandardCharsets.UTF_8);
        int[] span = locate(original, instruction);
        if (span == null) {
            return blockNotFound(instruction);
        }

        int start = span[0];
        int end = span[1];
        boolean startsLine = start == 0 || original.charAt(start - 1) == '\n';
        boolean endsWithTerminator = end > start && original.charAt(end - 1) == '\n';
        boolean endsLine = end == original.length() || original.charAt(end) == '\n';
        if (startsLine && endsLine && !endsWithTerminator) {
            if (end < original.length()) {
                end++;
            } else if (start > 0) {
                start--;
            }
        }
        write(target, original.substring(0, start) + original.substring(end));
        return ValidationResult.success(PATCH_APPLIED, "Deleted block from " + instruction.filePath());
    }

    // --- Helpers ---

    /** Returns {@code [start, end)} of the first match, or null. */
    private static int[] locate(String text, PatchInstruction instruction) {
        if (instruction.regex()) {
            Matcher matcher = Pattern.compile(instruction.match(), Pattern.MULTILINE | Pattern.DOTALL).matcher(text);
            return matcher.find() ? new int[]{matcher.start(), matcher.end()} : null;
        }
        int idx = text.indexOf(instruction.match());
        return idx < 0 ? null : new int[]{idx, idx + instruction.match().length()};
    }

    private static ValidationResult blockNotFound(PatchInstruction instruction) {
        String preview = instruction.match().length() > 80
                ? instruction.match().substring(0, 80) + "..."
                : instruction.match();
        return ValidationResult.failure(BLOCK_NOT_FOUND,
                "Block not found in %s: %s".formatted(instruction.filePath(), preview));
    }

    /** Splits on '\n', ignoring one trailing terminator. */
    static List<String> splitLines(String text) {
        if (text.isEmpty()) {
            return new ArrayList<>();
        }
        String body = text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
        return new ArrayList<>(Arrays.asList(body.split("\n", -1)));
    }

    private static void write(Path target, String content) throws IOException {
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, content, StandardCharsets.UTF_8);
    }
}
