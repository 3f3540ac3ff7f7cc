package com.evolver.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;

/**
 * One structured edit against one file.
 * <p>
 * A {@code null} {@code match} on {@link PatchOperation#REPLACE} or {@link PatchOperation#DELETE}
 * targets the whole file. A {@code null} {@code lineNumber} on {@link PatchOperation#INSERT}
 * appends at the end of the file.
 *
 * @param operation  INSERT, REPLACE or DELETE
 * @param filePath   path relative to the project root
 * @param match      literal block (or regex when {@code regex} is set) to locate, or null
 * @param regex      whether {@code match} is a regular expression
 * @param content    text to insert or substitute, may be null for DELETE
 * @param lineNumber 1-indexed insertion line for INSERT, or null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PatchInstruction(
    PatchOperation operation,
    @JsonAlias("file_path") String filePath,
    @JsonAlias({"block_to_replace", "block_to_delete"}) String match,
    @JsonAlias("is_regex") boolean regex,
    String content,
    @JsonAlias("line_number") Integer lineNumber
) implements Serializable {

    public static PatchInstruction insert(String filePath, String content, Integer lineNumber) {
        return new PatchInstruction(PatchOperation.INSERT, filePath, null, false, content, lineNumber);
    }

    public static PatchInstruction replace(String filePath, String match, String content) {
        return new PatchInstruction(PatchOperation.REPLACE, filePath, match, false, content, null);
    }

    public static PatchInstruction replaceRegex(String filePath, String pattern, String content) {
        return new PatchInstruction(PatchOperation.REPLACE, filePath, pattern, true, content, null);
    }

    public static PatchInstruction delete(String filePath, String match) {
        return new PatchInstruction(PatchOperation.DELETE, filePath, match, false, null, null);
    }

    public boolean targetsWholeFile() {
        return match == null;
    }
}
