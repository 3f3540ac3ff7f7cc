package com.evolver.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Snapshot of the project's structure used to render the manifest handed to the planner.
 */
public record ProjectContext(
    String rootPath,
    List<String> fileTree,
    String language,
    String buildTool,
    int fileCount,
    String summary
) implements Serializable {}
