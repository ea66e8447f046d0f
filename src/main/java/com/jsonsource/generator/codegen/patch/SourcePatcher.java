package com.jsonsource.generator.codegen.patch;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsonsource.generator.codegen.exception.PatchIoException;
import com.jsonsource.generator.codegen.exception.PatchRangeException;
import com.jsonsource.generator.codegen.util.FileWriteUtil;

/**
 * Applies batches of {@link PatchInstruction}s to files.
 *
 * Instructions of one file are applied from the highest start offset to the lowest, so the
 * offsets of the remaining ones stay valid. The whole batch is validated and spliced in memory
 * before the file is written, once; a failing batch leaves its file untouched and does not
 * affect other files.
 */
public class SourcePatcher {

    private static final Logger log = LoggerFactory.getLogger(SourcePatcher.class);

    private final boolean dryRun;

    public SourcePatcher() {
        this(false);
    }

    /**
     * @param dryRun validate and compute, but never write
     */
    public SourcePatcher(boolean dryRun) {
        this.dryRun = dryRun;
    }

    /**
     * Applies every instruction, grouped by file. Errors are reported per file.
     */
    public List<PatchResult> applyAll(Collection<PatchInstruction> instructions) {
        Map<Path, List<PatchInstruction>> byFile = new LinkedHashMap<>();
        for (PatchInstruction instruction : instructions) {
            byFile.computeIfAbsent(instruction.getFilePath(), k -> new ArrayList<>()).add(instruction);
        }

        List<PatchResult> results = new ArrayList<>();
        for (Map.Entry<Path, List<PatchInstruction>> entry : byFile.entrySet()) {
            try {
                results.add(apply(entry.getKey(), entry.getValue()));
            } catch (PatchRangeException | PatchIoException e) {
                log.error("Patch batch for {} failed: {}", entry.getKey(), e.getMessage());
                results.add(PatchResult.builder()
                        .file(entry.getKey())
                        .instructionCount(entry.getValue().size())
                        .error(e.getMessage())
                        .build());
            }
        }
        return results;
    }

    /**
     * Applies one file's batch.
     *
     * @throws PatchRangeException if a range is reversed, exceeds the current text or overlaps another
     * @throws PatchIoException if the file cannot be read or written
     */
    public PatchResult apply(Path file, List<PatchInstruction> batch) {
        String original = read(file);
        String patched = splice(file, original, batch);
        boolean changed = !patched.equals(original);

        if (changed && !dryRun) {
            try {
                FileWriteUtil.replaceString(file, patched);
            } catch (IOException e) {
                throw new PatchIoException(file.toString(), "Failed to write " + file + ": " + e.getMessage(), e);
            }
            log.info("Patched {} ({} instructions)", file, batch.size());
        } else if (!changed) {
            log.debug("{} unchanged", file);
        }

        return PatchResult.builder()
                .file(file)
                .instructionCount(batch.size())
                .changed(changed)
                .build();
    }

    /**
     * Splices {@code batch} into {@code text}, highest start offset first.
     */
    static String splice(Path file, String text, List<PatchInstruction> batch) {
        List<PatchInstruction> ordered = new ArrayList<>(batch);
        ordered.sort(Comparator.comparingInt(PatchInstruction::getStartOffset).reversed());

        StringBuilder sb = new StringBuilder(text);
        int lowestApplied = Integer.MAX_VALUE;
        for (PatchInstruction instruction : ordered) {
            validate(file, text, instruction, lowestApplied);
            sb.replace(instruction.getStartOffset(), instruction.getEndOffset(), instruction.getReplacementText());
            lowestApplied = instruction.getStartOffset();
        }
        return sb.toString();
    }

    private static void validate(Path file, String text, PatchInstruction instruction, int lowestApplied) {
        int start = instruction.getStartOffset();
        int end = instruction.getEndOffset();
        if (start < 0 || start > end) {
            throw new PatchRangeException(file.toString(),
                    "Invalid range [" + start + ", " + end + ") for " + file + ".");
        }
        if (end > text.length()) {
            throw new PatchRangeException(file.toString(),
                    "Range [" + start + ", " + end + ") exceeds the " + text.length() + " chars of " + file + ".");
        }
        if (end > lowestApplied) {
            throw new PatchRangeException(file.toString(),
                    "Range [" + start + ", " + end + ") overlaps a patch starting at " + lowestApplied + " in "
                            + file + ".");
        }
    }

    private static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PatchIoException(file.toString(), "Failed to read " + file + ": " + e.getMessage(), e);
        }
    }
}
