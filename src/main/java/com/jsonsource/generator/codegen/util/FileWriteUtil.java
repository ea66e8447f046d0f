package com.jsonsource.generator.codegen.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Utility for safe file operations with automatic directory creation.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content only when it differs from what the file holds.
     *
     * @return whether the file was written
     */
    public static boolean writeIfChanged(Path filePath, String content) throws IOException {
        if (Files.isRegularFile(filePath) && Files.readString(filePath, StandardCharsets.UTF_8).equals(content)) {
            return false;
        }
        replaceString(filePath, content);
        return true;
    }

    /**
     * Replaces a file's content through a sibling temporary file, so readers never see a
     * partially written file.
     */
    public static void replaceString(Path filePath, String content) throws IOException {
        Path target = filePath.toAbsolutePath();
        Path parentDir = target.getParent();
        Files.createDirectories(parentDir);
        Path temp = Files.createTempFile(parentDir, "." + target.getFileName(), ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
