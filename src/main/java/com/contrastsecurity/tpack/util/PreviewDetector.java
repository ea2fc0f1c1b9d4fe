package com.contrastsecurity.tpack.util;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Finds a preview image in a package root and turns it into a raw GitHub URL.
 */
public final class PreviewDetector {

    private static final String[] EXTENSIONS = {".png", ".jpg", ".jpeg", ".gif", ".webp"};

    private PreviewDetector() {
    }

    /**
     * @return file name of the first {@code preview.*} image found, or null
     */
    public static String findPreviewFile(Path packageDir) {
        for (String ext : EXTENSIONS) {
            String fileName = "preview" + ext;
            if (Files.isRegularFile(packageDir.resolve(fileName))) {
                return fileName;
            }
        }
        return null;
    }

    /**
     * Raw content URL of a file on the repository's main branch, e.g.
     * {@code https://raw.githubusercontent.com/me/pkg/main/preview.png}.
     *
     * @return the URL, or an empty string if the repository or the file is unknown
     */
    public static String toRawUrl(String github, String fileName) {
        if (github == null || github.trim().isEmpty() || fileName == null) {
            return "";
        }
        String base = github.trim().replace("github.com", "raw.githubusercontent.com");
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/main/" + fileName;
    }
}
