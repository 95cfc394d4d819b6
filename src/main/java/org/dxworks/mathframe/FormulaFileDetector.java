package org.dxworks.mathframe;

import java.nio.file.Path;
import java.util.Locale;

public class FormulaFileDetector {

    private FormulaFileDetector() {
    }

    public static boolean isFormulaFile(Path filePath) {
        Path fileName = filePath.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".tex") || name.endsWith(".latex") || name.endsWith(".math");
    }
}
