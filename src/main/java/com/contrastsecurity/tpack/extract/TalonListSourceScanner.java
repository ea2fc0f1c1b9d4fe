package com.contrastsecurity.tpack.extract;

import com.contrastsecurity.tpack.model.EntityKind;

import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scanner for {@code .talon-list} files, which populate a list declared elsewhere.
 */
public class TalonListSourceScanner implements SourceScanner {

    public static final String DIALECT = "talon-list";

    private static final Pattern LIST_HEADER = Pattern.compile("^\\s*list:\\s*([A-Za-z_][\\w.]*)\\s*$", Pattern.MULTILINE);

    @Override
    public String getDialect() {
        return DIALECT;
    }

    @Override
    public boolean supports(Path file) {
        return file.getFileName().toString().endsWith(".talon-list");
    }

    @Override
    public FileExtraction scan(Path relativePath, String content) {
        FileExtraction result = new FileExtraction(relativePath, DIALECT);
        String text = content.replace("\r\n", "\n");
        int separator = TalonSourceScanner.findSeparator(text);
        String header = separator >= 0 ? text.substring(0, separator) : text;

        Matcher m = LIST_HEADER.matcher(header);
        if (m.find()) {
            result.getReferenced().add(EntityKind.LIST, m.group(1));
        }
        return result;
    }
}
