package com.raditha.exprdetect.frontend;

import com.raditha.exprdetect.model.Dialect;
import com.raditha.exprdetect.model.TranslationUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Entry point of the front end: turns a source file into a
 * {@link TranslationUnit}.
 * <p>
 * C++ input is not analyzed; it yields a unit with no declarations, so every
 * later pass sees zero candidates.
 */
public class CFrontEnd {

    private static final Logger logger = LoggerFactory.getLogger(CFrontEnd.class);

    /**
     * Sources are read and written one char per byte, so bytes that are not
     * valid UTF-8 survive a rewrite unchanged.
     */
    public static final Charset SOURCE_CHARSET = StandardCharsets.ISO_8859_1;

    public TranslationUnit parse(String fileName, String source, Dialect dialect) {
        if (dialect == Dialect.CXX) {
            logger.warn("{}: C++ input is not analyzed", fileName);
            return new TranslationUnit(fileName, source, dialect, List.of(), List.of());
        }
        return new CParser(fileName, source).parse();
    }

    /**
     * Read and parse a file.
     *
     * @param dialect the dialect, or {@code null} to infer it from the file name
     */
    public TranslationUnit parseFile(Path file, Dialect dialect) throws IOException {
        String source = Files.readString(file, SOURCE_CHARSET);
        Dialect effective = dialect != null ? dialect : Dialect.fromFileName(file.getFileName().toString());
        return parse(file.toString(), source, effective);
    }
}
