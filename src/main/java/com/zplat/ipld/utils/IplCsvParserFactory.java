package com.zplat.ipld.utils;

import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Builds parsers for the {@code ;}-separated result files written by the remote scripts.
 * Headers are not extracted; the caller reads the first row itself.
 */
@Slf4j
@Component
public class IplCsvParserFactory {

    private final char delimiter;

    public IplCsvParserFactory(@Value("${ipld.ingest.delimiter:;}") char delimiter) {
        this.delimiter = delimiter;
    }

    public CsvParser newParser() {
        CsvParserSettings settings = new CsvParserSettings();
        settings.getFormat().setDelimiter(delimiter);
        settings.getFormat().setLineSeparator("\n");
        settings.setLineSeparatorDetectionEnabled(true);
        settings.setHeaderExtractionEnabled(false);
        settings.setSkipEmptyLines(true);
        settings.setIgnoreLeadingWhitespaces(true);
        settings.setIgnoreTrailingWhitespaces(true);
        settings.setMaxCharsPerColumn(4096);
        log.debug("Created CsvParser with delimiter='{}'", delimiter);
        return new CsvParser(settings);
    }
}
