package com.flagship.statement_importer.statement;

import java.nio.file.Path;

/**
 * Turns a statement file into parsed transactions.
 */
public interface StatementParser {

    /**
     * @param file existing statement file
     * @return the parsed statement, transactions in file order
     * @throws StatementParseException if the file cannot be read or understood
     */
    ParsedStatement parse(Path file);
}
