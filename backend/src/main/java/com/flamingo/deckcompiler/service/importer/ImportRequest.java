package com.flamingo.deckcompiler.service.importer;

/**
 * What an {@code <import>} element asks for.
 *
 * @param fileName file to read, relative to the configured base directory
 * @param sheet worksheet name for XLSX files, null for the first sheet
 * @param rows 1-based row selection (e.g. {@code "2-5,8"}), null for all rows
 * @param cols 1-based column selection, null for all columns
 */
public record ImportRequest(String fileName, String sheet, String rows, String cols) {}
