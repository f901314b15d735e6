/* Copyright (C) 2024 The FASim Authors
 * This file is part of FASim.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.fasim.datastructure.transitiontable;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Writes a {@link TransitionTable} as plain text. Columns are separated by {@code " | "} and padded to the width of
 * their widest entry:
 * <pre>
 * State  | a  | b
 * q0 (I) | q1 | q0
 * q1 (F) | q1 | q0
 * </pre>
 */
public final class TransitionTableASCIIWriter {

    private static final String COLUMN_SEPARATOR = " | ";

    private TransitionTableASCIIWriter() {
        // prevent instantiation
    }

    public static String render(TransitionTable table) {
        final StringBuilder sb = new StringBuilder();
        try {
            write(table, sb);
        } catch (IOException e) {
            // StringBuilder does not throw
            throw new UncheckedIOException(e);
        }
        return sb.toString();
    }

    public static void write(TransitionTable table, Appendable out) throws IOException {
        final List<String> symbols = table.getColumnSymbols();
        final int[] widths = new int[symbols.size() + 1];

        widths[0] = TransitionTable.STATE_HEADING.length();
        for (int i = 0; i < symbols.size(); i++) {
            widths[i + 1] = symbols.get(i).length();
        }
        for (Row row : table.getRows()) {
            widths[0] = Math.max(widths[0], row.getLabel().length());
            for (int i = 0; i < symbols.size(); i++) {
                widths[i + 1] = Math.max(widths[i + 1], row.getCell(i).length());
            }
        }

        writeLine(out, widths, TransitionTable.STATE_HEADING, symbols);
        for (Row row : table.getRows()) {
            writeLine(out, widths, row.getLabel(), row.getCells());
        }
    }

    private static void writeLine(Appendable out, int[] widths, String first, List<String> cells)
            throws IOException {
        final StringBuilder line = new StringBuilder();
        pad(line, first, widths[0]);
        for (int i = 0; i < cells.size(); i++) {
            line.append(COLUMN_SEPARATOR);
            pad(line, cells.get(i), widths[i + 1]);
        }

        int end = line.length();
        while (end > 0 && line.charAt(end - 1) == ' ') {
            end--;
        }
        line.setLength(end);

        out.append(line).append(System.lineSeparator());
    }

    private static void pad(StringBuilder sb, String s, int width) {
        sb.append(s);
        for (int i = s.length(); i < width; i++) {
            sb.append(' ');
        }
    }
}
