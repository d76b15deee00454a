/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.solver;

import com.powsybl.linopt.writer.TokenType;
import com.univocity.parsers.fixed.FixedWidthFields;
import com.univocity.parsers.fixed.FixedWidthParser;
import com.univocity.parsers.fixed.FixedWidthParserSettings;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a solution file written by {@code glpsol --output}: a header block of {@code key: value} lines ended by
 * a blank line, followed by fixed-width tables of rows and columns.
 * <pre>
 * Status:     OPTIMAL
 * Objective:  obj = 3.5 (MINimum)
 *
 *    No.   Row name   St   Activity     Lower bound   Upper bound    Marginal
 * ------ ------------ -- ------------- ------------- ------------- -------------
 *      1 c0           NS             1             1             =           0.5
 * </pre>
 * Column widths are taken from the dashed ruler line under each table header.
 *
 * @author powsybl-linopt contributors
 */
public final class GlpkSolutionParser {

    private static final Pattern NUMBER_PATTERN = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private static final Pattern ROW_NUMBER_PATTERN = Pattern.compile("\\d+");

    private static final String STATUS_KEY = "Status";
    private static final String OBJECTIVE_KEY = "Objective";
    private static final String ACTIVITY_COLUMN = "Activity";
    private static final String MARGINAL_COLUMN = "Marginal";

    private static final int NAME_FIELD = 1;

    private static final int LAST_FIELD_LENGTH = 256;

    private GlpkSolutionParser() {
    }

    private static final class Table {

        private final FixedWidthParser parser;

        private final int activityField;

        private final int marginalField;

        private String pendingName;

        private Table(FixedWidthParser parser, int activityField, int marginalField) {
            this.parser = parser;
            this.activityField = activityField;
            this.marginalField = marginalField;
        }
    }

    public static SolverResult parse(BufferedReader reader) throws IOException {
        Map<String, String> header = readHeader(reader);
        String status = header.get(STATUS_KEY);
        if (status == null) {
            throw new SolutionParsingException("No status in GLPK solution");
        }
        status = status.toLowerCase().trim();
        TerminationCondition condition = TerminationCondition.fromStatus(status);
        if (condition != TerminationCondition.OPTIMAL) {
            return SolverResult.notOptimal(status, condition);
        }
        double objective = parseObjective(header.get(OBJECTIVE_KEY));

        Map<String, Double> variableValues = new LinkedHashMap<>();
        Map<String, Double> constraintDuals = new LinkedHashMap<>();
        Table table = null;
        String line;
        while ((line = reader.readLine()) != null) {
            String trimmedLine = line.trim();
            if (trimmedLine.startsWith("Karush-Kuhn-Tucker") || trimmedLine.startsWith("End of output")) {
                break;
            }
            if (trimmedLine.isEmpty()) {
                table = null;
            } else if (line.contains("Row name") || line.contains("Column name")) {
                table = createTable(line, reader.readLine());
            } else if (table != null) {
                readRow(table, line, variableValues, constraintDuals);
            }
        }
        return SolverResult.optimal(status, variableValues, constraintDuals, objective);
    }

    private static Map<String, String> readHeader(BufferedReader reader) throws IOException {
        Map<String, String> header = new HashMap<>();
        String line;
        while ((line = reader.readLine()) != null && !line.isBlank()) {
            int separator = line.indexOf(':');
            if (separator == -1) {
                throw new SolutionParsingException("Invalid GLPK solution header line: '" + line + "'");
            }
            header.put(line.substring(0, separator).trim(), line.substring(separator + 1));
        }
        return header;
    }

    private static double parseObjective(String text) {
        if (text == null) {
            throw new SolutionParsingException("No objective in GLPK solution");
        }
        int equals = text.indexOf('=');
        Matcher matcher = NUMBER_PATTERN.matcher(equals != -1 ? text.substring(equals + 1) : text);
        if (!matcher.find()) {
            throw new SolutionParsingException("Invalid GLPK objective: '" + text.trim() + "'");
        }
        return Double.parseDouble(matcher.group());
    }

    private static Table createTable(String headerLine, String rulerLine) {
        if (rulerLine == null || !rulerLine.trim().startsWith("-")) {
            throw new SolutionParsingException("Missing ruler line after GLPK table header '" + headerLine + "'");
        }
        FixedWidthFields fields = new FixedWidthFields();
        List<String> columnNames = new ArrayList<>();
        Matcher matcher = Pattern.compile("-+").matcher(rulerLine);
        List<int[]> groups = new ArrayList<>();
        while (matcher.find()) {
            groups.add(new int[] {matcher.start(), matcher.end()});
        }
        for (int i = 0; i < groups.size(); i++) {
            int start = i == 0 ? 0 : groups.get(i)[0];
            boolean last = i == groups.size() - 1;
            int end = last ? start + LAST_FIELD_LENGTH : groups.get(i + 1)[0];
            fields.addField(end - start);
            columnNames.add(headerLine.substring(Math.min(start, headerLine.length()), Math.min(end, headerLine.length())).trim());
        }
        int activityField = columnNames.indexOf(ACTIVITY_COLUMN);
        int marginalField = columnNames.indexOf(MARGINAL_COLUMN);
        if (activityField == -1 || marginalField == -1) {
            throw new SolutionParsingException("Unexpected GLPK table columns: " + columnNames);
        }
        FixedWidthParserSettings settings = new FixedWidthParserSettings(fields);
        settings.setRecordEndsOnNewline(true);
        return new Table(new FixedWidthParser(settings), activityField, marginalField);
    }

    private static void readRow(Table table, String line, Map<String, Double> variableValues, Map<String, Double> constraintDuals) {
        if (table.pendingName == null) {
            String[] tokens = line.trim().split("\\s+");
            if (tokens.length == 1 || tokens.length == 2 && ROW_NUMBER_PATTERN.matcher(tokens[0]).matches()) {
                // name too long for its column, values of the row are on the next line
                table.pendingName = tokens[tokens.length - 1];
                return;
            }
        }
        String[] values = table.parser.parseLine(line);
        if (values == null) {
            return;
        }
        String name = field(values, NAME_FIELD);
        String activity = field(values, table.activityField);
        if (activity == null) {
            throw new SolutionParsingException("GLPK solution row without activity: '" + line + "'");
        }
        if (name == null) {
            name = table.pendingName;
        }
        table.pendingName = null;
        if (name == null) {
            throw new SolutionParsingException("GLPK solution row without name: '" + line + "'");
        }
        if (TokenType.VARIABLE.matches(name)) {
            variableValues.put(name, parseActivity(activity, line));
        } else if (TokenType.CONSTRAINT.matches(name)) {
            constraintDuals.put(name, parseMarginal(field(values, table.marginalField)));
        }
    }

    private static String field(String[] values, int index) {
        if (index >= values.length || values[index] == null) {
            return null;
        }
        String value = values[index].trim();
        return value.isEmpty() ? null : value;
    }

    private static double parseActivity(String text, String line) {
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new SolutionParsingException("Invalid activity '" + text + "' in GLPK solution line '" + line + "'", e);
        }
    }

    private static double parseMarginal(String text) {
        if (text == null) {
            return 0;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            // "< eps" and other non numeric marginals
            return 0;
        }
    }
}
