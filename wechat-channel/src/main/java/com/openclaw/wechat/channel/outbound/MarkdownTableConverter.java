package com.openclaw.wechat.channel.outbound;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * {@link TableConverter} for pipe tables.
 * <p>
 * {@link TableMode#CODE} wraps each table in a code fence so columns stay
 * aligned; {@link TableMode#BULLETS} turns each row into a bullet of
 * {@code header: value} pairs. Text outside tables is left untouched.
 */
public class MarkdownTableConverter implements TableConverter {

    public enum TableMode {
        OFF, CODE, BULLETS
    }

    private static final Pattern SEPARATOR_ROW = Pattern.compile("^\\s*\\|?\\s*:?-{3,}:?\\s*(\\|\\s*:?-{3,}:?\\s*)*\\|?\\s*$");

    private final TableMode mode;

    public MarkdownTableConverter(TableMode mode) {
        this.mode = mode;
    }

    @Override
    public String convert(String markdown) {
        if (markdown == null || markdown.isEmpty() || mode == TableMode.OFF) {
            return markdown;
        }
        String[] lines = markdown.split("\n", -1);
        List<String> out = new ArrayList<>();
        boolean inFence = false;
        int i = 0;
        while (i < lines.length) {
            String line = lines[i];
            if (line.trim().startsWith("```")) {
                inFence = !inFence;
                out.add(line);
                i++;
                continue;
            }
            if (!inFence && isRow(line) && i + 1 < lines.length && SEPARATOR_ROW.matcher(lines[i + 1]).matches()) {
                int end = i + 2;
                while (end < lines.length && isRow(lines[end])) {
                    end++;
                }
                renderTable(lines, i, end, out);
                i = end;
                continue;
            }
            out.add(line);
            i++;
        }
        return String.join("\n", out);
    }

    private void renderTable(String[] lines, int start, int end, List<String> out) {
        if (mode == TableMode.CODE) {
            out.add("```");
            out.add(lines[start]);
            for (int row = start + 2; row < end; row++) {
                out.add(lines[row]);
            }
            out.add("```");
            return;
        }
        List<String> headers = cells(lines[start]);
        for (int row = start + 2; row < end; row++) {
            List<String> values = cells(lines[row]);
            List<String> pairs = new ArrayList<>();
            for (int col = 0; col < values.size(); col++) {
                String header = col < headers.size() ? headers.get(col) : "";
                String value = values.get(col);
                if (value.isEmpty())
                    continue;
                pairs.add(header.isEmpty() ? value : header + ": " + value);
            }
            out.add("- " + String.join(", ", pairs));
        }
    }

    private static boolean isRow(String line) {
        String trimmed = line.trim();
        return trimmed.length() > 1 && trimmed.contains("|");
    }

    static List<String> cells(String line) {
        String trimmed = line.trim();
        if (trimmed.startsWith("|"))
            trimmed = trimmed.substring(1);
        if (trimmed.endsWith("|"))
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        List<String> result = new ArrayList<>();
        for (String cell : trimmed.split("\\|", -1)) {
            result.add(cell.trim());
        }
        return result;
    }
}
