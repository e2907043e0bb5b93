package db.pesa.cli;

import java.io.PrintStream;
import java.util.List;

import db.pesa.query.QueryResult;

/**
 * Simple ASCII table printer for statement results.
 */
public final class TablePrinter {
    private TablePrinter() {}

    public static void print(QueryResult result) {
        print(result, System.out);
    }

    public static void print(QueryResult result, PrintStream out) {
        if (result.kind() == QueryResult.Kind.AFFECTED_ROWS) {
            out.println(result.message());
            return;
        }
        List<String> headers = result.columns();
        List<List<Object>> rows = result.rows();
        int[] widths = new int[headers.size()];
        for (int i = 0; i < widths.length; i++) widths[i] = headers.get(i).length();
        for (List<Object> r : rows) {
            for (int i = 0; i < widths.length; i++) {
                String s = format(r.get(i));
                if (s.length() > widths[i]) widths[i] = s.length();
            }
        }
        String divLine = buildDivider(widths);
        out.println(divLine);
        out.println(buildLine(headers, widths));
        out.println(divLine);
        for (List<Object> r : rows) {
            out.println(buildLine(r, widths));
        }
        if (!rows.isEmpty()) out.println(divLine);
        out.println("(" + rows.size() + " row(s))");
    }

    static String format(Object v) {
        return v == null ? "NULL" : String.valueOf(v);
    }

    private static String buildDivider(int[] widths) {
        StringBuilder divider = new StringBuilder();
        divider.append('+');
        for (int w : widths) {
            for (int k = 0; k < w + 2; k++) divider.append('-');
            divider.append('+');
        }
        return divider.toString();
    }

    private static String buildLine(List<?> cells, int[] widths) {
        StringBuilder sb = new StringBuilder();
        sb.append('|');
        for (int i = 0; i < widths.length; i++) {
            sb.append(' ').append(pad(format(cells.get(i)), widths[i])).append(' ').append('|');
        }
        return sb.toString();
    }

    private static String pad(String s, int width) {
        if (s.length() >= width) return s;
        StringBuilder sb = new StringBuilder(width);
        sb.append(s);
        for (int i = s.length(); i < width; i++) sb.append(' ');
        return sb.toString();
    }
}
