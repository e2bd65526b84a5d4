package tcdiags.utils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Tabla de texto de ancho fijo para los resúmenes que se vuelcan al log.
 */
public final class SummaryTable {

    private final List<String> headers;
    private final List<List<String>> rows = new ArrayList<>();

    public SummaryTable(String... headers) {
        this.headers = List.of(headers);
    }

    public SummaryTable row(Object... cells) {
        if (cells.length != headers.size()) {
            throw new IllegalArgumentException(String.format(
                    "La fila tiene %d celdas y la tabla %d columnas.", cells.length, headers.size()));
        }
        List<String> row = new ArrayList<>(cells.length);
        for (Object cell : cells) {
            row.add(format(cell));
        }
        rows.add(row);
        return this;
    }

    public int size() {
        return rows.size();
    }

    public String render() {
        int[] widths = new int[headers.size()];
        for (int c = 0; c < widths.length; c++) {
            widths[c] = headers.get(c).length();
            for (List<String> row : rows) {
                widths[c] = Math.max(widths[c], row.get(c).length());
            }
        }
        StringBuilder sb = new StringBuilder();
        appendRow(sb, headers, widths);
        for (int c = 0; c < widths.length; c++) {
            sb.append(c == 0 ? "" : "-+-").append("-".repeat(widths[c]));
        }
        sb.append(System.lineSeparator());
        for (List<String> row : rows) {
            appendRow(sb, row, widths);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return render();
    }

    private static void appendRow(StringBuilder sb, List<String> cells, int[] widths) {
        for (int c = 0; c < widths.length; c++) {
            if (c > 0) {
                sb.append(" | ");
            }
            sb.append(String.format("%-" + widths[c] + "s", cells.get(c)));
        }
        sb.append(System.lineSeparator());
    }

    private static String format(Object cell) {
        if (cell == null) {
            return "-";
        }
        if (cell instanceof Double d) {
            return Double.isNaN(d) ? "NaN" : String.format(Locale.ROOT, "%.4g", d);
        }
        return cell.toString();
    }
}
