package com.weatherledger.ingest.rows;

import java.util.List;

final class Cells {
    private Cells() {
    }

    // Short rows are tolerated: a missing trailing column reads as an empty cell.
    static String at(List<String> row, int index) {
        if (row == null || index >= row.size()) {
            return "";
        }
        String cell = row.get(index);
        return cell == null ? "" : cell;
    }
}
