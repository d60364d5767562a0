package io.fleetquery.tools.multiquery;

public enum OutputMode {
    TABLE,
    CSV;

    public static OutputMode of(boolean csvOutput) {
        return csvOutput ? CSV : TABLE;
    }
}
