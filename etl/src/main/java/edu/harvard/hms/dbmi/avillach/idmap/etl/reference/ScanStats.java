package edu.harvard.hms.dbmi.avillach.idmap.etl.reference;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Row counts for one pass over the reference corpus.
 *
 * <p>Every row is scanned. A scanned row is then exactly one of kept, unwanted or rejected,
 * and rejected rows are rolled up by {@link RejectionReason}.</p>
 */
public class ScanStats {

    private long rowsScanned;
    private long rowsKept;
    private long rowsUnwanted;
    private final EnumMap<RejectionReason, Long> rejections = new EnumMap<>(RejectionReason.class);

    public void record(RowVerdict verdict) {
        rowsScanned++;
        switch (verdict.outcome()) {
            case KEPT -> rowsKept++;
            case UNWANTED -> rowsUnwanted++;
            case REJECTED -> rejections.merge(verdict.reason(), 1L, Long::sum);
        }
    }

    public long getRowsScanned() {
        return rowsScanned;
    }

    public long getRowsKept() {
        return rowsKept;
    }

    public long getRowsUnwanted() {
        return rowsUnwanted;
    }

    public long getRowsRejected() {
        return rejections.values().stream().mapToLong(Long::longValue).sum();
    }

    public long getRejections(RejectionReason reason) {
        return rejections.getOrDefault(reason, 0L);
    }

    public Map<RejectionReason, Long> getRejections() {
        return Collections.unmodifiableMap(rejections);
    }

    @Override
    public String toString() {
        return "ScanStats{scanned=" + rowsScanned + ", kept=" + rowsKept + ", unwanted=" + rowsUnwanted
            + ", rejected=" + rejections + "}";
    }
}
