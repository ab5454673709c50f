package edu.harvard.hms.dbmi.avillach.idmap.etl.reference;

import edu.harvard.hms.dbmi.avillach.idmap.data.variant.CandidateIndex;

public record ScanResult(CandidateIndex candidates, ScanStats stats) {
}
