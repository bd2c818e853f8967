package com.eainde.insight.ingestion;

import com.eainde.insight.model.Platform;
import com.eainde.insight.schema.FileFingerprint;

import java.io.IOException;
import java.io.Reader;

/**
 * Handle to one discovered source file. Discovery itself (directory traversal) happens outside
 * the pipeline; callers hand over these handles grouped by family.
 */
public interface SourceFile {

    /** File name without directories, used for heuristics and reporting. */
    String name();

    /** Platform every record of this file is tagged with. */
    Platform platform();

    FileFingerprint fingerprint() throws IOException;

    Reader openReader() throws IOException;
}
