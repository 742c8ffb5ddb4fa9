/* (C)2026 */
package com.ammann.accuracy.store;

import com.ammann.accuracy.dto.AccuracyReportDTO;
import com.ammann.accuracy.exception.StorageException;
import java.util.List;

/**
 * Append-only persistence port for accuracy reports.
 */
public interface ReportStore {

    /**
     * Stores a new report.
     *
     * @throws StorageException if the store is unavailable or rejects the write
     */
    void create(AccuracyReportDTO report);

    /**
     * Returns matching reports, newest first.
     *
     * @throws StorageException if the store is unavailable
     */
    List<AccuracyReportDTO> findMany(ReportQuery query);

    /**
     * @return total number of stored reports
     * @throws StorageException if the store is unavailable
     */
    long count();
}
