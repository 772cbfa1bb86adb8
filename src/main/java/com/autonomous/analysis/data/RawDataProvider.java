package com.autonomous.analysis.data;

import com.autonomous.analysis.exception.DataNotFoundException;
import com.autonomous.analysis.model.DataPayload;

/**
 * Supplies the raw data slice a role analyzes.
 */
@FunctionalInterface
public interface RawDataProvider {

    /**
     * @throws DataNotFoundException when a data source mapped to the role is missing or unreadable
     */
    DataPayload loadInput(String role);
}
