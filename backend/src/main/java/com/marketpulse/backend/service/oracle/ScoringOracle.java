package com.marketpulse.backend.service.oracle;

import com.marketpulse.backend.exception.OracleUnavailableException;

/**
 * External sentiment inference service.
 */
public interface ScoringOracle {

    /**
     * @throws OracleUnavailableException when the oracle cannot produce a score in time
     */
    SentimentScore score(String text, DomainHint hint);
}
