package com.dealwatch.output;

import com.dealwatch.model.OfferRecord;

import java.util.List;

/**
 * Delivers one alert covering all newly matched deals of a run.
 */
public interface DealNotifier {

    /**
     * @return {@code true} only when delivery succeeded; the caller commits the seen set only then
     */
    boolean send(List<OfferRecord> deals);
}
