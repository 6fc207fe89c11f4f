package com.sweref.coordsearch.application.service;

import com.sweref.coordsearch.domain.model.CoordinateSearchResult;

import java.util.List;

/**
 * Receives the outcome of the most recent coordinate search in a session.
 */
public interface CoordinateSearchListener {

    CoordinateSearchListener NONE = new CoordinateSearchListener() {
        @Override
        public void onSuccess(CoordinateSearchResult result) {
        }

        @Override
        public void onError(String errorKey, List<String> warnings) {
        }
    };

    void onSuccess(CoordinateSearchResult result);

    /**
     * @param errorKey opaque error key such as {@code coordinateErrorParse}
     * @param warnings warnings gathered before the failure, possibly empty
     */
    void onError(String errorKey, List<String> warnings);
}
