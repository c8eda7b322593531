package com.rankfusion.query.index;

public interface SearchIndexProvider {

    /**
     * Opens an index over the current record set.
     *
     * @throws com.rankfusion.ingestion.exception.IndexNotBuiltException when nothing has been built
     */
    SearchIndex open();
}
