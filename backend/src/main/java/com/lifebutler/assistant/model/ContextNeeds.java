package com.lifebutler.assistant.model;

/**
 * How much retrieved context a query needs, expressed as a search result budget.
 */
public enum ContextNeeds {
    MINIMAL(3),
    MODERATE(5),
    EXTENSIVE(10),
    HISTORICAL(15),
    COMPARATIVE(8);

    private final int searchLimit;

    ContextNeeds(int searchLimit) {
        this.searchLimit = searchLimit;
    }

    public int getSearchLimit() {
        return searchLimit;
    }
}
