package com.lifebutler.assistant.service;

import com.lifebutler.assistant.model.QueryContext;

/**
 * Turns a raw question into the structured context the router works from.
 */
public interface QueryPlanner {

    QueryContext plan(String query);
}
