package com.vidnyan.kpolicy.domain.engine;

import com.vidnyan.kpolicy.domain.check.CheckDefinition;
import com.vidnyan.kpolicy.domain.config.Configuration;
import com.vidnyan.kpolicy.domain.result.ResultRecord;
import com.vidnyan.kpolicy.domain.result.ResultSet;

/**
 * Turns a verdict into a result record.
 * Severity comes from the configuration, never from the definition.
 */
public class ResultAggregator {

    public ResultRecord record(Configuration configuration, CheckDefinition check, boolean passed) {
        return new ResultRecord(
                check.id(),
                configuration.severityOf(check.id()),
                check.category(),
                passed,
                passed ? check.successMessage() : check.failureMessage());
    }

    public void recordInto(ResultSet results, Configuration configuration, CheckDefinition check, boolean passed) {
        results.put(record(configuration, check, passed));
    }
}
